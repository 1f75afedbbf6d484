package tsubst.model.region;

/**
 * A concrete region scoped to some body of code.
 */
public class FreeRegion extends Region {
	private final int scopeId;
	private final String name;

	public FreeRegion(int scopeId, String name) {
		this.scopeId = scopeId;
		this.name = name;
	}

	public int getScopeId() {
		return scopeId;
	}

	public String getName() {
		return name;
	}

	@Override
	public int hashCode() {
		return scopeId * 31 + name.hashCode() * 23 + 3;
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof FreeRegion)) {
			return false;
		}
		FreeRegion other = (FreeRegion) obj;
		return scopeId == other.scopeId && name.equals(other.name);
	}

	@Override
	public <T, E extends Throwable> T accept(RegionVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
