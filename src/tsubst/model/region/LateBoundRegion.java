package tsubst.model.region;

/**
 * A region bound by a function signature. These are instantiated per call and never
 * touched by table substitution.
 */
public class LateBoundRegion extends Region {
	private final int binderId;
	private final String name;

	public LateBoundRegion(int binderId, String name) {
		this.binderId = binderId;
		this.name = name;
	}

	public int getBinderId() {
		return binderId;
	}

	public String getName() {
		return name;
	}

	@Override
	public int hashCode() {
		return binderId * 31 + name.hashCode() * 19 + 2;
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof LateBoundRegion)) {
			return false;
		}
		LateBoundRegion other = (LateBoundRegion) obj;
		return binderId == other.binderId && name.equals(other.name);
	}

	@Override
	public <T, E extends Throwable> T accept(RegionVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
