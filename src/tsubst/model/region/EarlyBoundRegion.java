package tsubst.model.region;

/**
 * A region parameter declared on a type, trait or impl, resolved at the same time as
 * the type parameters of that declaration.
 */
public class EarlyBoundRegion extends Region {
	private final int index;
	private final String name;

	public EarlyBoundRegion(int index, String name) {
		this.index = index;
		this.name = name;
	}

	public int getIndex() {
		return index;
	}

	public String getName() {
		return name;
	}

	@Override
	public boolean needsSubstitution() {
		return true;
	}

	@Override
	public int hashCode() {
		return index * 31 + name.hashCode() * 17 + 1;
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof EarlyBoundRegion)) {
			return false;
		}
		EarlyBoundRegion other = (EarlyBoundRegion) obj;
		return index == other.index && name.equals(other.name);
	}

	@Override
	public <T, E extends Throwable> T accept(RegionVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
