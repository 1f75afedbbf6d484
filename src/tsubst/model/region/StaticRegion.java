package tsubst.model.region;

/**
 * The region that outlives every other region. Region erasure maps every early-bound
 * region to this one.
 */
public class StaticRegion extends Region {
	private static final StaticRegion instance = new StaticRegion();

	private StaticRegion() {}

	public static StaticRegion getInstance() {
		return instance;
	}

	@Override
	public int hashCode() {
		return 5;
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof StaticRegion;
	}

	@Override
	public <T, E extends Throwable> T accept(RegionVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
