package tsubst.model.region;

public abstract class RegionVisitor<T, E extends Throwable> {
	public abstract T visit(StaticRegion staticRegion) throws E;
	public abstract T visit(EarlyBoundRegion earlyBoundRegion) throws E;
	public abstract T visit(LateBoundRegion lateBoundRegion) throws E;
	public abstract T visit(FreeRegion freeRegion) throws E;
}
