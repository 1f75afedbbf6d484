package tsubst.model.subst;

public abstract class RegionSubstitutionVisitor<T, E extends Throwable> {
	public abstract T visit(ErasedRegions erasedRegions) throws E;
	public abstract T visit(NonErasedRegions nonErasedRegions) throws E;
}
