package tsubst.model.subst;

import tsubst.model.fold.TypeFolder;
import tsubst.model.region.Region;

import java.util.List;

/**
 * What to do with early-bound regions during a substitution: erase them all to the
 * static region, or replace each with a concrete region by index.
 */
public abstract class RegionSubstitution {

	public static RegionSubstitution erased() {
		return ErasedRegions.getInstance();
	}

	public static RegionSubstitution nonErased(List<Region> regions) {
		return new NonErasedRegions(regions);
	}

	public abstract boolean isErased();

	abstract boolean needsSubstitution();

	abstract RegionSubstitution foldWith(TypeFolder folder);

	@Override
	public abstract int hashCode();

	@Override
	public abstract boolean equals(Object obj);

	public abstract <T, E extends Throwable> T accept(RegionSubstitutionVisitor<T, E> v) throws E;
}
