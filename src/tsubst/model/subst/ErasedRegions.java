package tsubst.model.subst;

import tsubst.model.fold.TypeFolder;

/**
 * Used once region checking is done: every early-bound region becomes the static region.
 */
public class ErasedRegions extends RegionSubstitution {
	private static final ErasedRegions instance = new ErasedRegions();

	private ErasedRegions() {}

	public static ErasedRegions getInstance() {
		return instance;
	}

	@Override
	public boolean isErased() {
		return true;
	}

	@Override
	boolean needsSubstitution() {
		return false;
	}

	@Override
	RegionSubstitution foldWith(TypeFolder folder) {
		return this;
	}

	@Override
	public int hashCode() {
		return 1;
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof ErasedRegions;
	}

	@Override
	public String toString() {
		return "ErasedRegions";
	}

	@Override
	public <T, E extends Throwable> T accept(RegionSubstitutionVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
