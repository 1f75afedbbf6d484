package tsubst.model.subst;

import tsubst.model.fold.TypeFoldables;
import tsubst.model.fold.TypeFolder;
import tsubst.model.region.Region;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Concrete replacements for early-bound regions, indexed by declaration order.
 */
public class NonErasedRegions extends RegionSubstitution {
	private final List<Region> regions;

	public NonErasedRegions(List<Region> regions) {
		this.regions = Collections.unmodifiableList(new ArrayList<>(regions));
	}

	public List<Region> getRegions() {
		return regions;
	}

	@Override
	public boolean isErased() {
		return false;
	}

	@Override
	boolean needsSubstitution() {
		for (Region r : regions) {
			if (r.needsSubstitution()) {
				return true;
			}
		}
		return false;
	}

	@Override
	RegionSubstitution foldWith(TypeFolder folder) {
		List<Region> folded = TypeFoldables.foldAll(regions, folder);
		if (folded == regions) {
			return this;
		}
		return new NonErasedRegions(folded);
	}

	@Override
	public int hashCode() {
		return regions.hashCode() * 17 + 2;
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof NonErasedRegions)) {
			return false;
		}
		return regions.equals(((NonErasedRegions) obj).regions);
	}

	@Override
	public String toString() {
		return "NonErasedRegions" + regions;
	}

	@Override
	public <T, E extends Throwable> T accept(RegionSubstitutionVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
