package tsubst.model.fold;

import tsubst.model.region.Region;
import tsubst.model.type.Type;
import tsubst.model.type.TypeContext;

/**
 * A rewrite over types and regions, driven by {@link TypeFoldable#foldWith(TypeFolder)}.
 *
 * Subclasses override {@link #foldType(Type)} and {@link #foldRegion(Region)} for the
 * leaves they care about, and call {@link #superFoldType(Type)} to get the default
 * reconstruction of every other shape.
 */
public abstract class TypeFolder {

	public abstract TypeContext getContext();

	public Type foldType(Type type) {
		return superFoldType(type);
	}

	public Region foldRegion(Region region) {
		return region;
	}

	/**
	 * Rebuilds type from its folded children. Leaves are returned as-is.
	 */
	public final Type superFoldType(Type type) {
		return type.accept(new SuperFoldVisitor(this));
	}
}
