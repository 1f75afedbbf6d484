package tsubst.model.fold;

/**
 * Anything that contains types or regions and can be rebuilt from rewritten copies of them.
 *
 * @param <T> the kind of entity produced by folding, normally the implementing class itself
 */
public interface TypeFoldable<T> {
	T foldWith(TypeFolder folder);
}
