package tsubst.model.subst;

import tsubst.model.fold.TypeFoldable;
import tsubst.model.type.TypeContext;
import tsubst.util.SourceLocation;

/**
 * Call {@code foo.subst(ctx, substitution)} to substitute across foo, or
 * {@code foo.substAt(ctx, substitution, location)} when a location is available for
 * better error reporting.
 *
 * @param <T> the kind of entity substituted, normally the implementing class itself
 */
public interface Substitutable<T> extends TypeFoldable<T> {

	default T subst(TypeContext ctx, Substitution substitution) {
		return substAt(ctx, substitution, null);
	}

	/**
	 * @param location where the substitution was requested, or null if unknown
	 */
	default T substAt(TypeContext ctx, Substitution substitution, SourceLocation location) {
		return foldWith(new SubstitutionFolder(ctx, substitution, location));
	}
}
