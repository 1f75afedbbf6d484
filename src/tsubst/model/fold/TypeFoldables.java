package tsubst.model.fold;

import tsubst.model.subst.Substitutable;
import tsubst.model.subst.Substitution;
import tsubst.model.subst.SubstitutionFolder;
import tsubst.model.type.TypeContext;
import tsubst.util.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class TypeFoldables {

	private TypeFoldables() {}

	/**
	 * Folds each element of items, returning items itself when no element changed.
	 */
	public static <T extends TypeFoldable<T>> List<T> foldAll(List<T> items, TypeFolder folder) {
		List<T> result = null;
		for (int i = 0; i < items.size(); i++) {
			T item = items.get(i);
			T folded = item.foldWith(folder);
			if (result == null && folded != item) {
				result = new ArrayList<>(items.subList(0, i));
			}
			if (result != null) {
				result.add(folded);
			}
		}
		if (result == null) {
			return items;
		}
		return Collections.unmodifiableList(result);
	}

	public static <T extends Substitutable<T>> List<T> substAll(List<T> items, TypeContext ctx,
	                                                            Substitution substitution) {
		return substAllAt(items, ctx, substitution, null);
	}

	public static <T extends Substitutable<T>> List<T> substAllAt(List<T> items, TypeContext ctx,
	                                                              Substitution substitution,
	                                                              SourceLocation location) {
		return foldAll(items, new SubstitutionFolder(ctx, substitution, location));
	}
}
