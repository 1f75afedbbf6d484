package tsubst.model.type;

import tsubst.Unreachable;
import tsubst.formatters.IndentingWriter;
import tsubst.formatters.TypeFormattingVisitor;
import tsubst.model.fold.TypeFolder;
import tsubst.model.subst.Substitutable;

import java.io.IOException;
import java.io.StringWriter;

/**
 * An immutable type node.
 *
 * Whether a type mentions a type parameter, the self type or an early-bound region
 * anywhere inside it is computed once, when the node is built, so that substitution can
 * skip parameter-free subtrees without walking them.
 */
public abstract class Type implements Substitutable<Type> {
	private final boolean needsSubstitution;

	/**
	 * @param needsSubstitution whether this node or any of its children refers to
	 *                          something a substitution table replaces
	 */
	protected Type(boolean needsSubstitution) {
		this.needsSubstitution = needsSubstitution;
	}

	public boolean needsSubstitution() {
		return needsSubstitution;
	}

	@Override
	public Type foldWith(TypeFolder folder) {
		return folder.foldType(this);
	}

	@Override
	public abstract int hashCode();

	@Override
	public abstract boolean equals(Object obj);

	@Override
	public String toString() {
		StringWriter writer = new StringWriter();
		try {
			this.accept(new TypeFormattingVisitor(new IndentingWriter(writer)));
		} catch (IOException e) {
			throw new Unreachable(e);
		}
		return writer.toString();
	}

	public abstract <T, E extends Throwable> T accept(TypeVisitor<T, E> v) throws E;

	static boolean anyNeedsSubstitution(Iterable<? extends Type> types) {
		for (Type t : types) {
			if (t.needsSubstitution()) {
				return true;
			}
		}
		return false;
	}
}
