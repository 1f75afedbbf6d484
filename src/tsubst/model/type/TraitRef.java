package tsubst.model.type;

import tsubst.Unreachable;
import tsubst.formatters.IndentingWriter;
import tsubst.formatters.TypeFormattingVisitor;
import tsubst.model.fold.TypeFolder;
import tsubst.model.subst.Substitutable;
import tsubst.model.subst.Substitution;

import java.io.IOException;
import java.io.StringWriter;

/**
 * A trait applied to a self type and type arguments, as in an impl header or a bound.
 */
public class TraitRef implements Substitutable<TraitRef> {
	private final String traitName;
	private final Substitution substitution;

	public TraitRef(String traitName, Substitution substitution) {
		this.traitName = traitName;
		this.substitution = substitution;
	}

	public String getTraitName() {
		return traitName;
	}

	public Substitution getSubstitution() {
		return substitution;
	}

	public boolean needsSubstitution() {
		return substitution.needsSubstitution();
	}

	@Override
	public TraitRef foldWith(TypeFolder folder) {
		Substitution folded = substitution.foldWith(folder);
		if (folded == substitution) {
			return this;
		}
		return new TraitRef(traitName, folded);
	}

	@Override
	public int hashCode() {
		return traitName.hashCode() * 41 + substitution.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof TraitRef)) {
			return false;
		}
		TraitRef other = (TraitRef) obj;
		return traitName.equals(other.traitName) && substitution.equals(other.substitution);
	}

	@Override
	public String toString() {
		StringWriter writer = new StringWriter();
		try {
			new TypeFormattingVisitor(new IndentingWriter(writer)).writeTraitRef(this);
		} catch (IOException e) {
			throw new Unreachable(e);
		}
		return writer.toString();
	}
}
