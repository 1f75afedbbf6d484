package tsubst.model.type;

import tsubst.model.subst.Substitution;

/**
 * A use of a nominal struct or enum, applied to the substitution that instantiates its
 * generic parameters.
 */
public class AdtType extends Type {
	private final String name;
	private final Substitution substitution;

	public AdtType(String name, Substitution substitution) {
		super(substitution.needsSubstitution());
		this.name = name;
		this.substitution = substitution;
	}

	public String getName() {
		return name;
	}

	public Substitution getSubstitution() {
		return substitution;
	}

	@Override
	public int hashCode() {
		return name.hashCode() * 31 + substitution.hashCode() * 7;
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof AdtType)) {
			return false;
		}
		AdtType other = (AdtType) obj;
		return name.equals(other.name) && substitution.equals(other.substitution);
	}

	@Override
	public <T, E extends Throwable> T accept(TypeVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
