package tsubst.model.type;

import tsubst.model.region.Region;

/**
 * A value of some type implementing a trait, known only through that trait, and valid
 * for the given region.
 */
public class TraitObjectType extends Type {
	private final TraitRef traitRef;
	private final Region bound;

	public TraitObjectType(TraitRef traitRef, Region bound) {
		super(traitRef.needsSubstitution() || bound.needsSubstitution());
		this.traitRef = traitRef;
		this.bound = bound;
	}

	public TraitRef getTraitRef() {
		return traitRef;
	}

	public Region getBound() {
		return bound;
	}

	@Override
	public int hashCode() {
		return traitRef.hashCode() * 37 + bound.hashCode() * 3;
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof TraitObjectType)) {
			return false;
		}
		TraitObjectType other = (TraitObjectType) obj;
		return traitRef.equals(other.traitRef) && bound.equals(other.bound);
	}

	@Override
	public <T, E extends Throwable> T accept(TypeVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
