package tsubst.model.type;

import tsubst.model.region.Region;

/**
 * Represents a borrowed reference, valid for some region.
 */
public class ReferenceType extends Type {
	private final Region region;
	private final boolean mutable;
	private final Type referentType;

	public ReferenceType(Region region, boolean mutable, Type referentType) {
		super(region.needsSubstitution() || referentType.needsSubstitution());
		this.region = region;
		this.mutable = mutable;
		this.referentType = referentType;
	}

	public Region getRegion() {
		return region;
	}

	public boolean isMutable() {
		return mutable;
	}

	public Type getReferentType() {
		return referentType;
	}

	@Override
	public int hashCode() {
		return region.hashCode() * 23 + referentType.hashCode() * 29 + (mutable ? 1 : 0);
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof ReferenceType)) {
			return false;
		}
		ReferenceType other = (ReferenceType) obj;
		return mutable == other.mutable && region.equals(other.region) && referentType.equals(other.referentType);
	}

	@Override
	public <T, E extends Throwable> T accept(TypeVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
