package tsubst.model.type;

/**
 * Contains overloaded methods for a container type with only one element type, for convenience.
 */
public abstract class SimpleContainerType extends Type {
	protected final Type elementType;

	public SimpleContainerType(Type elementType) {
		super(elementType.needsSubstitution());
		this.elementType = elementType;
	}

	public Type getElementType() {
		return elementType;
	}

	@Override
	public int hashCode() {
		return elementType.hashCode();
	}

	@Override
	public boolean equals(Object p) {
		if (!(p instanceof SimpleContainerType)) {
			return false;
		}
		return elementType.equals(((SimpleContainerType) p).elementType);
	}
}
