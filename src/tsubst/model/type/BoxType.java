package tsubst.model.type;

/**
 * Represents an owned heap pointer.
 */
public class BoxType extends SimpleContainerType {
	public BoxType(Type elementType) {
		super(elementType);
	}

	@Override
	public int hashCode() {
		return super.hashCode() * 17 + 9;
	}

	@Override
	public boolean equals(Object p) {
		if (!(p instanceof BoxType)) {
			return false;
		}
		return super.equals(p);
	}

	@Override
	public <T, E extends Throwable> T accept(TypeVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
