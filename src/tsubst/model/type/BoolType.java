package tsubst.model.type;

/**
 * Represents the boolean type.
 */
public class BoolType extends Type {
	public BoolType() {
		super(false);
	}

	@Override
	public int hashCode() {
		return 3;
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof BoolType;
	}

	@Override
	public <T, E extends Throwable> T accept(TypeVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
