package tsubst.model.type;

/**
 * Represents the fallback integer type.
 */
public class IntType extends Type {
	public IntType() {
		super(false);
	}

	@Override
	public int hashCode() {
		return 4;
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof IntType;
	}

	@Override
	public <T, E extends Throwable> T accept(TypeVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
