package tsubst.model.type;

/**
 * Represents the string type.
 */
public class StringType extends Type {
	public StringType() {
		super(false);
	}

	@Override
	public int hashCode() {
		return 6;
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof StringType;
	}

	@Override
	public <T, E extends Throwable> T accept(TypeVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
