package tsubst.model.type;

/**
 * Stands in for a type that could not be computed after an issue has been reported, so
 * that callers can keep going and report further issues.
 */
public class ErrorType extends Type {
	public ErrorType() {
		super(false);
	}

	@Override
	public int hashCode() {
		return 13;
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof ErrorType;
	}

	@Override
	public <T, E extends Throwable> T accept(TypeVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
