package tsubst.model.type;

/**
 * The implicit receiver type of a trait. There is only ever one self slot in scope.
 */
public class SelfType extends Type {
	public SelfType() {
		super(true);
	}

	@Override
	public int hashCode() {
		return 11;
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof SelfType;
	}

	@Override
	public <T, E extends Throwable> T accept(TypeVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
