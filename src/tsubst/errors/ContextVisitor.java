package tsubst.errors;

import tsubst.model.type.AtSourceLocation;

public abstract class ContextVisitor<T, E extends Throwable> {

	public abstract T visit(AtSourceLocation atSourceLocation) throws E;

}
