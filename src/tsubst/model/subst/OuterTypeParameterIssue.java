package tsubst.model.subst;

import tsubst.errors.Issue;
import tsubst.errors.IssueVisitor;
import tsubst.model.type.ParamType;
import tsubst.model.type.Type;

/**
 * A type parameter was substituted with a table that does not cover its index. This is
 * usually a parameter of an enclosing generic item used where it is not in scope.
 */
public class OuterTypeParameterIssue extends Issue {
	private final ParamType param;
	private final Type root;

	/**
	 * @param root the outermost type being substituted, or null if unknown
	 */
	public OuterTypeParameterIssue(ParamType param, Type root) {
		this.param = param;
		this.root = root;
	}

	public ParamType getParam() {
		return param;
	}

	public Type getRoot() {
		return root;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
