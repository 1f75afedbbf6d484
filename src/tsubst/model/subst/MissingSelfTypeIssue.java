package tsubst.model.subst;

import tsubst.errors.Issue;
import tsubst.errors.IssueVisitor;
import tsubst.model.type.Type;

public class MissingSelfTypeIssue extends Issue {
	private final Type root;

	/**
	 * @param root the outermost type being substituted, or null if unknown
	 */
	public MissingSelfTypeIssue(Type root) {
		this.root = root;
	}

	public Type getRoot() {
		return root;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
