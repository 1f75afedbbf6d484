package tsubst.errors;

import tsubst.model.subst.MissingSelfTypeIssue;
import tsubst.model.subst.OuterTypeParameterIssue;

public abstract class IssueVisitor<T, E extends Throwable> {
	public abstract T visit(IssueWithContext issueWithContext) throws E;
	public abstract T visit(OuterTypeParameterIssue outerTypeParameterIssue) throws E;
	public abstract T visit(MissingSelfTypeIssue missingSelfTypeIssue) throws E;
}
