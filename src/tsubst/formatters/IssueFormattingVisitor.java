package tsubst.formatters;

import tsubst.errors.IssueVisitor;
import tsubst.errors.IssueWithContext;
import tsubst.model.subst.MissingSelfTypeIssue;
import tsubst.model.subst.OuterTypeParameterIssue;
import tsubst.model.type.Type;

import java.io.IOException;

public class IssueFormattingVisitor extends IssueVisitor<Void, IOException> {
	private final IndentingWriter out;

	public IssueFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	private void writeRoot(Type root) throws IOException {
		if (root == null) {
			return;
		}
		out.write(" in the substitution of `");
		root.accept(new TypeFormattingVisitor(out));
		out.write("`");
	}

	@Override
	public Void visit(IssueWithContext issueWithContext) throws IOException {
		issueWithContext.getContext().accept(new ContextFormattingVisitor(out));
		try (IndentingWriter.Indent ignored = out.indent()) {
			out.newLine();
			issueWithContext.getIssue().accept(this);
		}
		return null;
	}

	@Override
	public Void visit(OuterTypeParameterIssue outerTypeParameterIssue) throws IOException {
		out.write("can't use type parameters from outer function");
		writeRoot(outerTypeParameterIssue.getRoot());
		out.write("; try using a local type parameter instead");
		return null;
	}

	@Override
	public Void visit(MissingSelfTypeIssue missingSelfTypeIssue) throws IOException {
		out.write("missing `Self` type param");
		writeRoot(missingSelfTypeIssue.getRoot());
		return null;
	}
}
