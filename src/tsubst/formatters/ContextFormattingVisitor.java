package tsubst.formatters;

import tsubst.errors.ContextVisitor;
import tsubst.model.type.AtSourceLocation;

import java.io.IOException;

public class ContextFormattingVisitor extends ContextVisitor<Void, IOException> {

	private final IndentingWriter out;

	public ContextFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(AtSourceLocation atSourceLocation) throws IOException {
		atSourceLocation.getLocation().writePretty(out);
		return null;
	}

}
