package tsubst.errors;

import tsubst.TSubstException;
import tsubst.Unreachable;
import tsubst.formatters.IndentingWriter;
import tsubst.formatters.IssueFormattingVisitor;

import java.io.IOException;
import java.io.StringWriter;

public abstract class Issue extends TSubstException {
	private static final String prefix = "Substitution Error";

	public Issue() {
		super(prefix, "");
	}

	@Override
	public String getMessage() {
		StringWriter sw = new StringWriter();
		IndentingWriter out = new IndentingWriter(sw);
		try {
			accept(new IssueFormattingVisitor(out));
		} catch (IOException e) {
			throw new Unreachable(e); // string ops don't throw IO exceptions
		}
		return sw.getBuffer().toString();
	}

	public Issue withContext(Context ctx) {
		return new IssueWithContext(this, ctx);
	}
	
	public abstract <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E;
	
}
