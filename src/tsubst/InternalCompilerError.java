package tsubst;

public class InternalCompilerError extends RuntimeException {
	public InternalCompilerError(String reason) {
		super("internal compiler error: " + reason);
	}
}
