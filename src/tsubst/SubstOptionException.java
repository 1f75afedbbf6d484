package tsubst;

public class SubstOptionException extends Exception {
	private static final long serialVersionUID = 4217783412946517602L;

	public SubstOptionException(String msg) {
		super(msg);
	}

	public SubstOptionException(String msg, Throwable cause) {
		super(msg, cause);
	}
}
