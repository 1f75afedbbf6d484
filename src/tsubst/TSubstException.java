package tsubst;

/**
 * A tsubst exception consisting of a prefix (kind of error) and a message.
 */
public abstract class TSubstException extends RuntimeException {
	public TSubstException(String prefix, String msg) {
		super(prefix + ": " + msg);
	}
}
