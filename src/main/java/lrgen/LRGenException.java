package lrgen;

/**
 * Base class of all exceptions thrown by the generator.
 */
public class LRGenException extends RuntimeException {

	public LRGenException(String message) {
		super(message);
	}
}
