package lrgen.grammar;

import lrgen.LRGenException;

/**
 * Thrown if a grammar isn't well formed, e.g. if it references an undefined non terminal.
 */
public class MalformedGrammarException extends LRGenException {

	/**
	 * Name of the symbol that caused the error
	 */
	public final String symbol;

	public MalformedGrammarException(String symbol, String message) {
		super(String.format("Malformed grammar (symbol %s): %s", symbol, message));
		this.symbol = symbol;
	}
}
