package lrgen.grammar;

/**
 * A terminal symbol.
 *
 * Literal terminals stand for the exact text of their name (like <code>"+"</code>), other terminals stand
 * for a whole class of tokens (like <code>?number?</code>).
 */
public class Terminal extends Symbol {

	/**
	 * End of input marker, implicitly part of every grammar
	 */
	public static final Terminal EOF = new Terminal("EOF", false);

	public final boolean isLiteral;

	public Terminal(String name, boolean isLiteral) {
		super(name);
		this.isLiteral = isLiteral;
	}

	public Terminal(String name) {
		this(name, true);
	}

	public boolean isEOF(){
		return equals(EOF);
	}

	@Override
	public String toString() {
		if (isLiteral){
			return "\"" + name.replace("\"", "\"\"") + "\"";
		}
		return "?" + name.replace("?", "??") + "?";
	}

	@Override
	public int hashCode() {
		return super.hashCode() + (isLiteral ? 1 : 0);
	}

	@Override
	public boolean equals(Object obj) {
		return super.equals(obj) && ((Terminal)obj).isLiteral == isLiteral;
	}
}
