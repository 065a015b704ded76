package lrgen.grammar;

/**
 * A non terminal symbol. Its productions are stored in the grammar.
 */
public class NonTerminal extends Symbol {

	public NonTerminal(String name) {
		super(name);
	}

	@Override
	public String toString() {
		return "<" + name.replace("\\", "\\\\").replace("<", "\\<").replace(">", "\\>") + ">";
	}
}
