package lrgen.grammar;

import java.io.Serializable;

/**
 * Base class for terminal symbols and non terminal symbols.
 *
 * Symbols are values: two symbols are equal if they are of the same kind and have the same name.
 */
public abstract class Symbol implements Serializable {

	/**
	 * Name of the symbol
	 */
	public final String name;

	protected Symbol(String name) {
		if (name == null || name.isEmpty()){
			throw new IllegalArgumentException("A symbol needs a non empty name");
		}
		this.name = name;
	}

	public boolean isTerminal(){
		return this instanceof Terminal;
	}

	public boolean isNonTerminal(){
		return this instanceof NonTerminal;
	}

	@Override
	public int hashCode() {
		return name.hashCode() * 31 + getClass().hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		return obj != null && obj.getClass() == getClass() && ((Symbol)obj).name.equals(name);
	}
}
