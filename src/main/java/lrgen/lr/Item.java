package lrgen.lr;

import java.io.Serializable;

import lrgen.grammar.NonTerminal;
import lrgen.grammar.Production;
import lrgen.grammar.Symbol;
import lrgen.grammar.Terminal;

/**
 * A production with a dot in its right hand side, the dot is before the position.th right hand side symbol.
 */
public class Item implements Serializable, Comparable<Item> {

	public final Production production;

	/**
	 * Number of right hand side symbols in front of the dot
	 */
	public final int position;

	public Item(Production production, int position) {
		if (position < 0 || position > production.rightSize()){
			throw new IllegalArgumentException(String.format("Invalid dot position %d for %s", position, production));
		}
		this.production = production;
		this.position = position;
	}

	/**
	 * Is the dot at the end of the production?
	 */
	public boolean isComplete(){
		return position == production.rightSize();
	}

	/**
	 * Symbol right after the dot or null if the item is complete
	 */
	public Symbol nextSymbol(){
		if (isComplete()){
			return null;
		}
		return production.right.get(position);
	}

	public boolean inFrontOfTerminal(){
		return nextSymbol() instanceof Terminal;
	}

	public boolean inFrontOfNonTerminal(){
		return nextSymbol() instanceof NonTerminal;
	}

	/**
	 * Item with the dot moved one symbol to the right
	 *
	 * @throws IllegalStateException if the item is already complete
	 */
	public Item advance(){
		if (isComplete()){
			throw new IllegalStateException("Can't advance item: Parser position already at end of production.");
		}
		return new Item(production, position + 1);
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Item)){
			return false;
		}
		Item other = (Item)obj;
		return other.production.id == production.id && other.position == position
				&& other.production.equals(production);
	}

	@Override
	public int hashCode() {
		return production.id * 31 + position;
	}

	@Override
	public int compareTo(Item o) {
		if (production.id != o.production.id){
			return Integer.compare(production.id, o.production.id);
		}
		return Integer.compare(position, o.position);
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		builder.append(production.left).append(" ::=");
		for (int i = 0; i < production.rightSize(); i++) {
			if (i == position){
				builder.append(" •");
			}
			builder.append(" ").append(production.right.get(i));
		}
		if (isComplete()){
			builder.append(" •");
		}
		return builder.toString();
	}
}
