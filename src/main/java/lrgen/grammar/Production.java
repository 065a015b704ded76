package lrgen.grammar;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A grammar production with a left and a right hand side.
 *
 * Two productions are equal if their left and right hand sides are equal, the id isn't taken into account.
 */
public class Production implements Serializable {

	/**
	 * Id of the production, it's index in the grammar, or -1 if the production isn't part of a grammar yet
	 */
	public final int id;
	/**
	 * Left hand side of the production (the associated non terminal)
	 */
	public final NonTerminal left;
	/**
	 * Right hand side of the production, empty for epsilon productions
	 */
	public final List<Symbol> right;

	/**
	 * Non terminals used in the right hand side
	 */
	public final List<NonTerminal> nonTerminals;

	/**
	 * Terminals used in the right hand side
	 */
	public final List<Terminal> terminals;

	public Production(int id, NonTerminal left, List<Symbol> right) {
		this.id = id;
		this.left = Objects.requireNonNull(left);
		List<NonTerminal> nonTerminals = new ArrayList<>();
		List<Terminal> terminals = new ArrayList<>();
		for (Symbol symbol : right) {
			if (symbol instanceof NonTerminal){
				nonTerminals.add((NonTerminal)symbol);
			} else if (symbol instanceof Terminal){
				terminals.add((Terminal)symbol);
			} else {
				throw new IllegalArgumentException("Unsupported symbol " + symbol + " in production of " + left);
			}
		}
		this.right = Collections.unmodifiableList(new ArrayList<>(right));
		this.nonTerminals = Collections.unmodifiableList(nonTerminals);
		this.terminals = Collections.unmodifiableList(terminals);
	}

	public Production(NonTerminal left, List<Symbol> right) {
		this(-1, left, right);
	}

	public Production(NonTerminal left, Symbol... right) {
		this(-1, left, Arrays.asList(right));
	}

	/**
	 * Copy of this production with the passed id
	 */
	public Production withId(int id){
		return new Production(id, left, right);
	}

	public String formatRightSide(){
		if (right.isEmpty()){
			return "ε";
		}
		StringBuilder builder = new StringBuilder();
		for (int i = 0; i < right.size(); i++) {
			builder.append(right.get(i));
			if (i < right.size() - 1) {
				builder.append(" ");
			}
		}
		return builder.toString();
	}

	@Override
	public String toString() {
		return left + " ::= " + formatRightSide();
	}

	/**
	 * Does this production have an empty right hand side?
	 */
	public boolean isEpsilonProduction(){
		return right.isEmpty();
	}

	/**
	 * Size of the right hand side.
	 */
	public int rightSize(){
		return right.size();
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Production)){
			return false;
		}
		Production other = (Production)obj;
		return left.equals(other.left) && right.equals(other.right);
	}

	@Override
	public int hashCode() {
		return Objects.hash(left, right);
	}
}
