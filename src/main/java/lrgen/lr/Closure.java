package lrgen.lr;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import lrgen.grammar.Grammar;
import lrgen.grammar.NonTerminal;
import lrgen.grammar.Production;
import lrgen.grammar.Symbol;

/**
 * Closure and goto functions on item sets of a grammar.
 */
public class Closure {

	public final Grammar grammar;

	public Closure(Grammar grammar) {
		this.grammar = grammar;
	}

	/**
	 * Closure of the passed item set: for every item with the dot in front of a non terminal N add the items
	 * <pre>N → • …</pre> for all productions of N, until nothing changes.
	 *
	 * @return closed item set, the empty set for an empty item set
	 */
	public ItemSet closure(ItemSet itemSet){
		List<Item> items = new ArrayList<>(itemSet.getItems());
		Set<Item> contained = new HashSet<>(items);
		int doneTill = 0;  // first index that isn't done yet
		while (doneTill < items.size()){
			Item item = items.get(doneTill++);
			if (item.inFrontOfNonTerminal()){
				for (Production prod : grammar.getProductionsOf((NonTerminal)item.nextSymbol())){
					Item newItem = new Item(prod, 0);
					if (contained.add(newItem)){
						items.add(newItem);
					}
				}
			}
		}
		return new ItemSet(items);
	}

	/**
	 * Items of the passed set that have the passed symbol after the dot, with the dot moved over the symbol.
	 * The result isn't closed.
	 *
	 * @return item set, empty if there's no transition for the symbol
	 */
	public ItemSet gotoSet(ItemSet itemSet, Symbol symbol){
		List<Item> advanced = new ArrayList<>();
		for (Item item : itemSet){
			if (symbol.equals(item.nextSymbol())){
				advanced.add(item.advance());
			}
		}
		return new ItemSet(advanced);
	}

	/**
	 * Closure of the goto set.
	 */
	public ItemSet closedGotoSet(ItemSet itemSet, Symbol symbol){
		return closure(gotoSet(itemSet, symbol));
	}

	/**
	 * Symbols that appear after a dot in the passed item set, in the order of the items.
	 */
	public List<Symbol> transitionSymbols(ItemSet itemSet){
		Set<Symbol> symbols = new LinkedHashSet<>();
		for (Item item : itemSet){
			if (!item.isComplete()){
				symbols.add(item.nextSymbol());
			}
		}
		return new ArrayList<>(symbols);
	}
}
