package lrgen.grammar;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static lrgen.util.Utils.LOG;

/**
 * Nullable non terminals, first(k=1) sets and follow(k=1) sets of a grammar.
 *
 * All sets are calculated over the augmented grammar by fixpoint iteration (repeated passes over all
 * productions until a pass doesn't change anything) and are immutable afterwards.
 */
public class FirstFollowSets {

	private final Grammar grammar;

	private final List<NonTerminal> nonTerminals;

	private final Set<NonTerminal> nullable;

	private final Map<NonTerminal, Set<Terminal>> firstSets;

	private final Map<NonTerminal, Set<Terminal>> followSets;

	private int nullablePasses;
	private int firstPasses;
	private int followPasses;

	public FirstFollowSets(Grammar grammar) {
		this.grammar = grammar;
		List<NonTerminal> nonTerminals = new ArrayList<>(grammar.getNonTerminals());
		nonTerminals.add(grammar.getAugmentedStart());
		this.nonTerminals = Collections.unmodifiableList(nonTerminals);
		this.nullable = Collections.unmodifiableSet(calculateNullable());
		this.firstSets = freeze(calculateFirst1Sets());
		this.followSets = freeze(calculateFollow1Sets());
		LOG.fine(String.format("Fixpoints reached after %d (nullable), %d (first) and %d (follow) passes",
				nullablePasses, firstPasses, followPasses));
	}

	/**
	 * A non terminal is nullable if it has an epsilon production or a production that consists only of
	 * nullable non terminals.
	 */
	private Set<NonTerminal> calculateNullable(){
		Set<NonTerminal> epsSet = new LinkedHashSet<>();
		boolean somethingChanged;
		do {
			somethingChanged = false;
			nullablePasses++;
			for (Production prod : grammar.getAllProductions()) {
				if (!epsSet.contains(prod.left) && prod.terminals.isEmpty() && epsSet.containsAll(prod.nonTerminals)){
					epsSet.add(prod.left);
					somethingChanged = true;
				}
			}
		} while (somethingChanged);
		return epsSet;
	}

	/**
	 * For each production X → Y_1 … Y_m add first(Y_i) to first(X) for every Y_i whose predecessors are all
	 * nullable, until no first set changes during a pass.
	 */
	private Map<NonTerminal, Set<Terminal>> calculateFirst1Sets(){
		Map<NonTerminal, Set<Terminal>> first = emptySets();
		boolean firstChanged;
		do {
			firstChanged = false;
			firstPasses++;
			for (Production production : grammar.getAllProductions()){
				Set<Terminal> set = first.get(production.left);
				for (Symbol symbol : production.right){
					if (symbol instanceof Terminal){
						firstChanged = set.add((Terminal)symbol) || firstChanged;
						break;
					}
					firstChanged = set.addAll(first.get(symbol)) || firstChanged;
					if (!nullable.contains(symbol)){
						break;
					}
				}
			}
		} while (firstChanged);
		return first;
	}

	/**
	 * First put EOF (the end of input marker) in follow(S) (S is the start symbol).
	 * If there is a production A → aBb (where a and b can be whole strings), then everything in first(b) is
	 * placed in follow(B). If there is a production A → aBb where b is nullable, then everything in follow(A)
	 * is in follow(B). Repeat until no follow set changes during a pass.
	 */
	private Map<NonTerminal, Set<Terminal>> calculateFollow1Sets(){
		Map<NonTerminal, Set<Terminal>> follow = emptySets();
		follow.get(grammar.getStart()).add(Terminal.EOF);
		follow.get(grammar.getAugmentedStart()).add(Terminal.EOF);
		boolean followChanged;
		do {
			followChanged = false;
			followPasses++;
			for (Production production : grammar.getAllProductions()){
				// terminals that can follow the current position, going from right to left
				Set<Terminal> lastFollow = new LinkedHashSet<>(follow.get(production.left));
				for (int i = production.right.size() - 1; i >= 0; i--){
					Symbol symbol = production.right.get(i);
					if (symbol instanceof NonTerminal){
						followChanged = follow.get(symbol).addAll(lastFollow) || followChanged;
						if (!nullable.contains(symbol)){
							lastFollow.clear();
						}
						lastFollow.addAll(firstSets.get(symbol));
					} else {
						lastFollow.clear();
						lastFollow.add((Terminal)symbol);
					}
				}
			}
		} while (followChanged);
		return follow;
	}

	private Map<NonTerminal, Set<Terminal>> emptySets(){
		Map<NonTerminal, Set<Terminal>> sets = new LinkedHashMap<>();
		for (NonTerminal nonTerminal : nonTerminals){
			sets.put(nonTerminal, new LinkedHashSet<>());
		}
		return sets;
	}

	private static Map<NonTerminal, Set<Terminal>> freeze(Map<NonTerminal, Set<Terminal>> sets){
		Map<NonTerminal, Set<Terminal>> frozen = new LinkedHashMap<>();
		for (Map.Entry<NonTerminal, Set<Terminal>> entry : sets.entrySet()){
			frozen.put(entry.getKey(), Collections.unmodifiableSet(entry.getValue()));
		}
		return Collections.unmodifiableMap(frozen);
	}

	public Set<NonTerminal> getNullable(){
		return nullable;
	}

	public boolean isNullable(Symbol symbol){
		return nullable.contains(symbol);
	}

	/**
	 * Does the passed sequence of symbols derive epsilon? True for the empty sequence.
	 */
	public boolean isNullable(List<Symbol> term){
		for (Symbol symbol : term){
			if (!nullable.contains(symbol)){
				return false;
			}
		}
		return true;
	}

	public Map<NonTerminal, Set<Terminal>> getFirstSets(){
		return firstSets;
	}

	/**
	 * First set of a symbol, <pre>{t}</pre> for a terminal t. Epsilon isn't part of the set, use
	 * {@link #isNullable(Symbol)} instead.
	 */
	public Set<Terminal> first(Symbol symbol){
		if (symbol instanceof Terminal){
			return Collections.singleton((Terminal)symbol);
		}
		Set<Terminal> set = firstSets.get(symbol);
		if (set == null){
			throw new IllegalArgumentException("Unknown non terminal " + symbol);
		}
		return set;
	}

	/**
	 * First set of a sequence of symbols (without epsilon).
	 */
	public Set<Terminal> first(List<Symbol> term){
		Set<Terminal> set = new LinkedHashSet<>();
		for (Symbol symbol : term){
			set.addAll(first(symbol));
			if (!isNullable(symbol)){
				break;
			}
		}
		return set;
	}

	public Map<NonTerminal, Set<Terminal>> getFollowSets(){
		return followSets;
	}

	public Set<Terminal> follow(NonTerminal nonTerminal){
		Set<Terminal> set = followSets.get(nonTerminal);
		if (set == null){
			throw new IllegalArgumentException("Unknown non terminal " + nonTerminal);
		}
		return set;
	}

	/**
	 * Number of passes the nullable fixpoint iteration needed, including the last pass without changes
	 */
	public int getNullablePasses(){
		return nullablePasses;
	}

	public int getFirstPasses(){
		return firstPasses;
	}

	public int getFollowPasses(){
		return followPasses;
	}
}
