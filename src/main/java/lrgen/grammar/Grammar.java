package lrgen.grammar;

import java.io.Serializable;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static lrgen.util.Utils.LOG;
import static lrgen.util.Utils.join;

/**
 * Immutable grammar consisting of terminals, non terminals, productions and a start non terminal.
 *
 * The grammar is validated on construction and augmented with a start production <pre>S' → S</pre>
 * (assuming <pre>S</pre> is the start non terminal). The augmented production has the highest id,
 * the ids of the passed productions are their indices in the passed list (without duplicates).
 *
 * Use the GrammarBuilder to build a grammar conveniently.
 *
 * @see GrammarBuilder GrammarBuilder
 */
public class Grammar implements Serializable {

	private final Set<Terminal> terminals;

	private final Set<NonTerminal> nonTerminals;

	private final List<Production> productions;

	private final NonTerminal start;

	private final NonTerminal augmentedStart;

	private final Production augmentedStartProduction;

	/**
	 * All productions including the augmented start production, indexed by id
	 */
	private final List<Production> allProductions;

	private final Map<NonTerminal, List<Production>> productionsByLeft;

	private transient FirstFollowSets firstFollowSets;

	/**
	 * Create a new validated and augmented grammar.
	 *
	 * Exact duplicates in the passed productions are dropped.
	 *
	 * @param terminals terminals of the grammar (without the end of input marker)
	 * @param nonTerminals non terminals of the grammar
	 * @param start start non terminal
	 * @param productions productions of the grammar, their ids are ignored
	 * @throws MalformedGrammarException if the grammar isn't well formed
	 */
	public Grammar(Collection<Terminal> terminals, Collection<NonTerminal> nonTerminals, NonTerminal start,
	               List<Production> productions) {
		this.terminals = Collections.unmodifiableSet(new LinkedHashSet<>(terminals));
		this.nonTerminals = Collections.unmodifiableSet(new LinkedHashSet<>(nonTerminals));
		this.start = start;
		this.productions = Collections.unmodifiableList(numberProductions(productions));
		validate();
		this.augmentedStart = new NonTerminal(uniqueStartName());
		this.augmentedStartProduction = new Production(this.productions.size(), augmentedStart,
				Collections.singletonList(start));
		List<Production> all = new ArrayList<>(this.productions);
		all.add(augmentedStartProduction);
		this.allProductions = Collections.unmodifiableList(all);
		Map<NonTerminal, List<Production>> byLeft = new LinkedHashMap<>();
		for (Production production : allProductions){
			byLeft.computeIfAbsent(production.left, n -> new ArrayList<>()).add(production);
		}
		for (Map.Entry<NonTerminal, List<Production>> entry : byLeft.entrySet()){
			entry.setValue(Collections.unmodifiableList(entry.getValue()));
		}
		this.productionsByLeft = Collections.unmodifiableMap(byLeft);
	}

	private static List<Production> numberProductions(List<Production> productions){
		Set<Production> seen = new HashSet<>();
		List<Production> numbered = new ArrayList<>();
		for (Production production : productions){
			if (!seen.add(production)){
				LOG.warning(String.format("Dropping duplicate production %s", production));
				continue;
			}
			numbered.add(production.withId(numbered.size()));
		}
		return numbered;
	}

	private void validate(){
		if (start == null){
			throw new MalformedGrammarException("null", "no start non terminal given");
		}
		if (terminals.contains(Terminal.EOF)){
			throw new MalformedGrammarException(Terminal.EOF.name,
					"the end of input terminal is reserved and can't be declared");
		}
		Set<String> terminalNames = new HashSet<>();
		for (Terminal terminal : terminals){
			terminalNames.add(terminal.name);
		}
		for (NonTerminal nonTerminal : nonTerminals){
			if (terminalNames.contains(nonTerminal.name)){
				throw new MalformedGrammarException(nonTerminal.name,
						"used as the name of a terminal and of a non terminal");
			}
		}
		Set<NonTerminal> defined = new HashSet<>();
		for (Production production : productions){
			if (!nonTerminals.contains(production.left)){
				throw new MalformedGrammarException(production.left.name,
						"left hand side of " + production + " isn't a declared non terminal");
			}
			defined.add(production.left);
		}
		for (Production production : productions){
			for (Terminal terminal : production.terminals){
				if (!terminals.contains(terminal)){
					throw new MalformedGrammarException(terminal.name,
							"terminal used in " + production + " isn't declared");
				}
			}
			for (NonTerminal nonTerminal : production.nonTerminals){
				if (!defined.contains(nonTerminal)){
					throw new MalformedGrammarException(nonTerminal.name,
							"non terminal used in " + production + " has no productions");
				}
			}
		}
		if (!defined.contains(start)){
			throw new MalformedGrammarException(start.name, "start non terminal has no productions");
		}
	}

	private String uniqueStartName(){
		Set<String> names = new HashSet<>();
		for (NonTerminal nonTerminal : nonTerminals){
			names.add(nonTerminal.name);
		}
		for (Terminal terminal : terminals){
			names.add(terminal.name);
		}
		String startName = start.name + "'";
		while (names.contains(startName)) {
			startName += "'";
		}
		return startName;
	}

	/**
	 * Declared terminals, without the end of input marker
	 */
	public Set<Terminal> getTerminals(){
		return terminals;
	}

	/**
	 * Declared terminals followed by the end of input marker
	 */
	public List<Terminal> getTerminalsWithEOF(){
		List<Terminal> list = new ArrayList<>(terminals);
		list.add(Terminal.EOF);
		return list;
	}

	/**
	 * Declared non terminals, without the augmented start non terminal
	 */
	public Set<NonTerminal> getNonTerminals(){
		return nonTerminals;
	}

	public NonTerminal getStart(){
		return start;
	}

	public NonTerminal getAugmentedStart(){
		return augmentedStart;
	}

	public Production getAugmentedStartProduction(){
		return augmentedStartProduction;
	}

	/**
	 * Productions of the grammar without the augmented start production
	 */
	public List<Production> getProductions(){
		return productions;
	}

	/**
	 * Productions including the augmented start production, the index of each production is its id
	 */
	public List<Production> getAllProductions(){
		return allProductions;
	}

	public Production getProductionForId(int id){
		return allProductions.get(id);
	}

	/**
	 * Productions with the passed non terminal on their left hand side (in id order), the augmented start
	 * non terminal is supported too.
	 */
	public List<Production> getProductionsOf(NonTerminal nonTerminal){
		return productionsByLeft.getOrDefault(nonTerminal, Collections.emptyList());
	}

	/**
	 * Nullable, first and follow sets of this grammar, calculated on the first call.
	 */
	public FirstFollowSets getFirstFollowSets(){
		if (firstFollowSets == null){
			firstFollowSets = new FirstFollowSets(this);
		}
		return firstFollowSets;
	}

	/**
	 * Non terminals that can be reached from the start non terminal.
	 */
	public Set<NonTerminal> reachableNonTerminals(){
		Set<NonTerminal> reached = new LinkedHashSet<>();
		Deque<NonTerminal> depthFirstStack = new ArrayDeque<>();
		depthFirstStack.push(start);
		reached.add(start);
		while (!depthFirstStack.isEmpty()){
			NonTerminal t = depthFirstStack.pop();
			for (Production prod : getProductionsOf(t)){
				for (NonTerminal nonTerminal : prod.nonTerminals){
					if (reached.add(nonTerminal)){
						depthFirstStack.push(nonTerminal);
					}
				}
			}
		}
		return reached;
	}

	public String longDescription(){
		List<String> lines = new ArrayList<>();
		for (Production production : allProductions){
			lines.add(production.id + " " + production);
		}
		return "Start non terminal: " + start + "\n" +
				"NonTerminals: " + nonTerminals + "\n" +
				"Terminals: " + terminals + "\n" +
				"Productions: \n" + join(lines, "\n");
	}

	@Override
	public String toString() {
		return join(productions, "\n");
	}
}
