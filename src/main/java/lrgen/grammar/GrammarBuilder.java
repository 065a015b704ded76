package lrgen.grammar;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Allows the simple creation of grammars.
 *
 * In this class names of declared terminals are treated as terminals and all other names are treated as
 * non terminals. The empty string stands for ε.
 *
 * <pre>
 * Grammar grammar = new GrammarBuilder()
 *     .terminals("+", "id")
 *     .add("E", "E", "+", "T")
 *     .add("E", "T")
 *     .add("T", "id")
 *     .toGrammar("E");
 * </pre>
 */
public class GrammarBuilder {

	private final Map<String, Terminal> terminals = new LinkedHashMap<>();
	private final Map<String, NonTerminal> nonTerminals = new LinkedHashMap<>();
	private final List<String[]> productions = new ArrayList<>();

	/**
	 * Declares literal terminals (like <code>"+"</code>).
	 */
	public GrammarBuilder terminals(String... names){
		for (String name : names){
			terminals.put(name, new Terminal(name, true));
		}
		return this;
	}

	/**
	 * Declares terminals that stand for a class of tokens (like <code>?number?</code>).
	 */
	public GrammarBuilder tokenClasses(String... names){
		for (String name : names){
			terminals.put(name, new Terminal(name, false));
		}
		return this;
	}

	/**
	 * Adds a new production.
	 *
	 * The entries of the right hand side are
	 *  - names of declared terminals
	 *  - names of non terminals
	 *  - "": equivalent to ε
	 *
	 * @param left name of the defining non terminal on the left hand side of the production
	 * @param right right hand side of the production
	 */
	public GrammarBuilder add(String left, String... right){
		if (terminals.containsKey(left)){
			throw new MalformedGrammarException(left, "is the name of a terminal and therefore " +
					"can't be used as a non terminal name");
		}
		String[] prod = new String[right.length + 1];
		prod[0] = left;
		System.arraycopy(right, 0, prod, 1, right.length);
		productions.add(prod);
		return this;
	}

	private Symbol symbol(String name){
		if (terminals.containsKey(name)){
			return terminals.get(name);
		}
		return nonTerminals.computeIfAbsent(name, NonTerminal::new);
	}

	/**
	 * Creates the grammar.
	 *
	 * @param startNonTerminal name of the start non terminal
	 * @throws MalformedGrammarException if the grammar isn't well formed
	 */
	public Grammar toGrammar(String startNonTerminal){
		nonTerminals.clear();
		List<Production> prods = new ArrayList<>();
		for (String[] prod : productions){
			if (terminals.containsKey(prod[0])){
				throw new MalformedGrammarException(prod[0], "is the name of a terminal and therefore " +
						"can't be used as a non terminal name");
			}
			NonTerminal left = (NonTerminal)symbol(prod[0]);
			List<Symbol> right = new ArrayList<>();
			for (int i = 1; i < prod.length; i++){
				if (!prod[i].isEmpty()){
					right.add(symbol(prod[i]));
				}
			}
			prods.add(new Production(left, right));
		}
		if (terminals.containsKey(startNonTerminal)){
			throw new MalformedGrammarException(startNonTerminal, "the start symbol has to be a non terminal");
		}
		NonTerminal start = (NonTerminal)symbol(startNonTerminal);
		return new Grammar(terminals.values(), nonTerminals.values(), start, prods);
	}
}
