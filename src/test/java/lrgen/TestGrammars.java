package lrgen;

import lrgen.grammar.Grammar;
import lrgen.grammar.GrammarBuilder;

/**
 * Grammars shared by the tests.
 */
public class TestGrammars {

	/**
	 * S → E, E → E + T | T, T → id
	 */
	public static Grammar expression(){
		return new GrammarBuilder()
				.terminals("+")
				.tokenClasses("id")
				.add("S", "E")
				.add("E", "E", "+", "T")
				.add("E", "T")
				.add("T", "id")
				.toGrammar("S");
	}

	/**
	 * E → E * B | E + B | B, B → 0 | 1
	 */
	public static Grammar wikipedia(){
		return new GrammarBuilder()
				.terminals("0", "1", "+", "*")
				.add("E", "E", "*", "B")
				.add("E", "E", "+", "B")
				.add("E", "B")
				.add("B", "0")
				.add("B", "1")
				.toGrammar("E");
	}

	/**
	 * S → A, A → A a | ε
	 */
	public static Grammar leftRecursiveEpsilon(){
		return new GrammarBuilder()
				.terminals("a")
				.add("S", "A")
				.add("A", "A", "a")
				.add("A", "")
				.toGrammar("S");
	}

	/**
	 * E → E + E | id
	 */
	public static Grammar ambiguousSum(){
		return new GrammarBuilder()
				.terminals("+")
				.tokenClasses("id")
				.add("E", "E", "+", "E")
				.add("E", "id")
				.toGrammar("E");
	}

	/**
	 * S → A | B, A → x, B → x
	 */
	public static Grammar reduceReduce(){
		return new GrammarBuilder()
				.terminals("x")
				.add("S", "A")
				.add("S", "B")
				.add("A", "x")
				.add("B", "x")
				.toGrammar("S");
	}

	/**
	 * S → A B c, A → a | ε, B → b | ε
	 */
	public static Grammar optionals(){
		return new GrammarBuilder()
				.terminals("a", "b", "c")
				.add("S", "A", "B", "c")
				.add("A", "a")
				.add("A", "")
				.add("B", "b")
				.add("B", "")
				.toGrammar("S");
	}

	/**
	 * Statements with if-then-else and assignments, a slightly bigger grammar with nested recursion.
	 * <pre>
	 * P → L
	 * L → L ; St | St
	 * St → id = Ex | if Ex then St Tail | begin L end
	 * Tail → else St | fi
	 * Ex → Ex + Te | Te
	 * Te → Te * F | F
	 * F → ( Ex ) | id | num
	 * </pre>
	 */
	public static Grammar statements(){
		return new GrammarBuilder()
				.terminals(";", "=", "if", "then", "else", "fi", "begin", "end", "+", "*", "(", ")")
				.tokenClasses("id", "num")
				.add("P", "L")
				.add("L", "L", ";", "St")
				.add("L", "St")
				.add("St", "id", "=", "Ex")
				.add("St", "if", "Ex", "then", "St", "Tail")
				.add("St", "begin", "L", "end")
				.add("Tail", "else", "St")
				.add("Tail", "fi")
				.add("Ex", "Ex", "+", "Te")
				.add("Ex", "Te")
				.add("Te", "Te", "*", "F")
				.add("Te", "F")
				.add("F", "(", "Ex", ")")
				.add("F", "id")
				.add("F", "num")
				.toGrammar("P");
	}
}
