package lrgen.grammar;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import lrgen.TestGrammars;

import static org.junit.jupiter.api.Assertions.*;

public class GrammarTest {

	@Nested
	public class Symbols {

		@Test
		public void testLiteralTerminal(){
			assertEquals("\"A \"\"test\"\" literal\"", new Terminal("A \"test\" literal").toString());
			assertEquals("class", new Terminal("class").name);
		}

		@Test
		public void testTokenClassTerminal(){
			assertEquals("?weird???", new Terminal("weird?", false).toString());
		}

		@Test
		public void testNonTerminal(){
			assertEquals("<expr>", new NonTerminal("expr").toString());
			assertEquals("<a\\<b>", new NonTerminal("a<b").toString());
		}

		@Test
		public void testEquality(){
			assertEquals(new Terminal("+"), new Terminal("+"));
			assertNotEquals(new Terminal("+"), new Terminal("+", false));
			assertNotEquals(new Terminal("E"), new NonTerminal("E"));
			assertEquals(new NonTerminal("E").hashCode(), new NonTerminal("E").hashCode());
		}

		@Test
		public void testLiteralAndTokenClassAreDistinctInSets(){
			Set<Symbol> symbols = new HashSet<>(Arrays.asList(new Terminal("x"), new Terminal("x", false),
					new NonTerminal("x"), new Terminal("x")));
			assertEquals(3, symbols.size());
		}

		@Test
		public void testEmptyName(){
			assertThrows(IllegalArgumentException.class, () -> new NonTerminal(""));
		}
	}

	@Nested
	public class Productions {

		private final NonTerminal expr = new NonTerminal("expr");
		private final Terminal number = new Terminal("number", false);
		private final Terminal plus = new Terminal("+");
		private final Production production = new Production(expr, number, plus, expr);

		@Test
		public void testToString(){
			assertEquals("<expr> ::= ?number? \"+\" <expr>", production.toString());
			assertEquals("<expr> ::= ε", new Production(expr).toString());
		}

		@Test
		public void testSymbolLists(){
			assertEquals(Arrays.asList(number, plus, expr), production.right);
			assertEquals(Collections.singletonList(expr), production.nonTerminals);
			assertEquals(Arrays.asList(number, plus), production.terminals);
			assertEquals(3, production.rightSize());
			assertFalse(production.isEpsilonProduction());
		}

		@Test
		public void testEqualityIgnoresId(){
			Production same = new Production(expr, number, plus, expr).withId(5);
			assertEquals(production, same);
			assertEquals(production.hashCode(), same.hashCode());
			assertNotEquals(production, new Production(expr, number, plus, number));
		}
	}

	@Nested
	public class Construction {

		@Test
		public void testProductionIds(){
			Grammar grammar = TestGrammars.expression();
			List<Production> productions = grammar.getAllProductions();
			assertEquals(5, productions.size());
			for (int i = 0; i < productions.size(); i++){
				assertEquals(i, productions.get(i).id);
				assertSame(productions.get(i), grammar.getProductionForId(i));
			}
			assertEquals(4, grammar.getProductions().size());
		}

		@Test
		public void testAugmentation(){
			Grammar grammar = TestGrammars.expression();
			Production augmented = grammar.getAugmentedStartProduction();
			assertEquals("S'", grammar.getAugmentedStart().name);
			assertEquals(Collections.singletonList(grammar.getStart()), augmented.right);
			assertEquals(4, augmented.id);
			assertFalse(grammar.getNonTerminals().contains(grammar.getAugmentedStart()));
			assertEquals(Collections.singletonList(augmented), grammar.getProductionsOf(grammar.getAugmentedStart()));
		}

		@Test
		public void testAugmentedNameIsUnique(){
			Grammar grammar = new GrammarBuilder()
					.terminals("x")
					.add("S", "S'")
					.add("S'", "x")
					.toGrammar("S");
			assertEquals("S''", grammar.getAugmentedStart().name);
		}

		@Test
		public void testProductionsOf(){
			Grammar grammar = TestGrammars.wikipedia();
			NonTerminal e = new NonTerminal("E");
			assertEquals(Arrays.asList(0, 1, 2), ids(grammar.getProductionsOf(e)));
			assertEquals(Arrays.asList(3, 4), ids(grammar.getProductionsOf(new NonTerminal("B"))));
			assertTrue(grammar.getProductionsOf(new NonTerminal("unknown")).isEmpty());
		}

		@Test
		public void testDuplicatesAreDropped(){
			Grammar grammar = new GrammarBuilder()
					.terminals("x")
					.add("S", "x")
					.add("S", "x")
					.add("S", "S", "x")
					.toGrammar("S");
			assertEquals(2, grammar.getProductions().size());
			assertEquals(1, grammar.getProductions().get(1).id);
		}

		@Test
		public void testTerminalsWithEOF(){
			Grammar grammar = TestGrammars.expression();
			List<Terminal> terminals = grammar.getTerminalsWithEOF();
			assertEquals(3, terminals.size());
			assertEquals(Terminal.EOF, terminals.get(2));
			assertFalse(grammar.getTerminals().contains(Terminal.EOF));
		}

		@Test
		public void testReachableNonTerminals(){
			Grammar grammar = new GrammarBuilder()
					.terminals("x")
					.add("S", "A")
					.add("A", "x")
					.add("U", "A", "x")
					.toGrammar("S");
			assertEquals(2, grammar.reachableNonTerminals().size());
			assertFalse(grammar.reachableNonTerminals().contains(new NonTerminal("U")));
		}

		@Test
		public void testLongDescription(){
			String description = TestGrammars.expression().longDescription();
			assertTrue(description.startsWith("Start non terminal: <S>"));
			assertTrue(description.contains("4 <S'> ::= <S>"));
		}
	}

	@Nested
	public class Validation {

		@Test
		public void testUndefinedNonTerminal(){
			MalformedGrammarException ex = assertThrows(MalformedGrammarException.class, () ->
					new GrammarBuilder()
							.terminals("b")
							.add("S", "A", "b")
							.add("A", "C")
							.toGrammar("S"));
			assertEquals("C", ex.symbol);
			assertTrue(ex.getMessage().contains("C"));
		}

		@Test
		public void testUndefinedStart(){
			MalformedGrammarException ex = assertThrows(MalformedGrammarException.class, () ->
					new GrammarBuilder()
							.terminals("b")
							.add("S", "b")
							.toGrammar("Start"));
			assertEquals("Start", ex.symbol);
		}

		@Test
		public void testTerminalAsLeftHandSide(){
			assertThrows(MalformedGrammarException.class, () ->
					new GrammarBuilder().terminals("b").add("b", "b"));
		}

		@Test
		public void testTerminalAsStart(){
			MalformedGrammarException ex = assertThrows(MalformedGrammarException.class, () ->
					new GrammarBuilder().terminals("b").add("S", "b").toGrammar("b"));
			assertEquals("b", ex.symbol);
		}

		@Test
		public void testUndeclaredTerminal(){
			NonTerminal s = new NonTerminal("S");
			Terminal b = new Terminal("b");
			MalformedGrammarException ex = assertThrows(MalformedGrammarException.class, () ->
					new Grammar(Collections.<Terminal>emptyList(), Collections.singletonList(s), s,
							Collections.singletonList(new Production(s, b))));
			assertEquals("b", ex.symbol);
		}

		@Test
		public void testUndeclaredLeftHandSide(){
			NonTerminal s = new NonTerminal("S");
			NonTerminal a = new NonTerminal("A");
			Terminal b = new Terminal("b");
			MalformedGrammarException ex = assertThrows(MalformedGrammarException.class, () ->
					new Grammar(Collections.singletonList(b), Collections.singletonList(s), s,
							Arrays.asList(new Production(s, a), new Production(a, b))));
			assertEquals("A", ex.symbol);
		}

		@Test
		public void testNameClash(){
			NonTerminal s = new NonTerminal("S");
			NonTerminal x = new NonTerminal("x");
			Terminal xTerminal = new Terminal("x");
			MalformedGrammarException ex = assertThrows(MalformedGrammarException.class, () ->
					new Grammar(Collections.singletonList(xTerminal), Arrays.asList(s, x), s,
							Collections.singletonList(new Production(s, xTerminal))));
			assertEquals("x", ex.symbol);
		}

		@Test
		public void testReservedEOF(){
			NonTerminal s = new NonTerminal("S");
			assertThrows(MalformedGrammarException.class, () ->
					new Grammar(Collections.singletonList(Terminal.EOF), Collections.singletonList(s), s,
							Collections.singletonList(new Production(s, Terminal.EOF))));
		}
	}

	private static List<Integer> ids(List<Production> productions){
		Integer[] ids = new Integer[productions.size()];
		for (int i = 0; i < ids.length; i++){
			ids[i] = productions.get(i).id;
		}
		return Arrays.asList(ids);
	}
}
