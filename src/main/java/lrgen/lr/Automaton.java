package lrgen.lr;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import lrgen.grammar.Grammar;
import lrgen.grammar.Symbol;
import lrgen.util.Utils;

import static lrgen.util.Utils.LOG;

/**
 * The LR(0) automaton of a grammar: the canonical collection of item sets with their transitions.
 *
 * States are referenced by their ids (indices into the state list), the start state has the id 0.
 */
public class Automaton {

	public final Grammar grammar;

	private final List<State> states;

	private Automaton(Grammar grammar, List<State> states) {
		this.grammar = grammar;
		this.states = Collections.unmodifiableList(states);
	}

	/**
	 * Builds the automaton, starting with the closure of the augmented start item. Every goto set is closed
	 * and either mapped to an already existing state with the same items or added as a new state.
	 */
	public static Automaton createFromGrammar(Grammar grammar){
		Closure closure = new Closure(grammar);
		List<State> states = new ArrayList<>();
		Map<ItemSet, Integer> stateIds = new HashMap<>();
		ItemSet startItems = closure.closure(ItemSet.of(new Item(grammar.getAugmentedStartProduction(), 0)));
		State startState = new State(0, startItems);
		states.add(startState);
		stateIds.put(startItems, 0);
		Deque<State> worklist = new ArrayDeque<>();
		worklist.add(startState);
		while (!worklist.isEmpty()){
			State currentState = worklist.poll();
			for (Symbol symbol : closure.transitionSymbols(currentState.items)){
				ItemSet created = closure.closedGotoSet(currentState.items, symbol);
				if (created.isEmpty()){
					continue;
				}
				Integer target = stateIds.get(created);
				if (target == null){
					State newState = new State(states.size(), created);
					target = newState.id;
					states.add(newState);
					stateIds.put(created, target);
					worklist.add(newState);
				}
				currentState.addTransition(symbol, target);
			}
		}
		LOG.fine(String.format("Created automaton with %d states for %d productions", states.size(),
				grammar.getAllProductions().size()));
		return new Automaton(grammar, states);
	}

	public List<State> getStates(){
		return states;
	}

	public State getState(int id){
		return states.get(id);
	}

	public State getStartState(){
		return states.get(0);
	}

	public int size(){
		return states.size();
	}

	/**
	 * @return id of the target state or -1 if there is no such transition
	 */
	public int transition(int state, Symbol symbol){
		return states.get(state).transition(symbol);
	}

	/**
	 * Ids of the states reachable from the start state (breadth first order)
	 */
	public List<Integer> reachableStates(){
		List<Integer> reached = new ArrayList<>();
		BitSet visited = new BitSet(states.size());
		Deque<Integer> queue = new ArrayDeque<>();
		queue.add(0);
		visited.set(0);
		while (!queue.isEmpty()){
			int current = queue.poll();
			reached.add(current);
			for (int target : states.get(current).getTransitions().values()){
				if (!visited.get(target)){
					visited.set(target);
					queue.add(target);
				}
			}
		}
		return reached;
	}

	/**
	 * Creates the action and goto table.
	 */
	public ParseTable toParserTable(LookaheadMode mode){
		return new TableBuilder(this, mode).build();
	}

	public ParseTable toParserTable(){
		return toParserTable(LookaheadMode.SLR1);
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		for (State state : states){
			if (state.id != 0){
				builder.append("\n–––––––\n");
			}
			builder.append(state.toString());
		}
		return builder.toString();
	}

	public String toGraphvizString(){
		StringBuilder builder = new StringBuilder();
		builder.append("digraph g {\n")
				.append("graph [fontsize=30 labelloc=\"t\" label=\"\" " +
						"splines=true overlap=false rankdir = \"LR\" dpi=\"" +
						Utils.GRAPHVIZ_IMAGE_DPI + "\"]; node [shape=box]\n");
		for (State state : states){
			builder.append(state.toGraphvizString()).append("\n");
		}
		builder.append("}");
		return builder.toString();
	}

	public void toGraphvizFile(Path file) throws IOException {
		Files.write(file, Collections.singletonList(toGraphvizString()), StandardCharsets.UTF_8);
	}
}
