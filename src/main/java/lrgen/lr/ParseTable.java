package lrgen.lr;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lrgen.grammar.Grammar;
import lrgen.grammar.NonTerminal;
import lrgen.grammar.Production;
import lrgen.grammar.Terminal;

/**
 * Immutable action and goto table, built by the {@link TableBuilder}.
 *
 * A driver starts in state 0, looks up {@link #action(int, Terminal)} for the current state and the next
 * terminal (the end of input is {@link Terminal#EOF}). A shift pushes the target state and consumes the
 * terminal. A reduce of production p pops <code>p.rightSize()</code> states and pushes
 * <code>gotoState(top, p.left)</code>. Accept ends the parse, a missing action is a syntax error.
 *
 * Only tables without conflicts describe the grammar, check {@link #isParseable()} or call
 * {@link #requireConflictFree()} first.
 */
public class ParseTable implements Serializable {

	public final Grammar grammar;

	public final LookaheadMode mode;

	/**
	 * Mapping of terminal to action for each state.
	 */
	private final List<Map<Terminal, Action>> actionTable;

	/**
	 * Mapping of non terminal to next state (for each state).
	 */
	private final List<Map<NonTerminal, Integer>> gotoTable;

	private final int acceptState;

	private final List<Conflict> conflicts;

	ParseTable(Grammar grammar, LookaheadMode mode, List<Map<Terminal, Action>> actionTable,
	           List<Map<NonTerminal, Integer>> gotoTable, int acceptState, List<Conflict> conflicts) {
		this.grammar = grammar;
		this.mode = mode;
		List<Map<Terminal, Action>> actions = new ArrayList<>();
		for (Map<Terminal, Action> row : actionTable){
			actions.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
		}
		List<Map<NonTerminal, Integer>> gotos = new ArrayList<>();
		for (Map<NonTerminal, Integer> row : gotoTable){
			gotos.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
		}
		this.actionTable = Collections.unmodifiableList(actions);
		this.gotoTable = Collections.unmodifiableList(gotos);
		this.acceptState = acceptState;
		this.conflicts = Collections.unmodifiableList(new ArrayList<>(conflicts));
	}

	public abstract static class Action implements Serializable {

		public abstract String name();
	}

	public static class ShiftAction extends Action {

		public final int stateToBeShifted;

		public ShiftAction(int stateToBeShifted) {
			this.stateToBeShifted = stateToBeShifted;
		}

		@Override
		public String toString() {
			return "shift(" + stateToBeShifted + ")";
		}

		@Override
		public String name() {
			return "shift";
		}

		@Override
		public boolean equals(Object obj) {
			return obj instanceof ShiftAction && ((ShiftAction)obj).stateToBeShifted == stateToBeShifted;
		}

		@Override
		public int hashCode() {
			return stateToBeShifted;
		}
	}

	public static class ReduceAction extends Action {

		public final int productionId;

		public ReduceAction(int productionId) {
			this.productionId = productionId;
		}

		@Override
		public String toString() {
			return "reduce(" + productionId + ")";
		}

		@Override
		public String name() {
			return "reduce";
		}

		@Override
		public boolean equals(Object obj) {
			return obj instanceof ReduceAction && ((ReduceAction)obj).productionId == productionId;
		}

		@Override
		public int hashCode() {
			return -productionId - 1;
		}
	}

	public static class Accept extends Action {

		@Override
		public String toString() {
			return "accept()";
		}

		@Override
		public String name() {
			return "accept";
		}

		@Override
		public boolean equals(Object obj) {
			return obj instanceof Accept;
		}

		@Override
		public int hashCode() {
			return Integer.MIN_VALUE;
		}
	}

	/**
	 * Number of states (rows)
	 */
	public int size(){
		return actionTable.size();
	}

	/**
	 * @return action or null for a syntax error
	 */
	public Action action(int state, Terminal terminal){
		return actionTable.get(state).get(terminal);
	}

	public Map<Terminal, Action> actionRow(int state){
		return actionTable.get(state);
	}

	/**
	 * @return next state or -1 if there is no such entry
	 */
	public int gotoState(int state, NonTerminal nonTerminal){
		return gotoTable.get(state).getOrDefault(nonTerminal, -1);
	}

	public Map<NonTerminal, Integer> gotoRow(int state){
		return gotoTable.get(state);
	}

	/**
	 * Id of the state that accepts on the end of input marker
	 */
	public int getAcceptState(){
		return acceptState;
	}

	/**
	 * Productions indexed by the ids used in reduce actions
	 */
	public List<Production> getProductions(){
		return grammar.getAllProductions();
	}

	public Production getProduction(int id){
		return grammar.getProductionForId(id);
	}

	public List<Conflict> getConflicts(){
		return conflicts;
	}

	/**
	 * Can the grammar be parsed with this table, i.e. are there no conflicts?
	 */
	public boolean isParseable(){
		return conflicts.isEmpty();
	}

	/**
	 * @return this table
	 * @throws GrammarConflictException if the table has conflicts
	 */
	public ParseTable requireConflictFree(){
		if (!isParseable()){
			throw new GrammarConflictException(conflicts);
		}
		return this;
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		for (int i = 0; i < actionTable.size(); i++){
			if (i != 0){
				builder.append("\n");
			}
			builder.append(String.format("State = %5d: ", i));
			builder.append(" Actions = ");
			builder.append(actionTable.get(i));
			builder.append(" GOTO = ");
			builder.append(gotoTable.get(i));
		}
		return builder.toString();
	}
}
