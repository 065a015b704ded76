package lrgen.lr;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import lrgen.grammar.FirstFollowSets;
import lrgen.grammar.NonTerminal;
import lrgen.grammar.Production;
import lrgen.grammar.Symbol;
import lrgen.grammar.Terminal;
import lrgen.util.Pair;

import static lrgen.util.Utils.LOG;

/**
 * Creates the action and goto table of an automaton.
 *
 * For each state the shift actions are inserted first, then the accept action and then the reduce actions.
 * If a cell already holds a different action, the first action is kept and a conflict is recorded.
 */
public class TableBuilder {

	private final Automaton automaton;

	private final LookaheadMode mode;

	private final List<Map<Terminal, ParseTable.Action>> actionTable = new ArrayList<>();

	private final List<Map<NonTerminal, Integer>> gotoTable = new ArrayList<>();

	/**
	 * (state, terminal) → competing actions
	 */
	private final Map<Pair<Integer, Terminal>, Set<ParseTable.Action>> conflicts = new LinkedHashMap<>();

	private int acceptState = -1;

	public TableBuilder(Automaton automaton, LookaheadMode mode) {
		this.automaton = automaton;
		this.mode = mode;
	}

	public ParseTable build(){
		FirstFollowSets sets = automaton.grammar.getFirstFollowSets();
		Production startProduction = automaton.grammar.getAugmentedStartProduction();
		for (State state : automaton.getStates()){
			actionTable.add(new LinkedHashMap<>());
			gotoTable.add(new LinkedHashMap<>());
			for (Map.Entry<Symbol, Integer> transition : state.getTransitions().entrySet()){
				if (transition.getKey() instanceof Terminal){
					addShift(state, (Terminal)transition.getKey(), transition.getValue());
				} else {
					addGoto(state, (NonTerminal)transition.getKey(), transition.getValue());
				}
			}
			for (Item item : state.items){
				if (item.isComplete() && item.production.equals(startProduction)){
					addAccept(state);
				}
			}
			for (Item item : state.items){
				if (item.isComplete() && !item.production.equals(startProduction)){
					for (Terminal terminal : reduceTerminals(sets, item.production)){
						addReduce(state, terminal, item.production);
					}
				}
			}
		}
		List<Conflict> conflictList = new ArrayList<>();
		for (Map.Entry<Pair<Integer, Terminal>, Set<ParseTable.Action>> entry : conflicts.entrySet()){
			Conflict conflict = new Conflict(entry.getKey().first, entry.getKey().second, entry.getValue());
			LOG.warning(conflict.toString());
			conflictList.add(conflict);
		}
		return new ParseTable(automaton.grammar, mode, actionTable, gotoTable, acceptState, conflictList);
	}

	private Collection<Terminal> reduceTerminals(FirstFollowSets sets, Production production){
		if (mode == LookaheadMode.LR0){
			return automaton.grammar.getTerminalsWithEOF();
		}
		return sets.follow(production.left);
	}

	private void insert(State state, Terminal terminal, ParseTable.Action action){
		Map<Terminal, ParseTable.Action> row = actionTable.get(state.id);
		ParseTable.Action cur = row.get(terminal);
		if (cur == null){
			row.put(terminal, action);
		} else if (!cur.equals(action)){
			conflicts.computeIfAbsent(new Pair<>(state.id, terminal), k -> {
				Set<ParseTable.Action> actions = new LinkedHashSet<>();
				actions.add(cur);
				return actions;
			}).add(action);
		}
	}

	private void addShift(State state, Terminal terminal, int newState){
		insert(state, terminal, new ParseTable.ShiftAction(newState));
	}

	private void addReduce(State state, Terminal terminal, Production production){
		insert(state, terminal, new ParseTable.ReduceAction(production.id));
	}

	private void addAccept(State state){
		acceptState = state.id;
		insert(state, Terminal.EOF, new ParseTable.Accept());
	}

	private void addGoto(State state, NonTerminal nonTerminal, int newState){
		gotoTable.get(state.id).put(nonTerminal, newState);
	}
}
