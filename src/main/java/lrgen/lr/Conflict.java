package lrgen.lr;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

import lrgen.grammar.Terminal;
import lrgen.util.Utils;

/**
 * More than one admissible action for a cell of the action table.
 */
public class Conflict implements Serializable {

	public enum Kind {
		SHIFT_REDUCE("shift/reduce"),
		REDUCE_REDUCE("reduce/reduce");

		private final String description;

		Kind(String description) {
			this.description = description;
		}

		@Override
		public String toString() {
			return description;
		}
	}

	public final int state;

	public final Terminal terminal;

	/**
	 * Competing actions, the first one is the action that is kept in the table
	 */
	public final List<ParseTable.Action> actions;

	public final Kind kind;

	public Conflict(int state, Terminal terminal, Collection<ParseTable.Action> actions) {
		if (actions.size() < 2){
			throw new IllegalArgumentException("A conflict needs at least two actions");
		}
		this.state = state;
		this.terminal = terminal;
		this.actions = Collections.unmodifiableList(new ArrayList<>(actions));
		Kind kind = Kind.REDUCE_REDUCE;
		for (ParseTable.Action action : actions){
			if (action instanceof ParseTable.ShiftAction){
				kind = Kind.SHIFT_REDUCE;
			}
		}
		this.kind = kind;
	}

	/**
	 * Action that is kept in the table
	 */
	public ParseTable.Action chosenAction(){
		return actions.get(0);
	}

	@Override
	public String toString() {
		return String.format("%s conflict in state %d at terminal %s: %s", kind, state, terminal,
				Utils.join(actions, ", "));
	}
}
