package lrgen.lr;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import lrgen.grammar.Symbol;
import lrgen.util.Utils;

/**
 * A state of the automaton: a closed item set with a stable id and its outgoing transitions.
 *
 * States are created by the {@link Automaton} and can't be modified from the outside.
 */
public class State implements Serializable {

	public final int id;

	public final ItemSet items;

	private final Map<Symbol, Integer> transitions = new LinkedHashMap<>();

	State(int id, ItemSet items) {
		this.id = id;
		this.items = items;
	}

	void addTransition(Symbol symbol, int target){
		transitions.put(symbol, target);
	}

	/**
	 * Outgoing transitions (symbol to id of the target state), in the order they were created
	 */
	public Map<Symbol, Integer> getTransitions(){
		return Collections.unmodifiableMap(transitions);
	}

	/**
	 * @return id of the target state or -1 if there is no transition for the symbol
	 */
	public int transition(Symbol symbol){
		return transitions.getOrDefault(symbol, -1);
	}

	@Override
	public String toString() {
		return "State " + id + "\n" + items;
	}

	public String toGraphvizString(){
		StringBuilder builder = new StringBuilder();
		builder.append("\"state").append(id)
				.append("\" [style = \"filled, bold\" penwidth = 5 " +
						"color=\"\" fillcolor = \"white\"")
				.append(" label=<<table border=\"0\" cellborder=\"0\" cellpadding=\"3\" " +
						"bgcolor=\"white\"><tr>" +
						"<td bgcolor=\"black\" align=\"center\" colspan=\"2\">" +
						"<font color=\"white\">State ").append(id)
				.append("</font></td></tr>");
		for (Item item : items){
			builder.append("<tr><td align=\"left\" port=\"r0\">")
					.append(Utils.escapeHtml(item.toString())).append("</td></tr>");
		}
		builder.append("</table>> ];\n");
		for (Map.Entry<Symbol, Integer> transition : transitions.entrySet()){
			builder.append("state").append(id).append(" -> ").append("state").append(transition.getValue());
			builder.append("[ penwidth = 5 fontsize = 28 fontcolor = \"black\" label = \"");
			builder.append(Utils.escapeHtml(transition.getKey().toString())).append("\"];\n");
		}
		return builder.toString();
	}
}
