package lrgen;

import lrgen.grammar.Grammar;
import lrgen.lr.Automaton;
import lrgen.lr.GrammarConflictException;
import lrgen.lr.ParseTable;
import lrgen.util.Cache;

import static lrgen.util.Utils.LOG;

/**
 * Creates parse tables for grammars: grammar → first and follow sets → LR(0) automaton → action and goto table.
 *
 * Tables are cached per grammar instance.
 */
public class Generator {

	private final Config config;

	private final Cache<Grammar, ParseTable> cache;

	public Generator(Config config) {
		this.config = config;
		this.cache = new Cache<>(config.cacheSize());
	}

	public Generator() {
		this(Config.getDefault());
	}

	/**
	 * Creates the table for the passed grammar or returns the cached one.
	 *
	 * @throws GrammarConflictException if the table has conflicts and conflicts aren't allowed by the
	 *                                  configuration
	 */
	public ParseTable generate(Grammar grammar){
		ParseTable table = cache.getIfPresent(grammar);
		if (table == null){
			Automaton automaton = Automaton.createFromGrammar(grammar);
			table = automaton.toParserTable(config.lookahead());
			LOG.fine(String.format("Created %s table with %d states and %d conflicts", table.mode, table.size(),
					table.getConflicts().size()));
			cache.put(grammar, table);
		}
		if (config.failOnConflict()){
			table.requireConflictFree();
		}
		return table;
	}
}
