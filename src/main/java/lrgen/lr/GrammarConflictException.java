package lrgen.lr;

import java.util.Collections;
import java.util.List;

import lrgen.LRGenException;
import lrgen.util.Utils;

/**
 * Thrown if a parse table with conflicts is used as if the grammar could be parsed with it.
 */
public class GrammarConflictException extends LRGenException {

	public final List<Conflict> conflicts;

	public GrammarConflictException(List<Conflict> conflicts) {
		super(String.format("Grammar isn't parseable by this construction, %d conflict(s):\n%s", conflicts.size(),
				Utils.join(conflicts, "\n")));
		this.conflicts = Collections.unmodifiableList(conflicts);
	}
}
