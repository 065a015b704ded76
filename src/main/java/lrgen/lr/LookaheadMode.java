package lrgen.lr;

/**
 * Terminals on which a complete item is reduced.
 */
public enum LookaheadMode {
	/**
	 * Reduce on every terminal (including the end of input marker)
	 */
	LR0,
	/**
	 * Reduce on the terminals in the follow set of the left hand side
	 */
	SLR1;

	/**
	 * Parses the configuration value (case insensitive, "slr" is accepted for SLR1)
	 */
	public static LookaheadMode parse(String value){
		switch (value.trim().toLowerCase()){
			case "lr0":
			case "lr(0)":
				return LR0;
			case "slr":
			case "slr1":
			case "slr(1)":
				return SLR1;
			default:
				throw new IllegalArgumentException(String.format("Unknown lookahead mode \"%s\"", value));
		}
	}
}
