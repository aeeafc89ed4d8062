package cfg.transform;

import cfg.grammar.Grammar;

/**
 * A single grammar rewriting pass. A pass never modifies the passed grammar, it returns a new one.
 */
public abstract class Transformation {

	/**
	 * Grammar produced by a pass and whether the pass changed anything
	 */
	public static class Result {

		public final Grammar grammar;

		public final boolean changed;

		public Result(Grammar grammar, boolean changed) {
			this.grammar = grammar;
			this.changed = changed;
		}

		public static Result unchanged(Grammar grammar){
			return new Result(grammar, false);
		}
	}

	public final String name;

	public final String description;

	protected Transformation(String name, String description) {
		this.name = name;
		this.description = description;
	}

	public abstract Result apply(Grammar grammar);

	@Override
	public String toString() {
		return name;
	}
}
