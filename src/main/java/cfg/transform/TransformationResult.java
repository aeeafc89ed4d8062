package cfg.transform;

import java.util.Collections;
import java.util.List;

import cfg.grammar.Grammar;

/**
 * Result of the transformation pipeline. If no pass changed anything, the result isn't
 * successful and contains the original grammar.
 */
public class TransformationResult {

	public final boolean success;

	public final Grammar grammar;

	public final List<TransformationStep> steps;

	public final String explanation;

	public TransformationResult(boolean success, Grammar grammar, List<TransformationStep> steps,
	                            String explanation) {
		this.success = success;
		this.grammar = grammar;
		this.steps = Collections.unmodifiableList(steps);
		this.explanation = explanation;
	}

	@Override
	public String toString() {
		return explanation;
	}
}
