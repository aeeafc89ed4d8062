package cfg.transform;

import java.util.*;
import java.util.logging.Logger;

import cfg.grammar.Grammar;

/**
 * Runs a fixed sequence of passes, each pass gets the grammar produced by the previous one.
 *
 * The default order matters: the precedence restructuring produces left recursive non terminals
 * that the left recursion elimination removes, the left factoring works on the result of both and
 * the dangling else resolution comes last.
 */
public class TransformationPipeline {

	private static final Logger LOG = Logger.getLogger(TransformationPipeline.class.getName());

	public static final String NO_TRANSFORMATION = "No applicable transformations were found. " +
			"The grammar may be inherently ambiguous, or it may require manual restructuring that is beyond " +
			"automated heuristic transformation.";

	private final List<Transformation> passes;

	public TransformationPipeline(List<Transformation> passes) {
		this.passes = Collections.unmodifiableList(new ArrayList<>(passes));
	}

	public TransformationPipeline() {
		this(defaultPasses());
	}

	public static List<Transformation> defaultPasses(){
		return Arrays.asList(new OperatorPrecedence(), new LeftRecursionElimination(), new LeftFactoring(),
				new DanglingElseResolution());
	}

	public static TransformationResult transformGrammar(Grammar grammar){
		return new TransformationPipeline().transform(grammar);
	}

	public List<Transformation> getPasses(){
		return passes;
	}

	public TransformationResult transform(Grammar grammar){
		List<TransformationStep> steps = new ArrayList<>();
		Grammar current = grammar;
		for (Transformation pass : passes){
			Transformation.Result result = pass.apply(current);
			if (result.changed){
				steps.add(new TransformationStep(pass.name, pass.description, current.format(), result.grammar.format()));
				current = result.grammar;
				LOG.fine(() -> "Applied " + pass.name);
			}
		}
		if (steps.isEmpty()){
			return new TransformationResult(false, grammar, steps, NO_TRANSFORMATION);
		}
		return new TransformationResult(true, current, steps,
				String.format("Applied %d transformation(s) to reduce ambiguity. " +
						"Review the converted grammar to verify language preservation.", steps.size()));
	}
}
