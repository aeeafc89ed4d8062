package cfg.report;

import java.util.*;

import cfg.analysis.*;
import cfg.grammar.Grammar;
import cfg.transform.TransformationPipeline;
import cfg.transform.TransformationResult;
import cfg.transform.TransformationStep;
import cfg.tree.SampleGenerator;

import static cfg.util.Utils.formatSet;
import static cfg.util.Utils.join;

/**
 * Plain text report of a complete analysis of a grammar.
 *
 * The core report contains the status, the original grammar text, the explanation and (if a
 * transformation applied) the converted grammar with the numbered transformation steps. Further
 * sections can be enabled for the details of the analysis.
 */
public class AnalysisReport {

	public static final String TITLE = "=== CFG Ambiguity Analysis Report ===";

	private final String grammarText;
	private final Grammar grammar;
	private final AmbiguityResult ambiguity;
	private final TransformationResult transformation;
	private boolean details = false;

	public AnalysisReport(String grammarText, Grammar grammar, AmbiguityResult ambiguity,
	                      TransformationResult transformation) {
		this.grammarText = grammarText;
		this.grammar = grammar;
		this.ambiguity = ambiguity;
		this.transformation = transformation;
	}

	/**
	 * Analyses and transforms the passed grammar
	 *
	 * @param grammarText text the grammar was parsed from
	 */
	public static AnalysisReport analyze(String grammarText, Grammar grammar){
		return new AnalysisReport(grammarText, grammar, AmbiguityDetector.detectAmbiguity(grammar),
				TransformationPipeline.transformGrammar(grammar));
	}

	/**
	 * Include the reasons, FIRST/FOLLOW sets, LL(1) conflicts, unreachable non terminals and sample sentences?
	 */
	public AnalysisReport withDetails(boolean details){
		this.details = details;
		return this;
	}

	public AmbiguityResult getAmbiguity(){
		return ambiguity;
	}

	public TransformationResult getTransformation(){
		return transformation;
	}

	public String format(){
		StringBuilder builder = new StringBuilder();
		builder.append(TITLE).append("\n\n");
		builder.append("Status: ").append(ambiguity.status).append("\n\n");
		builder.append("Original Grammar:\n").append(grammarText.trim()).append("\n\n");
		builder.append("Explanation:\n").append(ambiguity.explanation).append("\n\n");
		if (transformation.success){
			builder.append("Converted Grammar:\n").append(transformation.grammar.format()).append("\n\n");
			builder.append("Transformation Steps:\n");
			List<TransformationStep> steps = transformation.steps;
			for (int i = 0; i < steps.size(); i++){
				builder.append(String.format("  %d. %s: %s%n", i + 1, steps.get(i).name, steps.get(i).description));
			}
		}
		if (details){
			appendDetails(builder);
		}
		return builder.toString();
	}

	private void appendDetails(StringBuilder builder){
		builder.append("\nReasons:\n");
		if (ambiguity.reasons.isEmpty()){
			builder.append("  none\n");
		}
		for (AmbiguityReason reason : ambiguity.reasons){
			builder.append("  ").append(reason).append("\n");
			for (String rule : reason.involvedRules){
				builder.append("      ").append(rule).append("\n");
			}
		}
		FirstFollowSets sets = FirstFollowSets.calculate(grammar);
		builder.append("\nFIRST and FOLLOW Sets:\n");
		for (String nonTerminal : grammar.getNonTerminals()){
			builder.append(String.format("  %s: FIRST = %s, FOLLOW = %s%n", nonTerminal,
					formatSet(sets.first(nonTerminal)), formatSet(sets.follow(nonTerminal))));
		}
		List<LL1Conflict> conflicts = LL1ConflictChecker.check(grammar, sets);
		builder.append("\nLL(1) Conflicts:\n");
		if (conflicts.isEmpty()){
			builder.append("  none, the grammar is LL(1)\n");
		}
		for (LL1Conflict conflict : conflicts){
			builder.append("  ").append(conflict.message()).append("\n");
		}
		List<String> unreachable = Reachability.unreachable(grammar);
		builder.append("\nUnreachable Non-terminals: ")
				.append(unreachable.isEmpty() ? "none" : join(unreachable, ", ")).append("\n");
		List<String> leftRecursive = LeftRecursion.direct(grammar);
		builder.append("Left Recursive Non-terminals: ")
				.append(leftRecursive.isEmpty() ? "none" : join(leftRecursive, ", ")).append("\n");
		for (Set<String> group : LeftRecursion.indirect(grammar)){
			builder.append("Indirect Left Recursion: ").append(formatSet(group)).append("\n");
		}
		builder.append("\nSample Strings:\n");
		for (String sample : new SampleGenerator().generate(grammar)){
			builder.append("  ").append(sample).append("\n");
		}
	}

	@Override
	public String toString() {
		return format();
	}
}
