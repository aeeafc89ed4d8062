package cfg.analysis;

import java.util.Collections;
import java.util.List;

/**
 * Verdict of the ambiguity heuristics, the status is derived from the reasons
 */
public class AmbiguityResult {

	public enum Status {
		AMBIGUOUS("ambiguous"),
		POSSIBLY_AMBIGUOUS("possibly-ambiguous"),
		NONE_DETECTED("no-ambiguity-detected");

		public final String description;

		Status(String description){
			this.description = description;
		}

		@Override
		public String toString() {
			return description;
		}
	}

	public final Status status;

	public final List<AmbiguityReason> reasons;

	public final String explanation;

	public AmbiguityResult(List<AmbiguityReason> reasons) {
		this.reasons = Collections.unmodifiableList(reasons);
		this.status = statusOf(reasons);
		this.explanation = explanationOf(status);
	}

	/**
	 * Any high severity reason means ambiguous, any other reason means possibly ambiguous
	 */
	public static Status statusOf(List<AmbiguityReason> reasons){
		if (reasons.stream().anyMatch(r -> r.severity == AmbiguityReason.Severity.HIGH)){
			return Status.AMBIGUOUS;
		}
		if (!reasons.isEmpty()){
			return Status.POSSIBLY_AMBIGUOUS;
		}
		return Status.NONE_DETECTED;
	}

	public static String explanationOf(Status status){
		switch (status){
			case AMBIGUOUS:
				return "The grammar contains patterns that are definitively ambiguous. " +
						"Multiple parse trees can be constructed for the same input string. " +
						"See the detailed reasons below for specific ambiguity sources.";
			case POSSIBLY_AMBIGUOUS:
				return "The grammar contains patterns that may lead to ambiguity. " +
						"While we cannot definitively prove ambiguity (the general problem is undecidable), " +
						"the detected patterns are commonly associated with ambiguous grammars.";
			case NONE_DETECTED:
			default:
				return "No common ambiguity patterns were detected in this grammar. " +
						"Note: Since general CFG ambiguity detection is undecidable, this does not guarantee " +
						"the grammar is unambiguous, only that no known heuristic patterns were found.";
		}
	}

	public boolean hasReason(String type){
		return reasons.stream().anyMatch(r -> r.type.equals(type));
	}

	@Override
	public String toString() {
		return status + " (" + reasons.size() + " reason(s))";
	}
}
