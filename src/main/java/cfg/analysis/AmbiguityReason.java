package cfg.analysis;

import java.util.Collections;
import java.util.List;

/**
 * A single hint that a grammar might be ambiguous
 */
public class AmbiguityReason {

	public enum Severity {
		HIGH,
		MEDIUM,
		LOW;

		@Override
		public String toString() {
			return name().toLowerCase();
		}
	}

	/**
	 * Kind of the detected pattern, like "Expression Ambiguity"
	 */
	public final String type;

	public final String description;

	/**
	 * Productions involved, each formatted as <code>A -> b c</code>
	 */
	public final List<String> involvedRules;

	public final Severity severity;

	public AmbiguityReason(String type, String description, List<String> involvedRules, Severity severity) {
		this.type = type;
		this.description = description;
		this.involvedRules = Collections.unmodifiableList(involvedRules);
		this.severity = severity;
	}

	@Override
	public String toString() {
		return String.format("[%s] %s: %s", severity, type, description);
	}
}
