package cfg.transform;

/**
 * A pass that changed the grammar, with the serialized grammar before and after the pass
 */
public class TransformationStep {

	public final String name;
	public final String description;
	public final String before;
	public final String after;

	public TransformationStep(String name, String description, String before, String after) {
		this.name = name;
		this.description = description;
		this.before = before;
		this.after = after;
	}

	@Override
	public String toString() {
		return name + ": " + description;
	}
}
