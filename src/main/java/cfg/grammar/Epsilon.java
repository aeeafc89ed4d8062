package cfg.grammar;

/**
 * The empty word
 */
public class Epsilon extends Symbol {

	public static final String VALUE = "ε";

	public static final Epsilon EPSILON = new Epsilon();

	private Epsilon() {
		super(VALUE);
	}

	@Override
	public Kind kind() {
		return Kind.EPSILON;
	}
}
