package cfg.grammar;

/**
 * A terminal symbol
 */
public class Terminal extends Symbol {

	public Terminal(String text) {
		super(text);
	}

	@Override
	public Kind kind() {
		return Kind.TERMINAL;
	}
}
