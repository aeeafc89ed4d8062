package cfg.grammar;

import java.util.regex.Pattern;

/**
 * A non terminal symbol, referenced by its name.
 *
 * The productions are stored in the grammar.
 */
public class NonTerminal extends Symbol {

	/**
	 * Valid names start with an uppercase letter
	 */
	public static final Pattern NAME_PATTERN = Pattern.compile("[A-Z][A-Za-z0-9'_]*");

	public NonTerminal(String name) {
		super(name);
	}

	public String name(){
		return value;
	}

	@Override
	public Kind kind() {
		return Kind.NON_TERMINAL;
	}

	public static boolean isValidName(String name){
		return NAME_PATTERN.matcher(name).matches();
	}
}
