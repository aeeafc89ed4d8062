package cfg;

/**
 * Base exception of this project.
 *
 * Only thrown for programming errors (like building a grammar that references an undefined
 * non terminal) or by callers that explicitly ask for an exception instead of an error list.
 */
public class CFGException extends RuntimeException {

	public CFGException(String message) {
		super(message);
	}

	public CFGException(String message, Throwable cause) {
		super(message, cause);
	}
}
