package knoelab.normalization.parser;

/**
 * Signals malformed concept or axiom text: unbalanced brackets, missing 
 * delimiter or operand, empty argument list, unknown construct.
 */
public class ConceptParseException extends Exception {

	private static final long serialVersionUID = 1L;
	// longer offending text is cut in the message, not in getParsedString()
	private static final int MAX_QUOTED_LENGTH = 80;
	
	private final String parsedString;
	
	public ConceptParseException(String message, String parsedString) {
		this(message, parsedString, null);
	}
	
	public ConceptParseException(String message, String parsedString, 
			Throwable cause) {
		super(message + " in '" + abbreviate(parsedString) + "'", cause);
		this.parsedString = parsedString;
	}
	
	private static String abbreviate(String str) {
		if(str == null || str.length() <= MAX_QUOTED_LENGTH)
			return str;
		return str.substring(0, MAX_QUOTED_LENGTH) + "...";
	}
	
	/**
	 * @return the offending substring
	 */
	public String getParsedString() {
		return parsedString;
	}
}
