package knoelab.normalization.concept;

/**
 * Thrown when a concept (or a construct of an external format) has a shape
 * that cannot be rewritten or represented. It is fatal for the axiom 
 * being processed only; batch operations record it and continue.
 */
public class UnsupportedConstructException extends RuntimeException {

	private static final long serialVersionUID = 1L;
	
	private final String construct;
	
	public UnsupportedConstructException(String construct, String message) {
		super(message + ": " + construct);
		this.construct = construct;
	}
	
	/**
	 * @return textual rendering of the offending construct
	 */
	public String getConstruct() {
		return construct;
	}
}
