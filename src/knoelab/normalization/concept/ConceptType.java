package knoelab.normalization.concept;

/**
 * Variants of {@link Concept}, together with the keyword
 * used for each of them in the textual syntax.
 */
public enum ConceptType {
	ATOMIC(null),
	NOT("not"),
	AND("and"),
	OR("or"),
	ONLY("only"),
	SOME("some");
	
	private String keyword;
	
	private ConceptType(String keyword) {
		this.keyword = keyword;
	}
	
	public String getKeyword() {
		return keyword;
	}
	
	/**
	 * @return the concept type introduced by the given keyword, 
	 * or null if the token is not a reserved keyword
	 */
	public static ConceptType forKeyword(String token) {
		for(ConceptType type : values()) {
			if(type.keyword != null && type.keyword.equals(token))
				return type;
		}
		return null;
	}
	
	public static boolean isKeyword(String token) {
		return forKeyword(token) != null;
	}
}
