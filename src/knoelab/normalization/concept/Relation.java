package knoelab.normalization.concept;

import knoelab.normalization.misc.Constants;

/**
 * A role, identified by its name only.
 */
public final class Relation {

	private final String name;
	
	public Relation(String name) {
		if(!isValidName(name))
			throw new IllegalArgumentException("Invalid relation name: '" 
					+ name + "'");
		this.name = name;
	}
	
	public static boolean isValidName(String name) {
		if(name == null || name.isEmpty())
			return false;
		for(int i=0; i<name.length(); i++) {
			char c = name.charAt(i);
			if(Character.isWhitespace(c) || c == '(' || c == ')' 
					|| c == '[' || c == ']' || c == ',')
				return false;
		}
		return !clashesWithLineSyntax(name);
	}
	
	/**
	 * Names holding a TBox delimiter, or starting with the comment prefix, 
	 * would not read back from an axiom line.
	 */
	static boolean clashesWithLineSyntax(String name) {
		return name.contains(Constants.DEFINITION_SYMBOL) || 
				name.contains(Constants.INCLUSION_SYMBOL) || 
				name.startsWith(Constants.COMMENT_PREFIX);
	}
	
	public String getName() {
		return name;
	}
	
	@Override
	public boolean equals(Object obj) {
		if(this == obj)
			return true;
		if(!(obj instanceof Relation))
			return false;
		return name.equals(((Relation) obj).name);
	}
	
	@Override
	public int hashCode() {
		return name.hashCode();
	}
	
	@Override
	public String toString() {
		return name;
	}
}
