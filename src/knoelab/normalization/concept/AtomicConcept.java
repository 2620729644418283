package knoelab.normalization.concept;

import java.util.Set;

/**
 * A named primitive concept.
 */
public final class AtomicConcept extends Concept {

	private final String name;
	
	public AtomicConcept(String name) {
		if(!isValidName(name))
			throw new IllegalArgumentException("Invalid atomic concept name: '" 
					+ name + "'");
		this.name = name;
	}
	
	/**
	 * A name is valid if it is a single token that is neither a reserved 
	 * keyword nor contains brackets, commas or TBox delimiters, so that it 
	 * reads back as the same atomic concept.
	 */
	public static boolean isValidName(String name) {
		if(name == null || name.isEmpty())
			return false;
		if(ConceptType.isKeyword(name))
			return false;
		for(int i=0; i<name.length(); i++) {
			char c = name.charAt(i);
			if(Character.isWhitespace(c) || c == '(' || c == ')' 
					|| c == '[' || c == ']' || c == ',')
				return false;
		}
		return !Relation.clashesWithLineSyntax(name);
	}
	
	public String getName() {
		return name;
	}
	
	@Override
	public ConceptType getConceptType() {
		return ConceptType.ATOMIC;
	}
	
	@Override
	public <T> T accept(ConceptVisitor<T> visitor) {
		return visitor.visit(this);
	}
	
	@Override
	protected String render() {
		return name;
	}
	
	@Override
	void collectSignature(Set<AtomicConcept> atomicConcepts, 
			Set<Relation> relations) {
		atomicConcepts.add(this);
	}
}
