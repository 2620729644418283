package knoelab.normalization.concept;

import java.util.Set;

/**
 * Complement of a concept, <code>(not C)</code>.
 */
public final class NotConcept extends Concept {

	private final Concept subconcept;
	
	public NotConcept(Concept subconcept) {
		if(subconcept == null)
			throw new IllegalArgumentException("Negated concept cannot be null");
		this.subconcept = subconcept;
	}
	
	public Concept getSubconcept() {
		return subconcept;
	}
	
	@Override
	public ConceptType getConceptType() {
		return ConceptType.NOT;
	}
	
	@Override
	public <T> T accept(ConceptVisitor<T> visitor) {
		return visitor.visit(this);
	}
	
	@Override
	protected String render() {
		return "(" + ConceptType.NOT.getKeyword() + " " + 
				subconcept.getCanonicalForm() + ")";
	}
	
	@Override
	void collectSignature(Set<AtomicConcept> atomicConcepts, 
			Set<Relation> relations) {
		subconcept.collectSignature(atomicConcepts, relations);
	}
}
