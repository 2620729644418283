package knoelab.normalization.concept;

/**
 * Universal restriction, <code>(only r C)</code>.
 */
public final class OnlyConcept extends RestrictionConcept {

	public OnlyConcept(Relation relation, Concept subconcept) {
		super(relation, subconcept);
	}
	
	@Override
	public ConceptType getConceptType() {
		return ConceptType.ONLY;
	}
	
	@Override
	public <T> T accept(ConceptVisitor<T> visitor) {
		return visitor.visit(this);
	}
}
