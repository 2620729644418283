package knoelab.normalization.concept;

/**
 * True iff negation only ever wraps atomic concepts.
 */
final class NNFChecker implements ConceptVisitor<Boolean> {

	static final NNFChecker INSTANCE = new NNFChecker();
	
	private NNFChecker() {
	}
	
	public Boolean visit(AtomicConcept concept) {
		return Boolean.TRUE;
	}
	
	public Boolean visit(NotConcept concept) {
		return concept.getSubconcept().getConceptType() == ConceptType.ATOMIC;
	}
	
	public Boolean visit(ConjunctionConcept concept) {
		return allNNF(concept);
	}
	
	public Boolean visit(DisjunctionConcept concept) {
		return allNNF(concept);
	}
	
	public Boolean visit(OnlyConcept concept) {
		return concept.getSubconcept().accept(this);
	}
	
	public Boolean visit(SomeConcept concept) {
		return concept.getSubconcept().accept(this);
	}
	
	private Boolean allNNF(NaryConcept concept) {
		for(Concept c : concept.getSubconcepts()) {
			if(!c.accept(this))
				return Boolean.FALSE;
		}
		return Boolean.TRUE;
	}
}
