package knoelab.normalization.concept;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites a concept into Negation Normal Form. Each visit fully resolves
 * its node before returning:
 * <ul>
 * <li>not (not C) => C</li>
 * <li>not (and (C D)) => or ((not C) (not D))</li>
 * <li>not (or (C D)) => and ((not C) (not D))</li>
 * <li>not (only r C) => some r (not C)</li>
 * <li>not (some r C) => only r (not C)</li>
 * </ul>
 * Negated atomic concepts are left as they are.
 */
final class NNFConverter implements ConceptVisitor<Concept> {

	static final NNFConverter INSTANCE = new NNFConverter();
	
	// computes NNF(not C) when visiting C
	private final ConceptVisitor<Concept> negatedConverter = new NegatedConverter();
	
	private NNFConverter() {
	}
	
	public Concept visit(AtomicConcept concept) {
		return concept;
	}
	
	public Concept visit(NotConcept concept) {
		return concept.getSubconcept().accept(negatedConverter);
	}
	
	public Concept visit(ConjunctionConcept concept) {
		return new ConjunctionConcept(convertAll(concept.getSubconcepts(), false));
	}
	
	public Concept visit(DisjunctionConcept concept) {
		return new DisjunctionConcept(convertAll(concept.getSubconcepts(), false));
	}
	
	public Concept visit(OnlyConcept concept) {
		return new OnlyConcept(concept.getRelation(), 
				concept.getSubconcept().accept(this));
	}
	
	public Concept visit(SomeConcept concept) {
		return new SomeConcept(concept.getRelation(), 
				concept.getSubconcept().accept(this));
	}
	
	private List<Concept> convertAll(List<Concept> concepts, boolean negate) {
		List<Concept> converted = new ArrayList<Concept>(concepts.size());
		for(Concept c : concepts) {
			if(negate)
				converted.add(c.negate().accept(this));
			else
				converted.add(c.accept(this));
		}
		return converted;
	}
	
	private class NegatedConverter implements ConceptVisitor<Concept> {
		
		public Concept visit(AtomicConcept concept) {
			return new NotConcept(concept);
		}
		
		public Concept visit(NotConcept concept) {
			// double negation
			return concept.getSubconcept().accept(NNFConverter.this);
		}
		
		public Concept visit(ConjunctionConcept concept) {
			return new DisjunctionConcept(convertAll(concept.getSubconcepts(), true));
		}
		
		public Concept visit(DisjunctionConcept concept) {
			return new ConjunctionConcept(convertAll(concept.getSubconcepts(), true));
		}
		
		public Concept visit(OnlyConcept concept) {
			return new SomeConcept(concept.getRelation(), 
					concept.getSubconcept().negate().accept(NNFConverter.this));
		}
		
		public Concept visit(SomeConcept concept) {
			return new OnlyConcept(concept.getRelation(), 
					concept.getSubconcept().negate().accept(NNFConverter.this));
		}
	}
}
