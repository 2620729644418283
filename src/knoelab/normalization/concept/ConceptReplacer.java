package knoelab.normalization.concept;

import java.util.ArrayList;
import java.util.List;

/**
 * Structural substitution. A node whose canonical form equals the one of
 * the target is replaced as a whole (the replacement is not scanned again);
 * any other node is rebuilt from its substituted children.
 */
final class ConceptReplacer implements ConceptVisitor<Concept> {

	private final String targetKey;
	private final Concept replacement;
	
	ConceptReplacer(Concept target, Concept replacement) {
		if(target == null || replacement == null)
			throw new IllegalArgumentException("Target and replacement are required");
		this.targetKey = target.getCanonicalForm();
		this.replacement = replacement;
	}
	
	private boolean matches(Concept concept) {
		return targetKey.equals(concept.getCanonicalForm());
	}
	
	public Concept visit(AtomicConcept concept) {
		return matches(concept) ? replacement : concept;
	}
	
	public Concept visit(NotConcept concept) {
		if(matches(concept))
			return replacement;
		return new NotConcept(concept.getSubconcept().accept(this));
	}
	
	public Concept visit(ConjunctionConcept concept) {
		if(matches(concept))
			return replacement;
		return new ConjunctionConcept(replaceAll(concept.getSubconcepts()));
	}
	
	public Concept visit(DisjunctionConcept concept) {
		if(matches(concept))
			return replacement;
		return new DisjunctionConcept(replaceAll(concept.getSubconcepts()));
	}
	
	public Concept visit(OnlyConcept concept) {
		if(matches(concept))
			return replacement;
		return new OnlyConcept(concept.getRelation(), 
				concept.getSubconcept().accept(this));
	}
	
	public Concept visit(SomeConcept concept) {
		if(matches(concept))
			return replacement;
		return new SomeConcept(concept.getRelation(), 
				concept.getSubconcept().accept(this));
	}
	
	private List<Concept> replaceAll(List<Concept> concepts) {
		List<Concept> replaced = new ArrayList<Concept>(concepts.size());
		for(Concept c : concepts)
			replaced.add(c.accept(this));
		return replaced;
	}
}
