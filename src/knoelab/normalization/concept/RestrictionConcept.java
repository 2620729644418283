package knoelab.normalization.concept;

import java.util.Set;

/**
 * Base of the role restrictions, <code>(only r C)</code> and <code>(some r C)</code>.
 */
public abstract class RestrictionConcept extends Concept {

	private final Relation relation;
	private final Concept subconcept;
	
	RestrictionConcept(Relation relation, Concept subconcept) {
		if(relation == null || subconcept == null)
			throw new IllegalArgumentException(getClass().getSimpleName() + 
					" needs a relation and a filler");
		this.relation = relation;
		this.subconcept = subconcept;
	}
	
	public Relation getRelation() {
		return relation;
	}
	
	public Concept getSubconcept() {
		return subconcept;
	}
	
	@Override
	protected String render() {
		return "(" + getConceptType().getKeyword() + " " + relation.getName() + 
				" " + subconcept.getCanonicalForm() + ")";
	}
	
	@Override
	void collectSignature(Set<AtomicConcept> atomicConcepts, 
			Set<Relation> relations) {
		relations.add(relation);
		subconcept.collectSignature(atomicConcepts, relations);
	}
}
