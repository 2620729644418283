package knoelab.normalization.concept;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Base of the n-ary boolean constructors. Operands keep their order 
 * and there is at least one of them.
 */
public abstract class NaryConcept extends Concept {

	private final List<Concept> subconcepts;
	
	NaryConcept(List<? extends Concept> subconcepts) {
		if(subconcepts == null || subconcepts.isEmpty())
			throw new IllegalArgumentException(getClass().getSimpleName() + 
					" needs at least one operand");
		List<Concept> operands = new ArrayList<Concept>(subconcepts.size());
		for(Concept c : subconcepts) {
			if(c == null)
				throw new IllegalArgumentException("Operands cannot be null");
			operands.add(c);
		}
		this.subconcepts = Collections.unmodifiableList(operands);
	}
	
	public List<Concept> getSubconcepts() {
		return subconcepts;
	}
	
	@Override
	protected String render() {
		StringBuilder sb = new StringBuilder();
		sb.append("(").append(getConceptType().getKeyword()).append(" (");
		for(int i=0; i<subconcepts.size(); i++) {
			if(i > 0)
				sb.append(" ");
			sb.append(subconcepts.get(i).getCanonicalForm());
		}
		return sb.append("))").toString();
	}
	
	@Override
	void collectSignature(Set<AtomicConcept> atomicConcepts, 
			Set<Relation> relations) {
		for(Concept c : subconcepts)
			c.collectSignature(atomicConcepts, relations);
	}
}
