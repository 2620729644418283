package knoelab.normalization.abox;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import knoelab.normalization.concept.Individual;

/**
 * Set of individual-level assertions. Duplicates (same textual form) are
 * collapsed; iteration follows insertion order. Rewriting operations 
 * replace the axiom set as a whole.
 */
public class ABox {

	private Set<ABoxAxiom> axioms;
	
	public ABox() {
		axioms = new LinkedHashSet<ABoxAxiom>();
	}
	
	public ABox(Collection<? extends ABoxAxiom> axioms) {
		this();
		for(ABoxAxiom axiom : axioms)
			add(axiom);
	}
	
	/**
	 * @return false if an equal axiom is already present
	 */
	public boolean add(ABoxAxiom axiom) {
		if(axiom == null)
			throw new IllegalArgumentException("Axiom cannot be null");
		return axioms.add(axiom);
	}
	
	public Set<ABoxAxiom> getAxioms() {
		return Collections.unmodifiableSet(axioms);
	}
	
	public List<ConceptAxiom> getConceptAxioms() {
		List<ConceptAxiom> conceptAxioms = new ArrayList<ConceptAxiom>();
		for(ABoxAxiom axiom : axioms)
			if(axiom.getAxiomType() == ABoxAxiomType.CONCEPT)
				conceptAxioms.add((ConceptAxiom) axiom);
		return conceptAxioms;
	}
	
	public List<RelationAxiom> getRelationAxioms() {
		List<RelationAxiom> relationAxioms = new ArrayList<RelationAxiom>();
		for(ABoxAxiom axiom : axioms)
			if(axiom.getAxiomType() == ABoxAxiomType.RELATION)
				relationAxioms.add((RelationAxiom) axiom);
		return relationAxioms;
	}
	
	public Set<Individual> getIndividuals() {
		Set<Individual> individuals = new LinkedHashSet<Individual>();
		for(ConceptAxiom axiom : getConceptAxioms())
			individuals.add(axiom.getIndividual());
		for(RelationAxiom axiom : getRelationAxioms()) {
			individuals.add(axiom.getLhs());
			individuals.add(axiom.getRhs());
		}
		return individuals;
	}
	
	/**
	 * Replaces the whole axiom set, e.g. with the result of a rewriting.
	 */
	public void replaceAxioms(Collection<? extends ABoxAxiom> newAxioms) {
		Set<ABoxAxiom> replacement = new LinkedHashSet<ABoxAxiom>();
		for(ABoxAxiom axiom : newAxioms) {
			if(axiom == null)
				throw new IllegalArgumentException("Axiom cannot be null");
			replacement.add(axiom);
		}
		axioms = replacement;
	}
	
	public int size() {
		return axioms.size();
	}
	
	public boolean isEmpty() {
		return axioms.isEmpty();
	}
	
	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder("ABox:");
		for(ABoxAxiom axiom : axioms)
			sb.append("\n  - ").append(axiom);
		return sb.toString();
	}
}
