package knoelab.normalization.tbox;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import knoelab.normalization.abox.ABox;
import knoelab.normalization.abox.ABoxAxiom;
import knoelab.normalization.abox.ABoxAxiomType;
import knoelab.normalization.abox.ConceptAxiom;
import knoelab.normalization.concept.Concept;
import knoelab.normalization.concept.ConjunctionConcept;
import knoelab.normalization.concept.DisjunctionConcept;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Set of concept-level axioms (definitions and inclusions), keyed by their
 * canonical text and iterated in insertion order.
 * <p>
 * The operations have to run in this order:
 * {@link #expandAllDefinitions()}, then {@link #applyDefinitionsToInclusions()}
 * (and {@link #applyDefinitionsToABox(ABox)} for every ABox), then 
 * {@link #aggregateInclusions()}. Each step replaces the axiom set as a whole.
 * </p>
 */
public class TBox {

	private Set<TBoxAxiom> axioms;
	private TBoxState state;
	private final Logger logger;
	
	public TBox() {
		this(LoggerFactory.getLogger(TBox.class));
	}
	
	public TBox(Logger logger) {
		this.logger = logger;
		axioms = new LinkedHashSet<TBoxAxiom>();
		state = TBoxState.PARSED;
	}
	
	/**
	 * @return false if an equal axiom is already present
	 */
	public boolean add(TBoxAxiom axiom) {
		if(axiom == null)
			throw new IllegalArgumentException("Axiom cannot be null");
		if(state != TBoxState.PARSED)
			throw new IllegalStateException("Cannot add axioms to a TBox in state " 
					+ state);
		return axioms.add(axiom);
	}
	
	public TBoxState getState() {
		return state;
	}
	
	public Set<TBoxAxiom> getAxioms() {
		return Collections.unmodifiableSet(axioms);
	}
	
	public List<TBoxAxiom> getDefinitions() {
		return getAxioms(TBoxAxiomType.DEFINITION);
	}
	
	public List<TBoxAxiom> getInclusions() {
		return getAxioms(TBoxAxiomType.INCLUSION);
	}
	
	private List<TBoxAxiom> getAxioms(TBoxAxiomType type) {
		List<TBoxAxiom> typedAxioms = new ArrayList<TBoxAxiom>();
		for(TBoxAxiom axiom : axioms)
			if(axiom.getAxiomType() == type)
				typedAxioms.add(axiom);
		return typedAxioms;
	}
	
	/**
	 * @return left-hand sides of all definitions
	 */
	public Set<Concept> getDefinedConcepts() {
		Set<Concept> definedConcepts = new LinkedHashSet<Concept>();
		for(TBoxAxiom def : getDefinitions())
			definedConcepts.add(def.getLhs());
		return definedConcepts;
	}
	
	public int size() {
		return axioms.size();
	}
	
	/**
	 * Expands all the definitions in such a way that no definition is
	 * used inside another definition. The TBox is left unchanged if the 
	 * definitions are cyclic.
	 */
	public void expandAllDefinitions() throws DefinitionCycleException {
		if(state == TBoxState.PROPAGATED)
			throw new IllegalStateException("Definitions have already been propagated");
		logger.info("Expanding TBox definitions...");
		List<TBoxAxiom> expandedDefs = 
				new DefinitionExpander(logger).expand(getDefinitions());
		
		// keep the position of every axiom; definitions are matched by index
		Set<TBoxAxiom> updatedAxioms = new LinkedHashSet<TBoxAxiom>();
		int defIndex = 0;
		for(TBoxAxiom axiom : axioms) {
			if(axiom.isDefinition())
				updatedAxioms.add(expandedDefs.get(defIndex++));
			else
				updatedAxioms.add(axiom);
		}
		axioms = updatedAxioms;
		state = TBoxState.EXPANDED;
	}
	
	/**
	 * Folds all the (expanded) definitions over the given concept.
	 */
	private Concept applyDefinitions(Concept concept, List<TBoxAxiom> definitions) {
		Concept replacedConcept = concept;
		for(TBoxAxiom def : definitions)
			replacedConcept = replacedConcept.replaceConcept(def.getLhs(), def.getRhs());
		return replacedConcept;
	}
	
	private void checkExpanded() {
		if(state == TBoxState.PARSED)
			throw new IllegalStateException("Definitions have to be expanded first");
	}
	
	/**
	 * Replaces every defined concept in the concept assertions of the given
	 * ABox by its definition. Relation assertions are kept as they are.
	 */
	public void applyDefinitionsToABox(ABox abox) {
		checkExpanded();
		logger.info("Applying expanded TBox definitions to an ABox...");
		List<TBoxAxiom> definitions = getDefinitions();
		List<ABoxAxiom> replacedAxioms = new ArrayList<ABoxAxiom>(abox.size());
		for(ABoxAxiom axiom : abox.getAxioms()) {
			if(axiom.getAxiomType() == ABoxAxiomType.CONCEPT) {
				ConceptAxiom conceptAxiom = (ConceptAxiom) axiom;
				replacedAxioms.add(new ConceptAxiom(
						applyDefinitions(conceptAxiom.getConcept(), definitions), 
						conceptAxiom.getIndividual()));
			}
			else
				replacedAxioms.add(axiom);
		}
		abox.replaceAxioms(replacedAxioms);
	}
	
	/**
	 * Replaces every defined concept on both sides of every inclusion
	 * by its definition.
	 */
	public void applyDefinitionsToInclusions() {
		checkExpanded();
		logger.info("Applying expanded TBox definitions to GCIs...");
		List<TBoxAxiom> definitions = getDefinitions();
		Set<TBoxAxiom> updatedAxioms = new LinkedHashSet<TBoxAxiom>();
		for(TBoxAxiom axiom : axioms) {
			if(axiom.isInclusion()) 
				updatedAxioms.add(new TBoxAxiom(TBoxAxiomType.INCLUSION, 
						applyDefinitions(axiom.getLhs(), definitions), 
						applyDefinitions(axiom.getRhs(), definitions)));
			else
				updatedAxioms.add(axiom);
		}
		axioms = updatedAxioms;
		state = TBoxState.PROPAGATED;
	}
	
	/**
	 * Turns every inclusion C -> D into (or ((not C) D)), with (not C) in NNF,
	 * and conjoins all of them.
	 * 
	 * @return the conjunction, or null if there are no inclusions
	 */
	public ConjunctionConcept aggregateInclusions() {
		if(state != TBoxState.PROPAGATED && !getDefinitions().isEmpty())
			throw new IllegalStateException("Definitions have to be applied " +
					"to the inclusions first");
		logger.info("Aggregating GCIs into a single one...");
		List<TBoxAxiom> inclusions = getInclusions();
		if(inclusions.isEmpty())
			return null;
		
		List<Concept> subconcepts = new ArrayList<Concept>(inclusions.size());
		for(TBoxAxiom inclusion : inclusions)
			subconcepts.add(new DisjunctionConcept(
					inclusion.getLhs().negate().convertToNNF(), 
					inclusion.getRhs()));
		return new ConjunctionConcept(subconcepts);
	}
	
	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder("TBox:");
		for(TBoxAxiom axiom : axioms)
			sb.append("\n  - ").append(axiom);
		return sb.toString();
	}
}
