package knoelab.normalization.tbox;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.Stack;

import knoelab.normalization.concept.Concept;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Expands definitions into each other until no right-hand side mentions
 * the left-hand side of another definition.
 * <p>
 * A definition D is popped from the stack of pending definitions, its lhs 
 * is marked as applied and every other definition gets the occurrences of 
 * D's lhs in its rhs replaced by D's rhs. Pending definitions are then the 
 * ones whose lhs has not been applied yet. Each round applies one more lhs,
 * so there are at most as many rounds as definitions.
 * </p>
 * Cycles are rejected: a definition whose rhs contains its own lhs, 
 * initially or right after a substitution, lies on a cycle.
 */
public class DefinitionExpander {

	private final Logger logger;
	
	public DefinitionExpander() {
		this(LoggerFactory.getLogger(DefinitionExpander.class));
	}
	
	public DefinitionExpander(Logger logger) {
		this.logger = logger;
	}
	
	/**
	 * @param definitions definition axioms, in the order they were added
	 * @return the expanded definitions, in the same order
	 * @throws DefinitionCycleException if the definitions are cyclic
	 */
	public List<TBoxAxiom> expand(List<TBoxAxiom> definitions) 
			throws DefinitionCycleException {
		for(TBoxAxiom def : definitions) {
			if(!def.isDefinition())
				throw new IllegalArgumentException("Not a definition: " + def);
			if(def.getRhs().contains(def.getLhs()))
				throw new DefinitionCycleException(Arrays.asList(def.getLhs()));
		}
		
		List<TBoxAxiom> expandedDefs = new ArrayList<TBoxAxiom>(definitions);
		Set<Concept> appliedDefs = new HashSet<Concept>();
		Stack<TBoxAxiom> pendingDefs = new Stack<TBoxAxiom>();
		pendingDefs.addAll(expandedDefs);
		int rounds = 0;
		
		while(!pendingDefs.isEmpty()) {
			if(++rounds > definitions.size())
				throw new IllegalStateException("Definition expansion did not " +
						"terminate after " + definitions.size() + " rounds");
			TBoxAxiom def = pendingDefs.pop();
			appliedDefs.add(def.getLhs());
			logger.debug("Expanding {}", def);
			// after this round, def.lhs occurs nowhere except in def itself
			List<TBoxAxiom> updatedDefs = new ArrayList<TBoxAxiom>(expandedDefs.size());
			for(TBoxAxiom d : expandedDefs) {
				if(d.getLhs().equals(def.getLhs())) {
					updatedDefs.add(d);
					continue;
				}
				Concept rhs = d.getRhs().replaceConcept(def.getLhs(), def.getRhs());
				if(rhs.contains(d.getLhs()))
					throw new DefinitionCycleException(
							Arrays.asList(d.getLhs(), def.getLhs()));
				updatedDefs.add(new TBoxAxiom(TBoxAxiomType.DEFINITION, 
						d.getLhs(), rhs));
			}
			expandedDefs = updatedDefs;
			
			pendingDefs.clear();
			for(TBoxAxiom d : expandedDefs)
				if(!appliedDefs.contains(d.getLhs()))
					pendingDefs.push(d);
		}
		logger.debug("Definitions expanded in {} rounds", rounds);
		return expandedDefs;
	}
}
