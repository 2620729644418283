package knoelab.normalization.owl;

import java.io.File;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import knoelab.normalization.abox.ABox;
import knoelab.normalization.abox.ConceptAxiom;
import knoelab.normalization.abox.RelationAxiom;
import knoelab.normalization.concept.AtomicConcept;
import knoelab.normalization.concept.Concept;
import knoelab.normalization.concept.ConjunctionConcept;
import knoelab.normalization.concept.DisjunctionConcept;
import knoelab.normalization.concept.Individual;
import knoelab.normalization.concept.NotConcept;
import knoelab.normalization.concept.OnlyConcept;
import knoelab.normalization.concept.Relation;
import knoelab.normalization.concept.SomeConcept;
import knoelab.normalization.concept.UnsupportedConstructException;
import knoelab.normalization.parser.LineError;
import knoelab.normalization.parser.ParseStatus;
import knoelab.normalization.tbox.TBox;
import knoelab.normalization.tbox.TBoxAxiom;
import knoelab.normalization.tbox.TBoxAxiomType;

import org.semanticweb.owlapi.apibinding.OWLManager;
import org.semanticweb.owlapi.model.IRI;
import org.semanticweb.owlapi.model.OWLClass;
import org.semanticweb.owlapi.model.OWLClassAssertionAxiom;
import org.semanticweb.owlapi.model.OWLClassExpression;
import org.semanticweb.owlapi.model.OWLEntity;
import org.semanticweb.owlapi.model.OWLEquivalentClassesAxiom;
import org.semanticweb.owlapi.model.OWLIndividual;
import org.semanticweb.owlapi.model.OWLLogicalAxiom;
import org.semanticweb.owlapi.model.OWLObjectAllValuesFrom;
import org.semanticweb.owlapi.model.OWLObjectComplementOf;
import org.semanticweb.owlapi.model.OWLObjectIntersectionOf;
import org.semanticweb.owlapi.model.OWLObjectPropertyAssertionAxiom;
import org.semanticweb.owlapi.model.OWLObjectPropertyExpression;
import org.semanticweb.owlapi.model.OWLObjectSomeValuesFrom;
import org.semanticweb.owlapi.model.OWLObjectUnionOf;
import org.semanticweb.owlapi.model.OWLOntology;
import org.semanticweb.owlapi.model.OWLOntologyCreationException;
import org.semanticweb.owlapi.model.OWLOntologyManager;
import org.semanticweb.owlapi.model.OWLSubClassOfAxiom;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a TBox and an ABox from the logical axioms of an OWL ontology.
 * Only the constructors of the concept algebra are accepted; any other 
 * class expression or axiom type is reported as an error for that axiom
 * and loading goes on with the rest. Entity names are the IRI fragments.
 * <p>
 * Axioms are visited in the OWL API's own sort order; the "line number" of 
 * an error is the 1-based position of the axiom in that order.
 * </p>
 */
public class OWLAxiomLoader {

	private OWLOntologyManager manager;
	private final Logger logger;
	
	public OWLAxiomLoader() {
		this(OWLManager.createOWLOntologyManager(), 
				LoggerFactory.getLogger(OWLAxiomLoader.class));
	}
	
	public OWLAxiomLoader(OWLOntologyManager manager, Logger logger) {
		this.manager = manager;
		this.logger = logger;
	}
	
	public OWLOntology loadOntology(File ontoFile) throws OWLOntologyCreationException {
		IRI documentIRI = IRI.create(ontoFile);
		OWLOntology ontology = manager.loadOntologyFromOntologyDocument(documentIRI);
		logger.info("Loaded {} logical axioms from {}", 
				ontology.getLogicalAxiomCount(), ontoFile);
		return ontology;
	}
	
	private List<OWLLogicalAxiom> getSortedAxioms(OWLOntology ontology) {
		List<OWLLogicalAxiom> axioms = 
				new ArrayList<OWLLogicalAxiom>(ontology.getLogicalAxioms());
		Collections.sort(axioms);
		return axioms;
	}
	
	/**
	 * Collects SubClassOf and EquivalentClasses axioms. Assertions are left
	 * to {@link #loadABox(OWLOntology)}; every other axiom type is an error.
	 */
	public ParseStatus<TBox> loadTBox(OWLOntology ontology) {
		TBox tbox = new TBox(logger);
		List<LineError> errors = new ArrayList<LineError>();
		List<OWLLogicalAxiom> axioms = getSortedAxioms(ontology);
		for(int i=0; i<axioms.size(); i++) {
			OWLLogicalAxiom ax = axioms.get(i);
			try {
				if(ax instanceof OWLSubClassOfAxiom) {
					OWLSubClassOfAxiom subClassAxiom = (OWLSubClassOfAxiom) ax;
					tbox.add(new TBoxAxiom(TBoxAxiomType.INCLUSION, 
							toConcept(subClassAxiom.getSubClass()).convertToNNF(), 
							toConcept(subClassAxiom.getSuperClass()).convertToNNF()));
				}
				else if(ax instanceof OWLEquivalentClassesAxiom) {
					// C1 == C2, C1 == C3, ... for more than two expressions
					List<OWLClassExpression> classExpressions = 
						((OWLEquivalentClassesAxiom) ax).getClassExpressionsAsList();
					Concept lhs = toConcept(classExpressions.get(0)).convertToNNF();
					for(int j=1; j<classExpressions.size(); j++)
						tbox.add(new TBoxAxiom(TBoxAxiomType.DEFINITION, lhs, 
								toConcept(classExpressions.get(j)).convertToNNF()));
				}
				else if(ax instanceof OWLClassAssertionAxiom || 
						ax instanceof OWLObjectPropertyAssertionAxiom)
					continue;
				else
					throw new UnsupportedConstructException(ax.toString(), 
							"Unsupported axiom type " + ax.getAxiomType());
			}
			catch(UnsupportedConstructException e) {
				logger.warn("Skipping axiom {}, unsupported: {}", i + 1, 
						e.getConstruct());
				errors.add(new LineError(i + 1, ax.toString(), e.getMessage()));
			}
		}
		logger.info("Loaded TBox: {} axioms, {} rejected", tbox.size(), errors.size());
		return new ParseStatus<TBox>(tbox, errors);
	}
	
	/**
	 * Collects ClassAssertion and ObjectPropertyAssertion axioms, 
	 * silently skipping everything else.
	 */
	public ParseStatus<ABox> loadABox(OWLOntology ontology) {
		ABox abox = new ABox();
		List<LineError> errors = new ArrayList<LineError>();
		List<OWLLogicalAxiom> axioms = getSortedAxioms(ontology);
		for(int i=0; i<axioms.size(); i++) {
			OWLLogicalAxiom ax = axioms.get(i);
			try {
				if(ax instanceof OWLClassAssertionAxiom) {
					OWLClassAssertionAxiom classAssertion = (OWLClassAssertionAxiom) ax;
					abox.add(new ConceptAxiom(
							toConcept(classAssertion.getClassExpression()), 
							toIndividual(classAssertion.getIndividual())));
				}
				else if(ax instanceof OWLObjectPropertyAssertionAxiom) {
					OWLObjectPropertyAssertionAxiom propertyAssertion = 
							(OWLObjectPropertyAssertionAxiom) ax;
					abox.add(new RelationAxiom(
							toRelation(propertyAssertion.getProperty()), 
							toIndividual(propertyAssertion.getSubject()), 
							toIndividual(propertyAssertion.getObject())));
				}
			}
			catch(UnsupportedConstructException e) {
				logger.warn("Skipping axiom {}, unsupported: {}", i + 1, 
						e.getConstruct());
				errors.add(new LineError(i + 1, ax.toString(), e.getMessage()));
			}
		}
		logger.info("Loaded ABox: {} axioms, {} rejected", abox.size(), errors.size());
		return new ParseStatus<ABox>(abox, errors);
	}
	
	public Concept toConcept(OWLClassExpression oce) {
		if(oce.isOWLThing() || oce.isOWLNothing())
			throw new UnsupportedConstructException(oce.toString(), 
					"Top and bottom concepts are not supported");
		else if(oce instanceof OWLClass) {
			String name = getName((OWLClass) oce);
			if(!AtomicConcept.isValidName(name))
				throw new UnsupportedConstructException(oce.toString(), 
						"Class name cannot be used as an atomic concept");
			return new AtomicConcept(name);
		}
		else if(oce instanceof OWLObjectComplementOf)
			return new NotConcept(toConcept(((OWLObjectComplementOf) oce).getOperand()));
		else if(oce instanceof OWLObjectIntersectionOf)
			return new ConjunctionConcept(
					toConcepts(((OWLObjectIntersectionOf) oce).getOperands()));
		else if(oce instanceof OWLObjectUnionOf)
			return new DisjunctionConcept(
					toConcepts(((OWLObjectUnionOf) oce).getOperands()));
		else if(oce instanceof OWLObjectAllValuesFrom) {
			OWLObjectAllValuesFrom oav = (OWLObjectAllValuesFrom) oce;
			return new OnlyConcept(toRelation(oav.getProperty()), 
					toConcept(oav.getFiller()));
		}
		else if(oce instanceof OWLObjectSomeValuesFrom) {
			OWLObjectSomeValuesFrom osv = (OWLObjectSomeValuesFrom) oce;
			return new SomeConcept(toRelation(osv.getProperty()), 
					toConcept(osv.getFiller()));
		}
		else
			throw new UnsupportedConstructException(oce.toString(), 
					"Unsupported class expression " + oce.getClass().getSimpleName());
	}
	
	private List<Concept> toConcepts(Set<OWLClassExpression> operands) {
		List<Concept> concepts = new ArrayList<Concept>(operands.size());
		for(OWLClassExpression operand : operands)
			concepts.add(toConcept(operand));
		return concepts;
	}
	
	private Relation toRelation(OWLObjectPropertyExpression ope) {
		if(ope.isAnonymous())
			throw new UnsupportedConstructException(ope.toString(), 
					"Unsupported property expression");
		String name = getName(ope.asOWLObjectProperty());
		if(!Relation.isValidName(name))
			throw new UnsupportedConstructException(ope.toString(), 
					"Property name cannot be used as a relation");
		return new Relation(name);
	}
	
	private Individual toIndividual(OWLIndividual individual) {
		if(individual.isAnonymous())
			throw new UnsupportedConstructException(individual.toString(), 
					"Anonymous individuals are not supported");
		String name = getName(individual.asOWLNamedIndividual());
		if(!Relation.isValidName(name))
			throw new UnsupportedConstructException(individual.toString(), 
					"Individual name cannot be used");
		return new Individual(name);
	}
	
	private String getName(OWLEntity entity) {
		IRI iri = entity.getIRI();
		String fragment = iri.getFragment();
		if(fragment == null || fragment.isEmpty())
			return iri.toString();
		return fragment;
	}
}
