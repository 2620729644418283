package knoelab.normalization.owl;

import java.io.File;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import knoelab.normalization.abox.ABox;
import knoelab.normalization.abox.ABoxAxiom;
import knoelab.normalization.abox.ConceptAxiom;
import knoelab.normalization.abox.RelationAxiom;
import knoelab.normalization.concept.AtomicConcept;
import knoelab.normalization.concept.Concept;
import knoelab.normalization.concept.ConceptVisitor;
import knoelab.normalization.concept.ConjunctionConcept;
import knoelab.normalization.concept.DisjunctionConcept;
import knoelab.normalization.concept.Individual;
import knoelab.normalization.concept.NotConcept;
import knoelab.normalization.concept.OnlyConcept;
import knoelab.normalization.concept.Relation;
import knoelab.normalization.concept.SomeConcept;
import knoelab.normalization.misc.PropertyFileHandler;
import knoelab.normalization.tbox.TBox;
import knoelab.normalization.tbox.TBoxAxiom;

import org.semanticweb.owlapi.apibinding.OWLManager;
import org.semanticweb.owlapi.io.OWLFunctionalSyntaxOntologyFormat;
import org.semanticweb.owlapi.model.IRI;
import org.semanticweb.owlapi.model.OWLAxiom;
import org.semanticweb.owlapi.model.OWLClass;
import org.semanticweb.owlapi.model.OWLClassExpression;
import org.semanticweb.owlapi.model.OWLDataFactory;
import org.semanticweb.owlapi.model.OWLNamedIndividual;
import org.semanticweb.owlapi.model.OWLObjectProperty;
import org.semanticweb.owlapi.model.OWLOntology;
import org.semanticweb.owlapi.model.OWLOntologyCreationException;
import org.semanticweb.owlapi.model.OWLOntologyManager;
import org.semanticweb.owlapi.model.OWLOntologyStorageException;

/**
 * Translates concepts and axioms into their OWL counterparts:
 * <ul>
 * <li>atomic concept - OWLClass</li>
 * <li>not, and, or - ObjectComplementOf, ObjectIntersectionOf, ObjectUnionOf</li>
 * <li>only, some - ObjectAllValuesFrom, ObjectSomeValuesFrom</li>
 * <li>C == D - EquivalentClasses, C -> D - SubClassOf</li>
 * <li>C[x] - ClassAssertion, r[x,y] - ObjectPropertyAssertion</li>
 * </ul>
 * Entity IRIs are the configured prefixes followed by the names.
 */
public class OWLTranslator {

	private OWLOntologyManager manager;
	private OWLDataFactory datafactory;
	private String classPrefix;
	private String propertyPrefix;
	private String individualPrefix;
	private final ConceptVisitor<OWLClassExpression> classExpressionBuilder = 
			new ClassExpressionBuilder();
	
	public OWLTranslator() {
		this(OWLManager.createOWLOntologyManager(), 
				PropertyFileHandler.getInstance().getClassPrefix(), 
				PropertyFileHandler.getInstance().getPropertyPrefix(), 
				PropertyFileHandler.getInstance().getIndividualPrefix());
	}
	
	public OWLTranslator(OWLOntologyManager manager, String classPrefix, 
			String propertyPrefix, String individualPrefix) {
		this.manager = manager;
		datafactory = manager.getOWLDataFactory();
		this.classPrefix = classPrefix;
		this.propertyPrefix = propertyPrefix;
		this.individualPrefix = individualPrefix;
	}
	
	public OWLOntologyManager getManager() {
		return manager;
	}
	
	public OWLClass toOWLClass(AtomicConcept concept) {
		return datafactory.getOWLClass(IRI.create(classPrefix + concept.getName()));
	}
	
	public OWLObjectProperty toOWLObjectProperty(Relation relation) {
		return datafactory.getOWLObjectProperty(
				IRI.create(propertyPrefix + relation.getName()));
	}
	
	public OWLNamedIndividual toOWLNamedIndividual(Individual individual) {
		return datafactory.getOWLNamedIndividual(
				IRI.create(individualPrefix + individual.getName()));
	}
	
	public OWLClassExpression toOWLClassExpression(Concept concept) {
		return concept.accept(classExpressionBuilder);
	}
	
	public OWLAxiom toOWLAxiom(TBoxAxiom axiom) {
		OWLClassExpression lhs = toOWLClassExpression(axiom.getLhs());
		OWLClassExpression rhs = toOWLClassExpression(axiom.getRhs());
		if(axiom.isDefinition())
			return datafactory.getOWLEquivalentClassesAxiom(lhs, rhs);
		else
			return datafactory.getOWLSubClassOfAxiom(lhs, rhs);
	}
	
	public OWLAxiom toOWLAxiom(ABoxAxiom axiom) {
		switch(axiom.getAxiomType()) {
			case CONCEPT:
				ConceptAxiom conceptAxiom = (ConceptAxiom) axiom;
				return datafactory.getOWLClassAssertionAxiom(
						toOWLClassExpression(conceptAxiom.getConcept()), 
						toOWLNamedIndividual(conceptAxiom.getIndividual()));
			case RELATION:
				RelationAxiom relationAxiom = (RelationAxiom) axiom;
				return datafactory.getOWLObjectPropertyAssertionAxiom(
						toOWLObjectProperty(relationAxiom.getRelation()), 
						toOWLNamedIndividual(relationAxiom.getLhs()), 
						toOWLNamedIndividual(relationAxiom.getRhs()));
			default:
				throw new IllegalArgumentException("Unknown axiom type: " + 
						axiom.getAxiomType());
		}
	}
	
	/**
	 * Creates an ontology holding the axioms of the given TBox and ABox,
	 * with a declaration for every class, property and individual they use.
	 * Either of them can be null.
	 */
	public OWLOntology toOntology(TBox tbox, ABox abox, IRI ontologyIRI) 
			throws OWLOntologyCreationException {
		OWLOntology ontology = manager.createOntology(ontologyIRI);
		Set<AtomicConcept> atomicConcepts = new LinkedHashSet<AtomicConcept>();
		Set<Relation> relations = new LinkedHashSet<Relation>();
		if(tbox != null) {
			for(TBoxAxiom axiom : tbox.getAxioms()) {
				manager.addAxiom(ontology, toOWLAxiom(axiom));
				collectSignature(axiom.getLhs(), atomicConcepts, relations);
				collectSignature(axiom.getRhs(), atomicConcepts, relations);
			}
		}
		if(abox != null) {
			for(ABoxAxiom axiom : abox.getAxioms())
				manager.addAxiom(ontology, toOWLAxiom(axiom));
			for(ConceptAxiom axiom : abox.getConceptAxioms())
				collectSignature(axiom.getConcept(), atomicConcepts, relations);
			for(RelationAxiom axiom : abox.getRelationAxioms())
				relations.add(axiom.getRelation());
			for(Individual individual : abox.getIndividuals())
				manager.addAxiom(ontology, datafactory.getOWLDeclarationAxiom(
						toOWLNamedIndividual(individual)));
		}
		for(AtomicConcept concept : atomicConcepts)
			manager.addAxiom(ontology, datafactory.getOWLDeclarationAxiom(
					toOWLClass(concept)));
		for(Relation relation : relations)
			manager.addAxiom(ontology, datafactory.getOWLDeclarationAxiom(
					toOWLObjectProperty(relation)));
		return ontology;
	}
	
	private void collectSignature(Concept concept, Set<AtomicConcept> atomicConcepts, 
			Set<Relation> relations) {
		atomicConcepts.addAll(concept.getAtomicConcepts());
		relations.addAll(concept.getRelations());
	}
	
	public void saveOntology(OWLOntology ontology, File file) 
			throws OWLOntologyStorageException {
		manager.saveOntology(ontology, new OWLFunctionalSyntaxOntologyFormat(), 
				IRI.create(file));
	}
	
	private Set<OWLClassExpression> toOWLClassExpressions(List<Concept> concepts) {
		Set<OWLClassExpression> operands = new LinkedHashSet<OWLClassExpression>();
		for(Concept c : concepts)
			operands.add(toOWLClassExpression(c));
		return operands;
	}
	
	private class ClassExpressionBuilder implements ConceptVisitor<OWLClassExpression> {
		
		public OWLClassExpression visit(AtomicConcept concept) {
			return toOWLClass(concept);
		}
		
		public OWLClassExpression visit(NotConcept concept) {
			return datafactory.getOWLObjectComplementOf(
					toOWLClassExpression(concept.getSubconcept()));
		}
		
		public OWLClassExpression visit(ConjunctionConcept concept) {
			return datafactory.getOWLObjectIntersectionOf(
					toOWLClassExpressions(concept.getSubconcepts()));
		}
		
		public OWLClassExpression visit(DisjunctionConcept concept) {
			return datafactory.getOWLObjectUnionOf(
					toOWLClassExpressions(concept.getSubconcepts()));
		}
		
		public OWLClassExpression visit(OnlyConcept concept) {
			return datafactory.getOWLObjectAllValuesFrom(
					toOWLObjectProperty(concept.getRelation()), 
					toOWLClassExpression(concept.getSubconcept()));
		}
		
		public OWLClassExpression visit(SomeConcept concept) {
			return datafactory.getOWLObjectSomeValuesFrom(
					toOWLObjectProperty(concept.getRelation()), 
					toOWLClassExpression(concept.getSubconcept()));
		}
	}
}
