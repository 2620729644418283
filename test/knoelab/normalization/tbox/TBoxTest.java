package knoelab.normalization.tbox;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.List;

import knoelab.normalization.abox.ABox;
import knoelab.normalization.abox.ABoxAxiom;
import knoelab.normalization.abox.ABoxParser;
import knoelab.normalization.concept.AtomicConcept;
import knoelab.normalization.concept.ConjunctionConcept;
import knoelab.normalization.concept.Concept;

import org.junit.Test;
import org.slf4j.LoggerFactory;

public class TBoxTest {

	private final TBoxParser tboxParser = new TBoxParser("==", "->", "#", 
			LoggerFactory.getLogger(TBoxTest.class));
	private final ABoxParser aboxParser = new ABoxParser("#", 
			LoggerFactory.getLogger(TBoxTest.class));
	
	private TBox parse(String tboxStr) {
		return tboxParser.parse(tboxStr).getResult();
	}
	
	private List<String> toStrings(Iterable<?> axioms) {
		List<String> strs = new ArrayList<String>();
		for(Object axiom : axioms)
			strs.add(axiom.toString());
		return strs;
	}
	
	@Test
	public void testEndToEnd() throws Exception {
		TBox tbox = parse("A == (or B C)\nA -> D");
		ABox abox = aboxParser.parse("A[x]\nr[x,y]").getResult();
		
		tbox.expandAllDefinitions();
		assertEquals(TBoxState.EXPANDED, tbox.getState());
		tbox.applyDefinitionsToABox(abox);
		tbox.applyDefinitionsToInclusions();
		assertEquals(TBoxState.PROPAGATED, tbox.getState());
		
		assertEquals("(or (B C)) -> D", tbox.getInclusions().get(0).toString());
		List<String> aboxAxioms = toStrings(abox.getAxioms());
		assertEquals("(or (B C))[x]", aboxAxioms.get(0));
		assertEquals("r[x,y]", aboxAxioms.get(1));
		
		ConjunctionConcept gci = tbox.aggregateInclusions();
		assertEquals("(and ((or ((and ((not B) (not C))) D))))", gci.toString());
	}
	
	@Test
	public void testExpansionKeepsAxiomOrder() throws Exception {
		TBox tbox = parse("A == (and (B C))\nE -> A\nB == (some r D)");
		tbox.expandAllDefinitions();
		assertEquals(3, tbox.size());
		List<String> axioms = toStrings(tbox.getAxioms());
		assertEquals("A == (and ((some r D) C))", axioms.get(0));
		assertEquals("E -> A", axioms.get(1));
		assertEquals("B == (some r D)", axioms.get(2));
	}
	
	@Test
	public void testDefinitionsAppliedToBothSides() throws Exception {
		TBox tbox = parse("A == (and (B C))\nB == (not D)\n" +
				"(some r A) -> (or (B E))\nE -> F");
		tbox.expandAllDefinitions();
		tbox.applyDefinitionsToInclusions();
		assertEquals(2, tbox.getDefinitions().size());
		List<String> inclusions = toStrings(tbox.getInclusions());
		assertEquals("(some r (and ((not D) C))) -> (or ((not D) E))", inclusions.get(0));
		assertEquals("E -> F", inclusions.get(1));
	}
	
	@Test
	public void testAggregation() throws Exception {
		TBox tbox = parse("(and (A B)) -> C\n(some r A) -> (only s B)");
		ConjunctionConcept gci = tbox.aggregateInclusions();
		assertEquals(2, gci.getSubconcepts().size());
		assertEquals("(and ((or ((or ((not A) (not B))) C)) " +
				"(or ((only r (not A)) (only s B)))))", gci.toString());
		assertTrue(gci.isNNF());
	}
	
	@Test
	public void testAggregationWithoutInclusions() throws Exception {
		TBox tbox = parse("A == B");
		tbox.expandAllDefinitions();
		tbox.applyDefinitionsToInclusions();
		assertNull(tbox.aggregateInclusions());
		assertNull(new TBox().aggregateInclusions());
	}
	
	@Test
	public void testCyclicDefinitionsLeaveTBoxUnchanged() {
		TBox tbox = parse("A == (and (B C))\nB == A\nC -> A");
		List<String> before = toStrings(tbox.getAxioms());
		try {
			tbox.expandAllDefinitions();
			fail("Expected a cycle");
		}
		catch(DefinitionCycleException e) {
			assertEquals(before, toStrings(tbox.getAxioms()));
			assertEquals(TBoxState.PARSED, tbox.getState());
		}
	}
	
	@Test
	public void testDefinedConcepts() {
		TBox tbox = parse("A == B\nC -> D\n(not E) == F");
		List<Concept> defined = new ArrayList<Concept>(tbox.getDefinedConcepts());
		assertEquals(2, defined.size());
		assertEquals(new AtomicConcept("A"), defined.get(0));
		assertEquals("(not E)", defined.get(1).toString());
	}
	
	@Test
	public void testOperationOrderIsEnforced() throws Exception {
		TBox tbox = parse("A == B\nA -> C");
		try {
			tbox.applyDefinitionsToInclusions();
			fail("Inclusions rewritten before expansion");
		}
		catch(IllegalStateException e) {
			// expected
		}
		try {
			tbox.applyDefinitionsToABox(new ABox());
			fail("ABox rewritten before expansion");
		}
		catch(IllegalStateException e) {
			// expected
		}
		try {
			tbox.aggregateInclusions();
			fail("Inclusions aggregated before propagation");
		}
		catch(IllegalStateException e) {
			// expected
		}
		
		tbox.expandAllDefinitions();
		try {
			tbox.add(tboxParser.parseAxiom("D -> E"));
			fail("Axiom added after expansion");
		}
		catch(IllegalStateException e) {
			// expected
		}
		
		tbox.applyDefinitionsToInclusions();
		try {
			tbox.expandAllDefinitions();
			fail("Definitions expanded after propagation");
		}
		catch(IllegalStateException e) {
			// expected
		}
	}
	
	@Test
	public void testABoxRelationAxiomsUntouched() throws Exception {
		TBox tbox = parse("r == B");
		tbox.expandAllDefinitions();
		ABox abox = aboxParser.parse("r[x,y]\n(some r r)[x]").getResult();
		tbox.applyDefinitionsToABox(abox);
		List<String> axioms = new ArrayList<String>();
		for(ABoxAxiom axiom : abox.getAxioms())
			axioms.add(axiom.toString());
		assertEquals("r[x,y]", axioms.get(0));
		assertEquals("(some r B)[x]", axioms.get(1));
	}
}
