package knoelab.normalization.parser;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.List;

import knoelab.normalization.concept.AtomicConcept;
import knoelab.normalization.concept.Concept;
import knoelab.normalization.concept.ConceptType;
import knoelab.normalization.concept.ConjunctionConcept;
import knoelab.normalization.concept.DisjunctionConcept;
import knoelab.normalization.concept.NotConcept;
import knoelab.normalization.concept.OnlyConcept;
import knoelab.normalization.concept.Relation;
import knoelab.normalization.concept.SomeConcept;

import org.junit.Test;
import org.slf4j.LoggerFactory;

public class ConceptParserTest {

	private final ConceptParser parser = new ConceptParser();
	
	private static final AtomicConcept A = new AtomicConcept("A");
	private static final AtomicConcept B = new AtomicConcept("B");
	private static final AtomicConcept C = new AtomicConcept("C");
	
	@Test
	public void testAtomic() throws Exception {
		assertEquals(A, parser.parseConcept("A"));
		assertEquals(A, parser.parseConcept("  (( A ))  "));
		// keywords are whole tokens only
		assertEquals(new AtomicConcept("android"), parser.parseConcept("android"));
		assertEquals(new AtomicConcept("nothing"), parser.parseConcept("nothing"));
		assertEquals(new AtomicConcept("someone"), parser.parseConcept("someone"));
	}
	
	@Test
	public void testNot() throws Exception {
		assertEquals(new NotConcept(A), parser.parseConcept("not A"));
		assertEquals(new NotConcept(A), parser.parseConcept("(not (A))"));
		assertEquals(new NotConcept(new NotConcept(A)), parser.parseConcept("not not A"));
	}
	
	@Test
	public void testBracketedOperandList() throws Exception {
		Concept c = parser.parseConcept("(and (C D))");
		assertEquals(ConceptType.AND, c.getConceptType());
		assertEquals(new ConjunctionConcept(C, new AtomicConcept("D")), c);
		assertEquals(new DisjunctionConcept(new NotConcept(A), B), 
				parser.parseConcept("or ((not A) B)"));
		assertEquals(new ConjunctionConcept(A), parser.parseConcept("and (A)"));
	}
	
	@Test
	public void testPlainOperandList() throws Exception {
		assertEquals(new DisjunctionConcept(B, C), parser.parseConcept("(or B C)"));
		assertEquals(new ConjunctionConcept(new NotConcept(A), B), 
				parser.parseConcept("and (not A) B"));
		// a single group starting with a keyword is one operand
		assertEquals(new ConjunctionConcept(new NotConcept(A)), 
				parser.parseConcept("and (not A)"));
	}
	
	@Test
	public void testNestedOperands() throws Exception {
		Concept expected = new ConjunctionConcept(new DisjunctionConcept(A, 
				new ConjunctionConcept(B, C)), new SomeConcept(new Relation("r"), A));
		assertEquals(expected, 
				parser.parseConcept("and ((or (A (and (B C)))) (some r A))"));
	}
	
	@Test
	public void testSingleCharacterRelation() throws Exception {
		Concept only = parser.parseConcept("only r C");
		assertEquals(new OnlyConcept(new Relation("r"), C), only);
		assertEquals("r", ((OnlyConcept) only).getRelation().getName());
		assertEquals(new SomeConcept(new Relation("s"), new NotConcept(C)), 
				parser.parseConcept("(some s (not C))"));
	}
	
	@Test
	public void testRelationToken() throws Exception {
		assertEquals(new SomeConcept(new Relation("hasChild"), 
				new ConjunctionConcept(A, B)), 
				parser.parseConcept("some hasChild (and (A B))"));
		assertEquals(new OnlyConcept(new Relation("r"), A), 
				parser.parseConcept("only r(A)"));
	}
	
	@Test
	public void testRoundTrip() throws Exception {
		Relation r = new Relation("r");
		List<Concept> concepts = Arrays.<Concept>asList(
				A,
				new NotConcept(A),
				new ConjunctionConcept(A),
				new ConjunctionConcept(new NotConcept(A)),
				new DisjunctionConcept(new ConjunctionConcept(A, B), new NotConcept(
						new NotConcept(C)), new OnlyConcept(r, A)),
				new SomeConcept(r, new OnlyConcept(new Relation("hasPart"), 
						new DisjunctionConcept(new NotConcept(B)))),
				new NotConcept(new ConjunctionConcept(new SomeConcept(r, 
						new ConjunctionConcept(A)), C)));
		for(Concept c : concepts)
			assertEquals(c, parser.parseConcept(c.toString()));
	}
	
	@Test
	public void testSplitConcepts() throws Exception {
		assertEquals(Arrays.asList("C"), ConceptParser.splitConcepts("C"));
		assertEquals(Arrays.asList("A", "(not B)", "(and (C (or (D E))))"), 
				ConceptParser.splitConcepts(" A  (not B) (and (C (or (D E))))"));
	}
	
	@Test
	public void testMalformedConcepts() {
		String[] malformed = {
				"", "   ", "(", "(A", "A)", "()", "(A) B", "C D", 
				"not", "and", "or ()", "and (A (B)", "some r", "only", 
				"only (r) A", "some r )", "and (C D) E"
		};
		for(String str : malformed) {
			try {
				Concept c = parser.parseConcept(str);
				fail("Parsed '" + str + "' as " + c);
			}
			catch(ConceptParseException e) {
				// expected
			}
		}
	}
	
	@Test
	public void testErrorCarriesOffendingText() {
		try {
			parser.parseConcept("and (A (not))");
			fail();
		}
		catch(ConceptParseException e) {
			assertEquals("not", e.getParsedString());
		}
	}
	
	@Test
	public void testNestingLimit() throws Exception {
		ConceptParser shallowParser = new ConceptParser(
				LoggerFactory.getLogger(ConceptParserTest.class), 4);
		assertEquals(new NotConcept(new NotConcept(A)), 
				shallowParser.parseConcept("not not A"));
		assertEquals(new SomeConcept(new Relation("r"), new NotConcept(A)), 
				shallowParser.parseConcept("(some r (not A))"));
		String[] tooDeep = {"not not not not not A", "(((((A)))))", 
				"and ((or ((not (not A)))))"};
		for(String str : tooDeep) {
			try {
				Concept concept = shallowParser.parseConcept(str);
				fail("Parsed '" + str + "' as " + concept);
			}
			catch(ConceptParseException e) {
				assertTrue(e.getMessage().startsWith("Nesting too deep"));
			}
		}
	}
	
	@Test
	public void testLongTextIsCutInMessage() {
		StringBuilder sb = new StringBuilder("C");
		for(int i=0; i<200; i++)
			sb.append(" D");
		try {
			parser.parseConcept(sb.toString());
			fail("Expected a parse error");
		}
		catch(ConceptParseException e) {
			assertEquals(sb.toString(), e.getParsedString());
			assertTrue(e.getMessage().endsWith("...'"));
		}
	}
	
	@Test(expected = ConceptParseException.class)
	public void testSplitUnbalanced() throws Exception {
		ConceptParser.splitConcepts("(A B");
	}
	
	@Test(expected = ConceptParseException.class)
	public void testSplitEmpty() throws Exception {
		ConceptParser.splitConcepts("   ");
	}
}
