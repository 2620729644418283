package knoelab.normalization.tbox;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.List;

import knoelab.normalization.concept.AtomicConcept;
import knoelab.normalization.concept.DisjunctionConcept;
import knoelab.normalization.parser.ConceptParseException;
import knoelab.normalization.parser.LineError;
import knoelab.normalization.parser.ParseStatus;

import org.junit.Test;
import org.slf4j.LoggerFactory;

public class TBoxParserTest {

	private final TBoxParser parser = new TBoxParser("==", "->", "#", 
			LoggerFactory.getLogger(TBoxParserTest.class));
	
	@Test
	public void testDefinition() throws Exception {
		TBoxAxiom axiom = parser.parseAxiom("A == (or B C)");
		assertTrue(axiom.isDefinition());
		assertEquals(new AtomicConcept("A"), axiom.getLhs());
		assertEquals(new DisjunctionConcept(new AtomicConcept("B"), 
				new AtomicConcept("C")), axiom.getRhs());
		assertEquals("A == (or (B C))", axiom.toString());
	}
	
	@Test
	public void testInclusion() throws Exception {
		TBoxAxiom axiom = parser.parseAxiom("  (some r A)->B ");
		assertTrue(axiom.isInclusion());
		assertEquals("(some r A) -> B", axiom.toString());
	}
	
	@Test
	public void testSidesAreInNNF() throws Exception {
		TBoxAxiom axiom = parser.parseAxiom("(not (and (A B))) -> (not (some r (not C)))");
		assertEquals("(or ((not A) (not B))) -> (only r C)", axiom.toString());
		assertTrue(axiom.getLhs().isNNF());
		assertTrue(axiom.getRhs().isNNF());
	}
	
	@Test
	public void testDefinitionSymbolTakesPrecedence() throws Exception {
		// the rhs "B -> C" is not a concept, so the line is not an inclusion
		try {
			parser.parseAxiom("A == B -> C");
			fail("Expected a parse error");
		}
		catch(ConceptParseException e) {
			assertEquals("B -> C", e.getParsedString());
		}
	}
	
	@Test
	public void testMalformedAxioms() {
		String[] malformed = {
				"A", "A = B", "== B", "A ->", " -> ", "A -> (and", "A == B == C", 
				"(and (A B) -> C"
		};
		for(String str : malformed) {
			try {
				TBoxAxiom axiom = parser.parseAxiom(str);
				fail("Parsed '" + str + "' as " + axiom);
			}
			catch(ConceptParseException e) {
				// expected
			}
		}
	}
	
	@Test
	public void testParseKeepsGoingAfterErrors() {
		String tboxStr = "# definitions\n" +
				"A == (and (B C))\n" +
				"A ==\n" +
				"\n" +
				"B -> (some r D)\n" +
				"B -> (some r D)\n" +
				"C -> \n" +
				"D -> (only r (not E))";
		ParseStatus<TBox> status = parser.parse(tboxStr);
		TBox tbox = status.getResult();
		assertEquals(TBoxState.PARSED, tbox.getState());
		assertEquals(3, tbox.size());
		assertEquals(1, tbox.getDefinitions().size());
		assertEquals(2, tbox.getInclusions().size());
		
		List<LineError> errors = status.getErrors();
		assertEquals(2, errors.size());
		assertEquals(3, errors.get(0).getLineNumber());
		assertEquals(7, errors.get(1).getLineNumber());
		assertEquals("C -> ", errors.get(1).getLine());
	}
	
	@Test
	public void testAxiomTextReadsBack() throws Exception {
		String[] lines = {"C -> A-B", "(some r#1 A=B) == (only s C)", "A#1 -> (not D)"};
		for(String line : lines) {
			TBoxAxiom axiom = parser.parseAxiom(line);
			assertEquals(axiom, parser.parseAxiom(axiom.toString()));
		}
	}
	
	static String deeplyNested(int levels) {
		StringBuilder sb = new StringBuilder();
		for(int i=0; i<levels; i++)
			sb.append("(not ");
		sb.append("B");
		for(int i=0; i<levels; i++)
			sb.append(")");
		return sb.toString();
	}
	
	@Test
	public void testDeeplyNestedLineDoesNotStopParsing() {
		ParseStatus<TBox> status = parser.parse("X -> Y\nA -> " + 
				deeplyNested(20000) + "\nZ -> W");
		TBox tbox = status.getResult();
		assertEquals(2, tbox.size());
		assertEquals("X -> Y", tbox.getInclusions().get(0).toString());
		assertEquals("Z -> W", tbox.getInclusions().get(1).toString());
		assertEquals(1, status.getErrors().size());
		LineError error = status.getErrors().get(0);
		assertEquals(2, error.getLineNumber());
		assertTrue(error.getMessage().startsWith("Nesting too deep"));
	}
	
	@Test
	public void testModeratelyNestedLineIsAccepted() throws Exception {
		TBoxAxiom axiom = parser.parseAxiom("A -> " + deeplyNested(100));
		assertEquals("A -> B", axiom.toString());
	}
	
	@Test
	public void testCustomSymbols() throws Exception {
		TBoxParser customParser = new TBoxParser("=", "<", "//", 
				LoggerFactory.getLogger(TBoxParserTest.class));
		assertTrue(customParser.parseAxiom("A = B").isDefinition());
		assertTrue(customParser.parseAxiom("A < B").isInclusion());
		ParseStatus<TBox> status = customParser.parse("// A = B\nA < B");
		assertEquals(1, status.getResult().size());
	}
}
