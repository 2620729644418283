package knoelab.normalization;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.List;

import knoelab.normalization.abox.ABoxAxiom;
import knoelab.normalization.abox.ABoxParser;
import knoelab.normalization.tbox.DefinitionCycleException;
import knoelab.normalization.tbox.TBoxParser;

import org.junit.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class KBNormalizerTest {

	private static final Logger LOGGER = LoggerFactory.getLogger(KBNormalizerTest.class);
	
	private final KBNormalizer normalizer = new KBNormalizer(
			new TBoxParser("==", "->", "#", LOGGER), new ABoxParser("#", LOGGER), LOGGER);
	
	private List<String> aboxStrings(NormalizedKB kb) {
		List<String> strs = new ArrayList<String>();
		for(ABoxAxiom axiom : kb.getABox().getAxioms())
			strs.add(axiom.toString());
		return strs;
	}
	
	@Test
	public void testNormalize() throws Exception {
		String tboxStr = "# sample TBox\n" +
				"A == (or B C)\n" +
				"A -> D\n" +
				"this is not an axiom\n" +
				"E == (some r A)\n" +
				"(not D) -> (only r (not E))";
		String aboxStr = "A[x]\n" +
				"(and (C D))[x]\n" +
				"r[x,y]\n" +
				"E[";
		NormalizedKB kb = normalizer.normalize(tboxStr, aboxStr);
		
		assertEquals(1, kb.getTBoxErrors().size());
		assertEquals(4, kb.getTBoxErrors().get(0).getLineNumber());
		assertEquals(1, kb.getABoxErrors().size());
		assertEquals(4, kb.getABoxErrors().get(0).getLineNumber());
		assertTrue(kb.hasErrors());
		
		List<String> abox = aboxStrings(kb);
		assertEquals(3, abox.size());
		assertEquals("(or (B C))[x]", abox.get(0));
		assertEquals("(and (C D))[x]", abox.get(1));
		assertEquals("r[x,y]", abox.get(2));
		
		assertEquals("(and ((or ((and ((not B) (not C))) D)) " +
				"(or (D (only r (not (some r (or (B C)))))))))", 
				kb.getAggregatedInclusions().toString());
	}
	
	@Test
	public void testNormalizeWithoutInclusions() throws Exception {
		NormalizedKB kb = normalizer.normalize("A == (and (B C))", "A[x]\nB[y]");
		assertFalse(kb.hasErrors());
		assertNull(kb.getAggregatedInclusions());
		assertEquals("(and (B C))[x]", aboxStrings(kb).get(0));
		assertTrue(kb.toString().contains("GCI: none"));
	}
	
	@Test
	public void testCyclicDefinitions() {
		try {
			normalizer.normalize("A == (and (B C))\nB == A", "A[x]");
			fail("Expected a cycle");
		}
		catch(DefinitionCycleException e) {
			assertEquals(2, e.getDefinedConcepts().size());
		}
	}
}
