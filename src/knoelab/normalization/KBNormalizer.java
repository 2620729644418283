package knoelab.normalization;

import java.io.File;
import java.io.IOException;

import knoelab.normalization.abox.ABox;
import knoelab.normalization.abox.ABoxParser;
import knoelab.normalization.concept.ConjunctionConcept;
import knoelab.normalization.misc.PropertyFileHandler;
import knoelab.normalization.misc.Util;
import knoelab.normalization.owl.OWLTranslator;
import knoelab.normalization.parser.ParseStatus;
import knoelab.normalization.tbox.DefinitionCycleException;
import knoelab.normalization.tbox.TBox;
import knoelab.normalization.tbox.TBoxParser;

import org.semanticweb.owlapi.model.IRI;
import org.semanticweb.owlapi.model.OWLOntology;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the normalization steps in the only order they are valid in:
 * parse TBox, expand definitions, parse ABox, apply definitions to 
 * the ABox and to the GCIs, aggregate the GCIs.
 */
public class KBNormalizer {

	private final TBoxParser tboxParser;
	private final ABoxParser aboxParser;
	private final Logger logger;
	
	public KBNormalizer() {
		this(new TBoxParser(), new ABoxParser(), 
				LoggerFactory.getLogger(KBNormalizer.class));
	}
	
	public KBNormalizer(TBoxParser tboxParser, ABoxParser aboxParser, Logger logger) {
		this.tboxParser = tboxParser;
		this.aboxParser = aboxParser;
		this.logger = logger;
	}
	
	public NormalizedKB normalize(String tboxStr, String aboxStr) 
			throws DefinitionCycleException {
		long startTime = System.nanoTime();
		ParseStatus<TBox> tboxStatus = tboxParser.parse(tboxStr);
		TBox tbox = tboxStatus.getResult();
		tbox.expandAllDefinitions();
		
		ParseStatus<ABox> aboxStatus = aboxParser.parse(aboxStr);
		ABox abox = aboxStatus.getResult();
		tbox.applyDefinitionsToABox(abox);
		tbox.applyDefinitionsToInclusions();
		ConjunctionConcept aggregatedInclusions = tbox.aggregateInclusions();
		
		logger.info("Normalized {} TBox and {} ABox axioms in {} secs", 
				tbox.size(), abox.size(), Util.getElapsedTimeSecs(startTime));
		return new NormalizedKB(tbox, abox, aggregatedInclusions, 
				tboxStatus.getErrors(), aboxStatus.getErrors());
	}
	
	public static void main(String[] args) throws Exception {
		if(args.length < 2 || args.length > 3) {
			System.out.println("Usage: KBNormalizer <tbox-file> <abox-file> " +
					"[owl-output-file]");
			System.exit(-1);
		}
		NormalizedKB kb = null;
		try {
			String tboxStr = Util.readFile(new File(args[0]));
			String aboxStr = Util.readFile(new File(args[1]));
			kb = new KBNormalizer().normalize(tboxStr, aboxStr);
		}
		catch(IOException e) {
			System.out.println("Cannot read input: " + e.getMessage());
			System.exit(-1);
		}
		catch(DefinitionCycleException e) {
			System.out.println(e.getMessage());
			System.exit(-1);
		}
		System.out.println(kb);
		if(args.length == 3) {
			OWLTranslator translator = new OWLTranslator();
			OWLOntology ontology = translator.toOntology(kb.getTBox(), kb.getABox(), 
					IRI.create(PropertyFileHandler.getInstance().getOntologyIRI()));
			translator.saveOntology(ontology, new File(args[2]));
			System.out.println("Saved ontology to " + args[2]);
		}
	}
}
