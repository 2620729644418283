package knoelab.normalization.misc;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

/**
 * This class contains all the 
 * miscellaneous utility methods
 * 
 * @author Raghava
 *
 */
public class Util {
	
	public static double getElapsedTimeSecs(long startTime) {
		long endTime = System.nanoTime();
		long diffTime = endTime - startTime;
		double diffTimeSecs = ((double)diffTime/Constants.NANO);
		return diffTimeSecs;
	}
	
	public static String readFile(File file) throws IOException {
		return new String(Files.readAllBytes(file.toPath()), StandardCharsets.UTF_8);
	}
	
	/**
	 * Splits a text into lines, accepting both \n and \r\n endings.
	 */
	public static String[] splitLines(String text) {
		return text.split("\\r?\\n", -1);
	}
	
	public static boolean isSkippable(String line, String commentPrefix) {
		String trimmed = line.trim();
		return trimmed.isEmpty() || trimmed.startsWith(commentPrefix);
	}
}
