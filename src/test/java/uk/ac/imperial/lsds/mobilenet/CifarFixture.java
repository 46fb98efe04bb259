package uk.ac.imperial.lsds.mobilenet;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Random;

/*
 * Writes small CIFAR-10 binary files. Example `n` of a file has label 
 * `n % 10` and random pixels.
 */
public class CifarFixture {
	
	public static void write (File file, int records, long seed) throws IOException {
		
		Random random = new Random (seed);
		
		byte [] record = new byte [Dataset.RECORD_SIZE];
		
		OutputStream out = new FileOutputStream (file);
		try {
			for (int n = 0; n < records; ++n) {
				random.nextBytes(record);
				record[0] = (byte) (n % Dataset.NUMBER_OF_CLASSES);
				out.write(record);
			}
		} finally {
			out.close();
		}
	}
	
	/* Five training files and one test file */
	public static void create (File directory, int recordsPerTrainingFile, int testRecords) throws IOException {
		
		if (! directory.isDirectory() && ! directory.mkdirs())
			throw new IOException ("error: cannot create " + directory);
		
		for (int i = 0; i < Dataset.TRAINING_FILES.length; ++i)
			write (new File (directory, Dataset.TRAINING_FILES[i]), recordsPerTrainingFile, i);
		
		write (new File (directory, Dataset.TEST_FILES[0]), testRecords, 100L);
	}
}
