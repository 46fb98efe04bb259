package uk.ac.imperial.lsds.mobilenet;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Arrays;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import uk.ac.imperial.lsds.mobilenet.device.random.RandomGenerator;
import uk.ac.imperial.lsds.mobilenet.model.Shape;
import uk.ac.imperial.lsds.mobilenet.types.Phase;

public class DatasetTest {
	
	@TempDir
	File directory;
	
	private static Dataset constant (int size, int value) {
		
		byte [] images = new byte [size * Dataset.IMAGE_SIZE];
		Arrays.fill(images, (byte) value);
		
		int [] labels = new int [size];
		for (int i = 0; i < size; ++i)
			labels[i] = i % 10;
		
		return new Dataset (Phase.TRAIN, images, labels);
	}
	
	@Test
	public void testLoad () throws IOException {
		
		CifarFixture.create (directory, 3, 4);
		
		Dataset training = Dataset.load (directory.getPath(), Phase.TRAIN);
		Dataset test = Dataset.load (directory.getPath(), Phase.CHECK);
		
		assertEquals(15, training.size());
		assertEquals(4, test.size());
		
		assertEquals(Phase.TRAIN, training.getPhase());
		assertEquals(2, training.getLabel (2));
		assertEquals(0, training.getLabel (3));
		assertEquals(3, test.getLabel (3));
	}
	
	@Test
	public void testLoadFromSubdirectory () throws IOException {
		
		CifarFixture.create (new File (directory, Dataset.SUBDIRECTORY), 1, 2);
		
		assertEquals(5, Dataset.load (directory.getPath(), Phase.TRAIN).size());
		assertEquals(2, Dataset.load (directory.getPath(), Phase.CHECK).size());
	}
	
	@Test
	public void testMissingFiles () throws IOException {
		
		assertThrows(FileNotFoundException.class, () -> Dataset.load (directory.getPath(), Phase.TRAIN));
		
		/* Only the first training file */
		CifarFixture.write (new File (directory, Dataset.TRAINING_FILES[0]), 2, 1L);
		
		assertThrows(FileNotFoundException.class, () -> Dataset.load (directory.getPath(), Phase.TRAIN));
	}
	
	@Test
	public void testInvalidRecords () throws IOException {
		
		CifarFixture.write (new File (directory, Dataset.TEST_FILES[0]), 2, 1L);
		
		/* Append half a record */
		OutputStream append = new FileOutputStream (new File (directory, Dataset.TEST_FILES[0]), true);
		try {
			append.write(new byte [Dataset.RECORD_SIZE / 2]);
		} finally {
			append.close();
		}
		assertThrows(IOException.class, () -> Dataset.load (directory.getPath(), Phase.CHECK));
		
		/* Label out of range */
		byte [] record = new byte [Dataset.RECORD_SIZE];
		record[0] = 10;
		OutputStream out = new FileOutputStream (new File (directory, Dataset.TEST_FILES[0]));
		try {
			out.write(record);
		} finally {
			out.close();
		}
		assertThrows(IOException.class, () -> Dataset.load (directory.getPath(), Phase.CHECK));
	}
	
	@Test
	public void testNormalisation () {
		
		Dataset dataset = constant (2, 255);
		
		int [] order = dataset.order (false, null);
		assertArrayEquals(new int [] { 0, 1 }, order);
		
		Batch batch = dataset.getBatch (order, 0, 2, false, null);
		
		assertEquals(new Shape (new int [] { 2, 3, 32, 32 }), batch.getExamples().getShape());
		assertArrayEquals(new int [] { 0, 1 }, batch.getLabels());
		
		float [] x = batch.getExamples().getData();
		
		assertEquals((1F - 0.4914F) / 0.2023F, x[0], 1e-5F);
		assertEquals((1F - 0.4822F) / 0.1994F, x[1024], 1e-5F);
		assertEquals((1F - 0.4465F) / 0.2010F, x[2048], 1e-5F);
		assertEquals((1F - 0.4914F) / 0.2023F, x[3072], 1e-5F);
	}
	
	@Test
	public void testAugmentationPadsWithZeros () {
		
		Dataset dataset = constant (64, 255);
		
		int [] order = dataset.order (false, null);
		
		Batch batch = dataset.getBatch (order, 0, 64, true, new RandomGenerator (1L));
		
		float inside = (1F - 0.4914F) / 0.2023F;
		float padding = (0F - 0.4914F) / 0.2023F;
		
		int shifted = 0;
		float [] x = batch.getExamples().getData();
		
		for (int n = 0; n < 64; ++n) {
			
			int padded = 0;
			for (int p = 0; p < 1024; ++p) {
				float v = x[n * Dataset.IMAGE_SIZE + p];
				if (v == padding)
					padded ++;
				else
					assertEquals(inside, v, 1e-5F);
			}
			
			/* At most 4 rows and 4 columns are padding */
			assertTrue(padded <= 4 * 32 + 4 * 32);
			if (padded > 0)
				shifted ++;
		}
		
		/* Most of 64 random offsets are non-zero */
		assertTrue(shifted > 32);
	}
	
	@Test
	public void testShuffleIsPermutation () {
		
		Dataset dataset = constant (100, 0);
		
		int [] order = dataset.order (true, new RandomGenerator (3L));
		
		assertNotEquals(Arrays.toString(dataset.order (false, null)), Arrays.toString(order));
		
		int [] sorted = order.clone();
		Arrays.sort(sorted);
		assertArrayEquals(dataset.order (false, null), sorted);
		
		assertEquals(4, dataset.numberOfBatches (32));
		assertEquals(1, dataset.numberOfBatches (100));
	}
	
	@Test
	public void testInvalidBatchRange () {
		
		Dataset dataset = constant (4, 0);
		int [] order = dataset.order (false, null);
		
		assertThrows(IllegalArgumentException.class, () -> dataset.getBatch (order, 2, 2, false, null));
		assertThrows(IllegalArgumentException.class, () -> dataset.getBatch (order, 0, 5, false, null));
		assertThrows(IllegalArgumentException.class, () -> new Dataset (Phase.TRAIN, new byte [10], new int [1]));
	}
}
