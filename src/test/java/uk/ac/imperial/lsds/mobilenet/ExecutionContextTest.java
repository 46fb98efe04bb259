package uk.ac.imperial.lsds.mobilenet;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.File;
import java.io.IOException;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import uk.ac.imperial.lsds.mobilenet.kernel.conf.SolverConf;
import uk.ac.imperial.lsds.mobilenet.result.Measurement;
import uk.ac.imperial.lsds.mobilenet.result.ResultWriter;
import uk.ac.imperial.lsds.mobilenet.result.Results;
import uk.ac.imperial.lsds.mobilenet.types.Phase;

public class ExecutionContextTest {
	
	@TempDir
	File directory;
	
	private SystemConf system (int epochs) {
		
		return new SystemConf ()
			.setDataPath (new File (directory, "data").getPath())
			.setOutputDirectory (new File (directory, "out").getPath())
			.setBatchSize (4)
			.setNumberOfEpochs (epochs)
			.setDisplayInterval (1);
	}
	
	private static ModelConf model () {
		return new ModelConf ().setNumberOfClasses (10).setWidthMultiplier (0.25);
	}
	
	@Test
	public void testRun () throws IOException {
		
		CifarFixture.create (new File (directory, "data"), 2, 6);
		
		SystemConf systemConf = system (1);
		
		ExecutionContext context = new ExecutionContext (model (), new SolverConf (), systemConf);
		
		Results results = context.run ();
		
		assertTrue(systemConf.getCheckpointFile().isFile());
		assertTrue(systemConf.getResultFile().isFile());
		
		/* 10 training examples in batches of 4 */
		assertEquals(3, results.getTrainingLog().size());
		assertEquals(1, results.getValidationLog().size());
		
		Measurement first = results.getTrainingLog().get(0);
		assertEquals(Integer.valueOf(0), first.getEpoch());
		assertEquals(Integer.valueOf(0), first.getBatch());
		assertEquals(0.01, first.getLr(), 1e-7);
		assertTrue(first.getLoss() > 0);
		
		Measurement validation = results.getValidationLog().get(0);
		assertNull(validation.getBatch());
		assertNull(validation.getLr());
		
		Results read = new ResultWriter ().read (systemConf.getResultFile());
		
		assertEquals(results.getFinalInfo().getBestValidationAccuracy(), read.getFinalInfo().getBestValidationAccuracy(), 1e-9);
		assertEquals(results.getFinalInfo().getTestAccuracy(), read.getFinalInfo().getTestAccuracy(), 1e-9);
		assertTrue(read.getFinalInfo().getTotalTrainingTime() >= 0);
		assertEquals(3, read.getTrainingLog().size());
		assertEquals(1, read.getValidationLog().size());
		
		Map<String, Object> config = read.getFinalInfo().getConfiguration();
		assertEquals(10, config.get("num_classes"));
		assertEquals(4, config.get("batch_size"));
		assertEquals("mobilenet_v3_small", config.get("model"));
		assertEquals("cpu", config.get("device"));
		
		/* The test set doubles as the validation set, and the best checkpoint is tested */
		assertEquals(validation.getAcc(), results.getFinalInfo().getTestAccuracy(), 1e-9);
	}
	
	@Test
	public void testCheckpointKeepsBestEpoch () throws IOException {
		
		CifarFixture.create (new File (directory, "data"), 2, 6);
		
		SystemConf systemConf = system (3);
		new File (systemConf.getOutputDirectory()).mkdirs();
		
		ExecutionContext context = new ExecutionContext (model (), new SolverConf ().setBaseLearningRate (0.05F), systemConf);
		
		Dataset training = Dataset.load (systemConf.getDataPath(), Phase.TRAIN);
		Dataset test = Dataset.load (systemConf.getDataPath(), Phase.CHECK);
		
		double best = context.train (training, test);
		
		assertEquals(3, context.getValidationLog().size());
		
		double max = 0;
		for (Measurement m: context.getValidationLog().list())
			max = Math.max(max, m.getAcc());
		assertEquals(max, best, 1e-9);
		
		/* The learning rate follows the cosine schedule per epoch */
		assertEquals(0.05, context.getTrainingLog().get(0).getLr(), 1e-7);
		assertEquals(0.05 * 0.75, context.getTrainingLog().get(3).getLr(), 1e-6);
		
		/* Restoring the checkpoint reproduces the best validation accuracy */
		assertEquals(best, context.test (test).getAcc(), 1e-9);
	}
	
	@Test
	public void testSingleExampleTailIsDropped () throws IOException {
		
		File data = new File (directory, "data");
		CifarFixture.create (data, 2, 3);
		
		/* 9 examples in batches of 4 would leave a batch of 1 */
		CifarFixture.write (new File (data, Dataset.TRAINING_FILES[4]), 1, 4L);
		
		SystemConf systemConf = system (1);
		new File (systemConf.getOutputDirectory()).mkdirs();
		
		ExecutionContext context = new ExecutionContext (model (), new SolverConf (), systemConf);
		
		Dataset training = Dataset.load (systemConf.getDataPath(), Phase.TRAIN);
		assertEquals(9, training.size());
		
		context.train (training, Dataset.load (systemConf.getDataPath(), Phase.CHECK));
		
		assertEquals(2, context.getTrainingLog().size());
	}
	
	@Test
	public void testEvaluate () {
		
		SystemConf systemConf = system (1);
		
		ExecutionContext context = new ExecutionContext (model (), new SolverConf (), systemConf);
		
		byte [] images = new byte [5 * Dataset.IMAGE_SIZE];
		int [] labels = { 0, 1, 2, 3, 4 };
		
		Measurement m = context.evaluate (context.getNetwork(), new Dataset (Phase.CHECK, images, labels));
		
		assertNull(m.getEpoch());
		assertNotNull(m.getLoss());
		assertTrue(m.getAcc() >= 0 && m.getAcc() <= 100);
		
		/* Identical images get identical predictions, so at most one label is right */
		assertTrue(m.getAcc() <= 20 + 1e-9);
	}
	
	@Test
	public void testInvalidSettings () {
		
		assertThrows(IllegalArgumentException.class, 
				() -> new ExecutionContext (model (), new SolverConf (), system (1).setBatchSize (0)));
		assertThrows(IllegalArgumentException.class, 
				() -> new ExecutionContext (model (), new SolverConf (), system (1).setDisplayInterval (0)));
		assertThrows(IllegalArgumentException.class, 
				() -> new ExecutionContext (model (), new SolverConf (), system (0)));
	}
	
	@Test
	public void testMissingData () {
		
		ExecutionContext context = new ExecutionContext (model (), new SolverConf (), system (1));
		
		assertThrows(IOException.class, () -> context.run ());
	}
}
