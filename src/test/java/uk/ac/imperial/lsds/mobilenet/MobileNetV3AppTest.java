package uk.ac.imperial.lsds.mobilenet;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.File;
import java.io.IOException;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import uk.ac.imperial.lsds.mobilenet.result.ResultWriter;
import uk.ac.imperial.lsds.mobilenet.result.Results;

public class MobileNetV3AppTest {
	
	@TempDir
	File directory;
	
	@Test
	public void testRun () throws IOException {
		
		File data = new File (directory, "data");
		File out = new File (directory, "out");
		
		CifarFixture.create (data, 2, 4);
		
		int code = MobileNetV3App.run (new String [] {
			"--data_path", data.getPath(),
			"--out_dir", out.getPath(),
			"--batch_size", "5",
			"--epochs", "1",
			"--width_mult", "0.25",
			"--log_interval", "1"
		});
		
		assertEquals(0, code);
		
		Results results = new ResultWriter ().read (new File (out, SystemConf.RESULT_FILENAME));
		assertEquals(2, results.getTrainingLog().size());
		assertEquals(0.25, ((Number) results.getFinalInfo().getConfiguration().get("width_mult")).doubleValue(), 1e-9);
		
		assertTrue(new File (out, SystemConf.CHECKPOINT_FILENAME).isFile());
	}
	
	@Test
	public void testInvalidArguments () {
		
		assertEquals(1, MobileNetV3App.run (new String [] { "--no_such_flag", "1" }));
		assertEquals(1, MobileNetV3App.run (new String [] { "--epochs" }));
	}
	
	@Test
	public void testMissingData () {
		
		assertEquals(1, MobileNetV3App.run (new String [] {
			"--data_path", new File (directory, "nothing").getPath(),
			"--out_dir", new File (directory, "out").getPath(),
			"--width_mult", "0.25"
		}));
	}
}
