package uk.ac.imperial.lsds.mobilenet;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import uk.ac.imperial.lsds.mobilenet.cli.CommandLine;
import uk.ac.imperial.lsds.mobilenet.cli.Options;
import uk.ac.imperial.lsds.mobilenet.kernel.conf.SolverConf;

/*
 * Trains MobileNetV3-Small on CIFAR-10.
 * 
 * Usage: java uk.ac.imperial.lsds.mobilenet.MobileNetV3App [--flag value]...
 */
public class MobileNetV3App {
	
	private final static Logger log = LogManager.getLogger (MobileNetV3App.class);
	
	public static void main (String [] args) {
		
		System.exit(run (args));
	}
	
	/* Returns the process exit code */
	public static int run (String [] args) {
		
		SystemConf systemConf = new SystemConf ();
		ModelConf modelConf = new ModelConf ();
		SolverConf solverConf = new SolverConf ();
		
		Options options = new Options (MobileNetV3App.class.getName(), systemConf, modelConf, solverConf);
		
		CommandLine commandLine = new CommandLine (options, systemConf, modelConf, solverConf);
		
		try {
			commandLine.parse (args);
		}
		catch (IllegalArgumentException e) {
			System.err.println(e.getMessage());
			System.err.println(options.toString());
			return 1;
		}
		
		log.debug(systemConf);
		log.debug(modelConf);
		log.debug(solverConf);
		
		try {
			new ExecutionContext (modelConf, solverConf, systemConf).run ();
		}
		catch (Exception e) {
			log.error(String.format("Training failed: %s", e.getMessage()), e);
			return 1;
		}
		
		return 0;
	}
}
