package uk.ac.imperial.lsds.mobilenet;

import java.io.File;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;

import uk.ac.imperial.lsds.mobilenet.cli.IConfiguration;
import uk.ac.imperial.lsds.mobilenet.cli.Option;

/*
 * Run-level settings: where data is read from, where results go, and how 
 * the training loop is paced.
 */
public class SystemConf implements IConfiguration {
	
	public static final String CHECKPOINT_FILENAME = "best_model.bin";
	
	public static final String RESULT_FILENAME = "mobilenetv3_cifar10_results.json";
	
	private LinkedList<Option> opts;
	
	private String dataPath;
	
	private String outputDirectory;
	
	private int batchSize;
	
	private int epochs;
	
	private int displayInterval;
	
	private boolean augment;
	
	public SystemConf () {
		
		opts = new LinkedList<Option>();
		
		opts.add (new Option ("--data_path",    "CIFAR-10 binary dataset directory",   false,  String.class, "./data"));
		opts.add (new Option ("--batch_size",   "Batch size",                          false, Integer.class,    "128"));
		opts.add (new Option ("--epochs",       "Number of training epochs",           false, Integer.class,     "30"));
		opts.add (new Option ("--out_dir",      "Output directory",                    false,  String.class,  "run_0"));
		opts.add (new Option ("--log_interval", "Log training progress every N batches", false, Integer.class,  "100"));
		opts.add (new Option ("--augment",      "Random crop and flip training images", false, Boolean.class, "true"));
		
		dataPath = "./data";
		outputDirectory = "run_0";
		
		batchSize = 128;
		epochs = 30;
		
		displayInterval = 100;
		
		augment = true;
	}
	
	public String getDataPath () {
		return dataPath;
	}
	
	public SystemConf setDataPath (String dataPath) {
		this.dataPath = dataPath;
		return this;
	}
	
	public String getOutputDirectory () {
		return outputDirectory;
	}
	
	public SystemConf setOutputDirectory (String outputDirectory) {
		this.outputDirectory = outputDirectory;
		return this;
	}
	
	public File getCheckpointFile () {
		return new File (outputDirectory, CHECKPOINT_FILENAME);
	}
	
	public File getResultFile () {
		return new File (outputDirectory, RESULT_FILENAME);
	}
	
	public int getBatchSize () {
		return batchSize;
	}
	
	public SystemConf setBatchSize (int batchSize) {
		this.batchSize = batchSize;
		return this;
	}
	
	public int numberOfEpochs () {
		return epochs;
	}
	
	public SystemConf setNumberOfEpochs (int epochs) {
		this.epochs = epochs;
		return this;
	}
	
	public int getDisplayInterval () {
		return displayInterval;
	}
	
	public SystemConf setDisplayInterval (int displayInterval) {
		this.displayInterval = displayInterval;
		return this;
	}
	
	public boolean useAugmentation () {
		return augment;
	}
	
	public SystemConf setAugmentation (boolean augment) {
		this.augment = augment;
		return this;
	}
	
	public List<Option> getOptions () {
		return opts;
	}
	
	public boolean parse (String arg, Option opt) {
		
		if (arg.equals("--data_path")) {
			
			setDataPath (opt.getStringValue ());
		}
		else if (arg.equals("--batch_size")) {
			
			setBatchSize (opt.getIntValue ());
		}
		else if (arg.equals("--epochs")) {
			
			setNumberOfEpochs (opt.getIntValue ());
		}
		else if (arg.equals("--out_dir")) {
			
			setOutputDirectory (opt.getStringValue ());
		}
		else if (arg.equals("--log_interval")) {
			
			setDisplayInterval (opt.getIntValue ());
		}
		else if (arg.equals("--augment")) {
			
			setAugmentation (opt.getBooleanValue ());
		}
		else {
			return false;
		}
		return true;
	}
	
	public Map<String, Object> toMap () {
		
		Map<String, Object> map = new LinkedHashMap<String, Object>();
		
		map.put("data_path", dataPath);
		map.put("batch_size", batchSize);
		map.put("epochs", epochs);
		map.put("log_interval", displayInterval);
		map.put("out_dir", outputDirectory);
		map.put("augment", augment);
		map.put("device", "cpu");
		
		return map;
	}
	
	public String toString () {
		
		StringBuilder s = new StringBuilder ("=== [System configuration dump] ===\n");
		
		s.append (String.format("Data path is %s\n", dataPath));
		s.append (String.format("Output directory is %s\n", outputDirectory));
		s.append (String.format("Batch size is %d\n", batchSize));
		s.append (String.format("%d epochs\n", epochs));
		s.append (String.format("Display loss every %d batches\n", displayInterval));
		s.append (String.format("%s data augmentation\n", (augment ? "Use" : "Don't use")));
		
		s.append("=== [End of system configuration dump] ===\n");
		
		return s.toString();
	}
}
