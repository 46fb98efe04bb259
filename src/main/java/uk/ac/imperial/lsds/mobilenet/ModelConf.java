package uk.ac.imperial.lsds.mobilenet;

import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;

import uk.ac.imperial.lsds.mobilenet.cli.IConfiguration;
import uk.ac.imperial.lsds.mobilenet.cli.Option;

/*
 * Architecture hyper-parameters of a MobileNetV3-Small network.
 */
public class ModelConf implements IConfiguration {
	
	private LinkedList<Option> opts;
	
	private int numberOfClasses;
	
	private double widthMultiplier;
	
	private float dropout;
	
	private boolean reducedTail;
	
	private boolean dilated;
	
	private long seed;
	
	private double epsilon;
	
	private double movingAverageFraction;
	
	public ModelConf () {
		
		/* Fill command-line arguments */
		opts = new LinkedList<Option>();
		
		opts.add (new Option ("--num_classes",  "Number of output classes",                 false, Integer.class,    "10"));
		opts.add (new Option ("--width_mult",   "Channel width multiplier",                 false,  Double.class,   "1.0"));
		opts.add (new Option ("--dropout",      "Dropout ratio of the classifier",          false,   Float.class,   "0.2"));
		opts.add (new Option ("--reduced_tail", "Halve the channels of the last stages",    false, Boolean.class, "false"));
		opts.add (new Option ("--dilated",      "Dilate the depthwise kernels of the last stages", false, Boolean.class, "false"));
		opts.add (new Option ("--seed",         "Random seed",                              false,    Long.class,    "42"));
		
		/* Default values */
		
		numberOfClasses = 1000;
		
		widthMultiplier = 1D;
		
		dropout = 0.2F;
		
		reducedTail = false;
		dilated = false;
		
		seed = 42L;
		
		epsilon = 0.001D;
		movingAverageFraction = 0.99D;
	}
	
	public int numberOfClasses () {
		return numberOfClasses;
	}
	
	public ModelConf setNumberOfClasses (int numberOfClasses) {
		this.numberOfClasses = numberOfClasses;
		return this;
	}
	
	public double getWidthMultiplier () {
		return widthMultiplier;
	}
	
	public ModelConf setWidthMultiplier (double widthMultiplier) {
		this.widthMultiplier = widthMultiplier;
		return this;
	}
	
	public float getDropout () {
		return dropout;
	}
	
	public ModelConf setDropout (float dropout) {
		this.dropout = dropout;
		return this;
	}
	
	public boolean isReducedTail () {
		return reducedTail;
	}
	
	public ModelConf setReducedTail (boolean reducedTail) {
		this.reducedTail = reducedTail;
		return this;
	}
	
	public boolean isDilated () {
		return dilated;
	}
	
	public ModelConf setDilated (boolean dilated) {
		this.dilated = dilated;
		return this;
	}
	
	public long getRandomSeed () {
		return seed;
	}
	
	public ModelConf setRandomSeed (long seed) {
		this.seed = seed;
		return this;
	}
	
	public double getEpsilon () {
		return epsilon;
	}
	
	public ModelConf setEpsilon (double epsilon) {
		this.epsilon = epsilon;
		return this;
	}
	
	public double getMovingAverageFraction () {
		return movingAverageFraction;
	}
	
	public ModelConf setMovingAverageFraction (double movingAverageFraction) {
		this.movingAverageFraction = movingAverageFraction;
		return this;
	}
	
	public List<Option> getOptions () {
		return opts;
	}
	
	public boolean parse (String arg, Option opt) {
		
		if (arg.equals("--num_classes")) {
			
			setNumberOfClasses (opt.getIntValue ());
		}
		else if (arg.equals("--width_mult")) {
			
			setWidthMultiplier (opt.getDoubleValue ());
		}
		else if (arg.equals("--dropout")) {
			
			setDropout (opt.getFloatValue ());
		}
		else if (arg.equals("--reduced_tail")) {
			
			setReducedTail (opt.getBooleanValue ());
		}
		else if (arg.equals("--dilated")) {
			
			setDilated (opt.getBooleanValue ());
		}
		else if (arg.equals("--seed")) {
			
			setRandomSeed (opt.getLongValue ());
		}
		else {
			return false;
		}
		return true;
	}
	
	public Map<String, Object> toMap () {
		
		Map<String, Object> map = new LinkedHashMap<String, Object>();
		
		map.put("num_classes", numberOfClasses);
		map.put("model", "mobilenet_v3_small");
		map.put("width_mult", widthMultiplier);
		map.put("dropout", dropout);
		map.put("reduced_tail", reducedTail);
		map.put("dilated", dilated);
		map.put("seed", seed);
		
		return map;
	}
	
	public String toString () {
		
		StringBuilder s = new StringBuilder ("=== [Model configuration dump] ===\n");
		
		s.append (String.format("%d classes\n", numberOfClasses));
		s.append (String.format("Width multiplier is %.3f\n", widthMultiplier));
		s.append (String.format("Dropout ratio is %.3f\n", dropout));
		s.append (String.format("%s reduced tail\n", (reducedTail ? "Use" : "Don't use")));
		s.append (String.format("%s dilated tail\n", (dilated ? "Use" : "Don't use")));
		s.append (String.format("Random seed is %d\n", seed));
		s.append (String.format("Batch normalisation epsilon is %g, moving average fraction is %g\n", epsilon, movingAverageFraction));
		
		s.append("=== [End of model configuration dump] ===\n");
		
		return s.toString();
	}
}
