package uk.ac.imperial.lsds.mobilenet.kernel.conf;

import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;

import uk.ac.imperial.lsds.mobilenet.cli.IConfiguration;
import uk.ac.imperial.lsds.mobilenet.cli.Option;
import uk.ac.imperial.lsds.mobilenet.types.LearningRateDecayPolicy;

public class SolverConf implements IConf, IConfiguration {
	
	private LinkedList<Option> opts;
	
	private LearningRateDecayPolicy learningRateDecayPolicy;
	
	private float baseLearningRate;
	
	private float momentum;
	
	private float weightDecay;
	
	public SolverConf () {
		
		opts = new LinkedList<Option>();
		
		opts.add(new Option("--learning_rate", "Base learning rate",                    false,  Float.class,   "0.01"));
		opts.add(new Option("--momentum",      "SGD momentum",                          false,  Float.class,    "0.9"));
		opts.add(new Option("--weight_decay",  "L2 weight decay",                       false,  Float.class, "0.0001"));
		opts.add(new Option("--lr_policy",     "Learning rate decay policy (fixed, cosine)", false, String.class, "cosine"));
		
		learningRateDecayPolicy = LearningRateDecayPolicy.COSINE;
		
		baseLearningRate = 0.01F;
		
		momentum = 0.9F;
		
		weightDecay = 0.0001F;
	}
	
	public float getBaseLearningRate () {
		return baseLearningRate;
	}
	
	public SolverConf setBaseLearningRate (float baseLearningRate) {
		this.baseLearningRate = baseLearningRate;
		return this;
	}

	public LearningRateDecayPolicy getLearningRateDecayPolicy () {
		return learningRateDecayPolicy;
	}
	
	public SolverConf setLearningRateDecayPolicy (LearningRateDecayPolicy learningRateDecayPolicy) {
		this.learningRateDecayPolicy = learningRateDecayPolicy;
		return this;
	}

	public float getMomentum () {
		return momentum;
	}

	public SolverConf setMomentum (float momentum) {
		this.momentum = momentum;
		return this;
	}

	public float getWeightDecay () {
		return weightDecay;
	}

	public SolverConf setWeightDecay (float weightDecay) {
		this.weightDecay = weightDecay;
		return this;
	}
	
	public List<Option> getOptions () {
		return opts;
	}
	
	public boolean parse (String arg, Option opt) {
		
		if (arg.equals("--learning_rate")) {
			
			setBaseLearningRate (opt.getFloatValue ());
		}
		else if (arg.equals("--momentum")) {
			
			setMomentum (opt.getFloatValue ());
		}
		else if (arg.equals("--weight_decay")) {
			
			setWeightDecay (opt.getFloatValue ());
		}
		else if (arg.equals("--lr_policy")) {
			
			setLearningRateDecayPolicy (LearningRateDecayPolicy.fromString (opt.getStringValue ()));
		}
		else {
			return false;
		}
		return true;
	}
	
	public Map<String, Object> toMap () {
		
		Map<String, Object> map = new LinkedHashMap<String, Object>();
		
		map.put("learning_rate", baseLearningRate);
		map.put("momentum", momentum);
		map.put("weight_decay", weightDecay);
		map.put("lr_policy", learningRateDecayPolicy.toString().toLowerCase());
		
		return map;
	}
	
	public String toString () {
		
		StringBuilder s = new StringBuilder ("=== [Solver configuration dump] ===\n");
		
		s.append (String.format("Learning rate decay policy is '%s'\n", learningRateDecayPolicy.toString ()));
		s.append (String.format("Learning rate is %.5f\n", baseLearningRate));
		s.append (String.format("Momentum is %.5f\n", momentum));
		s.append (String.format("Weight decay is %.5f\n", weightDecay));
		
		s.append("=== [End of solver configuration dump] ===\n");
		
		return s.toString();
	}
}
