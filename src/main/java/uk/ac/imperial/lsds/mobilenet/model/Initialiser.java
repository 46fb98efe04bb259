package uk.ac.imperial.lsds.mobilenet.model;

import java.util.Arrays;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import uk.ac.imperial.lsds.mobilenet.device.random.RandomGenerator;
import uk.ac.imperial.lsds.mobilenet.types.InitialiserType;

public class Initialiser {

	private final static Logger log = LogManager.getLogger (Initialiser.class);
	
	InitialiserConf conf;
	
	Variable variable;
	
	RandomGenerator random;
	
	public Initialiser (InitialiserConf conf, Variable variable, RandomGenerator random) {
		this.conf = conf;
		this.variable = variable;
		this.random = random;
	}
	
	public void initialise () {
		
		InitialiserType type = conf.getType();
		
		switch (type) {
		case CONSTANT: constant (); break;
		case GAUSSIAN: gaussian (); break;
		case     MSRA:     msra (); break;
		default:
			throw new IllegalArgumentException ("error: unknown initialiser type");
		}
	}
	
	private void constant () {
		
		log.debug (String.format("Initialising variable %s", variable.getName()));
		
		Arrays.fill(variable.getData(), conf.getValue());
	}
	
	private void gaussian () {
		
		log.debug (String.format("Initialising variable %s", variable.getName()));
		
		float mean = conf.getMean();
		float std  = conf.getStd ();
		
		if (std <= 0)
			throw new IllegalArgumentException ("error: standard deviation must be greater than 0");
		
		random.randomGaussianFill (variable.getData(), variable.capacity(), mean, std);
	}
	
	/*
	 * He et al. normal initialisation. For a weight shaped as [outputs, inputs, kh, kw],
	 * fan-in is `inputs * kh * kw` and fan-out is `outputs * kh * kw`.
	 */
	private void msra () {
	
		log.debug (String.format("Initialising variable %s", variable.getName()));
		
		Shape shape = variable.getShape();
		
		if (shape.dimensions() < 2)
			throw new IllegalArgumentException (String.format("error: cannot compute fan-in and fan-out of variable %s", variable.getName()));
		
		int elements = shape.countAllElements();
		
		float p = (float) elements / (float) shape.get(0);
		float q = (float) elements / (float) shape.get(1);
		float n;
		switch (conf.getNorm()) {
		case FAN_IN:  n = p; break;
		case FAN_OUT: n = q; break;
		case AVG: 
			n = (p + q) / 2F; break;
		default:
			throw new IllegalArgumentException ("error: unknown variable normalisation type");
		}
		
		float std = (float) Math.sqrt (2.0 / n);
		
		log.debug(String.format("MSRA filler: n = %5.5f std %5.5f", n, std));
		
		random.randomGaussianFill (variable.getData(), elements, conf.getMean(), std);
	}
}
