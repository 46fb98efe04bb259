package uk.ac.imperial.lsds.mobilenet.kernel;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import uk.ac.imperial.lsds.mobilenet.kernel.conf.ActivationConf;
import uk.ac.imperial.lsds.mobilenet.model.Model;
import uk.ac.imperial.lsds.mobilenet.model.ModelGradient;
import uk.ac.imperial.lsds.mobilenet.model.Variable;
import uk.ac.imperial.lsds.mobilenet.types.ActivationMode;
import uk.ac.imperial.lsds.mobilenet.types.KernelType;
import uk.ac.imperial.lsds.mobilenet.types.Phase;

/*
 * Element-wise non-linearity. For input X, the output Y is:
 * 
 * RELU:         y[i] = max(0, x[i])
 * HARD_SWISH:   y[i] = x[i] * min(max(x[i] + 3, 0), 6) / 6
 * HARD_SIGMOID: y[i] = min(max(x[i] + 3, 0), 6) / 6
 */
public class Activation extends Kernel {

	private final static Logger log = LogManager.getLogger (Activation.class);

	private ActivationConf conf;
	
	private ActivationMode mode;

	public Activation (ActivationConf conf) {
		this.conf = conf;
	}
	
	public Activation (ActivationMode mode) {
		this (new ActivationConf ().setMode (mode));
	}
	
	public KernelType getKernelType () {
		return KernelType.ACTIVATION;
	}
	
	public ActivationMode getMode () {
		return conf.getMode();
	}

	public Activation setup (String name, int channels, Model model) {

		log.debug(String.format("Setup kernel %s (%s)", name, conf.getMode()));
		
		if (conf.getMode() == null)
			throw new IllegalArgumentException (String.format("error: kernel %s has no activation mode", name));
		
		this.name = name;
		this.inputs = this.outputs = channels;
		this.mode = conf.getMode();
		
		return this;
	}
	
	public Variable compute (Variable input, Phase phase) {
		
		checkInput (input, 0);
		
		Variable output = new Variable (input.getShape().copy());
		
		float [] x = input.getData();
		float [] y = output.getData();
		
		for (int i = 0; i < x.length; ++i)
			y[i] = apply (mode, x[i]);
		
		retain (input, phase);
		
		return output;
	}
	
	public Variable computeGradient (Variable gradient, ModelGradient modelGradient) {
		
		Variable input = getRetainedInput ();
		
		checkGradient (gradient, input.getShape());
		
		Variable inputGradient = new Variable (input.getShape().copy());
		
		float [] x  = input.getData();
		float [] dy = gradient.getData();
		float [] dx = inputGradient.getData();
		
		for (int i = 0; i < x.length; ++i)
			dx[i] = dy[i] * derivative (mode, x[i]);
		
		return inputGradient;
	}
	
	public static float apply (ActivationMode mode, float x) {
		
		switch (mode) {
		case RELU:
			return (x > 0) ? x : 0;
		case HARD_SWISH:
			return x * Math.min(Math.max(x + 3F, 0F), 6F) / 6F;
		case HARD_SIGMOID:
			return Math.min(Math.max(x + 3F, 0F), 6F) / 6F;
		default:
			throw new IllegalArgumentException ("error: invalid activation mode");
		}
	}
	
	public static float derivative (ActivationMode mode, float x) {
		
		switch (mode) {
		case RELU:
			return (x > 0) ? 1 : 0;
		case HARD_SWISH:
			if (x < -3F) 
				return 0;
			if (x > 3F) 
				return 1;
			return (2F * x + 3F) / 6F;
		case HARD_SIGMOID:
			return (x > -3F && x < 3F) ? 1F / 6F : 0;
		default:
			throw new IllegalArgumentException ("error: invalid activation mode");
		}
	}
}
