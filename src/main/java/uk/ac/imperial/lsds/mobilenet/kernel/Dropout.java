package uk.ac.imperial.lsds.mobilenet.kernel;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import uk.ac.imperial.lsds.mobilenet.device.random.RandomGenerator;
import uk.ac.imperial.lsds.mobilenet.kernel.conf.DropoutConf;
import uk.ac.imperial.lsds.mobilenet.model.Model;
import uk.ac.imperial.lsds.mobilenet.model.ModelGradient;
import uk.ac.imperial.lsds.mobilenet.model.Variable;
import uk.ac.imperial.lsds.mobilenet.types.KernelType;
import uk.ac.imperial.lsds.mobilenet.types.Phase;

/*
 * Inverted dropout: in the training phase, each element is zeroed with 
 * probability `ratio` and the survivors are scaled by 1 / (1 - ratio). 
 * In the test phase, the kernel is the identity.
 */
public class Dropout extends Kernel {
	
	private final static Logger log = LogManager.getLogger (Dropout.class);
	
	private DropoutConf conf;
	
	private RandomGenerator random;
	
	private float [] mask = null;
	
	public Dropout (DropoutConf conf) {
		this.conf = conf;
	}
	
	public KernelType getKernelType () {
		return KernelType.DROPOUT;
	}
	
	public float getRatio () {
		return conf.getRatio();
	}
	
	public Dropout setup (String name, int channels, Model model) {
		
		log.debug(String.format("Setup kernel %s (ratio %.3f)", name, conf.getRatio()));
		
		if (conf.getRatio() < 0 || conf.getRatio() >= 1)
			throw new IllegalArgumentException (String.format("error: dropout ratio of kernel %s must be in [0, 1)", name));
		
		this.name = name;
		this.inputs = this.outputs = channels;
		this.random = model.getRandomGenerator();
		
		return this;
	}
	
	public Variable compute (Variable input, Phase phase) {
		
		checkInput (input, 0);
		
		retain (input, phase);
		
		mask = null;
		
		if (phase != Phase.TRAIN || conf.getRatio() == 0)
			return input;
		
		float ratio = conf.getRatio();
		float scale = 1F / (1F - ratio);
		
		Variable output = new Variable (input.getShape().copy());
		
		float [] x = input.getData();
		float [] y = output.getData();
		
		mask = new float [x.length];
		
		for (int i = 0; i < x.length; ++i) {
			mask[i] = (random.nextFloat() < ratio) ? 0 : scale;
			y[i] = x[i] * mask[i];
		}
		
		return output;
	}
	
	public Variable computeGradient (Variable gradient, ModelGradient modelGradient) {
		
		Variable input = getRetainedInput ();
		
		checkGradient (gradient, input.getShape());
		
		if (mask == null)
			return gradient;
		
		Variable inputGradient = new Variable (input.getShape().copy());
		
		float [] dy = gradient.getData();
		float [] dx = inputGradient.getData();
		
		for (int i = 0; i < dy.length; ++i)
			dx[i] = dy[i] * mask[i];
		
		return inputGradient;
	}
}
