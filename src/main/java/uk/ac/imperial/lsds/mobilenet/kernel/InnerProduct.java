package uk.ac.imperial.lsds.mobilenet.kernel;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import uk.ac.imperial.lsds.mobilenet.kernel.conf.InnerProductConf;
import uk.ac.imperial.lsds.mobilenet.model.Model;
import uk.ac.imperial.lsds.mobilenet.model.ModelGradient;
import uk.ac.imperial.lsds.mobilenet.model.Shape;
import uk.ac.imperial.lsds.mobilenet.model.Variable;
import uk.ac.imperial.lsds.mobilenet.types.KernelType;
import uk.ac.imperial.lsds.mobilenet.types.Phase;

/*
 * Fully-connected layer, y = x W^T + b, with W shaped as [outputs, inputs].
 * 
 * Every axis after the first is flattened, so a pooled [N, C, 1, 1] input
 * is treated as [N, C].
 */
public class InnerProduct extends Kernel {
	
	private final static Logger log = LogManager.getLogger (InnerProduct.class);
	
	private InnerProductConf conf;
	
	private Variable weights, bias = null;
	
	public InnerProduct (InnerProductConf conf) {
		this.conf = conf;
	}
	
	public KernelType getKernelType () {
		return KernelType.INNER_PRODUCT;
	}
	
	public InnerProduct setup (String name, int channels, Model model) {
		
		log.debug(String.format("Setup kernel %s", name));
		
		outputs = conf.numberOfOutputs();
		
		if (channels < 1 || outputs < 1)
			throw new IllegalArgumentException (String.format("error: kernel %s needs a positive number of inputs and outputs (got %d and %d)", name, channels, outputs));
		
		this.name = name;
		this.inputs = channels;
		
		weights = new Variable (name + ".weight", new Shape (new int [] { outputs, inputs }));
		weights.initialise (conf.getWeightInitialiser(), model.getRandomGenerator());
		
		register (model, weights, true);
		
		if (conf.hasBias()) {
			
			bias = new Variable (name + ".bias", new Shape (new int [] { outputs }));
			bias.initialise (conf.getBiasInitialiser(), model.getRandomGenerator());
			
			register (model, bias, true);
		}
		
		return this;
	}
	
	public Variable getWeights () {
		return weights;
	}
	
	public Variable getBias () {
		return bias;
	}
	
	public Variable compute (Variable input, Phase phase) {
		
		checkSetup ();
		
		Shape shape = input.getShape();
		
		if (shape.dimensions() < 2 || shape.countElements(1) != inputs)
			throw new IllegalArgumentException (String.format("error: kernel %s expects %d features per example but got %s", name, inputs, shape));
		
		int batchSize = shape.numberOfExamples();
		
		Variable output = new Variable (new Shape (new int [] { batchSize, outputs }));
		
		float [] x = input.getData();
		float [] y = output.getData();
		float [] w = weights.getData();
		
		for (int n = 0; n < batchSize; ++n) {
			for (int o = 0; o < outputs; ++o) {
				float sum = (bias != null) ? bias.getData()[o] : 0;
				for (int k = 0; k < inputs; ++k)
					sum += x[n * inputs + k] * w[o * inputs + k];
				y[n * outputs + o] = sum;
			}
		}
		
		retain (input, phase);
		
		return output;
	}
	
	public Variable computeGradient (Variable gradient, ModelGradient modelGradient) {
		
		Variable input = getRetainedInput ();
		
		int batchSize = input.getShape().numberOfExamples();
		
		checkGradient (gradient, new Shape (new int [] { batchSize, outputs }));
		
		Variable inputGradient = new Variable (input.getShape().copy());
		
		float [] x  = input.getData();
		float [] dx = inputGradient.getData();
		float [] dy = gradient.getData();
		float [] w  = weights.getData();
		float [] dw = modelGradient.getGradient(weights);
		float [] db = (bias != null) ? modelGradient.getGradient(bias) : null;
		
		for (int n = 0; n < batchSize; ++n) {
			for (int o = 0; o < outputs; ++o) {
				
				float delta = dy[n * outputs + o];
				
				if (db != null)
					db[o] += delta;
				
				for (int k = 0; k < inputs; ++k) {
					dw[o * inputs + k] += delta * x[n * inputs + k];
					dx[n * inputs + k] += delta * w[o * inputs + k];
				}
			}
		}
		
		return inputGradient;
	}
}
