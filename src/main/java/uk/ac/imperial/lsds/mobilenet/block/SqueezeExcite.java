package uk.ac.imperial.lsds.mobilenet.block;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import uk.ac.imperial.lsds.mobilenet.kernel.Activation;
import uk.ac.imperial.lsds.mobilenet.kernel.Conv;
import uk.ac.imperial.lsds.mobilenet.kernel.IKernel;
import uk.ac.imperial.lsds.mobilenet.kernel.Kernel;
import uk.ac.imperial.lsds.mobilenet.kernel.Pool;
import uk.ac.imperial.lsds.mobilenet.kernel.conf.ConvConf;
import uk.ac.imperial.lsds.mobilenet.kernel.conf.PoolConf;
import uk.ac.imperial.lsds.mobilenet.model.Model;
import uk.ac.imperial.lsds.mobilenet.model.ModelGradient;
import uk.ac.imperial.lsds.mobilenet.model.Shape;
import uk.ac.imperial.lsds.mobilenet.model.Variable;
import uk.ac.imperial.lsds.mobilenet.types.ActivationMode;
import uk.ac.imperial.lsds.mobilenet.types.KernelType;
import uk.ac.imperial.lsds.mobilenet.types.Phase;
import uk.ac.imperial.lsds.mobilenet.types.PoolMethod;

/**
 * Squeeze-and-excitation gate.
 * <p>
 * The input [N, C, H, W] is pooled to [N, C, 1, 1], reduced to the squeeze
 * channel count by a 1x1 convolution ({@code fc1}), passed through a ReLU, 
 * expanded back to C channels ({@code fc2}) and squashed by a hard-sigmoid. 
 * The resulting per-channel scale, in [0, 1], multiplies the input.
 */
public class SqueezeExcite extends Kernel {
	
	private final static Logger log = LogManager.getLogger (SqueezeExcite.class);
	
	private int squeezeChannels;
	
	private Pool pool;
	private Conv fc1, fc2;
	private Activation activation, scaleActivation;
	
	private List<IKernel> children;
	
	private Variable theScale = null;
	
	public SqueezeExcite (int squeezeChannels) {
		
		this (squeezeChannels, ActivationMode.RELU, ActivationMode.HARD_SIGMOID);
	}
	
	public SqueezeExcite (int squeezeChannels, ActivationMode activationMode, ActivationMode scaleActivationMode) {
		
		if (squeezeChannels < 1)
			throw new IllegalArgumentException ("error: number of squeeze channels must be greater than 0");
		
		this.squeezeChannels = squeezeChannels;
		
		pool = new Pool (new PoolConf ().setMethod (PoolMethod.AVERAGE).setGlobal (true));
		fc1 = new Conv (new ConvConf ().setNumberOfOutputs (squeezeChannels).setBias (true));
		activation = new Activation (activationMode);
		scaleActivation = new Activation (scaleActivationMode);
	}
	
	/* Squeeze channel count for an input of `channels` channels */
	public static int squeezeChannels (int channels) {
		
		return ChannelQuantizer.quantize (channels / 4, ChannelQuantizer.DIVISOR);
	}
	
	public KernelType getKernelType () {
		return KernelType.SQUEEZE_EXCITE;
	}
	
	public SqueezeExcite setup (String name, int channels, Model model) {
		
		log.debug(String.format("Setup gate %s: %d -> %d -> %d channels", name, channels, squeezeChannels, channels));
		
		this.name = name;
		this.inputs = this.outputs = channels;
		
		fc2 = new Conv (new ConvConf ().setNumberOfOutputs (channels).setBias (true));
		
		pool.setup (name + ".avgpool", channels, model);
		fc1.setup (name + ".fc1", channels, model);
		activation.setup (name + ".activation", squeezeChannels, model);
		fc2.setup (name + ".fc2", squeezeChannels, model);
		scaleActivation.setup (name + ".scale_activation", channels, model);
		
		List<IKernel> list = new ArrayList<IKernel>();
		list.add (pool);
		list.add (fc1);
		list.add (activation);
		list.add (fc2);
		list.add (scaleActivation);
		children = Collections.unmodifiableList(list);
		
		variables.addAll (fc1.getVariables());
		variables.addAll (fc2.getVariables());
		
		return this;
	}
	
	public List<IKernel> getChildren () {
		return (children == null) ? Collections.<IKernel>emptyList() : children;
	}
	
	/* Per-channel scale, shaped [N, C, 1, 1] */
	public Variable computeScale (Variable input, Phase phase) {
		
		checkInput (input, 4);
		
		Variable x = pool.compute (input, phase);
		x = fc1.compute (x, phase);
		x = activation.compute (x, phase);
		x = fc2.compute (x, phase);
		
		return scaleActivation.compute (x, phase);
	}
	
	public Variable compute (Variable input, Phase phase) {
		
		Variable scale = computeScale (input, phase);
		
		Shape shape = input.getShape();
		
		int planes = shape.numberOfExamples() * inputs;
		int area = shape.height() * shape.width();
		
		Variable output = new Variable (shape.copy());
		
		float [] x = input.getData();
		float [] y = output.getData();
		float [] s = scale.getData();
		
		for (int i = 0; i < planes; ++i)
			for (int p = i * area; p < (i + 1) * area; ++p)
				y[p] = x[p] * s[i];
		
		retain (input, phase);
		theScale = (phase == Phase.TRAIN) ? scale : null;
		
		return output;
	}
	
	public Variable computeGradient (Variable gradient, ModelGradient modelGradient) {
		
		Variable input = getRetainedInput ();
		
		Shape shape = input.getShape();
		
		checkGradient (gradient, shape);
		
		int planes = shape.numberOfExamples() * inputs;
		int area = shape.height() * shape.width();
		
		Variable inputGradient = new Variable (shape.copy());
		Variable scaleGradient = new Variable (theScale.getShape().copy());
		
		float [] x  = input.getData();
		float [] s  = theScale.getData();
		float [] dy = gradient.getData();
		float [] dx = inputGradient.getData();
		float [] ds = scaleGradient.getData();
		
		for (int i = 0; i < planes; ++i) {
			float sum = 0;
			for (int p = i * area; p < (i + 1) * area; ++p) {
				dx[p] = dy[p] * s[i];
				sum += dy[p] * x[p];
			}
			ds[i] = sum;
		}
		
		/* Back through the gate branch */
		Variable g = scaleActivation.computeGradient (scaleGradient, modelGradient);
		g = fc2.computeGradient (g, modelGradient);
		g = activation.computeGradient (g, modelGradient);
		g = fc1.computeGradient (g, modelGradient);
		g = pool.computeGradient (g, modelGradient);
		
		float [] dg = g.getData();
		for (int i = 0; i < dx.length; ++i)
			dx[i] += dg[i];
		
		return inputGradient;
	}
}
