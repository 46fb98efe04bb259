package uk.ac.imperial.lsds.mobilenet.kernel;

import java.util.Arrays;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import uk.ac.imperial.lsds.mobilenet.kernel.conf.ConvConf;
import uk.ac.imperial.lsds.mobilenet.model.Model;
import uk.ac.imperial.lsds.mobilenet.model.ModelGradient;
import uk.ac.imperial.lsds.mobilenet.model.Shape;
import uk.ac.imperial.lsds.mobilenet.model.Variable;
import uk.ac.imperial.lsds.mobilenet.types.KernelType;
import uk.ac.imperial.lsds.mobilenet.types.Phase;

/*
 * Grouped, strided, padded and dilated 2-D convolution over NCHW inputs.
 * 
 * Weights are shaped as [outputs, channels / groups, kh, kw]. Output channel
 * `oc` belongs to group `oc / (outputs / groups)` and only reads the input
 * channels of that group. A depthwise convolution has groups == channels.
 */
public class Conv extends Kernel {
	
	private final static Logger log = LogManager.getLogger (Conv.class);
	
	private ConvConf conf;
	
	private int groups;
	
	private int kernelHeight, kernelWidth;
	private int strideHeight, strideWidth;
	private int paddingHeight, paddingWidth;
	private int dilationHeight, dilationWidth;
	
	private Variable weights, bias = null;
	
	public Conv (ConvConf conf) {
		
		this.conf = conf;
	}
	
	public KernelType getKernelType () {
		return KernelType.CONV;
	}
	
	public Conv setup (String name, int channels, Model model) {
		
		log.debug(String.format("Setup kernel %s", name));
		
		groups = conf.numberOfGroups();
		outputs = conf.numberOfOutputs();
		
		if (channels < 1 || outputs < 1)
			throw new IllegalArgumentException (String.format("error: kernel %s needs a positive number of channels and outputs (got %d and %d)", name, channels, outputs));
		
		if (groups < 1)
			throw new IllegalArgumentException (String.format("error: kernel %s needs at least one group", name));
		
		if ((channels % groups) != 0)
			throw new IllegalArgumentException (String.format("error: number of channels (%d) of kernel %s must be a multiple of group size (%d)", channels, name, groups));
		
		if ((outputs % groups) != 0)
			throw new IllegalArgumentException (String.format("error: number of outputs (%d) of kernel %s must be a multiple of group size (%d)", outputs, name, groups));
		
		kernelHeight   = conf.getKernelHeight   ();
		kernelWidth    = conf.getKernelWidth    ();
		strideHeight   = conf.getStrideHeight   ();
		strideWidth    = conf.getStrideWidth    ();
		paddingHeight  = conf.getPaddingHeight  ();
		paddingWidth   = conf.getPaddingWidth   ();
		dilationHeight = conf.getDilationHeight ();
		dilationWidth  = conf.getDilationWidth  ();
		
		if (kernelHeight < 1 || kernelWidth < 1 || strideHeight < 1 || strideWidth < 1 || dilationHeight < 1 || dilationWidth < 1)
			throw new IllegalArgumentException (String.format("error: invalid kernel, stride or dilation for kernel %s", name));
		
		if (paddingHeight < 0 || paddingWidth < 0)
			throw new IllegalArgumentException (String.format("error: invalid padding for kernel %s", name));
		
		log.debug(String.format("Kernel %dx%d stride %dx%d padding %dx%d dilation %dx%d, %d channels, %d groups", 
				kernelHeight, kernelWidth, strideHeight, strideWidth, paddingHeight, paddingWidth, dilationHeight, dilationWidth, channels, groups));
		
		this.name = name;
		this.inputs = channels;
		
		Shape w = new Shape (new int [] { outputs, channels / groups, kernelHeight, kernelWidth });
		
		weights = new Variable (name + ".weight", w);
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
	
	public boolean hasBias () {
		return (bias != null);
	}
	
	public int numberOfGroups () {
		return groups;
	}
	
	public int getStrideHeight () {
		return strideHeight;
	}
	
	public int getPaddingHeight () {
		return paddingHeight;
	}
	
	public int getDilationHeight () {
		return dilationHeight;
	}
	
	public int getKernelHeight () {
		return kernelHeight;
	}
	
	public int outputHeight (int height) {
		return (height + 2 * paddingHeight - dilationHeight * (kernelHeight - 1) - 1) / strideHeight + 1;
	}
	
	public int outputWidth (int width) {
		return (width + 2 * paddingWidth - dilationWidth * (kernelWidth - 1) - 1) / strideWidth + 1;
	}
	
	public Variable compute (Variable input, Phase phase) {
		
		checkInput (input, 4);
		
		Shape shape = input.getShape();
		
		int batchSize = shape.numberOfExamples();
		int H = shape.height();
		int W = shape.width();
		
		int OH = outputHeight (H);
		int OW = outputWidth  (W);
		
		if (OH < 1 || OW < 1)
			throw new IllegalArgumentException (String.format("error: input shaped %s is too small for kernel %s", shape, name));
		
		Variable output = new Variable (new Shape (new int [] { batchSize, outputs, OH, OW }));
		
		float [] x = input.getData();
		float [] y = output.getData();
		float [] w = weights.getData();
		
		int channelsPerGroup = inputs / groups;
		int outputsPerGroup = outputs / groups;
		
		for (int n = 0; n < batchSize; ++n) {
			for (int oc = 0; oc < outputs; ++oc) {
				
				int g = oc / outputsPerGroup;
				int yOffset = (n * outputs + oc) * OH * OW;
				
				if (bias != null)
					Arrays.fill(y, yOffset, yOffset + OH * OW, bias.getData()[oc]);
				
				for (int k = 0; k < channelsPerGroup; ++k) {
					
					int xOffset = (n * inputs + g * channelsPerGroup + k) * H * W;
					
					for (int ky = 0; ky < kernelHeight; ++ky) {
						for (int kx = 0; kx < kernelWidth; ++kx) {
							
							float value = w[((oc * channelsPerGroup + k) * kernelHeight + ky) * kernelWidth + kx];
							
							for (int oy = 0; oy < OH; ++oy) {
								
								int iy = oy * strideHeight - paddingHeight + ky * dilationHeight;
								if (iy < 0 || iy >= H)
									continue;
								
								int yRow = yOffset + oy * OW;
								int xRow = xOffset + iy * W;
								
								for (int ox = 0; ox < OW; ++ox) {
									
									int ix = ox * strideWidth - paddingWidth + kx * dilationWidth;
									if (ix < 0 || ix >= W)
										continue;
									
									y[yRow + ox] += value * x[xRow + ix];
								}
							}
						}
					}
				}
			}
		}
		
		retain (input, phase);
		
		return output;
	}
	
	public Variable computeGradient (Variable gradient, ModelGradient modelGradient) {
		
		Variable input = getRetainedInput ();
		
		Shape shape = input.getShape();
		
		int batchSize = shape.numberOfExamples();
		int H = shape.height();
		int W = shape.width();
		
		int OH = outputHeight (H);
		int OW = outputWidth  (W);
		
		checkGradient (gradient, new Shape (new int [] { batchSize, outputs, OH, OW }));
		
		Variable inputGradient = new Variable (shape.copy());
		
		float [] x  = input.getData();
		float [] dx = inputGradient.getData();
		float [] dy = gradient.getData();
		float [] w  = weights.getData();
		float [] dw = modelGradient.getGradient(weights);
		float [] db = (bias != null) ? modelGradient.getGradient(bias) : null;
		
		int channelsPerGroup = inputs / groups;
		int outputsPerGroup = outputs / groups;
		
		for (int n = 0; n < batchSize; ++n) {
			for (int oc = 0; oc < outputs; ++oc) {
				
				int g = oc / outputsPerGroup;
				int yOffset = (n * outputs + oc) * OH * OW;
				
				if (db != null) {
					float sum = 0;
					for (int p = yOffset; p < yOffset + OH * OW; ++p)
						sum += dy[p];
					db[oc] += sum;
				}
				
				for (int k = 0; k < channelsPerGroup; ++k) {
					
					int xOffset = (n * inputs + g * channelsPerGroup + k) * H * W;
					
					for (int ky = 0; ky < kernelHeight; ++ky) {
						for (int kx = 0; kx < kernelWidth; ++kx) {
							
							int ndx = ((oc * channelsPerGroup + k) * kernelHeight + ky) * kernelWidth + kx;
							float value = w[ndx];
							float sum = 0;
							
							for (int oy = 0; oy < OH; ++oy) {
								
								int iy = oy * strideHeight - paddingHeight + ky * dilationHeight;
								if (iy < 0 || iy >= H)
									continue;
								
								int yRow = yOffset + oy * OW;
								int xRow = xOffset + iy * W;
								
								for (int ox = 0; ox < OW; ++ox) {
									
									int ix = ox * strideWidth - paddingWidth + kx * dilationWidth;
									if (ix < 0 || ix >= W)
										continue;
									
									float delta = dy[yRow + ox];
									dx[xRow + ix] += value * delta;
									sum += x[xRow + ix] * delta;
								}
							}
							
							dw[ndx] += sum;
						}
					}
				}
			}
		}
		
		return inputGradient;
	}
}
