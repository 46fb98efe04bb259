package uk.ac.imperial.lsds.mobilenet;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import uk.ac.imperial.lsds.mobilenet.block.BlockSpec;
import uk.ac.imperial.lsds.mobilenet.block.ChannelQuantizer;
import uk.ac.imperial.lsds.mobilenet.block.ConvNormAct;
import uk.ac.imperial.lsds.mobilenet.block.InvertedResidual;
import uk.ac.imperial.lsds.mobilenet.device.random.RandomGenerator;
import uk.ac.imperial.lsds.mobilenet.kernel.Activation;
import uk.ac.imperial.lsds.mobilenet.kernel.BatchNorm;
import uk.ac.imperial.lsds.mobilenet.kernel.Conv;
import uk.ac.imperial.lsds.mobilenet.kernel.Dropout;
import uk.ac.imperial.lsds.mobilenet.kernel.IKernel;
import uk.ac.imperial.lsds.mobilenet.kernel.InnerProduct;
import uk.ac.imperial.lsds.mobilenet.kernel.Pool;
import uk.ac.imperial.lsds.mobilenet.kernel.SubGraph;
import uk.ac.imperial.lsds.mobilenet.kernel.conf.BatchNormConf;
import uk.ac.imperial.lsds.mobilenet.kernel.conf.ConvNormActConf;
import uk.ac.imperial.lsds.mobilenet.kernel.conf.DropoutConf;
import uk.ac.imperial.lsds.mobilenet.kernel.conf.InnerProductConf;
import uk.ac.imperial.lsds.mobilenet.kernel.conf.PoolConf;
import uk.ac.imperial.lsds.mobilenet.model.InitialiserConf;
import uk.ac.imperial.lsds.mobilenet.model.Model;
import uk.ac.imperial.lsds.mobilenet.model.ModelGradient;
import uk.ac.imperial.lsds.mobilenet.model.Shape;
import uk.ac.imperial.lsds.mobilenet.model.Variable;
import uk.ac.imperial.lsds.mobilenet.types.ActivationMode;
import uk.ac.imperial.lsds.mobilenet.types.InitialiserType;
import uk.ac.imperial.lsds.mobilenet.types.KernelType;
import uk.ac.imperial.lsds.mobilenet.types.Phase;
import uk.ac.imperial.lsds.mobilenet.types.PoolMethod;
import uk.ac.imperial.lsds.mobilenet.types.VarianceNormalisation;

/**
 * MobileNetV3-Small.
 * <p>
 * The network is a {@code features} chain (stem, 11 inverted residual blocks and
 * a point-wise tail), a global average pool ({@code avgpool}) and a 
 * {@code classifier} chain (linear, hard-swish, dropout, linear). Variables are 
 * named after their position in these chains, e.g. {@code features.0.0.weight}
 * for the stem convolution or {@code classifier.3.bias} for the output bias.
 */
public class MobileNetV3 {
	
	private final static Logger log = LogManager.getLogger (MobileNetV3.class);
	
	public static final int INPUT_CHANNELS = 3;
	
	public static final String CLASSIFIER_WEIGHT = "classifier.3.weight";
	
	private ModelConf conf;
	
	private Model model;
	
	private List<BlockSpec> schedule;
	
	private SubGraph features;
	private Pool pool;
	private SubGraph classifier;
	
	private Set<String> classifierVariables;
	
	public MobileNetV3 (ModelConf conf) {
		
		validate (conf);
		
		this.conf = conf;
		
		model = new Model (new RandomGenerator (conf.getRandomSeed()));
		
		schedule = buildSchedule (conf.getWidthMultiplier(), conf.isReducedTail(), conf.isDilated());
		
		BatchNormConf normalisation = new BatchNormConf ()
			.setEpsilon (conf.getEpsilon())
			.setMovingAverageFraction (conf.getMovingAverageFraction());
		
		features = new SubGraph ();
		
		/* Stem */
		features.add (new ConvNormAct (new ConvNormActConf ()
				.setNumberOfOutputs (schedule.get(0).getInputChannels())
				.setKernel (3)
				.setStride (2)
				.setNormalisation (normalisation)
				.setActivation (ActivationMode.HARD_SWISH)));
		
		/* Body */
		for (BlockSpec spec: schedule)
			features.add (new InvertedResidual (spec, normalisation));
		
		/* Tail */
		int lastConvOutputs = ChannelQuantizer.quantize (576 * conf.getWidthMultiplier(), ChannelQuantizer.DIVISOR);
		features.add (new ConvNormAct (new ConvNormActConf ()
				.setNumberOfOutputs (lastConvOutputs)
				.setKernel (1)
				.setNormalisation (normalisation)
				.setActivation (ActivationMode.HARD_SWISH)));
		
		pool = new Pool (new PoolConf ().setMethod (PoolMethod.AVERAGE).setGlobal (true));
		
		int reduceDivider = conf.isReducedTail() ? 2 : 1;
		int lastChannel = ChannelQuantizer.quantize (1024 / reduceDivider * conf.getWidthMultiplier(), ChannelQuantizer.DIVISOR);
		
		classifier = new SubGraph ()
			.add (new InnerProduct (new InnerProductConf ().setNumberOfOutputs (lastChannel)))
			.add (new Activation (ActivationMode.HARD_SWISH))
			.add (new Dropout (new DropoutConf ().setRatio (conf.getDropout())))
			.add (new InnerProduct (new InnerProductConf ().setNumberOfOutputs (conf.numberOfClasses())));
		
		features.setup ("features", INPUT_CHANNELS, model);
		pool.setup ("avgpool", features.numberOfOutputs(), model);
		classifier.setup ("classifier", pool.numberOfOutputs(), model);
		
		model.finalise ();
		
		classifierVariables = new HashSet<String>();
		for (Variable v: classifier.getVariables())
			classifierVariables.add(v.getName());
		
		initialise ();
		
		log.info(String.format("MobileNetV3-Small: %d classes, width %.2f, %d variables (%d parameters)", 
				conf.numberOfClasses(), conf.getWidthMultiplier(), model.getSize(), countParameters ()));
	}
	
	private static void validate (ModelConf conf) {
		
		if (conf.numberOfClasses() < 1)
			throw new IllegalArgumentException (String.format("error: number of classes must be at least 1 (got %d)", conf.numberOfClasses()));
		
		double w = conf.getWidthMultiplier();
		
		if (! (w > 0))
			throw new IllegalArgumentException (String.format("error: width multiplier must be greater than 0 (got %s)", w));
		
		/* Narrower networks would clamp every stage to the minimum channel count */
		if (16 * w < ChannelQuantizer.DIVISOR / 2)
			throw new IllegalArgumentException (String.format("error: width multiplier %s is too small (minimum is 0.25)", w));
		
		if (conf.getDropout() < 0 || conf.getDropout() >= 1)
			throw new IllegalArgumentException (String.format("error: dropout ratio must be in [0, 1) (got %s)", conf.getDropout()));
	}
	
	/*
	 * The 11-stage MobileNetV3-Small schedule:
	 * 
	 * input, kernel, expanded, output, gate, activation, stride, dilation
	 */
	public static List<BlockSpec> buildSchedule (double widthMult, boolean reducedTail, boolean dilated) {
		
		int reduceDivider = reducedTail ? 2 : 1;
		int dilation = dilated ? 2 : 1;
		
		List<BlockSpec> list = new ArrayList<BlockSpec>();
		
		list.add (new BlockSpec (16, 3,  16, 16,  true, "RE", 2, 1, widthMult));
		list.add (new BlockSpec (16, 3,  72, 24, false, "RE", 2, 1, widthMult));
		list.add (new BlockSpec (24, 3,  88, 24, false, "RE", 1, 1, widthMult));
		list.add (new BlockSpec (24, 5,  96, 40,  true, "HS", 2, 1, widthMult));
		list.add (new BlockSpec (40, 5, 240, 40,  true, "HS", 1, 1, widthMult));
		list.add (new BlockSpec (40, 5, 240, 40,  true, "HS", 1, 1, widthMult));
		list.add (new BlockSpec (40, 5, 120, 48,  true, "HS", 1, 1, widthMult));
		list.add (new BlockSpec (48, 5, 144, 48,  true, "HS", 1, 1, widthMult));
		list.add (new BlockSpec (48, 5, 288 / reduceDivider, 96 / reduceDivider, true, "HS", 2, dilation, widthMult));
		list.add (new BlockSpec (96 / reduceDivider, 5, 576 / reduceDivider, 96 / reduceDivider, true, "HS", 1, dilation, widthMult));
		list.add (new BlockSpec (96 / reduceDivider, 5, 576 / reduceDivider, 96 / reduceDivider, true, "HS", 1, dilation, widthMult));
		
		return Collections.unmodifiableList(list);
	}
	
	/*
	 * Conv weights: normal with std sqrt(2 / fan-out), zero bias.
	 * Batch norm: weight 1, bias 0, running mean 0, running variance 1.
	 * Inner product weights: normal with std 0.01, zero bias.
	 */
	private void initialise () {
		
		RandomGenerator random = model.getRandomGenerator();
		
		InitialiserConf msra  = new InitialiserConf ().setType (InitialiserType.MSRA).setNorm (VarianceNormalisation.FAN_OUT);
		InitialiserConf gauss = new InitialiserConf ().setType (InitialiserType.GAUSSIAN).setStd (0.01F);
		InitialiserConf zeros = new InitialiserConf ().setType (InitialiserType.CONSTANT).setValue (0);
		InitialiserConf ones  = new InitialiserConf ().setType (InitialiserType.CONSTANT).setValue (1);
		
		List<IKernel> stack = new ArrayList<IKernel>();
		stack.add (classifier);
		stack.add (pool);
		stack.add (features);
		
		while (! stack.isEmpty()) {
			
			IKernel kernel = stack.remove(stack.size() - 1);
			
			switch (kernel.getKernelType()) {
			
			case CONV:
				Conv conv = (Conv) kernel;
				conv.getWeights().initialise (msra, random);
				if (conv.hasBias())
					conv.getBias().initialise (zeros, random);
				break;
				
			case BATCHNORM:
				BatchNorm norm = (BatchNorm) kernel;
				norm.getWeights().initialise (ones, random);
				norm.getBias().initialise (zeros, random);
				norm.getRunningMean().initialise (zeros, random);
				norm.getRunningVariance().initialise (ones, random);
				break;
				
			case INNER_PRODUCT:
				InnerProduct ip = (InnerProduct) kernel;
				ip.getWeights().initialise (gauss, random);
				if (ip.getBias() != null)
					ip.getBias().initialise (zeros, random);
				break;
				
			case ACTIVATION:
			case POOL:
			case DROPOUT:
				break;
				
			case SUBGRAPH:
			case CONV_NORM_ACT:
			case SQUEEZE_EXCITE:
			case INVERTED_RESIDUAL:
				/* Visit children in order */
				List<IKernel> children = kernel.getChildren();
				for (int i = children.size() - 1; i >= 0; --i)
					stack.add (children.get(i));
				break;
				
			default:
				throw new IllegalStateException (String.format("error: unknown kernel type %s", kernel.getKernelType()));
			}
		}
	}
	
	/**
	 * Computes logits [B, classes] for images [B, 3, H, W].
	 */
	public Variable forward (Variable input, Phase phase) {
		
		Shape shape = input.getShape();
		
		if (shape.dimensions() != 4 || shape.numberOfChannels() != INPUT_CHANNELS)
			throw new IllegalArgumentException (String.format("error: expected input shaped [batch, 3, height, width] but got %s", shape));
		
		Variable x = features.compute (input, phase);
		x = pool.compute (x, phase);
		
		return classifier.compute (x, phase);
	}
	
	/**
	 * Back-propagates the loss gradient w.r.t. the logits of the last training-phase
	 * forward pass, accumulating parameter gradients into {@code gradient}.
	 */
	public Variable computeGradient (Variable logitsGradient, ModelGradient gradient) {
		
		if (gradient.getParent() != model)
			throw new IllegalArgumentException ("error: gradient does not belong to this network's model");
		
		Variable g = classifier.computeGradient (logitsGradient, gradient);
		g = pool.computeGradient (g, gradient);
		
		return features.computeGradient (g, gradient);
	}
	
	/**
	 * Copies every source variable whose name this network also has. If the source
	 * was trained for a different number of classes, the classifier is left as is.
	 * 
	 * @return the number of variables copied
	 */
	public int transplant (Map<String, Variable> source) {
		
		boolean sameClasses = true;
		
		Variable weights = source.get(CLASSIFIER_WEIGHT);
		if (weights != null) {
			int sourceClasses = weights.getShape().get(0);
			sameClasses = (sourceClasses == conf.numberOfClasses());
			if (! sameClasses)
				log.info(String.format("Source has %d classes (target has %d); keep the classifier", sourceClasses, conf.numberOfClasses()));
		}
		
		if (sameClasses)
			return model.transplant (source, Collections.<String>emptySet());
		
		return model.transplant (source, classifierVariables);
	}
	
	public boolean isClassifierVariable (String name) {
		return classifierVariables.contains(name);
	}
	
	/* Kernels of the given type, in network order */
	public List<IKernel> getKernels (KernelType type) {
		
		List<IKernel> result = new ArrayList<IKernel>();
		collect (features, type, result);
		collect (pool, type, result);
		collect (classifier, type, result);
		return result;
	}
	
	private static void collect (IKernel kernel, KernelType type, List<IKernel> result) {
		
		if (kernel.getKernelType() == type)
			result.add(kernel);
		
		for (IKernel child: kernel.getChildren())
			collect (child, type, result);
	}
	
	public long countParameters () {
		
		long count = 0;
		for (Variable v: model.getTrainableVariables())
			count += v.capacity();
		return count;
	}
	
	public ModelConf getConf () {
		return conf;
	}
	
	public Model getModel () {
		return model;
	}
	
	public List<BlockSpec> getSchedule () {
		return schedule;
	}
	
	public SubGraph getFeatures () {
		return features;
	}
	
	public SubGraph getClassifier () {
		return classifier;
	}
	
	public int numberOfClasses () {
		return conf.numberOfClasses();
	}
}
