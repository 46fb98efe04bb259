package uk.ac.imperial.lsds.mobilenet.block;

import java.util.Collections;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import uk.ac.imperial.lsds.mobilenet.kernel.IKernel;
import uk.ac.imperial.lsds.mobilenet.kernel.Kernel;
import uk.ac.imperial.lsds.mobilenet.kernel.SubGraph;
import uk.ac.imperial.lsds.mobilenet.kernel.conf.BatchNormConf;
import uk.ac.imperial.lsds.mobilenet.kernel.conf.ConvNormActConf;
import uk.ac.imperial.lsds.mobilenet.model.Model;
import uk.ac.imperial.lsds.mobilenet.model.ModelGradient;
import uk.ac.imperial.lsds.mobilenet.model.Variable;
import uk.ac.imperial.lsds.mobilenet.types.KernelType;
import uk.ac.imperial.lsds.mobilenet.types.Phase;

/**
 * Expand, depthwise, optional squeeze-and-excitation gate, linear project;
 * plus the block input when the block has a shortcut.
 * <p>
 * The expand stage is omitted when the expanded channel count equals the input
 * channel count. Stages are labelled by their position in the realised chain,
 * so variables are named {@code name.block.<i>...}.
 */
public class InvertedResidual extends Kernel {
	
	private final static Logger log = LogManager.getLogger (InvertedResidual.class);
	
	private BlockSpec spec;
	
	private SubGraph block;
	
	private ConvNormAct expand = null;
	private ConvNormAct depthwise;
	private SqueezeExcite gate = null;
	private ConvNormAct project;
	
	public InvertedResidual (BlockSpec spec, BatchNormConf normalisation) {
		
		if (spec.getStride() < 1 || spec.getStride() > 2)
			throw new IllegalArgumentException (String.format("error: invalid stride %d (must be 1 or 2)", spec.getStride()));
		
		this.spec = spec;
		
		block = new SubGraph ();
		
		if (spec.getExpandedChannels() != spec.getInputChannels()) {
			
			expand = new ConvNormAct (new ConvNormActConf ()
					.setNumberOfOutputs (spec.getExpandedChannels())
					.setKernel (1)
					.setNormalisation (normalisation)
					.setActivation (spec.getActivation()));
			block.add (expand);
		}
		
		depthwise = new ConvNormAct (new ConvNormActConf ()
				.setNumberOfOutputs (spec.getExpandedChannels())
				.setKernel (spec.getKernel())
				.setStride (spec.getStride())
				.setDilation (spec.getDilation())
				.setNumberOfGroups (spec.getExpandedChannels())
				.setNormalisation (normalisation)
				.setActivation (spec.getActivation()));
		block.add (depthwise);
		
		if (spec.useGate()) {
			gate = new SqueezeExcite (SqueezeExcite.squeezeChannels (spec.getExpandedChannels()));
			block.add (gate);
		}
		
		project = new ConvNormAct (new ConvNormActConf ()
				.setNumberOfOutputs (spec.getOutChannels())
				.setKernel (1)
				.setNormalisation (normalisation)
				.setActivation (null));
		block.add (project);
	}
	
	public KernelType getKernelType () {
		return KernelType.INVERTED_RESIDUAL;
	}
	
	public InvertedResidual setup (String name, int channels, Model model) {
		
		if (channels != spec.getInputChannels())
			throw new IllegalArgumentException (String.format("error: block %s expects %d input channels but follows a stage with %d", 
					name, spec.getInputChannels(), channels));
		
		log.debug(String.format("Setup block %s: %s", name, spec));
		
		block.setup (name + ".block", channels, model);
		
		if (depthwise.numberOfInputs() != depthwise.getConf().numberOfGroups())
			throw new IllegalStateException (String.format("error: depthwise stage of block %s has %d channels but %d groups", 
					name, depthwise.numberOfInputs(), depthwise.getConf().numberOfGroups()));
		
		this.name = name;
		this.inputs = channels;
		this.outputs = block.numberOfOutputs();
		
		variables.addAll (block.getVariables());
		
		return this;
	}
	
	public boolean hasShortcut () {
		return spec.hasShortcut();
	}
	
	public SubGraph getBlock () {
		return block;
	}
	
	public ConvNormAct getExpand () {
		return expand;
	}
	
	public ConvNormAct getDepthwise () {
		return depthwise;
	}
	
	public SqueezeExcite getGate () {
		return gate;
	}
	
	public ConvNormAct getProject () {
		return project;
	}
	
	public List<IKernel> getChildren () {
		return Collections.<IKernel>singletonList(block);
	}
	
	public Variable compute (Variable input, Phase phase) {
		
		checkInput (input, 4);
		
		Variable output = block.compute (input, phase);
		
		if (hasShortcut ()) {
			float [] x = input.getData();
			float [] y = output.getData();
			for (int i = 0; i < y.length; ++i)
				y[i] += x[i];
		}
		
		retain (input, phase);
		
		return output;
	}
	
	public Variable computeGradient (Variable gradient, ModelGradient modelGradient) {
		
		getRetainedInput ();
		
		Variable inputGradient = block.computeGradient (gradient, modelGradient);
		
		if (hasShortcut ()) {
			float [] dy = gradient.getData();
			float [] dx = inputGradient.getData();
			for (int i = 0; i < dx.length; ++i)
				dx[i] += dy[i];
		}
		
		return inputGradient;
	}
}
