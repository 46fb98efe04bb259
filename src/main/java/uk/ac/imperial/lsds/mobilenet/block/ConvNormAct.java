package uk.ac.imperial.lsds.mobilenet.block;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import uk.ac.imperial.lsds.mobilenet.kernel.Activation;
import uk.ac.imperial.lsds.mobilenet.kernel.BatchNorm;
import uk.ac.imperial.lsds.mobilenet.kernel.Conv;
import uk.ac.imperial.lsds.mobilenet.kernel.SubGraph;
import uk.ac.imperial.lsds.mobilenet.kernel.conf.ConvNormActConf;
import uk.ac.imperial.lsds.mobilenet.model.Model;
import uk.ac.imperial.lsds.mobilenet.types.KernelType;

/**
 * Convolution, then optional batch normalisation, then optional activation.
 * <p>
 * Stages are labelled by position, so variables are named {@code name.0.weight},
 * {@code name.1.running_mean}, and so on.
 */
public class ConvNormAct extends SubGraph {
	
	private final static Logger log = LogManager.getLogger (ConvNormAct.class);
	
	private ConvNormActConf conf;
	
	private Conv conv;
	private BatchNorm norm = null;
	private Activation activation = null;
	
	public ConvNormAct (ConvNormActConf conf) {
		
		this.conf = conf;
		
		conv = new Conv (conf.toConvConf ());
		add (conv);
		
		if (conf.getNormalisation() != null) {
			norm = new BatchNorm (conf.getNormalisation());
			add (norm);
		}
		
		if (conf.getActivation() != null) {
			activation = new Activation (conf.getActivation());
			add (activation);
		}
	}
	
	public KernelType getKernelType () {
		return KernelType.CONV_NORM_ACT;
	}
	
	public ConvNormAct setup (String name, int channels, Model model) {
		
		super.setup (name, channels, model);
		
		log.debug(String.format("%s: %d -> %d channels, k%d s%d p%d d%d g%d, %s, %s", name, channels, outputs, 
				conf.getKernel(), conf.getStride(), conf.getPadding(), conf.getDilation(), conf.numberOfGroups(), 
				(norm == null) ? "no norm" : "batch norm", 
				(activation == null) ? "linear" : activation.getMode().toString()));
		
		return this;
	}
	
	public ConvNormActConf getConf () {
		return conf;
	}
	
	public Conv getConv () {
		return conv;
	}
	
	public BatchNorm getNorm () {
		return norm;
	}
	
	public Activation getActivation () {
		return activation;
	}
}
