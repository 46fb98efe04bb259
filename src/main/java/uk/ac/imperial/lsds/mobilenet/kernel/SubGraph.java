package uk.ac.imperial.lsds.mobilenet.kernel;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import uk.ac.imperial.lsds.mobilenet.model.Model;
import uk.ac.imperial.lsds.mobilenet.model.ModelGradient;
import uk.ac.imperial.lsds.mobilenet.model.Variable;
import uk.ac.imperial.lsds.mobilenet.types.KernelType;
import uk.ac.imperial.lsds.mobilenet.types.Phase;

/*
 * An ordered chain of kernels. Each child is named `name.<label>`, where the
 * label defaults to the child's position in the chain, and its input channel
 * count is the output channel count of the previous child.
 */
public class SubGraph extends Kernel {
	
	private final static Logger log = LogManager.getLogger (SubGraph.class);
	
	protected List<IKernel> kernels = new ArrayList<IKernel>();
	
	protected List<String> labels = new ArrayList<String>();
	
	public KernelType getKernelType () {
		return KernelType.SUBGRAPH;
	}
	
	public SubGraph add (IKernel kernel) {
		
		return add (Integer.toString(kernels.size()), kernel);
	}
	
	public SubGraph add (String label, IKernel kernel) {
		
		if (isSetup ())
			throw new IllegalStateException (String.format("error: cannot add kernel %s to %s after setup", label, name));
		
		if (labels.contains(label))
			throw new IllegalArgumentException (String.format("error: duplicate kernel label %s", label));
		
		kernels.add(kernel);
		labels.add(label);
		
		return this;
	}
	
	public SubGraph setup (String name, int channels, Model model) {
		
		log.debug(String.format("Setup sub-graph %s with %d kernels", name, kernels.size()));
		
		if (kernels.isEmpty())
			throw new IllegalStateException (String.format("error: sub-graph %s is empty", name));
		
		this.name = name;
		this.inputs = channels;
		
		int c = channels;
		for (int i = 0; i < kernels.size(); ++i) {
			
			IKernel kernel = kernels.get(i);
			
			kernel.setup (name + "." + labels.get(i), c, model);
			variables.addAll (kernel.getVariables());
			
			c = kernel.numberOfOutputs();
		}
		
		this.outputs = c;
		
		return this;
	}
	
	public int size () {
		return kernels.size();
	}
	
	public IKernel get (int ndx) {
		return kernels.get(ndx);
	}
	
	public List<IKernel> getChildren () {
		return Collections.unmodifiableList(kernels);
	}
	
	public Variable compute (Variable input, Phase phase) {
		
		checkSetup ();
		
		Variable x = input;
		for (IKernel kernel: kernels)
			x = kernel.compute(x, phase);
		
		return x;
	}
	
	public Variable computeGradient (Variable gradient, ModelGradient modelGradient) {
		
		checkSetup ();
		
		Variable g = gradient;
		for (int i = kernels.size() - 1; i >= 0; --i)
			g = kernels.get(i).computeGradient(g, modelGradient);
		
		return g;
	}
}
