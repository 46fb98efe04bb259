package uk.ac.imperial.lsds.mobilenet.kernel;

import java.util.List;

import uk.ac.imperial.lsds.mobilenet.model.Model;
import uk.ac.imperial.lsds.mobilenet.model.ModelGradient;
import uk.ac.imperial.lsds.mobilenet.model.Variable;
import uk.ac.imperial.lsds.mobilenet.types.KernelType;
import uk.ac.imperial.lsds.mobilenet.types.Phase;

public interface IKernel {
	
	public KernelType getKernelType ();
	
	/*
	 * Binds the kernel to a name and an input channel count, and registers
	 * its variables (named `name.<variable>`) with the model.
	 */
	public IKernel setup (String name, int channels, Model model);
	
	public String getName ();
	
	public int numberOfInputs ();
	public int numberOfOutputs ();
	
	public Variable compute (Variable input, Phase phase);
	
	/*
	 * Back-propagates `gradient` (the loss gradient w.r.t. the output of the 
	 * most recent training-phase `compute` call), accumulates parameter 
	 * gradients into `modelGradient` and returns the gradient w.r.t. the input.
	 */
	public Variable computeGradient (Variable gradient, ModelGradient modelGradient);
	
	public List<Variable> getVariables ();
	
	public List<IKernel> getChildren ();
}
