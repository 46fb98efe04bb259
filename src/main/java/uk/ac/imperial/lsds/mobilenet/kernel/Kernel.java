package uk.ac.imperial.lsds.mobilenet.kernel;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import uk.ac.imperial.lsds.mobilenet.model.Model;
import uk.ac.imperial.lsds.mobilenet.model.Shape;
import uk.ac.imperial.lsds.mobilenet.model.Variable;
import uk.ac.imperial.lsds.mobilenet.types.Phase;

public abstract class Kernel implements IKernel {
	
	protected String name = null;
	
	protected int inputs = -1, outputs = -1;
	
	protected List<Variable> variables = new ArrayList<Variable>();
	
	/* Input of the last training-phase forward pass */
	protected Variable theInput = null;
	
	public String getName () {
		return name;
	}
	
	public int numberOfInputs () {
		return inputs;
	}
	
	public int numberOfOutputs () {
		return outputs;
	}
	
	public List<Variable> getVariables () {
		return Collections.unmodifiableList(variables);
	}
	
	public List<IKernel> getChildren () {
		return Collections.emptyList();
	}
	
	public boolean isSetup () {
		return (name != null);
	}
	
	protected Variable register (Model model, Variable variable, boolean isTrainable) {
		model.register(variable, isTrainable);
		variables.add(variable);
		return variable;
	}
	
	protected void checkSetup () {
		if (name == null)
			throw new IllegalStateException (String.format("error: %s kernel is not set up", getKernelType()));
	}
	
	/* Inputs are at least 2-D, with channels (or features) along axis 1 */
	protected void checkInput (Variable input, int dimensions) {
		
		checkSetup ();
		
		Shape shape = input.getShape();
		
		if (dimensions > 0 && shape.dimensions() != dimensions)
			throw new IllegalArgumentException (String.format("error: kernel %s expects a %d-D input but got %s", name, dimensions, shape));
		
		if (shape.dimensions() < 2)
			throw new IllegalArgumentException (String.format("error: kernel %s expects at least a 2-D input but got %s", name, shape));
		
		if (shape.get(1) != inputs)
			throw new IllegalArgumentException (String.format("error: kernel %s expects %d input channels but got %s", name, inputs, shape));
	}
	
	protected void checkGradient (Variable gradient, Shape expected) {
		
		if (! gradient.getShape().equals(expected))
			throw new IllegalArgumentException (String.format("error: kernel %s expects a gradient shaped %s but got %s", 
					name, expected, gradient.getShape()));
	}
	
	protected void retain (Variable input, Phase phase) {
		theInput = (phase == Phase.TRAIN) ? input : null;
	}
	
	protected Variable getRetainedInput () {
		if (theInput == null)
			throw new IllegalStateException (String.format("error: kernel %s has no training-phase forward pass to back-propagate through", name));
		return theInput;
	}
}
