package uk.ac.imperial.lsds.mobilenet.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import uk.ac.imperial.lsds.mobilenet.device.random.RandomGenerator;

/*
 * The set of named variables that make up a network. 
 * 
 * Trainable variables (weights and biases) are collected by the optimiser; 
 * the rest (normalisation running statistics) are only part of the state 
 * that is checkpointed and transplanted.
 */
public class Model {
	
	private final static Logger log = LogManager.getLogger (Model.class);
	
	private Map<String, Variable> variables;
	private Map<String, Boolean> trainable;
	
	private RandomGenerator random;
	
	private boolean finalised;
	
	public Model (RandomGenerator random) {
		
		variables = new LinkedHashMap<String, Variable>();
		trainable = new LinkedHashMap<String, Boolean>();
		
		this.random = random;
		
		finalised = false;
	}
	
	public RandomGenerator getRandomGenerator () {
		return random;
	}
	
	public Variable register (Variable variable, boolean isTrainable) {
		
		if (finalised)
			throw new IllegalStateException ("error: model is already finalised");
		
		String name = variable.getName();
		
		if (variables.containsKey(name))
			throw new IllegalArgumentException (String.format("error: variable %s is already registered", name));
		
		variables.put(name, variable);
		trainable.put(name, isTrainable);
		
		log.debug(String.format("Registered %s variable %s", (isTrainable ? "trainable" : "non-trainable"), variable));
		
		return variable;
	}
	
	public Model finalise () {
		
		if (finalised)
			throw new IllegalStateException ("error: model is already finalised");
		
		log.debug(String.format("Model finalised with %d variables (%d elements)", getSize(), numberOfElements()));
		
		finalised = true;
		return this;
	}
	
	public int getSize () {
		return variables.size();
	}
	
	public long numberOfElements () {
		long count = 0L;
		for (Variable v: variables.values())
			count += v.capacity();
		return count;
	}
	
	public Variable getVariable (String name) {
		
		Variable v = variables.get(name);
		if (v == null)
			throw new IllegalArgumentException (String.format("error: invalid model variable request: %s", name));
		return v;
	}
	
	public boolean contains (String name) {
		return variables.containsKey(name);
	}
	
	public boolean isTrainable (String name) {
		
		Boolean t = trainable.get(name);
		if (t == null)
			throw new IllegalArgumentException (String.format("error: invalid model variable request: %s", name));
		return t.booleanValue();
	}
	
	/* The parameters an optimiser updates, in registration order */
	public List<Variable> getTrainableVariables () {
		
		List<Variable> list = new ArrayList<Variable>();
		for (Map.Entry<String, Variable> entry: variables.entrySet()) {
			if (trainable.get(entry.getKey()))
				list.add(entry.getValue());
		}
		return Collections.unmodifiableList(list);
	}
	
	/* A flat, insertion-ordered view of every variable, keyed by name */
	public Map<String, Variable> getState () {
		
		return Collections.unmodifiableMap(variables);
	}
	
	/*
	 * Strict load: `state` must provide every variable of this model, 
	 * with identical shapes.
	 */
	public void load (Map<String, Variable> state) {
		
		for (String name: variables.keySet()) {
			if (! state.containsKey(name))
				throw new IllegalStateException (String.format("error: variable %s is missing from model state", name));
		}
		
		for (Map.Entry<String, Variable> entry: variables.entrySet())
			entry.getValue().copyFrom(state.get(entry.getKey()));
		
		log.debug(String.format("Loaded %d variables", variables.size()));
	}
	
	/*
	 * Lenient, name-keyed merge: copy every source entry that this model also 
	 * registers and whose name is not in `excluded`. Unmatched variables keep their values.
	 * 
	 * Returns the number of variables copied.
	 */
	public int transplant (Map<String, Variable> source, Set<String> excluded) {
		
		int count = 0;
		
		for (Map.Entry<String, Variable> entry: source.entrySet()) {
			
			String name = entry.getKey();
			
			if (excluded.contains(name)) {
				log.debug(String.format("Skip excluded variable %s", name));
				continue;
			}
			
			Variable target = variables.get(name);
			if (target == null) {
				log.debug(String.format("Skip unmatched variable %s", name));
				continue;
			}
			
			target.copyFrom(entry.getValue());
			count ++;
		}
		
		log.info(String.format("Transplanted %d out of %d variables", count, variables.size()));
		
		return count;
	}
}
