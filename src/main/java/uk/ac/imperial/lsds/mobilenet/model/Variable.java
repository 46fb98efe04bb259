package uk.ac.imperial.lsds.mobilenet.model;

import java.util.Arrays;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import uk.ac.imperial.lsds.mobilenet.device.random.RandomGenerator;

/*
 * A named, shaped tensor of single-precision floats, stored in row-major
 * (NCHW for 4-D tensors) order.
 */
public class Variable {
	
	private final static Logger log = LogManager.getLogger(Variable.class);
	
	private Shape shape;
	
	private float [] data;
	
	private String name = "Var";
	
	private int capacity;
	
	public Variable (Shape shape) {
		
		this (null, shape);
	}
	
	public Variable (String name, Shape shape) {
		
		this (name, shape, null);
	}
	
	public Variable (String name, Shape shape, float [] data) {
		
		if (name != null)
			this.name = name;
		
		if (shape == null)
			throw new NullPointerException ("error: variable shape is null");
		
		this.shape = shape;
		
		capacity = shape.countAllElements();
		
		if (capacity <= 0)
			throw new IllegalStateException (String.format("error: capacity of variable %s must be greater than 0", this.name));
		
		if (data == null) {
			/* Allocate buffer */
			this.data = new float [capacity];
		}
		else {
			if (data.length != capacity)
				throw new IllegalArgumentException (String.format("error: variable %s shaped %s cannot wrap %d elements", this.name, shape, data.length));
			this.data = data;
		}
	}
	
	/* Number of elements */
	public int capacity () {
		return capacity;
	}
	
	public Shape getShape () {
		return shape;
	}
	
	public float [] getData () {
		return data;
	}
	
	public String getName () {
		return name;
	}
	
	public Variable copy () {
		
		return new Variable (name, shape.copy(), Arrays.copyOf(data, data.length));
	}
	
	/*
	 * Overwrite this variable's values with those of `other`. Shapes must
	 * match exactly; no coercion is attempted.
	 */
	public void copyFrom (Variable other) {
		
		if (! shape.equals(other.getShape()))
			throw new IllegalStateException (String.format("error: cannot load variable %s shaped %s into %s shaped %s", 
					other.getName(), other.getShape(), name, shape));
		
		log.debug(String.format("Copy %d elements from %s to %s", capacity, other.getName(), name));
		
		System.arraycopy(other.getData(), 0, data, 0, capacity);
	}
	
	public void initialise (InitialiserConf conf, RandomGenerator random) {
		
		new Initialiser (conf, this, random).initialise();
	}
	
	public String toString () {
		return String.format("%s (shape %s)", name, shape);
	}
}
