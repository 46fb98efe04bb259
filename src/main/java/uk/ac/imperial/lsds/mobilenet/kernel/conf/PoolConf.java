package uk.ac.imperial.lsds.mobilenet.kernel.conf;

import uk.ac.imperial.lsds.mobilenet.types.PoolMethod;

public class PoolConf implements IConf {
	
	private PoolMethod method;
	
	private boolean global;
	
	public PoolConf () {
		
		method = PoolMethod.AVERAGE;
		
		global = false;
	}
	
	public PoolConf setMethod (PoolMethod method) {
		this.method = method;
		return this;
	}
	
	public PoolMethod getMethod () {
		return method;
	}
	
	public PoolConf setGlobal (boolean global) {
		this.global = global;
		return this;
	}
	
	public boolean isGlobal () {
		return global;
	}
}
