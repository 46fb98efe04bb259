package uk.ac.imperial.lsds.mobilenet.kernel.conf;

import uk.ac.imperial.lsds.mobilenet.types.ActivationMode;

public class ActivationConf implements IConf {
	
	private ActivationMode mode;
	
	public ActivationConf () {
		mode = ActivationMode.RELU;
	}
	
	public ActivationConf setMode (ActivationMode mode) {
		this.mode = mode;
		return this;
	}
	
	public ActivationMode getMode () {
		return mode;
	}
}
