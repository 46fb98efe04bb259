package uk.ac.imperial.lsds.mobilenet.block;

import uk.ac.imperial.lsds.mobilenet.types.ActivationMode;

/**
 * Immutable description of one inverted residual stage.
 * <p>
 * Channel counts are given at nominal width and scaled by the width multiplier,
 * then quantized to a multiple of {@link ChannelQuantizer#DIVISOR}. Kernel size,
 * stride, dilation, gate and activation pass through unchanged.
 */
public class BlockSpec {
	
	private final int inputChannels;
	private final int kernel;
	private final int expandedChannels;
	private final int outChannels;
	
	private final boolean useGate;
	
	private final ActivationMode activation;
	
	private final int stride;
	private final int dilation;
	
	public BlockSpec (int inputChannels, int kernel, int expandedChannels, int outChannels, boolean useGate, 
			ActivationMode activation, int stride, int dilation, double widthMult) {
		
		if (widthMult <= 0 || Double.isNaN(widthMult))
			throw new IllegalArgumentException (String.format("error: width multiplier must be greater than 0 (got %s)", widthMult));
		
		if (stride < 1 || stride > 2)
			throw new IllegalArgumentException (String.format("error: invalid stride %d (must be 1 or 2)", stride));
		
		if (kernel < 1 || (kernel % 2) == 0)
			throw new IllegalArgumentException (String.format("error: invalid kernel size %d (must be odd)", kernel));
		
		if (dilation < 1)
			throw new IllegalArgumentException (String.format("error: invalid dilation %d", dilation));
		
		if (activation == null)
			throw new IllegalArgumentException ("error: block activation is null");
		
		this.inputChannels    = adjustChannels (inputChannels,    widthMult);
		this.kernel           = kernel;
		this.expandedChannels = adjustChannels (expandedChannels, widthMult);
		this.outChannels      = adjustChannels (outChannels,      widthMult);
		this.useGate          = useGate;
		this.activation       = activation;
		this.stride           = stride;
		this.dilation         = dilation;
	}
	
	public BlockSpec (int inputChannels, int kernel, int expandedChannels, int outChannels, boolean useGate, 
			String activation, int stride, int dilation, double widthMult) {
		
		this (inputChannels, kernel, expandedChannels, outChannels, useGate, ActivationMode.fromTag (activation), stride, dilation, widthMult);
	}
	
	public static int adjustChannels (int channels, double widthMult) {
		
		return ChannelQuantizer.quantize (channels * widthMult, ChannelQuantizer.DIVISOR);
	}
	
	public int getInputChannels () {
		return inputChannels;
	}
	
	public int getKernel () {
		return kernel;
	}
	
	public int getExpandedChannels () {
		return expandedChannels;
	}
	
	public int getOutChannels () {
		return outChannels;
	}
	
	public boolean useGate () {
		return useGate;
	}
	
	public ActivationMode getActivation () {
		return activation;
	}
	
	public int getStride () {
		return stride;
	}
	
	public int getDilation () {
		return dilation;
	}
	
	public boolean hasShortcut () {
		return (stride == 1 && inputChannels == outChannels);
	}
	
	public String toString () {
		return String.format("BlockSpec (%d -> %d -> %d, k%d, s%d, d%d, %s%s)", inputChannels, expandedChannels, outChannels, 
				kernel, stride, dilation, activation, (useGate ? ", gated" : ""));
	}
}
