package uk.ac.imperial.lsds.mobilenet.block;

/**
 * Rounds channel counts to a multiple of a divisor.
 * <p>
 * The result is the nearest multiple of {@code divisor} (ties rounding up), never
 * below {@code minValue}; when that loses more than 10% of {@code v}, one more
 * {@code divisor} is added.
 */
public class ChannelQuantizer {
	
	public static final int DIVISOR = 8;
	
	private ChannelQuantizer () {
	}
	
	public static int quantize (double v, int divisor) {
		
		return quantize (v, divisor, divisor);
	}
	
	public static int quantize (double v, int divisor, int minValue) {
		
		if (divisor <= 0)
			throw new IllegalArgumentException (String.format("error: quantization divisor must be greater than 0 (got %d)", divisor));
		
		if (v < 0 || Double.isNaN(v))
			throw new IllegalArgumentException (String.format("error: cannot quantize negative channel count %s", v));
		
		int candidate = Math.max(minValue, (int) Math.floor((v + divisor / 2D) / divisor) * divisor);
		
		if (candidate < 0.9D * v)
			candidate += divisor;
		
		return candidate;
	}
	
	public static int quantize (double v) {
		
		return quantize (v, DIVISOR);
	}
}
