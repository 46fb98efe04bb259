package uk.ac.imperial.lsds.mobilenet.result;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/*
 * A training (epoch, batch, loss, acc, lr) or validation (epoch, loss, acc)
 * log entry. Accuracy is a percentage; fields that do not apply are null.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "epoch", "batch", "loss", "acc", "lr" })
public class Measurement {
	
	private Integer epoch;
	private Integer batch;
	
	private Double loss;
	private Double acc;
	private Double lr;
	
	public Measurement () {
	}
	
	public Measurement (int epoch, int batch, double loss, double acc, double lr) {
		this.epoch = epoch;
		this.batch = batch;
		this.loss = loss;
		this.acc = acc;
		this.lr = lr;
	}
	
	public Measurement (int epoch, double loss, double acc) {
		this.epoch = epoch;
		this.loss = loss;
		this.acc = acc;
	}
	
	public Integer getEpoch () {
		return epoch;
	}
	
	public void setEpoch (Integer epoch) {
		this.epoch = epoch;
	}
	
	public Integer getBatch () {
		return batch;
	}
	
	public void setBatch (Integer batch) {
		this.batch = batch;
	}
	
	public Double getLoss () {
		return loss;
	}
	
	public void setLoss (Double loss) {
		this.loss = loss;
	}
	
	public Double getAcc () {
		return acc;
	}
	
	public void setAcc (Double acc) {
		this.acc = acc;
	}
	
	public Double getLr () {
		return lr;
	}
	
	public void setLr (Double lr) {
		this.lr = lr;
	}
	
	public String toString () {
		if (batch != null)
			return String.format("Epoch: %d, Batch: %d, Loss: %.3f, Acc: %.3f%%, LR: %.6f", epoch, batch, loss, acc, lr);
		return String.format("Epoch: %d, Loss: %.3f, Acc: %.3f%%", epoch, loss, acc);
	}
}
