package uk.ac.imperial.lsds.mobilenet.result;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/*
 * The result record of a training run.
 */
@JsonPropertyOrder({ "final_info", "train_log_info", "val_log_info" })
public class Results {
	
	@JsonPropertyOrder({ "best_val_acc", "test_acc", "total_train_time", "config" })
	public static class FinalInfo {
		
		@JsonProperty("best_val_acc")
		private double bestValidationAccuracy;
		
		@JsonProperty("test_acc")
		private double testAccuracy;
		
		/* Seconds */
		@JsonProperty("total_train_time")
		private double totalTrainingTime;
		
		@JsonProperty("config")
		private Map<String, Object> configuration;
		
		public FinalInfo () {
		}
		
		public FinalInfo (double bestValidationAccuracy, double testAccuracy, double totalTrainingTime, Map<String, Object> configuration) {
			this.bestValidationAccuracy = bestValidationAccuracy;
			this.testAccuracy = testAccuracy;
			this.totalTrainingTime = totalTrainingTime;
			this.configuration = configuration;
		}
		
		public double getBestValidationAccuracy () {
			return bestValidationAccuracy;
		}
		
		public double getTestAccuracy () {
			return testAccuracy;
		}
		
		public double getTotalTrainingTime () {
			return totalTrainingTime;
		}
		
		public Map<String, Object> getConfiguration () {
			return configuration;
		}
	}
	
	@JsonProperty("final_info")
	private FinalInfo finalInfo;
	
	@JsonProperty("train_log_info")
	private List<Measurement> trainingLog;
	
	@JsonProperty("val_log_info")
	private List<Measurement> validationLog;
	
	public Results () {
	}
	
	public Results (FinalInfo finalInfo, List<Measurement> trainingLog, List<Measurement> validationLog) {
		this.finalInfo = finalInfo;
		this.trainingLog = trainingLog;
		this.validationLog = validationLog;
	}
	
	public FinalInfo getFinalInfo () {
		return finalInfo;
	}
	
	public List<Measurement> getTrainingLog () {
		return trainingLog;
	}
	
	public List<Measurement> getValidationLog () {
		return validationLog;
	}
}
