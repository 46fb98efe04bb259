package uk.ac.imperial.lsds.mobilenet.result;

import java.io.File;
import java.io.IOException;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

public class ResultWriter {
	
	private final static Logger log = LogManager.getLogger (ResultWriter.class);
	
	private final ObjectMapper mapper;
	
	public ResultWriter () {
		
		mapper = new ObjectMapper ();
		mapper.enable (SerializationFeature.INDENT_OUTPUT);
	}
	
	public void write (Results results, File file) throws IOException {
		
		mapper.writeValue (file, results);
		
		log.info(String.format("Results saved to %s", file.getPath()));
	}
	
	public Results read (File file) throws IOException {
		
		return mapper.readValue (file, Results.class);
	}
}
