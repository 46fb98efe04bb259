package uk.ac.imperial.lsds.mobilenet.cli;

import java.util.List;
import java.util.Map;

/*
 * A configuration object that can be filled in from the command line.
 */
public interface IConfiguration {
	
	public List<Option> getOptions ();
	
	/* Returns true if `arg` belongs to this configuration */
	public boolean parse (String arg, Option opt);
	
	/* Flag name (without dashes) to current value, in declaration order */
	public Map<String, Object> toMap ();
}
