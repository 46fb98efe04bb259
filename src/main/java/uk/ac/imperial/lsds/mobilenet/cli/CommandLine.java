package uk.ac.imperial.lsds.mobilenet.cli;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/*
 * Parses `--flag value` pairs and hands every recognised flag to the
 * configuration objects in turn until one of them claims it. Flags that
 * are not given are handed over with their default value.
 */
public class CommandLine {
	
	private final static Logger log = LogManager.getLogger (CommandLine.class);
	
	private Options options;
	
	private IConfiguration [] configurations;
	
	public CommandLine (Options options, IConfiguration... configurations) {
		this.options = options;
		this.configurations = configurations;
	}
	
	public Options getOptions () {
		return options;
	}
	
	public void parse (String [] args) {
		
		Option option;
		
		int i, j;
		
		for (i = 0; i < args.length; ) {
			
			if ((j = i + 1) == args.length)
				throw new IllegalArgumentException (String.format("error: option %s has no value", args[i]));
			
			if ((option = options.find(args[i])) == null)
				throw new IllegalArgumentException (String.format("error: invalid option: %s %s", args[i], args[j]));
			
			option.setValue(args[j]);
			
			if (! parseOther (args[i], option))
				log.warn(String.format("Option %s is not claimed by any configuration", args[i]));
			
			i = j + 1;
		}
		
		/* Options left out take their default value */
		for (Option opt: options.values())
			if (! opt.hasValue() && opt.getDefaultValue() != null)
				parseOther (opt.getOpt(), opt);
		
		options.check();
	}
	
	private boolean parseOther (String arg, Option opt) {
		
		for (IConfiguration conf: configurations)
			if (conf.parse(arg, opt))
				return true;
		return false;
	}
}
