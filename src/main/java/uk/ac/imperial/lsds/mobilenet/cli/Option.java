package uk.ac.imperial.lsds.mobilenet.cli;

public class Option {
	
	private boolean initialised = false;
	
	private String opt;
	
	private boolean required;
	
	private String description;
	
	private Class<?> type = String.class;
	
	private String value, defaultValue = null;
	
	public Option (String opt, String description, boolean required, Class<?> type, String defaultValue) {
		
		this.opt = opt;
		
		this.description = description;
		
		this.required = required;
		
		this.type = type;
		
		this.value = null;
		
		if (defaultValue != null && ! isValid (defaultValue))
			throw new IllegalArgumentException (String.format("error: invalid option: %s %s", opt, defaultValue));
		
		this.defaultValue = defaultValue;
		
		this.initialised = (defaultValue != null);
	}
	
	public String getOpt () {
		
		return opt;
	}
	
	public boolean isRequired () {
		
		return required;
	}
	
	public String getDescription () {
		
		return description;
	}
	
	public String getDefaultValue () {
		
		return defaultValue;
	}
	
	public Option setValue (String value) {
		
		if (value == null)
			throw new IllegalArgumentException (String.format("error: option %s value is null", opt));
		
		if (! isValid(value))
			throw new IllegalArgumentException (String.format("error: invalid option: %s %s", opt, value));
		
		this.value = value;
		this.initialised = true;
		
		return this;
	}
	
	public String getStringValue () {
		
		return (value == null) ? defaultValue : value;
	}
	
	public int getIntValue () {
		
		return Integer.parseInt(getStringValue ());
	}
	
	public long getLongValue () {
		
		return Long.parseLong(getStringValue ());
	}
	
	public float getFloatValue () {
		
		return Float.parseFloat(getStringValue ());
	}
	
	public double getDoubleValue () {
		
		return Double.parseDouble(getStringValue ());
	}
	
	public boolean getBooleanValue () {
		
		return Boolean.parseBoolean(getStringValue ());
	}
	
	public boolean isInitialised () {
		return initialised;
	}
	
	/* True if a value was given explicitly, not just defaulted */
	public boolean hasValue () {
		return (value != null);
	}
	
	private boolean isValid (String v) {
		if (type == String.class) 
		{
			return true;
		} 
		else if (type == Integer.class) 
		{	
			try 
			{ 
				Integer.parseInt(v);
				return true;
			} 
			catch (NumberFormatException e) 
			{ 
				return false; 
			}	
		} 
		else if (type == Long.class) 
		{	
			try 
			{ 
				Long.parseLong(v);
				return true;
			} 
			catch (NumberFormatException e) 
			{ 
				return false; 
			}	
		} 
		else if (type == Float.class) 
		{	
			try 
			{ 
				Float.parseFloat(v);
				return true;
			} 
			catch (NumberFormatException e) 
			{ 
				return false; 
			}
		} 
		else if (type == Double.class) 
		{	
			try 
			{ 
				Double.parseDouble(v);
				return true;
			} 
			catch (NumberFormatException e) 
			{ 
				return false; 
			}
		} 
		else if (type == Boolean.class)
		{
			return (v.equals("true") || v.equals("false"));
		}
		
		return false;
	}

	public String getTypeString () {
		
		if (type == String.class) 
		{
			return "string";
		}
		else if (type == Integer.class) 
		{
			return "integer";
		}
		else if (type == Long.class) 
		{
			return "long";
		}
		else if (type == Float.class) 
		{
			return "float";
		}
		else if (type == Double.class) 
		{
			return "double";
		}
		else if (type == Boolean.class)
		{
			return "boolean";
		}
		
		throw new IllegalStateException ("error: unknown option type: " + type);
	}
}
