package edu.tum.cs.sat.util;

import java.io.FileReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.util.Properties;
import java.util.logging.Logger;

public class TableConfiguration extends Properties {

	private static final long serialVersionUID = -3961727184458062140L;
	private static final Logger logger = Logger.getLogger(TableConfiguration.class.getName());

	public static final String CONFIG_FILE_PROPERTY = "edu.tum.cs.sat.config";
	public static final String CONFIG_RESOURCE = "/summed-area-table.properties";

	// well-known properties, qualified by the owning class
	public static final String PROP_VALIDATE_COORDINATES = "validateCoordinates";
	public static final String PROP_CHECK_OVERFLOW = "checkOverflow";

	private final String root;

	/**
	 * Reads the file named by the system property {@value #CONFIG_FILE_PROPERTY}, or the classpath resource
	 * {@value #CONFIG_RESOURCE} if the property is not set. Without either, all lookups fall back to their defaults.
	 */
	public TableConfiguration(Class<?> cls) {
		try {
			String configFileName = System.getProperty(CONFIG_FILE_PROPERTY);
			if (configFileName != null) {
				Reader reader = new FileReader(configFileName);
				try {
					load(reader);
				} finally {
					reader.close();
				}
				logger.config("loaded configuration from " + configFileName);
			} else {
				InputStream is = TableConfiguration.class.getResourceAsStream(CONFIG_RESOURCE);
				if (is != null) {
					try {
						load(is);
					} finally {
						is.close();
					}
					logger.config("loaded configuration from classpath resource " + CONFIG_RESOURCE);
				} else {
					logger.config("no configuration found, using defaults");
				}
			}
		} catch (IOException ex) {
			throw new RuntimeException("error reading configuration", ex);
		}
		root = cls.getSimpleName();
	}

	/**
	 * Creates a configuration from explicitly given properties, ignoring any configuration file.
	 */
	public TableConfiguration(Class<?> cls, Properties props) {
		putAll(props);
		root = cls.getSimpleName();
	}

	private String makeGlobal(String key) {
		return root + "." + key;
	}

	/**
	 * @throws RuntimeException if the key is not set and no default is given
	 */
	@Override
	public String getProperty(String key, String defaultValue) {
		String value = super.getProperty(key);
		if (value == null) {
			value = defaultValue;
			if (value == null)
				throw new RuntimeException("required property '" + key + "' not specified");
		}
		return value;
	}

	public String getLocalProperty(String key, String defaultValue) {
		return getProperty(makeGlobal(key), defaultValue);
	}

	public boolean getBooleanProperty(String key, Boolean defaultValue) {
		String rawValue = getProperty(key, (defaultValue != null) ? defaultValue.toString() : null);
		return Boolean.parseBoolean(rawValue.trim());
	}

	public boolean getLocalBooleanProperty(String key, Boolean defaultValue) {
		return getBooleanProperty(makeGlobal(key), defaultValue);
	}

	public boolean isValidatingCoordinates() {
		return getLocalBooleanProperty(PROP_VALIDATE_COORDINATES, true);
	}

	public boolean isCheckingOverflow() {
		return getLocalBooleanProperty(PROP_CHECK_OVERFLOW, true);
	}

}
