// Copyright (c) 2001-2014 Genome Research Ltd.
//
// Authors: David Harper
//          Ed Zuiderwijk
//          Kate Taylor
//
// This file is part of RnaFold.
//
// RnaFold is free software: you can redistribute it and/or modify it under
// the terms of the GNU General Public License as published by the Free Software
// Foundation; either version 3 of the License, or (at your option) any later
// version.
//
// This program is distributed in the hope that it will be useful, but WITHOUT
// ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or FITNESS
// FOR A PARTICULAR PURPOSE. See the GNU General Public License for more
// details.
//
// You should have received a copy of the GNU General Public License along with
// this program. If not, see <http://www.gnu.org/licenses/>.

package uk.ac.sanger.rnafold;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

import uk.ac.sanger.rnafold.logging.LongMessageFormatter;
import uk.ac.sanger.rnafold.logging.ShortMessageFormatter;

/**
 * Process-wide configuration and logging. Properties are read from the
 * <code>/resources/rnafold.props</code> resource, then from
 * <code>~/.rnafold/rnafold.props</code>, then from the first
 * <code>.rnafold.props</code> found by walking up from the working directory.
 * Later files override earlier ones, and system properties back them all.
 */
public class RnaFold {
	protected static final String PROJECT_PROPERTIES_FILE = ".rnafold.props";
	protected static final String DEFAULT_PROPERTIES_RESOURCE = "/resources/rnafold.props";

	public static final String LOGGER_NAME = "uk.ac.sanger.rnafold";

	public final static String BUILD_VERSION_KEY = "build.version";
	public final static String LOG_LEVEL_KEY = "rnafold.log.level";
	public final static String LOG_FILE_KEY = "rnafold.log.file";

	protected static Properties rnafoldProps = new Properties(System
			.getProperties());
	protected static Logger logger = Logger.getLogger(LOGGER_NAME);

	static {
		loadProperties();
		initialiseLogging();
	}

	private static void loadProperties() {
		InputStream is = RnaFold.class
				.getResourceAsStream(DEFAULT_PROPERTIES_RESOURCE);

		if (is != null)
			loadProperties(is, DEFAULT_PROPERTIES_RESOURCE);
		else
			System.err.println("Unable to find the resource "
					+ DEFAULT_PROPERTIES_RESOURCE);

		File userhome = new File(System.getProperty("user.home"));
		File dotrnafold = new File(userhome, ".rnafold");
		File privateprops = new File(dotrnafold, "rnafold.props");

		if (privateprops.isFile() && privateprops.canRead())
			loadProperties(privateprops);

		// Walk up the directory tree from the working directory, looking for
		// a project-specific properties file.

		File dir = new File(System.getProperty("user.dir"));

		boolean found = false;

		while (dir != null && !found) {
			File file = new File(dir, PROJECT_PROPERTIES_FILE);

			if (file.isFile() && file.canRead()) {
				loadProperties(file);
				found = true;
			} else
				dir = dir.getParentFile();
		}
	}

	private static void loadProperties(File file) {
		try {
			loadProperties(new FileInputStream(file), file.getPath());
		} catch (IOException ioe) {
			System.err.println("Failed to open properties file " + file.getPath()
					+ " : " + ioe.getMessage());
		}
	}

	private static void loadProperties(InputStream is, String source) {
		try {
			try {
				rnafoldProps.load(is);
			} finally {
				is.close();
			}
		} catch (IOException ioe) {
			System.err.println("Failed to read properties from " + source + " : "
					+ ioe.getMessage());
		}
	}

	private static void initialiseLogging() {
		logger.setUseParentHandlers(false);

		String levelName = getProperty(LOG_LEVEL_KEY, "INFO");

		Level level = Level.INFO;
		String badLevel = null;

		try {
			level = Level.parse(levelName.trim().toUpperCase());
		} catch (IllegalArgumentException iae) {
			badLevel = levelName;
		}

		logger.setLevel(level);

		Handler console = new ConsoleHandler();
		console.setLevel(level);
		console.setFormatter(new ShortMessageFormatter());
		logger.addHandler(console);

		if (badLevel != null)
			logger.warning("Unknown log level \"" + badLevel + "\", using " + level);

		String logfile = getProperty(LOG_FILE_KEY);

		if (logfile != null && logfile.trim().length() > 0) {
			try {
				FileHandler filehandler = new FileHandler(logfile.trim(), true);
				filehandler.setLevel(level);
				filehandler.setFormatter(new LongMessageFormatter());
				logger.addHandler(filehandler);
			} catch (IOException ioe) {
				logger.log(Level.WARNING,
						"Unable to create a FileHandler for logging to " + logfile, ioe);
			}
		}
	}

	public static Properties getProperties() {
		return rnafoldProps;
	}

	public static String getProperty(String key) {
		return rnafoldProps.getProperty(key);
	}

	public static String getProperty(String key, String defaultValue) {
		String value = getProperty(key);
		return (value == null) ? defaultValue : value;
	}

	public static boolean getBoolean(String key) {
		String value = rnafoldProps.getProperty(key);

		return value != null && value.trim().equalsIgnoreCase("true");
	}

	public static int getInteger(String key, int defaultValue) {
		String value = getProperty(key);

		if (value == null || value.trim().length() == 0)
			return defaultValue;

		try {
			return Integer.parseInt(value.trim());
		} catch (NumberFormatException nfe) {
			throw new IllegalArgumentException("The property " + key
					+ " must be an integer, not \"" + value + "\"", nfe);
		}
	}

	public static Logger getLogger() {
		return logger;
	}

	public static boolean isLoggable(Level level) {
		return logger.isLoggable(level);
	}

	public static void log(Level level, String message, Throwable throwable) {
		logger.log(level, message, throwable);
	}

	public static void log(Level level, String message) {
		logger.log(level, message);
	}

	public static void logFine(String message) {
		logger.log(Level.FINE, message);
	}

	public static void logInfo(String message) {
		logger.log(Level.INFO, message);
	}

	public static void logWarning(String message) {
		logger.log(Level.WARNING, message);
	}

	public static void logWarning(String message, Throwable throwable) {
		logger.log(Level.WARNING, message, throwable);
	}

	public static void logSevere(String message) {
		logger.log(Level.SEVERE, message);
	}

	public static void logSevere(Throwable throwable) {
		logger.log(Level.SEVERE, throwable.getMessage(), throwable);
	}

	public static void logSevere(String message, Throwable throwable) {
		logger.log(Level.SEVERE, message, throwable);
	}
}
