package com.seamcarve;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;

/**
 * Platform-logger access for the file and command-line layers. The carving
 * classes do not log.
 */
final class Log
{
	// no-one calls
	private Log() {}

	static final String LOG_NAME = "com.seamcarve";

	static Logger logger()
	{
		return System.getLogger(LOG_NAME);
	}

	static void debug(String message)
	{
		logger().log(Level.DEBUG, message);
	}

	static void debug(String message, Throwable cause)
	{
		logger().log(Level.DEBUG, message, cause);
	}

	static void info(String message)
	{
		logger().log(Level.INFO, message);
	}

	static void warning(String message)
	{
		logger().log(Level.WARNING, message);
	}
}
