/*-
 * #%L
 * This file is part of PixelServe.
 * %%
 * Copyright (C) 2024 PixelServe developers
 * %%
 * PixelServe is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * PixelServe is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with PixelServe.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package pixelserve.lib.app.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;

/**
 * Manage the logback configuration at runtime.
 * 
 * @author PixelServe developers
 */
public class LogManager {
	
	private static final Logger logger = LoggerFactory.getLogger(LogManager.class);
	
	/**
	 * Available log levels.
	 */
	public static enum LogLevel {
		/**
		 * Trace logging (an awful lot of messages)
		 */
		TRACE,
		/**
		 * Debug logging (a lot of messages)
		 */
		DEBUG,
		/**
		 * Info logging (default)
		 */
		INFO,
		/**
		 * Warn logging (only if something is moderately important)
		 */
		WARN,
		/**
		 * Error logging (only if something goes recognizably wrong)
		 */
		ERROR,
		/**
		 * All log messages
		 */
		ALL,
		/**
		 * Turn off logging
		 */
		OFF;
	}
	
	// Suppress default constructor for non-instantiability
	private LogManager() {
		throw new AssertionError();
	}
	
	/**
	 * Set the log level for the root logger.
	 * @param logLevel
	 * @return true if the level could be set, false if logback is not the active binding
	 */
	public static boolean setRootLogLevel(LogLevel logLevel) {
		var root = getRootLogger();
		if (root == null) {
			logger.warn("Cannot get root logger!");
			return false;
		}
		root.setLevel(getLevel(logLevel));
		return true;
	}
	
	/**
	 * Get the log level of the root logger.
	 * @return the level, or null if logback is not the active binding
	 */
	public static LogLevel getRootLogLevel() {
		var root = getRootLogger();
		if (root == null || root.getLevel() == null)
			return null;
		return LogLevel.valueOf(root.getLevel().toString());
	}
	
	static Level getLevel(LogLevel level) {
		switch (level) {
		case ALL:
			return Level.ALL;
		case DEBUG:
			return Level.DEBUG;
		case ERROR:
			return Level.ERROR;
		case INFO:
			return Level.INFO;
		case OFF:
			return Level.OFF;
		case TRACE:
			return Level.TRACE;
		case WARN:
		default:
			return Level.WARN;
		}
	}
	
	static LoggerContext getLoggerContext() {
		if (LoggerFactory.getILoggerFactory() instanceof LoggerContext) {
			return (LoggerContext)LoggerFactory.getILoggerFactory();
		} else
			return null;
	}
	
	static ch.qos.logback.classic.Logger getRootLogger() {
		var context = getLoggerContext();
		return context == null ? null : context.getLogger(Logger.ROOT_LOGGER_NAME);
	}

}
