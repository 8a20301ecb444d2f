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

package pixelserve.lib.common;

import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.event.Level;

import com.google.common.collect.Sets;

/**
 * Helpers for logging messages that would otherwise be repeated on every request.
 * 
 * @author PixelServe developers
 */
public class LogTools {
	
	/**
	 * Keys of messages already logged, combining the logger name, level and message.
	 */
	private static final Set<String> alreadyLogged = Sets.newConcurrentHashSet();
	
	// Suppress default constructor for non-instantiability
	private LogTools() {
		throw new AssertionError();
	}

	/**
	 * Log a message once at the specified level.
	 * <p>
	 * The same message may still be logged once for each logger and level.
	 * 
	 * @param logger
	 * @param level
	 * @param message
	 * @return true if the message was logged, false if it had been logged before
	 */
	public static boolean logOnce(Logger logger, Level level, String message) {
		String key = logger.getName() + '\n' + level + '\n' + message;
		if (!alreadyLogged.add(key))
			return false;
		logger.atLevel(level).log(message);
		return true;
	}

	/**
	 * Log a message once at the INFO level.
	 * 
	 * @param logger
	 * @param message
	 * @return true if the message was logged, false if it had been logged before
	 */
	public static boolean logOnce(Logger logger, String message) {
		return logOnce(logger, Level.INFO, message);
	}

	/**
	 * Log a message once at the WARN level.
	 * 
	 * @param logger
	 * @param message
	 * @return true if the message was logged, false if it had been logged before
	 */
	public static boolean warnOnce(Logger logger, String message) {
		return logOnce(logger, Level.WARN, message);
	}

}
