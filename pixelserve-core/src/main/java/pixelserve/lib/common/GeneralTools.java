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

import java.util.Objects;
import java.util.Optional;

/**
 * A collection of generally-useful static methods.
 * 
 * @author PixelServe developers
 *
 */
public final class GeneralTools {
	
	// Suppressed default constructor for non-instantiability
	private GeneralTools() {
		throw new AssertionError();
	}
	
	/**
	 * Get extension from a filename or path.
	 * <ul>
	 * <li>This is 'the final dot and beyond'.</li>
	 * <li>The dot is included as the first character.</li>
	 * <li>If a dot is the final character then no extension is returned.</li>
	 * <li>The extension is returned in lower case.</li>
	 * </ul>
	 * @param name
	 * @return
	 */
	public static Optional<String> getExtension(String name) {
		Objects.requireNonNull(name);
		int indSep = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
		int ind = name.lastIndexOf(".");
		if (ind <= indSep)
			return Optional.empty();
		String ext = name.substring(ind);
		// Check we only have letters & digits
		if (!ext.matches(".\\w+"))
			return Optional.empty();
		return Optional.of(ext.toLowerCase());
	}
	
	/**
	 * Check if a string is blank, i.e. it is null or its length is 0.
	 * @param s
	 * @param trim If true, any string will be trimmed before its length checked.
	 * @return True if the string is null or empty.
	 */
	public static boolean blankString(final String s, final boolean trim) {
		return s == null || (trim ? s.trim().length() == 0 : s.length() == 0);
	}
	
	/**
	 * Clip a value to be within a specific range.
	 * 
	 * @param value
	 * @param min
	 * @param max
	 * @return
	 */
	public static int clipValue(final int value, final int min, final int max) {
		return value < min ? min : (value > max ? max : value);
	}
	
	/**
	 * Clip a value to be within a specific range.
	 * 
	 * @param value
	 * @param min
	 * @param max
	 * @return
	 */
	public static double clipValue(final double value, final double min, final double max) {
		return value < min ? min : (value > max ? max : value);
	}
	
	/**
	 * Round a value to the nearest integer, with ties rounded away from zero.
	 * <p>
	 * This differs from {@link Math#round(double)} for negative ties (e.g. -2.5 becomes -3 rather than -2).
	 * 
	 * @param value
	 * @return
	 */
	public static long roundHalfAwayFromZero(final double value) {
		if (value < 0)
			return -Math.round(-value);
		return Math.round(value);
	}

}
