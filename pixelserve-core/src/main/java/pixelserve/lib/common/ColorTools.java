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

/**
 * Static methods to help with packed ARGB colors.
 * <p>
 * Colors are passed around as packed {@code int} values, with alpha in the highest 8 bits 
 * followed by red, green and blue. This is the representation used when reading or writing 
 * individual pixels of a {@link pixelserve.lib.images.PixelBuffer}.
 * 
 * @author PixelServe developers
 *
 */
public class ColorTools {
	
	// Suppressed default constructor for non-instantiability
	private ColorTools() {
		throw new AssertionError();
	}
	
	/**
	 * Packed int representing opaque white.
	 */
	final public static int WHITE = packRGB(255, 255, 255);

	/**
	 * Packed int representing opaque black.
	 */
	final public static int BLACK = packRGB(0, 0, 0);
	
	/**
	 * Packed int representing fully transparent black.
	 */
	final public static int TRANSPARENT = packARGB(0, 0, 0, 0);

	/**
	 * Make a packed RGB value from specified input values.
	 * This is equivalent to an ARGB value with alpha set to 255.
	 * <p>
	 * Input r, g, and b should be in the range 0-255; only the lower 8 bits are used.
	 * 
	 * @param r
	 * @param g
	 * @param b
	 * @return packed ARGB value
	 */
	public static int packRGB(int r, int g, int b) {
		return packARGB(255, r, g, b);
	}

	/**
	 * Make a packed ARGB value from specified input values.
	 * <p>
	 * Input a, r, g, and b should be in the range 0-255; only the lower 8 bits are used.
	 * 
	 * @param a
	 * @param r
	 * @param g
	 * @param b
	 * @return packed ARGB value
	 * @see #packClippedARGB(int, int, int, int)
	 */
	public static int packARGB(int a, int r, int g, int b) {
		return ((a & 0xff)<<24) + 
			   ((r & 0xff)<<16) + 
			   ((g & 0xff)<<8) + 
				(b & 0xff);
	}
	
	/**
	 * Make a packed ARGB value from specified input values, clipping to the range 0-255.
	 * 
	 * @param a
	 * @param r
	 * @param g
	 * @param b
	 * @return packed ARGB value
	 * @see #packARGB(int, int, int, int)
	 */
	public static int packClippedARGB(int a, int r, int g, int b) {
		return packARGB(
				do8BitRangeCheck(a), 
			    do8BitRangeCheck(r),
			    do8BitRangeCheck(g), 
			    do8BitRangeCheck(b)
			    );
	}
	
	/**
	 * Clip an input value to be an integer in the range 0-255.
	 * 
	 * @param v
	 * @return
	 */
	public static int do8BitRangeCheck(int v) {
		return GeneralTools.clipValue(v, 0, 255);
	}

	/**
	 * Round and clip an input value to be an integer in the range 0-255.
	 * 
	 * @param v
	 * @return
	 */
	public static int do8BitRangeCheck(double v) {
		return (int)Math.round(GeneralTools.clipValue(v, 0, 255));
	}
	
	/**
	 * Extract the 8-bit alpha value from a packed ARGB value.
	 * 
	 * @param argb
	 * @return
	 */
	public static int alpha(int argb) {
		return (argb >> 24) & 0xff;
	}

	/**
	 * Extract the 8-bit red value from a packed ARGB value.
	 * 
	 * @param argb
	 * @return
	 */
	public static int red(int argb) {
		return (argb >> 16) & 0xff;
	}
	
	/**
	 * Extract the 8-bit green value from a packed ARGB value.
	 * 
	 * @param argb
	 * @return
	 */
	public static int green(int argb) {
		return (argb >> 8) & 0xff;
	}

	/**
	 * Extract the 8-bit blue value from a packed ARGB value.
	 * 
	 * @param argb
	 * @return
	 */
	public static int blue(int argb) {
		return (argb & 0xff);
	}
	
	/**
	 * Parse a hex color string, with or without a leading '#'.
	 * <p>
	 * Supported forms are RGB, ARGB, RRGGBB and AARRGGBB; if alpha is omitted it is 255.
	 * 
	 * @param hex
	 * @return packed ARGB value
	 * @throws IllegalArgumentException if the string cannot be parsed
	 */
	public static int parseHexColor(String hex) {
		if (hex == null)
			throw new IllegalArgumentException("Color string must not be null");
		String s = hex.trim();
		if (s.startsWith("#"))
			s = s.substring(1);
		try {
			switch (s.length()) {
			case 3:
			case 4:
				var sb = new StringBuilder();
				for (char c : s.toCharArray())
					sb.append(c).append(c);
				return parseHexColor(sb.toString());
			case 6:
				return 0xff000000 | Integer.parseInt(s, 16);
			case 8:
				return Integer.parseUnsignedInt(s, 16);
			default:
				throw new IllegalArgumentException("Invalid color string: " + hex);
			}
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid color string: " + hex, e);
		}
	}
	
	/**
	 * Convert RGB values to hue, saturation and brightness, each in the range 0-1.
	 * 
	 * @param r
	 * @param g
	 * @param b
	 * @param hsb optional array to receive the result (may be null)
	 * @return the array containing hue, saturation and brightness
	 */
	public static float[] RGBtoHSB(int r, int g, int b, float[] hsb) {
		if (hsb == null || hsb.length < 3)
			hsb = new float[3];
		int max = Math.max(r, Math.max(g, b));
		int min = Math.min(r, Math.min(g, b));
		float brightness = max / 255f;
		float saturation = max == 0 ? 0f : (max - min) / (float)max;
		float hue = 0f;
		if (saturation != 0f) {
			float range = max - min;
			float redc = (max - r) / range;
			float greenc = (max - g) / range;
			float bluec = (max - b) / range;
			if (r == max)
				hue = bluec - greenc;
			else if (g == max)
				hue = 2f + redc - bluec;
			else
				hue = 4f + greenc - redc;
			hue = hue / 6f;
			if (hue < 0)
				hue = hue + 1f;
		}
		hsb[0] = hue;
		hsb[1] = saturation;
		hsb[2] = brightness;
		return hsb;
	}
	
	/**
	 * Convert hue, saturation and brightness (each in the range 0-1) to a packed RGB value 
	 * with alpha 255.
	 * 
	 * @param hue
	 * @param saturation
	 * @param brightness
	 * @return
	 */
	public static int HSBtoRGB(float hue, float saturation, float brightness) {
		int r = 0, g = 0, b = 0;
		if (saturation == 0) {
			r = g = b = (int)(brightness * 255f + 0.5f);
		} else {
			float h = (hue - (float)Math.floor(hue)) * 6f;
			float f = h - (float)Math.floor(h);
			float p = brightness * (1f - saturation);
			float q = brightness * (1f - saturation * f);
			float t = brightness * (1f - (saturation * (1f - f)));
			switch ((int)h) {
			case 0:
				r = (int)(brightness * 255f + 0.5f);
				g = (int)(t * 255f + 0.5f);
				b = (int)(p * 255f + 0.5f);
				break;
			case 1:
				r = (int)(q * 255f + 0.5f);
				g = (int)(brightness * 255f + 0.5f);
				b = (int)(p * 255f + 0.5f);
				break;
			case 2:
				r = (int)(p * 255f + 0.5f);
				g = (int)(brightness * 255f + 0.5f);
				b = (int)(t * 255f + 0.5f);
				break;
			case 3:
				r = (int)(p * 255f + 0.5f);
				g = (int)(q * 255f + 0.5f);
				b = (int)(brightness * 255f + 0.5f);
				break;
			case 4:
				r = (int)(t * 255f + 0.5f);
				g = (int)(p * 255f + 0.5f);
				b = (int)(brightness * 255f + 0.5f);
				break;
			case 5:
			default:
				r = (int)(brightness * 255f + 0.5f);
				g = (int)(p * 255f + 0.5f);
				b = (int)(q * 255f + 0.5f);
				break;
			}
		}
		return packRGB(r, g, b);
	}
	
	/**
	 * Compute the luminance of a packed RGB value, using ITU-R BT.601 weights.
	 * @param argb
	 * @return luminance in the range 0-255
	 */
	public static double luminance(int argb) {
		return red(argb) * 0.299 + green(argb) * 0.587 + blue(argb) * 0.114;
	}

}
