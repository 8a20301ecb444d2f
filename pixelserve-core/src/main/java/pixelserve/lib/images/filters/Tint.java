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

package pixelserve.lib.images.filters;

import pixelserve.lib.common.ColorTools;

/**
 * Filter that tints an image towards a color.
 * <p>
 * By default, each color channel is multiplied by the corresponding channel of the tint color. 
 * In HSB mode, the hue and saturation of each pixel are replaced by those of the tint color 
 * while its brightness is kept.
 */
public class Tint extends AbstractPixelFilter {
	
	private final int color;
	private final boolean useHsb;
	private final float hue, saturation;
	
	/**
	 * Constructor.
	 * @param color packed RGB tint color (alpha is ignored)
	 * @param useHsb if true, tint in HSB color space rather than by multiplication
	 */
	public Tint(int color, boolean useHsb) {
		this.color = color & 0x00ffffff;
		this.useHsb = useHsb;
		float[] hsb = ColorTools.RGBtoHSB(ColorTools.red(color), ColorTools.green(color), ColorTools.blue(color), null);
		this.hue = hsb[0];
		this.saturation = hsb[1];
	}

	@Override
	protected int filterPixel(int argb, int x, int y, int width, int height) {
		int a = ColorTools.alpha(argb);
		int r = ColorTools.red(argb);
		int g = ColorTools.green(argb);
		int b = ColorTools.blue(argb);
		if (useHsb) {
			float[] hsb = ColorTools.RGBtoHSB(r, g, b, null);
			int rgb = ColorTools.HSBtoRGB(hue, saturation, hsb[2]);
			return (a << 24) | (rgb & 0x00ffffff);
		}
		return ColorTools.packARGB(a,
				r * ColorTools.red(color) / 255,
				g * ColorTools.green(color) / 255,
				b * ColorTools.blue(color) / 255);
	}

	@Override
	public String getDescriptor() {
		return String.format("tint(%06x,%s)", color, useHsb ? "hsb" : "multiply");
	}

}
