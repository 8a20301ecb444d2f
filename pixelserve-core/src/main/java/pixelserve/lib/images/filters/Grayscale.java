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
 * Filter that converts colors to gray using their luminance. Alpha is unchanged.
 */
public class Grayscale extends AbstractPixelFilter {

	@Override
	protected int filterPixel(int argb, int x, int y, int width, int height) {
		int v = ColorTools.do8BitRangeCheck(ColorTools.luminance(argb));
		return ColorTools.packARGB(ColorTools.alpha(argb), v, v, v);
	}

	@Override
	public String getDescriptor() {
		return "gray";
	}

}
