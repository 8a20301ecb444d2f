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
 * Filter that makes every pixel outside a centered circle fully transparent.
 */
public class CropCircle extends AbstractPixelFilter {
	
	private final int radius;
	
	/**
	 * Constructor.
	 * @param radius circle radius in pixels; if negative, the largest circle that fits in the image is used
	 */
	public CropCircle(int radius) {
		this.radius = radius;
	}

	@Override
	protected int filterPixel(int argb, int x, int y, int width, int height) {
		double r = radius < 0 ? Math.min(width, height) / 2.0 : radius;
		double dx = x + 0.5 - width / 2.0;
		double dy = y + 0.5 - height / 2.0;
		if (dx*dx + dy*dy > r*r)
			return ColorTools.TRANSPARENT;
		return argb;
	}

	@Override
	public String getDescriptor() {
		return radius < 0 ? "circle" : "circle(" + radius + ")";
	}

}
