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

import java.util.Objects;

import pixelserve.lib.images.PixelBuffer;
import pixelserve.lib.images.ops.ImageFilter;
import pixelserve.lib.regions.ImageRegion;

/**
 * Abstract {@link ImageFilter} that transforms each pixel independently.
 * <p>
 * Subclasses only need to implement {@link #filterPixel(int, int, int, int, int)}.
 * 
 * @author PixelServe developers
 */
public abstract class AbstractPixelFilter implements ImageFilter {

	@Override
	public PixelBuffer apply(PixelBuffer image, ImageRegion region) {
		Objects.requireNonNull(image, "Image must not be null");
		var target = region == null ? image.getBounds() : image.getBounds().intersect(region);
		if (target.isEmpty())
			return image;
		int width = image.getWidth();
		int height = image.getHeight();
		int[] argb = image.getARGB();
		for (int y = target.getY(); y < target.getMaxY(); y++) {
			for (int x = target.getX(); x < target.getMaxX(); x++) {
				int ind = y * width + x;
				argb[ind] = filterPixel(argb[ind], x, y, width, height);
			}
		}
		return PixelBuffer.createFromARGB(width, height, argb);
	}
	
	/**
	 * Compute the new value for a single pixel.
	 * @param argb the packed ARGB input value
	 * @param x the pixel x coordinate
	 * @param y the pixel y coordinate
	 * @param width the full image width
	 * @param height the full image height
	 * @return the packed ARGB output value
	 */
	protected abstract int filterPixel(int argb, int x, int y, int width, int height);
	
	@Override
	public String toString() {
		return getDescriptor();
	}

}
