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

package pixelserve.lib.images.ops;

import java.util.Objects;

import pixelserve.lib.images.InvalidDimensionException;
import pixelserve.lib.images.PixelBuffer;

/**
 * Sampler that takes the source pixel closest to the center of each output pixel.
 * 
 * @author PixelServe developers
 */
public class NearestNeighborSampler implements ImageSampler {

	@Override
	public PixelBuffer sample(PixelBuffer source, int width, int height) {
		Objects.requireNonNull(source, "Source buffer must not be null");
		if (width < 0 || height < 0)
			throw new InvalidDimensionException(String.format("Cannot sample to %dx%d", width, height));
		if (width == 0 || height == 0)
			return PixelBuffer.create(width, height);
		if (source.isEmpty())
			throw new InvalidDimensionException("Cannot sample from an empty image");
		
		int srcWidth = source.getWidth();
		int srcHeight = source.getHeight();
		int[] src = source.getARGB();
		int[] dest = new int[width * height];
		double sx = (double)srcWidth / width;
		double sy = (double)srcHeight / height;
		for (int y = 0; y < height; y++) {
			int yy = Math.min(srcHeight - 1, (int)((y + 0.5) * sy));
			for (int x = 0; x < width; x++) {
				int xx = Math.min(srcWidth - 1, (int)((x + 0.5) * sx));
				dest[y * width + x] = src[yy * srcWidth + xx];
			}
		}
		return PixelBuffer.createFromARGB(width, height, dest);
	}

	@Override
	public String getName() {
		return "nearest";
	}
	
	@Override
	public String toString() {
		return "Nearest neighbor";
	}

}
