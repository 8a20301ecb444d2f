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

import pixelserve.lib.common.ColorTools;
import pixelserve.lib.images.InvalidDimensionException;
import pixelserve.lib.images.PixelBuffer;

/**
 * Sampler that computes each output pixel as the area-weighted average of all source pixels 
 * it covers.
 * <p>
 * Color channels are averaged with alpha weighting, so fully transparent pixels do not 
 * darken their neighbors. When enlarging, this behaves like a box filter.
 * 
 * @author PixelServe developers
 */
public class SuperSamplingSampler implements ImageSampler {

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
		
		for (int ty = 0; ty < height; ty++) {
			double y0 = ty * sy;
			double y1 = Math.min(srcHeight, y0 + sy);
			int yStart = (int)Math.floor(y0);
			int yEnd = Math.min(srcHeight, (int)Math.ceil(y1));
			for (int tx = 0; tx < width; tx++) {
				double x0 = tx * sx;
				double x1 = Math.min(srcWidth, x0 + sx);
				int xStart = (int)Math.floor(x0);
				int xEnd = Math.min(srcWidth, (int)Math.ceil(x1));
				
				double sumWeight = 0;
				double sumAlpha = 0;
				double sumRed = 0;
				double sumGreen = 0;
				double sumBlue = 0;
				for (int yy = yStart; yy < yEnd; yy++) {
					double wy = Math.min(y1, yy + 1) - Math.max(y0, yy);
					if (wy <= 0)
						continue;
					int row = yy * srcWidth;
					for (int xx = xStart; xx < xEnd; xx++) {
						double wx = Math.min(x1, xx + 1) - Math.max(x0, xx);
						if (wx <= 0)
							continue;
						double w = wx * wy;
						int v = src[row + xx];
						double wa = w * ColorTools.alpha(v);
						sumWeight += w;
						sumAlpha += wa;
						sumRed += wa * ColorTools.red(v);
						sumGreen += wa * ColorTools.green(v);
						sumBlue += wa * ColorTools.blue(v);
					}
				}
				int argb;
				if (sumAlpha <= 0 || sumWeight <= 0)
					argb = ColorTools.TRANSPARENT;
				else
					argb = ColorTools.packClippedARGB(
							ColorTools.do8BitRangeCheck(sumAlpha / sumWeight),
							ColorTools.do8BitRangeCheck(sumRed / sumAlpha),
							ColorTools.do8BitRangeCheck(sumGreen / sumAlpha),
							ColorTools.do8BitRangeCheck(sumBlue / sumAlpha));
				dest[ty * width + tx] = argb;
			}
		}
		return PixelBuffer.createFromARGB(width, height, dest);
	}

	@Override
	public String getName() {
		return "supersampling";
	}
	
	@Override
	public String toString() {
		return "Super sampling";
	}

}
