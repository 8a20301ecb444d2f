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

import pixelserve.lib.common.ColorTools;
import pixelserve.lib.common.GeneralTools;
import pixelserve.lib.images.PixelBuffer;
import pixelserve.lib.images.ops.ImageFilter;
import pixelserve.lib.regions.ImageRegion;

/**
 * Abstract edge detector using a pair of 3x3 gradient kernels.
 * <p>
 * Each color channel of the output is the gradient magnitude of the corresponding input channel. 
 * Alpha is unchanged. Edge pixels are replicated at the image boundary.
 * 
 * @author PixelServe developers
 */
abstract class AbstractEdgeFilter implements ImageFilter {
	
	private final int[] kernelX;
	private final int[] kernelY;
	
	/**
	 * Constructor.
	 * @param kernelX 3x3 kernel for the horizontal gradient, in row-major order
	 */
	AbstractEdgeFilter(int[] kernelX) {
		this.kernelX = kernelX.clone();
		// The vertical kernel is the transpose of the horizontal one
		this.kernelY = new int[9];
		for (int y = 0; y < 3; y++) {
			for (int x = 0; x < 3; x++)
				kernelY[y * 3 + x] = kernelX[x * 3 + y];
		}
	}

	@Override
	public PixelBuffer apply(PixelBuffer image, ImageRegion region) {
		Objects.requireNonNull(image, "Image must not be null");
		var target = region == null ? image.getBounds() : image.getBounds().intersect(region);
		if (target.isEmpty())
			return image;
		int width = image.getWidth();
		int height = image.getHeight();
		int[] src = image.getARGB();
		int[] dest = src.clone();
		int[] gx = new int[3];
		int[] gy = new int[3];
		for (int y = target.getY(); y < target.getMaxY(); y++) {
			for (int x = target.getX(); x < target.getMaxX(); x++) {
				gx[0] = gx[1] = gx[2] = 0;
				gy[0] = gy[1] = gy[2] = 0;
				for (int ky = -1; ky <= 1; ky++) {
					int yy = GeneralTools.clipValue(y + ky, 0, height - 1);
					for (int kx = -1; kx <= 1; kx++) {
						int xx = GeneralTools.clipValue(x + kx, 0, width - 1);
						int v = src[yy * width + xx];
						int k = (ky + 1) * 3 + (kx + 1);
						int r = ColorTools.red(v);
						int g = ColorTools.green(v);
						int b = ColorTools.blue(v);
						gx[0] += kernelX[k] * r;
						gx[1] += kernelX[k] * g;
						gx[2] += kernelX[k] * b;
						gy[0] += kernelY[k] * r;
						gy[1] += kernelY[k] * g;
						gy[2] += kernelY[k] * b;
					}
				}
				int ind = y * width + x;
				dest[ind] = ColorTools.packARGB(
						ColorTools.alpha(src[ind]),
						ColorTools.do8BitRangeCheck(Math.hypot(gx[0], gy[0])),
						ColorTools.do8BitRangeCheck(Math.hypot(gx[1], gy[1])),
						ColorTools.do8BitRangeCheck(Math.hypot(gx[2], gy[2])));
			}
		}
		return PixelBuffer.createFromARGB(width, height, dest);
	}
	
	@Override
	public String toString() {
		return getDescriptor();
	}

}
