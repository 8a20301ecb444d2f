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
 * Separable Gaussian blur.
 * <p>
 * Pixels outside the image are treated as copies of the nearest edge pixel. 
 * Pixels outside the region may be read, but are never changed.
 * 
 * @author PixelServe developers
 */
public class GaussianBlur implements ImageFilter {
	
	/**
	 * Largest supported variance. This limits the kernel to a few thousand entries.
	 */
	public static final double MAX_VARIANCE = 1e6;
	
	private final double variance;
	private final double[] kernel;
	
	/**
	 * Constructor.
	 * @param variance the Gaussian variance, must be positive and no more than {@link #MAX_VARIANCE}
	 */
	public GaussianBlur(double variance) {
		if (!(variance > 0) || !Double.isFinite(variance))
			throw new IllegalArgumentException("Blur variance must be positive, but was " + variance);
		if (variance > MAX_VARIANCE)
			throw new IllegalArgumentException("Blur variance must be <= " + MAX_VARIANCE + ", but was " + variance);
		this.variance = variance;
		this.kernel = createKernel(Math.sqrt(variance));
	}
	
	static double[] createKernel(double sigma) {
		int radius = Math.max(1, (int)Math.ceil(sigma * 3));
		double[] k = new double[radius * 2 + 1];
		double sum = 0;
		for (int i = -radius; i <= radius; i++) {
			double v = Math.exp(-(i * i) / (2 * sigma * sigma));
			k[i + radius] = v;
			sum += v;
		}
		for (int i = 0; i < k.length; i++)
			k[i] /= sum;
		return k;
	}
	
	public double getVariance() {
		return variance;
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
		int radius = kernel.length / 2;
		
		// Horizontal pass over the rows needed by the vertical pass, stored premultiplied
		int y0 = Math.max(0, target.getY() - radius);
		int y1 = Math.min(height, target.getMaxY() + radius);
		int x0 = target.getX();
		int x1 = target.getMaxX();
		int w = x1 - x0;
		double[][] temp = new double[4][(y1 - y0) * w];
		for (int y = y0; y < y1; y++) {
			for (int x = x0; x < x1; x++) {
				double a = 0, r = 0, g = 0, b = 0;
				for (int k = -radius; k <= radius; k++) {
					int xx = GeneralTools.clipValue(x + k, 0, width - 1);
					int v = src[y * width + xx];
					double weight = kernel[k + radius];
					double alpha = ColorTools.alpha(v);
					a += weight * alpha;
					r += weight * alpha * ColorTools.red(v);
					g += weight * alpha * ColorTools.green(v);
					b += weight * alpha * ColorTools.blue(v);
				}
				int ind = (y - y0) * w + (x - x0);
				temp[0][ind] = a;
				temp[1][ind] = r;
				temp[2][ind] = g;
				temp[3][ind] = b;
			}
		}
		
		int[] dest = src.clone();
		for (int y = target.getY(); y < target.getMaxY(); y++) {
			for (int x = x0; x < x1; x++) {
				double a = 0, r = 0, g = 0, b = 0;
				for (int k = -radius; k <= radius; k++) {
					int yy = GeneralTools.clipValue(y + k, 0, height - 1);
					int ind = (yy - y0) * w + (x - x0);
					double weight = kernel[k + radius];
					a += weight * temp[0][ind];
					r += weight * temp[1][ind];
					g += weight * temp[2][ind];
					b += weight * temp[3][ind];
				}
				int argb;
				if (a <= 0)
					argb = ColorTools.TRANSPARENT;
				else
					argb = ColorTools.packARGB(
							ColorTools.do8BitRangeCheck(a),
							ColorTools.do8BitRangeCheck(r / a),
							ColorTools.do8BitRangeCheck(g / a),
							ColorTools.do8BitRangeCheck(b / a));
				dest[y * width + x] = argb;
			}
		}
		return PixelBuffer.createFromARGB(width, height, dest);
	}

	@Override
	public String getDescriptor() {
		return "blur(" + variance + ")";
	}
	
	@Override
	public String toString() {
		return getDescriptor();
	}

}
