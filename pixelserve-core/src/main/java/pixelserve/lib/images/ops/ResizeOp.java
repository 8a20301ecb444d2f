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

import pixelserve.lib.common.GeneralTools;
import pixelserve.lib.images.InvalidDimensionException;
import pixelserve.lib.images.PixelBuffer;
import pixelserve.lib.images.SizeLimitExceededException;
import pixelserve.lib.images.UnsupportedModeException;

/**
 * Operation to resize a frame.
 * <p>
 * A resize can be specified in one of four ways:
 * <ul>
 *   <li>an explicit width and height</li>
 *   <li>a width only, with the height derived from the aspect ratio</li>
 *   <li>a height only, with the width derived from the aspect ratio</li>
 *   <li>a size, which is applied to the longer side (the width if the image is wider than tall, 
 *       otherwise the height) with the other side derived from the aspect ratio</li>
 * </ul>
 * Derived dimensions are rounded half away from zero.
 * <p>
 * Only {@link StretchMode#FILL} is currently supported.
 * 
 * @author PixelServe developers
 * @see Builder
 */
public class ResizeOp implements ImageOp {
	
	private final int width;
	private final int height;
	private final int size;
	private final StretchMode mode;
	private final ImageSampler sampler;
	private final int maxWidth;
	private final int maxHeight;
	
	private ResizeOp(Builder builder) {
		this.width = builder.width;
		this.height = builder.height;
		this.size = builder.size;
		this.mode = builder.mode;
		this.sampler = builder.sampler;
		this.maxWidth = builder.maxWidth;
		this.maxHeight = builder.maxHeight;
	}
	
	/**
	 * Compute the output width and height for a source of the given size.
	 * @param sourceWidth
	 * @param sourceHeight
	 * @return an array containing the output width and height
	 * @throws InvalidDimensionException if the source is empty and a dimension must be derived, 
	 *                                   or if a derived dimension is not positive
	 * @throws SizeLimitExceededException if the output would exceed the maximum size
	 */
	public int[] computeOutputSize(int sourceWidth, int sourceHeight) {
		int w, h;
		if (width > 0 && height > 0) {
			w = width;
			h = height;
		} else {
			if (sourceWidth <= 0 || sourceHeight <= 0)
				throw new InvalidDimensionException(
						String.format("Cannot derive a new size for an image of %dx%d", sourceWidth, sourceHeight));
			double ratio = (double)sourceWidth / sourceHeight;
			if (size > 0) {
				if (sourceWidth > sourceHeight && ratio > 0) {
					w = size;
					h = derive(size / ratio);
				} else {
					w = derive(size * ratio);
					h = size;
				}
			} else if (width > 0) {
				w = width;
				h = derive(width / ratio);
			} else {
				w = derive(height * ratio);
				h = height;
			}
			if (w <= 0 || h <= 0)
				throw new InvalidDimensionException(
						String.format("Resizing %dx%d with %s gives an empty image (%dx%d)", sourceWidth, sourceHeight, getDescriptor(), w, h));
		}
		checkLimits(w, h, maxWidth, maxHeight);
		return new int[] {w, h};
	}
	
	private static int derive(double value) {
		long v = GeneralTools.roundHalfAwayFromZero(value);
		return v > Integer.MAX_VALUE ? Integer.MAX_VALUE : (int)v;
	}
	
	private static void checkLimits(int w, int h, int maxWidth, int maxHeight) {
		if (w > maxWidth || h > maxHeight)
			throw new SizeLimitExceededException(w, h, maxWidth, maxHeight);
	}

	@Override
	public PixelBuffer apply(PixelBuffer frame) {
		Objects.requireNonNull(frame, "Frame must not be null");
		int[] outputSize = computeOutputSize(frame.getWidth(), frame.getHeight());
		if (outputSize[0] == frame.getWidth() && outputSize[1] == frame.getHeight())
			return frame;
		if (frame.isEmpty())
			throw new InvalidDimensionException("Cannot resize an empty image to " + outputSize[0] + "x" + outputSize[1]);
		return sampler.sample(frame, outputSize[0], outputSize[1]);
	}
	
	/**
	 * Get the requested width, or 0 if the width is not set.
	 * @return
	 */
	public int getWidth() {
		return width;
	}

	/**
	 * Get the requested height, or 0 if the height is not set.
	 * @return
	 */
	public int getHeight() {
		return height;
	}

	/**
	 * Get the requested size of the longer side, or 0 if not set.
	 * @return
	 */
	public int getSize() {
		return size;
	}
	
	public StretchMode getMode() {
		return mode;
	}
	
	public ImageSampler getSampler() {
		return sampler;
	}

	@Override
	public String getDescriptor() {
		return String.format("resize(w=%d,h=%d,size=%d,mode=%s,sampler=%s)",
				width, height, size, mode.name().toLowerCase(), sampler.getName());
	}
	
	@Override
	public String toString() {
		return getDescriptor();
	}
	
	
	/**
	 * Builder for a {@link ResizeOp}.
	 */
	public static class Builder {
		
		private int width = 0;
		private int height = 0;
		private int size = 0;
		private StretchMode mode = StretchMode.FILL;
		private ImageSampler sampler = new SuperSamplingSampler();
		private int maxWidth = ImageOps.DEFAULT_MAX_WIDTH;
		private int maxHeight = ImageOps.DEFAULT_MAX_HEIGHT;
		
		private boolean hasWidth, hasHeight, hasSize;
		
		/**
		 * Request a specific output width.
		 * @param width
		 * @return this builder
		 */
		public Builder width(int width) {
			this.width = width;
			this.hasWidth = true;
			return this;
		}
		
		/**
		 * Request a specific output height.
		 * @param height
		 * @return this builder
		 */
		public Builder height(int height) {
			this.height = height;
			this.hasHeight = true;
			return this;
		}
		
		/**
		 * Request the size of the longer side.
		 * @param size
		 * @return this builder
		 */
		public Builder size(int size) {
			this.size = size;
			this.hasSize = true;
			return this;
		}
		
		public Builder mode(StretchMode mode) {
			this.mode = Objects.requireNonNull(mode);
			return this;
		}
		
		public Builder sampler(ImageSampler sampler) {
			this.sampler = Objects.requireNonNull(sampler);
			return this;
		}
		
		/**
		 * Set the maximum output size.
		 * @param maxWidth
		 * @param maxHeight
		 * @return this builder
		 */
		public Builder maxSize(int maxWidth, int maxHeight) {
			if (maxWidth <= 0 || maxHeight <= 0)
				throw new InvalidDimensionException(String.format("Maximum size must be positive (requested %dx%d)", maxWidth, maxHeight));
			this.maxWidth = maxWidth;
			this.maxHeight = maxHeight;
			return this;
		}
		
		/**
		 * Build the operation.
		 * @return
		 * @throws UnsupportedModeException if the stretch mode is not {@link StretchMode#FILL}
		 * @throws InvalidDimensionException if any requested dimension is not positive, 
		 *                                   or no dimension has been requested
		 * @throws SizeLimitExceededException if explicitly requested dimensions exceed the maximum size
		 */
		public ResizeOp build() {
			if (mode != StretchMode.FILL)
				throw new UnsupportedModeException("Stretch mode " + mode + " is not supported, only " + StretchMode.FILL);
			if (hasSize) {
				if (hasWidth || hasHeight)
					throw new IllegalArgumentException("A resize size cannot be combined with a width or height");
				if (size <= 0)
					throw new InvalidDimensionException("Resize size must be positive, but was " + size);
			} else {
				if (!hasWidth && !hasHeight)
					throw new InvalidDimensionException("No output width, height or size specified");
				if ((hasWidth && width <= 0) || (hasHeight && height <= 0))
					throw new InvalidDimensionException(String.format("Resize dimensions must be positive, but were %dx%d", width, height));
				if (hasWidth && hasHeight)
					checkLimits(width, height, maxWidth, maxHeight);
			}
			return new ResizeOp(this);
		}
		
	}

}
