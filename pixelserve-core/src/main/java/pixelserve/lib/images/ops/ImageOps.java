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

import java.util.Arrays;
import java.util.Objects;
import java.util.function.UnaryOperator;

import pixelserve.lib.images.PixelBuffer;
import pixelserve.lib.images.filters.Brightness;
import pixelserve.lib.images.filters.Contrast;
import pixelserve.lib.images.filters.CropCircle;
import pixelserve.lib.images.filters.GaussianBlur;
import pixelserve.lib.images.filters.Grayscale;
import pixelserve.lib.images.filters.Inverter;
import pixelserve.lib.images.filters.Prewitt;
import pixelserve.lib.images.filters.Sobel;
import pixelserve.lib.images.filters.Tint;
import pixelserve.lib.regions.ImageRegion;

/**
 * Static methods to create {@link ImageOp}s and {@link ImageFilter}s.
 * 
 * @author PixelServe developers
 */
public class ImageOps {
	
	/**
	 * Default maximum output width for a resize.
	 */
	public static final int DEFAULT_MAX_WIDTH = 4096;

	/**
	 * Default maximum output height for a resize.
	 */
	public static final int DEFAULT_MAX_HEIGHT = 4096;
	
	// Suppress default constructor for non-instantiability
	private ImageOps() {
		throw new AssertionError();
	}
	
	/**
	 * Create a builder for a resize operation.
	 * @return
	 */
	public static ResizeOp.Builder resizeBuilder() {
		return new ResizeOp.Builder();
	}
	
	/**
	 * Resize to an explicit width and height, stretching to fill.
	 * @param width
	 * @param height
	 * @return
	 */
	public static ResizeOp resize(int width, int height) {
		return resizeBuilder().width(width).height(height).build();
	}
	
	/**
	 * Resize to an explicit width and height.
	 * @param width
	 * @param height
	 * @param mode the stretch mode; only {@link StretchMode#FILL} is supported
	 * @return
	 * @throws pixelserve.lib.images.UnsupportedModeException if the mode is not supported
	 */
	public static ResizeOp resize(int width, int height, StretchMode mode) {
		return resizeBuilder().width(width).height(height).mode(mode).build();
	}
	
	/**
	 * Resize to a fixed width, preserving the aspect ratio.
	 * @param width
	 * @return
	 */
	public static ResizeOp width(int width) {
		return resizeBuilder().width(width).build();
	}
	
	/**
	 * Resize to a fixed height, preserving the aspect ratio.
	 * @param height
	 * @return
	 */
	public static ResizeOp height(int height) {
		return resizeBuilder().height(height).build();
	}
	
	/**
	 * Resize so that the longer side has the given size, preserving the aspect ratio.
	 * @param size
	 * @return
	 */
	public static ResizeOp size(int size) {
		return resizeBuilder().size(size).build();
	}
	
	/**
	 * Rotate clockwise, then flip.
	 * @param rotation
	 * @param flip
	 * @return
	 */
	public static TransformOp transform(Rotation rotation, Flip flip) {
		return new TransformOp(rotation, flip);
	}
	
	public static TransformOp flipX() {
		return transform(Rotation.NONE, Flip.HORIZONTAL);
	}
	
	public static TransformOp flipY() {
		return transform(Rotation.NONE, Flip.VERTICAL);
	}
	
	public static TransformOp rotate90() {
		return transform(Rotation.ROTATE_90, Flip.NONE);
	}
	
	public static TransformOp rotate180() {
		return transform(Rotation.ROTATE_180, Flip.NONE);
	}
	
	public static TransformOp rotate270() {
		return transform(Rotation.ROTATE_270, Flip.NONE);
	}
	
	/**
	 * Crop to a region, clipped to the frame bounds.
	 * @param region
	 * @return
	 */
	public static CropOp crop(ImageRegion region) {
		return new CropOp(region);
	}
	
	/**
	 * Crop to a region, clipped to the frame bounds.
	 * @param x
	 * @param y
	 * @param width
	 * @param height
	 * @return
	 */
	public static CropOp crop(int x, int y, int width, int height) {
		return crop(ImageRegion.createInstance(x, y, width, height));
	}
	
	/**
	 * Apply filters to the full frame.
	 * @param filters
	 * @return
	 */
	public static FilterOp filter(ImageFilter... filters) {
		return filter(null, filters);
	}
	
	/**
	 * Apply filters within a region.
	 * @param region the region, or null for the full frame
	 * @param filters
	 * @return
	 */
	public static FilterOp filter(ImageRegion region, ImageFilter... filters) {
		return new FilterOp(region, Arrays.asList(filters));
	}
	
	public static ImageFilter gray() {
		return new Grayscale();
	}
	
	public static ImageFilter invert() {
		return new Inverter();
	}
	
	public static ImageFilter blur(double variance) {
		return new GaussianBlur(variance);
	}
	
	public static ImageFilter tint(int rgb, boolean useHsb) {
		return new Tint(rgb, useHsb);
	}
	
	public static ImageFilter brightness(int amount) {
		return new Brightness(amount);
	}
	
	public static ImageFilter contrast(int amount) {
		return new Contrast(amount);
	}
	
	/**
	 * Make pixels outside the largest centered circle transparent.
	 * @return
	 */
	public static ImageFilter circle() {
		return new CropCircle(-1);
	}
	
	public static ImageFilter circle(int radius) {
		return new CropCircle(radius);
	}
	
	public static ImageFilter sobel() {
		return new Sobel();
	}
	
	public static ImageFilter prewitt() {
		return new Prewitt();
	}
	
	/**
	 * Create an operation from a function.
	 * <p>
	 * The descriptor is used to fingerprint requests, and so must uniquely identify the function.
	 * 
	 * @param descriptor
	 * @param fun
	 * @return
	 */
	public static ImageOp custom(String descriptor, UnaryOperator<PixelBuffer> fun) {
		Objects.requireNonNull(descriptor, "Descriptor must not be null");
		Objects.requireNonNull(fun, "Function must not be null");
		return new ImageOp() {
			@Override
			public PixelBuffer apply(PixelBuffer frame) {
				return fun.apply(frame);
			}

			@Override
			public String getDescriptor() {
				return descriptor;
			}
			
			@Override
			public String toString() {
				return descriptor;
			}
		};
	}

}
