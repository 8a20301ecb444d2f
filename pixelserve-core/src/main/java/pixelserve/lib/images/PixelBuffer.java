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

package pixelserve.lib.images;

import java.util.Arrays;
import java.util.Objects;

import pixelserve.lib.regions.ImageRegion;

/**
 * A single 8-bit RGBA image frame, stored as a flat byte array.
 * <p>
 * Each pixel occupies four consecutive bytes in the order <b>red, green, blue, alpha</b>, 
 * with pixels stored row by row starting at the top left. The store always has exactly 
 * {@code width * height * 4} bytes.
 * <p>
 * Individual pixels are read and written as packed ARGB ints (see {@link pixelserve.lib.common.ColorTools}); 
 * {@link #getPixel(int, int)} decodes the same channel order that {@link #setPixel(int, int, int)} writes.
 * <p>
 * Replacing the pixels with {@link #setPixels(int, int, byte[])} validates all inputs first and 
 * then swaps the dimensions and store together, so a failed call leaves the buffer unchanged.
 * A buffer is not intended to be modified by more than one thread at a time.
 * 
 * @author PixelServe developers
 */
public class PixelBuffer {
	
	/**
	 * Number of bytes used to store each pixel.
	 */
	public static final int BYTES_PER_PIXEL = 4;
	
	// Leave some headroom, since some VMs cannot allocate arrays of exactly Integer.MAX_VALUE
	private static final long MAX_STORE_LENGTH = Integer.MAX_VALUE - 8;
	
	/**
	 * Dimensions and pixels, always replaced together.
	 */
	private static class Store {
		
		private final int width;
		private final int height;
		private final byte[] pixels;
		
		private Store(int width, int height, byte[] pixels) {
			this.width = width;
			this.height = height;
			this.pixels = pixels;
		}
		
	}
	
	private volatile Store store;
	
	private PixelBuffer(Store store) {
		this.store = store;
	}
	
	/**
	 * Create a new buffer with the specified dimensions, with all bytes set to zero 
	 * (i.e. transparent black).
	 * 
	 * @param width
	 * @param height
	 * @return
	 * @throws InvalidDimensionException if width or height is negative, or the image is too large to store
	 */
	public static PixelBuffer create(int width, int height) {
		int length = checkedLength(width, height);
		return new PixelBuffer(new Store(width, height, new byte[length]));
	}
	
	/**
	 * Create a new buffer containing a copy of the specified pixels.
	 * 
	 * @param width
	 * @param height
	 * @param pixels RGBA pixels, with length {@code width * height * 4}
	 * @return
	 * @throws NullPointerException if pixels is null
	 * @throws InvalidDimensionException if width or height is negative
	 * @throws SizeMismatchException if the length of pixels does not match the dimensions
	 */
	public static PixelBuffer create(int width, int height, byte[] pixels) {
		var buffer = new PixelBuffer(new Store(0, 0, new byte[0]));
		buffer.setPixels(width, height, pixels);
		return buffer;
	}
	
	/**
	 * Create a deep copy of another buffer.
	 * 
	 * @param other
	 * @return
	 * @throws NullPointerException if other is null
	 */
	public static PixelBuffer copyOf(PixelBuffer other) {
		Objects.requireNonNull(other, "Source buffer must not be null");
		var source = other.store;
		return new PixelBuffer(new Store(source.width, source.height, source.pixels.clone()));
	}
	
	/**
	 * Replace the dimensions and pixels of this buffer.
	 * <p>
	 * The pixels are copied, so later changes to the input array do not affect this buffer.
	 * 
	 * @param width
	 * @param height
	 * @param pixels RGBA pixels, with length {@code width * height * 4}
	 * @throws NullPointerException if pixels is null
	 * @throws InvalidDimensionException if width or height is negative
	 * @throws SizeMismatchException if the length of pixels does not match the dimensions
	 */
	public void setPixels(int width, int height, byte[] pixels) {
		Objects.requireNonNull(pixels, "Pixel array must not be null");
		int length = checkedLength(width, height);
		if (pixels.length != length)
			throw new SizeMismatchException(
					String.format("Pixel array must have the length of width * height * 4 (%d), but length is %d", length, pixels.length));
		this.store = new Store(width, height, pixels.clone());
	}
	
	/**
	 * Get a copy of the RGBA pixels of this buffer.
	 * @return
	 */
	public byte[] getPixels() {
		return store.pixels.clone();
	}
	
	/**
	 * Get the color of a pixel as a packed ARGB value.
	 * 
	 * @param x
	 * @param y
	 * @return
	 * @throws PixelOutOfRangeException if the coordinate is outside the image
	 */
	public int getPixel(int x, int y) {
		var s = store;
		checkBounds(s, x, y);
		return getPixelUnchecked(s, x, y);
	}
	
	/**
	 * Set the color of a pixel from a packed ARGB value.
	 * 
	 * @param x
	 * @param y
	 * @param argb
	 * @throws PixelOutOfRangeException if the coordinate is outside the image
	 */
	public void setPixel(int x, int y, int argb) {
		var s = store;
		checkBounds(s, x, y);
		setPixelUnchecked(s, x, y, argb);
	}
	
	/**
	 * Get all pixels as packed ARGB values, row by row.
	 * @return
	 */
	public int[] getARGB() {
		var s = store;
		int[] argb = new int[s.width * s.height];
		byte[] px = s.pixels;
		for (int i = 0, j = 0; i < argb.length; i++, j += BYTES_PER_PIXEL) {
			argb[i] = ((px[j+3] & 0xff) << 24) |
					  ((px[j] & 0xff) << 16) |
					  ((px[j+1] & 0xff) << 8) |
					   (px[j+2] & 0xff);
		}
		return argb;
	}
	
	/**
	 * Create a buffer from packed ARGB values, row by row.
	 * @param width
	 * @param height
	 * @param argb
	 * @return
	 * @throws NullPointerException if argb is null
	 * @throws InvalidDimensionException if width or height is negative
	 * @throws SizeMismatchException if the length of argb is not {@code width * height}
	 */
	public static PixelBuffer createFromARGB(int width, int height, int[] argb) {
		Objects.requireNonNull(argb, "Pixel array must not be null");
		int length = checkedLength(width, height);
		if (argb.length * (long)BYTES_PER_PIXEL != length)
			throw new SizeMismatchException(
					String.format("ARGB array must have the length of width * height (%d), but length is %d", length / BYTES_PER_PIXEL, argb.length));
		byte[] px = new byte[length];
		for (int i = 0, j = 0; i < argb.length; i++, j += BYTES_PER_PIXEL) {
			int v = argb[i];
			px[j] = (byte)(v >> 16);
			px[j+1] = (byte)(v >> 8);
			px[j+2] = (byte)v;
			px[j+3] = (byte)(v >> 24);
		}
		return new PixelBuffer(new Store(width, height, px));
	}
	
	/**
	 * Get the image width, in pixels.
	 * @return
	 */
	public int getWidth() {
		return store.width;
	}
	
	/**
	 * Get the image height, in pixels.
	 * @return
	 */
	public int getHeight() {
		return store.height;
	}
	
	/**
	 * Get the ratio of the width to the height.
	 * @return the aspect ratio, or {@code Double.NaN} if the height is 0
	 */
	public double getAspectRatio() {
		var s = store;
		if (s.height == 0)
			return Double.NaN;
		return (double)s.width / s.height;
	}
	
	/**
	 * Get a region representing the full image, anchored at the origin.
	 * @return
	 */
	public ImageRegion getBounds() {
		var s = store;
		return ImageRegion.createInstance(0, 0, s.width, s.height);
	}
	
	/**
	 * Returns true if the image has no pixels.
	 * @return
	 */
	public boolean isEmpty() {
		var s = store;
		return s.width == 0 || s.height == 0;
	}
	
	/**
	 * Get the number of bytes required to store the pixels.
	 * @return
	 */
	public int getByteCount() {
		return store.pixels.length;
	}
	
	/**
	 * Returns true if another buffer has the same dimensions and identical pixels.
	 * @param other
	 * @return
	 */
	public boolean contentEquals(PixelBuffer other) {
		if (other == null)
			return false;
		if (other == this)
			return true;
		var s1 = store;
		var s2 = other.store;
		return s1.width == s2.width && s1.height == s2.height && Arrays.equals(s1.pixels, s2.pixels);
	}
	
	@Override
	public String toString() {
		var s = store;
		return "PixelBuffer (" + s.width + "x" + s.height + ")";
	}
	
	private static void checkBounds(Store s, int x, int y) {
		if (x < 0 || y < 0 || x >= s.width || y >= s.height)
			throw new PixelOutOfRangeException(x, y, s.width, s.height);
	}
	
	private static int getPixelUnchecked(Store s, int x, int y) {
		int start = (y * s.width + x) * BYTES_PER_PIXEL;
		byte[] px = s.pixels;
		return ((px[start+3] & 0xff) << 24) |
			   ((px[start] & 0xff) << 16) |
			   ((px[start+1] & 0xff) << 8) |
				(px[start+2] & 0xff);
	}
	
	private static void setPixelUnchecked(Store s, int x, int y, int argb) {
		int start = (y * s.width + x) * BYTES_PER_PIXEL;
		byte[] px = s.pixels;
		px[start] = (byte)(argb >> 16);
		px[start+1] = (byte)(argb >> 8);
		px[start+2] = (byte)argb;
		px[start+3] = (byte)(argb >> 24);
	}
	
	private static int checkedLength(int width, int height) {
		if (width < 0)
			throw new InvalidDimensionException("Width must be greater or equal to zero, but was " + width);
		if (height < 0)
			throw new InvalidDimensionException("Height must be greater or equal to zero, but was " + height);
		long length = (long)width * height * BYTES_PER_PIXEL;
		if (length > MAX_STORE_LENGTH)
			throw new InvalidDimensionException(String.format("Image %dx%d is too large to store", width, height));
		return (int)length;
	}

}
