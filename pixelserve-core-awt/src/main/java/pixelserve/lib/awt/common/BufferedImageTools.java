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

package pixelserve.lib.awt.common;

import java.awt.Graphics2D;
import java.awt.Transparency;
import java.awt.image.BufferedImage;
import java.util.Objects;

import pixelserve.lib.images.InvalidDimensionException;
import pixelserve.lib.images.PixelBuffer;

/**
 * Static methods for converting between {@link BufferedImage} and {@link PixelBuffer}.
 * 
 * @author PixelServe developers
 */
public final class BufferedImageTools {
	
	// Suppress default constructor for non-instantiability
	private BufferedImageTools() {
		throw new AssertionError();
	}
	
	/**
	 * Create a {@code TYPE_INT_ARGB} image containing the pixels of a buffer.
	 * @param buffer
	 * @return
	 * @throws InvalidDimensionException if the buffer is empty
	 */
	public static BufferedImage toBufferedImage(PixelBuffer buffer) {
		Objects.requireNonNull(buffer, "Buffer must not be null");
		if (buffer.isEmpty())
			throw new InvalidDimensionException("Cannot create an image from an empty buffer " + buffer);
		int width = buffer.getWidth();
		int height = buffer.getHeight();
		var img = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
		img.setRGB(0, 0, width, height, buffer.getARGB(), 0, width);
		return img;
	}
	
	/**
	 * Create a buffer from the pixels of an image, converted to sRGB with alpha.
	 * @param img
	 * @return
	 */
	public static PixelBuffer toPixelBuffer(BufferedImage img) {
		Objects.requireNonNull(img, "Image must not be null");
		int width = img.getWidth();
		int height = img.getHeight();
		int[] argb = img.getRGB(0, 0, width, height, null, 0, width);
		return PixelBuffer.createFromARGB(width, height, argb);
	}
	
	/**
	 * Ensure an image has a specific type, converting it if necessary.
	 * @param img
	 * @param requestedType
	 * @return the input image if it already has the requested type, otherwise a converted copy
	 */
	public static BufferedImage ensureBufferedImageType(final BufferedImage img, int requestedType) {
		if (img.getType() == requestedType)
			return img;
		var img2 = new BufferedImage(img.getWidth(), img.getHeight(), requestedType);
		Graphics2D g2d = img2.createGraphics();
		g2d.drawImage(img, 0, 0, null);
		g2d.dispose();
		return img2;
	}
	
	/**
	 * Ensure an image is opaque, drawing it onto a black RGB image if necessary.
	 * @param img
	 * @return
	 */
	public static BufferedImage ensureOpaque(final BufferedImage img) {
		if (img.getTransparency() == Transparency.OPAQUE)
			return img;
		return ensureBufferedImageType(img, BufferedImage.TYPE_INT_RGB);
	}
	
	/**
	 * Create a copy of an image with type {@code TYPE_INT_ARGB}.
	 * @param img
	 * @return
	 */
	public static BufferedImage duplicate(final BufferedImage img) {
		var img2 = new BufferedImage(img.getWidth(), img.getHeight(), BufferedImage.TYPE_INT_ARGB);
		Graphics2D g2d = img2.createGraphics();
		g2d.drawImage(img, 0, 0, null);
		g2d.dispose();
		return img2;
	}

}
