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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.awt.Transparency;
import java.awt.image.BufferedImage;

import org.junit.jupiter.api.Test;

import pixelserve.lib.common.ColorTools;
import pixelserve.lib.images.InvalidDimensionException;
import pixelserve.lib.images.PixelBuffer;

@SuppressWarnings("javadoc")
public class TestBufferedImageTools {
	
	private static PixelBuffer createBuffer() {
		var buffer = PixelBuffer.create(5, 3);
		for (int y = 0; y < 3; y++) {
			for (int x = 0; x < 5; x++)
				buffer.setPixel(x, y, ColorTools.packARGB(50 * y + 5, x * 40, y * 80, 255 - x));
		}
		return buffer;
	}
	
	@Test
	public void test_roundTrip() {
		var buffer = createBuffer();
		var img = BufferedImageTools.toBufferedImage(buffer);
		assertEquals(BufferedImage.TYPE_INT_ARGB, img.getType());
		assertEquals(5, img.getWidth());
		assertEquals(3, img.getHeight());
		assertEquals(buffer.getPixel(4, 2), img.getRGB(4, 2));
		assertTrue(buffer.contentEquals(BufferedImageTools.toPixelBuffer(img)));
	}
	
	@Test
	public void test_emptyBuffer() {
		assertThrows(InvalidDimensionException.class, () -> BufferedImageTools.toBufferedImage(PixelBuffer.create(0, 3)));
	}
	
	@Test
	public void test_ensureOpaque() {
		var img = BufferedImageTools.toBufferedImage(createBuffer());
		var opaque = BufferedImageTools.ensureOpaque(img);
		assertEquals(Transparency.OPAQUE, opaque.getTransparency());
		assertSame(opaque, BufferedImageTools.ensureOpaque(opaque));
		
		var rgb = new BufferedImage(2, 2, BufferedImage.TYPE_INT_RGB);
		assertSame(rgb, BufferedImageTools.ensureBufferedImageType(rgb, BufferedImage.TYPE_INT_RGB));
	}
	
	@Test
	public void test_duplicate() {
		var img = BufferedImageTools.toBufferedImage(createBuffer());
		var copy = BufferedImageTools.duplicate(img);
		img.setRGB(0, 0, 0);
		assertEquals(createBuffer().getPixel(0, 0), copy.getRGB(0, 0));
	}

}
