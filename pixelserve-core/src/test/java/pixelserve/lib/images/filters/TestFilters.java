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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import pixelserve.lib.common.ColorTools;
import pixelserve.lib.images.PixelBuffer;
import pixelserve.lib.images.ops.ImageFilter;
import pixelserve.lib.images.ops.ImageOps;
import pixelserve.lib.regions.ImageRegion;

@SuppressWarnings("javadoc")
public class TestFilters {
	
	private static PixelBuffer createFilled(int width, int height, int argb) {
		int[] values = new int[width * height];
		Arrays.fill(values, argb);
		return PixelBuffer.createFromARGB(width, height, values);
	}
	
	private static PixelBuffer createGradient(int width, int height) {
		var buffer = PixelBuffer.create(width, height);
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++)
				buffer.setPixel(x, y, ColorTools.packARGB(255 - y, x * 20, y * 20, (x + y) * 10));
		}
		return buffer;
	}
	
	static List<ImageFilter> provideFilters() {
		return List.of(
				ImageOps.gray(),
				ImageOps.invert(),
				ImageOps.brightness(30),
				ImageOps.contrast(50),
				ImageOps.tint(0x3366cc, false),
				ImageOps.tint(0x3366cc, true),
				ImageOps.circle(),
				ImageOps.blur(2.0),
				ImageOps.sobel(),
				ImageOps.prewitt()
				);
	}
	
	@ParameterizedTest
	@MethodSource("provideFilters")
	public void test_inputUnchanged(ImageFilter filter) {
		var source = createGradient(8, 6);
		var copy = PixelBuffer.copyOf(source);
		var output = filter.apply(source, null);
		assertTrue(source.contentEquals(copy));
		assertEquals(source.getWidth(), output.getWidth());
		assertEquals(source.getHeight(), output.getHeight());
	}
	
	@ParameterizedTest
	@MethodSource("provideFilters")
	public void test_outsideRegionUnchanged(ImageFilter filter) {
		var source = createGradient(10, 8);
		var region = ImageRegion.createInstance(2, 3, 4, 2);
		var output = filter.apply(source, region);
		for (int y = 0; y < source.getHeight(); y++) {
			for (int x = 0; x < source.getWidth(); x++) {
				if (!region.contains(x, y))
					assertEquals(source.getPixel(x, y), output.getPixel(x, y), "Pixel (" + x + ", " + y + ") changed by " + filter);
			}
		}
	}
	
	@ParameterizedTest
	@MethodSource("provideFilters")
	public void test_emptyImage(ImageFilter filter) {
		var source = PixelBuffer.create(0, 3);
		assertTrue(filter.apply(source, null).isEmpty());
	}
	
	@Test
	public void test_invert() {
		var output = ImageOps.invert().apply(createFilled(2, 2, ColorTools.packARGB(100, 10, 20, 30)), null);
		assertEquals(ColorTools.packARGB(100, 245, 235, 225), output.getPixel(1, 1));
	}
	
	@Test
	public void test_gray() {
		var output = ImageOps.gray().apply(createFilled(1, 1, ColorTools.packARGB(200, 255, 0, 0)), null);
		assertEquals(ColorTools.packARGB(200, 76, 76, 76), output.getPixel(0, 0));
		
		output = ImageOps.gray().apply(createFilled(1, 1, ColorTools.WHITE), null);
		assertEquals(ColorTools.WHITE, output.getPixel(0, 0));
	}
	
	@Test
	public void test_brightness() {
		var output = ImageOps.brightness(10).apply(createFilled(1, 1, ColorTools.packARGB(255, 250, 100, 0)), null);
		assertEquals(ColorTools.packARGB(255, 255, 110, 10), output.getPixel(0, 0));
		output = ImageOps.brightness(-20).apply(createFilled(1, 1, ColorTools.packARGB(255, 250, 100, 0)), null);
		assertEquals(ColorTools.packARGB(255, 230, 80, 0), output.getPixel(0, 0));
		assertThrows(IllegalArgumentException.class, () -> ImageOps.brightness(256));
	}
	
	@Test
	public void test_contrast() {
		var source = createGradient(5, 5);
		assertTrue(ImageOps.contrast(0).apply(source, null).contentEquals(source));
		var output = ImageOps.contrast(-100).apply(source, null);
		for (int v : output.getARGB()) {
			assertEquals(128, ColorTools.red(v));
			assertEquals(128, ColorTools.green(v));
			assertEquals(128, ColorTools.blue(v));
		}
		assertThrows(IllegalArgumentException.class, () -> ImageOps.contrast(101));
	}
	
	@Test
	public void test_tint() {
		var output = ImageOps.tint(0xff0000, false).apply(createFilled(1, 1, ColorTools.WHITE), null);
		assertEquals(ColorTools.packRGB(255, 0, 0), output.getPixel(0, 0));
		
		// HSB tinting keeps the brightness
		output = ImageOps.tint(0x00ff00, true).apply(createFilled(1, 1, ColorTools.packARGB(50, 0, 0, 128)), null);
		assertEquals(ColorTools.packARGB(50, 0, 128, 0), output.getPixel(0, 0));
	}
	
	@Test
	public void test_circle() {
		var source = createFilled(10, 10, ColorTools.WHITE);
		var output = ImageOps.circle().apply(source, null);
		assertEquals(ColorTools.TRANSPARENT, output.getPixel(0, 0));
		assertEquals(ColorTools.TRANSPARENT, output.getPixel(9, 9));
		assertEquals(ColorTools.WHITE, output.getPixel(5, 5));
		assertEquals(ColorTools.WHITE, output.getPixel(0, 5));
		
		output = ImageOps.circle(2).apply(source, null);
		assertEquals(ColorTools.TRANSPARENT, output.getPixel(0, 5));
		assertEquals(ColorTools.WHITE, output.getPixel(5, 5));
	}
	
	@Test
	public void test_blur() {
		int color = ColorTools.packARGB(255, 30, 60, 90);
		var source = createFilled(9, 7, color);
		assertTrue(ImageOps.blur(3.0).apply(source, null).contentEquals(source));
		
		source = createFilled(9, 9, ColorTools.BLACK);
		source.setPixel(4, 4, ColorTools.WHITE);
		var output = ImageOps.blur(1.0).apply(source, null);
		int center = ColorTools.red(output.getPixel(4, 4));
		int neighbor = ColorTools.red(output.getPixel(5, 4));
		int far = ColorTools.red(output.getPixel(0, 0));
		assertTrue(center < 255);
		assertTrue(neighbor > 0);
		assertTrue(center > neighbor);
		assertEquals(0, far);
		assertEquals(ColorTools.red(output.getPixel(3, 4)), neighbor);
		
		assertThrows(IllegalArgumentException.class, () -> ImageOps.blur(0));
		assertThrows(IllegalArgumentException.class, () -> ImageOps.blur(Double.NaN));
		assertThrows(IllegalArgumentException.class, () -> ImageOps.blur(Double.MAX_VALUE));
		assertThrows(IllegalArgumentException.class, () -> ImageOps.blur(GaussianBlur.MAX_VARIANCE * 2));
		var small = createFilled(3, 2, ColorTools.packARGB(255, 10, 20, 30));
		assertTrue(ImageOps.blur(GaussianBlur.MAX_VARIANCE).apply(small, null).contentEquals(small));
	}
	
	@Test
	public void test_edges() {
		for (var filter : List.of(ImageOps.sobel(), ImageOps.prewitt())) {
			var constant = createFilled(6, 6, ColorTools.packARGB(128, 90, 90, 90));
			var output = filter.apply(constant, null);
			for (int v : output.getARGB())
				assertEquals(ColorTools.packARGB(128, 0, 0, 0), v);
			
			// Vertical edge between columns 2 and 3
			var edge = PixelBuffer.create(6, 6);
			for (int y = 0; y < 6; y++) {
				for (int x = 0; x < 6; x++)
					edge.setPixel(x, y, x < 3 ? ColorTools.BLACK : ColorTools.WHITE);
			}
			output = filter.apply(edge, null);
			assertEquals(0, ColorTools.red(output.getPixel(0, 3)));
			assertEquals(0, ColorTools.red(output.getPixel(5, 3)));
			assertEquals(255, ColorTools.red(output.getPixel(2, 3)));
			assertEquals(255, ColorTools.red(output.getPixel(3, 3)));
		}
	}
	
	@Test
	public void test_descriptors() {
		assertEquals("gray", ImageOps.gray().getDescriptor());
		assertNotEquals(ImageOps.blur(1).getDescriptor(), ImageOps.blur(2).getDescriptor());
		assertNotEquals(ImageOps.sobel().getDescriptor(), ImageOps.prewitt().getDescriptor());
		assertNotEquals(ImageOps.tint(0xff0000, true).getDescriptor(), ImageOps.tint(0xff0000, false).getDescriptor());
		assertEquals("filter(gray,invert)", ImageOps.filter(ImageOps.gray(), ImageOps.invert()).getDescriptor());
	}

}
