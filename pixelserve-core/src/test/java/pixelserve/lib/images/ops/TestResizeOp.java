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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.MethodSource;

import pixelserve.lib.common.ColorTools;
import pixelserve.lib.images.InvalidDimensionException;
import pixelserve.lib.images.PixelBuffer;
import pixelserve.lib.images.SizeLimitExceededException;
import pixelserve.lib.images.UnsupportedModeException;

@SuppressWarnings("javadoc")
public class TestResizeOp {
	
	private static PixelBuffer createFilled(int width, int height, int argb) {
		int[] values = new int[width * height];
		java.util.Arrays.fill(values, argb);
		return PixelBuffer.createFromARGB(width, height, values);
	}
	
	static Stream<Arguments> provideResizes() {
		return Stream.of(
				// Explicit sizes ignore the aspect ratio
				Arguments.of(ImageOps.resize(100, 100), 200, 50, 100, 100),
				Arguments.of(ImageOps.resize(7, 3), 3, 7, 7, 3),
				// Width only
				Arguments.of(ImageOps.width(100), 200, 50, 100, 25),
				Arguments.of(ImageOps.width(5), 2, 3, 5, 8),
				// Height only, with 7.5 rounded away from zero
				Arguments.of(ImageOps.height(5), 3, 2, 8, 5),
				Arguments.of(ImageOps.height(10), 200, 50, 40, 10),
				// Size applies to the longer side
				Arguments.of(ImageOps.size(100), 200, 50, 100, 25),
				Arguments.of(ImageOps.size(100), 50, 200, 25, 100),
				Arguments.of(ImageOps.size(50), 100, 100, 50, 50)
				);
	}
	
	@ParameterizedTest
	@MethodSource("provideResizes")
	public void test_outputSize(ResizeOp op, int srcWidth, int srcHeight, int expectedWidth, int expectedHeight) {
		var output = op.apply(PixelBuffer.create(srcWidth, srcHeight));
		assertEquals(expectedWidth, output.getWidth());
		assertEquals(expectedHeight, output.getHeight());
		assertArrayEquals(new int[] {expectedWidth, expectedHeight}, op.computeOutputSize(srcWidth, srcHeight));
	}
	
	@ParameterizedTest
	@EnumSource(value = StretchMode.class, names = {"UNIFORM", "UNIFORM_TO_FILL", "NONE"})
	public void test_unsupportedModes(StretchMode mode) {
		assertThrows(UnsupportedModeException.class, () -> ImageOps.resize(10, 10, mode));
		assertThrows(UnsupportedOperationException.class, () -> ImageOps.resizeBuilder().width(10).mode(mode).build());
	}
	
	@Test
	public void test_fillMode() {
		var op = ImageOps.resize(10, 20, StretchMode.FILL);
		assertEquals(StretchMode.FILL, op.getMode());
	}
	
	@Test
	public void test_invalidDimensions() {
		assertThrows(InvalidDimensionException.class, () -> ImageOps.resize(0, 10));
		assertThrows(InvalidDimensionException.class, () -> ImageOps.resize(10, -1));
		assertThrows(InvalidDimensionException.class, () -> ImageOps.width(0));
		assertThrows(InvalidDimensionException.class, () -> ImageOps.height(-5));
		assertThrows(InvalidDimensionException.class, () -> ImageOps.size(0));
		assertThrows(InvalidDimensionException.class, () -> ImageOps.resizeBuilder().build());
		assertThrows(IllegalArgumentException.class, () -> ImageOps.resizeBuilder().size(10).width(10).build());
	}
	
	@Test
	public void test_derivedDimensionTooSmall() {
		// 1 / 100 rounds to 0
		var op = ImageOps.width(1);
		assertThrows(InvalidDimensionException.class, () -> op.apply(PixelBuffer.create(100, 1)));
	}
	
	@Test
	public void test_emptySource() {
		assertThrows(InvalidDimensionException.class, () -> ImageOps.width(10).apply(PixelBuffer.create(0, 10)));
		assertThrows(InvalidDimensionException.class, () -> ImageOps.resize(10, 10).apply(PixelBuffer.create(0, 0)));
	}
	
	@Test
	public void test_sizeLimits() {
		assertThrows(SizeLimitExceededException.class, () -> ImageOps.resize(ImageOps.DEFAULT_MAX_WIDTH + 1, 10));
		assertThrows(SizeLimitExceededException.class, () -> ImageOps.resize(10, ImageOps.DEFAULT_MAX_HEIGHT + 1));
		ImageOps.resize(ImageOps.DEFAULT_MAX_WIDTH, ImageOps.DEFAULT_MAX_HEIGHT);
		
		// Width is checked against the maximum width, height against the maximum height
		assertThrows(SizeLimitExceededException.class, () -> ImageOps.resizeBuilder().maxSize(100, 10).width(50).height(50).build());
		assertThrows(SizeLimitExceededException.class, () -> ImageOps.resizeBuilder().maxSize(10, 100).width(50).height(50).build());
		ImageOps.resizeBuilder().maxSize(50, 50).width(50).height(50).build();
		
		// Derived dimensions are checked when applied
		var op = ImageOps.resizeBuilder().maxSize(100, 100).width(50).build();
		var e = assertThrows(SizeLimitExceededException.class, () -> op.apply(PixelBuffer.create(10, 100)));
		assertEquals(100, e.getMaxHeight());
		assertEquals(100, e.getMaxWidth());
	}
	
	@Test
	public void test_constantColorPreserved() {
		int color = ColorTools.packARGB(255, 200, 100, 50);
		var source = createFilled(17, 9, color);
		for (var sampler : new ImageSampler[] {new SuperSamplingSampler(), new NearestNeighborSampler()}) {
			for (var size : new int[][] {{5, 3}, {40, 31}, {17, 1}}) {
				var op = ImageOps.resizeBuilder().width(size[0]).height(size[1]).sampler(sampler).build();
				var output = op.apply(source);
				for (int v : output.getARGB())
					assertEquals(color, v, () -> "Unexpected color using " + sampler);
			}
		}
	}
	
	@Test
	public void test_superSamplingAverages() {
		var source = PixelBuffer.createFromARGB(2, 1, new int[] {ColorTools.packRGB(0, 0, 0), ColorTools.packRGB(200, 100, 50)});
		var output = ImageOps.resize(1, 1).apply(source);
		assertEquals(ColorTools.packRGB(100, 50, 25), output.getPixel(0, 0));
	}
	
	@Test
	public void test_superSamplingIgnoresTransparentColor() {
		var source = PixelBuffer.createFromARGB(2, 1, new int[] {ColorTools.packARGB(0, 0, 0, 0), ColorTools.packARGB(255, 200, 100, 50)});
		int v = ImageOps.resize(1, 1).apply(source).getPixel(0, 0);
		assertEquals(128, ColorTools.alpha(v));
		assertEquals(200, ColorTools.red(v));
		assertEquals(100, ColorTools.green(v));
		assertEquals(50, ColorTools.blue(v));
	}
	
	@Test
	public void test_nearestNeighbor() {
		var source = PixelBuffer.createFromARGB(2, 1, new int[] {ColorTools.BLACK, ColorTools.WHITE});
		var output = ImageOps.resizeBuilder().width(4).height(1).sampler(new NearestNeighborSampler()).build().apply(source);
		assertArrayEquals(new int[] {ColorTools.BLACK, ColorTools.BLACK, ColorTools.WHITE, ColorTools.WHITE}, output.getARGB());
	}
	
	@Test
	public void test_descriptors() {
		assertEquals(ImageOps.resize(10, 20).getDescriptor(), ImageOps.resize(10, 20).getDescriptor());
		assertNotEquals(ImageOps.resize(10, 20).getDescriptor(), ImageOps.resize(20, 10).getDescriptor());
		assertNotEquals(ImageOps.width(10).getDescriptor(), ImageOps.height(10).getDescriptor());
		assertNotEquals(ImageOps.width(10).getDescriptor(), ImageOps.size(10).getDescriptor());
		assertNotEquals(ImageOps.width(10).getDescriptor(), 
				ImageOps.resizeBuilder().width(10).sampler(new NearestNeighborSampler()).build().getDescriptor());
	}

}
