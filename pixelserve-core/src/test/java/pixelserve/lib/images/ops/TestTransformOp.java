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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import pixelserve.lib.common.ColorTools;
import pixelserve.lib.images.PixelBuffer;

@SuppressWarnings("javadoc")
public class TestTransformOp {
	
	/**
	 * Create an image where each pixel encodes its own coordinates in its red and green channels.
	 */
	private static PixelBuffer createCoordinateImage(int width, int height) {
		var buffer = PixelBuffer.create(width, height);
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++)
				buffer.setPixel(x, y, ColorTools.packRGB(x, y, 0));
		}
		return buffer;
	}
	
	private static void assertSourcePixel(PixelBuffer output, int x, int y, int expectedSourceX, int expectedSourceY) {
		int v = output.getPixel(x, y);
		assertEquals(expectedSourceX, ColorTools.red(v), "Wrong source x for output (" + x + ", " + y + ")");
		assertEquals(expectedSourceY, ColorTools.green(v), "Wrong source y for output (" + x + ", " + y + ")");
	}
	
	@Test
	public void test_rotate90() {
		var output = ImageOps.rotate90().apply(createCoordinateImage(3, 2));
		assertEquals(2, output.getWidth());
		assertEquals(3, output.getHeight());
		// Top left of output is bottom left of input
		assertSourcePixel(output, 0, 0, 0, 1);
		assertSourcePixel(output, 1, 0, 0, 0);
		assertSourcePixel(output, 0, 2, 2, 1);
		assertSourcePixel(output, 1, 2, 2, 0);
	}
	
	@Test
	public void test_rotate180() {
		var output = ImageOps.rotate180().apply(createCoordinateImage(3, 2));
		assertEquals(3, output.getWidth());
		assertEquals(2, output.getHeight());
		assertSourcePixel(output, 0, 0, 2, 1);
		assertSourcePixel(output, 2, 1, 0, 0);
		assertSourcePixel(output, 1, 0, 1, 1);
	}
	
	@Test
	public void test_rotate270() {
		var output = ImageOps.rotate270().apply(createCoordinateImage(3, 2));
		assertEquals(2, output.getWidth());
		assertEquals(3, output.getHeight());
		// Top left of output is top right of input
		assertSourcePixel(output, 0, 0, 2, 0);
		assertSourcePixel(output, 1, 0, 2, 1);
		assertSourcePixel(output, 0, 2, 0, 0);
	}
	
	@Test
	public void test_flips() {
		var source = createCoordinateImage(3, 2);
		var flipX = ImageOps.flipX().apply(source);
		assertSourcePixel(flipX, 0, 0, 2, 0);
		assertSourcePixel(flipX, 2, 1, 0, 1);
		
		var flipY = ImageOps.flipY().apply(source);
		assertSourcePixel(flipY, 0, 0, 0, 1);
		assertSourcePixel(flipY, 2, 1, 2, 0);
		
		var flipBoth = ImageOps.transform(Rotation.NONE, Flip.BOTH).apply(source);
		assertTrue(flipBoth.contentEquals(ImageOps.rotate180().apply(source)));
	}
	
	static Stream<Arguments> provideTransforms() {
		List<Arguments> args = new ArrayList<>();
		for (var rotation : Rotation.values()) {
			for (var flip : Flip.values())
				args.add(Arguments.of(rotation, flip));
		}
		return args.stream();
	}
	
	@ParameterizedTest
	@MethodSource("provideTransforms")
	public void test_rotateThenFlip(Rotation rotation, Flip flip) {
		var source = createCoordinateImage(5, 3);
		var combined = ImageOps.transform(rotation, flip).apply(source);
		var sequential = ImageOps.transform(Rotation.NONE, flip).apply(
				ImageOps.transform(rotation, Flip.NONE).apply(source));
		assertTrue(combined.contentEquals(sequential));
	}
	
	@Test
	public void test_fullTurn() {
		var source = createCoordinateImage(4, 7);
		var output = source;
		for (int i = 0; i < 4; i++)
			output = ImageOps.rotate90().apply(output);
		assertTrue(output.contentEquals(source));
		assertTrue(ImageOps.rotate90().apply(ImageOps.rotate270().apply(source)).contentEquals(source));
	}
	
	@Test
	public void test_inputUnchanged() {
		var source = createCoordinateImage(4, 3);
		var copy = PixelBuffer.copyOf(source);
		ImageOps.transform(Rotation.ROTATE_90, Flip.HORIZONTAL).apply(source);
		assertTrue(source.contentEquals(copy));
	}
	
	@Test
	public void test_emptyImage() {
		var output = ImageOps.rotate90().apply(PixelBuffer.create(0, 5));
		assertEquals(5, output.getWidth());
		assertEquals(0, output.getHeight());
	}
	
	@Test
	public void test_rotationFromDegrees() {
		assertEquals(Rotation.NONE, Rotation.fromDegrees(0));
		assertEquals(Rotation.ROTATE_90, Rotation.fromDegrees(90));
		assertEquals(Rotation.ROTATE_270, Rotation.fromDegrees(-90));
		assertEquals(Rotation.ROTATE_180, Rotation.fromDegrees(540));
		assertThrows(IllegalArgumentException.class, () -> Rotation.fromDegrees(45));
		assertThrows(NullPointerException.class, () -> ImageOps.transform(null, Flip.NONE));
	}

}
