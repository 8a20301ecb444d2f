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

package pixelserve.lib.requests;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import pixelserve.lib.images.ops.ImageOps;
import pixelserve.lib.images.servers.OutputFormat;

@SuppressWarnings("javadoc")
public class TestFingerprint {
	
	@ParameterizedTest
	@ValueSource(strings = {"car.bmp", "car.bmp?", "car.bmp?&", "car.bmp?&&"})
	public void test_equivalentRequests(String request) {
		var expected = Fingerprint.of("car.bmp");
		var fp = Fingerprint.parse(request);
		assertEquals(expected, fp);
		assertEquals(expected.hashCode(), fp.hashCode());
		assertEquals("car.bmp", fp.getCanonicalKey());
	}
	
	@Test
	public void test_tokenOrderMatters() {
		var fp1 = Fingerprint.of("car.bmp", "rotate=90", "flip=x");
		var fp2 = Fingerprint.of("car.bmp", "flip=x", "rotate=90");
		assertNotEquals(fp1, fp2);
		assertEquals("car.bmp?rotate=90&flip=x", fp1.getCanonicalKey());
		assertEquals(fp1, Fingerprint.parse("car.bmp?rotate=90&flip=x"));
	}
	
	@Test
	public void test_blankTokensIgnored() {
		var fp = Fingerprint.of("car.bmp", Arrays.asList("gray", "", null, "  ", "invert"));
		assertEquals(Fingerprint.of("car.bmp", "gray", "invert"), fp);
		assertEquals(Fingerprint.of("car.bmp", List.of()), Fingerprint.of("car.bmp"));
	}
	
	@Test
	public void test_differentSources() {
		assertNotEquals(Fingerprint.of("a.png", "gray"), Fingerprint.of("b.png", "gray"));
		assertNotEquals(Fingerprint.of("a.png"), Fingerprint.of("a.png "));
		assertNotEquals(Fingerprint.of("a.png"), Fingerprint.parse(" a.png?"));
		assertEquals(" a.png ?gray", Fingerprint.parse(" a.png ?gray").getCanonicalKey());
	}
	
	@Test
	public void test_hexString() {
		var hex = Fingerprint.of("car.bmp").toHexString();
		assertEquals(64, hex.length());
		assertTrue(hex.matches("[0-9a-f]+"));
		assertEquals(hex, Fingerprint.parse("car.bmp?").toHexString());
	}
	
	@Test
	public void test_nulls() {
		assertThrows(NullPointerException.class, () -> Fingerprint.of(null, "gray"));
		assertThrows(NullPointerException.class, () -> Fingerprint.parse(null));
	}
	
	@Test
	public void test_requestFingerprint() {
		var ops = List.of(ImageOps.resize(100, 100), ImageOps.filter(ImageOps.gray()));
		var png1 = ImageRequest.createInstance("car.bmp", ops, OutputFormat.PNG, 10);
		var png2 = ImageRequest.createInstance("car.bmp", ops, OutputFormat.PNG, 90);
		assertEquals(png1.getFingerprint(), png2.getFingerprint());
		
		var jpeg1 = ImageRequest.createInstance("car.bmp", ops, OutputFormat.JPEG, 10);
		var jpeg2 = ImageRequest.createInstance("car.bmp", ops, OutputFormat.JPEG, 90);
		assertNotEquals(jpeg1.getFingerprint(), jpeg2.getFingerprint());
		assertNotEquals(png1.getFingerprint(), jpeg2.getFingerprint());
		
		var reordered = ImageRequest.createInstance("car.bmp", List.of(ops.get(1), ops.get(0)), OutputFormat.PNG);
		assertNotEquals(png1.getFingerprint(), reordered.getFingerprint());
		
		var same = ImageRequest.createInstance("car.bmp", List.of(ImageOps.resize(100, 100), ImageOps.filter(ImageOps.gray())), OutputFormat.PNG);
		assertEquals(png1.getFingerprint(), same.getFingerprint());
	}
	
	@Test
	public void test_requestQuality() {
		assertEquals(ImageRequest.DEFAULT_QUALITY, ImageRequest.createInstance("car.bmp", OutputFormat.JPEG).getQuality());
		assertThrows(IllegalArgumentException.class, () -> ImageRequest.createInstance("car.bmp", List.of(), OutputFormat.JPEG, 0));
		assertThrows(IllegalArgumentException.class, () -> ImageRequest.createInstance("car.bmp", List.of(), OutputFormat.JPEG, 101));
	}

}
