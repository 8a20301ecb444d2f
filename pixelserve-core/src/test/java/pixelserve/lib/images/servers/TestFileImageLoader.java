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

package pixelserve.lib.images.servers;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import pixelserve.lib.requests.Fingerprint;

@SuppressWarnings("javadoc")
public class TestFileImageLoader {
	
	@TempDir
	Path tempDir;
	
	@Test
	public void test_load() throws Exception {
		byte[] bytes = {1, 2, 3, 4};
		Files.createDirectories(tempDir.resolve("images"));
		Files.write(tempDir.resolve("images/car.bmp"), bytes);
		
		var loader = new FileImageLoader(tempDir);
		assertArrayEquals(bytes, loader.load("images/car.bmp"));
		assertArrayEquals(bytes, loader.load("/images/car.bmp"));
		assertArrayEquals(bytes, loader.load("images/car.bmp?rotate=90&flip=x"));
		assertArrayEquals(bytes, loader.load("images/../images/car.bmp"));
	}
	
	@Test
	public void test_whitespaceIsPartOfName() throws Exception {
		Files.write(tempDir.resolve("car.bmp"), new byte[] {1});
		Files.write(tempDir.resolve("car.bmp "), new byte[] {2});
		
		var loader = new FileImageLoader(tempDir);
		assertArrayEquals(new byte[] {1}, loader.load("car.bmp"));
		assertArrayEquals(new byte[] {2}, loader.load("car.bmp "));
		// Different files must never share a cached artifact
		assertNotEquals(Fingerprint.of("car.bmp"), Fingerprint.of("car.bmp "));
	}
	
	@ParameterizedTest
	@ValueSource(strings = {"missing.png", "", "   ", "?gray", "images", "../outside.png", "images/../../outside.png"})
	public void test_missing(String source) throws Exception {
		Files.createDirectories(tempDir.resolve("root/images"));
		Files.write(tempDir.resolve("outside.png"), new byte[] {1});
		var loader = new FileImageLoader(tempDir.resolve("root"));
		assertThrows(NoSuchFileException.class, () -> loader.load(source));
	}
	
	@Test
	public void test_nullSource() {
		var loader = new FileImageLoader(tempDir);
		assertThrows(NullPointerException.class, () -> loader.load(null));
	}

}
