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

package pixelserve.lib.common;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@SuppressWarnings("javadoc")
public class TestGeneralTools {
	
	@Test
	public void test_getExtension() {
		assertEquals(Optional.of(".png"), GeneralTools.getExtension("output.PNG"));
		assertEquals(Optional.of(".gif"), GeneralTools.getExtension("/tmp/some.dir/anim.gif"));
		assertEquals(Optional.empty(), GeneralTools.getExtension("/tmp/some.dir/noext"));
		assertEquals(Optional.empty(), GeneralTools.getExtension("trailing."));
		assertEquals(Optional.empty(), GeneralTools.getExtension("odd.ext-"));
	}
	
	@Test
	public void test_blankString() {
		assertTrue(GeneralTools.blankString(null, false));
		assertTrue(GeneralTools.blankString("", false));
		assertFalse(GeneralTools.blankString("  ", false));
		assertTrue(GeneralTools.blankString("  ", true));
		assertFalse(GeneralTools.blankString(" a ", true));
	}
	
	@Test
	public void test_clipValue() {
		assertEquals(0, GeneralTools.clipValue(-5, 0, 255));
		assertEquals(255, GeneralTools.clipValue(500, 0, 255));
		assertEquals(12, GeneralTools.clipValue(12, 0, 255));
		assertEquals(1.0, GeneralTools.clipValue(1.5, 0.0, 1.0));
	}
	
	@ParameterizedTest
	@CsvSource({
		"0.0, 0",
		"0.4, 0",
		"0.5, 1",
		"2.5, 3",
		"-0.5, -1",
		"-2.5, -3",
		"-2.4, -2",
		"133.3333, 133"
	})
	public void test_roundHalfAwayFromZero(double value, long expected) {
		assertEquals(expected, GeneralTools.roundHalfAwayFromZero(value));
	}

}
