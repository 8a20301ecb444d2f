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

package pixelserve.lib.app.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import pixelserve.lib.app.logging.LogManager.LogLevel;

@SuppressWarnings("javadoc")
public class TestLogManager {
	
	private LogLevel originalLevel;
	
	@BeforeEach
	public void storeLevel() {
		originalLevel = LogManager.getRootLogLevel();
	}
	
	@AfterEach
	public void restoreLevel() {
		if (originalLevel != null)
			LogManager.setRootLogLevel(originalLevel);
	}
	
	@ParameterizedTest
	@EnumSource(LogLevel.class)
	public void test_setRootLogLevel(LogLevel level) {
		assertNotNull(LogManager.getLoggerContext());
		assertTrue(LogManager.setRootLogLevel(level));
		assertEquals(level, LogManager.getRootLogLevel());
		assertEquals(level.name(), LogManager.getLevel(level).toString());
	}

}
