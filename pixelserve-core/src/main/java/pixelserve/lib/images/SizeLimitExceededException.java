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

/**
 * Exception thrown when requested output dimensions exceed the configured maximum.
 * 
 * @author PixelServe developers
 */
public class SizeLimitExceededException extends IllegalArgumentException {

	private static final long serialVersionUID = 1L;
	
	private final int maxWidth;
	private final int maxHeight;

	/**
	 * Constructor.
	 * @param width requested width
	 * @param height requested height
	 * @param maxWidth maximum permitted width
	 * @param maxHeight maximum permitted height
	 */
	public SizeLimitExceededException(int width, int height, int maxWidth, int maxHeight) {
		super(String.format("Target size '%dx%d' is bigger than the max allowed size '%dx%d'", 
				width, height, maxWidth, maxHeight));
		this.maxWidth = maxWidth;
		this.maxHeight = maxHeight;
	}
	
	/**
	 * Get the maximum permitted width.
	 * @return
	 */
	public int getMaxWidth() {
		return maxWidth;
	}
	
	/**
	 * Get the maximum permitted height.
	 * @return
	 */
	public int getMaxHeight() {
		return maxHeight;
	}

}
