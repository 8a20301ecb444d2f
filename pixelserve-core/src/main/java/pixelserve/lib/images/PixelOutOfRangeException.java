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
 * Exception thrown when a pixel coordinate falls outside an image.
 * 
 * @author PixelServe developers
 */
public class PixelOutOfRangeException extends IndexOutOfBoundsException {

	private static final long serialVersionUID = 1L;

	/**
	 * Constructor.
	 * @param x requested x coordinate
	 * @param y requested y coordinate
	 * @param width image width
	 * @param height image height
	 */
	public PixelOutOfRangeException(int x, int y, int width, int height) {
		super(String.format("Pixel (%d, %d) is outside the %dx%d image", x, y, width, height));
	}

}
