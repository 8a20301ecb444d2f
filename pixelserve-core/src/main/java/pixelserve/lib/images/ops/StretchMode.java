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

/**
 * Policies for mapping the aspect ratio of a source image to a requested size.
 * <p>
 * Only {@link #FILL} is currently supported; requesting any other mode fails with 
 * {@link pixelserve.lib.images.UnsupportedModeException}.
 */
public enum StretchMode {
	
	/**
	 * Stretch the image to exactly fill the requested size.
	 */
	FILL,
	
	/**
	 * Scale uniformly so that the image fits within the requested size.
	 */
	UNIFORM,
	
	/**
	 * Scale uniformly so that the image covers the requested size, cropping the excess.
	 */
	UNIFORM_TO_FILL,
	
	/**
	 * Keep the original size.
	 */
	NONE;

}
