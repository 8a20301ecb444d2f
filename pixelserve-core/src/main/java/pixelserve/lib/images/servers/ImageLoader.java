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

import java.io.IOException;

/**
 * Source of encoded image bytes.
 * 
 * @author PixelServe developers
 */
public interface ImageLoader {
	
	/**
	 * Load the encoded bytes for an image.
	 * @param source the image identifier, without any request parameters
	 * @return the encoded bytes
	 * @throws java.nio.file.NoSuchFileException if the image does not exist
	 * @throws IOException if the image could not be read
	 */
	byte[] load(String source) throws IOException;

}
