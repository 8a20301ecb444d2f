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

import pixelserve.lib.images.ImageContent;

/**
 * Decoder to convert encoded image bytes into {@link ImageContent}.
 * 
 * @author PixelServe developers
 */
public interface ImageDecoder {
	
	/**
	 * Decode image bytes.
	 * @param bytes
	 * @return a single image, or an animated sequence if the bytes contain more than one frame
	 * @throws UnsupportedImageFormatException if the format is not recognized
	 * @throws ImageDecodeException if the bytes are corrupt
	 * @throws IOException
	 */
	ImageContent decode(byte[] bytes) throws IOException;

}
