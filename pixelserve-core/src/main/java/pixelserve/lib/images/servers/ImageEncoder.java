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
 * Encoder to convert {@link ImageContent} into bytes.
 * 
 * @author PixelServe developers
 */
public interface ImageEncoder {
	
	/**
	 * Encode image content.
	 * <p>
	 * If the format cannot store an animation, only the first frame is written.
	 * 
	 * @param content
	 * @param format
	 * @param quality quality between 1 and 100, used by lossy formats only
	 * @return the encoded bytes
	 * @throws UnsupportedImageFormatException if the format cannot be written
	 * @throws IOException
	 */
	byte[] encode(ImageContent content, OutputFormat format, int quality) throws IOException;

}
