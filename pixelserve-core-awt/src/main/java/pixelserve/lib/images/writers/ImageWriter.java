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

package pixelserve.lib.images.writers;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Collection;

import pixelserve.lib.awt.common.BufferedImageTools;
import pixelserve.lib.images.ImageContent;
import pixelserve.lib.images.servers.OutputFormat;

/**
 * Interface for writing images in a specific format.
 * <p>
 * Implementations are discovered with a {@link java.util.ServiceLoader}.
 * 
 * @author PixelServe developers
 */
public interface ImageWriter {
	
	/**
	 * Get a short name for the writer.
	 * @return
	 */
	public String getName();
	
	/**
	 * Get a description of the writer, including its limitations.
	 * @return
	 */
	public String getDetails();
	
	/**
	 * Get the output format written by this writer.
	 * @return
	 */
	public OutputFormat getFormat();
	
	/**
	 * Get the file extensions associated with the format, without the dot.
	 * @return
	 */
	public Collection<String> getExtensions();
	
	/**
	 * Get the preferred file extension.
	 * @return
	 */
	public default String getDefaultExtension() {
		return getExtensions().iterator().next();
	}
	
	/**
	 * Returns true if the writer can store all frames of an animation.
	 * @return
	 */
	public default boolean supportsAnimation() {
		return getFormat().supportsAnimation();
	}
	
	/**
	 * Write a single image.
	 * @param img
	 * @param quality quality between 1 and 100; ignored by lossless writers
	 * @param stream
	 * @throws IOException
	 */
	public void writeImage(BufferedImage img, int quality, OutputStream stream) throws IOException;
	
	/**
	 * Write image content. If the writer does not support animation, only the first frame is written.
	 * @param content
	 * @param quality
	 * @param stream
	 * @throws IOException
	 */
	public default void writeImage(ImageContent content, int quality, OutputStream stream) throws IOException {
		writeImage(BufferedImageTools.toBufferedImage(content.getFirstFrame()), quality, stream);
	}

}
