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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.ServiceLoader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import pixelserve.lib.images.ImageContent;
import pixelserve.lib.images.InvalidDimensionException;
import pixelserve.lib.images.servers.ImageEncoder;
import pixelserve.lib.images.servers.OutputFormat;
import pixelserve.lib.images.servers.UnsupportedImageFormatException;

/**
 * Static methods to access {@link ImageWriter} objects and encode images.
 * 
 * @author PixelServe developers
 */
public class ImageWriterTools {
	
	private static final Logger logger = LoggerFactory.getLogger(ImageWriterTools.class);
	
	private static ServiceLoader<ImageWriter> serviceLoader = ServiceLoader.load(ImageWriter.class);
	
	// Suppress default constructor for non-instantiability
	private ImageWriterTools() {
		throw new AssertionError();
	}
	
	/**
	 * Get all available writers.
	 * @return
	 */
	public static List<ImageWriter> getWriters() {
		List<ImageWriter> writers = new ArrayList<>();
		synchronized (serviceLoader) {
			for (ImageWriter writer : serviceLoader)
				writers.add(writer);
		}
		return Collections.unmodifiableList(writers);
	}
	
	/**
	 * Get the writers for an output format.
	 * @param format
	 * @return
	 */
	public static List<ImageWriter> getCompatibleWriters(OutputFormat format) {
		Objects.requireNonNull(format, "Output format must not be null");
		List<ImageWriter> writers = new ArrayList<>();
		for (var writer : getWriters()) {
			if (writer.getFormat() == format)
				writers.add(writer);
		}
		return writers;
	}
	
	/**
	 * Encode image content.
	 * @param content
	 * @param format
	 * @param quality quality between 1 and 100, used by lossy formats only
	 * @return the encoded bytes
	 * @throws UnsupportedImageFormatException if no writer is available for the format
	 * @throws IOException if the image could not be written
	 */
	public static byte[] writeImage(ImageContent content, OutputFormat format, int quality) throws IOException {
		Objects.requireNonNull(content, "Content must not be null");
		if (content.nFrames() == 0 || content.getFirstFrame().isEmpty())
			throw new InvalidDimensionException("Cannot encode an empty image " + content);
		var writers = getCompatibleWriters(format);
		if (writers.isEmpty())
			throw new UnsupportedImageFormatException("No writer found for " + format);
		IOException lastException = null;
		for (var writer : writers) {
			if (content.nFrames() > 1 && !writer.supportsAnimation())
				logger.debug("{} will only write the first of {} frames", writer, content.nFrames());
			try (var stream = new ByteArrayOutputStream()) {
				writer.writeImage(content, quality, stream);
				return stream.toByteArray();
			} catch (IOException e) {
				logger.warn("Unable to write image with {}: {}", writer, e.getLocalizedMessage());
				logger.debug(e.getLocalizedMessage(), e);
				lastException = e;
			}
		}
		throw lastException;
	}
	
	/**
	 * Get an {@link ImageEncoder} that uses the available writers.
	 * @return
	 */
	public static ImageEncoder getEncoder() {
		return ImageWriterTools::writeImage;
	}

}
