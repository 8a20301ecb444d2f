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

package pixelserve.lib.io;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonParseException;

import pixelserve.lib.images.ops.ImageOps;
import pixelserve.lib.images.stores.ArtifactCache;
import pixelserve.lib.requests.ImageRequest;

/**
 * Configuration for serving images, read from JSON.
 * <p>
 * Any field missing from the JSON keeps its default value.
 * 
 * @author PixelServe developers
 */
public class PixelServeConfig {
	
	private static final Logger logger = LoggerFactory.getLogger(PixelServeConfig.class);
	
	private int maxWidth = ImageOps.DEFAULT_MAX_WIDTH;
	private int maxHeight = ImageOps.DEFAULT_MAX_HEIGHT;
	private long cacheSizeBytes = ArtifactCache.DEFAULT_MAX_BYTES;
	private int frameThreads = 0;
	private int defaultJpegQuality = ImageRequest.DEFAULT_QUALITY;
	private Path imageRoot = Paths.get(".");
	
	/**
	 * Create a configuration with default values.
	 * @return
	 */
	public static PixelServeConfig createDefault() {
		return new PixelServeConfig();
	}
	
	/**
	 * Read and validate a configuration from a JSON file.
	 * @param path
	 * @return
	 * @throws IOException if the file cannot be read or parsed
	 * @throws IllegalArgumentException if the configuration contains invalid values
	 */
	public static PixelServeConfig read(Path path) throws IOException {
		logger.debug("Reading configuration from {}", path);
		try (var reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
			return read(reader);
		}
	}
	
	/**
	 * Read and validate a configuration from JSON.
	 * @param reader
	 * @return
	 * @throws IOException if the JSON cannot be parsed
	 * @throws IllegalArgumentException if the configuration contains invalid values
	 */
	public static PixelServeConfig read(Reader reader) throws IOException {
		PixelServeConfig config;
		try {
			config = GsonTools.getInstance().fromJson(reader, PixelServeConfig.class);
		} catch (JsonParseException e) {
			throw new IOException("Unable to parse configuration: " + e.getMessage(), e);
		}
		if (config == null)
			config = createDefault();
		config.validate();
		return config;
	}
	
	/**
	 * Check that all values are in range.
	 * @throws IllegalArgumentException if any value is invalid
	 */
	public void validate() {
		if (maxWidth <= 0 || maxHeight <= 0)
			throw new IllegalArgumentException(String.format("Maximum size must be positive, but was %dx%d", maxWidth, maxHeight));
		if (cacheSizeBytes < 0)
			throw new IllegalArgumentException("Cache size must be >= 0, but was " + cacheSizeBytes);
		if (frameThreads < 0)
			throw new IllegalArgumentException("Frame threads must be >= 0, but was " + frameThreads);
		if (defaultJpegQuality < 1 || defaultJpegQuality > 100)
			throw new IllegalArgumentException("JPEG quality must be between 1 and 100, but was " + defaultJpegQuality);
		if (imageRoot == null)
			throw new IllegalArgumentException("Image root must not be null");
	}
	
	/**
	 * Write this configuration as pretty-printed JSON.
	 * @return
	 */
	public String toJson() {
		return GsonTools.getInstance(true).toJson(this);
	}
	
	public int getMaxWidth() {
		return maxWidth;
	}
	
	public int getMaxHeight() {
		return maxHeight;
	}
	
	/**
	 * Get the maximum number of bytes of encoded artifacts to cache.
	 * @return
	 */
	public long getCacheSizeBytes() {
		return cacheSizeBytes;
	}
	
	/**
	 * Get the number of threads used to process animation frames; 0 means frames are processed sequentially.
	 * @return
	 */
	public int getFrameThreads() {
		return frameThreads;
	}
	
	public int getDefaultJpegQuality() {
		return defaultJpegQuality;
	}
	
	/**
	 * Get the directory that image sources are resolved against.
	 * @return
	 */
	public Path getImageRoot() {
		return imageRoot;
	}
	
	@Override
	public String toString() {
		return "PixelServeConfig" + GsonTools.getInstance().toJson(this);
	}

}
