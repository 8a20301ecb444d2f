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

import java.util.Optional;

import pixelserve.lib.common.GeneralTools;

/**
 * Supported output formats.
 */
public enum OutputFormat {
	
	/**
	 * Lossless PNG
	 */
	PNG("image/png", ".png", false),
	
	/**
	 * Lossy JPEG; transparency is lost
	 */
	JPEG("image/jpeg", ".jpg", false),
	
	/**
	 * GIF, supporting animation
	 */
	GIF("image/gif", ".gif", true);
	
	private final String contentType;
	private final String extension;
	private final boolean supportsAnimation;
	
	private OutputFormat(String contentType, String extension, boolean supportsAnimation) {
		this.contentType = contentType;
		this.extension = extension;
		this.supportsAnimation = supportsAnimation;
	}
	
	/**
	 * Get the MIME type.
	 * @return
	 */
	public String getContentType() {
		return contentType;
	}
	
	/**
	 * Get the default file extension, including the dot.
	 * @return
	 */
	public String getExtension() {
		return extension;
	}
	
	/**
	 * Returns true if multiple frames can be written.
	 * @return
	 */
	public boolean supportsAnimation() {
		return supportsAnimation;
	}
	
	/**
	 * Get the output format for a file name or extension, if known.
	 * @param name file name, or extension with or without the dot
	 * @return
	 */
	public static Optional<OutputFormat> fromExtension(String name) {
		if (name == null)
			return Optional.empty();
		String ext = name.contains(".") ? GeneralTools.getExtension(name).orElse("") : "." + name.toLowerCase();
		switch (ext) {
		case ".png":
			return Optional.of(PNG);
		case ".jpg":
		case ".jpeg":
			return Optional.of(JPEG);
		case ".gif":
			return Optional.of(GIF);
		default:
			return Optional.empty();
		}
	}

}
