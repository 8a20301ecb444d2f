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

package pixelserve.lib.images.stores;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable encoded image, with its content type.
 * 
 * @author PixelServe developers
 */
public final class Artifact {
	
	private final byte[] bytes;
	private final String contentType;
	
	private Artifact(byte[] bytes, String contentType) {
		this.bytes = bytes;
		this.contentType = contentType;
	}
	
	/**
	 * Create an artifact. The bytes are copied.
	 * @param bytes
	 * @param contentType
	 * @return
	 */
	public static Artifact create(byte[] bytes, String contentType) {
		Objects.requireNonNull(bytes, "Bytes must not be null");
		Objects.requireNonNull(contentType, "Content type must not be null");
		return new Artifact(bytes.clone(), contentType);
	}
	
	/**
	 * Get a copy of the encoded bytes.
	 * @return
	 */
	public byte[] getBytes() {
		return bytes.clone();
	}
	
	/**
	 * Get the number of encoded bytes.
	 * @return
	 */
	public int length() {
		return bytes.length;
	}
	
	public String getContentType() {
		return contentType;
	}
	
	@Override
	public String toString() {
		return "Artifact[" + contentType + ", " + bytes.length + " bytes]";
	}

	@Override
	public int hashCode() {
		return 31 * Arrays.hashCode(bytes) + contentType.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof Artifact))
			return false;
		var other = (Artifact)obj;
		return contentType.equals(other.contentType) && Arrays.equals(bytes, other.bytes);
	}

}
