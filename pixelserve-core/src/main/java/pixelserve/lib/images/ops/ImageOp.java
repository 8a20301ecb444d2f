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

import pixelserve.lib.images.PixelBuffer;

/**
 * A single step of an {@link ImagePipeline}, applied to one frame at a time.
 * 
 * @author PixelServe developers
 * @see ImageOps
 */
public interface ImageOp {
	
	/**
	 * Apply the operation to a single frame.
	 * <p>
	 * The frame belongs to the caller's pipeline; it may be modified and returned, 
	 * or a new buffer returned. Callers must use the returned buffer.
	 * 
	 * @param frame
	 * @return the transformed frame
	 */
	PixelBuffer apply(PixelBuffer frame);
	
	/**
	 * Get a stable, canonical descriptor for this operation and its parameters.
	 * <p>
	 * This is used to fingerprint requests, and so two operations with the same 
	 * descriptor must produce identical output for the same input.
	 * @return
	 */
	String getDescriptor();

}
