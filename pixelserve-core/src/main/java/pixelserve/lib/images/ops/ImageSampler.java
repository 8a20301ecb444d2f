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
 * Interface for resampling an image to new dimensions.
 * <p>
 * Implementations must be deterministic and must not modify the source buffer.
 * 
 * @author PixelServe developers
 */
public interface ImageSampler {
	
	/**
	 * Create a new buffer containing the source image resampled to the specified size.
	 * 
	 * @param source the source image; this is not modified
	 * @param width target width
	 * @param height target height
	 * @return a new buffer with the requested dimensions
	 */
	PixelBuffer sample(PixelBuffer source, int width, int height);
	
	/**
	 * Get a short, stable name for this sampler, used to identify requests.
	 * @return
	 */
	String getName();

}
