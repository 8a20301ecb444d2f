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
import pixelserve.lib.regions.ImageRegion;

/**
 * Interface for a transformation applied to the pixels of an image within a region.
 * <p>
 * A filter may return a new buffer or modify and return the input; callers should always 
 * use the returned buffer.
 * 
 * @author PixelServe developers
 */
public interface ImageFilter {
	
	/**
	 * Apply the filter.
	 * 
	 * @param image the input image
	 * @param region the region to filter; pixels outside this region should be unchanged
	 * @return the filtered image
	 */
	PixelBuffer apply(PixelBuffer image, ImageRegion region);
	
	/**
	 * Get a stable descriptor for this filter, including its parameters.
	 * Two filters with the same descriptor must produce identical output.
	 * @return
	 */
	String getDescriptor();

}
