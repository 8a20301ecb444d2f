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

import java.util.Objects;

import pixelserve.lib.images.PixelBuffer;
import pixelserve.lib.regions.ImageRegion;

/**
 * Operation to crop a frame to a rectangular region.
 * <p>
 * The region is clipped to the frame bounds, so a region extending beyond the frame 
 * gives a smaller output, and a region entirely outside gives an empty output.
 * 
 * @author PixelServe developers
 */
public class CropOp implements ImageOp {
	
	private final ImageRegion region;
	
	CropOp(ImageRegion region) {
		this.region = Objects.requireNonNull(region, "Crop region must not be null");
	}
	
	public ImageRegion getRegion() {
		return region;
	}

	@Override
	public PixelBuffer apply(PixelBuffer frame) {
		Objects.requireNonNull(frame, "Frame must not be null");
		var bounds = frame.getBounds();
		var clipped = bounds.intersect(region);
		if (clipped.equals(bounds))
			return frame;
		if (clipped.isEmpty())
			return PixelBuffer.create(clipped.getWidth(), clipped.getHeight());
		
		int width = frame.getWidth();
		int[] src = frame.getARGB();
		int[] dest = new int[clipped.getWidth() * clipped.getHeight()];
		for (int y = 0; y < clipped.getHeight(); y++) {
			System.arraycopy(src, (clipped.getY() + y) * width + clipped.getX(), 
					dest, y * clipped.getWidth(), clipped.getWidth());
		}
		return PixelBuffer.createFromARGB(clipped.getWidth(), clipped.getHeight(), dest);
	}

	@Override
	public String getDescriptor() {
		return String.format("crop(%d,%d,%d,%d)", region.getX(), region.getY(), region.getWidth(), region.getHeight());
	}
	
	@Override
	public String toString() {
		return getDescriptor();
	}

}
