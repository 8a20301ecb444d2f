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

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import pixelserve.lib.images.PixelBuffer;
import pixelserve.lib.regions.ImageRegion;

/**
 * Operation that applies one or more filters in order, optionally restricted to a region.
 * 
 * @author PixelServe developers
 */
public class FilterOp implements ImageOp {
	
	private final ImageRegion region;
	private final List<ImageFilter> filters;
	
	/**
	 * Constructor.
	 * @param region the region to filter, or null to filter the full frame
	 * @param filters
	 */
	FilterOp(ImageRegion region, List<? extends ImageFilter> filters) {
		Objects.requireNonNull(filters, "Filters must not be null");
		this.region = region;
		this.filters = List.copyOf(filters);
	}
	
	/**
	 * Get the region to filter, or null if the full frame is filtered.
	 * @return
	 */
	public ImageRegion getRegion() {
		return region;
	}
	
	public List<ImageFilter> getFilters() {
		return filters;
	}

	@Override
	public PixelBuffer apply(PixelBuffer frame) {
		Objects.requireNonNull(frame, "Frame must not be null");
		var bounds = frame.getBounds();
		var target = region == null ? bounds : bounds.intersect(region);
		if (target.isEmpty())
			return frame;
		var output = frame;
		for (var filter : filters)
			output = filter.apply(output, target);
		return output;
	}

	@Override
	public String getDescriptor() {
		String names = filters.stream().map(ImageFilter::getDescriptor).collect(Collectors.joining(","));
		if (region == null)
			return "filter(" + names + ")";
		return String.format("filter(%s;region=%d,%d,%d,%d)", names,
				region.getX(), region.getY(), region.getWidth(), region.getHeight());
	}
	
	@Override
	public String toString() {
		return getDescriptor();
	}

}
