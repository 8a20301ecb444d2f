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

package pixelserve.lib.regions;

/**
 * Class for defining a rectangular image region.
 * <p>
 * The bounding box is given in pixel coordinates; the width and height are never negative.
 * 
 * @author PixelServe developers
 *
 */
public class ImageRegion {
	
	private final int x;
	private final int y;
	private final int width;
	private final int height;
	
	
	@Override
	public String toString() {
		return "Region: x=" + x + ", y=" + y + ", w=" + width + ", h=" + height;
	}
	
	ImageRegion(final int x, final int y, final int width, final int height) {
		this.x = x;
		this.y = y;
		this.width = width;
		this.height = height;
	}
	
	/**
	 * Create a region based on its bounding box coordinates.
	 * @param x
	 * @param y
	 * @param width
	 * @param height
	 * @return
	 * @throws IllegalArgumentException if the width or height is negative
	 */
	public static ImageRegion createInstance(final int x, final int y, final int width, final int height) {
		if (width < 0)
			throw new IllegalArgumentException("Width must be >= 0! Requested width = " + width);
		if (height < 0)
			throw new IllegalArgumentException("Height must be >= 0! Requested height = " + height);
		return new ImageRegion(x, y, width, height);
	}
	
	/**
	 * Query if this region intersects with another region.
	 * @param region
	 * @return
	 */
	public boolean intersects(final ImageRegion region) {
		return intersects(region.x, region.y, region.width, region.height);
	}
	
	/**
	 * Query if this region intersects with a specified bounding box.
	 * 
	 * @param x
	 * @param y
	 * @param width
	 * @param height
	 * @return
	 */
	public boolean intersects(final double x, final double y, final double width, final double height) {
		if (this.width <= 0 || this.height <= 0 || width <= 0 || height <= 0)
			return false;
		return (x + width > this.x &&
				y + height > this.y &&
				x < this.x + this.width &&
				y < this.y + this.height);
	}
	
	/**
	 * Intersect with another region.
	 * @param region
	 * @return the intersection, which may be this if no clipping is required; the width and height 
	 *         are zero if the regions do not overlap
	 */
	public ImageRegion intersect(final ImageRegion region) {
		if (x >= region.x && y >= region.y && getMaxX() <= region.getMaxX() && getMaxY() <= region.getMaxY())
			return this;
		int x1 = Math.max(x, region.x);
		int y1 = Math.max(y, region.y);
		int x2 = Math.min(getMaxX(), region.getMaxX());
		int y2 = Math.min(getMaxY(), region.getMaxY());
		return new ImageRegion(x1, y1, Math.max(x2-x1, 0), Math.max(y2-y1, 0));
	}
	
	/**
	 * Returns true if a specified pixel falls within this region.
	 * @param x
	 * @param y
	 * @return
	 */
	public boolean contains(final int x, final int y) {
		return x >= this.x && x < this.x + width && y >= this.y && y < this.y + height;
	}

	/**
	 * Returns true if the region has zero width or height.
	 * @return
	 */
	public boolean isEmpty() {
		return width == 0 || height == 0;
	}
	
	/**
	 * Get the x coordinate of the region bounding box (top left).
	 * @return
	 */
	public int getX() {
		return x;
	}

	/**
	 * Get the y coordinate of the region bounding box (top left).
	 * @return
	 */
	public int getY() {
		return y;
	}

	/**
	 * Get the width of the region bounding box.
	 * @return
	 */
	public int getWidth() {
		return width;
	}

	/**
	 * Get the height of the region bounding box.
	 * @return
	 */
	public int getHeight() {
		return height;
	}
	
	/**
	 * Get the x coordinate of the bottom right of the region bounding box (exclusive).
	 * @return
	 */
	public int getMaxX() {
		return x + width;
	}

	/**
	 * Get the y coordinate of the bottom right of the region bounding box (exclusive).
	 * @return
	 */
	public int getMaxY() {
		return y + height;
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + height;
		result = prime * result + width;
		result = prime * result + x;
		result = prime * result + y;
		return result;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		ImageRegion other = (ImageRegion) obj;
		return height == other.height && width == other.width && x == other.x && y == other.y;
	}

}
