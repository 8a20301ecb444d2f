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

/**
 * Operation that applies a rotation and a flip in a single pass.
 * <p>
 * The rotation (clockwise) is applied first, then the flip is applied to the rotated image. 
 * For a quarter turn the output width and height are swapped.
 * 
 * @author PixelServe developers
 */
public class TransformOp implements ImageOp {
	
	private final Rotation rotation;
	private final Flip flip;
	
	TransformOp(Rotation rotation, Flip flip) {
		this.rotation = Objects.requireNonNull(rotation, "Rotation must not be null");
		this.flip = Objects.requireNonNull(flip, "Flip must not be null");
	}
	
	public Rotation getRotation() {
		return rotation;
	}
	
	public Flip getFlip() {
		return flip;
	}
	
	/**
	 * Returns true if this operation leaves every frame unchanged.
	 * @return
	 */
	public boolean isIdentity() {
		return rotation == Rotation.NONE && flip == Flip.NONE;
	}

	@Override
	public PixelBuffer apply(PixelBuffer frame) {
		Objects.requireNonNull(frame, "Frame must not be null");
		if (isIdentity())
			return frame;
		
		int width = frame.getWidth();
		int height = frame.getHeight();
		int outWidth = rotation.isQuarterTurn() ? height : width;
		int outHeight = rotation.isQuarterTurn() ? width : height;
		if (frame.isEmpty())
			return PixelBuffer.create(outWidth, outHeight);
		
		int[] src = frame.getARGB();
		int[] dest = new int[src.length];
		boolean flipX = flip.flipsX();
		boolean flipY = flip.flipsY();
		
		for (int oy = 0; oy < outHeight; oy++) {
			// Undo the flip in rotated coordinates
			int fy = flipY ? outHeight - 1 - oy : oy;
			for (int ox = 0; ox < outWidth; ox++) {
				int fx = flipX ? outWidth - 1 - ox : ox;
				int sx, sy;
				switch (rotation) {
				case ROTATE_90:
					sx = fy;
					sy = height - 1 - fx;
					break;
				case ROTATE_180:
					sx = width - 1 - fx;
					sy = height - 1 - fy;
					break;
				case ROTATE_270:
					sx = width - 1 - fy;
					sy = fx;
					break;
				case NONE:
				default:
					sx = fx;
					sy = fy;
					break;
				}
				dest[oy * outWidth + ox] = src[sy * width + sx];
			}
		}
		return PixelBuffer.createFromARGB(outWidth, outHeight, dest);
	}

	@Override
	public String getDescriptor() {
		return String.format("transform(rotate=%d,flip=%s)", rotation.getDegrees(), flip.name().toLowerCase());
	}
	
	@Override
	public String toString() {
		return getDescriptor();
	}

}
