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

/**
 * Enum for rotations in increments of 90 degrees.
 */
public enum Rotation {
	
	/**
	 * No rotation.
	 */
	NONE(0),
	
	/**
	 * Rotate 90 degrees clockwise.
	 */
	ROTATE_90(90),
	
	/**
	 * Rotate 180 degrees.
	 */
	ROTATE_180(180),
	
	/**
	 * Rotate 270 degrees clockwise.
	 */
	ROTATE_270(270);
	
	private final int degrees;
	
	Rotation(int degrees) {
		this.degrees = degrees;
	}
	
	/**
	 * Get the clockwise rotation in degrees.
	 * @return
	 */
	public int getDegrees() {
		return degrees;
	}
	
	/**
	 * Returns true if the rotation swaps the width and height.
	 * @return
	 */
	public boolean isQuarterTurn() {
		return this == ROTATE_90 || this == ROTATE_270;
	}
	
	/**
	 * Get the rotation for a number of degrees.
	 * @param degrees clockwise rotation; must be a multiple of 90 (negative values are permitted)
	 * @return
	 * @throws IllegalArgumentException if the degrees are not a multiple of 90
	 */
	public static Rotation fromDegrees(int degrees) {
		if (degrees % 90 != 0)
			throw new IllegalArgumentException("Rotation must be a multiple of 90 degrees, but was " + degrees);
		int d = ((degrees % 360) + 360) % 360;
		switch (d) {
		case 90:
			return ROTATE_90;
		case 180:
			return ROTATE_180;
		case 270:
			return ROTATE_270;
		case 0:
		default:
			return NONE;
		}
	}
	
	@Override
	public String toString() {
		switch(this) {
		case ROTATE_180:
			return "Rotate 180";
		case ROTATE_270:
			return "Rotate 270";
		case ROTATE_90:
			return "Rotate 90";
		case NONE:
		default:
			return "No rotation";
		}
	}

}
