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

package pixelserve.lib.images.filters;

import pixelserve.lib.common.ColorTools;

/**
 * Filter that adds a constant to the red, green and blue channels.
 */
public class Brightness extends AbstractPixelFilter {
	
	private final int amount;
	
	/**
	 * Constructor.
	 * @param amount value to add to each color channel, between -255 and 255
	 */
	public Brightness(int amount) {
		if (amount < -255 || amount > 255)
			throw new IllegalArgumentException("Brightness must be between -255 and 255, but was " + amount);
		this.amount = amount;
	}
	
	public int getAmount() {
		return amount;
	}

	@Override
	protected int filterPixel(int argb, int x, int y, int width, int height) {
		return ColorTools.packClippedARGB(
				ColorTools.alpha(argb),
				ColorTools.red(argb) + amount,
				ColorTools.green(argb) + amount,
				ColorTools.blue(argb) + amount);
	}

	@Override
	public String getDescriptor() {
		return "brightness(" + amount + ")";
	}

}
