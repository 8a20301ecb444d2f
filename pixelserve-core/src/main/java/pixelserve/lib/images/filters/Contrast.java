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
 * Filter that scales the distance of each color channel from mid-gray.
 * <p>
 * The scale factor is {@code ((100 + amount) / 100)^2}, so 0 leaves the image unchanged 
 * and -100 gives uniform gray.
 */
public class Contrast extends AbstractPixelFilter {
	
	private final int amount;
	private final double factor;
	
	/**
	 * Constructor.
	 * @param amount contrast change, between -100 and 100
	 */
	public Contrast(int amount) {
		if (amount < -100 || amount > 100)
			throw new IllegalArgumentException("Contrast must be between -100 and 100, but was " + amount);
		this.amount = amount;
		double f = (100.0 + amount) / 100.0;
		this.factor = f * f;
	}
	
	public int getAmount() {
		return amount;
	}
	
	private int adjust(int v) {
		return ColorTools.do8BitRangeCheck(((v / 255.0 - 0.5) * factor + 0.5) * 255.0);
	}

	@Override
	protected int filterPixel(int argb, int x, int y, int width, int height) {
		return ColorTools.packARGB(
				ColorTools.alpha(argb),
				adjust(ColorTools.red(argb)),
				adjust(ColorTools.green(argb)),
				adjust(ColorTools.blue(argb)));
	}

	@Override
	public String getDescriptor() {
		return "contrast(" + amount + ")";
	}

}
