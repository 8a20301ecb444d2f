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

package pixelserve.lib.images.writers;

import java.util.Collection;
import java.util.Collections;

import pixelserve.lib.images.servers.OutputFormat;

/**
 * ImageWriter implementation to write PNG images using ImageIO.
 * 
 * @author PixelServe developers
 */
public class PngWriter extends AbstractImageIOWriter {

	@Override
	public String getName() {
		return "PNG";
	}

	@Override
	public String getDetails() {
		return "Write image as PNG using ImageIO (lossless compression, with transparency). Only the first frame of an animation is written.";
	}
	
	@Override
	public OutputFormat getFormat() {
		return OutputFormat.PNG;
	}

	@Override
	public Collection<String> getExtensions() {
		return Collections.singleton("png");
	}

}
