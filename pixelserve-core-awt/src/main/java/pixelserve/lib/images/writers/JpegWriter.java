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

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Arrays;
import java.util.Collection;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;

import pixelserve.lib.awt.common.BufferedImageTools;
import pixelserve.lib.images.servers.OutputFormat;

/**
 * ImageWriter implementation to write JPEG images using ImageIO.
 * 
 * @author PixelServe developers
 */
public class JpegWriter extends AbstractImageIOWriter {

	@Override
	public String getName() {
		return "JPEG";
	}

	@Override
	public String getDetails() {
		return "Write image as JPEG using ImageIO (lossy compression). Transparency is lost, and only the first frame of an animation is written.";
	}
	
	@Override
	public OutputFormat getFormat() {
		return OutputFormat.JPEG;
	}
	
	@Override
	public void writeImage(BufferedImage img, int quality, OutputStream stream) throws IOException {
		if (quality < 1 || quality > 100)
			throw new IllegalArgumentException("JPEG quality must be between 1 and 100, but was " + quality);
		// If the image isn't opaque, make it so
		img = BufferedImageTools.ensureOpaque(img);
		
		var writers = ImageIO.getImageWritersByFormatName("jpeg");
		if (!writers.hasNext())
			throw new IOException("No JPEG writer found");
		var writer = writers.next();
		try (var ios = ImageIO.createImageOutputStream(stream)) {
			writer.setOutput(ios);
			var param = writer.getDefaultWriteParam();
			param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
			param.setCompressionQuality(quality / 100f);
			writer.write(null, new IIOImage(img, null, null), param);
			ios.flush();
		} finally {
			writer.dispose();
		}
	}

	@Override
	public Collection<String> getExtensions() {
		return Arrays.asList("jpg", "jpeg");
	}

}
