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
import java.util.Collection;
import java.util.Collections;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageTypeSpecifier;
import javax.imageio.metadata.IIOInvalidTreeException;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.metadata.IIOMetadataNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import pixelserve.lib.awt.common.BufferedImageTools;
import pixelserve.lib.images.ImageContent;
import pixelserve.lib.images.servers.OutputFormat;

/**
 * ImageWriter implementation to write GIF images using ImageIO, including animations.
 * <p>
 * Animations loop indefinitely. Colors are reduced to a palette of at most 256 entries.
 * 
 * @author PixelServe developers
 */
public class GifWriter extends AbstractImageIOWriter {
	
	private static final Logger logger = LoggerFactory.getLogger(GifWriter.class);

	@Override
	public String getName() {
		return "GIF";
	}

	@Override
	public String getDetails() {
		return "Write image as GIF using ImageIO (indexed color, lossy for images with more than 256 colors). Animations are supported.";
	}
	
	@Override
	public OutputFormat getFormat() {
		return OutputFormat.GIF;
	}

	@Override
	public Collection<String> getExtensions() {
		return Collections.singleton("gif");
	}
	
	@Override
	public void writeImage(ImageContent content, int quality, OutputStream stream) throws IOException {
		if (content.getKind() == ImageContent.Kind.ANIMATED && content.nFrames() > 1)
			writeSequence(content, content.getSequence().getFrameDelay(), stream);
		else
			super.writeImage(content, quality, stream);
	}
	
	private void writeSequence(ImageContent content, int frameDelay, OutputStream stream) throws IOException {
		var writers = ImageIO.getImageWritersByFormatName("gif");
		if (!writers.hasNext())
			throw new IOException("No GIF writer found");
		var writer = writers.next();
		logger.trace("Writing {} frames with delay {} ms", content.nFrames(), frameDelay);
		try (var ios = ImageIO.createImageOutputStream(stream)) {
			writer.setOutput(ios);
			writer.prepareWriteSequence(null);
			var param = writer.getDefaultWriteParam();
			boolean firstFrame = true;
			for (var frame : content.getFrames()) {
				BufferedImage img = BufferedImageTools.toBufferedImage(frame);
				var type = ImageTypeSpecifier.createFromRenderedImage(img);
				var metadata = writer.getDefaultImageMetadata(type, param);
				configureMetadata(metadata, frameDelay, firstFrame);
				writer.writeToSequence(new IIOImage(img, null, metadata), param);
				firstFrame = false;
			}
			writer.endWriteSequence();
			ios.flush();
		} finally {
			writer.dispose();
		}
	}
	
	private static void configureMetadata(IIOMetadata metadata, int frameDelay, boolean loop) throws IIOInvalidTreeException {
		String formatName = metadata.getNativeMetadataFormatName();
		var root = (IIOMetadataNode)metadata.getAsTree(formatName);
		
		var gce = getOrCreateNode(root, "GraphicControlExtension");
		gce.setAttribute("disposalMethod", "restoreToBackgroundColor");
		gce.setAttribute("userInputFlag", "FALSE");
		gce.setAttribute("transparentColorFlag", "FALSE");
		// GIF delays are in hundredths of a second
		gce.setAttribute("delayTime", Integer.toString(Math.round(frameDelay / 10f)));
		gce.setAttribute("transparentColorIndex", "0");
		
		if (loop) {
			var extensions = getOrCreateNode(root, "ApplicationExtensions");
			var app = new IIOMetadataNode("ApplicationExtension");
			app.setAttribute("applicationID", "NETSCAPE");
			app.setAttribute("authenticationCode", "2.0");
			// Loop count of 0 means loop forever
			app.setUserObject(new byte[] {0x1, 0, 0});
			extensions.appendChild(app);
		}
		metadata.setFromTree(formatName, root);
	}
	
	private static IIOMetadataNode getOrCreateNode(IIOMetadataNode root, String nodeName) {
		for (int i = 0; i < root.getLength(); i++) {
			if (root.item(i).getNodeName().equals(nodeName))
				return (IIOMetadataNode)root.item(i);
		}
		var node = new IIOMetadataNode(nodeName);
		root.appendChild(node);
		return node;
	}

}
