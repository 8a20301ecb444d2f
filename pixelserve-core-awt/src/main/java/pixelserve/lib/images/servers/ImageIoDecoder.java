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

package pixelserve.lib.images.servers;

import java.awt.AlphaComposite;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.metadata.IIOMetadataNode;
import javax.imageio.stream.ImageInputStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.NodeList;

import pixelserve.lib.awt.common.BufferedImageTools;
import pixelserve.lib.images.AnimatedSequence;
import pixelserve.lib.images.ImageContent;
import pixelserve.lib.images.PixelBuffer;

/**
 * {@link ImageDecoder} using Java's ImageIO.
 * <p>
 * GIF images with more than one frame are decoded as an {@link AnimatedSequence}, with each frame 
 * composited onto the logical screen according to its disposal method. The delay of the first frame 
 * is used for the whole sequence.
 * 
 * @author PixelServe developers
 */
public class ImageIoDecoder implements ImageDecoder {
	
	private static final Logger logger = LoggerFactory.getLogger(ImageIoDecoder.class);

	@Override
	public ImageContent decode(byte[] bytes) throws IOException {
		Objects.requireNonNull(bytes, "Bytes must not be null");
		try (ImageInputStream stream = ImageIO.createImageInputStream(new ByteArrayInputStream(bytes))) {
			if (stream == null)
				throw new UnsupportedImageFormatException("Unable to create an image input stream");
			var readers = ImageIO.getImageReaders(stream);
			if (!readers.hasNext())
				throw new UnsupportedImageFormatException("No image reader found for " + bytes.length + " bytes");
			var reader = readers.next();
			try {
				reader.setInput(stream, false, false);
				String format = reader.getFormatName();
				logger.trace("Decoding {} bytes with {} reader", bytes.length, format);
				if ("gif".equalsIgnoreCase(format))
					return readGif(reader);
				return ImageContent.single(BufferedImageTools.toPixelBuffer(reader.read(0)));
			} catch (ImageDecodeException e) {
				throw e;
			} catch (IOException | RuntimeException e) {
				throw new ImageDecodeException("Unable to decode image: " + e.getLocalizedMessage(), e);
			} finally {
				reader.dispose();
			}
		}
	}
	
	private static ImageContent readGif(ImageReader reader) throws IOException {
		int nImages = reader.getNumImages(true);
		if (nImages <= 0)
			throw new ImageDecodeException("GIF contains no frames");
		
		BufferedImage first = reader.read(0);
		if (nImages == 1)
			return ImageContent.single(BufferedImageTools.toPixelBuffer(first));
		
		int[] screenSize = readLogicalScreenSize(reader);
		int width = screenSize[0] > 0 ? screenSize[0] : first.getWidth();
		int height = screenSize[1] > 0 ? screenSize[1] : first.getHeight();
		
		var canvas = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
		Graphics2D g2d = canvas.createGraphics();
		List<PixelBuffer> frames = new ArrayList<>();
		int delay = -1;
		try {
			for (int i = 0; i < nImages; i++) {
				BufferedImage img = i == 0 ? first : reader.read(i);
				var frameMetadata = readFrameMetadata(reader.getImageMetadata(i));
				if (delay < 0)
					delay = frameMetadata.delay;
				else if (frameMetadata.delay != delay)
					logger.debug("GIF frame {} has delay {} ms, using {} ms for all frames", i, frameMetadata.delay, delay);
				
				BufferedImage previous = "restoreToPrevious".equals(frameMetadata.disposal) ? BufferedImageTools.duplicate(canvas) : null;
				g2d.drawImage(img, frameMetadata.x, frameMetadata.y, null);
				frames.add(BufferedImageTools.toPixelBuffer(canvas));
				
				if ("restoreToBackgroundColor".equals(frameMetadata.disposal)) {
					g2d.setComposite(AlphaComposite.Clear);
					g2d.fillRect(frameMetadata.x, frameMetadata.y, img.getWidth(), img.getHeight());
					g2d.setComposite(AlphaComposite.SrcOver);
				} else if (previous != null) {
					g2d.setComposite(AlphaComposite.Src);
					g2d.drawImage(previous, 0, 0, null);
					g2d.setComposite(AlphaComposite.SrcOver);
				}
			}
		} finally {
			g2d.dispose();
		}
		return ImageContent.animated(AnimatedSequence.create(Math.max(0, delay), frames));
	}
	
	private static int[] readLogicalScreenSize(ImageReader reader) throws IOException {
		IIOMetadata metadata = reader.getStreamMetadata();
		if (metadata == null)
			return new int[] {0, 0};
		var root = (IIOMetadataNode)metadata.getAsTree(metadata.getNativeMetadataFormatName());
		NodeList nodes = root.getElementsByTagName("LogicalScreenDescriptor");
		if (nodes.getLength() == 0)
			return new int[] {0, 0};
		var node = (IIOMetadataNode)nodes.item(0);
		return new int[] {
				parseInt(node.getAttribute("logicalScreenWidth"), 0),
				parseInt(node.getAttribute("logicalScreenHeight"), 0)
		};
	}
	
	private static GifFrameMetadata readFrameMetadata(IIOMetadata metadata) {
		var frame = new GifFrameMetadata();
		if (metadata == null)
			return frame;
		var root = (IIOMetadataNode)metadata.getAsTree(metadata.getNativeMetadataFormatName());
		NodeList nodes = root.getElementsByTagName("GraphicControlExtension");
		if (nodes.getLength() > 0) {
			var gce = (IIOMetadataNode)nodes.item(0);
			// GIF delays are in hundredths of a second
			frame.delay = parseInt(gce.getAttribute("delayTime"), 0) * 10;
			frame.disposal = gce.getAttribute("disposalMethod");
		}
		nodes = root.getElementsByTagName("ImageDescriptor");
		if (nodes.getLength() > 0) {
			var descriptor = (IIOMetadataNode)nodes.item(0);
			frame.x = parseInt(descriptor.getAttribute("imageLeftPosition"), 0);
			frame.y = parseInt(descriptor.getAttribute("imageTopPosition"), 0);
		}
		return frame;
	}
	
	private static int parseInt(String s, int defaultValue) {
		if (s == null || s.isBlank())
			return defaultValue;
		try {
			return Integer.parseInt(s.strip());
		} catch (NumberFormatException e) {
			logger.debug("Unable to parse GIF metadata value '{}'", s);
			return defaultValue;
		}
	}
	
	private static class GifFrameMetadata {
		
		private int delay = 0;
		private String disposal = "none";
		private int x = 0;
		private int y = 0;
		
	}
	
	@Override
	public String toString() {
		return "ImageIoDecoder";
	}

}
