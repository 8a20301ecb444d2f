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

package pixelserve.lib.requests;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import pixelserve.lib.images.ops.ImageOp;
import pixelserve.lib.images.ops.ImagePipeline;
import pixelserve.lib.images.servers.OutputFormat;

/**
 * Request for a source image to be transformed by an ordered list of operations and encoded.
 * <p>
 * Requests are immutable.
 * 
 * @author PixelServe developers
 */
public class ImageRequest {
	
	/**
	 * Default JPEG quality.
	 */
	public static final int DEFAULT_QUALITY = 80;
	
	private final String source;
	private final ImagePipeline pipeline;
	private final OutputFormat format;
	private final int quality;
	
	private transient Fingerprint fingerprint;
	
	private ImageRequest(String source, ImagePipeline pipeline, OutputFormat format, int quality) {
		this.source = source;
		this.pipeline = pipeline;
		this.format = format;
		this.quality = quality;
	}
	
	/**
	 * Create a request.
	 * @param source the source identity
	 * @param ops operations to apply, in order
	 * @param format the output format
	 * @param quality the output quality, between 1 and 100 (used for JPEG only)
	 * @return
	 */
	public static ImageRequest createInstance(String source, List<? extends ImageOp> ops, OutputFormat format, int quality) {
		Objects.requireNonNull(source, "Source must not be null");
		Objects.requireNonNull(format, "Output format must not be null");
		if (quality < 1 || quality > 100)
			throw new IllegalArgumentException("Quality must be between 1 and 100, but was " + quality);
		return new ImageRequest(source, ImagePipeline.create(ops), format, quality);
	}
	
	/**
	 * Create a request with the default quality.
	 * @param source
	 * @param ops
	 * @param format
	 * @return
	 */
	public static ImageRequest createInstance(String source, List<? extends ImageOp> ops, OutputFormat format) {
		return createInstance(source, ops, format, DEFAULT_QUALITY);
	}
	
	/**
	 * Create a request to re-encode a source without any operations.
	 * @param source
	 * @param format
	 * @return
	 */
	public static ImageRequest createInstance(String source, OutputFormat format) {
		return createInstance(source, List.of(), format);
	}
	
	public String getSource() {
		return source;
	}
	
	public ImagePipeline getPipeline() {
		return pipeline;
	}
	
	public List<ImageOp> getOps() {
		return pipeline.getOps();
	}
	
	public OutputFormat getFormat() {
		return format;
	}
	
	public int getQuality() {
		return quality;
	}
	
	/**
	 * Get the output token used in the fingerprint. Quality is only included where it affects the output.
	 * @return
	 */
	String getOutputToken() {
		if (format == OutputFormat.JPEG)
			return "format=" + format.name().toLowerCase() + ",quality=" + quality;
		return "format=" + format.name().toLowerCase();
	}
	
	/**
	 * Get the fingerprint identifying this request.
	 * @return
	 */
	public Fingerprint getFingerprint() {
		if (fingerprint == null) {
			var tokens = new ArrayList<String>();
			for (var op : pipeline.getOps())
				tokens.add(op.getDescriptor());
			tokens.add(getOutputToken());
			fingerprint = Fingerprint.of(source, tokens);
		}
		return fingerprint;
	}
	
	@Override
	public String toString() {
		return "ImageRequest[" + getFingerprint().getCanonicalKey() + "]";
	}

}
