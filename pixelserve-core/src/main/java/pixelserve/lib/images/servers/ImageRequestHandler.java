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

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.Objects;
import java.util.concurrent.ExecutorService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import pixelserve.lib.images.ImageContent;
import pixelserve.lib.images.stores.Artifact;
import pixelserve.lib.images.stores.ArtifactCache;
import pixelserve.lib.requests.ImageRequest;

/**
 * Handles {@link ImageRequest}s by loading, decoding, transforming and encoding images, 
 * using an {@link ArtifactCache} so that identical requests are only computed once.
 * 
 * @author PixelServe developers
 */
public class ImageRequestHandler {
	
	private static final Logger logger = LoggerFactory.getLogger(ImageRequestHandler.class);
	
	private final ImageLoader loader;
	private final ImageDecoder decoder;
	private final ImageEncoder encoder;
	private final ArtifactCache cache;
	private final ExecutorService framePool;
	
	/**
	 * Constructor.
	 * @param loader source of encoded images
	 * @param decoder decoder for loaded images
	 * @param encoder encoder for transformed images
	 * @param cache cache for encoded results
	 * @param framePool optional executor used to process animation frames in parallel; may be null
	 */
	public ImageRequestHandler(ImageLoader loader, ImageDecoder decoder, ImageEncoder encoder, ArtifactCache cache, ExecutorService framePool) {
		this.loader = Objects.requireNonNull(loader, "Loader must not be null");
		this.decoder = Objects.requireNonNull(decoder, "Decoder must not be null");
		this.encoder = Objects.requireNonNull(encoder, "Encoder must not be null");
		this.cache = Objects.requireNonNull(cache, "Cache must not be null");
		this.framePool = framePool;
	}
	
	/**
	 * Constructor that processes animation frames sequentially.
	 * @param loader
	 * @param decoder
	 * @param encoder
	 * @param cache
	 */
	public ImageRequestHandler(ImageLoader loader, ImageDecoder decoder, ImageEncoder encoder, ArtifactCache cache) {
		this(loader, decoder, encoder, cache, null);
	}
	
	public ArtifactCache getCache() {
		return cache;
	}
	
	/**
	 * Get the encoded result for a request, from the cache if possible.
	 * @param request
	 * @return
	 * @throws java.nio.file.NoSuchFileException if the source does not exist
	 * @throws UnsupportedImageFormatException if the source cannot be decoded or the output format cannot be written
	 * @throws ImageComputationException if the transformation failed
	 * @throws IOException
	 */
	public Artifact handle(ImageRequest request) throws IOException {
		Objects.requireNonNull(request, "Request must not be null");
		var fingerprint = request.getFingerprint();
		logger.trace("Handling {}", request);
		return cache.getOrCompute(fingerprint, () -> compute(request));
	}
	
	/**
	 * Compute the result for a request, without using the cache.
	 * @param request
	 * @return
	 * @throws IOException
	 */
	Artifact compute(ImageRequest request) throws IOException {
		long startTime = System.currentTimeMillis();
		byte[] bytes = loader.load(request.getSource());
		ImageContent content = decoder.decode(bytes);
		ImageContent output;
		try {
			output = request.getPipeline().apply(content, framePool);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			var e2 = new InterruptedIOException("Interrupted while processing " + request);
			e2.initCause(e);
			throw e2;
		}
		byte[] encoded = encoder.encode(output, request.getFormat(), request.getQuality());
		long endTime = System.currentTimeMillis();
		logger.debug("Computed {} ({} bytes) in {} ms", request, encoded.length, endTime - startTime);
		return Artifact.create(encoded, request.getFormat().getContentType());
	}
	
	@Override
	public String toString() {
		return "ImageRequestHandler[" + loader + ", " + cache + "]";
	}

}
