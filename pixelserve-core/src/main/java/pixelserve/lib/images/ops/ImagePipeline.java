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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import pixelserve.lib.images.AnimatedSequence;
import pixelserve.lib.images.ImageContent;
import pixelserve.lib.images.PixelBuffer;
import pixelserve.lib.regions.ImageRegion;

/**
 * An ordered sequence of {@link ImageOp}s.
 * <p>
 * A pipeline can be applied to a single {@link PixelBuffer} or to {@link ImageContent}. 
 * For animated content, the same operations are applied to every frame independently; 
 * the output keeps the frame order, frame count and frame delay of the input.
 * <p>
 * Inputs are never modified.
 * 
 * @author PixelServe developers
 */
public class ImagePipeline {
	
	private static final Logger logger = LoggerFactory.getLogger(ImagePipeline.class);
	
	private final List<ImageOp> ops;
	
	private ImagePipeline(List<? extends ImageOp> ops) {
		this.ops = List.copyOf(ops);
	}
	
	/**
	 * Create a pipeline from a list of operations, applied in order.
	 * @param ops
	 * @return
	 */
	public static ImagePipeline create(List<? extends ImageOp> ops) {
		Objects.requireNonNull(ops, "Operations must not be null");
		return new ImagePipeline(ops);
	}
	
	/**
	 * Create a pipeline from operations, applied in order.
	 * @param ops
	 * @return
	 */
	public static ImagePipeline create(ImageOp... ops) {
		return create(Arrays.asList(ops));
	}
	
	/**
	 * Get an unmodifiable list of the operations in this pipeline.
	 * @return
	 */
	public List<ImageOp> getOps() {
		return ops;
	}
	
	/**
	 * Get a pipeline with an additional operation at the end.
	 * @param op
	 * @return
	 */
	public ImagePipeline append(ImageOp op) {
		Objects.requireNonNull(op, "Operation must not be null");
		var list = new ArrayList<ImageOp>(ops);
		list.add(op);
		return new ImagePipeline(list);
	}
	
	/**
	 * Get a canonical descriptor for all operations, in order.
	 * @return
	 */
	public String getDescriptor() {
		return ops.stream().map(ImageOp::getDescriptor).collect(Collectors.joining("|"));
	}
	
	/**
	 * Apply all operations to a single buffer.
	 * @param buffer the input; this is not modified
	 * @return a new buffer containing the result
	 */
	public PixelBuffer apply(PixelBuffer buffer) {
		Objects.requireNonNull(buffer, "Buffer must not be null");
		var output = PixelBuffer.copyOf(buffer);
		for (var op : ops)
			output = op.apply(output);
		// An identity op may return its input, so ensure we never hand back the caller's buffer
		return output == buffer ? PixelBuffer.copyOf(buffer) : output;
	}
	
	/**
	 * Apply all operations to image content, frame by frame.
	 * @param content
	 * @return content of the same kind as the input
	 */
	public ImageContent apply(ImageContent content) {
		Objects.requireNonNull(content, "Content must not be null");
		switch (content.getKind()) {
		case SINGLE:
			return ImageContent.single(apply(content.getBuffer()));
		case ANIMATED:
		default:
			var sequence = content.getSequence();
			var frames = new ArrayList<PixelBuffer>(sequence.nFrames());
			for (var frame : sequence.getFrames())
				frames.add(apply(frame));
			return ImageContent.animated(AnimatedSequence.create(sequence.getFrameDelay(), frames));
		}
	}
	
	/**
	 * Apply all operations to image content, processing animation frames in parallel.
	 * @param content
	 * @param pool executor used for animation frames; if null, frames are processed on the calling thread
	 * @return content of the same kind as the input
	 * @throws InterruptedException if interrupted while waiting for frames
	 */
	public ImageContent apply(ImageContent content, ExecutorService pool) throws InterruptedException {
		Objects.requireNonNull(content, "Content must not be null");
		if (pool == null || content.getKind() == ImageContent.Kind.SINGLE || content.nFrames() < 2)
			return apply(content);
		
		var sequence = content.getSequence();
		logger.trace("Applying {} to {} frames in parallel", this, sequence.nFrames());
		List<Future<PixelBuffer>> futures = new ArrayList<>();
		for (var frame : sequence.getFrames())
			futures.add(pool.submit(() -> apply(frame)));
		
		List<PixelBuffer> frames = new ArrayList<>();
		try {
			for (var future : futures)
				frames.add(future.get());
		} catch (ExecutionException e) {
			futures.forEach(f -> f.cancel(true));
			var cause = e.getCause();
			if (cause instanceof RuntimeException)
				throw (RuntimeException)cause;
			if (cause instanceof Error)
				throw (Error)cause;
			throw new IllegalStateException(cause);
		} catch (InterruptedException e) {
			futures.forEach(f -> f.cancel(true));
			throw e;
		}
		return ImageContent.animated(AnimatedSequence.create(sequence.getFrameDelay(), frames));
	}
	
	/**
	 * Apply one or more filters to a buffer, optionally within a region.
	 * @param buffer the input buffer; this is not modified
	 * @param region the region to filter, or null to filter the full buffer
	 * @param filters
	 * @return a new buffer containing the result
	 */
	public static PixelBuffer filter(PixelBuffer buffer, ImageRegion region, ImageFilter... filters) {
		return create(ImageOps.filter(region, filters)).apply(buffer);
	}
	
	@Override
	public String toString() {
		return "ImagePipeline[" + getDescriptor() + "]";
	}

}
