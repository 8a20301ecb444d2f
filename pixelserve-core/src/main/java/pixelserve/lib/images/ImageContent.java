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

package pixelserve.lib.images;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The decoded content of an image, which is either a single {@link PixelBuffer} or an 
 * {@link AnimatedSequence}.
 * <p>
 * Code that needs to treat the two cases differently should switch on {@link #getKind()}.
 * 
 * @author PixelServe developers
 */
public final class ImageContent {
	
	/**
	 * The kind of content.
	 */
	public static enum Kind {
		/**
		 * A single image frame.
		 */
		SINGLE,
		/**
		 * An animated sequence of frames.
		 */
		ANIMATED
	}
	
	private final Kind kind;
	private final PixelBuffer buffer;
	private final AnimatedSequence sequence;
	
	private ImageContent(Kind kind, PixelBuffer buffer, AnimatedSequence sequence) {
		this.kind = kind;
		this.buffer = buffer;
		this.sequence = sequence;
	}
	
	/**
	 * Create content wrapping a single buffer.
	 * @param buffer
	 * @return
	 */
	public static ImageContent single(PixelBuffer buffer) {
		return new ImageContent(Kind.SINGLE, Objects.requireNonNull(buffer, "Buffer must not be null"), null);
	}
	
	/**
	 * Create content wrapping an animated sequence.
	 * @param sequence
	 * @return
	 */
	public static ImageContent animated(AnimatedSequence sequence) {
		return new ImageContent(Kind.ANIMATED, null, Objects.requireNonNull(sequence, "Sequence must not be null"));
	}
	
	/**
	 * Get the kind of content.
	 * @return
	 */
	public Kind getKind() {
		return kind;
	}
	
	/**
	 * Get the buffer for single-frame content.
	 * @return
	 * @throws IllegalStateException if the content is animated
	 */
	public PixelBuffer getBuffer() {
		if (kind != Kind.SINGLE)
			throw new IllegalStateException("Content is animated, not a single buffer");
		return buffer;
	}
	
	/**
	 * Get the sequence for animated content.
	 * @return
	 * @throws IllegalStateException if the content is a single buffer
	 */
	public AnimatedSequence getSequence() {
		if (kind != Kind.ANIMATED)
			throw new IllegalStateException("Content is a single buffer, not animated");
		return sequence;
	}
	
	/**
	 * Get all frames. For single content this is a list containing only the buffer.
	 * @return
	 */
	public List<PixelBuffer> getFrames() {
		switch (kind) {
		case ANIMATED:
			return sequence.getFrames();
		case SINGLE:
		default:
			return Collections.singletonList(buffer);
		}
	}
	
	/**
	 * Get the first frame, or null if there are no frames.
	 * @return
	 */
	public PixelBuffer getFirstFrame() {
		var frames = getFrames();
		return frames.isEmpty() ? null : frames.get(0);
	}
	
	/**
	 * Get the width of the first frame, or 0 if there are no frames.
	 * @return
	 */
	public int getWidth() {
		var first = getFirstFrame();
		return first == null ? 0 : first.getWidth();
	}
	
	/**
	 * Get the height of the first frame, or 0 if there are no frames.
	 * @return
	 */
	public int getHeight() {
		var first = getFirstFrame();
		return first == null ? 0 : first.getHeight();
	}
	
	/**
	 * Get the number of frames.
	 * @return
	 */
	public int nFrames() {
		return kind == Kind.ANIMATED ? sequence.nFrames() : 1;
	}
	
	@Override
	public String toString() {
		return kind == Kind.ANIMATED ? sequence.toString() : buffer.toString();
	}

}
