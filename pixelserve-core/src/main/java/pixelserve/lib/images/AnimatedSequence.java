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

import java.util.List;

/**
 * An ordered sequence of frames that share a single delay between frames.
 * <p>
 * The sequence itself is immutable: the list of frames cannot be changed after creation.
 * 
 * @author PixelServe developers
 */
public class AnimatedSequence {
	
	private final int frameDelay;
	private final List<PixelBuffer> frames;
	
	private AnimatedSequence(int frameDelay, List<PixelBuffer> frames) {
		this.frameDelay = frameDelay;
		this.frames = frames;
	}
	
	/**
	 * Create a new sequence.
	 * @param frameDelay the delay between frames, in milliseconds (0 if unspecified)
	 * @param frames the frames, in display order
	 * @return
	 * @throws NullPointerException if frames is null or contains null
	 * @throws IllegalArgumentException if the frame delay is negative
	 */
	public static AnimatedSequence create(int frameDelay, List<PixelBuffer> frames) {
		if (frameDelay < 0)
			throw new IllegalArgumentException("Frame delay must be >= 0, but was " + frameDelay);
		return new AnimatedSequence(frameDelay, List.copyOf(frames));
	}
	
	/**
	 * Create a new sequence.
	 * @param frameDelay the delay between frames, in milliseconds (0 if unspecified)
	 * @param frames the frames, in display order
	 * @return
	 */
	public static AnimatedSequence create(int frameDelay, PixelBuffer... frames) {
		return create(frameDelay, List.of(frames));
	}
	
	/**
	 * Get the delay between frames, in milliseconds.
	 * @return
	 */
	public int getFrameDelay() {
		return frameDelay;
	}
	
	/**
	 * Get an unmodifiable list of all frames, in display order.
	 * @return
	 */
	public List<PixelBuffer> getFrames() {
		return frames;
	}
	
	/**
	 * Get a single frame.
	 * @param index
	 * @return
	 */
	public PixelBuffer getFrame(int index) {
		return frames.get(index);
	}
	
	/**
	 * Get the number of frames.
	 * @return
	 */
	public int nFrames() {
		return frames.size();
	}
	
	@Override
	public String toString() {
		return "AnimatedSequence (" + frames.size() + " frames, delay=" + frameDelay + " ms)";
	}

}
