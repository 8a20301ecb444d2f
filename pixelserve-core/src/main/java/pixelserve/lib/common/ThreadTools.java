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

package pixelserve.lib.common;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

/**
 * Static methods to create the named worker threads used for requests and animation frames.
 * <p>
 * Named threads make it easier to see which work a thread is doing in a thread dump.
 * 
 * @author PixelServe developers
 */
public class ThreadTools {
	
	// Suppress default constructor for non-instantiability
	private ThreadTools() {
		throw new AssertionError();
	}
	
	/**
	 * Create a thread factory where each thread name is the prefix followed by a counter, starting at 0.
	 * 
	 * @param prefix
	 * @param daemon
	 * @return
	 */
	public static ThreadFactory createThreadFactory(String prefix, boolean daemon) {
		// The name is used as a format string
		String nameFormat = prefix.replace("%", "%%") + "%d";
		return new ThreadFactoryBuilder()
				.setNameFormat(nameFormat)
				.setDaemon(daemon)
				.build();
	}
	
	/**
	 * Create a fixed-size pool of daemon threads.
	 * 
	 * @param prefix thread name prefix
	 * @param nThreads number of threads; must be at least 1
	 * @return
	 */
	public static ExecutorService createFixedPool(String prefix, int nThreads) {
		if (nThreads < 1)
			throw new IllegalArgumentException("Number of threads must be >= 1, but was " + nThreads);
		return Executors.newFixedThreadPool(nThreads, createThreadFactory(prefix, true));
	}
	
	/**
	 * Create the pool used to process animation frames in parallel.
	 * 
	 * @param nThreads the number of threads
	 * @return a new pool, or null if nThreads &lt;= 0 so that frames are processed on the calling thread
	 */
	public static ExecutorService createFramePool(int nThreads) {
		if (nThreads <= 0)
			return null;
		return createFixedPool("pixelserve-frames-", nThreads);
	}
	
}
