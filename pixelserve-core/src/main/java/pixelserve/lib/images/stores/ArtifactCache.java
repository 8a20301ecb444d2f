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

package pixelserve.lib.images.stores;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;

import pixelserve.lib.common.LogTools;
import pixelserve.lib.images.servers.ImageComputationException;
import pixelserve.lib.requests.Fingerprint;

/**
 * Cache of encoded artifacts, keyed by {@link Fingerprint}, that computes each missing artifact at most 
 * once at a time.
 * <p>
 * When several threads request the same fingerprint concurrently, the first becomes responsible for the 
 * computation and the others wait for its result. A failed computation is reported to every waiting 
 * thread but is not cached, so a later request will try again. Requests for different fingerprints 
 * never wait for one another.
 * <p>
 * Artifacts are retained up to a maximum total number of bytes, with the least recently used evicted first.
 * 
 * @author PixelServe developers
 */
public class ArtifactCache {
	
	private static final Logger logger = LoggerFactory.getLogger(ArtifactCache.class);
	
	/**
	 * Default maximum number of bytes to retain.
	 */
	public static final long DEFAULT_MAX_BYTES = 64L * 1024L * 1024L;
	
	private final long maxBytes;
	private final Cache<Fingerprint, Artifact> cache;
	
	/**
	 * Map of artifacts currently being computed, so that duplicate requests wait for the first to complete.
	 */
	private final Map<Fingerprint, ComputeTask> pending = new ConcurrentHashMap<>();
	
	private final AtomicLong computationCount = new AtomicLong();
	private final AtomicLong hitCount = new AtomicLong();
	private final AtomicLong duplicateRequestCount = new AtomicLong();
	
	private static class ComputeTask extends FutureTask<Artifact> {
		
		private final Thread thread;
		
		ComputeTask(Thread thread, Callable<Artifact> callable) {
			super(callable);
			this.thread = thread;
		}
		
		/**
		 * Complete the task with an existing artifact, without running it.
		 */
		void complete(Artifact artifact) {
			set(artifact);
		}
		
	}
	
	/**
	 * Create a cache with the default maximum size.
	 */
	public ArtifactCache() {
		this(DEFAULT_MAX_BYTES);
	}
	
	/**
	 * Create a cache that retains up to the specified number of bytes.
	 * @param maxBytes maximum total artifact size; if 0, nothing is retained but concurrent requests are still deduplicated
	 */
	public ArtifactCache(long maxBytes) {
		if (maxBytes < 0)
			throw new IllegalArgumentException("Cache size must be >= 0, but was " + maxBytes);
		this.maxBytes = maxBytes;
		// A single segment gives exact least-recently-used eviction across all entries
		this.cache = CacheBuilder.newBuilder()
				.concurrencyLevel(1)
				.weigher((Fingerprint k, Artifact v) -> Math.max(1, v.length()))
				.maximumWeight(maxBytes)
				.removalListener(n -> {
					if (n.wasEvicted())
						logger.trace("Evicted {} ({})", n.getKey(), n.getCause());
				})
				.build();
	}
	
	/**
	 * Get the artifact for a fingerprint, computing it if necessary.
	 * <p>
	 * If another thread is already computing the same fingerprint, this waits for its result rather 
	 * than computing again.
	 * 
	 * @param fingerprint
	 * @param computation function to compute the artifact; must not return null
	 * @return the artifact
	 * @throws IOException if the computation failed; an {@link IOException} thrown by the computation is 
	 *                     rethrown as-is, while any other failure is wrapped in an {@link ImageComputationException}
	 * @throws InterruptedIOException if interrupted while waiting
	 */
	public Artifact getOrCompute(Fingerprint fingerprint, Callable<Artifact> computation) throws IOException {
		return getOrCompute(fingerprint, computation, -1, TimeUnit.MILLISECONDS);
	}
	
	/**
	 * Get the artifact for a fingerprint, computing it if necessary, waiting up to the specified time for 
	 * another thread's computation.
	 * <p>
	 * A timeout only affects the waiting thread: the shared computation continues, and its result will still 
	 * be cached. A thread that performs the computation itself is not subject to the timeout.
	 * 
	 * @param fingerprint
	 * @param computation function to compute the artifact; must not return null
	 * @param timeout maximum time to wait; if negative, wait indefinitely
	 * @param unit
	 * @return the artifact
	 * @throws IOException if the computation failed
	 * @throws InterruptedIOException if interrupted or timed out while waiting
	 * @throws IllegalStateException if called from within the computation of the same fingerprint
	 */
	public Artifact getOrCompute(Fingerprint fingerprint, Callable<Artifact> computation, long timeout, TimeUnit unit) throws IOException {
		Objects.requireNonNull(fingerprint, "Fingerprint must not be null");
		Objects.requireNonNull(computation, "Computation must not be null");
		
		var cached = cache.getIfPresent(fingerprint);
		if (cached != null) {
			hitCount.incrementAndGet();
			logger.trace("Returning cached artifact for {}", fingerprint);
			return cached;
		}
		
		var thread = Thread.currentThread();
		var newTask = new ComputeTask(thread, () -> compute(fingerprint, computation));
		var existing = pending.putIfAbsent(fingerprint, newTask);
		// A computation that requests its own fingerprint would otherwise wait on itself forever
		if (existing != null && existing.thread == thread && !existing.isDone())
			throw new IllegalStateException("Recursive request for " + fingerprint);
		var task = existing == null ? newTask : existing;
		if (existing == null) {
			try {
				// Another thread may have published the artifact between our cache check and registering the task
				cached = cache.getIfPresent(fingerprint);
				if (cached != null) {
					hitCount.incrementAndGet();
					task.complete(cached);
				} else
					task.run();
				return getResult(fingerprint, task, -1, unit);
			} finally {
				pending.remove(fingerprint, task);
			}
		} else {
			long n = duplicateRequestCount.incrementAndGet();
			logger.debug("Duplicate request for a pending artifact ({} total) - {}", n, fingerprint);
			return getResult(fingerprint, task, timeout, unit);
		}
	}
	
	private Artifact compute(Fingerprint fingerprint, Callable<Artifact> computation) throws Exception {
		computationCount.incrementAndGet();
		logger.trace("Computing artifact for {}", fingerprint);
		var artifact = computation.call();
		if (artifact == null)
			throw new NullPointerException("Computation returned null for " + fingerprint);
		// Publish before the pending entry is removed, so that later requests find it in the cache
		cache.put(fingerprint, artifact);
		if (cache.getIfPresent(fingerprint) == null) {
			LogTools.warnOnce(logger, "Unable to cache some artifacts - consider increasing the cache size (currently " + maxBytes + " bytes)");
			logger.debug("Unable to cache {} for {}", artifact, fingerprint);
		}
		return artifact;
	}
	
	private static Artifact getResult(Fingerprint fingerprint, ComputeTask task, long timeout, TimeUnit unit) throws IOException {
		try {
			if (timeout < 0)
				return task.get();
			return task.get(timeout, unit);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			var e2 = new InterruptedIOException("Interrupted while waiting for " + fingerprint);
			e2.initCause(e);
			throw e2;
		} catch (TimeoutException e) {
			var e2 = new InterruptedIOException("Timed out waiting for " + fingerprint);
			e2.initCause(e);
			throw e2;
		} catch (ExecutionException e) {
			var cause = e.getCause();
			logger.debug("Computation failed for {}: {}", fingerprint, cause == null ? e.getMessage() : cause.getMessage());
			if (cause instanceof IOException)
				throw (IOException)cause;
			throw new ImageComputationException("Unable to compute " + fingerprint, cause == null ? e : cause);
		}
	}
	
	/**
	 * Get the cached artifact for a fingerprint, without computing it.
	 * @param fingerprint
	 * @return the artifact, or null if it is not cached
	 */
	public Artifact getIfPresent(Fingerprint fingerprint) {
		return cache.getIfPresent(fingerprint);
	}
	
	/**
	 * Returns true if an artifact is currently being computed for the fingerprint.
	 * @param fingerprint
	 * @return
	 */
	public boolean isPending(Fingerprint fingerprint) {
		return pending.containsKey(fingerprint);
	}
	
	/**
	 * Remove all cached artifacts. Pending computations are unaffected.
	 */
	public void clear() {
		cache.invalidateAll();
	}
	
	/**
	 * Get the number of cached artifacts.
	 * @return
	 */
	public long size() {
		return cache.size();
	}
	
	/**
	 * Get the maximum total number of bytes that may be retained.
	 * @return
	 */
	public long getMaxBytes() {
		return maxBytes;
	}
	
	/**
	 * Get the number of computations that have been started.
	 * @return
	 */
	public long getComputationCount() {
		return computationCount.get();
	}
	
	/**
	 * Get the number of requests that were satisfied from the cache.
	 * @return
	 */
	public long getHitCount() {
		return hitCount.get();
	}
	
	/**
	 * Get the number of requests that waited for another thread's computation.
	 * @return
	 */
	public long getDuplicateRequestCount() {
		return duplicateRequestCount.get();
	}
	
	@Override
	public String toString() {
		return String.format("ArtifactCache[size=%d, maxBytes=%d, computations=%d, hits=%d, duplicates=%d]",
				size(), maxBytes, getComputationCount(), getHitCount(), getDuplicateRequestCount());
	}

}
