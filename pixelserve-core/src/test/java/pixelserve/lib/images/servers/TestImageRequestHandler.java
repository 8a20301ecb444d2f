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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.file.NoSuchFileException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import pixelserve.lib.common.ColorTools;
import pixelserve.lib.common.ThreadTools;
import pixelserve.lib.images.ImageContent;
import pixelserve.lib.images.PixelBuffer;
import pixelserve.lib.images.SizeLimitExceededException;
import pixelserve.lib.images.ops.ImageOps;
import pixelserve.lib.images.stores.ArtifactCache;
import pixelserve.lib.requests.ImageRequest;

@SuppressWarnings("javadoc")
public class TestImageRequestHandler {
	
	/**
	 * Minimal raw codec: width and height as ints, followed by RGBA bytes of the first frame.
	 */
	private static class RawCodec implements ImageDecoder, ImageEncoder {

		@Override
		public ImageContent decode(byte[] bytes) throws IOException {
			if (bytes.length < 8)
				throw new ImageDecodeException("Too short");
			var buffer = ByteBuffer.wrap(bytes);
			int width = buffer.getInt();
			int height = buffer.getInt();
			byte[] pixels = new byte[bytes.length - 8];
			buffer.get(pixels);
			return ImageContent.single(PixelBuffer.create(width, height, pixels));
		}

		@Override
		public byte[] encode(ImageContent content, OutputFormat format, int quality) throws IOException {
			var frame = content.getFirstFrame();
			byte[] pixels = frame.getPixels();
			return ByteBuffer.allocate(8 + pixels.length)
					.putInt(frame.getWidth())
					.putInt(frame.getHeight())
					.put(pixels)
					.array();
		}
		
	}
	
	private static class MapLoader implements ImageLoader {
		
		private final Map<String, byte[]> sources = new ConcurrentHashMap<>();
		private final AtomicInteger loadCount = new AtomicInteger();
		private volatile CountDownLatch gate;

		@Override
		public byte[] load(String source) throws IOException {
			loadCount.incrementAndGet();
			var latch = gate;
			if (latch != null) {
				try {
					latch.await();
				} catch (InterruptedException e) {
					Thread.currentThread().interrupt();
					throw new IOException(e);
				}
			}
			var bytes = sources.get(source);
			if (bytes == null)
				throw new NoSuchFileException(source);
			return bytes;
		}
		
	}
	
	private ExecutorService pool;
	private MapLoader loader;
	private RawCodec codec;
	private ArtifactCache cache;
	private ImageRequestHandler handler;
	
	@BeforeEach
	public void setUp() throws IOException {
		pool = Executors.newCachedThreadPool(ThreadTools.createThreadFactory("test-handler-", true));
		loader = new MapLoader();
		codec = new RawCodec();
		var image = PixelBuffer.create(200, 150);
		for (int y = 0; y < image.getHeight(); y++) {
			for (int x = 0; x < image.getWidth(); x++)
				image.setPixel(x, y, ColorTools.packRGB(x, y, 100));
		}
		loader.sources.put("car.bmp", codec.encode(ImageContent.single(image), OutputFormat.PNG, 100));
		cache = new ArtifactCache();
		handler = new ImageRequestHandler(loader, codec, codec, cache, pool);
	}
	
	@AfterEach
	public void tearDown() {
		pool.shutdownNow();
	}
	
	private static ImageRequest createRequest(int width, int height) {
		return ImageRequest.createInstance("car.bmp", List.of(ImageOps.resize(width, height), ImageOps.filter(ImageOps.gray())), OutputFormat.PNG);
	}
	
	@Test
	public void test_concurrentIdenticalRequests() throws Exception {
		loader.gate = new CountDownLatch(1);
		var future1 = pool.submit(() -> handler.handle(createRequest(100, 100)));
		var future2 = pool.submit(() -> handler.handle(createRequest(100, 100)));
		long endTime = System.currentTimeMillis() + 10_000L;
		while (cache.getDuplicateRequestCount() < 1 && System.currentTimeMillis() < endTime)
			Thread.sleep(5L);
		loader.gate.countDown();
		
		var artifact1 = future1.get(10, TimeUnit.SECONDS);
		var artifact2 = future2.get(10, TimeUnit.SECONDS);
		assertSame(artifact1, artifact2);
		assertEquals(1, loader.loadCount.get());
		assertEquals(1, cache.getComputationCount());
		assertEquals("image/png", artifact1.getContentType());
		
		var output = codec.decode(artifact1.getBytes()).getBuffer();
		assertEquals(100, output.getWidth());
		assertEquals(100, output.getHeight());
		int p = output.getPixel(50, 50);
		assertEquals(ColorTools.red(p), ColorTools.green(p));
		assertEquals(ColorTools.green(p), ColorTools.blue(p));
	}
	
	@Test
	public void test_differentRequestsComputedSeparately() throws Exception {
		var artifact1 = handler.handle(createRequest(100, 100));
		var artifact2 = handler.handle(createRequest(50, 50));
		assertEquals(2, cache.getComputationCount());
		assertEquals(50, codec.decode(artifact2.getBytes()).getWidth());
		
		// Repeating a request uses the cache
		assertArrayEquals(artifact1.getBytes(), handler.handle(createRequest(100, 100)).getBytes());
		assertEquals(2, cache.getComputationCount());
		assertEquals(2, loader.loadCount.get());
	}
	
	@Test
	public void test_missingSource() {
		var request = ImageRequest.createInstance("missing.bmp", OutputFormat.PNG);
		assertThrows(NoSuchFileException.class, () -> handler.handle(request));
		assertEquals(0, cache.size());
	}
	
	@Test
	public void test_failingOp() {
		var op = ImageOps.custom("explode", frame -> {
			throw new IllegalStateException("Boom");
		});
		var request = ImageRequest.createInstance("car.bmp", List.of(op), OutputFormat.PNG);
		var e = assertThrows(ImageComputationException.class, () -> handler.handle(request));
		assertInstanceOf(IllegalStateException.class, e.getCause());
	}
	
	@Test
	public void test_sizeLimit() {
		var request = ImageRequest.createInstance("car.bmp", List.of(ImageOps.width(5000)), OutputFormat.PNG);
		var e = assertThrows(ImageComputationException.class, () -> handler.handle(request));
		assertInstanceOf(SizeLimitExceededException.class, e.getCause());
		assertEquals(0, cache.size());
	}
	
	@Test
	public void test_decodeFailure() {
		loader.sources.put("broken.bmp", new byte[] {1, 2});
		var request = ImageRequest.createInstance("broken.bmp", OutputFormat.PNG);
		assertThrows(ImageDecodeException.class, () -> handler.handle(request));
	}

}
