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

package pixelserve;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.HelpCommand;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.TypeConversionException;
import pixelserve.lib.app.logging.LogManager;
import pixelserve.lib.app.logging.LogManager.LogLevel;
import pixelserve.lib.common.ColorTools;
import pixelserve.lib.common.ThreadTools;
import pixelserve.lib.images.ops.Flip;
import pixelserve.lib.images.ops.ImageFilter;
import pixelserve.lib.images.ops.ImageOp;
import pixelserve.lib.images.ops.ImageOps;
import pixelserve.lib.images.ops.NearestNeighborSampler;
import pixelserve.lib.images.ops.Rotation;
import pixelserve.lib.images.servers.FileImageLoader;
import pixelserve.lib.images.servers.ImageIoDecoder;
import pixelserve.lib.images.servers.ImageRequestHandler;
import pixelserve.lib.images.servers.OutputFormat;
import pixelserve.lib.images.stores.Artifact;
import pixelserve.lib.images.stores.ArtifactCache;
import pixelserve.lib.images.writers.ImageWriterTools;
import pixelserve.lib.io.PixelServeConfig;
import pixelserve.lib.regions.ImageRegion;
import pixelserve.lib.requests.ImageRequest;

/**
 * Main PixelServe launcher.
 * 
 * @author PixelServe developers
 */
@Command(name = "pixelserve", subcommands = {HelpCommand.class, RenderCommand.class},
	description = "Transform images with resize, crop, rotate, flip and filter operations.",
	mixinStandardHelpOptions = true, version = "PixelServe 0.1.0")
public class PixelServe {
	
	@Option(names = {"-l", "--log"}, description = {"Log level (default = INFO).", "Options: ${COMPLETION-CANDIDATES}"})
	void setLogLevel(LogLevel logLevel) {
		if (logLevel != null)
			LogManager.setRootLogLevel(logLevel);
	}
	
	/**
	 * Main class to launch PixelServe.
	 * 
	 * @param args
	 */
	public static void main(String[] args) {
		int exitCode = createCommandLine().execute(args);
		System.exit(exitCode);
	}
	
	static CommandLine createCommandLine() {
		CommandLine cmd = new CommandLine(new PixelServe());
		cmd.setCaseInsensitiveEnumValuesAllowed(true);
		cmd.setExpandAtFiles(false);
		cmd.setExitCodeExceptionMapper(t -> t instanceof CommandLine.ParameterException ? CommandLine.ExitCode.USAGE : 1);
		return cmd;
	}

}


@Command(name = "render", description = {
		"Render a transformed image.",
		"Operations are applied in a fixed order: crop, resize, rotate & flip, then filters."},
		mixinStandardHelpOptions = true)
class RenderCommand implements Callable<Integer> {
	
	private static final Logger logger = LoggerFactory.getLogger(RenderCommand.class);
	
	@Parameters(index = "0", description = "Source image, relative to the image root.", paramLabel = "source")
	private String source;
	
	@Option(names = {"-c", "--config"}, description = "Path to a JSON configuration file.", paramLabel = "config")
	private Path configPath;
	
	@Option(names = {"-o", "--output"}, description = "Output file.", paramLabel = "output", required = true)
	private Path output;
	
	@Option(names = {"--width"}, description = "Output width; if no height is given, the aspect ratio is preserved.")
	private Integer width;
	
	@Option(names = {"--height"}, description = "Output height; if no width is given, the aspect ratio is preserved.")
	private Integer height;
	
	@Option(names = {"--size"}, description = "Output size of the longer side, preserving the aspect ratio.")
	private Integer size;
	
	@Option(names = {"--nearest"}, description = "Use nearest neighbor sampling when resizing.")
	private boolean nearest;
	
	@Option(names = {"--rotate"}, description = "Clockwise rotation in degrees (a multiple of 90).", defaultValue = "0")
	private int rotate;
	
	@Option(names = {"--flip"}, description = {"Flip after rotating.", "Options: ${COMPLETION-CANDIDATES}"}, defaultValue = "NONE")
	private Flip flip;
	
	@Option(names = {"--crop"}, description = "Crop region as x,y,width,height.", converter = RegionConverter.class, paramLabel = "x,y,w,h")
	private ImageRegion crop;
	
	@Option(names = {"--gray"}, description = "Convert to grayscale.")
	private boolean gray;
	
	@Option(names = {"--invert"}, description = "Invert colors.")
	private boolean invert;
	
	@Option(names = {"--blur"}, description = "Gaussian blur variance.", paramLabel = "variance")
	private Double blur;
	
	@Option(names = {"--brightness"}, description = "Brightness change (-255 to 255).")
	private Integer brightness;
	
	@Option(names = {"--contrast"}, description = "Contrast change (-100 to 100).")
	private Integer contrast;
	
	@Option(names = {"--tint"}, description = "Tint color, as a hexadecimal RGB value.", paramLabel = "color")
	private String tint;
	
	@Option(names = {"--circle"}, description = "Make pixels outside the largest centered circle transparent.")
	private boolean circle;
	
	@Option(names = {"--sobel"}, description = "Apply Sobel edge detection.")
	private boolean sobel;
	
	@Option(names = {"--prewitt"}, description = "Apply Prewitt edge detection.")
	private boolean prewitt;
	
	@Option(names = {"--format"}, description = {"Output format; if not set, this is determined from the output extension.", "Options: ${COMPLETION-CANDIDATES}"})
	private OutputFormat format;
	
	@Option(names = {"--quality"}, description = "JPEG quality (1-100); defaults to the configured quality.")
	private Integer quality;
	
	@Option(names = {"--repeat"}, description = "Issue the same request this many times concurrently, and report how many computations were needed.", defaultValue = "1")
	private int repeat;
	
	@Override
	public Integer call() throws Exception {
		if (repeat < 1)
			throw new IllegalArgumentException("Repeat count must be at least 1");
		var config = configPath == null ? PixelServeConfig.createDefault() : PixelServeConfig.read(configPath);
		logger.debug("Using {}", config);
		
		var request = createRequest(config);
		var cache = new ArtifactCache(config.getCacheSizeBytes());
		ExecutorService framePool = ThreadTools.createFramePool(config.getFrameThreads());
		try {
			var handler = new ImageRequestHandler(
					new FileImageLoader(config.getImageRoot()),
					new ImageIoDecoder(),
					ImageWriterTools.getEncoder(),
					cache,
					framePool);
			var artifact = repeat == 1 ? handler.handle(request) : handleConcurrently(handler, request, repeat);
			
			var parent = output.toAbsolutePath().getParent();
			if (parent != null)
				Files.createDirectories(parent);
			Files.write(output, artifact.getBytes());
			logger.info("Wrote {} to {}", artifact, output);
			if (repeat > 1)
				logger.info("{} requests needed {} computation(s)", repeat, cache.getComputationCount());
			return 0;
		} finally {
			if (framePool != null)
				framePool.shutdownNow();
		}
	}
	
	private static Artifact handleConcurrently(ImageRequestHandler handler, ImageRequest request, int n) throws IOException, InterruptedException {
		var pool = ThreadTools.createFixedPool("pixelserve-request-", n);
		try {
			List<Future<Artifact>> futures = new ArrayList<>();
			for (int i = 0; i < n; i++)
				futures.add(pool.submit(() -> handler.handle(request)));
			Artifact artifact = null;
			for (var future : futures) {
				var result = future.get();
				if (artifact != null && !artifact.equals(result))
					throw new IllegalStateException("Identical requests gave different results!");
				artifact = result;
			}
			return artifact;
		} catch (ExecutionException e) {
			if (e.getCause() instanceof IOException)
				throw (IOException)e.getCause();
			throw new IOException(e.getCause());
		} finally {
			pool.shutdownNow();
		}
	}
	
	ImageRequest createRequest(PixelServeConfig config) {
		List<ImageOp> ops = new ArrayList<>();
		if (crop != null)
			ops.add(ImageOps.crop(crop));
		if (width != null || height != null || size != null) {
			var builder = ImageOps.resizeBuilder()
					.maxSize(config.getMaxWidth(), config.getMaxHeight());
			if (width != null)
				builder.width(width);
			if (height != null)
				builder.height(height);
			if (size != null)
				builder.size(size);
			if (nearest)
				builder.sampler(new NearestNeighborSampler());
			ops.add(builder.build());
		}
		var rotation = Rotation.fromDegrees(rotate);
		if (rotation != Rotation.NONE || flip != Flip.NONE)
			ops.add(ImageOps.transform(rotation, flip));
		
		List<ImageFilter> filters = new ArrayList<>();
		if (gray)
			filters.add(ImageOps.gray());
		if (invert)
			filters.add(ImageOps.invert());
		if (brightness != null)
			filters.add(ImageOps.brightness(brightness));
		if (contrast != null)
			filters.add(ImageOps.contrast(contrast));
		if (tint != null)
			filters.add(ImageOps.tint(ColorTools.parseHexColor(tint), false));
		if (blur != null)
			filters.add(ImageOps.blur(blur));
		if (sobel)
			filters.add(ImageOps.sobel());
		if (prewitt)
			filters.add(ImageOps.prewitt());
		if (circle)
			filters.add(ImageOps.circle());
		if (!filters.isEmpty())
			ops.add(ImageOps.filter(filters.toArray(ImageFilter[]::new)));
		
		var outputFormat = format;
		if (outputFormat == null) {
			outputFormat = OutputFormat.fromExtension(output.getFileName().toString())
					.orElseThrow(() -> new IllegalArgumentException("Cannot determine output format for " + output + " - please specify --format"));
		}
		int q = quality == null ? config.getDefaultJpegQuality() : quality;
		return ImageRequest.createInstance(source, ops, outputFormat, q);
	}
	
	static class RegionConverter implements ITypeConverter<ImageRegion> {

		@Override
		public ImageRegion convert(String value) throws Exception {
			String[] parts = value.split(",");
			if (parts.length != 4)
				throw new TypeConversionException("Expected x,y,width,height but got '" + value + "'");
			try {
				return ImageRegion.createInstance(
						Integer.parseInt(parts[0].strip()),
						Integer.parseInt(parts[1].strip()),
						Integer.parseInt(parts[2].strip()),
						Integer.parseInt(parts[3].strip()));
			} catch (NumberFormatException e) {
				throw new TypeConversionException("Invalid crop region '" + value + "': " + e.getMessage());
			}
		}
		
	}
	
}
