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
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ImageLoader} that reads files from below a root directory.
 * <p>
 * Any request parameters following {@code ?} are ignored. Sources that resolve outside the root 
 * are treated as missing.
 * 
 * @author PixelServe developers
 */
public class FileImageLoader implements ImageLoader {
	
	private static final Logger logger = LoggerFactory.getLogger(FileImageLoader.class);
	
	private final Path root;
	
	/**
	 * Constructor.
	 * @param root the directory to resolve sources against
	 */
	public FileImageLoader(Path root) {
		Objects.requireNonNull(root, "Root must not be null");
		this.root = root.toAbsolutePath().normalize();
	}
	
	public Path getRoot() {
		return root;
	}
	
	/**
	 * Resolve a source identity to a file below the root.
	 * @param source
	 * @return
	 * @throws NoSuchFileException if the source cannot be resolved below the root
	 */
	Path resolve(String source) throws NoSuchFileException {
		Objects.requireNonNull(source, "Source must not be null");
		String name = source;
		int ind = name.indexOf('?');
		if (ind >= 0)
			name = name.substring(0, ind);
		while (name.startsWith("/") || name.startsWith("\\"))
			name = name.substring(1);
		if (name.isBlank())
			throw new NoSuchFileException(source);
		Path path;
		try {
			path = root.resolve(name).normalize();
		} catch (InvalidPathException e) {
			logger.debug("Invalid path {}: {}", source, e.getMessage());
			throw new NoSuchFileException(source, null, e.getMessage());
		}
		if (!path.startsWith(root)) {
			logger.warn("Rejected request for {} outside of {}", source, root);
			throw new NoSuchFileException(source);
		}
		return path;
	}

	@Override
	public byte[] load(String source) throws IOException {
		var path = resolve(source);
		if (!Files.isRegularFile(path))
			throw new NoSuchFileException(path.toString());
		logger.trace("Loading {}", path);
		return Files.readAllBytes(path);
	}
	
	@Override
	public String toString() {
		return "FileImageLoader[" + root + "]";
	}

}
