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

package pixelserve.lib.io;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;

/**
 * Access to a default {@link Gson} instance, with type adapters for the classes used in configuration files.
 * 
 * @author PixelServe developers
 */
public class GsonTools {
	
	private static final GsonBuilder builder = new GsonBuilder()
			.serializeSpecialFloatingPointValues()
			.setLenient()
			.registerTypeHierarchyAdapter(Path.class, PathTypeAdapter.INSTANCE);
	
	// Suppress default constructor for non-instantiability
	private GsonTools() {
		throw new AssertionError();
	}
	
	/**
	 * Get the default Gson.
	 * @return
	 * @see #getInstance(boolean)
	 */
	public static Gson getInstance() {
		return builder.create();
	}
	
	/**
	 * Get the default Gson, optionally with pretty printing enabled.
	 * @param pretty if true, write using pretty-printing
	 * @return
	 */
	public static Gson getInstance(boolean pretty) {
		if (pretty)
			return getInstance().newBuilder().setPrettyPrinting().create();
		return getInstance();
	}
	
	/**
	 * TypeAdapter to read and write file paths as strings.
	 */
	static class PathTypeAdapter extends TypeAdapter<Path> {
		
		static final PathTypeAdapter INSTANCE = new PathTypeAdapter();

		@Override
		public void write(JsonWriter out, Path value) throws IOException {
			if (value == null)
				out.nullValue();
			else
				out.value(value.toString());
		}

		@Override
		public Path read(JsonReader in) throws IOException {
			if (in.peek() == JsonToken.NULL) {
				in.nextNull();
				return null;
			}
			return Paths.get(in.nextString());
		}
		
	}

}
