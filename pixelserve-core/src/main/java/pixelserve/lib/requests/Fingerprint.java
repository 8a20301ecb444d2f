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

package pixelserve.lib.requests;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import com.google.common.hash.HashCode;
import com.google.common.hash.Hashing;

import pixelserve.lib.common.GeneralTools;

/**
 * Deterministic identity for a source image and an ordered list of request tokens.
 * <p>
 * The fingerprint is the SHA-256 hash of a canonical key of the form {@code source?token1&token2}. 
 * Blank tokens are dropped, and a source without tokens has no trailing {@code ?}, so 
 * {@code car.bmp}, {@code car.bmp?} and {@code car.bmp?&} all give the same fingerprint.
 * Token order is significant. The source is used exactly as given, since whitespace may be part of a file name.
 * 
 * @author PixelServe developers
 */
public final class Fingerprint {
	
	private final String canonicalKey;
	private final HashCode hash;
	
	private Fingerprint(String canonicalKey) {
		this.canonicalKey = canonicalKey;
		this.hash = Hashing.sha256().hashString(canonicalKey, StandardCharsets.UTF_8);
	}
	
	/**
	 * Create a fingerprint for a source and ordered tokens.
	 * @param source the source identity
	 * @param tokens tokens describing the request, in order
	 * @return
	 */
	public static Fingerprint of(String source, Collection<String> tokens) {
		Objects.requireNonNull(source, "Source must not be null");
		Objects.requireNonNull(tokens, "Tokens must not be null");
		String base = source;
		while (base.endsWith("?"))
			base = base.substring(0, base.length() - 1);
		String query = tokens.stream()
				.filter(t -> t != null && !GeneralTools.blankString(t, true))
				.map(String::strip)
				.collect(Collectors.joining("&"));
		return new Fingerprint(query.isEmpty() ? base : base + "?" + query);
	}
	
	/**
	 * Create a fingerprint for a source and ordered tokens.
	 * @param source
	 * @param tokens
	 * @return
	 */
	public static Fingerprint of(String source, String... tokens) {
		return of(source, Arrays.asList(tokens));
	}
	
	/**
	 * Create a fingerprint from a request string of the form {@code source?token1&token2}.
	 * @param request
	 * @return
	 */
	public static Fingerprint parse(String request) {
		Objects.requireNonNull(request, "Request must not be null");
		int ind = request.indexOf('?');
		if (ind < 0)
			return of(request);
		List<String> tokens = new ArrayList<>(Arrays.asList(request.substring(ind + 1).split("&")));
		return of(request.substring(0, ind), tokens);
	}
	
	/**
	 * Get the canonical key from which the hash was computed.
	 * @return
	 */
	public String getCanonicalKey() {
		return canonicalKey;
	}
	
	/**
	 * Get the hash as a lowercase hexadecimal string.
	 * @return
	 */
	public String toHexString() {
		return hash.toString();
	}
	
	@Override
	public String toString() {
		return "Fingerprint[" + canonicalKey + "]";
	}

	@Override
	public int hashCode() {
		return hash.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof Fingerprint))
			return false;
		return hash.equals(((Fingerprint)obj).hash);
	}

}
