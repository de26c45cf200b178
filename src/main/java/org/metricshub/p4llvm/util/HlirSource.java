package org.metricshub.p4llvm.util;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * P4LLVM
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Represents one JSON description of an HLIR: either text supplied by the
 * caller, or a file given with the {@code -f} command line switch.
 */
public class HlirSource {

	/** Constant <code>DESCRIPTION_INLINE="&lt;inline-hlir&gt;"</code> */
	public static final String DESCRIPTION_INLINE = "<inline-hlir>";

	private final String description;
	private final Reader reader;
	private final Path path;

	/**
	 * <p>
	 * Constructor for HlirSource.
	 * </p>
	 *
	 * @param description a {@link java.lang.String} object
	 * @param reader a {@link java.io.Reader} object
	 */
	public HlirSource(String description, Reader reader) {
		this.description = description;
		this.reader = reader;
		this.path = null;
	}

	private HlirSource(Path path) {
		this.description = path.toString();
		this.reader = null;
		this.path = path;
	}

	/**
	 * @param filePath path of a JSON file, read as UTF-8
	 * @return a source opening the file when read
	 */
	public static HlirSource fromFile(String filePath) {
		return new HlirSource(Paths.get(filePath));
	}

	public final String getDescription() {
		return description;
	}

	/**
	 * Obtain the {@link Reader} serving the JSON contents.
	 *
	 * @return The reader which contains the JSON contents.
	 * @throws java.io.IOException if the file cannot be opened
	 */
	public Reader getReader() throws IOException {
		if (path != null) {
			return Files.newBufferedReader(path, StandardCharsets.UTF_8);
		}
		return reader;
	}

	/** {@inheritDoc} */
	@Override
	public String toString() {
		return getDescription();
	}
}
