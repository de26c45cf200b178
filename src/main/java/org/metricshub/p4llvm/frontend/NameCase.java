package org.metricshub.p4llvm.frontend;

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

/**
 * Case conversions of P4 names into identifiers of generated code.
 * <p>
 * A word starts after any character that is not a letter, so
 * {@code "ipv4_lpm"} becomes {@code "Ipv4Lpm"}. Characters that are neither
 * letters nor digits are dropped.
 */
public final class NameCase {

	private NameCase() {
		// utility class
	}

	/**
	 * @param name a P4 name
	 * @return the name with every word capitalized, e.g. {@code Ipv4Lpm}
	 */
	public static String pascalCase(String name) {
		StringBuilder sb = new StringBuilder(name.length());
		boolean wordStart = true;
		for (int i = 0; i < name.length(); i++) {
			char c = name.charAt(i);
			if (Character.isLetter(c)) {
				sb.append(wordStart ? Character.toUpperCase(c) : Character.toLowerCase(c));
				wordStart = false;
			} else {
				wordStart = true;
				if (Character.isDigit(c)) {
					sb.append(c);
				}
			}
		}
		return sb.toString();
	}

	/**
	 * @param name a P4 name
	 * @return the {@link #pascalCase(String)} form with a lower-case first letter, e.g. {@code ipv4Lpm}
	 */
	public static String camelCase(String name) {
		String pascal = pascalCase(name);
		if (pascal.isEmpty()) {
			return pascal;
		}
		return Character.toLowerCase(pascal.charAt(0)) + pascal.substring(1);
	}
}
