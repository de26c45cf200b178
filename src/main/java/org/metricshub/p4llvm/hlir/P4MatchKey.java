package org.metricshub.p4llvm.hlir;

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

import java.util.Locale;
import java.util.Objects;

/**
 * One component of a table key.
 */
public final class P4MatchKey {

	/**
	 * How the key component is compared against table entries.
	 */
	public enum MatchType {
		EXACT,
		LPM,
		TERNARY,
		RANGE,
		/** Matches on the validity bit of a header. */
		VALID;

		/**
		 * @param name match type as spelled in the source program
		 * @return the match type
		 * @throws IllegalArgumentException if the name is unknown
		 */
		public static MatchType fromName(String name) {
			return valueOf(name.toUpperCase(Locale.ROOT));
		}
	}

	private final P4Expression target;
	private final MatchType matchType;

	/**
	 * @param target a field reference, or a header reference for {@link MatchType#VALID}
	 * @param matchType comparison kind
	 */
	public P4MatchKey(P4Expression target, MatchType matchType) {
		this.target = Objects.requireNonNull(target, "target");
		this.matchType = Objects.requireNonNull(matchType, "matchType");
		if (matchType == MatchType.VALID && !(target instanceof P4Expression.HeaderRef)) {
			throw new IllegalArgumentException("A valid match needs a header reference, not " + target);
		}
		if (matchType != MatchType.VALID && !(target instanceof P4Expression.FieldRef)) {
			throw new IllegalArgumentException("A " + matchType + " match needs a field reference, not " + target);
		}
	}

	public P4Expression getTarget() {
		return target;
	}

	public MatchType getMatchType() {
		return matchType;
	}

	@Override
	public String toString() {
		return target + ":" + matchType.name().toLowerCase(Locale.ROOT);
	}
}
