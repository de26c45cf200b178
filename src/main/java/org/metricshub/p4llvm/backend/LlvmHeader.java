package org.metricshub.p4llvm.backend;

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

import org.metricshub.p4llvm.hlir.P4HeaderInstance;

/**
 * A packet header. It starts invalid and becomes valid when extracted.
 */
public final class LlvmHeader extends LlvmInstance {

	LlvmHeader(P4HeaderInstance hlirInstance, String structVariable, LlvmTypeFactory typeFactory) {
		super(hlirInstance, structVariable, typeFactory);
	}

	@Override
	public InstanceKind getKind() {
		return InstanceKind.HEADER;
	}

	@Override
	public String getInitializer() {
		return "{ ." + VALID_FIELD + " = 0 }";
	}
}
