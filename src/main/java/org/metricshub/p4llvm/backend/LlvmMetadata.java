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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.metricshub.p4llvm.hlir.P4HeaderInstance;

/**
 * Per-packet scratch data. Metadata is always valid; its fields start with
 * their declared initial value, or zero.
 */
public final class LlvmMetadata extends LlvmInstance {

	LlvmMetadata(P4HeaderInstance hlirInstance, String structVariable, LlvmTypeFactory typeFactory) {
		super(hlirInstance, structVariable, typeFactory);
	}

	@Override
	public InstanceKind getKind() {
		return InstanceKind.METADATA;
	}

	@Override
	public boolean hasValidity() {
		return false;
	}

	@Override
	public String getInitializer() {
		Map<String, String> initialValues = getHlirInstance().getInitializer();
		List<String> members = new ArrayList<String>();
		for (String field : getHeaderType().getFields().keySet()) {
			String value = initialValues.get(field);
			if (value == null) {
				value = getFieldType(field).getInitializer();
			}
			members.add("." + field + " = " + value);
		}
		if (members.isEmpty()) {
			return "{ 0 }";
		}
		return "{ " + String.join(", ", members) + " }";
	}
}
