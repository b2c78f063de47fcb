/*
 * Copyright 2019 the original author or authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.fluentsql.relational.core.sql.render;

import java.util.List;

/**
 * {@link PartRenderer} for the {@code ORDER BY} clause.
 */
class OrderByClauseRenderer implements PartRenderer {

	private final List<String> orderBy;

	OrderByClauseRenderer(List<String> orderBy) {
		this.orderBy = orderBy;
	}

	@Override
	public CharSequence getRenderedPart() {

		StringBuilder builder = new StringBuilder();
		boolean first = true;

		for (String field : orderBy) {

			if (!first) {
				builder.append(", ");
			} else {
				builder.append(" ORDER BY ");
			}
			first = false;

			builder.append(field);
		}

		return builder;
	}
}
