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
 * {@link PartRenderer} for the {@code WHERE} clause. A single condition is rendered bare, multiple conditions are
 * parenthesized and combined with {@code AND}.
 */
class WhereClauseRenderer implements PartRenderer {

	private final List<String> conditions;

	WhereClauseRenderer(List<String> conditions) {
		this.conditions = conditions;
	}

	@Override
	public CharSequence getRenderedPart() {

		if (conditions.isEmpty()) {
			return "";
		}

		StringBuilder builder = new StringBuilder(" WHERE ");

		if (conditions.size() == 1) {
			return builder.append(conditions.get(0));
		}

		boolean first = true;
		for (String condition : conditions) {

			if (!first) {
				builder.append(" AND ");
			}
			first = false;

			builder.append('(').append(condition).append(')');
		}

		return builder;
	}
}
