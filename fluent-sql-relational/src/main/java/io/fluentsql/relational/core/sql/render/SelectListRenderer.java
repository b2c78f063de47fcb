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
 * {@link PartRenderer} for comma separated lists such as select lists, column lists and {@code GROUP BY}
 * expressions.
 */
class SelectListRenderer implements PartRenderer {

	private final List<String> items;
	private final String fallback;

	private SelectListRenderer(List<String> items, String fallback) {
		this.items = items;
		this.fallback = fallback;
	}

	/**
	 * Render the list, falling back to {@code *} if it is empty.
	 */
	static SelectListRenderer selectList(List<String> fields) {
		return new SelectListRenderer(fields, "*");
	}

	/**
	 * Render the list as is, empty if there are no items.
	 */
	static SelectListRenderer of(List<String> items) {
		return new SelectListRenderer(items, "");
	}

	@Override
	public CharSequence getRenderedPart() {

		if (items.isEmpty()) {
			return fallback;
		}

		StringBuilder builder = new StringBuilder();
		boolean requiresComma = false;

		for (String item : items) {

			if (requiresComma) {
				builder.append(", ");
			}
			builder.append(item);
			requiresComma = true;
		}

		return builder;
	}
}
