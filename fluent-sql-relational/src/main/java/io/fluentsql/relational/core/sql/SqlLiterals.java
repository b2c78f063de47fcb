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
package io.fluentsql.relational.core.sql;

import org.springframework.util.Assert;

/**
 * Utility methods to embed string literals into raw SQL fragments. The builder never escapes caller-supplied field,
 * condition or join text on its own, so literal values must pass through {@link #quote(String)} (or
 * {@link #escape(String)} when the surrounding quotes are already part of the fragment).
 *
 * @see SqlBuilder#quote(String)
 */
public abstract class SqlLiterals {

	private static final String SINGLE_QUOTE = "'";

	/**
	 * Escape a string value by doubling every single quote.
	 *
	 * @param value the raw value, must not be {@literal null}.
	 * @return the escaped value, e.g. {@code O''Brien} for {@code O'Brien}.
	 */
	public static String escape(String value) {

		Assert.notNull(value, "Value must not be null!");

		return value.replace(SINGLE_QUOTE, SINGLE_QUOTE + SINGLE_QUOTE);
	}

	/**
	 * Escape a string value and wrap it into single quotes.
	 *
	 * @param value the raw value, must not be {@literal null}.
	 * @return the quoted string literal.
	 */
	public static String quote(String value) {
		return SINGLE_QUOTE + escape(value) + SINGLE_QUOTE;
	}

	// Utility constructor.
	private SqlLiterals() {
	}
}
