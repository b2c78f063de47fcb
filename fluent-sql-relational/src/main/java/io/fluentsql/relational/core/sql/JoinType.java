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

/**
 * Join operators that prefix the {@code JOIN} keyword.
 *
 * @see SqlBuilder#join(Object)
 */
public enum JoinType {

	/**
	 * Plain {@code JOIN}.
	 */
	JOIN(""),

	LEFT("LEFT "),

	LEFT_OUTER("LEFT OUTER "),

	RIGHT("RIGHT "),

	INNER("INNER "),

	CROSS("CROSS ");

	private final String prefix;

	JoinType(String prefix) {
		this.prefix = prefix;
	}

	/**
	 * @return the keyword text rendered in front of {@code JOIN}, including its trailing blank. Empty for
	 *         {@link #JOIN}.
	 */
	public String getPrefix() {
		return prefix;
	}
}
