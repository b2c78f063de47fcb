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
package io.fluentsql.jdbc.core;

import org.springframework.lang.Nullable;
import org.springframework.util.Assert;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

/**
 * Converts JDBC cell values into {@link JsonNode}s: {@literal null} becomes a null node, integral numbers
 * ({@link Byte}, {@link Short}, {@link Integer}, {@link Long}) become numeric nodes and {@link String}s become text
 * nodes. Any other value is rejected with {@link UnsupportedValueTypeException}.
 */
public class JsonValueConverter {

	private final JsonNodeFactory nodeFactory;

	public JsonValueConverter() {
		this(JsonNodeFactory.instance);
	}

	public JsonValueConverter(JsonNodeFactory nodeFactory) {

		Assert.notNull(nodeFactory, "JsonNodeFactory must not be null!");

		this.nodeFactory = nodeFactory;
	}

	/**
	 * Convert a single cell value.
	 *
	 * @param value the value as returned by the JDBC driver, may be {@literal null}.
	 * @return the JSON value.
	 * @throws UnsupportedValueTypeException if the value type has no JSON representation.
	 */
	public JsonNode convert(@Nullable Object value) {

		if (value == null) {
			return nodeFactory.nullNode();
		}

		if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
			return nodeFactory.numberNode(((Number) value).longValue());
		}

		if (value instanceof String) {
			return nodeFactory.textNode((String) value);
		}

		throw new UnsupportedValueTypeException(value.getClass());
	}
}
