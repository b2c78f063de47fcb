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

import org.springframework.dao.TypeMismatchDataAccessException;

/**
 * Thrown when a result cell holds a value that has no JSON representation. Only {@code NULL}, integer and text
 * values are supported.
 *
 * @see JsonValueConverter
 */
public class UnsupportedValueTypeException extends TypeMismatchDataAccessException {

	private static final long serialVersionUID = -2318526240925087543L;

	private final Class<?> valueType;

	public UnsupportedValueTypeException(Class<?> valueType) {

		super("Unsupported type " + valueType.getName());

		this.valueType = valueType;
	}

	/**
	 * @return the Java type of the rejected value.
	 */
	public Class<?> getValueType() {
		return valueType;
	}
}
