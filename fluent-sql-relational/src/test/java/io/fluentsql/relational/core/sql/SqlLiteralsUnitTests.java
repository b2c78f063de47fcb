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

import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link SqlLiterals}.
 */
class SqlLiteralsUnitTests {

	@Test
	void shouldDoubleSingleQuotes() {

		assertThat(SqlLiterals.escape("O'Brien")).isEqualTo("O''Brien");
		assertThat(SqlLiterals.escape("Hello, 'World'")).isEqualTo("Hello, ''World''");
	}

	@Test
	void shouldLeaveTextWithoutQuotesUntouched() {
		assertThat(SqlLiterals.escape("Don Quixote")).isEqualTo("Don Quixote");
	}

	@Test
	void shouldQuoteEscapedValue() {

		assertThat(SqlLiterals.quote("Hello, 'World'")).isEqualTo("'Hello, ''World'''");
		assertThat(SqlLiterals.quote("")).isEqualTo("''");
	}

	@Test
	void builderShouldDelegateToLiterals() {

		String value = "Harry Potter and the Philosopher's Stone";

		assertThat(SqlBuilder.escape(value)).isEqualTo(SqlLiterals.escape(value));
		assertThat(SqlBuilder.quote(value)).isEqualTo("'" + SqlLiterals.escape(value) + "'");
	}

	@Test
	void shouldRejectNull() {
		assertThatIllegalArgumentException().isThrownBy(() -> SqlLiterals.escape(null));
	}
}
