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

import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.Test;

import io.fluentsql.relational.core.sql.IncompleteStatementException;
import io.fluentsql.relational.core.sql.SqlBuilder;
import io.fluentsql.relational.core.sql.Statement;

/**
 * Unit tests for {@link SqlRenderer}.
 */
class SqlRendererUnitTests {

	@Test
	void shouldRenderStatementOfEveryKind() {

		assertThat(SqlRenderer.toString(SqlBuilder.selectFrom("books").field("id").getStatement()))
				.isEqualTo("SELECT id FROM books");
		assertThat(SqlRenderer.toString(SqlBuilder.insertInto("books").field("id").values(1).getStatement()))
				.isEqualTo("INSERT INTO books (id) VALUES (1)");
		assertThat(SqlRenderer.toString(SqlBuilder.updateTable("books").set("id", 1).getStatement()))
				.isEqualTo("UPDATE books SET id = 1");
		assertThat(SqlRenderer.toString(SqlBuilder.deleteFrom("books").getStatement())).isEqualTo("DELETE FROM books");
	}

	@Test
	void renderingShouldNotChangeStatement() {

		Statement statement = SqlBuilder.selectFrom("books").andWhere("a").andWhere("b").orderDesc("id").getStatement();
		SqlRenderer renderer = SqlRenderer.create(statement);

		String first = renderer.render();

		assertThat(renderer.render()).isEqualTo(first).isEqualTo("SELECT * FROM books WHERE (a) AND (b) ORDER BY id DESC");
		assertThat(statement.getWheres()).containsExactly("a", "b");
	}

	@Test
	void valuesShouldNotRequireTable() {

		Statement statement = SqlBuilder.selectValues("1 + 1").getStatement();

		assertThat(SqlRenderer.create(statement).renderValues()).isEqualTo("SELECT 1 + 1");
		assertThatExceptionOfType(IncompleteStatementException.class)
				.isThrownBy(() -> SqlRenderer.create(statement).render()).withMessage("no table name");
	}

	@Test
	void shouldRejectNullStatement() {
		assertThatIllegalArgumentException().isThrownBy(() -> SqlRenderer.create(null));
	}
}
