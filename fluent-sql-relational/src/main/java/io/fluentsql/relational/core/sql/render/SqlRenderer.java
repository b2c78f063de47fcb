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

import org.springframework.util.Assert;
import org.springframework.util.StringUtils;

import io.fluentsql.relational.core.sql.IncompleteStatementException;
import io.fluentsql.relational.core.sql.IncompleteStatementException.Reason;
import io.fluentsql.relational.core.sql.Statement;

/**
 * Renders a {@link Statement} into SQL text. Rendering dispatches on {@link Statement#getKind()} and does not change
 * the statement, so rendering twice yields the same text.
 *
 * @see io.fluentsql.relational.core.sql.SqlBuilder#query()
 */
public class SqlRenderer {

	private final Statement statement;

	private SqlRenderer(Statement statement) {

		Assert.notNull(statement, "Statement must not be null!");

		this.statement = statement;
	}

	/**
	 * Creates a new {@link SqlRenderer}.
	 *
	 * @param statement must not be {@literal null}.
	 * @return the renderer.
	 */
	public static SqlRenderer create(Statement statement) {
		return new SqlRenderer(statement);
	}

	/**
	 * Renders a {@link Statement} into a SQL fragment.
	 *
	 * @param statement must not be {@literal null}.
	 * @return the rendered fragment.
	 * @see #render()
	 */
	public static String toString(Statement statement) {
		return create(statement).render();
	}

	/**
	 * Render the statement as fragment without trailing {@code ;}.
	 *
	 * @return the rendered fragment.
	 * @throws IncompleteStatementException if a part required by the statement kind is missing.
	 */
	public String render() {

		PartRenderer renderer;

		switch (statement.getKind()) {
			case SELECT:
				renderer = new SelectStatementRenderer(statement, false);
				break;
			case INSERT:
				renderer = new InsertStatementRenderer(statement);
				break;
			case UPDATE:
				renderer = new UpdateStatementRenderer(statement);
				break;
			case DELETE:
				renderer = new DeleteStatementRenderer(statement);
				break;
			default:
				throw new IllegalStateException("Unsupported statement kind " + statement.getKind());
		}

		return renderer.getRenderedPart().toString();
	}

	/**
	 * Render {@code SELECT [DISTINCT] fields} without {@code FROM} and further clauses except unions.
	 *
	 * @return the rendered fragment.
	 */
	public String renderValues() {
		return new SelectStatementRenderer(statement, true).getRenderedPart().toString();
	}

	static String requireTable(Statement statement) {

		if (!StringUtils.hasText(statement.getTable())) {
			throw new IncompleteStatementException(Reason.NO_TABLE_NAME);
		}

		return statement.getTable();
	}
}
