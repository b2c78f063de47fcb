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

import io.fluentsql.relational.core.sql.IncompleteStatementException;
import io.fluentsql.relational.core.sql.IncompleteStatementException.Reason;
import io.fluentsql.relational.core.sql.Statement;

/**
 * {@link PartRenderer} for {@code INSERT} statements. A {@code SELECT} source takes precedence over value tuples.
 */
class InsertStatementRenderer implements PartRenderer {

	private final Statement statement;

	InsertStatementRenderer(Statement statement) {
		this.statement = statement;
	}

	@Override
	public CharSequence getRenderedPart() {

		StringBuilder builder = new StringBuilder("INSERT INTO ").append(SqlRenderer.requireTable(statement));

		if (!statement.getFields().isEmpty()) {
			builder.append(" (").append(SelectListRenderer.of(statement.getFields()).getRenderedPart()).append(')');
		}

		String select = statement.getSelect();

		if (select != null) {
			return builder.append(' ').append(select);
		}

		if (statement.getValues().isEmpty()) {
			throw new IncompleteStatementException(Reason.NO_VALUES);
		}

		return builder.append(" VALUES ").append(SelectListRenderer.of(statement.getValues()).getRenderedPart());
	}
}
