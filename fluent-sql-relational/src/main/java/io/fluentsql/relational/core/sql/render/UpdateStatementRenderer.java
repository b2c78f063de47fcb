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
 * {@link PartRenderer} for {@code UPDATE} statements.
 */
class UpdateStatementRenderer implements PartRenderer {

	private final Statement statement;

	UpdateStatementRenderer(Statement statement) {
		this.statement = statement;
	}

	@Override
	public CharSequence getRenderedPart() {

		String table = SqlRenderer.requireTable(statement);

		if (statement.getSets().isEmpty()) {
			throw new IncompleteStatementException(Reason.NO_SET_FIELDS);
		}

		return new StringBuilder("UPDATE ").append(table) //
				.append(" SET ").append(SelectListRenderer.of(statement.getSets()).getRenderedPart()) //
				.append(new WhereClauseRenderer(statement.getWheres()).getRenderedPart());
	}
}
