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

import io.fluentsql.relational.core.sql.Statement;

/**
 * {@link PartRenderer} for {@code DELETE} statements.
 */
class DeleteStatementRenderer implements PartRenderer {

	private final Statement statement;

	DeleteStatementRenderer(Statement statement) {
		this.statement = statement;
	}

	@Override
	public CharSequence getRenderedPart() {

		return new StringBuilder("DELETE FROM ").append(SqlRenderer.requireTable(statement)) //
				.append(new WhereClauseRenderer(statement.getWheres()).getRenderedPart());
	}
}
