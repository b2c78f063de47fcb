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
 * {@link PartRenderer} for {@code SELECT} statements:
 *
 * <pre class="code">
 * SELECT [DISTINCT] fields|* FROM table [joins] [GROUP BY ...] [HAVING ...] [WHERE ...] [ORDER BY ...] [LIMIT n] [OFFSET n] [unions]
 * </pre>
 *
 * In values mode only {@code SELECT [DISTINCT] fields [unions]} is rendered and no table is required.
 */
class SelectStatementRenderer implements PartRenderer {

	private final Statement statement;
	private final boolean valuesOnly;

	SelectStatementRenderer(Statement statement, boolean valuesOnly) {
		this.statement = statement;
		this.valuesOnly = valuesOnly;
	}

	@Override
	public CharSequence getRenderedPart() {

		StringBuilder builder = new StringBuilder("SELECT ");

		if (statement.isDistinct()) {
			builder.append("DISTINCT ");
		}
		builder.append(SelectListRenderer.selectList(statement.getFields()).getRenderedPart());

		if (!valuesOnly) {

			builder.append(" FROM ").append(SqlRenderer.requireTable(statement));
			builder.append(new FragmentSequenceRenderer(statement.getJoins()).getRenderedPart());

			if (!statement.getGroupBy().isEmpty()) {
				builder.append(" GROUP BY ").append(SelectListRenderer.of(statement.getGroupBy()).getRenderedPart());
			}

			String having = statement.getHaving();
			if (having != null) {
				builder.append(" HAVING ").append(having);
			}

			builder.append(new WhereClauseRenderer(statement.getWheres()).getRenderedPart());
			builder.append(new OrderByClauseRenderer(statement.getOrderBy()).getRenderedPart());

			statement.getLimit().ifPresent(limit -> builder.append(" LIMIT ").append(limit));
			statement.getOffset().ifPresent(offset -> builder.append(" OFFSET ").append(offset));
		}

		builder.append(new FragmentSequenceRenderer(statement.getUnions()).getRenderedPart());

		return builder;
	}
}
