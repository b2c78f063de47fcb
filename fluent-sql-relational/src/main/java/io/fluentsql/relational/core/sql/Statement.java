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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.OptionalLong;

import org.springframework.lang.Nullable;
import org.springframework.util.Assert;

/**
 * Accumulated clauses of a single SQL statement. Clauses are kept as already formatted SQL text in the order they
 * were added. Read access is public so that renderers can serialize the statement; mutation happens through
 * {@link SqlBuilder} only.
 * <p/>
 * Instances are not thread-safe.
 *
 * @see SqlBuilder
 * @see io.fluentsql.relational.core.sql.render.SqlRenderer
 */
public class Statement {

	private static final String OR = " OR ";
	private static final String ON = " ON ";

	private final StatementKind kind;
	private final String table;

	private boolean distinct = false;

	private final List<String> fields = new ArrayList<>();
	private final List<String> joins = new ArrayList<>();
	private final List<String> sets = new ArrayList<>();
	private final List<String> values = new ArrayList<>();
	private final List<String> groupBy = new ArrayList<>();
	private final List<String> wheres = new ArrayList<>();
	private final List<String> unions = new ArrayList<>();
	private final List<String> orderBy = new ArrayList<>();

	private @Nullable String select;
	private @Nullable String having;
	private @Nullable Long limit;
	private @Nullable Long offset;

	Statement(StatementKind kind, String table) {

		Assert.notNull(kind, "StatementKind must not be null!");
		Assert.notNull(table, "Table must not be null!");

		this.kind = kind;
		this.table = table;
	}

	public StatementKind getKind() {
		return kind;
	}

	/**
	 * @return the table, table list or subquery expression. May be empty, which renderers reject.
	 */
	public String getTable() {
		return table;
	}

	public boolean isDistinct() {
		return distinct;
	}

	public List<String> getFields() {
		return Collections.unmodifiableList(fields);
	}

	/**
	 * @return join fragments such as {@code LEFT JOIN shops AS s ON b.id = s.book}.
	 */
	public List<String> getJoins() {
		return Collections.unmodifiableList(joins);
	}

	/**
	 * @return {@code field = value} assignments.
	 */
	public List<String> getSets() {
		return Collections.unmodifiableList(sets);
	}

	/**
	 * @return parenthesized value tuples such as {@code ('Don Quixote', 200)}.
	 */
	public List<String> getValues() {
		return Collections.unmodifiableList(values);
	}

	/**
	 * @return the raw query used as {@code INSERT} source instead of {@code VALUES}.
	 */
	@Nullable
	public String getSelect() {
		return select;
	}

	public List<String> getGroupBy() {
		return Collections.unmodifiableList(groupBy);
	}

	@Nullable
	public String getHaving() {
		return having;
	}

	/**
	 * @return top-level conditions. Each entry is a complete OR-chain; entries are combined with {@code AND}.
	 */
	public List<String> getWheres() {
		return Collections.unmodifiableList(wheres);
	}

	/**
	 * @return {@code UNION} and {@code UNION ALL} fragments appended after the query.
	 */
	public List<String> getUnions() {
		return Collections.unmodifiableList(unions);
	}

	public List<String> getOrderBy() {
		return Collections.unmodifiableList(orderBy);
	}

	public OptionalLong getLimit() {
		return limit == null ? OptionalLong.empty() : OptionalLong.of(limit);
	}

	public OptionalLong getOffset() {
		return offset == null ? OptionalLong.empty() : OptionalLong.of(offset);
	}

	void setDistinct(boolean distinct) {
		this.distinct = distinct;
	}

	void addField(String field) {
		fields.add(field);
	}

	void replaceFields(Collection<String> fields) {

		this.fields.clear();
		this.fields.addAll(fields);
	}

	void addJoin(String join) {
		joins.add(join);
	}

	/**
	 * Append {@code ON <constraint>} to the most recent join. Does nothing if no join was added yet.
	 */
	void constrainLastJoin(String constraint) {

		if (joins.isEmpty()) {
			return;
		}

		int last = joins.size() - 1;
		joins.set(last, joins.get(last) + ON + constraint);
	}

	void addSet(String assignment) {
		sets.add(assignment);
	}

	void addValues(String tuple) {
		values.add(tuple);
	}

	void setSelect(String select) {
		this.select = select;
	}

	void addGroupBy(String expression) {
		groupBy.add(expression);
	}

	void setHaving(String condition) {
		this.having = condition;
	}

	void addWhere(String condition) {
		wheres.add(condition);
	}

	/**
	 * Extend the most recent condition with {@code OR <condition>}. Starts a new condition if there is none.
	 */
	void extendLastWhere(String condition) {

		if (wheres.isEmpty()) {
			wheres.add(condition);
			return;
		}

		int last = wheres.size() - 1;
		wheres.set(last, wheres.get(last) + OR + condition);
	}

	void addUnion(String union) {
		unions.add(union);
	}

	void addOrderBy(String order) {
		orderBy.add(order);
	}

	void setLimit(long limit) {
		this.limit = limit;
	}

	void setOffset(long offset) {
		this.offset = offset;
	}

	@Override
	public String toString() {
		return "Statement[" + kind + " " + table + "]";
	}
}
