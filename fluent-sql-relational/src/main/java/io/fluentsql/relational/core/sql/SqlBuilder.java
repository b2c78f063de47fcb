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

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import org.springframework.lang.Nullable;
import org.springframework.util.Assert;
import org.springframework.util.StringUtils;

import io.fluentsql.relational.core.sql.render.SqlRenderer;

/**
 * Fluent builder for SQL statements. Entry points are {@link #selectFrom(Object)}, {@link #insertInto(Object)},
 * {@link #updateTable(Object)}, {@link #deleteFrom(Object)} and {@link #selectValues(Object...)}. Every clause method
 * mutates this builder and returns it:
 *
 * <pre class="code">
 * String sql = SqlBuilder.selectFrom("books") //
 * 		.field("title") //
 * 		.field("price") //
 * 		.andWhere("price > 100") //
 * 		.andWhereLikeLeft("title", "Harry Potter") //
 * 		.sql();
 *
 * // SELECT title, price FROM books WHERE (price > 100) AND (title LIKE 'Harry Potter%');
 * </pre>
 *
 * Clause text is taken verbatim. Use {@link #quote(String)} to embed string literals. A builder may be rendered
 * several times and mutated in between, e.g. to render a {@code COUNT} query and then the result query with
 * {@link #setFields(Object...)}. Instances are not thread-safe.
 *
 * @see Statement
 * @see SqlRenderer
 */
public class SqlBuilder {

	private final Statement statement;

	private boolean naturalJoin = false;
	private JoinType joinType = JoinType.JOIN;

	private SqlBuilder(StatementKind kind, Object table) {

		Assert.notNull(table, "Table must not be null!");

		this.statement = new Statement(kind, table.toString());
	}

	/**
	 * Create a {@code SELECT} statement. The table may be a comma separated table list or a subquery obtained from
	 * {@link #subquery()}.
	 *
	 * @param table the table expression.
	 * @return the builder.
	 */
	public static SqlBuilder selectFrom(Object table) {
		return new SqlBuilder(StatementKind.SELECT, table);
	}

	/**
	 * Create a {@code SELECT} without table to be rendered by {@link #queryValues()}.
	 *
	 * @param values the selected values or expressions.
	 * @return the builder.
	 */
	public static SqlBuilder selectValues(Object... values) {
		return new SqlBuilder(StatementKind.SELECT, "").fields(values);
	}

	/**
	 * Create an {@code INSERT} statement.
	 *
	 * <pre class="code">
	 * SqlBuilder.insertInto("books") //
	 * 		.field("title") //
	 * 		.field("price") //
	 * 		.values(SqlBuilder.quote("In Search of Lost Time"), 150) //
	 * 		.values("'Don Quixote', 200") //
	 * 		.sql();
	 *
	 * // INSERT INTO books (title, price) VALUES ('In Search of Lost Time', 150), ('Don Quixote', 200);
	 * </pre>
	 */
	public static SqlBuilder insertInto(Object table) {
		return new SqlBuilder(StatementKind.INSERT, table);
	}

	/**
	 * Create an {@code UPDATE} statement.
	 */
	public static SqlBuilder updateTable(Object table) {
		return new SqlBuilder(StatementKind.UPDATE, table);
	}

	/**
	 * Create a {@code DELETE} statement.
	 */
	public static SqlBuilder deleteFrom(Object table) {
		return new SqlBuilder(StatementKind.DELETE, table);
	}

	/**
	 * @see SqlLiterals#escape(String)
	 */
	public static String escape(String value) {
		return SqlLiterals.escape(value);
	}

	/**
	 * @see SqlLiterals#quote(String)
	 */
	public static String quote(String value) {
		return SqlLiterals.quote(value);
	}

	// -------------------------------------------------------------------------
	// Joins
	// -------------------------------------------------------------------------

	/**
	 * Prefix the next {@link #join(Object)} with {@code NATURAL}.
	 */
	public SqlBuilder natural() {

		this.naturalJoin = true;
		return this;
	}

	public SqlBuilder left() {
		return joinType(JoinType.LEFT);
	}

	public SqlBuilder leftOuter() {
		return joinType(JoinType.LEFT_OUTER);
	}

	public SqlBuilder right() {
		return joinType(JoinType.RIGHT);
	}

	public SqlBuilder inner() {
		return joinType(JoinType.INNER);
	}

	public SqlBuilder cross() {
		return joinType(JoinType.CROSS);
	}

	/**
	 * Set the operator of the next {@link #join(Object)}. The last call before {@code join} wins.
	 *
	 * @param joinType the join operator.
	 * @return this builder.
	 */
	public SqlBuilder joinType(JoinType joinType) {

		Assert.notNull(joinType, "JoinType must not be null!");

		this.joinType = joinType;
		return this;
	}

	/**
	 * Join with a table using the pending {@link #natural()} flag and join operator, both of which are reset
	 * afterwards. Add the join constraint with {@link #on(Object)}:
	 *
	 * <pre class="code">
	 * SqlBuilder.selectFrom("books AS b").field("b.title").left().join("shops AS s").on("b.id = s.book").sql();
	 *
	 * // SELECT b.title FROM books AS b LEFT JOIN shops AS s ON b.id = s.book;
	 * </pre>
	 *
	 * @param table the table to join.
	 * @return this builder.
	 */
	public SqlBuilder join(Object table) {

		Assert.notNull(table, "Join table must not be null!");

		StringBuilder join = new StringBuilder();
		if (naturalJoin) {
			join.append("NATURAL ");
		}
		join.append(joinType.getPrefix()).append("JOIN ").append(table);

		statement.addJoin(join.toString());

		this.naturalJoin = false;
		this.joinType = JoinType.JOIN;

		return this;
	}

	/**
	 * Join with a table giving operator and constraint as raw text, e.g.
	 * {@code join("shops AS s", "LEFT OUTER", "ON b.id = s.book")}. Pending join flags are left untouched.
	 *
	 * @param table the table to join.
	 * @param operator optional operator rendered in front of {@code JOIN}.
	 * @param constraint optional constraint including its {@code ON} or {@code USING} keyword.
	 * @return this builder.
	 */
	public SqlBuilder join(Object table, @Nullable String operator, @Nullable String constraint) {

		Assert.notNull(table, "Join table must not be null!");

		StringBuilder join = new StringBuilder();
		if (StringUtils.hasText(operator)) {
			join.append(operator).append(' ');
		}
		join.append("JOIN ").append(table);
		if (StringUtils.hasText(constraint)) {
			join.append(' ').append(constraint);
		}

		statement.addJoin(join.toString());
		return this;
	}

	/**
	 * Add the {@code ON} constraint to the most recent join. Without a preceding join this call has no effect.
	 */
	public SqlBuilder on(Object constraint) {

		statement.constrainLastJoin(Conditions.just(constraint));
		return this;
	}

	/**
	 * Add an {@code ON left = right} constraint to the most recent join.
	 */
	public SqlBuilder onEq(Object left, Object right) {

		statement.constrainLastJoin(Conditions.isEqual(left, right));
		return this;
	}

	// -------------------------------------------------------------------------
	// Fields, SET and VALUES
	// -------------------------------------------------------------------------

	/**
	 * Select distinct rows only. Rendered for {@code SELECT} statements.
	 */
	public SqlBuilder distinct() {

		statement.setDistinct(true);
		return this;
	}

	public SqlBuilder field(Object field) {

		statement.addField(text(field, "Field"));
		return this;
	}

	public SqlBuilder fields(Object... fields) {
		return fields(Arrays.asList(fields));
	}

	public SqlBuilder fields(Collection<?> fields) {

		texts(fields, "Fields").forEach(statement::addField);
		return this;
	}

	/**
	 * Replace all fields with the given one.
	 */
	public SqlBuilder setField(Object field) {

		statement.replaceFields(Collections.singletonList(text(field, "Field")));
		return this;
	}

	/**
	 * Replace all fields with the given ones.
	 */
	public SqlBuilder setFields(Object... fields) {
		return setFields(Arrays.asList(fields));
	}

	public SqlBuilder setFields(Collection<?> fields) {

		statement.replaceFields(texts(fields, "Fields"));
		return this;
	}

	/**
	 * Add a {@code field = value} assignment to an {@code UPDATE}. The value is rendered as given so that numbers and
	 * expressions such as {@code price + 10} work.
	 *
	 * @see #setStr(Object, String)
	 */
	public SqlBuilder set(Object field, Object value) {

		statement.addSet(Conditions.isEqual(field, value));
		return this;
	}

	/**
	 * Add a {@code field = 'value'} assignment with the value escaped and quoted as string literal.
	 */
	public SqlBuilder setStr(Object field, String value) {
		return set(field, SqlLiterals.quote(value));
	}

	/**
	 * Add one value tuple to an {@code INSERT}. Values are rendered as given, joined with {@code ", "}.
	 */
	public SqlBuilder values(Object... values) {
		return values(Arrays.asList(values));
	}

	public SqlBuilder values(Collection<?> values) {

		statement.addValues("(" + String.join(", ", texts(values, "Values")) + ")");
		return this;
	}

	/**
	 * Use a query as {@code INSERT} source instead of {@code VALUES}.
	 *
	 * @param query the query, typically obtained from {@link #query()}.
	 * @return this builder.
	 */
	public SqlBuilder select(Object query) {

		statement.setSelect(text(query, "Query"));
		return this;
	}

	// -------------------------------------------------------------------------
	// GROUP BY and HAVING
	// -------------------------------------------------------------------------

	public SqlBuilder groupBy(Object field) {

		statement.addGroupBy(text(field, "Group by field"));
		return this;
	}

	/**
	 * Set the {@code HAVING} condition. The last call wins.
	 */
	public SqlBuilder having(Object condition) {

		statement.setHaving(Conditions.just(condition));
		return this;
	}

	// -------------------------------------------------------------------------
	// WHERE: AND
	// -------------------------------------------------------------------------

	/**
	 * Add a condition. Conditions added with {@code andWhere*} are combined with {@code AND}.
	 *
	 * @param condition the condition text.
	 * @return this builder.
	 */
	public SqlBuilder andWhere(Object condition) {
		return and(Conditions.just(condition));
	}

	public SqlBuilder andWhereEq(Object field, Object value) {
		return and(Conditions.isEqual(field, value));
	}

	public SqlBuilder andWhereNe(Object field, Object value) {
		return and(Conditions.isNotEqual(field, value));
	}

	public SqlBuilder andWhereGt(Object field, Object value) {
		return and(Conditions.isGreater(field, value));
	}

	public SqlBuilder andWhereGe(Object field, Object value) {
		return and(Conditions.isGreaterOrEqualTo(field, value));
	}

	public SqlBuilder andWhereLt(Object field, Object value) {
		return and(Conditions.isLess(field, value));
	}

	public SqlBuilder andWhereLe(Object field, Object value) {
		return and(Conditions.isLessOrEqualTo(field, value));
	}

	/**
	 * Add {@code field LIKE 'mask'} with the mask used as given.
	 */
	public SqlBuilder andWhereLike(Object field, String mask) {
		return and(Conditions.like(field, mask));
	}

	/**
	 * Add {@code field LIKE 'mask%'}.
	 */
	public SqlBuilder andWhereLikeLeft(Object field, String mask) {
		return and(Conditions.like(field, startingWith(mask)));
	}

	/**
	 * Add {@code field LIKE '%mask'}.
	 */
	public SqlBuilder andWhereLikeRight(Object field, String mask) {
		return and(Conditions.like(field, endingWith(mask)));
	}

	/**
	 * Add {@code field LIKE '%mask%'}.
	 */
	public SqlBuilder andWhereLikeAny(Object field, String mask) {
		return and(Conditions.like(field, containing(mask)));
	}

	public SqlBuilder andWhereNotLike(Object field, String mask) {
		return and(Conditions.notLike(field, mask));
	}

	public SqlBuilder andWhereNotLikeLeft(Object field, String mask) {
		return and(Conditions.notLike(field, startingWith(mask)));
	}

	public SqlBuilder andWhereNotLikeRight(Object field, String mask) {
		return and(Conditions.notLike(field, endingWith(mask)));
	}

	public SqlBuilder andWhereNotLikeAny(Object field, String mask) {
		return and(Conditions.notLike(field, containing(mask)));
	}

	public SqlBuilder andWhereIsNull(Object field) {
		return and(Conditions.isNull(field));
	}

	public SqlBuilder andWhereIsNotNull(Object field) {
		return and(Conditions.isNotNull(field));
	}

	public SqlBuilder andWhereIn(Object field, Object... values) {
		return and(Conditions.in(field, Conditions.asList(values)));
	}

	public SqlBuilder andWhereInQuoted(Object field, Object... values) {
		return and(Conditions.inQuoted(field, Conditions.asList(values)));
	}

	public SqlBuilder andWhereInQuery(Object field, Object query) {
		return and(Conditions.inQuery(field, query));
	}

	public SqlBuilder andWhereNotIn(Object field, Object... values) {
		return and(Conditions.notIn(field, Conditions.asList(values)));
	}

	public SqlBuilder andWhereNotInQuoted(Object field, Object... values) {
		return and(Conditions.notInQuoted(field, Conditions.asList(values)));
	}

	public SqlBuilder andWhereNotInQuery(Object field, Object query) {
		return and(Conditions.notInQuery(field, query));
	}

	public SqlBuilder andWhereBetween(Object field, Object min, Object max) {
		return and(Conditions.between(field, min, max));
	}

	public SqlBuilder andWhereNotBetween(Object field, Object min, Object max) {
		return and(Conditions.notBetween(field, min, max));
	}

	// -------------------------------------------------------------------------
	// WHERE: OR
	// -------------------------------------------------------------------------

	/**
	 * Extend the most recently added condition with {@code OR condition}. {@code OR} thus binds tighter than the
	 * {@code AND} between separate {@code andWhere*} calls:
	 *
	 * <pre class="code">
	 * SqlBuilder.selectFrom("books").andWhere("price < 10").orWhere("price > 1000").andWhereIsNotNull("title").sql();
	 *
	 * // SELECT * FROM books WHERE (price < 10 OR price > 1000) AND (title IS NOT NULL);
	 * </pre>
	 *
	 * Starts a new condition if none was added yet.
	 *
	 * @param condition the condition text.
	 * @return this builder.
	 */
	public SqlBuilder orWhere(Object condition) {
		return or(Conditions.just(condition));
	}

	public SqlBuilder orWhereEq(Object field, Object value) {
		return or(Conditions.isEqual(field, value));
	}

	public SqlBuilder orWhereNe(Object field, Object value) {
		return or(Conditions.isNotEqual(field, value));
	}

	public SqlBuilder orWhereGt(Object field, Object value) {
		return or(Conditions.isGreater(field, value));
	}

	public SqlBuilder orWhereGe(Object field, Object value) {
		return or(Conditions.isGreaterOrEqualTo(field, value));
	}

	public SqlBuilder orWhereLt(Object field, Object value) {
		return or(Conditions.isLess(field, value));
	}

	public SqlBuilder orWhereLe(Object field, Object value) {
		return or(Conditions.isLessOrEqualTo(field, value));
	}

	public SqlBuilder orWhereLike(Object field, String mask) {
		return or(Conditions.like(field, mask));
	}

	public SqlBuilder orWhereLikeLeft(Object field, String mask) {
		return or(Conditions.like(field, startingWith(mask)));
	}

	public SqlBuilder orWhereLikeRight(Object field, String mask) {
		return or(Conditions.like(field, endingWith(mask)));
	}

	public SqlBuilder orWhereLikeAny(Object field, String mask) {
		return or(Conditions.like(field, containing(mask)));
	}

	public SqlBuilder orWhereNotLike(Object field, String mask) {
		return or(Conditions.notLike(field, mask));
	}

	public SqlBuilder orWhereNotLikeLeft(Object field, String mask) {
		return or(Conditions.notLike(field, startingWith(mask)));
	}

	public SqlBuilder orWhereNotLikeRight(Object field, String mask) {
		return or(Conditions.notLike(field, endingWith(mask)));
	}

	public SqlBuilder orWhereNotLikeAny(Object field, String mask) {
		return or(Conditions.notLike(field, containing(mask)));
	}

	public SqlBuilder orWhereIsNull(Object field) {
		return or(Conditions.isNull(field));
	}

	public SqlBuilder orWhereIsNotNull(Object field) {
		return or(Conditions.isNotNull(field));
	}

	public SqlBuilder orWhereIn(Object field, Object... values) {
		return or(Conditions.in(field, Conditions.asList(values)));
	}

	public SqlBuilder orWhereInQuoted(Object field, Object... values) {
		return or(Conditions.inQuoted(field, Conditions.asList(values)));
	}

	public SqlBuilder orWhereInQuery(Object field, Object query) {
		return or(Conditions.inQuery(field, query));
	}

	public SqlBuilder orWhereNotIn(Object field, Object... values) {
		return or(Conditions.notIn(field, Conditions.asList(values)));
	}

	public SqlBuilder orWhereNotInQuoted(Object field, Object... values) {
		return or(Conditions.notInQuoted(field, Conditions.asList(values)));
	}

	public SqlBuilder orWhereNotInQuery(Object field, Object query) {
		return or(Conditions.notInQuery(field, query));
	}

	public SqlBuilder orWhereBetween(Object field, Object min, Object max) {
		return or(Conditions.between(field, min, max));
	}

	public SqlBuilder orWhereNotBetween(Object field, Object min, Object max) {
		return or(Conditions.notBetween(field, min, max));
	}

	// -------------------------------------------------------------------------
	// UNION, ORDER BY, LIMIT and OFFSET
	// -------------------------------------------------------------------------

	/**
	 * Append {@code UNION query} after the rendered query. Only the last query of a union may carry
	 * {@code ORDER BY}, {@code LIMIT} and {@code OFFSET}.
	 */
	public SqlBuilder union(Object query) {

		statement.addUnion("UNION " + text(query, "Query"));
		return this;
	}

	public SqlBuilder unionAll(Object query) {

		statement.addUnion("UNION ALL " + text(query, "Query"));
		return this;
	}

	public SqlBuilder orderBy(Object field, boolean desc) {

		String order = text(field, "Order by field");
		statement.addOrderBy(desc ? order + " DESC" : order);
		return this;
	}

	public SqlBuilder orderAsc(Object field) {
		return orderBy(field, false);
	}

	public SqlBuilder orderDesc(Object field) {
		return orderBy(field, true);
	}

	public SqlBuilder limit(long limit) {

		Assert.isTrue(limit >= 0, "Limit must not be negative!");

		statement.setLimit(limit);
		return this;
	}

	public SqlBuilder offset(long offset) {

		Assert.isTrue(offset >= 0, "Offset must not be negative!");

		statement.setOffset(offset);
		return this;
	}

	// -------------------------------------------------------------------------
	// Rendering
	// -------------------------------------------------------------------------

	/**
	 * Render the complete statement terminated with {@code ;}.
	 *
	 * @return the SQL statement.
	 * @throws IncompleteStatementException if a required part is missing.
	 */
	public String sql() {
		return query() + ";";
	}

	/**
	 * Render the statement as fragment without trailing {@code ;}, e.g. to pass it to {@link #select(Object)},
	 * {@link #union(Object)} or {@link #andWhereInQuery(Object, Object)} of another builder.
	 *
	 * @return the SQL fragment.
	 * @throws IncompleteStatementException if a required part is missing.
	 */
	public String query() {
		return SqlRenderer.create(statement).render();
	}

	/**
	 * Render the statement as parenthesized subquery, e.g. {@code (SELECT ...)}.
	 */
	public String subquery() {
		return "(" + query() + ")";
	}

	/**
	 * Render the statement as parenthesized subquery with alias, e.g. {@code (SELECT ...) AS name}.
	 */
	public String subqueryAs(Object name) {
		return subquery() + " AS " + text(name, "Subquery name");
	}

	/**
	 * Render {@code SELECT} with fields only and without {@code FROM}, e.g. for a builder created with
	 * {@link #selectValues(Object...)}. Does not require a table.
	 */
	public String queryValues() {
		return SqlRenderer.create(statement).renderValues();
	}

	/**
	 * @return the accumulated statement.
	 */
	public Statement getStatement() {
		return statement;
	}

	@Override
	public String toString() {
		return "SqlBuilder[" + statement + "]";
	}

	private SqlBuilder and(String condition) {

		statement.addWhere(condition);
		return this;
	}

	private SqlBuilder or(String condition) {

		statement.extendLastWhere(condition);
		return this;
	}

	private static String startingWith(String mask) {
		return mask + "%";
	}

	private static String endingWith(String mask) {
		return "%" + mask;
	}

	private static String containing(String mask) {
		return "%" + mask + "%";
	}

	private static String text(Object value, String name) {

		Assert.notNull(value, () -> name + " must not be null!");

		return value.toString();
	}

	private static List<String> texts(Collection<?> values, String name) {

		Assert.notNull(values, () -> name + " must not be null!");
		Assert.noNullElements(values, () -> name + " must not contain null elements!");

		return values.stream().map(Object::toString).collect(Collectors.toList());
	}
}
