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
import java.util.stream.Collectors;

import org.springframework.util.Assert;

/**
 * Factory for common condition fragments. Operands are taken as raw SQL text, except for {@code LIKE} masks and the
 * {@code *Quoted} variants which are turned into string literals.
 *
 * @see SqlBuilder#andWhere(Object)
 * @see SqlBuilder#orWhere(Object)
 * @see SqlLiterals
 */
public abstract class Conditions {

	/**
	 * Creates a plain {@code sql} condition.
	 *
	 * @param sql the SQL, must not be {@literal null}.
	 * @return the condition text.
	 */
	public static String just(Object sql) {

		Assert.notNull(sql, "Condition must not be null!");

		return sql.toString();
	}

	/**
	 * Creates a {@code =} (equals) condition.
	 *
	 * @param field left side of the comparison.
	 * @param value right side of the comparison, rendered as given.
	 * @return the condition text.
	 */
	public static String isEqual(Object field, Object value) {
		return compare(field, "=", value);
	}

	/**
	 * Creates a {@code <>} (not equals) condition.
	 */
	public static String isNotEqual(Object field, Object value) {
		return compare(field, "<>", value);
	}

	public static String isGreater(Object field, Object value) {
		return compare(field, ">", value);
	}

	public static String isGreaterOrEqualTo(Object field, Object value) {
		return compare(field, ">=", value);
	}

	public static String isLess(Object field, Object value) {
		return compare(field, "<", value);
	}

	public static String isLessOrEqualTo(Object field, Object value) {
		return compare(field, "<=", value);
	}

	/**
	 * Creates a {@code LIKE} condition. The mask is escaped and quoted; wildcards must be part of it.
	 *
	 * @param field the field or expression to match.
	 * @param mask the {@code LIKE} pattern, e.g. {@code Harry%}.
	 * @return the condition text.
	 */
	public static String like(Object field, String mask) {
		return compare(field, "LIKE", SqlLiterals.quote(mask));
	}

	/**
	 * Creates a {@code NOT LIKE} condition.
	 *
	 * @see #like(Object, String)
	 */
	public static String notLike(Object field, String mask) {
		return compare(field, "NOT LIKE", SqlLiterals.quote(mask));
	}

	/**
	 * Creates a {@code IS NULL} condition.
	 *
	 * @param field the field or expression to check for nullability, must not be {@literal null}.
	 * @return the condition text.
	 */
	public static String isNull(Object field) {
		return text(field) + " IS NULL";
	}

	/**
	 * Creates a {@code IS NOT NULL} condition.
	 */
	public static String isNotNull(Object field) {
		return text(field) + " IS NOT NULL";
	}

	/**
	 * Creates a {@code IN} condition with the given raw values.
	 *
	 * @param field left side of the comparison.
	 * @param values the {@code IN} arguments, rendered as given.
	 * @return the condition text.
	 */
	public static String in(Object field, Collection<?> values) {
		return compare(field, "IN", "(" + join(values, false) + ")");
	}

	/**
	 * Creates a {@code IN} condition quoting every value as string literal.
	 */
	public static String inQuoted(Object field, Collection<?> values) {
		return compare(field, "IN", "(" + join(values, true) + ")");
	}

	/**
	 * Creates a {@code IN} condition for a subselect.
	 *
	 * @param field the field to compare.
	 * @param query the subselect, typically obtained from {@link SqlBuilder#query()}.
	 * @return the condition text.
	 */
	public static String inQuery(Object field, Object query) {
		return compare(field, "IN", "(" + text(query) + ")");
	}

	public static String notIn(Object field, Collection<?> values) {
		return compare(field, "NOT IN", "(" + join(values, false) + ")");
	}

	public static String notInQuoted(Object field, Collection<?> values) {
		return compare(field, "NOT IN", "(" + join(values, true) + ")");
	}

	public static String notInQuery(Object field, Object query) {
		return compare(field, "NOT IN", "(" + text(query) + ")");
	}

	/**
	 * Creates a {@code BETWEEN} condition. Bounds are rendered as given.
	 */
	public static String between(Object field, Object min, Object max) {
		return compare(field, "BETWEEN", text(min) + " AND " + text(max));
	}

	public static String notBetween(Object field, Object min, Object max) {
		return compare(field, "NOT BETWEEN", text(min) + " AND " + text(max));
	}

	static Collection<?> asList(Object... values) {

		Assert.notNull(values, "Values must not be null!");

		return Arrays.asList(values);
	}

	private static String compare(Object left, String operator, Object right) {
		return text(left) + " " + operator + " " + text(right);
	}

	private static String join(Collection<?> values, boolean quoted) {

		Assert.notNull(values, "Values must not be null!");
		Assert.noNullElements(values, "Values must not contain null elements!");

		return values.stream() //
				.map(Object::toString) //
				.map(it -> quoted ? SqlLiterals.quote(it) : it) //
				.collect(Collectors.joining(", "));
	}

	private static String text(Object value) {

		Assert.notNull(value, "Operand must not be null!");

		return value.toString();
	}

	// Utility constructor.
	private Conditions() {
	}
}
