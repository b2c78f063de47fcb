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
package io.fluentsql.jdbc.core;

import java.util.List;
import java.util.stream.Stream;

import org.springframework.dao.DataAccessException;

import com.fasterxml.jackson.databind.JsonNode;

import io.fluentsql.relational.core.sql.SqlBuilder;

/**
 * Interface specifying the operations to run {@link SqlBuilder} statements against a database. Statements are
 * rendered with {@link SqlBuilder#sql()}; rendering errors surface as
 * {@link io.fluentsql.relational.core.sql.IncompleteStatementException} before a connection is obtained.
 *
 * @see SqlBuilderTemplate
 */
public interface SqlBuilderOperations {

	/**
	 * Execute a statement without result, e.g. {@code INSERT}, {@code UPDATE} or {@code DELETE}.
	 *
	 * @param builder the statement to execute.
	 * @throws DataAccessException if there is any problem executing the statement.
	 */
	void exec(SqlBuilder builder) throws DataAccessException;

	/**
	 * Query all rows.
	 *
	 * @param builder the query to execute.
	 * @return the rows, each row as list of column values.
	 * @throws UnsupportedValueTypeException if a cell value cannot be represented as JSON.
	 * @throws DataAccessException if there is any problem executing the query.
	 */
	List<List<JsonNode>> get(SqlBuilder builder) throws DataAccessException;

	/**
	 * Query the first row.
	 *
	 * @param builder the query to execute.
	 * @return the column values of the first row, or an empty list if the query returned no rows.
	 * @throws DataAccessException if there is any problem executing the query.
	 */
	List<JsonNode> getRow(SqlBuilder builder) throws DataAccessException;

	/**
	 * Query the first column of the first row.
	 *
	 * @param builder the query to execute.
	 * @return the value.
	 * @throws org.springframework.dao.EmptyResultDataAccessException if the query returned no rows.
	 * @throws DataAccessException if there is any problem executing the query.
	 */
	JsonNode getValue(SqlBuilder builder) throws DataAccessException;

	/**
	 * Query a single integer value.
	 *
	 * @param builder the query to execute.
	 * @return the value.
	 * @throws org.springframework.dao.TypeMismatchDataAccessException if the value is not an integer.
	 * @see #getValue(SqlBuilder)
	 */
	long getInt(SqlBuilder builder) throws DataAccessException;

	/**
	 * Query a single text value.
	 *
	 * @param builder the query to execute.
	 * @return the value.
	 * @throws org.springframework.dao.TypeMismatchDataAccessException if the value is not text.
	 * @see #getValue(SqlBuilder)
	 */
	String getStr(SqlBuilder builder) throws DataAccessException;

	/**
	 * Query rows lazily. The returned stream holds an open cursor and connection and must be closed, e.g. with
	 * try-with-resources.
	 *
	 * @param builder the query to execute.
	 * @return the rows.
	 * @throws DataAccessException if there is any problem executing the query.
	 */
	Stream<List<JsonNode>> stream(SqlBuilder builder) throws DataAccessException;
}
