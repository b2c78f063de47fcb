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

import java.util.Collections;
import java.util.List;
import java.util.stream.Stream;

import javax.sql.DataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.dao.TypeMismatchDataAccessException;
import org.springframework.jdbc.core.JdbcOperations;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.util.Assert;

import com.fasterxml.jackson.databind.JsonNode;

import io.fluentsql.relational.core.sql.SqlBuilder;

/**
 * {@link SqlBuilderOperations} implementation delegating to {@link JdbcOperations}. Connections are obtained from the
 * underlying {@link DataSource} per operation, so a pooling {@link DataSource} is recommended. Each statement is
 * logged at {@code DEBUG} level before it is executed.
 * <p/>
 * Instances are thread-safe once configured.
 */
public class SqlBuilderTemplate implements SqlBuilderOperations {

	private static final Logger logger = LoggerFactory.getLogger(SqlBuilderTemplate.class);

	private final JdbcOperations jdbcOperations;
	private final JsonRowMapper rowMapper;

	/**
	 * Creates a new {@link SqlBuilderTemplate} given a {@link DataSource}.
	 *
	 * @param dataSource must not be {@literal null}.
	 */
	public SqlBuilderTemplate(DataSource dataSource) {
		this(new JdbcTemplate(dataSource));
	}

	/**
	 * Creates a new {@link SqlBuilderTemplate} given {@link JdbcOperations}.
	 *
	 * @param jdbcOperations must not be {@literal null}.
	 */
	public SqlBuilderTemplate(JdbcOperations jdbcOperations) {
		this(jdbcOperations, new JsonValueConverter());
	}

	/**
	 * Creates a new {@link SqlBuilderTemplate} given {@link JdbcOperations} and {@link JsonValueConverter}.
	 *
	 * @param jdbcOperations must not be {@literal null}.
	 * @param converter must not be {@literal null}.
	 */
	public SqlBuilderTemplate(JdbcOperations jdbcOperations, JsonValueConverter converter) {

		Assert.notNull(jdbcOperations, "JdbcOperations must not be null!");
		Assert.notNull(converter, "JsonValueConverter must not be null!");

		this.jdbcOperations = jdbcOperations;
		this.rowMapper = new JsonRowMapper(converter);
	}

	/**
	 * @return the underlying {@link JdbcOperations}.
	 */
	public JdbcOperations getJdbcOperations() {
		return jdbcOperations;
	}

	@Override
	public void exec(SqlBuilder builder) throws DataAccessException {

		String sql = render(builder);
		logger.debug("Exec sql = {}", sql);

		jdbcOperations.execute(sql);
	}

	@Override
	public List<List<JsonNode>> get(SqlBuilder builder) throws DataAccessException {

		String sql = render(builder);
		logger.debug("Get rows sql = {}", sql);

		return jdbcOperations.query(sql, rowMapper);
	}

	@Override
	public List<JsonNode> getRow(SqlBuilder builder) throws DataAccessException {

		String sql = render(builder);
		logger.debug("Get row sql = {}", sql);

		List<JsonNode> row = jdbcOperations.query(sql, rs -> rs.next() ? rowMapper.mapRow(rs, 0) : null);

		return row != null ? row : Collections.emptyList();
	}

	@Override
	public JsonNode getValue(SqlBuilder builder) throws DataAccessException {

		String sql = render(builder);
		logger.debug("Get value sql = {}", sql);

		JsonNode value = jdbcOperations.query(sql, rs -> rs.next() ? rowMapper.mapFirstColumn(rs) : null);

		if (value == null) {
			throw new EmptyResultDataAccessException("No any value", 1);
		}

		return value;
	}

	@Override
	public long getInt(SqlBuilder builder) throws DataAccessException {

		JsonNode value = getValue(builder);

		if (!value.isIntegralNumber()) {
			throw new TypeMismatchDataAccessException("Expected an integer value but got " + value.getNodeType());
		}

		return value.longValue();
	}

	@Override
	public String getStr(SqlBuilder builder) throws DataAccessException {

		JsonNode value = getValue(builder);

		if (!value.isTextual()) {
			throw new TypeMismatchDataAccessException("Expected a text value but got " + value.getNodeType());
		}

		return value.textValue();
	}

	@Override
	public Stream<List<JsonNode>> stream(SqlBuilder builder) throws DataAccessException {

		String sql = render(builder);
		logger.debug("Get cursor sql = {}", sql);

		return jdbcOperations.queryForStream(sql, rowMapper);
	}

	private static String render(SqlBuilder builder) {

		Assert.notNull(builder, "SqlBuilder must not be null!");

		return builder.sql();
	}
}
