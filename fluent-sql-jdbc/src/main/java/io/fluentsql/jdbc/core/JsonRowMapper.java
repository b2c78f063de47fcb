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

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.JdbcUtils;
import org.springframework.util.Assert;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * {@link RowMapper} that maps all columns of a row to a list of {@link JsonNode}s in column order.
 *
 * @see JsonValueConverter
 */
public class JsonRowMapper implements RowMapper<List<JsonNode>> {

	private final JsonValueConverter converter;

	public JsonRowMapper(JsonValueConverter converter) {

		Assert.notNull(converter, "JsonValueConverter must not be null!");

		this.converter = converter;
	}

	@Override
	public List<JsonNode> mapRow(ResultSet rs, int rowNum) throws SQLException {

		int columnCount = rs.getMetaData().getColumnCount();
		List<JsonNode> row = new ArrayList<>(columnCount);

		for (int index = 1; index <= columnCount; index++) {
			row.add(getColumnValue(rs, index));
		}

		return row;
	}

	/**
	 * Read and convert the value of the first column.
	 */
	JsonNode mapFirstColumn(ResultSet rs) throws SQLException {
		return getColumnValue(rs, 1);
	}

	private JsonNode getColumnValue(ResultSet rs, int index) throws SQLException {
		return converter.convert(JdbcUtils.getResultSetValue(rs, index));
	}
}
