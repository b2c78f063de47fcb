/**
 * Executes {@link io.fluentsql.relational.core.sql.SqlBuilder} statements through Spring JDBC and maps result cells
 * to Jackson {@link com.fasterxml.jackson.databind.JsonNode}s. Use {@link io.fluentsql.jdbc.core.SqlBuilderTemplate}
 * as entry point.
 */
@NonNullApi
@NonNullFields
package io.fluentsql.jdbc.core;

import org.springframework.lang.NonNullApi;
import org.springframework.lang.NonNullFields;
