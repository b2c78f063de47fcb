/**
 * Statement Builder implementation. Use {@link io.fluentsql.relational.core.sql.SqlBuilder} as entry point to create
 * SQL statements. Builders and the {@link io.fluentsql.relational.core.sql.Statement} they accumulate are mutable.
 * <p/> Clause text is assembled verbatim. Literal values must be escaped with
 * {@link io.fluentsql.relational.core.sql.SqlLiterals}.
 */
@NonNullApi
@NonNullFields
package io.fluentsql.relational.core.sql;

import org.springframework.lang.NonNullApi;
import org.springframework.lang.NonNullFields;
