/**
 * Renderers turning a {@link io.fluentsql.relational.core.sql.Statement} into SQL text. Use
 * {@link io.fluentsql.relational.core.sql.render.SqlRenderer} as entry point.
 */
@NonNullApi
@NonNullFields
package io.fluentsql.relational.core.sql.render;

import org.springframework.lang.NonNullApi;
import org.springframework.lang.NonNullFields;
