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

/**
 * Thrown when a {@link Statement} lacks a part that is required to render it. Checks run at render time only;
 * accumulating clauses never fails.
 */
public class IncompleteStatementException extends IllegalStateException {

	private static final long serialVersionUID = 4624171839531478612L;

	private final Reason reason;

	public IncompleteStatementException(Reason reason) {

		super(reason.getDescription());

		this.reason = reason;
	}

	public Reason getReason() {
		return reason;
	}

	/**
	 * The missing statement part.
	 */
	public enum Reason {

		/**
		 * The table name is missing or empty. Applies to every {@link StatementKind}.
		 */
		NO_TABLE_NAME("no table name"),

		/**
		 * An {@code INSERT} has neither value tuples nor a {@code SELECT} source.
		 */
		NO_VALUES("no values"),

		/**
		 * An {@code UPDATE} has no {@code SET} assignment.
		 */
		NO_SET_FIELDS("no set fields");

		private final String description;

		Reason(String description) {
			this.description = description;
		}

		public String getDescription() {
			return description;
		}
	}
}
