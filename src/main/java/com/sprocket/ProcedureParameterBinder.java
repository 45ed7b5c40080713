/*
 * Copyright 2026 The Sprocket Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.sprocket;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import java.sql.CallableStatement;
import java.sql.SQLException;
import java.time.ZoneId;

import static java.util.Objects.requireNonNull;

/**
 * Contract for binding parameter values to a {@link CallableStatement}.
 * <p>
 * A production-ready concrete implementation is available via the following static methods:
 * <ul>
 *   <li>{@link #withDefaultConfiguration()}</li>
 *   <li>{@link #withTimeZone(ZoneId)} (builder)</li>
 * </ul>
 * <p>
 * Implementations should be threadsafe.
 *
 * @since 1.0.0
 */
public interface ProcedureParameterBinder {
	/**
	 * Binds a single value.
	 *
	 * @param callableStatement the statement to bind to
	 * @param parameterIndex    1-based index of the placeholder
	 * @param parameter         the value, may be {@code null}
	 * @param declaredParameter the parameter's declaration, if the procedure's signature is known
	 * @throws SQLException if the driver rejects the value
	 */
	void bindParameter(@NonNull CallableStatement callableStatement,
										 @NonNull Integer parameterIndex,
										 @Nullable Object parameter,
										 @Nullable ProcedureParameter declaredParameter) throws SQLException;

	/**
	 * Registers an {@code OUT} or {@code INOUT} parameter so the call can be executed.
	 * <p>
	 * Output values are never read.
	 *
	 * @param callableStatement the statement to register with
	 * @param declaredParameter the parameter's declaration
	 * @throws SQLException if the driver rejects the registration
	 */
	default void registerOutParameter(@NonNull CallableStatement callableStatement,
																		@NonNull ProcedureParameter declaredParameter) throws SQLException {
		requireNonNull(callableStatement);
		requireNonNull(declaredParameter);

		callableStatement.registerOutParameter(declaredParameter.getPosition(), declaredParameter.getSqlType());
	}

	/**
	 * Acquires a builder specifying the zone used when an instant must be bound to a zone-less column.
	 *
	 * @param timeZone the zone to apply
	 * @return a {@code Builder} for a concrete implementation
	 */
	@NonNull
	static Builder withTimeZone(@NonNull ZoneId timeZone) {
		requireNonNull(timeZone);
		return new Builder().timeZone(timeZone);
	}

	@NonNull
	static ProcedureParameterBinder withDefaultConfiguration() {
		return new Builder().build();
	}

	/**
	 * Builder used to construct a standard implementation of {@link ProcedureParameterBinder}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	class Builder {
		@NonNull
		ZoneId timeZone;

		private Builder() {
			this.timeZone = ZoneId.systemDefault();
		}

		@NonNull
		public Builder timeZone(@NonNull ZoneId timeZone) {
			requireNonNull(timeZone);
			this.timeZone = timeZone;
			return this;
		}

		@NonNull
		public ProcedureParameterBinder build() {
			return new DefaultProcedureParameterBinder(this);
		}
	}
}
