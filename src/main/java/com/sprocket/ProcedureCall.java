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
import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.joining;

/**
 * Data that represents a single stored procedure call.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class ProcedureCall {
	@NonNull
	private final String procedureName;
	@NonNull
	private final ConnectionDescriptor connectionDescriptor;
	@NonNull
	private final Cardinality cardinality;
	@Nullable
	private final Class<?> resultType;
	@Nullable
	private final String sql;
	@NonNull
	private final Map<String, @Nullable Object> parameters;

	private ProcedureCall(@NonNull Builder builder) {
		requireNonNull(builder);

		this.procedureName = requireNonNull(builder.procedureName);
		this.connectionDescriptor = requireNonNull(builder.connectionDescriptor);
		this.cardinality = requireNonNull(builder.cardinality);
		this.resultType = builder.resultType;
		this.sql = builder.sql;
		this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(builder.parameters));
	}

	@NonNull
	public static Builder with(@NonNull String procedureName,
														 @NonNull ConnectionDescriptor connectionDescriptor,
														 @NonNull Cardinality cardinality) {
		return new Builder(procedureName, connectionDescriptor, cardinality);
	}

	@Override
	public String toString() {
		List<String> components = new ArrayList<>(6);

		components.add(format("procedureName=%s", getProcedureName()));
		components.add(format("connection=%s", getConnectionDescriptor().getDescription()));
		components.add(format("cardinality=%s", getCardinality().name()));

		Class<?> resultType = getResultType().orElse(null);

		if (resultType != null)
			components.add(format("resultType=%s", resultType.getName()));

		String sql = getSql().orElse(null);

		if (sql != null)
			components.add(format("sql=%s", sql));

		if (!getParameters().isEmpty())
			components.add(format("parameters=%s", getParameters().keySet()));

		return format("%s{%s}", getClass().getSimpleName(), components.stream().collect(joining(", ")));
	}

	@NonNull
	public String getProcedureName() {
		return this.procedureName;
	}

	@NonNull
	public ConnectionDescriptor getConnectionDescriptor() {
		return this.connectionDescriptor;
	}

	@NonNull
	public Cardinality getCardinality() {
		return this.cardinality;
	}

	/**
	 * @return the type rows are mapped to, or empty for {@link Cardinality#NONE}
	 */
	@NonNull
	public Optional<Class<?>> getResultType() {
		return Optional.ofNullable(this.resultType);
	}

	/**
	 * @return the JDBC call escape that was prepared, or empty if the call failed before preparation
	 */
	@NonNull
	public Optional<String> getSql() {
		return Optional.ofNullable(this.sql);
	}

	/**
	 * @return bound parameter names and values, in placeholder order
	 */
	@NonNull
	public Map<String, @Nullable Object> getParameters() {
		return this.parameters;
	}

	/**
	 * Builder used to construct instances of {@link ProcedureCall}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final String procedureName;
		@NonNull
		private final ConnectionDescriptor connectionDescriptor;
		@NonNull
		private final Cardinality cardinality;
		@Nullable
		private Class<?> resultType;
		@Nullable
		private String sql;
		@NonNull
		private Map<String, @Nullable Object> parameters;

		private Builder(@NonNull String procedureName,
										@NonNull ConnectionDescriptor connectionDescriptor,
										@NonNull Cardinality cardinality) {
			this.procedureName = requireNonNull(procedureName);
			this.connectionDescriptor = requireNonNull(connectionDescriptor);
			this.cardinality = requireNonNull(cardinality);
			this.parameters = Map.of();
		}

		@NonNull
		public Builder resultType(@Nullable Class<?> resultType) {
			this.resultType = resultType;
			return this;
		}

		@NonNull
		public Builder sql(@Nullable String sql) {
			this.sql = sql;
			return this;
		}

		@NonNull
		public Builder parameters(@NonNull Map<String, @Nullable Object> parameters) {
			requireNonNull(parameters);
			this.parameters = parameters;
			return this;
		}

		@NonNull
		public ProcedureCall build() {
			return new ProcedureCall(this);
		}
	}
}
