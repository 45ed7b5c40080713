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
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.joining;

/**
 * A log of one stored procedure call: what was called, how long each phase took, and how it ended.
 * <p>
 * Delivered to the configured {@link ProcedureCallLogger} exactly once per call, whether it succeeded or failed.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class ProcedureCallLog {
	@NonNull
	private final ProcedureCall procedureCall;
	@NonNull
	private final Duration totalDuration;
	@Nullable
	private final Duration connectionAcquisitionDuration;
	@Nullable
	private final Duration preparationDuration;
	@Nullable
	private final Duration executionDuration;
	@Nullable
	private final Duration resultSetMappingDuration;
	@Nullable
	private final Integer rowCount;
	@NonNull
	private final Integer fieldMappingFailureCount;
	@Nullable
	private final Exception exception;

	private ProcedureCallLog(@NonNull Builder builder) {
		requireNonNull(builder);

		this.procedureCall = requireNonNull(builder.procedureCall);
		this.connectionAcquisitionDuration = builder.connectionAcquisitionDuration;
		this.preparationDuration = builder.preparationDuration;
		this.executionDuration = builder.executionDuration;
		this.resultSetMappingDuration = builder.resultSetMappingDuration;
		this.rowCount = builder.rowCount;
		this.fieldMappingFailureCount = builder.fieldMappingFailureCount;
		this.exception = builder.exception;

		Duration totalDuration = Duration.ZERO;

		if (this.connectionAcquisitionDuration != null)
			totalDuration = totalDuration.plus(this.connectionAcquisitionDuration);

		if (this.preparationDuration != null)
			totalDuration = totalDuration.plus(this.preparationDuration);

		if (this.executionDuration != null)
			totalDuration = totalDuration.plus(this.executionDuration);

		if (this.resultSetMappingDuration != null)
			totalDuration = totalDuration.plus(this.resultSetMappingDuration);

		this.totalDuration = totalDuration;
	}

	@NonNull
	public static Builder withProcedureCall(@NonNull ProcedureCall procedureCall) {
		requireNonNull(procedureCall);
		return new Builder(procedureCall);
	}

	@Override
	public String toString() {
		List<String> components = new ArrayList<>(9);

		components.add(format("procedureCall=%s", getProcedureCall()));
		components.add(format("totalDuration=%s", getTotalDuration()));

		getConnectionAcquisitionDuration().ifPresent(duration -> components.add(format("connectionAcquisitionDuration=%s", duration)));
		getPreparationDuration().ifPresent(duration -> components.add(format("preparationDuration=%s", duration)));
		getExecutionDuration().ifPresent(duration -> components.add(format("executionDuration=%s", duration)));
		getResultSetMappingDuration().ifPresent(duration -> components.add(format("resultSetMappingDuration=%s", duration)));
		getRowCount().ifPresent(rowCount -> components.add(format("rowCount=%d", rowCount)));

		if (getFieldMappingFailureCount() > 0)
			components.add(format("fieldMappingFailureCount=%d", getFieldMappingFailureCount()));

		getException().ifPresent(exception -> components.add(format("exception=%s", exception)));

		return format("%s{%s}", getClass().getSimpleName(), components.stream().collect(joining(", ")));
	}

	@NonNull
	public ProcedureCall getProcedureCall() {
		return this.procedureCall;
	}

	@NonNull
	public Duration getTotalDuration() {
		return this.totalDuration;
	}

	@NonNull
	public Optional<Duration> getConnectionAcquisitionDuration() {
		return Optional.ofNullable(this.connectionAcquisitionDuration);
	}

	/**
	 * @return time spent reading the procedure's signature, preparing the call and binding parameters
	 */
	@NonNull
	public Optional<Duration> getPreparationDuration() {
		return Optional.ofNullable(this.preparationDuration);
	}

	@NonNull
	public Optional<Duration> getExecutionDuration() {
		return Optional.ofNullable(this.executionDuration);
	}

	/**
	 * @return time spent materializing and mapping rows
	 */
	@NonNull
	public Optional<Duration> getResultSetMappingDuration() {
		return Optional.ofNullable(this.resultSetMappingDuration);
	}

	/**
	 * @return how many rows were materialized, if the call got that far
	 */
	@NonNull
	public Optional<Integer> getRowCount() {
		return Optional.ofNullable(this.rowCount);
	}

	@NonNull
	public Integer getFieldMappingFailureCount() {
		return this.fieldMappingFailureCount;
	}

	@NonNull
	public Optional<Exception> getException() {
		return Optional.ofNullable(this.exception);
	}

	/**
	 * Builder used to construct instances of {@link ProcedureCallLog}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final ProcedureCall procedureCall;
		@Nullable
		private Duration connectionAcquisitionDuration;
		@Nullable
		private Duration preparationDuration;
		@Nullable
		private Duration executionDuration;
		@Nullable
		private Duration resultSetMappingDuration;
		@Nullable
		private Integer rowCount;
		@NonNull
		private Integer fieldMappingFailureCount;
		@Nullable
		private Exception exception;

		private Builder(@NonNull ProcedureCall procedureCall) {
			this.procedureCall = requireNonNull(procedureCall);
			this.fieldMappingFailureCount = 0;
		}

		@NonNull
		public Builder connectionAcquisitionDuration(@Nullable Duration connectionAcquisitionDuration) {
			this.connectionAcquisitionDuration = connectionAcquisitionDuration;
			return this;
		}

		@NonNull
		public Builder preparationDuration(@Nullable Duration preparationDuration) {
			this.preparationDuration = preparationDuration;
			return this;
		}

		@NonNull
		public Builder executionDuration(@Nullable Duration executionDuration) {
			this.executionDuration = executionDuration;
			return this;
		}

		@NonNull
		public Builder resultSetMappingDuration(@Nullable Duration resultSetMappingDuration) {
			this.resultSetMappingDuration = resultSetMappingDuration;
			return this;
		}

		@NonNull
		public Builder rowCount(@Nullable Integer rowCount) {
			this.rowCount = rowCount;
			return this;
		}

		@NonNull
		public Builder fieldMappingFailureCount(@NonNull Integer fieldMappingFailureCount) {
			requireNonNull(fieldMappingFailureCount);
			this.fieldMappingFailureCount = fieldMappingFailureCount;
			return this;
		}

		@NonNull
		public Builder exception(@Nullable Exception exception) {
			this.exception = exception;
			return this;
		}

		@NonNull
		public ProcedureCallLog build() {
			return new ProcedureCallLog(this);
		}
	}
}
