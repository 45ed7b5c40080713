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

import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.joining;

/**
 * Basic implementation of {@link ProcedureCallLogger} which logs via java.util.logging.
 *
 * @since 1.0.0
 */
@ThreadSafe
public class DefaultProcedureCallLogger implements ProcedureCallLogger {
	@NonNull
	public static final String DEFAULT_LOGGER_NAME = "com.sprocket.SQL";
	@NonNull
	public static final Level DEFAULT_LOGGER_LEVEL = Level.FINE;

	/**
	 * The point at which we ellipsize output for parameters.
	 */
	private static final int MAXIMUM_PARAMETER_LOGGING_LENGTH = 100;

	@NonNull
	private final Logger logger;
	@NonNull
	private final Level loggerLevel;

	/**
	 * Creates a new logger with the default logger name <code>{@value #DEFAULT_LOGGER_NAME}</code> and level.
	 */
	public DefaultProcedureCallLogger() {
		this(DEFAULT_LOGGER_NAME, DEFAULT_LOGGER_LEVEL);
	}

	public DefaultProcedureCallLogger(@NonNull String loggerName,
																		@NonNull Level loggerLevel) {
		requireNonNull(loggerName);
		requireNonNull(loggerLevel);

		this.logger = Logger.getLogger(loggerName);
		this.loggerLevel = loggerLevel;
	}

	@Override
	public void log(@NonNull ProcedureCallLog procedureCallLog) {
		requireNonNull(procedureCallLog);

		if (getLogger().isLoggable(getLoggerLevel()))
			getLogger().log(getLoggerLevel(), formatProcedureCallLog(procedureCallLog));
	}

	@NonNull
	protected String formatProcedureCallLog(@NonNull ProcedureCallLog procedureCallLog) {
		requireNonNull(procedureCallLog);

		ProcedureCall procedureCall = procedureCallLog.getProcedureCall();
		List<String> timingEntries = new ArrayList<>(4);

		procedureCallLog.getConnectionAcquisitionDuration().ifPresent(duration -> timingEntries.add(format("%s acquiring connection", duration)));
		procedureCallLog.getPreparationDuration().ifPresent(duration -> timingEntries.add(format("%s preparing call", duration)));
		procedureCallLog.getExecutionDuration().ifPresent(duration -> timingEntries.add(format("%s executing call", duration)));
		procedureCallLog.getResultSetMappingDuration().ifPresent(duration -> timingEntries.add(format("%s processing resultset", duration)));

		List<String> lines = new ArrayList<>(5);

		lines.add(procedureCall.getSql().orElse(procedureCall.getProcedureName()));

		if (!procedureCall.getParameters().isEmpty())
			lines.add(format("Parameters: %s", procedureCall.getParameters().entrySet().stream()
					.map(this::formatParameter)
					.collect(joining(", "))));

		if (timingEntries.size() > 0)
			lines.add(timingEntries.stream().collect(joining(", ")));

		procedureCallLog.getRowCount().ifPresent(rowCount -> {
			if (procedureCallLog.getFieldMappingFailureCount() > 0)
				lines.add(format("%d row[s], %d field mapping failure[s]", rowCount, procedureCallLog.getFieldMappingFailureCount()));
			else
				lines.add(format("%d row[s]", rowCount));
		});

		Throwable exception = procedureCallLog.getException().orElse(null);

		if (exception != null) {
			if (exception instanceof DatabaseException && exception.getCause() != null)
				exception = exception.getCause();

			lines.add(format("Failed due to %s", exception));
		}

		return lines.stream().collect(joining("\n"));
	}

	@NonNull
	protected String formatParameter(Map.@NonNull Entry<String, Object> parameter) {
		requireNonNull(parameter);

		Object value = parameter.getValue();
		String formattedValue;

		if (value == null)
			formattedValue = "null";
		else if (value instanceof Number || value instanceof Boolean)
			formattedValue = value.toString();
		else if (value instanceof byte[] bytes)
			formattedValue = format("[byte array of length %d]", bytes.length);
		else
			formattedValue = format("'%s'", ellipsize(value.toString(), MAXIMUM_PARAMETER_LOGGING_LENGTH));

		return format("%s=%s", parameter.getKey(), formattedValue);
	}

	/**
	 * Ellipsizes the given {@code string}, capping at {@code maximumLength}.
	 *
	 * @param string        the string to ellipsize
	 * @param maximumLength the maximum length of the ellipsized string, not including ellipsis
	 * @return an ellipsized version of {@code string}
	 */
	@NonNull
	protected String ellipsize(@NonNull String string,
														 int maximumLength) {
		requireNonNull(string);

		string = string.trim();

		if (string.length() <= maximumLength)
			return string;

		return format("%s...", string.substring(0, maximumLength));
	}

	@NonNull
	protected Logger getLogger() {
		return this.logger;
	}

	@NonNull
	protected Level getLoggerLevel() {
		return this.loggerLevel;
	}
}
