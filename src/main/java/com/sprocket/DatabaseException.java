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
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static java.lang.String.format;

/**
 * Thrown when an error occurs when interacting with a database through a {@link ProcedureExecutor}.
 * <p>
 * If the {@code cause} of this exception (or any exception in its cause chain) is a {@link SQLException}, the
 * {@link #getErrorCode()} and {@link #getSqlState()} accessors are shorthand for retrieving the corresponding
 * {@link SQLException} values.
 * <p>
 * Subclasses identify which layer failed:
 * <ul>
 *   <li>{@link ConnectionException} - a connection could not be opened</li>
 *   <li>{@link ProcedureException} - the database rejected the procedure call</li>
 *   <li>{@link FieldMappingException} - a single property could not be populated from a row</li>
 * </ul>
 *
 * @since 1.0.0
 */
@NotThreadSafe
public class DatabaseException extends RuntimeException {
	@Nullable
	private final Integer errorCode;
	@Nullable
	private final String sqlState;

	/**
	 * Creates a {@code DatabaseException} with the given {@code message}.
	 *
	 * @param message a message describing this exception
	 */
	public DatabaseException(@Nullable String message) {
		this(message, null);
	}

	/**
	 * Creates a {@code DatabaseException} which wraps the given {@code cause}.
	 *
	 * @param cause the cause of this exception
	 */
	public DatabaseException(@Nullable Throwable cause) {
		this(cause == null ? null : cause.getMessage(), cause);
	}

	/**
	 * Creates a {@code DatabaseException} which wraps the given {@code cause}.
	 *
	 * @param message a message describing this exception
	 * @param cause   the cause of this exception
	 */
	public DatabaseException(@Nullable String message,
													 @Nullable Throwable cause) {
		super(message, cause);

		SQLException sqlException = findSqlException(cause);

		this.errorCode = sqlException == null ? null : sqlException.getErrorCode();
		this.sqlState = sqlException == null ? null : sqlException.getSQLState();
	}

	@Nullable
	private static SQLException findSqlException(@Nullable Throwable cause) {
		Throwable current = cause;

		while (current != null) {
			if (current instanceof SQLException sqlException)
				return sqlException;

			if (current.getCause() == current)
				break;

			current = current.getCause();
		}

		return null;
	}

	@Override
	public String toString() {
		List<String> components = new ArrayList<>(4);

		if (getMessage() != null && getMessage().trim().length() > 0)
			components.add(format("message=%s", getMessage()));

		if (getErrorCode().isPresent())
			components.add(format("errorCode=%s", getErrorCode().get()));
		if (getSqlState().isPresent())
			components.add(format("sqlState=%s", getSqlState().get()));

		components.addAll(additionalToStringComponents());

		return format("%s: %s", getClass().getName(), components.stream().collect(Collectors.joining(", ")));
	}

	/**
	 * Hook for subclasses to contribute to {@link #toString()}.
	 *
	 * @return extra {@code name=value} components, in display order
	 */
	@NonNull
	protected List<String> additionalToStringComponents() {
		return List.of();
	}

	/**
	 * Shorthand for {@link SQLException#getErrorCode()} if this exception was caused by a {@link SQLException}.
	 *
	 * @return the value of {@link SQLException#getErrorCode()}, or empty if not available
	 */
	@NonNull
	public Optional<Integer> getErrorCode() {
		return Optional.ofNullable(this.errorCode);
	}

	/**
	 * Shorthand for {@link SQLException#getSQLState()} if this exception was caused by a {@link SQLException}.
	 *
	 * @return the value of {@link SQLException#getSQLState()}, or empty if not available
	 */
	@NonNull
	public Optional<String> getSqlState() {
		return Optional.ofNullable(this.sqlState);
	}
}
