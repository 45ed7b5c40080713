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

import javax.annotation.concurrent.ThreadSafe;
import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Identifies the database a procedure call runs against.
 * <p>
 * Wraps either a JDBC URL (with optional credentials) or a {@link DataSource}. A fresh connection is opened for every
 * call and closed before the call returns; nothing is cached here.
 * <p>
 * {@link #toString()} and {@link #getDescription()} never reveal the password.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class ConnectionDescriptor {
	@Nullable
	private final String jdbcUrl;
	@Nullable
	private final String user;
	@Nullable
	private final String password;
	@Nullable
	private final DataSource dataSource;

	private ConnectionDescriptor(@Nullable String jdbcUrl,
															 @Nullable String user,
															 @Nullable String password,
															 @Nullable DataSource dataSource) {
		this.jdbcUrl = jdbcUrl;
		this.user = user;
		this.password = password;
		this.dataSource = dataSource;
	}

	@NonNull
	public static ConnectionDescriptor ofJdbcUrl(@NonNull String jdbcUrl) {
		return ofJdbcUrl(jdbcUrl, null, null);
	}

	/**
	 * Creates a descriptor that connects through {@link DriverManager}.
	 *
	 * @param jdbcUrl  the JDBC URL, e.g. {@code jdbc:hsqldb:mem:example}
	 * @param user     the user, or {@code null} to rely on the URL alone
	 * @param password the password, or {@code null}
	 * @return a connection descriptor
	 */
	@NonNull
	public static ConnectionDescriptor ofJdbcUrl(@NonNull String jdbcUrl,
																							 @Nullable String user,
																							 @Nullable String password) {
		requireNonNull(jdbcUrl);

		if (jdbcUrl.isBlank())
			throw new IllegalArgumentException("JDBC URL must not be blank");

		return new ConnectionDescriptor(jdbcUrl.trim(), user, password, null);
	}

	@NonNull
	public static ConnectionDescriptor ofDataSource(@NonNull DataSource dataSource) {
		requireNonNull(dataSource);
		return new ConnectionDescriptor(null, null, null, dataSource);
	}

	/**
	 * Opens a new connection. The caller owns it and must close it.
	 *
	 * @return a new connection
	 * @throws SQLException if the connection cannot be opened
	 */
	@NonNull
	public Connection openConnection() throws SQLException {
		if (this.dataSource != null)
			return this.dataSource.getConnection();

		if (this.user == null)
			return DriverManager.getConnection(this.jdbcUrl);

		return DriverManager.getConnection(this.jdbcUrl, this.user, this.password);
	}

	/**
	 * @return a human-readable, password-free description of the target database
	 */
	@NonNull
	public String getDescription() {
		if (this.dataSource != null)
			return format("DataSource %s", this.dataSource.getClass().getName());

		if (this.user == null)
			return this.jdbcUrl;

		return format("%s (user %s)", this.jdbcUrl, this.user);
	}

	@NonNull
	public Optional<String> getJdbcUrl() {
		return Optional.ofNullable(this.jdbcUrl);
	}

	@NonNull
	public Optional<String> getUser() {
		return Optional.ofNullable(this.user);
	}

	@NonNull
	public Optional<DataSource> getDataSource() {
		return Optional.ofNullable(this.dataSource);
	}

	@Override
	public String toString() {
		return format("%s{%s}", getClass().getSimpleName(), getDescription());
	}
}
