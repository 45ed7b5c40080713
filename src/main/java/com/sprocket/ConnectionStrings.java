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
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.TreeMap;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Named {@link ConnectionDescriptor}s loaded from properties.
 * <p>
 * Each connection is configured with keys of the form:
 * <pre>
 * sprocket.connection.reporting.url=jdbc:hsqldb:mem:reporting
 * sprocket.connection.reporting.user=sa
 * sprocket.connection.reporting.password=
 * </pre>
 * Only {@code url} is required.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class ConnectionStrings {
	@NonNull
	public static final String DEFAULT_RESOURCE_NAME = "sprocket.properties";

	@NonNull
	private static final String KEY_PREFIX = "sprocket.connection.";
	@NonNull
	private static final String URL_SUFFIX = ".url";
	@NonNull
	private static final String USER_SUFFIX = ".user";
	@NonNull
	private static final String PASSWORD_SUFFIX = ".password";

	@NonNull
	private final Map<String, ConnectionDescriptor> connectionDescriptorsByName;

	private ConnectionStrings(@NonNull Map<String, ConnectionDescriptor> connectionDescriptorsByName) {
		requireNonNull(connectionDescriptorsByName);
		this.connectionDescriptorsByName = Collections.unmodifiableMap(new TreeMap<>(connectionDescriptorsByName));
	}

	/**
	 * Reads connections from already-loaded properties. Keys outside the {@code sprocket.connection.} namespace are
	 * ignored.
	 *
	 * @param properties the properties to read
	 * @return the configured connections
	 * @throws IllegalArgumentException if a connection has a {@code user} or {@code password} but no {@code url}
	 */
	@NonNull
	public static ConnectionStrings fromProperties(@NonNull Properties properties) {
		requireNonNull(properties);

		Map<String, ConnectionDescriptor> connectionDescriptorsByName = new TreeMap<>();

		for (String key : properties.stringPropertyNames()) {
			if (!key.startsWith(KEY_PREFIX))
				continue;

			String name = connectionName(key);

			if (name == null || connectionDescriptorsByName.containsKey(name))
				continue;

			String url = properties.getProperty(KEY_PREFIX + name + URL_SUFFIX);

			if (url == null || url.isBlank())
				throw new IllegalArgumentException(format("Connection '%s' is missing required property '%s'",
						name, KEY_PREFIX + name + URL_SUFFIX));

			connectionDescriptorsByName.put(name, ConnectionDescriptor.ofJdbcUrl(url,
					properties.getProperty(KEY_PREFIX + name + USER_SUFFIX),
					properties.getProperty(KEY_PREFIX + name + PASSWORD_SUFFIX)));
		}

		return new ConnectionStrings(connectionDescriptorsByName);
	}

	/**
	 * Reads connections from {@value #DEFAULT_RESOURCE_NAME} on the classpath.
	 *
	 * @return the configured connections
	 * @throws IllegalStateException if the resource does not exist
	 */
	@NonNull
	public static ConnectionStrings fromClasspath() {
		return fromClasspath(DEFAULT_RESOURCE_NAME);
	}

	/**
	 * Reads connections from a UTF-8 properties file on the classpath.
	 *
	 * @param resourceName the resource to load, e.g. {@code sprocket.properties}
	 * @return the configured connections
	 * @throws IllegalStateException if the resource does not exist
	 */
	@NonNull
	public static ConnectionStrings fromClasspath(@NonNull String resourceName) {
		requireNonNull(resourceName);

		ClassLoader classLoader = Thread.currentThread().getContextClassLoader();

		if (classLoader == null)
			classLoader = ConnectionStrings.class.getClassLoader();

		try (InputStream inputStream = classLoader.getResourceAsStream(resourceName)) {
			if (inputStream == null)
				throw new IllegalStateException(format("Unable to find classpath resource '%s'", resourceName));

			Properties properties = new Properties();

			try (Reader reader = new InputStreamReader(inputStream, StandardCharsets.UTF_8)) {
				properties.load(reader);
			}

			return fromProperties(properties);
		} catch (IOException e) {
			throw new UncheckedIOException(format("Unable to read classpath resource '%s'", resourceName), e);
		}
	}

	/**
	 * @param name the connection name
	 * @return the named connection
	 * @throws IllegalArgumentException if no connection has that name
	 */
	@NonNull
	public ConnectionDescriptor get(@NonNull String name) {
		requireNonNull(name);

		ConnectionDescriptor connectionDescriptor = this.connectionDescriptorsByName.get(name);

		if (connectionDescriptor == null)
			throw new IllegalArgumentException(format("No connection named '%s' is configured. Configured connections: %s",
					name, names()));

		return connectionDescriptor;
	}

	/**
	 * @return names of every configured connection, sorted
	 */
	@NonNull
	public Set<String> names() {
		return this.connectionDescriptorsByName.keySet();
	}

	@Nullable
	private static String connectionName(@NonNull String key) {
		String remainder = key.substring(KEY_PREFIX.length());

		for (String suffix : new String[]{URL_SUFFIX, USER_SUFFIX, PASSWORD_SUFFIX})
			if (remainder.endsWith(suffix) && remainder.length() > suffix.length())
				return remainder.substring(0, remainder.length() - suffix.length());

		return null;
	}

	@Override
	public String toString() {
		return format("%s{names=%s}", getClass().getSimpleName(), names());
	}
}
