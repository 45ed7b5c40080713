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
import java.util.List;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Thrown when a database connection cannot be opened for a {@link ConnectionDescriptor}.
 * <p>
 * Never retried.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public class ConnectionException extends DatabaseException {
	@NonNull
	private final ConnectionDescriptor connectionDescriptor;

	public ConnectionException(@NonNull ConnectionDescriptor connectionDescriptor,
														 @Nullable Throwable cause) {
		super(format("Unable to open database connection for %s", requireNonNull(connectionDescriptor).getDescription()), cause);
		this.connectionDescriptor = connectionDescriptor;
	}

	@Override
	@NonNull
	protected List<String> additionalToStringComponents() {
		return List.of(format("connection=%s", getConnectionDescriptor().getDescription()));
	}

	@NonNull
	public ConnectionDescriptor getConnectionDescriptor() {
		return this.connectionDescriptor;
	}
}
