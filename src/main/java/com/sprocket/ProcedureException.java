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
 * Thrown when the database rejects a stored procedure call: unknown procedure, parameter mismatch,
 * constraint violation, or any other error raised while the call executes.
 * <p>
 * Also thrown before execution when the parameter bag does not fit the procedure's declared signature.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public class ProcedureException extends DatabaseException {
	@NonNull
	private final String procedureName;

	public ProcedureException(@NonNull String procedureName,
														@Nullable String message) {
		this(procedureName, message, null);
	}

	public ProcedureException(@NonNull String procedureName,
														@Nullable Throwable cause) {
		this(procedureName, format("Call to stored procedure '%s' failed%s", requireNonNull(procedureName),
				cause == null || cause.getMessage() == null ? "" : ": " + cause.getMessage()), cause);
	}

	public ProcedureException(@NonNull String procedureName,
														@Nullable String message,
														@Nullable Throwable cause) {
		super(message, cause);
		this.procedureName = requireNonNull(procedureName);
	}

	@Override
	@NonNull
	protected List<String> additionalToStringComponents() {
		return List.of(format("procedure=%s", getProcedureName()));
	}

	/**
	 * @return the name of the stored procedure whose call failed
	 */
	@NonNull
	public String getProcedureName() {
		return this.procedureName;
	}
}
