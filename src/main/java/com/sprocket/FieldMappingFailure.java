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
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Describes one property that could not be populated while mapping a row.
 * <p>
 * The property is left at its default value; mapping of the remaining properties continues.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class FieldMappingFailure {
	@NonNull
	private final String propertyName;
	@NonNull
	private final String columnName;
	@Nullable
	private final String text;
	@NonNull
	private final TargetType targetType;
	@NonNull
	private final FieldMappingException exception;

	public FieldMappingFailure(@NonNull String propertyName,
														 @NonNull String columnName,
														 @Nullable String text,
														 @NonNull TargetType targetType,
														 @NonNull FieldMappingException exception) {
		this.propertyName = requireNonNull(propertyName);
		this.columnName = requireNonNull(columnName);
		this.text = text;
		this.targetType = requireNonNull(targetType);
		this.exception = requireNonNull(exception);
	}

	@NonNull
	public String getPropertyName() {
		return this.propertyName;
	}

	@NonNull
	public String getColumnName() {
		return this.columnName;
	}

	/**
	 * @return the cell text that failed to map, or empty for SQL {@code NULL}
	 */
	@NonNull
	public Optional<String> getText() {
		return Optional.ofNullable(this.text);
	}

	@NonNull
	public TargetType getTargetType() {
		return this.targetType;
	}

	@NonNull
	public FieldMappingException getException() {
		return this.exception;
	}

	@Override
	public String toString() {
		return format("%s{propertyName=%s, columnName=%s, text=%s, targetType=%s, exception=%s}",
				getClass().getSimpleName(), getPropertyName(), getColumnName(),
				getText().map(text -> format("'%s'", text)).orElse("NULL"), getTargetType(), getException().getMessage());
	}
}
