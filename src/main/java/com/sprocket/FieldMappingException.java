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

import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;

/**
 * Signals that a single column value could not be coerced to, or assigned to, its target property.
 * <p>
 * {@link RowMapper} implementations capture these per property in a {@link RowMappingResult} instead of letting them
 * abort the row.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public class FieldMappingException extends DatabaseException {
	public FieldMappingException(@Nullable String message) {
		super(message);
	}

	public FieldMappingException(@Nullable String message,
															 @Nullable Throwable cause) {
		super(message, cause);
	}
}
