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
import java.util.List;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * The outcome of mapping one row: the new instance, plus any per-property failures encountered along the way.
 *
 * @param <T> the mapped type
 * @since 1.0.0
 */
@ThreadSafe
public final class RowMappingResult<T> {
	@NonNull
	private final T value;
	@NonNull
	private final List<FieldMappingFailure> failures;

	public RowMappingResult(@NonNull T value,
													@NonNull List<FieldMappingFailure> failures) {
		requireNonNull(value);
		requireNonNull(failures);

		this.value = value;
		this.failures = List.copyOf(failures);
	}

	/**
	 * @return the mapped instance, possibly only partially populated if {@link #hasFailures()}
	 */
	@NonNull
	public T getValue() {
		return this.value;
	}

	@NonNull
	public List<FieldMappingFailure> getFailures() {
		return this.failures;
	}

	@NonNull
	public Boolean hasFailures() {
		return !this.failures.isEmpty();
	}

	@Override
	public String toString() {
		return format("%s{value=%s, failures=%s}", getClass().getSimpleName(), getValue(), getFailures());
	}
}
