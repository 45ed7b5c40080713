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
import java.time.ZoneId;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Contract for converting the text of a single cell to a property's type.
 * <p>
 * A production-ready concrete implementation is available via the following static methods:
 * <ul>
 *   <li>{@link #withDefaultConfiguration()}</li>
 *   <li>{@link #withCustomValueConverters(List)} (builder)</li>
 *   <li>{@link #withTimeZone(ZoneId)} (builder)</li>
 * </ul>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface ValueConverter {
	/**
	 * Converts non-null cell text to an instance of {@code targetType}.
	 * <p>
	 * {@code targetType} has already been unwrapped from {@code Optional}. Primitive types convert like their wrappers.
	 *
	 * @param text       the cell text
	 * @param targetType the type to convert to
	 * @return the converted value, or {@code null} if a custom converter explicitly produced {@code null}
	 * @throws FieldMappingException if the text cannot be converted, or the type is unsupported
	 */
	@Nullable
	Object convert(@NonNull String text,
								 @NonNull TargetType targetType);

	@NonNull
	static Builder withCustomValueConverters(@NonNull List<CustomValueConverter> customValueConverters) {
		requireNonNull(customValueConverters);
		return new Builder().customValueConverters(customValueConverters);
	}

	/**
	 * Acquires a builder specifying the zone used to interpret zone-less date-times when an instant is requested.
	 *
	 * @param timeZone the zone to apply
	 * @return a {@code Builder} for a concrete implementation
	 */
	@NonNull
	static Builder withTimeZone(@NonNull ZoneId timeZone) {
		requireNonNull(timeZone);
		return new Builder().timeZone(timeZone);
	}

	@NonNull
	static ValueConverter withDefaultConfiguration() {
		return new Builder().build();
	}

	/**
	 * Builder used to construct a standard implementation of {@link ValueConverter}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	class Builder {
		@NonNull
		List<CustomValueConverter> customValueConverters;
		@NonNull
		ZoneId timeZone;

		private Builder() {
			this.customValueConverters = List.of();
			this.timeZone = ZoneId.systemDefault();
		}

		@NonNull
		public Builder customValueConverters(@NonNull List<CustomValueConverter> customValueConverters) {
			requireNonNull(customValueConverters);
			this.customValueConverters = customValueConverters;
			return this;
		}

		@NonNull
		public Builder timeZone(@NonNull ZoneId timeZone) {
			requireNonNull(timeZone);
			this.timeZone = timeZone;
			return this;
		}

		@NonNull
		public ValueConverter build() {
			return new DefaultValueConverter(this);
		}
	}
}
