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

import javax.annotation.concurrent.NotThreadSafe;
import java.util.Locale;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Contract for turning {@link RawRow}s into instances of a caller-specified type.
 * <p>
 * Two kinds of target are supported:
 * <ul>
 *   <li>Records, built through their canonical constructor</li>
 *   <li>JavaBeans, default-constructed and then populated through their setters</li>
 * </ul>
 * Property names (or {@link DatabaseColumn} aliases) are matched case-insensitively against column names.
 * <p>
 * A production-ready concrete implementation is available via the following static methods:
 * <ul>
 *   <li>{@link #withDefaultConfiguration()}</li>
 *   <li>{@link #withValueConverter(ValueConverter)} (builder)</li>
 *   <li>{@link #withInstanceProvider(InstanceProvider)} (builder)</li>
 *   <li>{@link #withNormalizationLocale(Locale)} (builder)</li>
 * </ul>
 *
 * @since 1.0.0
 */
public interface RowMapper {
	/**
	 * Determines which of the row set's columns feed a property of {@code targetType}.
	 * <p>
	 * Computed once per call and then passed to {@link #mapRow(RawRow, Class, Set)} for every row.
	 *
	 * @param targetType the type rows will be mapped to
	 * @param rowSet     the rows about to be mapped
	 * @param <T>        the mapped type
	 * @return lower-cased column names that correspond to a writable property, in property order
	 */
	@NonNull
	<T> Set<String> matchingFieldNames(@NonNull Class<T> targetType,
																		 @NonNull RowSet rowSet);

	/**
	 * Creates a new instance of {@code targetType} and populates each property whose column is in {@code fieldNames}.
	 * <p>
	 * A property that cannot be populated does not abort mapping; it is reported in the result instead.
	 *
	 * @param row        the row to map
	 * @param targetType the type to map to
	 * @param fieldNames as returned by {@link #matchingFieldNames(Class, RowSet)}
	 * @param <T>        the mapped type
	 * @return the new instance and any per-property failures
	 * @throws DatabaseException if {@code targetType} cannot be introspected or instantiated
	 */
	@NonNull
	<T> RowMappingResult<T> mapRow(@NonNull RawRow row,
																 @NonNull Class<T> targetType,
																 @NonNull Set<String> fieldNames);

	@NonNull
	static Builder withValueConverter(@NonNull ValueConverter valueConverter) {
		requireNonNull(valueConverter);
		return new Builder().valueConverter(valueConverter);
	}

	@NonNull
	static Builder withInstanceProvider(@NonNull InstanceProvider instanceProvider) {
		requireNonNull(instanceProvider);
		return new Builder().instanceProvider(instanceProvider);
	}

	/**
	 * Acquires a builder specifying the locale to use when lower-casing property names and aliases.
	 *
	 * @param normalizationLocale the locale to use
	 * @return a {@code Builder} for a concrete implementation
	 */
	@NonNull
	static Builder withNormalizationLocale(@NonNull Locale normalizationLocale) {
		requireNonNull(normalizationLocale);
		return new Builder().normalizationLocale(normalizationLocale);
	}

	@NonNull
	static RowMapper withDefaultConfiguration() {
		return new Builder().build();
	}

	/**
	 * Builder used to construct a standard implementation of {@link RowMapper}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	class Builder {
		@NonNull
		ValueConverter valueConverter;
		@NonNull
		InstanceProvider instanceProvider;
		@NonNull
		Locale normalizationLocale;

		private Builder() {
			this.valueConverter = ValueConverter.withDefaultConfiguration();
			this.instanceProvider = new InstanceProvider() {};
			this.normalizationLocale = Locale.ROOT;
		}

		@NonNull
		public Builder valueConverter(@NonNull ValueConverter valueConverter) {
			requireNonNull(valueConverter);
			this.valueConverter = valueConverter;
			return this;
		}

		@NonNull
		public Builder instanceProvider(@NonNull InstanceProvider instanceProvider) {
			requireNonNull(instanceProvider);
			this.instanceProvider = instanceProvider;
			return this;
		}

		@NonNull
		public Builder normalizationLocale(@NonNull Locale normalizationLocale) {
			requireNonNull(normalizationLocale);
			this.normalizationLocale = normalizationLocale;
			return this;
		}

		@NonNull
		public RowMapper build() {
			return new DefaultRowMapper(this);
		}
	}
}
