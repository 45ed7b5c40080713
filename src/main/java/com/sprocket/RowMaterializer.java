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
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Locale;

import static java.util.Objects.requireNonNull;

/**
 * Contract for flattening a {@link ResultSet} into a {@link RowSet} of textual {@link RawRow}s.
 * <p>
 * Implementations perform no type coercion: every driver-native cell becomes text (or {@code null}), so the same row
 * representation serves any requested target type.
 * <p>
 * A production-ready concrete implementation is available via the following static methods:
 * <ul>
 *   <li>{@link #withDefaultConfiguration()}</li>
 *   <li>{@link #withNormalizationLocale(Locale)} (builder)</li>
 * </ul>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface RowMaterializer {
	/**
	 * Walks every row the cursor makes available and flattens it.
	 * <p>
	 * The cursor is not closed by this method.
	 *
	 * @param resultSet the cursor, positioned before its first row
	 * @return every row, in traversal order
	 * @throws SQLException if the driver fails while reading
	 */
	@NonNull
	RowSet materialize(@NonNull ResultSet resultSet) throws SQLException;

	/**
	 * Acquires a builder for a concrete implementation of this interface, specifying the locale to use when lower-casing
	 * column labels.
	 *
	 * @param normalizationLocale the locale to use when lower-casing column labels
	 * @return a {@code Builder} for a concrete implementation
	 */
	@NonNull
	static Builder withNormalizationLocale(@NonNull Locale normalizationLocale) {
		requireNonNull(normalizationLocale);
		return new Builder().normalizationLocale(normalizationLocale);
	}

	/**
	 * Acquires a concrete implementation of this interface with out-of-the-box defaults.
	 * <p>
	 * The returned instance is thread-safe.
	 *
	 * @return a concrete implementation of this interface with out-of-the-box defaults
	 */
	@NonNull
	static RowMaterializer withDefaultConfiguration() {
		return new Builder().build();
	}

	/**
	 * Builder used to construct a standard implementation of {@link RowMaterializer}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	class Builder {
		@NonNull
		Locale normalizationLocale;

		private Builder() {
			this.normalizationLocale = Locale.ROOT;
		}

		@NonNull
		public Builder normalizationLocale(@NonNull Locale normalizationLocale) {
			this.normalizationLocale = requireNonNull(normalizationLocale);
			return this;
		}

		@NonNull
		public RowMaterializer build() {
			return new DefaultRowMaterializer(this);
		}
	}
}
