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
import javax.annotation.concurrent.ThreadSafe;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * One result row flattened to text: an ordered mapping from normalized (lower-cased) column name to the cell value
 * rendered as text, or {@code null} when the database reported SQL {@code NULL}.
 * <p>
 * Instances are immutable.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class RawRow {
	@NonNull
	private final Map<String, @Nullable String> valuesByColumnName;

	private RawRow(@NonNull Builder builder) {
		requireNonNull(builder);
		this.valuesByColumnName = Collections.unmodifiableMap(new LinkedHashMap<>(builder.valuesByColumnName));
	}

	/**
	 * Creates a row from already-normalized column names, preserving iteration order.
	 *
	 * @param valuesByColumnName column name to text (values may be {@code null})
	 * @return a row
	 */
	@NonNull
	public static RawRow of(@NonNull Map<String, @Nullable String> valuesByColumnName) {
		requireNonNull(valuesByColumnName);

		Builder builder = builder();

		for (Map.Entry<String, String> entry : valuesByColumnName.entrySet())
			builder.column(entry.getKey(), entry.getValue());

		return builder.build();
	}

	@NonNull
	public static Builder builder() {
		return new Builder();
	}

	/**
	 * @return the column names of this row, in result set order
	 */
	@NonNull
	public Set<String> getColumnNames() {
		return this.valuesByColumnName.keySet();
	}

	@NonNull
	public Boolean hasColumn(@NonNull String columnName) {
		requireNonNull(columnName);
		return this.valuesByColumnName.containsKey(columnName);
	}

	/**
	 * The text of the given column.
	 * <p>
	 * Empty both for SQL {@code NULL} and for columns this row does not have; use {@link #hasColumn(String)} to
	 * distinguish.
	 *
	 * @param columnName normalized column name
	 * @return the cell text, if any
	 */
	@NonNull
	public Optional<String> getValue(@NonNull String columnName) {
		requireNonNull(columnName);
		return Optional.ofNullable(this.valuesByColumnName.get(columnName));
	}

	/**
	 * @return an unmodifiable view of this row's column-to-text mapping
	 */
	@NonNull
	public Map<String, @Nullable String> asMap() {
		return this.valuesByColumnName;
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof RawRow rawRow))
			return false;

		return Objects.equals(this.valuesByColumnName, rawRow.valuesByColumnName);
	}

	@Override
	public int hashCode() {
		return Objects.hashCode(this.valuesByColumnName);
	}

	@Override
	public String toString() {
		return format("%s%s", getClass().getSimpleName(), this.valuesByColumnName);
	}

	/**
	 * Builder used to construct instances of {@link RawRow}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private final Map<String, @Nullable String> valuesByColumnName;

		private Builder() {
			this.valuesByColumnName = new LinkedHashMap<>();
		}

		/**
		 * Adds a column.
		 *
		 * @param columnName normalized column name
		 * @param value      the cell text, or {@code null} for SQL {@code NULL}
		 * @return this {@code Builder}, for chaining
		 * @throws DatabaseException if this column name was already added
		 */
		@NonNull
		public Builder column(@NonNull String columnName,
													@Nullable String value) {
			requireNonNull(columnName);

			if (this.valuesByColumnName.containsKey(columnName))
				throw new DatabaseException(format("Duplicate column name '%s' in row", columnName));

			this.valuesByColumnName.put(columnName, value);
			return this;
		}

		@NonNull
		public RawRow build() {
			return new RawRow(this);
		}
	}
}
