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
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * All rows produced by a single stored procedure call, in cursor traversal order.
 * <p>
 * Every row shares the same column names. Structurally equal rows are kept; nothing is deduplicated.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class RowSet {
	@NonNull
	private static final RowSet EMPTY = new RowSet(Set.of(), List.of());

	@NonNull
	private final Set<String> columnNames;
	@NonNull
	private final List<RawRow> rows;

	private RowSet(@NonNull Set<String> columnNames,
								 @NonNull List<RawRow> rows) {
		this.columnNames = Collections.unmodifiableSet(new LinkedHashSet<>(requireNonNull(columnNames)));
		this.rows = Collections.unmodifiableList(new ArrayList<>(requireNonNull(rows)));
	}

	/**
	 * @return a row set with no columns and no rows
	 */
	@NonNull
	public static RowSet empty() {
		return EMPTY;
	}

	/**
	 * Creates a row set.
	 *
	 * @param columnNames normalized column names shared by every row, in result set order
	 * @param rows        the rows, in traversal order
	 * @return a row set
	 * @throws DatabaseException if a row's columns differ from {@code columnNames}
	 */
	@NonNull
	public static RowSet of(@NonNull Set<String> columnNames,
													@NonNull List<RawRow> rows) {
		requireNonNull(columnNames);
		requireNonNull(rows);

		for (RawRow row : rows)
			if (!row.getColumnNames().equals(columnNames))
				throw new DatabaseException(format("Row columns %s do not match result set columns %s", row.getColumnNames(), columnNames));

		return new RowSet(columnNames, rows);
	}

	/**
	 * Creates a row set whose column names are taken from the first row.
	 *
	 * @param rows the rows, in traversal order
	 * @return a row set
	 */
	@NonNull
	public static RowSet of(@NonNull List<RawRow> rows) {
		requireNonNull(rows);
		return rows.isEmpty() ? empty() : of(rows.get(0).getColumnNames(), rows);
	}

	@NonNull
	public Set<String> getColumnNames() {
		return this.columnNames;
	}

	@NonNull
	public List<RawRow> getRows() {
		return this.rows;
	}

	@NonNull
	public Boolean isEmpty() {
		return this.rows.isEmpty();
	}

	public int size() {
		return this.rows.size();
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof RowSet rowSet))
			return false;

		return Objects.equals(this.columnNames, rowSet.columnNames)
				&& Objects.equals(this.rows, rowSet.rows);
	}

	@Override
	public int hashCode() {
		return Objects.hash(this.columnNames, this.rows);
	}

	@Override
	public String toString() {
		return format("%s{columnNames=%s, rows=%d}", getClass().getSimpleName(), this.columnNames, this.rows.size());
	}
}
