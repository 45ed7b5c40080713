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
import java.math.BigDecimal;
import java.sql.Blob;
import java.sql.Clob;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.OffsetTime;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Package-private standard implementation of {@link RowMaterializer}.
 * <p>
 * Temporal columns are rendered in ISO-8601 form and {@link BigDecimal}s in plain (non-scientific) notation so that
 * {@link DefaultValueConverter} can always parse them back.
 *
 * @since 1.0.0
 */
@ThreadSafe
class DefaultRowMaterializer implements RowMaterializer {
	@NonNull
	private final Locale normalizationLocale;

	DefaultRowMaterializer(@NonNull Builder builder) {
		requireNonNull(builder);
		this.normalizationLocale = requireNonNull(builder.normalizationLocale);
	}

	@Override
	@NonNull
	public RowSet materialize(@NonNull ResultSet resultSet) throws SQLException {
		requireNonNull(resultSet);

		ResultSetMetaData resultSetMetaData = resultSet.getMetaData();
		List<String> columnNames = determineColumnNames(resultSetMetaData);
		List<RawRow> rows = new ArrayList<>();

		while (resultSet.next()) {
			RawRow.Builder row = RawRow.builder();

			for (int i = 0; i < columnNames.size(); ++i)
				row.column(columnNames.get(i), extractColumnText(resultSet, resultSetMetaData, i + 1));

			rows.add(row.build());
		}

		return RowSet.of(new LinkedHashSet<>(columnNames), rows);
	}

	/**
	 * Reads and normalizes every column label, rejecting labels that collide once normalized.
	 */
	@NonNull
	protected List<String> determineColumnNames(@NonNull ResultSetMetaData resultSetMetaData) throws SQLException {
		requireNonNull(resultSetMetaData);

		int columnCount = resultSetMetaData.getColumnCount();
		List<String> columnNames = new ArrayList<>(columnCount);
		Map<String, String> normalizedLabelsToRawLabels = new HashMap<>(columnCount);

		for (int i = 1; i <= columnCount; i++) {
			String rawLabel = resultSetMetaData.getColumnLabel(i);

			if (rawLabel == null || rawLabel.isBlank())
				rawLabel = resultSetMetaData.getColumnName(i);

			String label = normalizeColumnLabel(rawLabel);
			String previousRawLabel = normalizedLabelsToRawLabels.putIfAbsent(label, rawLabel);

			if (previousRawLabel != null)
				throw new DatabaseException(format(
						"Duplicate column label '%s' (normalized from '%s' and '%s'); use column aliases to disambiguate.",
						label, previousRawLabel, rawLabel));

			columnNames.add(label);
		}

		return columnNames;
	}

	/**
	 * Renders a single cell as text.
	 *
	 * @return the cell text, or {@code null} if the driver reports SQL {@code NULL}
	 */
	@Nullable
	protected String extractColumnText(@NonNull ResultSet resultSet,
																		 @NonNull ResultSetMetaData resultSetMetaData,
																		 int columnIndex) throws SQLException {
		requireNonNull(resultSet);
		requireNonNull(resultSetMetaData);

		Object value = resultSet.getObject(columnIndex);

		if (value == null || resultSet.wasNull())
			return null;

		int jdbcType = resultSetMetaData.getColumnType(columnIndex);

		if (isTimestampWithTimeZone(resultSetMetaData, columnIndex)) {
			OffsetDateTime offsetDateTime = tryGet(resultSet, columnIndex, OffsetDateTime.class);
			if (offsetDateTime != null)
				return offsetDateTime.toString();
		} else if (jdbcType == Types.TIMESTAMP) {
			LocalDateTime localDateTime = tryGet(resultSet, columnIndex, LocalDateTime.class);
			if (localDateTime != null)
				return localDateTime.toString();
		} else if (jdbcType == Types.DATE) {
			LocalDate localDate = tryGet(resultSet, columnIndex, LocalDate.class);
			if (localDate != null)
				return localDate.toString();
		} else if (isTimeWithTimeZone(resultSetMetaData, columnIndex)) {
			OffsetTime offsetTime = tryGet(resultSet, columnIndex, OffsetTime.class);
			if (offsetTime != null)
				return offsetTime.toString();
		} else if (jdbcType == Types.TIME) {
			LocalTime localTime = tryGet(resultSet, columnIndex, LocalTime.class);
			if (localTime != null)
				return localTime.toString();
		}

		return renderValue(value);
	}

	/**
	 * Renders a driver-native value as text.
	 */
	@NonNull
	protected String renderValue(@NonNull Object value) throws SQLException {
		requireNonNull(value);

		if (value instanceof String string)
			return string;
		if (value instanceof BigDecimal bigDecimal)
			return bigDecimal.toPlainString();
		if (value instanceof Timestamp timestamp)
			return timestamp.toLocalDateTime().toString();
		if (value instanceof java.sql.Date date)
			return date.toLocalDate().toString();
		if (value instanceof java.sql.Time time)
			return time.toLocalTime().toString();
		if (value instanceof byte[] bytes)
			return Base64.getEncoder().encodeToString(bytes);

		if (value instanceof Clob clob) {
			long length = clob.length();

			if (length > Integer.MAX_VALUE)
				throw new DatabaseException(format("CLOB of length %d is too large to render as text", length));

			return length == 0 ? "" : clob.getSubString(1, (int) length);
		}

		if (value instanceof Blob blob) {
			long length = blob.length();

			if (length > Integer.MAX_VALUE)
				throw new DatabaseException(format("BLOB of length %d is too large to render as text", length));

			return Base64.getEncoder().encodeToString(length == 0 ? new byte[0] : blob.getBytes(1, (int) length));
		}

		return value.toString();
	}

	@NonNull
	protected String normalizeColumnLabel(@NonNull String columnLabel) {
		requireNonNull(columnLabel);
		return columnLabel.toLowerCase(getNormalizationLocale());
	}

	@NonNull
	protected Locale getNormalizationLocale() {
		return this.normalizationLocale;
	}

	protected static boolean isTimestampWithTimeZone(@NonNull ResultSetMetaData resultSetMetaData,
																									 int columnIndex) throws SQLException {
		if (resultSetMetaData.getColumnType(columnIndex) == Types.TIMESTAMP_WITH_TIMEZONE)
			return true;

		// Some drivers still report plain TIMESTAMP, e.g. PostgreSQL's TIMESTAMPTZ
		String typeName = resultSetMetaData.getColumnTypeName(columnIndex);

		if (typeName == null)
			return false;

		String upperTypeName = typeName.toUpperCase(Locale.ROOT);
		return upperTypeName.startsWith("TIMESTAMP") && (upperTypeName.contains("WITH TIME ZONE") || upperTypeName.contains("TIMESTAMPTZ"));
	}

	protected static boolean isTimeWithTimeZone(@NonNull ResultSetMetaData resultSetMetaData,
																							int columnIndex) throws SQLException {
		if (resultSetMetaData.getColumnType(columnIndex) == Types.TIME_WITH_TIMEZONE)
			return true;

		String typeName = resultSetMetaData.getColumnTypeName(columnIndex);
		return typeName != null && typeName.toUpperCase(Locale.ROOT).startsWith("TIME WITH TIME ZONE");
	}

	/**
	 * Tries JDBC 4.2 {@link ResultSet#getObject(int, Class)}; returns {@code null} if the driver does not support it.
	 */
	@Nullable
	protected static <T> T tryGet(@NonNull ResultSet resultSet,
																int columnIndex,
																@NonNull Class<T> type) throws SQLException {
		try {
			return resultSet.getObject(columnIndex, type);
		} catch (SQLFeatureNotSupportedException | AbstractMethodError e) {
			return null;
		}
	}
}
