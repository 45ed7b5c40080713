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
import java.sql.CallableStatement;
import java.sql.ParameterMetaData;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.OffsetTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Currency;
import java.util.Date;
import java.util.Locale;
import java.util.Optional;
import java.util.TimeZone;

import static java.util.Objects.requireNonNull;

/**
 * Package-private standard implementation of {@link ProcedureParameterBinder}.
 * <p>
 * Values are normalized to {@code java.time} types or strings before binding, preferring JDBC 4.2
 * {@code setObject} and falling back to legacy setters on drivers that do not support it.
 *
 * @since 1.0.0
 */
@ThreadSafe
class DefaultProcedureParameterBinder implements ProcedureParameterBinder {
	@NonNull
	private final ZoneId timeZone;

	DefaultProcedureParameterBinder(@NonNull Builder builder) {
		requireNonNull(builder);
		this.timeZone = requireNonNull(builder.timeZone);
	}

	@Override
	public void bindParameter(@NonNull CallableStatement callableStatement,
														@NonNull Integer parameterIndex,
														@Nullable Object parameter,
														@Nullable ProcedureParameter declaredParameter) throws SQLException {
		requireNonNull(callableStatement);
		requireNonNull(parameterIndex);

		Optional<Integer> sqlTypeOptional = declaredParameter != null
				? Optional.of(declaredParameter.getSqlType())
				: determineParameterSqlType(callableStatement, parameterIndex);

		if (parameter == null) {
			callableStatement.setNull(parameterIndex, sqlTypeOptional.orElse(Types.NULL));
			return;
		}

		int sqlType = sqlTypeOptional.orElse(Types.OTHER);
		Object normalizedParameter = normalizeParameter(parameter);

		if (normalizedParameter instanceof LocalDate localDate) {
			if (!trySetObject(callableStatement, parameterIndex, localDate, Types.DATE))
				callableStatement.setDate(parameterIndex, java.sql.Date.valueOf(localDate));

			return;
		}

		if (normalizedParameter instanceof LocalTime localTime) {
			if (!trySetObject(callableStatement, parameterIndex, localTime, Types.TIME))
				callableStatement.setString(parameterIndex, localTime.toString());

			return;
		}

		if (normalizedParameter instanceof LocalDateTime localDateTime) {
			if (!trySetObject(callableStatement, parameterIndex, localDateTime, Types.TIMESTAMP))
				callableStatement.setTimestamp(parameterIndex, Timestamp.valueOf(localDateTime));

			return;
		}

		if (normalizedParameter instanceof OffsetDateTime offsetDateTime) {
			if (sqlType == Types.TIMESTAMP) {
				// Coerce to the configured zone and drop the offset
				LocalDateTime localDateTime = offsetDateTime.atZoneSameInstant(getTimeZone()).toLocalDateTime();

				if (!trySetObject(callableStatement, parameterIndex, localDateTime, Types.TIMESTAMP))
					callableStatement.setTimestamp(parameterIndex, Timestamp.valueOf(localDateTime));

				return;
			}

			if (!trySetObject(callableStatement, parameterIndex, offsetDateTime, Types.TIMESTAMP_WITH_TIMEZONE))
				callableStatement.setTimestamp(parameterIndex, Timestamp.from(offsetDateTime.toInstant()));

			return;
		}

		if (normalizedParameter instanceof Instant instant) {
			if (sqlType == Types.TIMESTAMP) {
				LocalDateTime localDateTime = LocalDateTime.ofInstant(instant, getTimeZone());

				if (!trySetObject(callableStatement, parameterIndex, localDateTime, Types.TIMESTAMP))
					callableStatement.setTimestamp(parameterIndex, Timestamp.valueOf(localDateTime));

				return;
			}

			OffsetDateTime offsetDateTime = instant.atZone(getTimeZone()).toOffsetDateTime();

			if (!trySetObject(callableStatement, parameterIndex, offsetDateTime, Types.TIMESTAMP_WITH_TIMEZONE))
				callableStatement.setTimestamp(parameterIndex, Timestamp.from(instant));

			return;
		}

		if (normalizedParameter instanceof OffsetTime offsetTime) {
			if (!trySetObject(callableStatement, parameterIndex, offsetTime, Types.TIME_WITH_TIMEZONE))
				callableStatement.setString(parameterIndex, offsetTime.toString());

			return;
		}

		// Everything else
		callableStatement.setObject(parameterIndex, normalizedParameter);
	}

	/**
	 * Massages a parameter into a form JDBC drivers handle consistently.
	 *
	 * @param parameter the parameter to (possibly) massage
	 * @return the result of the massaging process
	 */
	@NonNull
	protected Object normalizeParameter(@NonNull Object parameter) {
		requireNonNull(parameter);

		// Coerce to java.time whenever possible
		if (parameter instanceof Timestamp timestamp)
			return timestamp.toLocalDateTime();
		if (parameter instanceof java.sql.Date date)
			return date.toLocalDate();
		if (parameter instanceof java.sql.Time time)
			return time.toLocalTime();
		if (parameter instanceof Date date)
			return Instant.ofEpochMilli(date.getTime());
		if (parameter instanceof ZonedDateTime zonedDateTime)
			return zonedDateTime.toOffsetDateTime();
		if (parameter instanceof Locale locale)
			return locale.toLanguageTag();
		if (parameter instanceof Currency currency)
			return currency.getCurrencyCode();
		if (parameter instanceof Enum<?> enumValue)
			return enumValue.name();
		if (parameter instanceof ZoneId zoneId)
			return zoneId.getId();
		if (parameter instanceof TimeZone timeZone)
			return timeZone.getID();
		if (parameter instanceof Character character)
			return character.toString();

		return parameter;
	}

	protected boolean trySetObject(@NonNull CallableStatement callableStatement,
																 @NonNull Integer parameterIndex,
																 @Nullable Object parameter,
																 @NonNull Integer sqlType) throws SQLException {
		requireNonNull(callableStatement);
		requireNonNull(parameterIndex);
		requireNonNull(sqlType);

		try {
			callableStatement.setObject(parameterIndex, parameter, sqlType);
			return true;
		} catch (SQLFeatureNotSupportedException | AbstractMethodError e) {
			return false;
		}
	}

	@NonNull
	protected Optional<Integer> determineParameterSqlType(@NonNull CallableStatement callableStatement,
																												@NonNull Integer parameterIndex) throws SQLException {
		requireNonNull(callableStatement);
		requireNonNull(parameterIndex);

		try {
			ParameterMetaData parameterMetaData = callableStatement.getParameterMetaData();

			if (parameterMetaData == null)
				return Optional.empty();

			return Optional.of(parameterMetaData.getParameterType(parameterIndex));
		} catch (SQLFeatureNotSupportedException | AbstractMethodError e) {
			return Optional.empty();
		}
	}

	@NonNull
	protected ZoneId getTimeZone() {
		return this.timeZone;
	}
}
