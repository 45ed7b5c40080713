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
import java.sql.DatabaseMetaData;
import java.util.Locale;
import java.util.Objects;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A declared parameter of a stored procedure, as reported by {@link DatabaseMetaData#getProcedureColumns}.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class ProcedureParameter {
	@NonNull
	private final String name;
	@NonNull
	private final Integer position;
	@NonNull
	private final Mode mode;
	@NonNull
	private final Integer sqlType;

	/**
	 * Direction of a procedure parameter.
	 */
	public enum Mode {
		IN,
		INOUT,
		OUT;

		/**
		 * Does the caller supply a value for parameters of this mode?
		 */
		@NonNull
		public Boolean isBound() {
			return this != OUT;
		}

		/**
		 * Must parameters of this mode be registered as output parameters?
		 */
		@NonNull
		public Boolean isRegistered() {
			return this != IN;
		}
	}

	/**
	 * @param name     the parameter name as the driver reports it
	 * @param position 1-based position in the call's argument list
	 * @param mode     the parameter's direction
	 * @param sqlType  the declared {@link java.sql.Types} code
	 */
	public ProcedureParameter(@NonNull String name,
														@NonNull Integer position,
														@NonNull Mode mode,
														@NonNull Integer sqlType) {
		requireNonNull(name);
		requireNonNull(position);
		requireNonNull(mode);
		requireNonNull(sqlType);

		if (position < 1)
			throw new IllegalArgumentException(format("Parameter position must be >= 1 but was %d", position));

		this.name = name;
		this.position = position;
		this.mode = mode;
		this.sqlType = sqlType;
	}

	/**
	 * Does this parameter answer to {@code candidateName}?
	 * <p>
	 * Comparison ignores case and a leading {@code @} on either side.
	 *
	 * @param candidateName the name to test, e.g. a parameter bag field name
	 * @return {@code true} if the names match
	 */
	@NonNull
	public Boolean matchesName(@NonNull String candidateName) {
		requireNonNull(candidateName);
		return normalizeName(getName()).equals(normalizeName(candidateName));
	}

	@NonNull
	static String normalizeName(@NonNull String name) {
		requireNonNull(name);

		String trimmed = name.trim();

		if (trimmed.startsWith("@"))
			trimmed = trimmed.substring(1);

		return trimmed.toLowerCase(Locale.ROOT);
	}

	@NonNull
	public String getName() {
		return this.name;
	}

	@NonNull
	public Integer getPosition() {
		return this.position;
	}

	@NonNull
	public Mode getMode() {
		return this.mode;
	}

	@NonNull
	public Integer getSqlType() {
		return this.sqlType;
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof ProcedureParameter procedureParameter))
			return false;

		return Objects.equals(getName(), procedureParameter.getName())
				&& Objects.equals(getPosition(), procedureParameter.getPosition())
				&& Objects.equals(getMode(), procedureParameter.getMode())
				&& Objects.equals(getSqlType(), procedureParameter.getSqlType());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getName(), getPosition(), getMode(), getSqlType());
	}

	@Override
	public String toString() {
		return format("%s{name=%s, position=%d, mode=%s, sqlType=%d}", getClass().getSimpleName(),
				getName(), getPosition(), getMode().name(), getSqlType());
	}
}
