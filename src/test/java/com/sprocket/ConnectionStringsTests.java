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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.sql.Connection;
import java.util.List;
import java.util.Properties;
import java.util.Set;

/**
 * @since 1.0.0
 */
@ThreadSafe
public class ConnectionStringsTests {
	@Test
	public void testFromClasspath() throws Exception {
		ConnectionStrings connectionStrings = ConnectionStrings.fromClasspath();

		Assertions.assertEquals(List.of("inventory", "reporting"), List.copyOf(connectionStrings.names()), "Names should be sorted");

		ConnectionDescriptor inventory = connectionStrings.get("inventory");
		Assertions.assertEquals("jdbc:hsqldb:mem:inventory", inventory.getJdbcUrl().orElse(null));
		Assertions.assertEquals("sa", inventory.getUser().orElse(null));

		ConnectionDescriptor reporting = connectionStrings.get("reporting");
		Assertions.assertTrue(reporting.getUser().isEmpty(), "No user was configured");

		try (Connection connection = inventory.openConnection()) {
			Assertions.assertFalse(connection.isClosed());
		}
	}

	@Test
	public void testMissingResource() {
		Assertions.assertThrows(IllegalStateException.class, () -> ConnectionStrings.fromClasspath("does-not-exist.properties"));
	}

	@Test
	public void testUnknownName() {
		Properties properties = new Properties();
		properties.setProperty("sprocket.connection.billing.url", "jdbc:hsqldb:mem:billing");

		IllegalArgumentException e = Assertions.assertThrows(IllegalArgumentException.class,
				() -> ConnectionStrings.fromProperties(properties).get("shipping"));

		Assertions.assertTrue(e.getMessage().contains("shipping"));
		Assertions.assertTrue(e.getMessage().contains("billing"), "Message should list what is configured");
	}

	@Test
	public void testMissingUrl() {
		Properties properties = new Properties();
		properties.setProperty("sprocket.connection.billing.user", "sa");

		Assertions.assertThrows(IllegalArgumentException.class, () -> ConnectionStrings.fromProperties(properties));
	}

	@Test
	public void testUnrelatedKeysIgnored() {
		Properties properties = new Properties();
		properties.setProperty("sprocket.connection.billing.url", "jdbc:hsqldb:mem:billing");
		properties.setProperty("sprocket.other.setting", "value");
		properties.setProperty("unrelated", "value");

		Assertions.assertEquals(Set.of("billing"), ConnectionStrings.fromProperties(properties).names());
	}

	@Test
	public void testDescriptionOmitsPassword() {
		ConnectionDescriptor connectionDescriptor = ConnectionDescriptor.ofJdbcUrl("jdbc:hsqldb:mem:secrets", "sa", "hunter2");

		Assertions.assertEquals("jdbc:hsqldb:mem:secrets (user sa)", connectionDescriptor.getDescription());
		Assertions.assertFalse(connectionDescriptor.toString().contains("hunter2"));
	}

	@Test
	public void testBlankUrlRejected() {
		Assertions.assertThrows(IllegalArgumentException.class, () -> ConnectionDescriptor.ofJdbcUrl("  "));
	}
}
