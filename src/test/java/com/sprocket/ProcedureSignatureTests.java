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
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.List;

/**
 * @since 1.0.0
 */
@ThreadSafe
public class ProcedureSignatureTests {
	@Test
	public void testValidateProcedureName() {
		Assertions.assertEquals("GetOrders", ProcedureSignature.validateProcedureName("  GetOrders "));
		Assertions.assertEquals("dbo.GetOrders", ProcedureSignature.validateProcedureName("dbo.GetOrders"));
		Assertions.assertEquals("[sales].[Get Orders]", ProcedureSignature.validateProcedureName("[sales].[Get Orders]"));
		Assertions.assertEquals("\"sales\".\"GetOrders\"", ProcedureSignature.validateProcedureName("\"sales\".\"GetOrders\""));
		Assertions.assertEquals("usp_get$orders#1", ProcedureSignature.validateProcedureName("usp_get$orders#1"));

		for (String procedureName : List.of("", " ", "GetOrders;", "GetOrders --", "Get Orders", ".GetOrders", "GetOrders.", "GetOrders(1)"))
			Assertions.assertThrows(IllegalArgumentException.class, () -> ProcedureSignature.validateProcedureName(procedureName), procedureName);
	}

	@Test
	public void testNameSegments() {
		Assertions.assertEquals(List.of("GetOrders"), ProcedureSignature.nameSegments("GetOrders"));
		Assertions.assertEquals(List.of("sales", "Get Orders"), ProcedureSignature.nameSegments("[sales].[Get Orders]"));
		Assertions.assertEquals(List.of("db", "sales", "GetOrders"), ProcedureSignature.nameSegments("db.\"sales\".GetOrders"));
	}

	@Test
	public void testFindParameter() {
		ProcedureSignature procedureSignature = new ProcedureSignature("GetOrders", List.of(
				new ProcedureParameter("@CustomerId", 1, ProcedureParameter.Mode.IN, Types.INTEGER),
				new ProcedureParameter("@Total", 2, ProcedureParameter.Mode.OUT, Types.DECIMAL)));

		Assertions.assertEquals(1, procedureSignature.findParameter("customerId").orElseThrow().getPosition());
		Assertions.assertEquals(1, procedureSignature.findParameter("@CUSTOMERID").orElseThrow().getPosition());
		Assertions.assertEquals(2, procedureSignature.findParameter("total").orElseThrow().getPosition());
		Assertions.assertTrue(procedureSignature.findParameter("region").isEmpty());
	}

	@Test
	public void testRead() throws SQLException {
		try (Connection connection = DriverManager.getConnection("jdbc:hsqldb:mem:testRead", "sa", "");
				 Statement statement = connection.createStatement()) {
			statement.execute("CREATE TABLE ledger (entry_id INT, amount DECIMAL(10,2))");
			statement.execute("CREATE PROCEDURE adjustEntry(IN entryId INT, INOUT delta DECIMAL(10,2), OUT adjusted INT) MODIFIES SQL DATA "
					+ "BEGIN ATOMIC "
					+ "UPDATE ledger SET amount = amount + delta WHERE entry_id = entryId; "
					+ "SET adjusted = 1; "
					+ "END");
			statement.execute("CREATE PROCEDURE noArguments() MODIFIES SQL DATA BEGIN ATOMIC DELETE FROM ledger; END");

			ProcedureSignature procedureSignature = ProcedureSignature.read(connection, "adjustEntry");

			Assertions.assertEquals(List.of("ENTRYID", "DELTA", "ADJUSTED"), List.copyOf(procedureSignature.getParameterNames()),
					"Parameters should be listed in declaration order");
			Assertions.assertEquals(ProcedureParameter.Mode.IN, procedureSignature.getParameters().get(0).getMode());
			Assertions.assertEquals(ProcedureParameter.Mode.INOUT, procedureSignature.getParameters().get(1).getMode());
			Assertions.assertEquals(ProcedureParameter.Mode.OUT, procedureSignature.getParameters().get(2).getMode());
			Assertions.assertEquals(List.of(1, 2, 3), procedureSignature.getParameters().stream().map(ProcedureParameter::getPosition).toList());
			Assertions.assertEquals(Types.INTEGER, procedureSignature.getParameters().get(0).getSqlType());

			Assertions.assertTrue(ProcedureSignature.read(connection, "noArguments").isEmpty());
			Assertions.assertTrue(ProcedureSignature.read(connection, "doesNotExist").isEmpty());
		}
	}

	@Test
	public void testReadOverloads() throws SQLException {
		try (Connection connection = DriverManager.getConnection("jdbc:hsqldb:mem:testReadOverloads", "sa", "");
				 Statement statement = connection.createStatement()) {
			statement.execute("CREATE TABLE tally (tag VARCHAR(10), amount INT)");
			statement.execute("CREATE PROCEDURE recordTally(IN amount INT) MODIFIES SQL DATA "
					+ "BEGIN ATOMIC INSERT INTO tally VALUES ('none', amount); END");
			statement.execute("CREATE PROCEDURE recordTally(IN amount INT, IN tag VARCHAR(10)) MODIFIES SQL DATA "
					+ "BEGIN ATOMIC INSERT INTO tally VALUES (tag, amount); END");

			Assertions.assertEquals(2, ProcedureSignature.readOverloads(connection, "recordTally").size());
			Assertions.assertTrue(ProcedureSignature.read(connection, "recordTally").isEmpty(),
					"An overloaded procedure has no single signature");

			ProcedureSignature single = ProcedureSignature.read(connection, "recordTally", List.of("amount"));
			Assertions.assertEquals(List.of("AMOUNT"), List.copyOf(single.getParameterNames()));
			Assertions.assertEquals(1, single.getParameters().get(0).getPosition());

			ProcedureSignature pair = ProcedureSignature.read(connection, "recordTally", List.of("tag", "amount"));
			Assertions.assertEquals(List.of("AMOUNT", "TAG"), List.copyOf(pair.getParameterNames()));
			Assertions.assertEquals(List.of(1, 2), pair.getParameters().stream().map(ProcedureParameter::getPosition).toList());

			Assertions.assertTrue(ProcedureSignature.read(connection, "recordTally", List.of("total")).isEmpty(),
					"No overload accepts the names, so the database decides");
		}
	}
}
