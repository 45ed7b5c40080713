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

/**
 * Sprocket calls stored procedures over JDBC and maps their result sets onto records and JavaBeans.
 *
 * <pre>
 * // Minimal setup, uses defaults
 * ProcedureExecutor procedureExecutor = ProcedureExecutor.withDefaultConfiguration();
 * ConnectionDescriptor orders = ConnectionStrings.fromClasspath().get("orders");
 *
 * // Parameters come from any record, JavaBean or Map, matched to the procedure's parameters by name
 * record OrderLookup(Long customerId, LocalDate since) {}
 *
 * Optional&lt;Order&gt; latest = procedureExecutor.fetchOne(orders, new OrderLookup(42L, today), "GetLatestOrder", Order.class);
 * List&lt;Order&gt; recent = procedureExecutor.fetchMany(orders, new OrderLookup(42L, lastWeek), "GetOrdersSince", Order.class);
 *
 * // Side effects only
 * procedureExecutor.run(orders, Map.of("orderId", 123), "CancelOrder");</pre>
 *
 * @since 1.0.0
 */
package com.sprocket;
