/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the interface that infrastructure adapters implement
 * to give the command engine a store to operate on.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.tripplan.core.spi.Receiver} - Entity-level create/read/update/delete keyed by collection and id</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter layers (e.g., tripplan-adapter-inmemory, a JSON-file or JDBC adapter)
 * provide concrete implementations and must pass the Receiver contract test shipped in
 * tripplan-testkit.</p>
 *
 * <h2>Receiver Implementation Guidelines</h2>
 * <ul>
 *   <li><strong>Concurrency Control:</strong> Each method is atomic; the adapter owns its lock</li>
 *   <li><strong>Id Allocation:</strong> Monotonic per collection, never reused</li>
 *   <li><strong>Persistence:</strong> Out of scope for the engine; adapters may save after each mutation</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Trip Planner Team
 */
package com.ryuqq.tripplan.core.spi;
