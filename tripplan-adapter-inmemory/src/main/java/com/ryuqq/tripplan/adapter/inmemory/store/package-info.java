/**
 * In-memory Receiver adapter implementation package.
 *
 * <p>This package provides the reference implementation of the Receiver SPI
 * for tests and local runs.</p>
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.tripplan.adapter.inmemory.store.InMemoryReceiver}:
 *       Thread-safe in-memory implementation of {@link com.ryuqq.tripplan.core.spi.Receiver}</li>
 * </ul>
 *
 * <p><strong>Design Principles:</strong></p>
 * <ul>
 *   <li><strong>Concurrency:</strong> One monitor per receiver; every SPI call is atomic</li>
 *   <li><strong>Ordering:</strong> Collections iterate in id order</li>
 *   <li><strong>Id Allocation:</strong> Per-collection sequence, never reused</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Trip Planner Team
 */
package com.ryuqq.tripplan.adapter.inmemory.store;
