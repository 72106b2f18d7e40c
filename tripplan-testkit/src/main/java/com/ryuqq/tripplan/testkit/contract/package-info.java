/**
 * Contract tests for Receiver adapters.
 *
 * <p>Adapter modules depend on this module in test scope and extend
 * {@link com.ryuqq.tripplan.testkit.contract.AbstractReceiverContractTest}.</p>
 *
 * @since 1.0.0
 * @author Trip Planner Team
 */
package com.ryuqq.tripplan.testkit.contract;
