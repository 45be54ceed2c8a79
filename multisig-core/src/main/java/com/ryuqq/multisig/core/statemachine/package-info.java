/**
 * Transaction state machine package.
 *
 * <p>This package implements the state transition rules for the transaction lifecycle,
 * ensuring that an executed transaction never changes again.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.multisig.core.statemachine.TransactionState} - Transaction lifecycle states (enum)</li>
 *   <li>{@link com.ryuqq.multisig.core.statemachine.StateTransition} - State transition validation and execution</li>
 * </ul>
 *
 * <h2>State Transition Rules</h2>
 * <pre>
 * PROPOSED → APPROVED (first approval)
 * APPROVED → APPROVED (further distinct approvals)
 * APPROVED → EXECUTED (quorum reached, transfer succeeded)
 *
 * Forbidden:
 * - EXECUTED → * (terminal state)
 * - Backward transitions (e.g., APPROVED → PROPOSED)
 * </pre>
 *
 * @since 1.0.0
 * @author MultiSig Team
 */
package com.ryuqq.multisig.core.statemachine;
