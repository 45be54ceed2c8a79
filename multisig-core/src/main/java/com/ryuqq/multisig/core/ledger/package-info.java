/**
 * Append-only transaction ledger.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.multisig.core.ledger.TransactionLedger} - Dense, 0-based id allocation; never deletes</li>
 *   <li>{@link com.ryuqq.multisig.core.ledger.Transaction} - Mutable record: approvals, executed flag</li>
 *   <li>{@link com.ryuqq.multisig.core.ledger.TransactionSnapshot} - Immutable read model handed to callers</li>
 * </ul>
 *
 * @since 1.0.0
 * @author MultiSig Team
 */
package com.ryuqq.multisig.core.ledger;
