/**
 * Wallet notifications for off-system observers.
 *
 * <p>{@link com.ryuqq.multisig.core.event.WalletEvent} is a sealed interface; every
 * notification is an immutable record published through
 * {@link com.ryuqq.multisig.core.spi.EventPublisher}.</p>
 *
 * <h2>Notifications</h2>
 * <ul>
 *   <li>{@code OwnerAdded(owner)} - one per owner, in input order, on successful construction</li>
 *   <li>{@code Deposit(sender, amount)} - value received outside of execute</li>
 *   <li>{@code ProposedTransaction(id, proposer, recipient, value)}</li>
 *   <li>{@code ApprovedTransaction(id, approver)}</li>
 *   <li>{@code AlreadyApprovedTransaction(id, approver)} - idempotent re-approval</li>
 *   <li>{@code TransactionExecuted(id, executor)} - only after the transfer succeeded</li>
 * </ul>
 *
 * @since 1.0.0
 * @author MultiSig Team
 */
package com.ryuqq.multisig.core.event;
