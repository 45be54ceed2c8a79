/**
 * MultiSig exception hierarchy.
 *
 * <p>Every failure a caller can provoke through the wallet API is a subclass of
 * {@link com.ryuqq.multisig.core.exception.MultiSigException} carrying an
 * {@link com.ryuqq.multisig.core.exception.ErrorCode} and the structured data needed to
 * diagnose it.</p>
 *
 * <h2>Taxonomy</h2>
 * <pre>
 * CONSTRUCTION    NoOwners, InvalidRequiredApprovals, ZeroAddressOwner, OwnerAlreadyExists
 * AUTHORIZATION   NotOwner
 * REFERENCE       ZeroAddressRecipient, InvalidTransactionNonce
 * STATE_CONFLICT  TransactionAlreadyExecuted, NotEnoughApprovals
 * TRANSFER        TransferFailed (executed flag rolled back)
 * REENTRANCY      ReentrantCall
 * </pre>
 *
 * @since 1.0.0
 * @author MultiSig Team
 */
package com.ryuqq.multisig.core.exception;
