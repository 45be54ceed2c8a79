/**
 * Owner registry: the immutable set of authorized principals and the quorum threshold.
 *
 * <p>Every mutating wallet operation asks
 * {@link com.ryuqq.multisig.core.registry.OwnerRegistry#isOwner} first; the transaction
 * ledger never second-guesses the registry.</p>
 *
 * @since 1.0.0
 * @author MultiSig Team
 */
package com.ryuqq.multisig.core.registry;
