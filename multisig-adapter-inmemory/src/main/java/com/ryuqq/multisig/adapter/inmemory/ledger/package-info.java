/**
 * In-memory value ledger adapter.
 *
 * <p>Reference implementation of {@link com.ryuqq.multisig.core.spi.ValueLedger} with
 * per-account {@link com.ryuqq.multisig.adapter.inmemory.ledger.Receiver} hooks, used to
 * simulate recipients that refuse value or re-enter the wallet.</p>
 *
 * @since 1.0.0
 * @author MultiSig Team
 */
package com.ryuqq.multisig.adapter.inmemory.ledger;
