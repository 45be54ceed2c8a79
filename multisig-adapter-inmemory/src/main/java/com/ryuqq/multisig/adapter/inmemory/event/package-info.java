/**
 * In-memory notification adapter.
 *
 * <p>{@link com.ryuqq.multisig.adapter.inmemory.event.InMemoryEventLog} records published
 * {@link com.ryuqq.multisig.core.event.WalletEvent}s in order for inspection by tests
 * and embedded observers.</p>
 *
 * @since 1.0.0
 * @author MultiSig Team
 */
package com.ryuqq.multisig.adapter.inmemory.event;
