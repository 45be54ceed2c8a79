/**
 * MultiSig execution engine.
 *
 * <p>This package implements the {@code MultiSigWallet} port on top of the core
 * registry, ledger and state machine.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.multisig.engine.QuorumWallet} - Propose / approve / execute state machine with commit-then-act execution</li>
 *   <li>{@link com.ryuqq.multisig.engine.ReentrancyGuard} - Lock spanning every mutating operation; rejects same-thread re-entry</li>
 *   <li>{@link com.ryuqq.multisig.engine.WalletConfig} - Immutable wallet configuration</li>
 * </ul>
 *
 * <h2>Dependencies</h2>
 * <ul>
 *   <li>multisig-core (registry, ledger, SPI)</li>
 *   <li>multisig-application (MultiSigWallet interface)</li>
 *   <li>SLF4J (logging)</li>
 * </ul>
 *
 * @author MultiSig Team
 * @since 1.0.0
 */
package com.ryuqq.multisig.engine;
