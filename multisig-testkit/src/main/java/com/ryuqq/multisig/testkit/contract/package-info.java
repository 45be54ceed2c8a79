/**
 * Contract test base for MultiSig wallet implementations.
 *
 * <p>{@link com.ryuqq.multisig.testkit.contract.AbstractWalletContractTest} wires a wallet to
 * the in-memory adapters; {@link com.ryuqq.multisig.testkit.contract.Receivers} supplies
 * recipients that refuse value or call back into the wallet during execution.</p>
 *
 * @author MultiSig Team
 * @since 1.0.0
 */
package com.ryuqq.multisig.testkit.contract;
