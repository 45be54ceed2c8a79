package com.ryuqq.multisig.core.spi;

import com.ryuqq.multisig.core.model.Address;
import com.ryuqq.multisig.core.model.Amount;

/**
 * Value-transfer substrate SPI.
 *
 * <p>This interface abstracts the host ledger that actually holds balances. The wallet only
 * needs four things from it: read the pool balance, record value arriving into the pool,
 * move value out of the pool to a recipient while reporting success or failure, and hear
 * about every inflow into the pool.</p>
 *
 * <p><strong>Transfer Contract:</strong></p>
 * <pre>
 * transfer(from, to, amount)
 *   balance(from) &lt; amount        → Rejected (nothing moved)
 *   recipient refuses the value   → Rejected (nothing moved)
 *   otherwise                     → Transferred (from -= amount, to += amount)
 * </pre>
 *
 * <p><strong>Callback Window:</strong> delivering value to a recipient may hand control to
 * untrusted code (a contract-like recipient). That code may try to call back into the wallet;
 * the wallet, not the ledger, is responsible for rejecting such reentrant calls.</p>
 *
 * <p><strong>Lock Ordering:</strong> a wallet enters its own guard before calling the ledger.
 * A recipient callback running under a ledger lock must therefore only call back into a wallet
 * while that wallet's own transfer is in flight; calling into a wallet from a transfer the
 * wallet did not start takes the two locks in the opposite order.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>All-or-nothing: a rejected transfer leaves every balance unchanged</li>
 *   <li>{@link InflowListener}s hear only about committed inflows, after the outermost
 *       transfer or credit has finished and without holding any ledger lock</li>
 *   <li>Transport failures may be thrown as unchecked exceptions; the wallet treats them
 *       exactly like a {@link TransferResult.Rejected} result</li>
 * </ul>
 *
 * @author MultiSig Team
 * @since 1.0.0
 */
public interface ValueLedger {

    /**
     * Returns the current balance of an account.
     *
     * @param account the account
     * @return the balance ({@link Amount#ZERO} for unknown accounts)
     * @throws IllegalArgumentException if account is null
     */
    Amount balanceOf(Address account);

    /**
     * Records value received into an account from outside this ledger's transfers.
     *
     * @param sender the principal the value came from
     * @param account the receiving account
     * @param amount the received amount
     * @throws IllegalArgumentException if any argument is null
     */
    void credit(Address sender, Address account, Amount amount);

    /**
     * Moves value from one account to another.
     *
     * @param from the debited account (the wallet pool)
     * @param to the recipient
     * @param amount the amount to move
     * @return {@link TransferResult.Transferred} or {@link TransferResult.Rejected}
     * @throws IllegalArgumentException if any argument is null
     */
    TransferResult transfer(Address from, Address to, Amount amount);

    /**
     * Registers a listener told about every committed inflow into an account, whether it
     * arrives through {@link #credit} or as the recipient of {@link #transfer}.
     *
     * @param account the watched account
     * @param listener the listener
     * @throws IllegalArgumentException if any argument is null
     */
    void addInflowListener(Address account, InflowListener listener);
}
