package com.ryuqq.multisig.core.spi;

import com.ryuqq.multisig.core.model.Address;
import com.ryuqq.multisig.core.model.Amount;

/**
 * Callback for value arriving into a watched account.
 *
 * <p>Listeners run on the thread that moved the value, after the inflow is committed.
 * They must not throw: the value has already arrived and cannot be refused here.</p>
 *
 * @author MultiSig Team
 * @since 1.0.0
 * @see ValueLedger#addInflowListener(Address, InflowListener)
 */
@FunctionalInterface
public interface InflowListener {

    /**
     * Called once per committed inflow.
     *
     * @param from the sender
     * @param amount the received amount
     */
    void onInflow(Address from, Amount amount);
}
