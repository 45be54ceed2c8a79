package com.ryuqq.multisig.testkit.contract;

import com.ryuqq.multisig.adapter.inmemory.ledger.Receiver;
import com.ryuqq.multisig.core.model.Address;
import com.ryuqq.multisig.core.model.Amount;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Reusable recipient behaviours for contract tests.
 *
 * @author MultiSig Team
 * @since 1.0.0
 */
public final class Receivers {

    private Receivers() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Recipient that refuses every incoming value.
     *
     * @return receiver returning false
     */
    public static Receiver refusing() {
        return (from, amount) -> false;
    }

    /**
     * Recipient whose hook throws.
     *
     * @param message exception message
     * @return receiver throwing {@link IllegalStateException}
     */
    public static Receiver reverting(String message) {
        return (from, amount) -> {
            throw new IllegalStateException(message);
        };
    }

    /**
     * Recipient that runs a callback (typically a call back into the wallet) when value arrives.
     *
     * @param callback action run inside the transfer step
     * @param propagateFailure whether a failure of the callback should escape the hook
     * @return recording receiver
     */
    public static CallbackReceiver callingBack(Runnable callback, boolean propagateFailure) {
        return new CallbackReceiver(callback, propagateFailure);
    }

    /**
     * Recipient that calls back while receiving and records what happened to the nested call.
     *
     * <p>When {@code propagateFailure} is false the hook accepts the value even if the nested
     * call failed, so the outer transfer only fails if the nested call is let through.</p>
     */
    public static final class CallbackReceiver implements Receiver {

        private final Runnable callback;
        private final boolean propagateFailure;
        private final List<RuntimeException> failures = Collections.synchronizedList(new ArrayList<>());
        private final AtomicInteger invocations = new AtomicInteger();

        private CallbackReceiver(Runnable callback, boolean propagateFailure) {
            if (callback == null) {
                throw new IllegalArgumentException("callback cannot be null");
            }
            this.callback = callback;
            this.propagateFailure = propagateFailure;
        }

        @Override
        public boolean onReceive(Address from, Amount amount) {
            invocations.incrementAndGet();
            try {
                callback.run();
            } catch (RuntimeException e) {
                failures.add(e);
                if (propagateFailure) {
                    throw e;
                }
            }
            return true;
        }

        public List<RuntimeException> failures() {
            return List.copyOf(failures);
        }

        public int invocations() {
            return invocations.get();
        }
    }
}
