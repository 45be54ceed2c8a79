package com.ryuqq.multisig.core.spi;

import com.ryuqq.multisig.core.event.WalletEvent;

/**
 * Notification sink SPI.
 *
 * <p>The wallet hands every {@link WalletEvent} to this port synchronously, in the order
 * the triggering events happened. Delivery to the actual observers (log, message broker,
 * websocket, ...) is the adapter's concern.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Must not call back into the wallet's mutating operations</li>
 *   <li>Thread-safe: inflow notifications may arrive on any thread that moves value</li>
 *   <li>Should not throw; a failure here is logged by the wallet and never undoes an
 *       operation that has already taken effect</li>
 * </ul>
 *
 * @author MultiSig Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface EventPublisher {

    /**
     * Publishes one notification.
     *
     * @param event the notification
     * @throws IllegalArgumentException if event is null
     */
    void publish(WalletEvent event);
}
