/**
 * Service Provider Interfaces towards the wallet's external collaborators.
 *
 * <h2>Ports</h2>
 * <ul>
 *   <li>{@link com.ryuqq.multisig.core.spi.ValueLedger} - Host value-transfer substrate (balances, credit, transfer)</li>
 *   <li>{@link com.ryuqq.multisig.core.spi.InflowListener} - Inflow notification from the substrate</li>
 *   <li>{@link com.ryuqq.multisig.core.spi.EventPublisher} - Notification sink for off-system observers</li>
 * </ul>
 *
 * <p>Reference implementations live in {@code multisig-adapter-inmemory}.</p>
 *
 * @since 1.0.0
 * @author MultiSig Team
 */
package com.ryuqq.multisig.core.spi;
