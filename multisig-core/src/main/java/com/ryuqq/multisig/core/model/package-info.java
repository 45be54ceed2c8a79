/**
 * Core value objects of the MultiSig Wallet SDK.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.multisig.core.model.Address} - Principal identifier (owner, recipient, depositor, pool)</li>
 *   <li>{@link com.ryuqq.multisig.core.model.Amount} - Non-negative quantity of pooled value</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> All value objects are immutable (final fields)</li>
 *   <li><strong>Validation:</strong> Constructor validation ensures data integrity</li>
 *   <li><strong>Pure Java:</strong> No external dependencies</li>
 * </ul>
 *
 * @since 1.0.0
 * @author MultiSig Team
 */
package com.ryuqq.multisig.core.model;
