package com.ryuqq.multisig.core.spi;

import com.ryuqq.multisig.core.model.Address;
import com.ryuqq.multisig.core.model.Amount;

/**
 * 가치 이전 결과.
 *
 * <ul>
 *   <li>{@link Transferred}: 이전 완료</li>
 *   <li>{@link Rejected}: 이전 거부 (잔액 변화 없음)</li>
 * </ul>
 *
 * @author MultiSig Team
 * @since 1.0.0
 */
public sealed interface TransferResult permits TransferResult.Transferred, TransferResult.Rejected {

    /**
     * 이전 성공 여부.
     *
     * @return 성공 시 true
     */
    default boolean isTransferred() {
        return this instanceof Transferred;
    }

    /**
     * 이전 완료.
     *
     * @param to 수신자
     * @param amount 이전된 가치
     */
    record Transferred(Address to, Amount amount) implements TransferResult {

        public Transferred {
            if (to == null) {
                throw new IllegalArgumentException("to cannot be null");
            }
            if (amount == null) {
                throw new IllegalArgumentException("amount cannot be null");
            }
        }
    }

    /**
     * 이전 거부.
     *
     * @param reasonCode 거부 사유 코드 (예: INSUFFICIENT_BALANCE)
     * @param message 상세 메시지
     */
    record Rejected(String reasonCode, String message) implements TransferResult {

        public static final String INSUFFICIENT_BALANCE = "INSUFFICIENT_BALANCE";
        public static final String RECIPIENT_REJECTED = "RECIPIENT_REJECTED";

        public Rejected {
            if (reasonCode == null || reasonCode.isBlank()) {
                throw new IllegalArgumentException("reasonCode cannot be null or blank");
            }
            if (message == null || message.isBlank()) {
                throw new IllegalArgumentException("message cannot be null or blank");
            }
        }

        public static Rejected of(String reasonCode, String message) {
            return new Rejected(reasonCode, message);
        }
    }
}
