package com.ryuqq.multisig.core.statemachine;

/**
 * 상태 전이 검증 및 실행.
 *
 * <p>트랜잭션의 상태 전이가 허용된 규칙을 따르는지 검증하고, 불변식을 보장합니다.</p>
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>PROPOSED → APPROVED</li>
 *   <li>APPROVED → APPROVED</li>
 *   <li>APPROVED → EXECUTED</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>종료 상태(EXECUTED)에서는 어떤 상태로도 전이 불가</li>
 *   <li>역방향 전이 불가 (예: APPROVED → PROPOSED)</li>
 * </ul>
 *
 * <p>실패한 가치 이전의 롤백은 상태 전이가 아니라 진행 중 실행의 취소이므로
 * 이 클래스를 거치지 않습니다 ({@code Transaction#revertExecution()} 참고).</p>
 *
 * @author MultiSig Team
 * @since 1.0.0
 */
public final class StateTransition {

    // Utility class - prevent instantiation
    private StateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(TransactionState from, TransactionState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }

        boolean valid = switch (from) {
            case PROPOSED -> to == TransactionState.APPROVED;
            case APPROVED -> to == TransactionState.APPROVED || to == TransactionState.EXECUTED;
            case EXECUTED -> false;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid state transition: %s → %s", from, to)
            );
        }
    }
}
