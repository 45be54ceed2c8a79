package com.ryuqq.multisig.core.exception;

/**
 * MultiSig 도메인 예외의 최상위 타입.
 *
 * <p>모든 하위 예외는 {@link ErrorCode}와 진단에 필요한 구조화된 필드(트랜잭션 ID,
 * 승인 수, Address 등)를 함께 제공하므로, 호출자는 상태를 다시 조회하지 않고도
 * 실패 원인을 파악할 수 있습니다.</p>
 *
 * <p>null 인자나 잘못된 형식 같은 프로그래밍 오류는 이 계층이 아니라
 * {@link IllegalArgumentException}으로 보고됩니다.</p>
 *
 * @author MultiSig Team
 * @since 1.0.0
 */
public abstract class MultiSigException extends RuntimeException {

    private final ErrorCode errorCode;

    protected MultiSigException(ErrorCode errorCode, String message) {
        this(errorCode, message, null);
    }

    protected MultiSigException(ErrorCode errorCode, String message, Throwable cause) {
        super("[" + errorCode.code() + "] " + message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public ErrorCategory getCategory() {
        return errorCode.category();
    }
}
