package com.ryuqq.multisig.core.exception;

/**
 * MultiSig 오류 코드.
 *
 * <p>각 코드는 고정 문자열 코드(예: {@code MSW-401})와 {@link ErrorCategory}를 가집니다.</p>
 *
 * @author MultiSig Team
 * @since 1.0.0
 */
public enum ErrorCode {

    NO_OWNERS("MSW-100", ErrorCategory.CONSTRUCTION),
    INVALID_REQUIRED_APPROVALS("MSW-101", ErrorCategory.CONSTRUCTION),
    ZERO_ADDRESS_OWNER("MSW-102", ErrorCategory.CONSTRUCTION),
    OWNER_ALREADY_EXISTS("MSW-103", ErrorCategory.CONSTRUCTION),

    NOT_OWNER("MSW-401", ErrorCategory.AUTHORIZATION),

    ZERO_ADDRESS_RECIPIENT("MSW-402", ErrorCategory.REFERENCE),
    INVALID_TRANSACTION_NONCE("MSW-404", ErrorCategory.REFERENCE),

    TRANSACTION_ALREADY_EXECUTED("MSW-409", ErrorCategory.STATE_CONFLICT),
    NOT_ENOUGH_APPROVALS("MSW-412", ErrorCategory.STATE_CONFLICT),

    TRANSFER_FAILED("MSW-502", ErrorCategory.TRANSFER),

    REENTRANT_CALL("MSW-423", ErrorCategory.REENTRANCY);

    private final String code;
    private final ErrorCategory category;

    ErrorCode(String code, ErrorCategory category) {
        this.code = code;
        this.category = category;
    }

    public String code() {
        return code;
    }

    public ErrorCategory category() {
        return category;
    }
}
