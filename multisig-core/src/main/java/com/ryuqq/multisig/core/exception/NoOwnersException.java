package com.ryuqq.multisig.core.exception;

/**
 * Owner 목록이 비어 있는 상태로 지갑을 생성하려 한 경우.
 *
 * @author MultiSig Team
 * @since 1.0.0
 */
public class NoOwnersException extends MultiSigException {

    public NoOwnersException() {
        super(ErrorCode.NO_OWNERS, "Owner list cannot be empty");
    }
}
