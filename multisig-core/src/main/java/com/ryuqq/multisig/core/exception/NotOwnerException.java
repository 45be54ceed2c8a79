package com.ryuqq.multisig.core.exception;

import com.ryuqq.multisig.core.model.Address;

/**
 * Owner가 아닌 호출자가 변경 연산을 시도한 경우.
 *
 * @author MultiSig Team
 * @since 1.0.0
 */
public class NotOwnerException extends MultiSigException {

    private final Address caller;

    /**
     * @param caller 호출자 (null 가능)
     */
    public NotOwnerException(Address caller) {
        super(ErrorCode.NOT_OWNER, "Caller is not an owner: " + caller);
        this.caller = caller;
    }

    public Address getCaller() {
        return caller;
    }
}
