package com.ryuqq.multisig.core.exception;

/**
 * Owner 목록에 null 또는 Zero Address가 포함된 경우.
 *
 * @author MultiSig Team
 * @since 1.0.0
 */
public class ZeroAddressOwnerException extends MultiSigException {

    private final int position;

    public ZeroAddressOwnerException(int position) {
        super(ErrorCode.ZERO_ADDRESS_OWNER, "Owner at position " + position + " is the zero address");
        this.position = position;
    }

    /**
     * 입력 목록에서 문제가 된 항목의 위치 (0부터 시작).
     *
     * @return 위치
     */
    public int getPosition() {
        return position;
    }
}
