package com.ryuqq.multisig.core.exception;

/**
 * 수신자가 null 또는 Zero Address인 트랜잭션을 제안한 경우.
 *
 * @author MultiSig Team
 * @since 1.0.0
 */
public class ZeroAddressRecipientException extends MultiSigException {

    public ZeroAddressRecipientException() {
        super(ErrorCode.ZERO_ADDRESS_RECIPIENT, "Recipient cannot be the zero address");
    }
}
