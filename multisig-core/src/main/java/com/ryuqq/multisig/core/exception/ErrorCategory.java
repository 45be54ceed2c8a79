package com.ryuqq.multisig.core.exception;

/**
 * 오류 분류.
 *
 * <p>모든 분류는 호출을 거부하며 상태 변경을 남기지 않습니다.
 * {@link #TRANSFER}는 잠정적으로 기록된 실행 플래그를 자동 롤백한 뒤 보고됩니다.</p>
 *
 * @author MultiSig Team
 * @since 1.0.0
 */
public enum ErrorCategory {

    /**
     * 지갑 생성 검증 실패. 인스턴스가 만들어지지 않습니다.
     */
    CONSTRUCTION,

    /**
     * 호출자가 Owner가 아님.
     */
    AUTHORIZATION,

    /**
     * 존재하지 않는 트랜잭션 참조.
     */
    REFERENCE,

    /**
     * 현재 트랜잭션 상태와 충돌 (이미 실행됨, 승인 부족 등).
     */
    STATE_CONFLICT,

    /**
     * 가치 이전 실패.
     */
    TRANSFER,

    /**
     * 진행 중인 실행 도중의 재진입 호출.
     */
    REENTRANCY
}
