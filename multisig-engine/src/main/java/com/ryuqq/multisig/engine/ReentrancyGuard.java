package com.ryuqq.multisig.engine;

import com.ryuqq.multisig.core.exception.ReentrantCallException;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 재진입 가드 겸 직렬화 락.
 *
 * <p>변경 연산 전체를 하나의 {@link ReentrantLock}으로 감쌉니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>락을 이미 보유한 스레드가 다시 변경 연산에 진입 → {@link ReentrantCallException}
 *       (가치 이전 중 수신자 콜백에서 돌아온 호출)</li>
 *   <li>다른 스레드 → 락이 풀릴 때까지 대기 (모든 변경 연산 직렬화)</li>
 *   <li>락은 정상 종료와 예외 종료 모두에서 해제</li>
 * </ul>
 *
 * <p>조회({@link #read})는 같은 락을 공유하되 재진입을 허용합니다. 다른 스레드는
 * 진행 중인 실행의 중간 상태를 볼 수 없습니다.</p>
 *
 * @author MultiSig Team
 * @since 1.0.0
 */
public final class ReentrancyGuard {

    private final ReentrantLock lock = new ReentrantLock();

    /**
     * 변경 연산을 가드 안에서 실행.
     *
     * @param operation 연산 이름 (예외 메시지용)
     * @param action 실행할 작업
     * @param <T> 반환 타입
     * @return action 결과
     * @throws ReentrantCallException 현재 스레드가 이미 가드 안에 있는 경우
     */
    public <T> T call(String operation, Supplier<T> action) {
        if (lock.isHeldByCurrentThread()) {
            throw new ReentrantCallException(operation);
        }
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 반환값 없는 변경 연산을 가드 안에서 실행.
     *
     * @param operation 연산 이름
     * @param action 실행할 작업
     * @throws ReentrantCallException 현재 스레드가 이미 가드 안에 있는 경우
     */
    public void run(String operation, Runnable action) {
        call(operation, () -> {
            action.run();
            return null;
        });
    }

    /**
     * 조회를 같은 락 아래에서 실행 (재진입 허용).
     *
     * @param reader 조회 작업
     * @param <T> 반환 타입
     * @return 조회 결과
     */
    public <T> T read(Supplier<T> reader) {
        lock.lock();
        try {
            return reader.get();
        } finally {
            lock.unlock();
        }
    }
}
