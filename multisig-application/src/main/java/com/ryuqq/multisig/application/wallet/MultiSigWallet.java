package com.ryuqq.multisig.application.wallet;

import com.ryuqq.multisig.core.exception.InvalidTransactionNonceException;
import com.ryuqq.multisig.core.exception.NotEnoughApprovalsException;
import com.ryuqq.multisig.core.exception.NotOwnerException;
import com.ryuqq.multisig.core.exception.ReentrantCallException;
import com.ryuqq.multisig.core.exception.TransactionAlreadyExecutedException;
import com.ryuqq.multisig.core.exception.TransferFailedException;
import com.ryuqq.multisig.core.exception.ZeroAddressRecipientException;
import com.ryuqq.multisig.core.ledger.TransactionSnapshot;
import com.ryuqq.multisig.core.model.Address;
import com.ryuqq.multisig.core.model.Amount;

import java.util.List;

/**
 * n-of-m MultiSig 지갑.
 *
 * <p>공유 풀에서 나가는 모든 가치 이전은 Owner 중 requiredApprovals명 이상이
 * 승인한 뒤에만 실행됩니다.</p>
 *
 * <p><strong>데이터 흐름 (단방향):</strong></p>
 * <pre>
 * propose → approve (서로 다른 Owner, 0회 이상) → execute (quorum 도달 후 정확히 한 번)
 * </pre>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * long id = wallet.propose(owner1, recipient, Amount.of(100));
 * wallet.approve(owner1, id);
 * wallet.approve(owner2, id);
 * wallet.execute(owner1, id);   // 풀 → recipient 100 이전
 * </pre>
 *
 * <p>모든 변경 연산은 동기식이며, 성공하거나 {@code MultiSigException} 하위 예외를 던집니다.
 * 실패한 연산은 상태도 알림도 남기지 않습니다.</p>
 *
 * @author MultiSig Team
 * @since 1.0.0
 */
public interface MultiSigWallet {

    /**
     * 가치 이전 트랜잭션 제안.
     *
     * <p>제안자는 자동으로 승인하지 않으며, 잔액 충분 여부도 검사하지 않습니다.</p>
     *
     * @param caller 호출자
     * @param recipient 수신자
     * @param value 이전할 가치
     * @return 새 트랜잭션 ID (0부터 순차 증가)
     * @throws ReentrantCallException 진행 중인 실행 내부에서 호출된 경우
     * @throws NotOwnerException caller가 Owner가 아닌 경우
     * @throws ZeroAddressRecipientException recipient가 null 또는 Zero Address인 경우
     * @throws IllegalArgumentException value가 null인 경우
     */
    long propose(Address caller, Address recipient, Amount value);

    /**
     * 트랜잭션 승인.
     *
     * <p>같은 Owner의 재승인은 오류가 아니라 AlreadyApprovedTransaction 알림만 남깁니다.
     * 승인이 실행을 자동으로 일으키지는 않습니다.</p>
     *
     * @param caller 호출자
     * @param transactionId 트랜잭션 ID
     * @throws ReentrantCallException 진행 중인 실행 내부에서 호출된 경우
     * @throws NotOwnerException caller가 Owner가 아닌 경우
     * @throws InvalidTransactionNonceException 존재하지 않는 ID인 경우
     * @throws TransactionAlreadyExecutedException 승인하지 않았던 Owner가 실행된 트랜잭션을 승인하는 경우
     */
    void approve(Address caller, long transactionId);

    /**
     * 트랜잭션 실행 (가치 이전).
     *
     * <p>executed 플래그를 먼저 기록한 뒤 이전을 시도하고, 이전이 실패하면 플래그를 되돌립니다.
     * 호출 전체가 재진입 가드로 보호됩니다.</p>
     *
     * @param caller 호출자
     * @param transactionId 트랜잭션 ID
     * @throws ReentrantCallException 진행 중인 실행 내부에서 호출된 경우
     * @throws NotOwnerException caller가 Owner가 아닌 경우
     * @throws InvalidTransactionNonceException 존재하지 않는 ID인 경우
     * @throws TransactionAlreadyExecutedException 이미 실행된 경우
     * @throws NotEnoughApprovalsException 승인 수가 quorum 미만인 경우
     * @throws TransferFailedException 가치 이전이 실패한 경우 (롤백 완료)
     */
    void execute(Address caller, long transactionId);

    /**
     * execute 외부 경로로 풀에 가치 입금.
     *
     * <p>누구나 입금할 수 있습니다. Deposit 알림은 이 경로뿐 아니라 풀로 들어오는
     * 모든 가치에 대해 원장의 inflow 알림을 통해 발행됩니다.</p>
     *
     * @param sender 입금자
     * @param amount 입금액
     * @throws ReentrantCallException 진행 중인 실행 내부에서 호출된 경우
     * @throws IllegalArgumentException sender 또는 amount가 null인 경우
     */
    void deposit(Address sender, Amount amount);

    boolean isOwner(Address principal);

    List<Address> listOwners();

    /**
     * 특정 Owner의 승인 여부 조회.
     *
     * @param transactionId 트랜잭션 ID
     * @param principal 확인할 주체
     * @return 승인했으면 true
     * @throws InvalidTransactionNonceException 존재하지 않는 ID인 경우
     */
    boolean hasApproved(long transactionId, Address principal);

    /**
     * 트랜잭션 조회.
     *
     * @param transactionId 트랜잭션 ID
     * @return 불변 스냅샷
     * @throws InvalidTransactionNonceException 존재하지 않는 ID인 경우
     */
    TransactionSnapshot getTransaction(long transactionId);

    /**
     * 지금까지 제안된 트랜잭션 수 (= 다음에 할당될 ID).
     *
     * @return 트랜잭션 수
     */
    long getTransactionCount();

    int getRequiredApprovals();

    /**
     * 풀 잔액 조회.
     *
     * @return 풀 잔액
     */
    Amount getBalance();

    /**
     * 풀 Address 조회.
     *
     * @return 가치 원장에서 풀을 식별하는 Address
     */
    Address getAddress();
}
