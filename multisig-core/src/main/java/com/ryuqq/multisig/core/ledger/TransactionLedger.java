package com.ryuqq.multisig.core.ledger;

import com.ryuqq.multisig.core.exception.InvalidTransactionNonceException;
import com.ryuqq.multisig.core.model.Address;
import com.ryuqq.multisig.core.model.Amount;

import java.util.ArrayList;
import java.util.List;

/**
 * 추가 전용(append-only) 트랜잭션 원장.
 *
 * <p>트랜잭션 ID는 리스트 인덱스와 같습니다. 0부터 시작해 빈틈없이 증가하며,
 * 삭제가 없으므로 재사용되지 않습니다.</p>
 *
 * <p><strong>동시성:</strong> thread-safe하지 않습니다. 지갑 엔진이 모든 접근을
 * 단일 락으로 직렬화합니다.</p>
 *
 * @author MultiSig Team
 * @since 1.0.0
 */
public final class TransactionLedger {

    private final List<Transaction> transactions = new ArrayList<>();

    /**
     * 새 트랜잭션 추가.
     *
     * @param recipient 수신자
     * @param value 이전할 가치
     * @return 추가된 트랜잭션 (id = 이전 count)
     */
    public Transaction append(Address recipient, Amount value) {
        Transaction transaction = new Transaction(transactions.size(), recipient, value);
        transactions.add(transaction);
        return transaction;
    }

    /**
     * 트랜잭션 조회.
     *
     * @param id 트랜잭션 ID
     * @return 트랜잭션
     * @throws InvalidTransactionNonceException 존재하지 않는 ID인 경우
     */
    public Transaction get(long id) {
        if (!exists(id)) {
            throw new InvalidTransactionNonceException(id, transactions.size());
        }
        return transactions.get((int) id);
    }

    public boolean exists(long id) {
        return id >= 0 && id < transactions.size();
    }

    /**
     * 다음에 할당될 ID이자 지금까지 제안된 트랜잭션 수.
     *
     * @return 트랜잭션 수
     */
    public long count() {
        return transactions.size();
    }
}
