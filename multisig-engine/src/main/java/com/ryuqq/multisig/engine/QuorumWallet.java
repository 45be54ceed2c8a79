package com.ryuqq.multisig.engine;

import com.ryuqq.multisig.application.wallet.MultiSigWallet;
import com.ryuqq.multisig.core.event.AlreadyApprovedTransaction;
import com.ryuqq.multisig.core.event.ApprovedTransaction;
import com.ryuqq.multisig.core.event.Deposit;
import com.ryuqq.multisig.core.event.ProposedTransaction;
import com.ryuqq.multisig.core.event.TransactionExecuted;
import com.ryuqq.multisig.core.event.WalletEvent;
import com.ryuqq.multisig.core.exception.NotEnoughApprovalsException;
import com.ryuqq.multisig.core.exception.NotOwnerException;
import com.ryuqq.multisig.core.exception.TransactionAlreadyExecutedException;
import com.ryuqq.multisig.core.exception.TransferFailedException;
import com.ryuqq.multisig.core.exception.ZeroAddressRecipientException;
import com.ryuqq.multisig.core.ledger.Transaction;
import com.ryuqq.multisig.core.ledger.TransactionLedger;
import com.ryuqq.multisig.core.ledger.TransactionSnapshot;
import com.ryuqq.multisig.core.model.Address;
import com.ryuqq.multisig.core.model.Amount;
import com.ryuqq.multisig.core.registry.OwnerRegistry;
import com.ryuqq.multisig.core.spi.EventPublisher;
import com.ryuqq.multisig.core.spi.TransferResult;
import com.ryuqq.multisig.core.spi.ValueLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * {@link MultiSigWallet} 구현체.
 *
 * <p>Owner 레지스트리, 추가 전용 트랜잭션 원장, 재진입 가드를 조합해
 * propose → approve → execute 상태 머신을 강제합니다.</p>
 *
 * <p><strong>검증 순서:</strong></p>
 * <pre>
 * propose: guard → owner → recipient
 * approve: guard → owner → 존재 → 이미 승인(알림 후 종료) → 실행됨 → 기록
 * execute: guard → owner → 존재 → 실행됨 → quorum → 확정 → 이전 → (실패 시 롤백)
 * </pre>
 *
 * <p><strong>execute 프로토콜 (commit-then-act):</strong></p>
 * <ol>
 *   <li>executed = true 먼저 기록</li>
 *   <li>ValueLedger로 풀 → 수신자 이전</li>
 *   <li>거부 또는 예외 → executed = false 롤백 후 {@link TransferFailedException}</li>
 *   <li>성공 → TransactionExecuted 발행</li>
 * </ol>
 *
 * <p><strong>알림:</strong> 알림은 변경이 반영된 뒤 발행됩니다. publisher가 실패해도 경고 로그만 남기고
 * 연산 결과는 그대로 유지됩니다. 풀로 들어오는 모든 가치는 원장의 inflow 알림을 통해
 * Deposit으로 발행됩니다.</p>
 *
 * <p><strong>동시성:</strong> 모든 변경 연산은 {@link ReentrancyGuard} 하나로 직렬화되며,
 * 가치 이전 중 수신자 콜백에서 돌아온 변경 호출은 즉시 거부됩니다.</p>
 *
 * @author MultiSig Team
 * @since 1.0.0
 */
public final class QuorumWallet implements MultiSigWallet {

    private static final Logger log = LoggerFactory.getLogger(QuorumWallet.class);

    private final Address address;
    private final OwnerRegistry registry;
    private final TransactionLedger transactions;
    private final ValueLedger valueLedger;
    private final EventPublisher publisher;
    private final ReentrancyGuard guard;

    /**
     * 생성자.
     *
     * <p>Owner 검증에 실패하면 OwnerRegistry가 던진 생성 오류가 그대로 전파되고,
     * 인스턴스와 OwnerAdded 알림은 남지 않습니다.</p>
     *
     * @param config 지갑 설정
     * @param valueLedger 가치 원장
     * @param publisher 알림 publisher
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public QuorumWallet(WalletConfig config, ValueLedger valueLedger, EventPublisher publisher) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (valueLedger == null) {
            throw new IllegalArgumentException("valueLedger cannot be null");
        }
        if (publisher == null) {
            throw new IllegalArgumentException("publisher cannot be null");
        }
        this.address = config.address();
        this.registry = OwnerRegistry.create(config.owners(), config.requiredApprovals(), publisher);
        this.transactions = new TransactionLedger();
        this.valueLedger = valueLedger;
        this.publisher = publisher;
        this.guard = new ReentrancyGuard();
        valueLedger.addInflowListener(address, this::onPoolInflow);

        log.info("MultiSig wallet {} created: {} owner(s), {} approval(s) required",
            address, registry.ownerCount(), registry.requiredApprovals());
    }

    @Override
    public long propose(Address caller, Address recipient, Amount value) {
        return guard.call("propose", () -> {
            requireOwner(caller);
            if (recipient == null || recipient.isZero()) {
                throw new ZeroAddressRecipientException();
            }
            if (value == null) {
                throw new IllegalArgumentException("value cannot be null");
            }

            Transaction transaction = transactions.append(recipient, value);
            notify(new ProposedTransaction(transaction.getId(), caller, recipient, value));
            log.info("Transaction {} proposed by {}: {} → {}", transaction.getId(), caller, value, recipient);
            return transaction.getId();
        });
    }

    @Override
    public void approve(Address caller, long transactionId) {
        guard.run("approve", () -> {
            requireOwner(caller);
            Transaction transaction = transactions.get(transactionId);

            // 재승인 확인이 실행 여부 확인보다 먼저
            if (transaction.hasApproved(caller)) {
                notify(new AlreadyApprovedTransaction(transactionId, caller));
                log.debug("Transaction {} already approved by {}", transactionId, caller);
                return;
            }
            if (transaction.isExecuted()) {
                throw new TransactionAlreadyExecutedException(transactionId);
            }

            transaction.approve(caller);
            notify(new ApprovedTransaction(transactionId, caller));
            log.info("Transaction {} approved by {} ({}/{})",
                transactionId, caller, transaction.getApprovalCount(), registry.requiredApprovals());
        });
    }

    @Override
    public void execute(Address caller, long transactionId) {
        guard.run("execute", () -> {
            requireOwner(caller);
            Transaction transaction = transactions.get(transactionId);
            if (transaction.isExecuted()) {
                throw new TransactionAlreadyExecutedException(transactionId);
            }
            int required = registry.requiredApprovals();
            if (transaction.getApprovalCount() < required) {
                throw new NotEnoughApprovalsException(transactionId, transaction.getApprovalCount(), required);
            }

            transaction.markExecuted();
            TransferResult result = transfer(transaction);
            if (result instanceof TransferResult.Rejected rejected) {
                transaction.revertExecution();
                log.warn("Transaction {} transfer rejected, rolled back: {} ({})",
                    transactionId, rejected.reasonCode(), rejected.message());
                throw new TransferFailedException(transactionId, transaction.getRecipient(), transaction.getValue(),
                    rejected.reasonCode() + ": " + rejected.message());
            }

            notify(new TransactionExecuted(transactionId, caller));
            log.info("Transaction {} executed by {}: {} → {}",
                transactionId, caller, transaction.getValue(), transaction.getRecipient());
        });
    }

    /**
     * 가치 이전 시도. 원장 예외는 롤백 후 {@link TransferFailedException}으로 변환.
     */
    private TransferResult transfer(Transaction transaction) {
        try {
            TransferResult result = valueLedger.transfer(address, transaction.getRecipient(), transaction.getValue());
            if (result == null) {
                return TransferResult.Rejected.of("NO_RESULT", "value ledger returned no result");
            }
            return result;
        } catch (RuntimeException e) {
            transaction.revertExecution();
            log.warn("Transaction {} transfer threw, rolled back", transaction.getId(), e);
            throw new TransferFailedException(transaction.getId(), transaction.getRecipient(), transaction.getValue(),
                "transfer threw " + e.getClass().getSimpleName(), e);
        }
    }

    @Override
    public void deposit(Address sender, Amount amount) {
        guard.run("deposit", () -> {
            if (sender == null) {
                throw new IllegalArgumentException("sender cannot be null");
            }
            if (amount == null) {
                throw new IllegalArgumentException("amount cannot be null");
            }
            valueLedger.credit(sender, address, amount);
        });
    }

    /**
     * 풀로 들어온 모든 가치(deposit, 다른 계정의 이전)를 Deposit으로 알림.
     *
     * <p>원장이 락 없이 호출하므로 가드에 진입하지 않습니다.</p>
     */
    private void onPoolInflow(Address sender, Amount amount) {
        log.info("Deposit of {} from {} into {}", amount, sender, address);
        notify(new Deposit(sender, amount));
    }

    /**
     * 이미 반영된 변경의 알림 발행. publisher 실패는 연산 실패로 전파하지 않음.
     */
    private void notify(WalletEvent event) {
        try {
            publisher.publish(event);
        } catch (RuntimeException e) {
            log.warn("Failed to publish {} from wallet {}", event.name(), address, e);
        }
    }

    @Override
    public boolean isOwner(Address principal) {
        return registry.isOwner(principal);
    }

    @Override
    public List<Address> listOwners() {
        return registry.listOwners();
    }

    @Override
    public boolean hasApproved(long transactionId, Address principal) {
        return guard.read(() -> transactions.get(transactionId).hasApproved(principal));
    }

    @Override
    public TransactionSnapshot getTransaction(long transactionId) {
        return guard.read(() -> transactions.get(transactionId).snapshot());
    }

    @Override
    public long getTransactionCount() {
        return guard.read(transactions::count);
    }

    @Override
    public int getRequiredApprovals() {
        return registry.requiredApprovals();
    }

    @Override
    public Amount getBalance() {
        return guard.read(() -> valueLedger.balanceOf(address));
    }

    @Override
    public Address getAddress() {
        return address;
    }

    private void requireOwner(Address caller) {
        if (!registry.isOwner(caller)) {
            log.warn("Rejected call from non-owner {}", caller);
            throw new NotOwnerException(caller);
        }
    }
}
