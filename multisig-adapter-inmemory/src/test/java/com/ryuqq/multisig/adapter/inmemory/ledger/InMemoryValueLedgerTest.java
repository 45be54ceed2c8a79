package com.ryuqq.multisig.adapter.inmemory.ledger;

import com.ryuqq.multisig.core.model.Address;
import com.ryuqq.multisig.core.model.Amount;
import com.ryuqq.multisig.core.spi.TransferResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InMemoryValueLedger 테스트.
 *
 * <p>잔액 이전, 잔액 부족 거부, 수신자 콜백의 거부/예외 시 전체 롤백을 검증합니다.</p>
 *
 * @author MultiSig Team
 * @since 1.0.0
 */
class InMemoryValueLedgerTest {

    private static final Address POOL = Address.of("0x" + "1".repeat(40));
    private static final Address ALICE = Address.of("0x" + "2".repeat(40));
    private static final Address BOB = Address.of("0x" + "3".repeat(40));

    private InMemoryValueLedger ledger;

    @BeforeEach
    void setUp() {
        ledger = new InMemoryValueLedger();
        ledger.credit(BOB, POOL, Amount.of(100));
    }

    @Test
    void balanceOf_처음_보는_계정은_0() {
        assertThat(ledger.balanceOf(ALICE)).isEqualTo(Amount.ZERO);
    }

    @Test
    void credit_잔액에_누적된다() {
        ledger.credit(BOB, POOL, Amount.of(5));

        assertThat(ledger.balanceOf(POOL)).isEqualTo(Amount.of(105));
    }

    @Test
    void transfer_성공하면_잔액이_이동한다() {
        // when
        TransferResult result = ledger.transfer(POOL, ALICE, Amount.of(30));

        // then
        assertThat(result).isEqualTo(new TransferResult.Transferred(ALICE, Amount.of(30)));
        assertThat(ledger.balanceOf(POOL)).isEqualTo(Amount.of(70));
        assertThat(ledger.balanceOf(ALICE)).isEqualTo(Amount.of(30));
        assertThat(ledger.completedTransfers()).hasSize(1);
    }

    @Test
    void transfer_잔액_전부를_보낼_수_있다() {
        assertThat(ledger.transfer(POOL, ALICE, Amount.of(100)).isTransferred()).isTrue();
        assertThat(ledger.balanceOf(POOL)).isEqualTo(Amount.ZERO);
    }

    @Test
    void transfer_0은_언제나_성공한다() {
        assertThat(ledger.transfer(ALICE, BOB, Amount.ZERO).isTransferred()).isTrue();
    }

    @Test
    void transfer_잔액_부족이면_INSUFFICIENT_BALANCE_잔액_불변() {
        // when
        TransferResult result = ledger.transfer(POOL, ALICE, Amount.of(101));

        // then
        assertThat(result).isInstanceOfSatisfying(TransferResult.Rejected.class,
            rejected -> assertThat(rejected.reasonCode()).isEqualTo(TransferResult.Rejected.INSUFFICIENT_BALANCE));
        assertThat(ledger.balanceOf(POOL)).isEqualTo(Amount.of(100));
        assertThat(ledger.balanceOf(ALICE)).isEqualTo(Amount.ZERO);
        assertThat(ledger.completedTransfers()).isEmpty();
    }

    @Test
    void transfer_수신자가_거부하면_RECIPIENT_REJECTED_잔액_복원() {
        // given
        ledger.registerReceiver(ALICE, (from, amount) -> false);

        // when
        TransferResult result = ledger.transfer(POOL, ALICE, Amount.of(10));

        // then
        assertThat(result).isInstanceOfSatisfying(TransferResult.Rejected.class,
            rejected -> assertThat(rejected.reasonCode()).isEqualTo(TransferResult.Rejected.RECIPIENT_REJECTED));
        assertThat(ledger.balanceOf(POOL)).isEqualTo(Amount.of(100));
        assertThat(ledger.balanceOf(ALICE)).isEqualTo(Amount.ZERO);
    }

    @Test
    void transfer_수신자_예외도_거부로_보고된다() {
        ledger.registerReceiver(ALICE, (from, amount) -> {
            throw new IllegalStateException("no thanks");
        });

        TransferResult result = ledger.transfer(POOL, ALICE, Amount.of(10));

        assertThat(result).isInstanceOfSatisfying(TransferResult.Rejected.class,
            rejected -> assertThat(rejected.message()).contains("no thanks"));
        assertThat(ledger.balanceOf(POOL)).isEqualTo(Amount.of(100));
    }

    @Test
    void transfer_콜백에서_일어난_이동까지_함께_복원한다() {
        // given: ALICE는 받은 가치를 BOB에게 넘긴 뒤 거부
        ledger.registerReceiver(ALICE, (from, amount) -> {
            ledger.transfer(ALICE, BOB, amount);
            return false;
        });

        // when
        ledger.transfer(POOL, ALICE, Amount.of(10));

        // then
        assertThat(ledger.balanceOf(POOL)).isEqualTo(Amount.of(100));
        assertThat(ledger.balanceOf(ALICE)).isEqualTo(Amount.ZERO);
        assertThat(ledger.balanceOf(BOB)).isEqualTo(Amount.ZERO);
        assertThat(ledger.completedTransfers()).isEmpty();
    }

    @Test
    void transfer_수신자가_수령하면_콜백이_한_번_호출된다() {
        AtomicInteger calls = new AtomicInteger();
        ledger.registerReceiver(ALICE, (from, amount) -> {
            assertThat(from).isEqualTo(POOL);
            assertThat(amount).isEqualTo(Amount.of(10));
            // 콜백 시점에 이미 입금되어 있음
            assertThat(ledger.balanceOf(ALICE)).isEqualTo(Amount.of(10));
            calls.incrementAndGet();
            return true;
        });

        assertThat(ledger.transfer(POOL, ALICE, Amount.of(10)).isTransferred()).isTrue();
        assertThat(calls).hasValue(1);
    }

    @Test
    void null_인자는_IllegalArgumentException() {
        assertThatThrownBy(() -> ledger.balanceOf(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ledger.credit(BOB, POOL, null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ledger.transfer(null, ALICE, Amount.ZERO)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ledger.credit(null, POOL, Amount.ZERO)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ledger.registerReceiver(ALICE, null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ledger.addInflowListener(ALICE, null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void clear_모든_상태를_초기화한다() {
        ledger.registerReceiver(ALICE, (from, amount) -> false);
        ledger.clear();

        assertThat(ledger.balanceOf(POOL)).isEqualTo(Amount.ZERO);
        ledger.credit(BOB, POOL, Amount.of(1));
        assertThat(ledger.transfer(POOL, ALICE, Amount.of(1)).isTransferred()).isTrue();
    }

    // ============================================================
    // inflow 알림
    // ============================================================

    @Test
    void inflow_credit과_transfer_모두_수신_계정_listener에_알린다() {
        // given
        List<String> inflows = new ArrayList<>();
        ledger.addInflowListener(ALICE, (from, amount) -> inflows.add(from + ":" + amount));

        // when
        ledger.credit(BOB, ALICE, Amount.of(7));
        ledger.transfer(POOL, ALICE, Amount.of(3));
        ledger.transfer(POOL, BOB, Amount.of(1));

        // then
        assertThat(inflows).containsExactly(BOB + ":7", POOL + ":3");
    }

    @Test
    void inflow_거부된_이전은_알리지_않는다() {
        List<Amount> inflows = new ArrayList<>();
        ledger.addInflowListener(ALICE, (from, amount) -> inflows.add(amount));
        ledger.registerReceiver(ALICE, (from, amount) -> false);

        ledger.transfer(POOL, ALICE, Amount.of(10));
        ledger.transfer(POOL, ALICE, Amount.of(1_000));

        assertThat(inflows).isEmpty();
    }

    @Test
    void inflow_롤백된_콜백_안의_이동은_알리지_않는다() {
        // given: ALICE가 받은 가치를 BOB에게 넘긴 뒤 거부
        List<Amount> bobInflows = new ArrayList<>();
        ledger.addInflowListener(BOB, (from, amount) -> bobInflows.add(amount));
        ledger.registerReceiver(ALICE, (from, amount) -> {
            ledger.transfer(ALICE, BOB, amount);
            return false;
        });

        // when
        ledger.transfer(POOL, ALICE, Amount.of(10));

        // then
        assertThat(bobInflows).isEmpty();
    }

    @Test
    void inflow_콜백_안의_이동은_바깥_이전이_끝난_뒤_락_없이_알린다() {
        // given
        List<Amount> bobInflows = new ArrayList<>();
        List<Boolean> lockHeld = new ArrayList<>();
        ledger.addInflowListener(BOB, (from, amount) -> {
            bobInflows.add(amount);
            lockHeld.add(Thread.holdsLock(ledger));
        });
        ledger.registerReceiver(ALICE, (from, amount) -> {
            ledger.transfer(ALICE, BOB, Amount.of(4));
            // 바깥 이전이 진행 중이므로 아직 알리지 않음
            assertThat(bobInflows).isEmpty();
            return true;
        });

        // when
        ledger.transfer(POOL, ALICE, Amount.of(10));

        // then
        assertThat(bobInflows).containsExactly(Amount.of(4));
        assertThat(lockHeld).containsExactly(false);
    }

    @Test
    void clear_inflow_listener는_유지한다() {
        List<Amount> inflows = new ArrayList<>();
        ledger.addInflowListener(POOL, (from, amount) -> inflows.add(amount));

        ledger.clear();
        ledger.credit(BOB, POOL, Amount.of(2));

        assertThat(inflows).containsExactly(Amount.of(2));
    }
}
