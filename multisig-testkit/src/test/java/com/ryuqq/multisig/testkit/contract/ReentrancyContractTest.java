package com.ryuqq.multisig.testkit.contract;

import com.ryuqq.multisig.core.event.ProposedTransaction;
import com.ryuqq.multisig.core.event.TransactionExecuted;
import com.ryuqq.multisig.core.exception.ErrorCode;
import com.ryuqq.multisig.core.exception.MultiSigException;
import com.ryuqq.multisig.core.exception.ReentrantCallException;
import com.ryuqq.multisig.core.exception.TransferFailedException;
import com.ryuqq.multisig.core.ledger.TransactionSnapshot;
import com.ryuqq.multisig.core.model.Amount;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for reentrancy protection.
 *
 * <p>The recipient hook runs inside the transfer step of {@code execute}. Any mutating call
 * it makes back into the wallet is rejected with {@link ReentrantCallException}; reads are
 * allowed and already observe the transaction as executed.</p>
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Nested execute swallowed by the recipient → outer execute pays exactly once</li>
 *   <li>Nested execute failure escapes the hook → outer execute fails and rolls back</li>
 *   <li>Nested approve / propose / deposit → rejected</li>
 *   <li>Nested reads → allowed</li>
 * </ul>
 *
 * @author MultiSig Team
 * @since 1.0.0
 */
class ReentrancyContractTest extends AbstractWalletContractTest {

    @Test
    void testNestedExecute_Swallowed_OuterPaysExactlyOnce() {
        // Given
        fund(Amount.of(10));
        long id = proposeAndApprove(RECIPIENT, Amount.of(4), OWNER_1, OWNER_2);
        Receivers.CallbackReceiver receiver = Receivers.callingBack(() -> wallet.execute(OWNER_1, id), false);
        valueLedger.registerReceiver(RECIPIENT, receiver);

        // When
        wallet.execute(OWNER_1, id);

        // Then
        assertEquals(1, receiver.invocations());
        assertEquals(1, receiver.failures().size());
        assertThat(receiver.failures().get(0))
                .isInstanceOfSatisfying(ReentrantCallException.class,
                        e -> assertThat(e.getOperation()).isEqualTo("execute"));
        assertExecuted(id, true);
        assertBalance(POOL, Amount.of(6));
        assertBalance(RECIPIENT, Amount.of(4));
        assertEquals(1, events.eventsOf(TransactionExecuted.class).size());
    }

    @Test
    void testNestedExecute_Propagated_OuterFailsAndRollsBack() {
        // Given
        fund(Amount.of(10));
        long id = proposeAndApprove(RECIPIENT, Amount.of(4), OWNER_1, OWNER_2);
        Receivers.CallbackReceiver receiver = Receivers.callingBack(() -> wallet.execute(OWNER_2, id), true);
        valueLedger.registerReceiver(RECIPIENT, receiver);

        // When
        assertThrows(TransferFailedException.class, () -> wallet.execute(OWNER_1, id));

        // Then
        assertEquals(1, receiver.failures().size());
        assertTrue(receiver.failures().get(0) instanceof ReentrantCallException);
        assertExecuted(id, false);
        assertBalance(POOL, Amount.of(10));
        assertBalance(RECIPIENT, Amount.ZERO);
        assertTrue(events.eventsOf(TransactionExecuted.class).isEmpty());
    }

    @Test
    void testNestedExecuteOfOtherTransaction_IsRejected() {
        // Given: two payable transactions to the same recipient
        fund(Amount.of(10));
        long first = proposeAndApprove(RECIPIENT, Amount.of(3), OWNER_1, OWNER_2);
        long second = proposeAndApprove(RECIPIENT, Amount.of(3), OWNER_1, OWNER_2);
        Receivers.CallbackReceiver receiver = Receivers.callingBack(() -> wallet.execute(OWNER_1, second), false);
        valueLedger.registerReceiver(RECIPIENT, receiver);

        // When
        wallet.execute(OWNER_1, first);

        // Then
        assertTrue(receiver.failures().get(0) instanceof ReentrantCallException);
        assertExecuted(first, true);
        assertExecuted(second, false);
        assertBalance(RECIPIENT, Amount.of(3));
    }

    @Test
    void testNestedMutatingCalls_AreAllRejected() {
        // Given
        fund(Amount.of(10));
        long id = proposeAndApprove(RECIPIENT, Amount.of(1), OWNER_1, OWNER_2);
        List<RuntimeException> failures = new ArrayList<>();
        List<Runnable> nestedCalls = List.of(
                () -> wallet.approve(OWNER_3, id),
                () -> wallet.propose(OWNER_3, RECIPIENT, Amount.of(1)),
                () -> wallet.deposit(RECIPIENT, Amount.of(1)));
        valueLedger.registerReceiver(RECIPIENT, (from, amount) -> {
            for (Runnable call : nestedCalls) {
                try {
                    call.run();
                } catch (RuntimeException e) {
                    failures.add(e);
                }
            }
            return true;
        });

        // When
        wallet.execute(OWNER_1, id);

        // Then
        assertEquals(3, failures.size());
        for (RuntimeException failure : failures) {
            assertTrue(failure instanceof MultiSigException);
            assertEquals(ErrorCode.REENTRANT_CALL, ((MultiSigException) failure).getErrorCode());
        }
        assertApprovalCount(id, 2);
        assertEquals(1, wallet.getTransactionCount());
        assertEquals(1, events.eventsOf(ProposedTransaction.class).size());
        assertBalance(POOL, Amount.of(9));
    }

    @Test
    void testNestedReads_AreAllowed_AndSeeExecutedFlag() {
        // Given
        fund(Amount.of(10));
        long id = proposeAndApprove(RECIPIENT, Amount.of(4), OWNER_1, OWNER_2);
        List<TransactionSnapshot> seen = new ArrayList<>();
        List<Amount> balances = new ArrayList<>();
        valueLedger.registerReceiver(RECIPIENT, (from, amount) -> {
            seen.add(wallet.getTransaction(id));
            balances.add(wallet.getBalance());
            return wallet.isOwner(OWNER_1) && wallet.hasApproved(id, OWNER_2);
        });

        // When
        wallet.execute(OWNER_1, id);

        // Then
        assertEquals(1, seen.size());
        assertTrue(seen.get(0).executed(), "Executed flag is committed before value moves");
        assertEquals(List.of(Amount.of(6)), balances);
        assertExecuted(id, true);
    }
}
