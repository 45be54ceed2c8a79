package com.ryuqq.multisig.adapter.inmemory.ledger;

import com.ryuqq.multisig.core.model.Address;
import com.ryuqq.multisig.core.model.Amount;
import com.ryuqq.multisig.core.spi.InflowListener;
import com.ryuqq.multisig.core.spi.TransferResult;
import com.ryuqq.multisig.core.spi.ValueLedger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory implementation of {@link ValueLedger} SPI for testing and reference purposes.
 *
 * <p>Balances live in a plain map guarded by this instance's monitor. Accounts may register a
 * {@link Receiver} hook that runs when value arrives, which is how tests simulate recipients that
 * refuse value or call back into the wallet during execution.</p>
 *
 * <p><strong>Transfer Algorithm:</strong></p>
 * <pre>
 * 1. balance(from) &lt; amount → Rejected(INSUFFICIENT_BALANCE)
 * 2. checkpoint all balances and pending inflows
 * 3. from -= amount, to += amount, queue inflow(to)
 * 4. receiver(to).onReceive(from, amount)
 *      false / exception → restore checkpoint, Rejected(RECIPIENT_REJECTED)
 * 5. Transferred
 * 6. outermost call only: release the monitor, then notify inflow listeners
 * </pre>
 *
 * <p>Restoring the whole checkpoint (not just reversing step 3) also undoes anything the
 * receiver moved during its callback, including inflows it queued.</p>
 *
 * <p><strong>Lock Ordering:</strong> receiver hooks run while the monitor is held. A hook may call
 * back into the wallet whose transfer delivered the value (that wallet already holds its guard).
 * A hook on a transfer started outside any wallet must not call a wallet sharing this ledger,
 * since that would take the wallet guard after the monitor.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * @author MultiSig Team
 * @since 1.0.0
 */
public class InMemoryValueLedger implements ValueLedger {

    private final Map<Address, Amount> balances = new HashMap<>();
    private final Map<Address, Receiver> receivers = new HashMap<>();
    private final Map<Address, List<InflowListener>> inflowListeners = new HashMap<>();
    private final List<TransferResult.Transferred> completedTransfers = new ArrayList<>();
    private final List<Inflow> pendingInflows = new ArrayList<>();
    private int depth;

    @Override
    public synchronized Amount balanceOf(Address account) {
        if (account == null) {
            throw new IllegalArgumentException("account cannot be null");
        }
        return balances.getOrDefault(account, Amount.ZERO);
    }

    @Override
    public void credit(Address sender, Address account, Amount amount) {
        if (sender == null) {
            throw new IllegalArgumentException("sender cannot be null");
        }
        if (account == null) {
            throw new IllegalArgumentException("account cannot be null");
        }
        if (amount == null) {
            throw new IllegalArgumentException("amount cannot be null");
        }
        List<Inflow> committed;
        synchronized (this) {
            balances.put(account, balanceOf(account).plus(amount));
            pendingInflows.add(new Inflow(sender, account, amount));
            committed = drainIfOutermost();
        }
        notifyInflows(committed);
    }

    @Override
    public TransferResult transfer(Address from, Address to, Amount amount) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("from and to cannot be null (from: " + from + ", to: " + to + ")");
        }
        if (amount == null) {
            throw new IllegalArgumentException("amount cannot be null");
        }
        TransferResult result;
        List<Inflow> committed;
        synchronized (this) {
            depth++;
            try {
                result = transferLocked(from, to, amount);
            } finally {
                depth--;
            }
            committed = drainIfOutermost();
        }
        notifyInflows(committed);
        return result;
    }

    private TransferResult transferLocked(Address from, Address to, Amount amount) {
        Amount available = balanceOf(from);
        if (available.isLessThan(amount)) {
            return TransferResult.Rejected.of(TransferResult.Rejected.INSUFFICIENT_BALANCE,
                String.format("%s holds %s, %s requested", from, available, amount));
        }

        Map<Address, Amount> checkpoint = new HashMap<>(balances);
        int transferCheckpoint = completedTransfers.size();
        int inflowCheckpoint = pendingInflows.size();
        balances.put(from, available.minus(amount));
        balances.put(to, balanceOf(to).plus(amount));
        pendingInflows.add(new Inflow(from, to, amount));

        Receiver receiver = receivers.get(to);
        if (receiver != null) {
            String refusal = deliver(receiver, from, amount);
            if (refusal != null) {
                restore(checkpoint, transferCheckpoint, inflowCheckpoint);
                return TransferResult.Rejected.of(TransferResult.Rejected.RECIPIENT_REJECTED, refusal);
            }
        }

        TransferResult.Transferred transferred = new TransferResult.Transferred(to, amount);
        completedTransfers.add(transferred);
        return transferred;
    }

    /**
     * 수신자 콜백 실행.
     *
     * @return 거부 사유, 수령했으면 null
     */
    private String deliver(Receiver receiver, Address from, Amount amount) {
        try {
            return receiver.onReceive(from, amount) ? null : "recipient refused the value";
        } catch (RuntimeException e) {
            return "recipient reverted: " + e.getMessage();
        }
    }

    private void restore(Map<Address, Amount> checkpoint, int transferCheckpoint, int inflowCheckpoint) {
        balances.clear();
        balances.putAll(checkpoint);
        completedTransfers.subList(transferCheckpoint, completedTransfers.size()).clear();
        pendingInflows.subList(inflowCheckpoint, pendingInflows.size()).clear();
    }

    /**
     * 가장 바깥 호출이면 확정된 inflow와 그 시점의 listener를 꺼냄.
     */
    private List<Inflow> drainIfOutermost() {
        if (depth > 0 || pendingInflows.isEmpty()) {
            return List.of();
        }
        List<Inflow> committed = new ArrayList<>(pendingInflows.size());
        for (Inflow inflow : pendingInflows) {
            List<InflowListener> listeners = inflowListeners.get(inflow.to());
            if (listeners != null) {
                committed.add(inflow.withListeners(List.copyOf(listeners)));
            }
        }
        pendingInflows.clear();
        return committed;
    }

    // 모니터 밖에서 호출
    private static void notifyInflows(List<Inflow> committed) {
        for (Inflow inflow : committed) {
            for (InflowListener listener : inflow.listeners()) {
                listener.onInflow(inflow.from(), inflow.amount());
            }
        }
    }

    @Override
    public synchronized void addInflowListener(Address account, InflowListener listener) {
        if (account == null) {
            throw new IllegalArgumentException("account cannot be null");
        }
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        inflowListeners.computeIfAbsent(account, key -> new ArrayList<>()).add(listener);
    }

    /**
     * 계정에 수신자 콜백 등록 (기존 콜백 교체).
     *
     * @param account 계정
     * @param receiver 콜백
     */
    public synchronized void registerReceiver(Address account, Receiver receiver) {
        if (account == null) {
            throw new IllegalArgumentException("account cannot be null");
        }
        if (receiver == null) {
            throw new IllegalArgumentException("receiver cannot be null");
        }
        receivers.put(account, receiver);
    }

    /**
     * 성공한 이전 내역 (발생 순서).
     *
     * @return 스냅샷 목록
     */
    public synchronized List<TransferResult.Transferred> completedTransfers() {
        return List.copyOf(completedTransfers);
    }

    /**
     * 잔액, 수신자 콜백, 이전 내역 초기화.
     *
     * <p>inflow listener는 이 원장을 쓰는 지갑의 등록이므로 유지합니다.</p>
     */
    public synchronized void clear() {
        balances.clear();
        receivers.clear();
        completedTransfers.clear();
        pendingInflows.clear();
    }

    private record Inflow(Address from, Address to, Amount amount, List<InflowListener> listeners) {

        Inflow(Address from, Address to, Amount amount) {
            this(from, to, amount, List.of());
        }

        Inflow withListeners(List<InflowListener> listeners) {
            return new Inflow(from, to, amount, listeners);
        }
    }
}
