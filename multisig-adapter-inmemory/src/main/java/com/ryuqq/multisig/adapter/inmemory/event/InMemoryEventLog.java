package com.ryuqq.multisig.adapter.inmemory.event;

import com.ryuqq.multisig.core.event.WalletEvent;
import com.ryuqq.multisig.core.spi.EventPublisher;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link EventPublisher} SPI.
 *
 * <p>Records every published {@link WalletEvent} in publication order.
 * {@link CopyOnWriteArrayList} gives thread-safe appends and snapshot iteration.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryEventLog events = new InMemoryEventLog();
 * MultiSigWallet wallet = new QuorumWallet(config, ledger, events);
 *
 * List&lt;ApprovedTransaction&gt; approvals = events.eventsOf(ApprovedTransaction.class);
 * </pre>
 *
 * @author MultiSig Team
 * @since 1.0.0
 */
public class InMemoryEventLog implements EventPublisher {

    private final List<WalletEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void publish(WalletEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        events.add(event);
    }

    /**
     * 전체 알림 (발행 순서).
     *
     * @return 불변 스냅샷
     */
    public List<WalletEvent> events() {
        return List.copyOf(events);
    }

    /**
     * 특정 타입의 알림만 조회 (발행 순서).
     *
     * @param type 알림 타입
     * @param <T> 알림 타입
     * @return 불변 목록
     */
    public <T extends WalletEvent> List<T> eventsOf(Class<T> type) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        return events.stream()
            .filter(type::isInstance)
            .map(type::cast)
            .collect(Collectors.toUnmodifiableList());
    }

    public int size() {
        return events.size();
    }

    public void clear() {
        events.clear();
    }
}
