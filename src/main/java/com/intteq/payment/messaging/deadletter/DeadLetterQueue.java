package com.intteq.payment.messaging.deadletter;

import com.intteq.payment.messaging.admin.QueueAdministrator;
import com.intteq.payment.messaging.admin.QueueStats;
import com.intteq.payment.messaging.topology.TopologyDescriptor;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * The terminal queue for messages that exhausted their retries.
 *
 * <p>Not an active component: it is filled only by the broker's dead-letter routing and
 * messages expire after the configured TTL. Draining and replay are left to operators.
 */
@Getter
@RequiredArgsConstructor
public class DeadLetterQueue {

    static final String X_DEATH_HEADER = "x-death";

    private final String name;
    private final Duration ttl;
    private final QueueAdministrator administrator;

    public static DeadLetterQueue of(TopologyDescriptor topology, QueueAdministrator administrator) {
        return new DeadLetterQueue(topology.getDeadLetterQueue(), topology.getDeadLetterTtl(), administrator);
    }

    /**
     * Messages currently waiting in the DLQ; empty if the broker cannot be asked.
     */
    public OptionalLong depth() {
        return administrator.stats(name)
                .map(stats -> OptionalLong.of(stats.getMessageCount()))
                .orElseGet(OptionalLong::empty);
    }

    public Optional<QueueStats> stats() {
        return administrator.stats(name);
    }

    /**
     * Whether the broker has dead-lettered this message at least once.
     */
    public static boolean isDeadLettered(Map<String, Object> headers) {
        return !deaths(headers).isEmpty();
    }

    /**
     * The most recent death, which the broker keeps first in {@code x-death}.
     */
    public static Optional<DeathRecord> lastDeath(Map<String, Object> headers) {
        List<DeathRecord> deaths = deaths(headers);
        return deaths.isEmpty() ? Optional.empty() : Optional.of(deaths.get(0));
    }

    /**
     * All death records carried by {@code headers}, most recent first.
     */
    public static List<DeathRecord> deaths(Map<String, Object> headers) {
        if (headers == null || !(headers.get(X_DEATH_HEADER) instanceof List<?> entries)) {
            return Collections.emptyList();
        }
        List<DeathRecord> records = new ArrayList<>();
        for (Object entry : entries) {
            if (entry instanceof Map<?, ?> death) {
                records.add(new DeathRecord(
                        string(death.get("queue")),
                        string(death.get("reason")),
                        death.get("count") instanceof Number n ? n.longValue() : 0L,
                        string(death.get("exchange")),
                        strings(death.get("routing-keys"))));
            }
        }
        return records;
    }

    private static String string(Object value) {
        // values arrive as LongString from the wire
        return value == null ? null : value.toString();
    }

    private static List<String> strings(Object value) {
        if (!(value instanceof List<?> list)) {
            return Collections.emptyList();
        }
        List<String> result = new ArrayList<>(list.size());
        list.forEach(item -> result.add(string(item)));
        return result;
    }
}
