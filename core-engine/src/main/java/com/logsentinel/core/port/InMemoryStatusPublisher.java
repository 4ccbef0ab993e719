package com.logsentinel.core.port;

import com.logsentinel.core.model.StatusRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * {@link StatusPublisher} that keeps every record in memory, keyed like the
 * external store. Thread-safe.
 */
public class InMemoryStatusPublisher implements StatusPublisher {

    private final Map<String, List<StatusRecord>> records = new ConcurrentHashMap<>();

    @Override
    public void publish(String key, StatusRecord record) {
        records.computeIfAbsent(key, k -> new CopyOnWriteArrayList<>()).add(record);
    }

    /**
     * @return the most recent record under {@code key}
     */
    public Optional<StatusRecord> latest(String key) {
        List<StatusRecord> list = records.get(key);
        if (list == null || list.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(list.get(list.size() - 1));
    }

    /**
     * @return every record under {@code key}, oldest first
     */
    public List<StatusRecord> history(String key) {
        List<StatusRecord> list = records.get(key);
        return list == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(list));
    }

    public Set<String> keys() {
        return Collections.unmodifiableSet(new TreeSet<>(records.keySet()));
    }

    public void clear() {
        records.clear();
    }
}
