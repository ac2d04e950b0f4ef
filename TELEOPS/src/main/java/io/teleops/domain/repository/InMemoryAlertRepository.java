package io.teleops.domain.repository;

import io.teleops.domain.model.Alert;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory alert store keyed by alert ID.
 */
@Repository
public class InMemoryAlertRepository implements AlertRepository {

    private final Map<String, Alert> store = new ConcurrentHashMap<>();

    @Override
    public List<Alert> saveAll(Collection<Alert> alerts) {
        alerts.forEach(alert -> store.put(alert.getId(), alert));
        return new ArrayList<>(alerts);
    }

    @Override
    public List<Alert> findAll() {
        return new ArrayList<>(store.values());
    }

    @Override
    public List<Alert> findAllById(Collection<String> ids) {
        return ids.stream()
                .map(store::get)
                .filter(Objects::nonNull)
                .toList();
    }

    @Override
    public long count() {
        return store.size();
    }

    @Override
    public int deleteAll() {
        int removed = store.size();
        store.clear();
        return removed;
    }
}
