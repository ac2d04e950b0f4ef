package io.teleops.domain.repository;

import io.teleops.domain.model.Incident;
import io.teleops.domain.model.Incident.IncidentStatus;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory incident store; durable storage is owned by an external collaborator.
 */
@Repository
public class InMemoryIncidentRepository implements IncidentRepository {

    private static final Comparator<Incident> NEWEST_FIRST = Comparator
            .comparing(Incident::getStartTime, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(Incident::getId);

    private final Map<String, Incident> store = new ConcurrentHashMap<>();

    @Override
    public Incident save(Incident incident) {
        store.put(incident.getId(), incident);
        return incident;
    }

    @Override
    public Optional<Incident> findById(String id) {
        return Optional.ofNullable(store.get(id));
    }

    @Override
    public List<Incident> findByStatusAndTenant(IncidentStatus status, String tenantId) {
        return store.values().stream()
                .filter(incident -> status == null || incident.getStatus() == status)
                .filter(incident -> tenantId == null || tenantId.equals(incident.getTenantId()))
                .sorted(NEWEST_FIRST)
                .toList();
    }

    @Override
    public long countByStatus(IncidentStatus status) {
        return store.values().stream()
                .filter(incident -> incident.getStatus() == status)
                .count();
    }

    @Override
    public int deleteAll() {
        int removed = store.size();
        store.clear();
        return removed;
    }
}
