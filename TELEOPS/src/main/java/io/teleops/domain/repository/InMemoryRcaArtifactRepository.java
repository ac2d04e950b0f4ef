package io.teleops.domain.repository;

import io.teleops.domain.model.RcaArtifact;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory RCA artifact store, grouped by incident.
 */
@Repository
public class InMemoryRcaArtifactRepository implements RcaArtifactRepository {

    private final Map<String, List<RcaArtifact>> store = new ConcurrentHashMap<>();

    @Override
    public RcaArtifact save(RcaArtifact artifact) {
        store.computeIfAbsent(artifact.getIncidentId(), id -> new CopyOnWriteArrayList<>())
                .add(artifact);
        return artifact;
    }

    @Override
    public List<RcaArtifact> findByIncidentId(String incidentId) {
        return new ArrayList<>(store.getOrDefault(incidentId, List.of()));
    }

    @Override
    public Optional<RcaArtifact> findLatestByIncidentId(String incidentId) {
        List<RcaArtifact> artifacts = store.getOrDefault(incidentId, List.of());
        return artifacts.isEmpty() ? Optional.empty() : Optional.of(artifacts.get(artifacts.size() - 1));
    }

    @Override
    public int deleteAll() {
        int removed = store.values().stream().mapToInt(List::size).sum();
        store.clear();
        return removed;
    }
}
