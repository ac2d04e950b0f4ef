package io.teleops.domain.repository;

import io.teleops.domain.model.RcaArtifact;

import java.util.List;
import java.util.Optional;

/**
 * Repository abstraction for RCA artifacts.
 */
public interface RcaArtifactRepository {

    RcaArtifact save(RcaArtifact artifact);

    /**
     * Artifacts for one incident, oldest first.
     */
    List<RcaArtifact> findByIncidentId(String incidentId);

    /**
     * Most recent artifact for an incident.
     */
    Optional<RcaArtifact> findLatestByIncidentId(String incidentId);

    /**
     * @return number of artifacts removed
     */
    int deleteAll();
}
