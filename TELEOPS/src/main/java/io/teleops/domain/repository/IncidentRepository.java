package io.teleops.domain.repository;

import io.teleops.domain.model.Incident;
import io.teleops.domain.model.Incident.IncidentStatus;

import java.util.List;
import java.util.Optional;

/**
 * Repository abstraction for incident persistence.
 */
public interface IncidentRepository {

    /**
     * Persist the given incident. Existing incidents are replaced.
     */
    Incident save(Incident incident);

    /**
     * Look up an incident by ID.
     */
    Optional<Incident> findById(String id);

    /**
     * Incidents matching both filters, newest start time first. A null filter matches everything.
     */
    List<Incident> findByStatusAndTenant(IncidentStatus status, String tenantId);

    long countByStatus(IncidentStatus status);

    /**
     * Remove every incident.
     *
     * @return number of incidents removed
     */
    int deleteAll();
}
