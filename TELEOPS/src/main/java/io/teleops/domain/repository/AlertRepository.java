package io.teleops.domain.repository;

import io.teleops.domain.model.Alert;

import java.util.Collection;
import java.util.List;

/**
 * Repository abstraction for ingested alerts.
 */
public interface AlertRepository {

    List<Alert> saveAll(Collection<Alert> alerts);

    List<Alert> findAll();

    /**
     * Alerts whose IDs are in the given set; unknown IDs are ignored.
     */
    List<Alert> findAllById(Collection<String> ids);

    long count();

    /**
     * Remove every stored alert.
     *
     * @return number of alerts removed
     */
    int deleteAll();
}
