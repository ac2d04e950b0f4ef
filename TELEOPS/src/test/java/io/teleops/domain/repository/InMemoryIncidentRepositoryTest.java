package io.teleops.domain.repository;

import io.teleops.domain.model.Incident;
import io.teleops.domain.model.Incident.IncidentStatus;
import io.teleops.testing.fixtures.TestDataFactories;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryIncidentRepositoryTest {

    private final Instant t0 = TestDataFactories.fixedInstant();
    private InMemoryIncidentRepository repository;

    @BeforeEach
    void setUp() {
        repository = new InMemoryIncidentRepository();
        repository.save(incident("a", "tenant-a", IncidentStatus.OPEN, t0));
        repository.save(incident("b", "tenant-a", IncidentStatus.CLOSED, t0.plusSeconds(60)));
        repository.save(incident("c", "tenant-b", IncidentStatus.OPEN, t0.plusSeconds(120)));
        repository.save(incident("d", "tenant-b", IncidentStatus.OPEN, null));
    }

    private static Incident incident(String id, String tenant, IncidentStatus status, Instant start) {
        return Incident.builder()
                .id(id)
                .tenantId(tenant)
                .status(status)
                .startTime(start)
                .build();
    }

    @Test
    void unfilteredListIsNewestFirstWithUndatedLast() {
        assertThat(repository.findByStatusAndTenant(null, null))
                .extracting(Incident::getId)
                .containsExactly("c", "b", "a", "d");
    }

    @Test
    void filtersCombine() {
        assertThat(repository.findByStatusAndTenant(IncidentStatus.OPEN, null))
                .extracting(Incident::getId)
                .containsExactly("c", "a", "d");
        assertThat(repository.findByStatusAndTenant(IncidentStatus.OPEN, "tenant-a"))
                .extracting(Incident::getId)
                .containsExactly("a");
        assertThat(repository.findByStatusAndTenant(IncidentStatus.CLOSED, "tenant-b")).isEmpty();
    }

    @Test
    void countsByStatusAndClears() {
        assertThat(repository.countByStatus(IncidentStatus.OPEN)).isEqualTo(3);
        assertThat(repository.countByStatus(IncidentStatus.CLOSED)).isEqualTo(1);

        assertThat(repository.deleteAll()).isEqualTo(4);
        assertThat(repository.findByStatusAndTenant(null, null)).isEmpty();
        assertThat(repository.findById("a")).isEmpty();
    }
}
