package io.teleops.correlation;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Random;

/**
 * Generates incident identifiers of the form {@code {tag}_{yyyyMMdd}_{HHmmss}_{hex4}}.
 * <p>
 * The timestamp is the generation time in UTC; the suffix is four lowercase hex digits.
 */
@Component
public class IncidentIdGenerator {

    private static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    private final Clock clock;
    private final Random random;

    @Autowired
    public IncidentIdGenerator(Clock clock) {
        this(clock, new SecureRandom());
    }

    public IncidentIdGenerator(Clock clock, Random random) {
        this.clock = clock;
        this.random = random;
    }

    public String nextId(String tag) {
        return String.format("%s_%s_%04x",
                tag, TIMESTAMP_FORMAT.format(clock.instant()), random.nextInt(0x10000));
    }
}
