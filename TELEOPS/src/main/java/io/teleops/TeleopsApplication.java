package io.teleops;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * TeleOps - alert correlation and baseline root cause analysis for network operations.
 *
 * <p>TeleOps provides:
 * <ul>
 *   <li>Alert correlation - tag grouping with adaptive noise filtering and time windows</li>
 *   <li>Baseline RCA - keyword matching against a hot-swappable rule table</li>
 *   <li>Quality evaluation - grading hypotheses against synthetic and labeled ground truth</li>
 * </ul>
 */
@SpringBootApplication
@EnableConfigurationProperties
public class TeleopsApplication {

    public static void main(String[] args) {
        SpringApplication.run(TeleopsApplication.class, args);
    }
}
