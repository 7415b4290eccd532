package com.petition.archive.config;

import com.petition.archive.model.WorkflowConfig;
import io.micronaut.context.env.Environment;
import io.micronaut.core.type.Argument;
import io.micronaut.core.value.PropertyResolver;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Resolves the archive workflow properties into an immutable {@link WorkflowConfig}.
 *
 * Properties are read from the environment on every {@link #resolve()} call rather
 * than captured at startup, so a refreshed environment takes effect on the next
 * run and never in the middle of one.
 *
 * <ul>
 *   <li>{@code archive.invalid-signatures-enabled} (default {@code true})</li>
 *   <li>{@code archive.minimum-signature-lifetime} (default {@code 14d})</li>
 *   <li>{@code archive.required-queues} (default {@code signature-intake,validation-intake})</li>
 * </ul>
 */
@Singleton
public class WorkflowSettings {

    private static final Logger log = LoggerFactory.getLogger(WorkflowSettings.class);

    static final String ARCHIVING_ENABLED = "archive.invalid-signatures-enabled";
    static final String MINIMUM_LIFETIME  = "archive.minimum-signature-lifetime";
    static final String REQUIRED_QUEUES   = "archive.required-queues";

    static final Duration DEFAULT_MINIMUM_LIFETIME = Duration.ofDays(14);
    static final List<String> DEFAULT_REQUIRED_QUEUES = List.of("signature-intake", "validation-intake");

    private final PropertyResolver properties;

    @Inject
    public WorkflowSettings(Environment environment) {
        this((PropertyResolver) environment);
    }

    WorkflowSettings(PropertyResolver properties) {
        this.properties = properties;
    }

    /**
     * Takes a snapshot of the current configuration.
     *
     * @return the configuration for one run
     * @throws ConfigurationUnavailableException if a property is present but unusable
     */
    public WorkflowConfig resolve() {
        boolean archivingEnabled = read(ARCHIVING_ENABLED, properties.getProperty(ARCHIVING_ENABLED, Boolean.class))
                .orElse(true);
        Duration minimumLifetime = read(MINIMUM_LIFETIME, properties.getProperty(MINIMUM_LIFETIME, Duration.class))
                .orElse(DEFAULT_MINIMUM_LIFETIME);
        List<String> requiredQueues = read(REQUIRED_QUEUES,
                properties.getProperty(REQUIRED_QUEUES, Argument.listOf(String.class)))
                .orElse(DEFAULT_REQUIRED_QUEUES);

        if (minimumLifetime.isNegative()) {
            throw new ConfigurationUnavailableException(
                    MINIMUM_LIFETIME + " must not be negative, was " + minimumLifetime);
        }
        List<String> queues = requiredQueues.stream()
                .map(String::trim)
                .filter(q -> !q.isEmpty())
                .toList();
        if (queues.isEmpty()) {
            throw new ConfigurationUnavailableException(REQUIRED_QUEUES + " must name at least one queue");
        }

        WorkflowConfig config = new WorkflowConfig(archivingEnabled, minimumLifetime, queues);
        log.debug("Resolved workflow config archivingEnabled={} minimumLifetime={} requiredQueues={}",
                archivingEnabled, minimumLifetime, queues);
        return config;
    }

    /**
     * A property that is set but cannot be converted is an error, not a reason to fall
     * back to the default.
     */
    private <T> Optional<T> read(String name, Optional<T> converted) {
        if (converted.isEmpty() && properties.containsProperty(name)) {
            throw new ConfigurationUnavailableException("Property " + name + " has an unusable value");
        }
        return converted;
    }
}
