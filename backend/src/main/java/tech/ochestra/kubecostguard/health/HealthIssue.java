package tech.ochestra.kubecostguard.health;

import tech.ochestra.kubecostguard.domain.model.IssueSeverity;
import tech.ochestra.kubecostguard.domain.model.ResourceKind;

import java.time.Instant;

/**
 * A detected problem. Generated per evaluation cycle, never persisted.
 */
public record HealthIssue(
        IssueSeverity severity,
        ResourceKind resourceKind,
        String namespace,
        String name,
        String message,
        String suggestion,
        Instant detectedAt
) {}
