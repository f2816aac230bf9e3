package tech.ochestra.kubecostguard.exception;

import tech.ochestra.kubecostguard.domain.model.HealthCategory;

/**
 * A secondary health check could not be evaluated. The category is reported
 * as unknown and the cycle continues.
 */
public class HealthCheckException extends RuntimeException {

    private final HealthCategory category;

    public HealthCheckException(HealthCategory category, String message) {
        super(message);
        this.category = category;
    }

    public HealthCategory getCategory() {
        return category;
    }
}
