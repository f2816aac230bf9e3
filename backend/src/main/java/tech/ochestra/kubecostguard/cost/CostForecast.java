package tech.ochestra.kubecostguard.cost;

/**
 * Advisory monthly cost projection from the utilization trend.
 *
 * With INSUFFICIENT_HISTORY only the current cost and sample count are set.
 */
public record CostForecast(
        Status status,
        int horizonDays,
        int sampleCount,
        double currentMonthlyCost,
        Double currentUtilization,
        Double projectedUtilization,
        Double dailyTrend,
        Double lowMonthlyCost,
        Double expectedMonthlyCost,
        Double highMonthlyCost
) {
    public enum Status {
        FORECAST,
        INSUFFICIENT_HISTORY
    }

    public static CostForecast insufficientHistory(int sampleCount, int horizonDays, double currentMonthlyCost) {
        return new CostForecast(Status.INSUFFICIENT_HISTORY, horizonDays, sampleCount, currentMonthlyCost,
                null, null, null, null, null, null);
    }

    public boolean isAvailable() {
        return status == Status.FORECAST;
    }
}
