package tech.ochestra.kubecostguard.cost;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tech.ochestra.kubecostguard.domain.snapshot.UsageSample;

import java.time.Duration;
import java.util.Comparator;
import java.util.List;

/**
 * Linear trend forecast of monthly cost.
 *
 * Fits a least-squares line through the mean utilization history, projects it
 * {@code horizonDays} past the last sample and scales the current monthly cost
 * by projected / current utilization. Bands come from the residual spread,
 * never narrower than +/-10%.
 *
 * This is advisory. Fewer than two samples yields INSUFFICIENT_HISTORY instead
 * of an error.
 */
@Service
@Slf4j
public class CostForecastService {

    static final int MINIMUM_SAMPLES = 2;
    static final double MINIMUM_BAND = 0.10;
    private static final double SECONDS_PER_DAY = 86_400.0;

    public CostForecast forecast(List<UsageSample> history, double currentMonthlyCost, int horizonDays) {
        if (history.size() < MINIMUM_SAMPLES) {
            log.debug("Cost forecast skipped: {} utilization samples", history.size());
            return CostForecast.insufficientHistory(history.size(), horizonDays, currentMonthlyCost);
        }

        List<UsageSample> samples = history.stream()
                .sorted(Comparator.comparing(UsageSample::timestamp))
                .toList();
        int n = samples.size();
        double[] x = new double[n];
        double[] y = new double[n];
        for (int i = 0; i < n; i++) {
            x[i] = Duration.between(samples.get(0).timestamp(), samples.get(i).timestamp()).toMillis()
                    / 1000.0 / SECONDS_PER_DAY;
            y[i] = samples.get(i).meanUtilization();
        }

        double meanX = mean(x);
        double meanY = mean(y);
        double sxx = 0;
        double sxy = 0;
        for (int i = 0; i < n; i++) {
            sxx += (x[i] - meanX) * (x[i] - meanX);
            sxy += (x[i] - meanX) * (y[i] - meanY);
        }
        // All samples at one instant: no slope to fit
        double slope = sxx == 0 ? 0.0 : sxy / sxx;
        double intercept = meanY - slope * meanX;

        double residualSquares = 0;
        for (int i = 0; i < n; i++) {
            double residual = y[i] - (intercept + slope * x[i]);
            residualSquares += residual * residual;
        }
        double residualStdDev = Math.sqrt(residualSquares / n);

        double current = y[n - 1];
        double projected = clamp(intercept + slope * (x[n - 1] + horizonDays));
        double ratio = current > 0 ? projected / current : 1.0;
        double expected = currentMonthlyCost * ratio;
        double band = Math.max(MINIMUM_BAND, current > 0 ? residualStdDev / current : MINIMUM_BAND);

        log.debug("Cost forecast: utilization {} -> {} over {} days, expected ${}/month",
                String.format("%.3f", current), String.format("%.3f", projected), horizonDays,
                String.format("%.2f", expected));

        return new CostForecast(
                CostForecast.Status.FORECAST,
                horizonDays,
                n,
                currentMonthlyCost,
                current,
                projected,
                slope,
                Math.max(0.0, expected * (1 - band)),
                expected,
                expected * (1 + band)
        );
    }

    private static double mean(double[] values) {
        double total = 0;
        for (double value : values) {
            total += value;
        }
        return total / values.length;
    }

    private static double clamp(double utilization) {
        return Math.max(0.0, Math.min(1.0, utilization));
    }
}
