package com.nexus.backend.service.regime;

import com.nexus.backend.config.NexusProperties;
import com.nexus.backend.model.MarketRegime;
import com.nexus.backend.model.VolatilityState;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.List;

/**
 * Single-timeframe classifier over close prices.
 * <p>
 * Trend vs range comes from the least-squares slope of log price over the
 * most recent window. Volatility state compares the current return standard
 * deviation with the distribution of 30-sample rolling deviations of the
 * same series.
 */
@Service
@RequiredArgsConstructor
public class RegimeService {

    static final int MAX_WINDOW = 120;
    static final int ROLLING_WINDOW = 30;
    static final int MIN_RETURNS_FOR_VOL_STATE = 60;
    static final int MIN_ROLLING_SAMPLES = 10;
    private static final double EPS = 1e-9;

    private final NexusProperties nexusProperties;

    public record RegimeResult(MarketRegime regime, VolatilityState volatilityState, double slope, double volatility) {}

    public RegimeResult classify(List<Double> closes) {
        if (closes == null || closes.size() < 2) {
            return new RegimeResult(MarketRegime.UNKNOWN, VolatilityState.UNKNOWN, 0.0, 0.0);
        }
        double[] logPrices = closes.stream()
                .mapToDouble(close -> Math.log(close + EPS))
                .toArray();

        int window = Math.min(MAX_WINDOW, logPrices.length);
        double slope = slope(Arrays.copyOfRange(logPrices, logPrices.length - window, logPrices.length));

        double[] returns = new double[logPrices.length - 1];
        for (int i = 1; i < logPrices.length; i++) {
            returns[i - 1] = logPrices[i] - logPrices[i - 1];
        }
        double volatility = returns.length >= window
                ? populationStd(Arrays.copyOfRange(returns, returns.length - window, returns.length))
                : populationStd(returns);

        NexusProperties.Regime cfg = nexusProperties.getRegime();
        VolatilityState volatilityState = VolatilityState.LOW;
        if (returns.length > MIN_RETURNS_FOR_VOL_STATE) {
            double[] rolling = rollingSampleStd(returns, ROLLING_WINDOW);
            if (rolling.length > MIN_ROLLING_SAMPLES) {
                double threshold = quantile(rolling, cfg.getHighVolPercentile());
                volatilityState = volatility >= threshold ? VolatilityState.HIGH : VolatilityState.LOW;
            }
        }

        MarketRegime regime = Math.abs(slope) >= cfg.getTrendSlopeThreshold() ? MarketRegime.TREND : MarketRegime.RANGE;
        return new RegimeResult(regime, volatilityState, slope, volatility);
    }

    static double slope(double[] y) {
        int n = y.length;
        double xMean = (n - 1) / 2.0;
        double yMean = Arrays.stream(y).average().orElse(0.0);
        double num = 0.0;
        double den = 0.0;
        for (int i = 0; i < n; i++) {
            double dx = i - xMean;
            num += dx * (y[i] - yMean);
            den += dx * dx;
        }
        return num / (den + EPS);
    }

    static double populationStd(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double mean = Arrays.stream(values).average().orElse(0.0);
        double sumSq = 0.0;
        for (double v : values) {
            sumSq += (v - mean) * (v - mean);
        }
        return Math.sqrt(sumSq / values.length);
    }

    static double[] rollingSampleStd(double[] values, int window) {
        if (values.length < window) {
            return new double[0];
        }
        double[] out = new double[values.length - window + 1];
        for (int end = window; end <= values.length; end++) {
            double[] slice = Arrays.copyOfRange(values, end - window, end);
            double mean = Arrays.stream(slice).average().orElse(0.0);
            double sumSq = 0.0;
            for (double v : slice) {
                sumSq += (v - mean) * (v - mean);
            }
            out[end - window] = Math.sqrt(sumSq / (window - 1));
        }
        return out;
    }

    // Linear interpolation between closest ranks
    static double quantile(double[] values, double q) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double pos = q * (sorted.length - 1);
        int lower = (int) Math.floor(pos);
        int upper = (int) Math.ceil(pos);
        if (lower == upper) {
            return sorted[lower];
        }
        return sorted[lower] + (pos - lower) * (sorted[upper] - sorted[lower]);
    }
}
