package com.vigil.service.core.detect.method;

import com.vigil.metric.model.MetricSeries;
import com.vigil.metric.model.Sensitivity;
import com.vigil.service.core.detect.AnomalyDetector;
import com.vigil.service.core.detect.DetectorCategory;
import com.vigil.service.core.detect.DetectorDescriptor;
import com.vigil.service.core.detect.DetectorOutput;
import com.vigil.service.core.detect.DetectorParameters;
import com.vigil.service.core.detect.ParameterKind;
import com.vigil.service.core.detect.SeriesStatistics;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.QRDecomposition;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Prophet-style forecast interval. An additive least-squares model (linear trend, plus daily
 * Fourier terms once the series spans enough days) is fitted to the series; a point is anomalous
 * when it falls outside {@code forecast ± z * sigma}, with sigma the robust residual scale.
 *
 * <p>The score is {@code min(1, |residual| / (2 z sigma))}, so the interval edge maps to 0.5.
 */
@Component
@Order(50)
@Slf4j
public class ForecastIntervalDetector implements AnomalyDetector {

    public static final String NAME = "prophet";
    public static final String OPTION_SEASONALITY_ORDER = "seasonality-order";
    public static final String OPTION_SEASONAL_MIN_DAYS = "seasonal-min-days";

    private static final DetectorDescriptor DESCRIPTOR = DetectorDescriptor.of(
            NAME,
            DetectorCategory.ML,
            "Forecast with trend and daily seasonality; flags values outside the confidence interval.",
            List.of("seasonal series", "trend", "business metrics"),
            10);

    static final double FLAG_SCORE = 0.5;
    private static final int DEFAULT_SEASONALITY_ORDER = 3;
    private static final double DEFAULT_SEASONAL_MIN_DAYS = 2.0;
    private static final double MAD_TO_SIGMA = 1.4826;
    private static final double SECONDS_PER_DAY = Duration.ofDays(1).toSeconds();

    @Override
    public DetectorDescriptor descriptor() {
        return DESCRIPTOR;
    }

    @Override
    public ParameterKind parameterKind() {
        return ParameterKind.THRESHOLD;
    }

    @Override
    public Map<Sensitivity, Double> defaultSensitivity() {
        return Map.of(Sensitivity.LOW, 2.576, Sensitivity.MEDIUM, 1.960, Sensitivity.HIGH, 1.282);
    }

    @Override
    public Map<String, Double> defaultOptions() {
        return Map.of(
                OPTION_SEASONALITY_ORDER, (double) DEFAULT_SEASONALITY_ORDER,
                OPTION_SEASONAL_MIN_DAYS, DEFAULT_SEASONAL_MIN_DAYS);
    }

    @Override
    public DetectorOutput score(MetricSeries series, DetectorParameters parameters) {
        return fit(series, parameters).score(series, parameters);
    }

    @Override
    public AnomalyDetector fit(MetricSeries series, DetectorParameters parameters) {
        long origin = series.timestamp(0).getEpochSecond();
        double span = series.timestamp(series.size() - 1).getEpochSecond() - origin;
        double spanDays = span / SECONDS_PER_DAY;
        int order = parameters.intOption(OPTION_SEASONALITY_ORDER, DEFAULT_SEASONALITY_ORDER);
        boolean seasonal = order > 0 && spanDays >= parameters.option(OPTION_SEASONAL_MIN_DAYS, DEFAULT_SEASONAL_MIN_DAYS);

        Basis basis = new Basis(origin, span > 0 ? span : 1.0, seasonal ? order : 0);
        double[] values = series.values();
        double[][] design = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            design[i] = basis.row(series.timestamp(i).getEpochSecond());
        }
        double[] coefficients = leastSquares(design, values);

        double[] residuals = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            residuals[i] = values[i] - dot(design[i], coefficients);
        }
        double sigma = MAD_TO_SIGMA * SeriesStatistics.mad(residuals);
        if (!(sigma > 0)) {
            sigma = SeriesStatistics.stddev(residuals);
        }
        log.debug(
                "prophet fitted stream={} points={} seasonal={} sigma={}",
                series.streamKey(), values.length, seasonal, sigma);
        return new FittedForecast(this, basis, coefficients, sigma);
    }

    @Override
    public String explain(MetricSeries series, int index, double score, DetectorParameters parameters) {
        return String.format("value %.2f falls outside the forecast interval", series.value(index));
    }

    /** Least-squares coefficients of {@code design * b ~ target}, via a QR decomposition of the design matrix. */
    static double[] leastSquares(double[][] design, double[] target) {
        DecompositionSolver solver = new QRDecomposition(new Array2DRowRealMatrix(design, false)).getSolver();
        return solver.solve(new ArrayRealVector(target, false)).toArray();
    }

    private static double dot(double[] a, double[] b) {
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            sum += a[i] * b[i];
        }
        return sum;
    }

    /** Regressors: intercept, trend over [0, 1] and {@code order} sine/cosine pairs of the time of day. */
    private record Basis(long origin, double span, int order) {

        double[] row(long epochSecond) {
            double[] row = new double[2 + 2 * order];
            row[0] = 1.0;
            row[1] = (epochSecond - origin) / span;
            double dayFraction = Math.floorMod(epochSecond, (long) SECONDS_PER_DAY) / SECONDS_PER_DAY;
            for (int j = 1; j <= order; j++) {
                double angle = 2 * Math.PI * j * dayFraction;
                row[2 * j] = Math.sin(angle);
                row[2 * j + 1] = Math.cos(angle);
            }
            return row;
        }
    }

    static final class FittedForecast implements AnomalyDetector {
        private final ForecastIntervalDetector method;
        private final Basis basis;
        private final double[] coefficients;
        private final double sigma;

        private FittedForecast(ForecastIntervalDetector method, Basis basis, double[] coefficients, double sigma) {
            this.method = method;
            this.basis = basis;
            this.coefficients = coefficients;
            this.sigma = sigma;
        }

        double forecast(long epochSecond) {
            return dot(basis.row(epochSecond), coefficients);
        }

        @Override
        public DetectorDescriptor descriptor() {
            return method.descriptor();
        }

        @Override
        public ParameterKind parameterKind() {
            return method.parameterKind();
        }

        @Override
        public Map<Sensitivity, Double> defaultSensitivity() {
            return method.defaultSensitivity();
        }

        @Override
        public Map<String, Double> defaultOptions() {
            return method.defaultOptions();
        }

        @Override
        public DetectorOutput score(MetricSeries series, DetectorParameters parameters) {
            int n = series.size();
            if (!(sigma > 0)) {
                return DetectorOutput.silent(n);
            }
            double width = 2 * parameters.value() * sigma;
            double[] scores = new double[n];
            for (int i = 0; i < n; i++) {
                double residual = series.value(i) - forecast(series.timestamp(i).getEpochSecond());
                scores[i] = SeriesStatistics.clamp01(Math.abs(residual) / width);
            }
            return new DetectorOutput(scores, FLAG_SCORE);
        }

        @Override
        public String explain(MetricSeries series, int index, double score, DetectorParameters parameters) {
            double expected = forecast(series.timestamp(index).getEpochSecond());
            double half = parameters.value() * sigma;
            return String.format(
                    "value %.2f falls outside the forecast interval [%.2f, %.2f]",
                    series.value(index), expected - half, expected + half);
        }
    }
}
