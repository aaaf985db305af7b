package org.carball.pivot.validator;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.stat.inference.KolmogorovSmirnovTest;
import org.carball.pivot.config.ValidationSettings;
import org.carball.pivot.model.analysis.FunctionSpec;
import org.carball.pivot.model.parity.ErrorStatistics;
import org.carball.pivot.model.parity.ParityCertificate;
import org.carball.pivot.model.parity.PerformanceComparison;
import org.carball.pivot.model.parity.TestFailure;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.LongSupplier;

/**
 * Runs the legacy function and its vessel on the same generated inputs and certifies the
 * vessel when no comparison fails and the confidence reaches the configured threshold.
 */
@Slf4j
public class ParityValidator implements Validator {

    public static final String NAME = "parity";

    static final int MAX_REPORTED_FAILURES = 20;

    private final ValidationSettings settings;
    private final RegressionInputStore regressionInputs;
    private final LongSupplier nanoClock;
    private final Clock clock;
    private final OutputComparator comparator;
    private final ConfidenceCalculator confidenceCalculator;

    public ParityValidator(ValidationSettings settings) {
        this(settings, null);
    }

    public ParityValidator(ValidationSettings settings, RegressionInputStore regressionInputs) {
        this(settings, regressionInputs, System::nanoTime, Clock.systemUTC());
    }

    public ParityValidator(ValidationSettings settings, RegressionInputStore regressionInputs,
                           LongSupplier nanoClock, Clock clock) {
        settings.validate();
        this.settings = settings;
        this.regressionInputs = regressionInputs;
        this.nanoClock = nanoClock;
        this.clock = clock;
        this.comparator = new OutputComparator(settings.getTolerance());
        this.confidenceCalculator = new ConfidenceCalculator(settings.getAcceptableFailureRate());
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ParityCertificate validate(FunctionSpec spec, FunctionRunner legacy, FunctionRunner vessel)
            throws IOException {
        List<ArgumentDomain> domains = spec.arguments().stream()
                .map(argument -> ArgumentDomain.of(argument, settings))
                .toList();
        return validate(spec, domains, legacy, vessel);
    }

    /**
     * Validates with explicit argument domains instead of the ones inferred from type hints.
     */
    public ParityCertificate validate(FunctionSpec spec, List<ArgumentDomain> domains,
                                      FunctionRunner legacy, FunctionRunner vessel) throws IOException {
        if (domains.size() != spec.arguments().size()) {
            throw new IllegalArgumentException("Function " + spec.name() + " takes " + spec.arguments().size()
                    + " argument(s) but " + domains.size() + " domain(s) were given");
        }

        List<List<Object>> stored = regressionInputs != null ? regressionInputs.load(spec.name()) : List.of();
        List<List<Object>> inputs = new TestInputGenerator(settings.getTestCaseCount(), settings.getSeed())
                .generate(domains, stored);

        log.info("Validating {} against {} input(s) (seed {}, tolerance {})",
                spec.name(), inputs.size(), settings.getSeed(), settings.getTolerance());

        Duration timeout = Duration.ofMillis(settings.getCallTimeoutMs());
        Tally tally = new Tally();

        try (TimedInvoker invoker = new TimedInvoker(nanoClock, "pivot-parity")) {
            for (List<Object> input : inputs) {
                TimedInvoker.Outcome legacyOutcome = invoker.call(legacy, input, timeout);
                TimedInvoker.Outcome vesselOutcome = invoker.call(vessel, input, timeout);
                tally.record(input, legacyOutcome, vesselOutcome);
            }
        }

        ParityCertificate certificate = buildCertificate(spec, inputs.size(), tally);

        if (regressionInputs != null && !tally.failedInputs.isEmpty()) {
            regressionInputs.append(spec.name(), tally.failedInputs);
        }

        if (certificate.certified()) {
            log.info("{} certified: {}/{} passed, confidence {}%, speedup {}x",
                    spec.name(), certificate.passed(), certificate.testCount(),
                    String.format("%.4f", certificate.confidence()),
                    String.format("%.2f", certificate.performance().speedup()));
        } else {
            log.info("{} not certified: {} failed ({} timed out), confidence {}%",
                    spec.name(), certificate.failed(), certificate.timedOut(),
                    String.format("%.4f", certificate.confidence()));
        }
        return certificate;
    }

    private ParityCertificate buildCertificate(FunctionSpec spec, int testCount, Tally tally) {
        Similarity similarity = similarity(tally, testCount);
        double confidence = confidenceCalculator.confidence(
                tally.passed, tally.failed, similarity.statistic(), similarity.n(), similarity.m());
        boolean certified = tally.failed == 0 && confidence >= settings.getConfidenceThreshold();

        return ParityCertificate.builder()
                .functionName(spec.name())
                .certified(certified)
                .confidence(confidence)
                .testCount(testCount)
                .passed(tally.passed)
                .failed(tally.failed)
                .timedOut(tally.timedOut)
                .seed(settings.getSeed())
                .tolerance(settings.getTolerance())
                .confidenceThreshold(settings.getConfidenceThreshold())
                .performance(PerformanceComparison.of(tally.legacyMs, tally.vesselMs))
                .statistics(errorStatistics(tally, similarity.statistic()))
                .failures(tally.failures)
                .createdAt(clock.instant())
                .build();
    }

    private static ErrorStatistics errorStatistics(Tally tally, double similarityStatistic) {
        DescriptiveStatistics errors = tally.errors;
        if (errors.getN() == 0) {
            return new ErrorStatistics(0.0, 0.0, 0.0, 0.0, similarityStatistic);
        }
        double stddev = errors.getN() > 1 ? errors.getStandardDeviation() : 0.0;
        return new ErrorStatistics(
                errors.getMean(),
                errors.getPercentile(50),
                stddev,
                errors.getMax(),
                similarityStatistic);
    }

    /**
     * Two-sample KS distance between numeric legacy and vessel outputs. A vessel output that
     * matched within tolerance enters the vessel sample as its legacy value, so only failing
     * comparisons can move the distributions apart. Without enough numeric outputs the
     * mismatch fraction stands in for it.
     */
    private static Similarity similarity(Tally tally, int testCount) {
        double[] legacyValues = tally.legacyNumbers.stream().mapToDouble(Double::doubleValue).toArray();
        double[] vesselValues = tally.vesselNumbers.stream().mapToDouble(Double::doubleValue).toArray();

        if (legacyValues.length >= 2 && vesselValues.length >= 2) {
            double statistic = new KolmogorovSmirnovTest().kolmogorovSmirnovStatistic(legacyValues, vesselValues);
            return new Similarity(statistic, legacyValues.length, vesselValues.length);
        }

        double mismatch = testCount == 0 ? 0.0 : (double) tally.failed / testCount;
        return new Similarity(mismatch, testCount, testCount);
    }

    private record Similarity(double statistic, int n, int m) {
    }

    private class Tally {
        int passed;
        int failed;
        int timedOut;
        double legacyMs;
        double vesselMs;
        final DescriptiveStatistics errors = new DescriptiveStatistics();
        final List<Double> legacyNumbers = new ArrayList<>();
        final List<Double> vesselNumbers = new ArrayList<>();
        final List<TestFailure> failures = new ArrayList<>();
        final List<List<Object>> failedInputs = new ArrayList<>();

        void record(List<Object> input, TimedInvoker.Outcome legacy, TimedInvoker.Outcome vessel) {
            if (!legacy.succeeded() || !vessel.succeeded()) {
                if (legacy.timedOut() || vessel.timedOut()) {
                    timedOut++;
                }
                String reason = !legacy.succeeded()
                        ? "Legacy: " + legacy.describeFailure()
                        : "Vessel: " + vessel.describeFailure();
                fail(new TestFailure(input, legacy.value(), vessel.value(), 1.0, reason));
                return;
            }

            legacyMs += legacy.durationMs();
            vesselMs += vessel.durationMs();

            OutputComparator.Comparison comparison = comparator.compare(legacy.value(), vessel.value());
            errors.addValue(comparison.relativeError());
            collectNumbers(legacy.value(), legacyNumbers);
            collectNumbers(comparison.matches() ? legacy.value() : vessel.value(), vesselNumbers);
            if (comparison.matches()) {
                passed++;
            } else {
                fail(new TestFailure(input, legacy.value(), vessel.value(),
                        comparison.relativeError(), comparison.reason()));
            }
        }

        private void fail(TestFailure failure) {
            failed++;
            failedInputs.add(failure.input());
            if (failures.size() < MAX_REPORTED_FAILURES) {
                failures.add(failure);
            }
            log.debug("Mismatch for {}: {}", failure.input(), failure.reason());
        }

        private void collectNumbers(Object value, List<Double> sink) {
            if (value instanceof Number number) {
                sink.add(number.doubleValue());
            } else if (value instanceof List<?> list && OutputComparator.isNumeric(list)) {
                list.forEach(element -> sink.add(((Number) element).doubleValue()));
            }
        }
    }
}
