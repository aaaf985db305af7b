package org.carball.pivot.validator;

import org.carball.pivot.config.ValidationSettings;
import org.carball.pivot.model.analysis.ArgumentHint;
import org.carball.pivot.model.analysis.FunctionSpec;
import org.carball.pivot.model.analysis.TargetLanguage;
import org.carball.pivot.model.parity.ParityCertificate;
import org.carball.pivot.model.parity.TestFailure;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

public class ParityValidatorTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final long MILLIS = 1_000_000L;

    @TempDir
    Path tempDir;

    private ValidationSettings settings;
    private AtomicLong nanos;

    @BeforeEach
    void setUp() {
        settings = new ValidationSettings();
        nanos = new AtomicLong();
    }

    @Test
    void shouldCertifyIdenticalImplementationsAndMeasureSpeedup() throws Exception {
        // Given
        FunctionRunner legacy = args -> {
            nanos.addAndGet(35 * MILLIS);
            return ((Long) args.get(0)) * 2;
        };
        FunctionRunner vessel = args -> {
            nanos.addAndGet(10 * MILLIS);
            return ((Long) args.get(0)) * 2;
        };

        // When
        ParityCertificate certificate = validator(null).validate(doubler(), legacy, vessel);

        // Then
        assertThat(certificate.certified()).isTrue();
        assertThat(certificate.testCount()).isEqualTo(105);
        assertThat(certificate.passed()).isEqualTo(105);
        assertThat(certificate.failed()).isZero();
        assertThat(certificate.confidence()).isCloseTo(100.0 * (1 - Math.pow(0.9, 106)), within(1e-6));
        assertThat(certificate.performance().speedup()).isCloseTo(3.5, within(1e-9));
        assertThat(certificate.performance().legacyMs()).isCloseTo(105 * 35.0, within(1e-6));
        assertThat(certificate.statistics().maxError()).isZero();
        assertThat(certificate.statistics().similarityStatistic()).isZero();
        assertThat(certificate.seed()).isEqualTo(42L);
        assertThat(certificate.createdAt()).isEqualTo(NOW);
        assertThat(certificate.failures()).isEmpty();
    }

    @Test
    void shouldNotCertifyWhenOneOutputExceedsTolerance() throws Exception {
        // Given
        FunctionRunner legacy = args -> ((Long) args.get(0)).doubleValue();
        FunctionRunner vessel = args -> {
            long x = (Long) args.get(0);
            return x == 1000L ? 1050.0 : (double) x;
        };

        // When
        ParityCertificate certificate = validator(null).validate(doubler(), legacy, vessel);

        // Then
        assertThat(certificate.certified()).isFalse();
        assertThat(certificate.failed()).isGreaterThanOrEqualTo(1);
        TestFailure failure = certificate.failures().get(0);
        assertThat(failure.input()).containsExactly(1000L);
        assertThat(failure.relativeError()).isCloseTo(50.0 / 1050.0, within(1e-9));
        assertThat(failure.reason()).contains("exceeds tolerance");
        assertThat(certificate.statistics().maxError()).isCloseTo(50.0 / 1050.0, within(1e-9));
    }

    @Test
    void shouldCountTimeoutsAsFailures() throws Exception {
        // Given
        settings.setTestCaseCount(0);
        settings.setCallTimeoutMs(50);
        FunctionRunner legacy = args -> args.get(0);
        FunctionRunner vessel = args -> {
            if ((Long) args.get(0) == 0L) {
                Thread.sleep(5_000);
            }
            return args.get(0);
        };

        // When
        ParityCertificate certificate = validator(null).validate(doubler(), legacy, vessel);

        // Then
        assertThat(certificate.testCount()).isEqualTo(5);
        assertThat(certificate.timedOut()).isEqualTo(1);
        assertThat(certificate.failed()).isEqualTo(1);
        assertThat(certificate.passed()).isEqualTo(4);
        assertThat(certificate.certified()).isFalse();
        assertThat(certificate.failures()).extracting(TestFailure::reason).containsExactly("Vessel: Timed out");
    }

    @Test
    void shouldReportRunnerExceptionsAsFailures() throws Exception {
        settings.setTestCaseCount(0);
        FunctionRunner legacy = args -> {
            throw new IllegalStateException("boom");
        };

        ParityCertificate certificate = validator(null).validate(doubler(), legacy, args -> args.get(0));

        assertThat(certificate.failed()).isEqualTo(5);
        assertThat(certificate.timedOut()).isZero();
        assertThat(certificate.failures().get(0).reason()).isEqualTo("Legacy: IllegalStateException: boom");
        assertThat(certificate.confidence()).isLessThan(1.0);
    }

    @Test
    void shouldStoreFailingInputsAndReplayThem() throws Exception {
        // Given
        RegressionInputStore store = new RegressionInputStore(tempDir.resolve("regressions"));
        settings.setTestCaseCount(3);
        FunctionRunner legacy = args -> args.get(0);
        FunctionRunner broken = args -> (Long) args.get(0) == -1L ? 99L : args.get(0);
        AtomicInteger calls = new AtomicInteger();
        FunctionRunner fixed = args -> {
            calls.incrementAndGet();
            return args.get(0);
        };

        // When
        ParityCertificate first = validator(store).validate(doubler(), legacy, broken);
        ParityCertificate second = validator(store).validate(doubler(), legacy, fixed);

        // Then
        assertThat(first.failed()).isEqualTo(1);
        assertThat(store.load("doubler")).containsExactly(List.of(-1L));
        assertThat(second.testCount()).isEqualTo(first.testCount() + 1);
        assertThat(calls.get()).isEqualTo(second.testCount());
        assertThat(second.failed()).isZero();
    }

    @Test
    void shouldProduceSameInputsForSameSeed() throws Exception {
        List<Object> firstInputs = new java.util.ArrayList<>();
        List<Object> secondInputs = new java.util.ArrayList<>();

        validator(null).validate(doubler(), args -> {
            firstInputs.add(args.get(0));
            return 0;
        }, args -> 0);
        validator(null).validate(doubler(), args -> {
            secondInputs.add(args.get(0));
            return 0;
        }, args -> 0);

        assertThat(firstInputs).hasSize(105).isEqualTo(secondInputs);
    }

    @Test
    void shouldCertifyTiedOutputsWithDriftInsideTolerance() throws Exception {
        // Given
        FunctionRunner legacy = args -> (Long) args.get(0) > 0 ? 1.0 : 0.0;
        FunctionRunner vessel = args -> (Long) args.get(0) > 0 ? 1.0000001 : 0.0;

        // When
        settings.setTestCaseCount(50);
        ParityCertificate smaller = validator(null).validate(doubler(), legacy, vessel);
        settings.setTestCaseCount(100);
        ParityCertificate larger = validator(null).validate(doubler(), legacy, vessel);

        // Then
        assertThat(smaller.failed()).isZero();
        assertThat(larger.failed()).isZero();
        assertThat(smaller.statistics().similarityStatistic()).isZero();
        assertThat(larger.statistics().similarityStatistic()).isZero();
        assertThat(smaller.confidence()).isCloseTo(100.0 * (1 - Math.pow(0.9, 56)), within(1e-6));
        assertThat(larger.confidence()).isGreaterThan(smaller.confidence());
        assertThat(larger.confidence()).isCloseTo(100.0 * (1 - Math.pow(0.9, 106)), within(1e-6));
        assertThat(larger.certified()).isTrue();
    }

    @Test
    void shouldProduceIdenticalCertificatesForSameSeed() throws Exception {
        // Given
        FunctionRunner legacy = args -> ((Long) args.get(0)).doubleValue();
        FunctionRunner vessel = args -> {
            long x = (Long) args.get(0);
            return x % 5 == 0 ? x * 1.5 : x * 1.0005;
        };

        // When
        ParityCertificate first = validator(null).validate(doubler(), legacy, vessel);
        ParityCertificate second = validator(null).validate(doubler(), legacy, vessel);

        // Then
        assertThat(first.failed()).isPositive();
        assertThat(first.passed()).isPositive();
        assertThat(first.statistics().similarityStatistic()).isPositive();
        assertThat(second)
                .usingRecursiveComparison()
                .ignoringFields("createdAt")
                .isEqualTo(first);
    }

    @Test
    void shouldRejectDomainCountMismatch() {
        ParityValidator validator = validator(null);

        assertThatThrownBy(() -> validator.validate(doubler(), List.of(), args -> 0, args -> 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("takes 1 argument(s)");
    }

    @Test
    void shouldRejectInvalidSettings() {
        settings.setAcceptableFailureRate(1.5);

        assertThatThrownBy(() -> validator(null)).isInstanceOf(IllegalArgumentException.class);
    }

    private ParityValidator validator(RegressionInputStore store) {
        return new ParityValidator(settings, store, nanos::get, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static FunctionSpec doubler() {
        return FunctionSpec.builder()
                .name("doubler")
                .startLine(1)
                .lineCount(2)
                .complexity(1)
                .arguments(List.of(new ArgumentHint("x", "int")))
                .returnHint("int")
                .recommendedTarget(TargetLanguage.COMPILED_NATIVE)
                .justification("test")
                .source("def doubler(x):\n    return x * 2")
                .build();
    }
}
