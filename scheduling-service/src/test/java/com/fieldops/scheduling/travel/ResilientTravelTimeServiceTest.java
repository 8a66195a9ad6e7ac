package com.fieldops.scheduling.travel;

import com.fieldops.scheduling.domain.GeoPoint;
import com.fieldops.scheduling.support.FixedTravelTimes;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.timelimiter.TimeLimiter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.fieldops.scheduling.support.SchedulingFixtures.travelService;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResilientTravelTimeServiceTest {

    private static final GeoPoint A = GeoPoint.of(51.5007, -0.1246);
    private static final GeoPoint B = GeoPoint.of(51.5194, -0.1270);
    private static final GeoPoint C = GeoPoint.of(51.5033, -0.1195);

    private final HaversineTravelTimeEstimator estimator = new HaversineTravelTimeEstimator();
    private ExecutorService executor;

    @AfterEach
    void tearDown() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("Provider answers are used as is and the batch is not degraded")
    void providerAnswersUsed() {
        ResilientTravelTimeService service = travelService(new FixedTravelTimes().between(A, B, 12));

        TravelTimeBatch batch = service.travelTimes(List.of(TravelLeg.of(A, B)));

        assertThat(batch.isDegraded()).isFalse();
        assertThat(batch.getSource()).isEqualTo("fixed");
        assertThat(batch.getDurations()).containsExactly(Duration.ofMinutes(12));
    }

    @Test
    @DisplayName("Provider failure answers the whole batch from the estimator, flagged degraded")
    void failureFallsBackToEstimator() {
        ResilientTravelTimeService service = travelService(new FailingProvider());

        TravelTimeBatch batch = service.travelTimes(List.of(TravelLeg.of(A, B), TravelLeg.of(B, C)));

        assertThat(batch.isDegraded()).isTrue();
        assertThat(batch.getDurations()).containsExactly(estimator.estimate(A, B), estimator.estimate(B, C));
    }

    @Test
    @DisplayName("A wrong number of durations counts as a provider failure")
    void malformedAnswerDegrades() {
        TravelTimeProvider shortAnswer = new TravelTimeProvider() {
            @Override
            public List<Duration> travelTimes(List<TravelLeg> legs) {
                return List.of(Duration.ofMinutes(5));
            }

            @Override
            public String name() {
                return "short";
            }
        };

        TravelTimeBatch batch = travelService(shortAnswer)
                .travelTimes(List.of(TravelLeg.of(A, B), TravelLeg.of(B, C)));

        assertThat(batch.isDegraded()).isTrue();
        assertThat(batch.getDurations()).hasSize(2);
    }

    @Test
    @DisplayName("A provider slower than the timeout is abandoned in favour of the estimator")
    void slowProviderTimesOut() {
        executor = Executors.newSingleThreadExecutor();
        TravelTimeProvider slow = new TravelTimeProvider() {
            @Override
            public List<Duration> travelTimes(List<TravelLeg> legs) {
                try {
                    Thread.sleep(2_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return List.of(Duration.ofMinutes(1));
            }

            @Override
            public String name() {
                return "slow";
            }
        };
        ResilientTravelTimeService service = new ResilientTravelTimeService(slow, estimator,
                TimeLimiter.of(Duration.ofMillis(100)), CircuitBreaker.ofDefaults("slow"), executor);

        long started = System.nanoTime();
        TravelTimeBatch batch = service.travelTimes(List.of(TravelLeg.of(A, B)));

        assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(1));
        assertThat(batch.isDegraded()).isTrue();
        assertThat(batch.getDurations()).containsExactly(estimator.estimate(A, B));
    }

    @Test
    @DisplayName("Without a provider the estimator is the primary source and nothing is degraded")
    void noProviderIsNotDegraded() {
        ResilientTravelTimeService service = travelService(null);

        TravelTimeBatch batch = service.travelTimes(List.of(TravelLeg.of(A, C)));

        assertThat(batch.isDegraded()).isFalse();
        assertThat(batch.getDurations()).containsExactly(estimator.estimate(A, C));
    }

    @Test
    @DisplayName("The matrix is fetched in one batch and identical points cost nothing")
    void matrixBuiltInOneBatch() {
        FixedTravelTimes provider = new FixedTravelTimes().between(A, B, 7);
        ResilientTravelTimeService service = travelService(provider);

        TravelTimeMatrix matrix = service.buildMatrix(List.of(A, B, A));

        assertThat(provider.calls()).isEqualTo(1);
        assertThat(matrix.seconds(0, 1)).isEqualTo(420);
        assertThat(matrix.seconds(1, 2)).isEqualTo(420);
        assertThat(matrix.seconds(0, 2)).isZero();
        assertThat(matrix.isDegraded()).isFalse();
    }

    @Test
    @DisplayName("Great-circle estimate grows with distance and rejects a non-positive speed")
    void estimatorBehaviour() {
        assertThat(estimator.estimate(A, A)).isZero();
        assertThat(estimator.estimate(A, B)).isGreaterThan(estimator.estimate(A, C));
        assertThatThrownBy(() -> new HaversineTravelTimeEstimator(0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static class FailingProvider implements TravelTimeProvider {
        @Override
        public List<Duration> travelTimes(List<TravelLeg> legs) {
            throw new TravelTimeProviderException("connection refused");
        }

        @Override
        public String name() {
            return "failing";
        }
    }
}
