package org.javai.retry.engine;

import org.javai.retry.*;
import org.javai.retry.backoff.BackoffStrategy;
import org.javai.retry.bailout.BailoutEvaluator;
import org.javai.retry.ops.AttemptReporter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class ExecutionEngineTest {

    private List<Duration> sleeps;
    private List<String> events;
    private ExecutionEngine engine;

    @BeforeEach
    void setUp() {
        sleeps = new ArrayList<>();
        events = new ArrayList<>();

        AttemptReporter reporter = new AttemptReporter() {
            @Override
            public void attemptFailed(String policy, int attemptNumber, AttemptFailure failure) {
                events.add("failed:" + policy + ":" + attemptNumber + ":" + failure.kind());
            }

            @Override
            public void retryScheduled(String policy, int attemptNumber, Duration delay) {
                events.add("retry:" + policy + ":" + attemptNumber + ":" + delay.toMillis());
            }

            @Override
            public void completed(String policy, ExecutionOutcome outcome, int attemptsMade) {
                events.add("completed:" + policy + ":" + outcome + ":" + attemptsMade);
            }
        };

        // Record waits instead of sleeping
        engine = ExecutionEngine.builder()
                .reporter(reporter)
                .sleeper(recordingSleeper(sleeps))
                .build();
    }

    @Test
    void execute_predicateNeverHolds_exhaustsBudget() {
        for (int maxAttempts = 1; maxAttempts <= 6; maxAttempts++) {
            AtomicInteger calls = new AtomicInteger();
            PolicyConfig<Integer> policy = PolicyBuilder.<Integer>create()
                    .withOperation(calls::incrementAndGet)
                    .withBailoutWhen(BailoutEvaluator.never())
                    .atMost(maxAttempts)
                    .build();

            ExecutionResult<Integer> result = engine.execute(policy);

            assertThat(result.attemptsMade()).isEqualTo(maxAttempts);
            assertThat(result.outcome()).isEqualTo(ExecutionOutcome.EXHAUSTED);
            assertThat(result.history()).hasSize(maxAttempts);
            assertThat(calls.get()).isEqualTo(maxAttempts);
        }
    }

    @Test
    void execute_counterScenario_endsWithLastValue() {
        AtomicInteger counter = new AtomicInteger(0);
        PolicyConfig<Integer> policy = PolicyBuilder.<Integer>create()
                .startWith(0)
                .withOperation(counter::incrementAndGet)
                .withBailoutWhen(value -> false)
                .atMost(3)
                .build();

        ExecutionResult<Integer> result = engine.execute(policy);

        assertThat(result.attemptsMade()).isEqualTo(3);
        assertThat(result.finalValue()).isEqualTo(3);
        assertThat(result.outcome()).isEqualTo(ExecutionOutcome.EXHAUSTED);
        assertThat(result.history()).extracting(Attempt::index).containsExactly(1, 2, 3);
    }

    @Test
    void execute_retryableCodesThenOk_bailsOutOnThirdAttempt() {
        AtomicInteger calls = new AtomicInteger();
        PolicyConfig<String> policy = PolicyBuilder.<String>create()
                .withOperation(() -> calls.incrementAndGet() < 3 ? "retryable" : "ok")
                .withBailoutWhen(BailoutEvaluator.equalTo("ok"))
                .atMost(5)
                .build();

        ExecutionResult<String> result = engine.execute(policy);

        assertThat(result.attemptsMade()).isEqualTo(3);
        assertThat(result.outcome()).isEqualTo(ExecutionOutcome.BAILED_OUT);
        assertThat(result.finalValue()).isEqualTo("ok");
        assertThat(calls.get()).isEqualTo(3);
    }

    @Test
    void execute_futileFirstValue_stopsWithoutBackoff() {
        CountingBackoff backoff = new CountingBackoff(BackoffStrategy.constant(Duration.ofMillis(100)));
        PolicyConfig<Integer> policy = PolicyBuilder.<Integer>create()
                .withOperation(() -> 404)
                .withBailoutWhen(status -> status == 404)
                .withBackoff(backoff)
                .atMost(3)
                .build();

        ExecutionResult<Integer> result = engine.execute(policy);

        assertThat(result.attemptsMade()).isEqualTo(1);
        assertThat(result.outcome()).isEqualTo(ExecutionOutcome.BAILED_OUT);
        assertThat(backoff.calls.get()).isZero();
        assertThat(sleeps).isEmpty();
    }

    @Test
    void execute_singleAttempt_neverInvokesBackoff() {
        CountingBackoff backoff = new CountingBackoff(BackoffStrategy.constant(Duration.ofMillis(100)));
        PolicyConfig<String> exhausting = PolicyBuilder.<String>create()
                .withOperation(() -> "x")
                .withBackoff(backoff)
                .atMost(1)
                .build();
        PolicyConfig<String> bailing = PolicyBuilder.<String>create()
                .withOperation(() -> "x")
                .withBailoutWhen(BailoutEvaluator.always())
                .withBackoff(backoff)
                .atMost(1)
                .build();

        assertThat(engine.execute(exhausting).outcome()).isEqualTo(ExecutionOutcome.EXHAUSTED);
        assertThat(engine.execute(bailing).outcome()).isEqualTo(ExecutionOutcome.BAILED_OUT);
        assertThat(backoff.calls.get()).isZero();
        assertThat(sleeps).isEmpty();
    }

    @Test
    void execute_backoffInvokedOncePerRetry() {
        CountingBackoff backoff = new CountingBackoff(BackoffStrategy.linear(Duration.ofMillis(10), Duration.ofMillis(10)));
        AtomicInteger calls = new AtomicInteger();
        PolicyConfig<Integer> policy = PolicyBuilder.<Integer>create()
                .withOperation(calls::incrementAndGet)
                .withBailoutWhen(value -> value == 4)
                .withBackoff(backoff)
                .atMost(10)
                .build();

        ExecutionResult<Integer> result = engine.execute(policy);

        assertThat(result.attemptsMade()).isEqualTo(4);
        assertThat(backoff.calls.get()).isEqualTo(result.attemptsMade() - 1);
        assertThat(backoff.indices).containsExactly(1, 2, 3);
        assertThat(sleeps).containsExactly(Duration.ofMillis(10), Duration.ofMillis(20), Duration.ofMillis(30));
    }

    @Test
    void execute_predicateEvaluatedOnFinalAttempt() {
        AtomicInteger calls = new AtomicInteger();
        List<Integer> evaluated = new ArrayList<>();
        PolicyConfig<Integer> policy = PolicyBuilder.<Integer>create()
                .withOperation(calls::incrementAndGet)
                .withBailoutWhen(value -> {
                    evaluated.add(value);
                    return value == 3;
                })
                .atMost(3)
                .build();

        ExecutionResult<Integer> result = engine.execute(policy);

        assertThat(evaluated).containsExactly(1, 2, 3);
        assertThat(result.outcome()).isEqualTo(ExecutionOutcome.BAILED_OUT);
        assertThat(result.attemptsMade()).isEqualTo(3);
    }

    @Test
    void execute_bailoutMeansSuccess_reportsSucceeded() {
        PolicyConfig<String> policy = PolicyBuilder.<String>create()
                .withOperation(() -> "ok")
                .withBailoutWhen(BailoutEvaluator.equalTo("ok"))
                .bailoutMeansSuccess()
                .atMost(3)
                .build();

        ExecutionResult<String> result = engine.execute(policy);

        assertThat(result.outcome()).isEqualTo(ExecutionOutcome.SUCCEEDED);
        assertThat(result.attemptsMade()).isEqualTo(1);
    }

    @Test
    void execute_invocationFailures_areRetriedAndRecorded() {
        AtomicInteger calls = new AtomicInteger();
        List<Object> evaluated = new ArrayList<>();
        PolicyConfig<String> policy = PolicyBuilder.<String>create()
                .startWith("initial")
                .withOperation(() -> {
                    if (calls.incrementAndGet() < 3) {
                        throw new IOException("unavailable " + calls.get());
                    }
                    return "ok";
                })
                .withBailoutWhen(value -> {
                    evaluated.add(value);
                    return "ok".equals(value);
                })
                .atMost(5)
                .build();

        ExecutionResult<String> result = engine.execute(policy);

        assertThat(result.outcome()).isEqualTo(ExecutionOutcome.BAILED_OUT);
        assertThat(result.attemptsMade()).isEqualTo(3);
        assertThat(evaluated).containsExactly("ok");
        assertThat(result.failures())
                .extracting(AttemptFailure::message)
                .containsExactly("unavailable 1", "unavailable 2");
        assertThat(result.history().get(0).succeeded()).isFalse();
        assertThat(result.history().get(2).succeeded()).isTrue();
    }

    @Test
    void execute_allAttemptsFail_exhaustsWithInitialValue() {
        PolicyConfig<String> policy = PolicyBuilder.<String>create()
                .startWith("initial")
                .withOperation(() -> {
                    throw new IllegalStateException("broken");
                })
                .atMost(2)
                .build();

        ExecutionResult<String> result = engine.execute(policy);

        assertThat(result.outcome()).isEqualTo(ExecutionOutcome.EXHAUSTED);
        assertThat(result.finalValue()).isEqualTo("initial");
        AttemptFailure failure = result.lastFailure().orElseThrow();
        assertThat(failure.kind()).isEqualTo(FailureKind.INVOCATION_FAILURE);
        assertThat(failure.exception()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void execute_failureAfterValue_keepsLastProducedValue() {
        AtomicInteger calls = new AtomicInteger();
        PolicyConfig<Integer> policy = PolicyBuilder.<Integer>create()
                .startWith(0)
                .withOperation(() -> {
                    if (calls.incrementAndGet() == 2) {
                        throw new IOException("flaky");
                    }
                    return calls.get() * 10;
                })
                .atMost(2)
                .build();

        ExecutionResult<Integer> result = engine.execute(policy);

        assertThat(result.finalValue()).isEqualTo(10);
        assertThat(result.lastFailure()).isPresent();
    }

    @Test
    void execute_treatInvocationErrorAsBailout_stopsAtFirstFailure() {
        AtomicInteger calls = new AtomicInteger();
        PolicyConfig<String> policy = PolicyBuilder.<String>create()
                .withOperation(() -> {
                    calls.incrementAndGet();
                    throw new IOException("permanent");
                })
                .treatInvocationErrorAsBailout()
                .atMost(5)
                .build();

        ExecutionResult<String> result = engine.execute(policy);

        assertThat(result.outcome()).isEqualTo(ExecutionOutcome.OPERATION_FAILED);
        assertThat(result.attemptsMade()).isEqualTo(1);
        assertThat(calls.get()).isEqualTo(1);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void execute_alreadyCancelled_makesNoAttempt() {
        AtomicInteger calls = new AtomicInteger();
        PolicyConfig<Integer> policy = PolicyBuilder.<Integer>create()
                .startWith(-1)
                .withOperation(calls::incrementAndGet)
                .atMost(3)
                .build();
        CancellationToken token = CancellationToken.create();
        token.cancel();

        ExecutionResult<Integer> result = engine.execute(policy, token);

        assertThat(result.outcome()).isEqualTo(ExecutionOutcome.CANCELLED);
        assertThat(result.attemptsMade()).isZero();
        assertThat(result.finalValue()).isEqualTo(-1);
        assertThat(calls.get()).isZero();
    }

    @Test
    void execute_cancelledDuringWait_stopsAfterCurrentAttempt() {
        for (int cancelAfter = 1; cancelAfter <= 3; cancelAfter++) {
            CancellationToken token = CancellationToken.create();
            int k = cancelAfter;
            List<Duration> waits = new ArrayList<>();
            ExecutionEngine cancellingEngine = ExecutionEngine.builder()
                    .sleeper((duration, t) -> {
                        waits.add(duration);
                        if (waits.size() == k) {
                            t.cancel();
                        }
                        return t.isCancelled();
                    })
                    .build();
            AtomicInteger calls = new AtomicInteger();
            PolicyConfig<Integer> policy = PolicyBuilder.<Integer>create()
                    .withOperation(calls::incrementAndGet)
                    .withBackoff(BackoffStrategy.constant(Duration.ofSeconds(1)))
                    .atMost(10)
                    .build();

            ExecutionResult<Integer> result = cancellingEngine.execute(policy, token);

            assertThat(result.outcome()).isEqualTo(ExecutionOutcome.CANCELLED);
            assertThat(result.attemptsMade()).isEqualTo(k);
            assertThat(calls.get()).isEqualTo(k);
            assertThatThrownBy(result::requireNotCancelled).isInstanceOf(ExecutionCancelledException.class);
        }
    }

    @Test
    void execute_cancelledWhileUntimedAttemptRuns_recordsCancelledAttemptAndClearsInterrupt() {
        CancellationToken token = CancellationToken.create();
        AtomicInteger calls = new AtomicInteger();
        PolicyConfig<Integer> policy = PolicyBuilder.<Integer>create()
                .startWith(-1)
                .withOperation(() -> {
                    token.cancel();
                    return calls.incrementAndGet();
                })
                .atMost(3)
                .build();

        ExecutionResult<Integer> result = engine.execute(policy, token);

        assertThat(result.outcome()).isEqualTo(ExecutionOutcome.CANCELLED);
        assertThat(result.attemptsMade()).isEqualTo(1);
        assertThat(result.lastFailure()).map(AttemptFailure::kind).contains(FailureKind.CANCELLED);
        assertThat(result.finalValue()).isEqualTo(-1);
        assertThat(calls.get()).isEqualTo(1);
        assertThat(sleeps).isEmpty();
        assertThat(Thread.currentThread().isInterrupted()).isFalse();
    }

    @Test
    void execute_operationInterruptedByOthers_keepsInterruptAndCancels() {
        PolicyConfig<String> policy = PolicyBuilder.<String>create()
                .withOperation(() -> {
                    throw new InterruptedException("external");
                })
                .atMost(3)
                .build();

        try {
            ExecutionResult<String> result = ExecutionEngine.create().execute(policy);

            assertThat(result.attemptsMade()).isEqualTo(1);
            assertThat(result.lastFailure()).map(AttemptFailure::kind).contains(FailureKind.INVOCATION_FAILURE);
            assertThat(result.outcome()).isEqualTo(ExecutionOutcome.CANCELLED);
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void execute_interruptedDuringWait_cancelsAndPreservesInterrupt() {
        ExecutionEngine interruptingEngine = ExecutionEngine.builder()
                .sleeper((duration, token) -> {
                    throw new InterruptedException();
                })
                .build();
        PolicyConfig<String> policy = PolicyBuilder.<String>create()
                .withOperation(() -> "x")
                .atMost(3)
                .build();

        try {
            ExecutionResult<String> result = interruptingEngine.execute(policy);

            assertThat(result.outcome()).isEqualTo(ExecutionOutcome.CANCELLED);
            assertThat(result.attemptsMade()).isEqualTo(1);
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void execute_zeroBackoff_isPassedThroughUnclamped() {
        PolicyConfig<String> policy = PolicyBuilder.<String>create()
                .withOperation(() -> "x")
                .withBackoff(BackoffStrategy.none())
                .atMost(3)
                .build();

        engine.execute(policy);

        assertThat(sleeps).containsExactly(Duration.ZERO, Duration.ZERO);
    }

    @Test
    void execute_negativeBackoff_isRejected() {
        PolicyConfig<String> policy = PolicyBuilder.<String>create()
                .withOperation(() -> "x")
                .withBackoff(attempt -> Duration.ofMillis(-1))
                .atMost(3)
                .build();

        assertThatThrownBy(() -> engine.execute(policy))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("attempt 1");
    }

    @Test
    void execute_errorsPropagate() {
        PolicyConfig<String> policy = PolicyBuilder.<String>create()
                .withOperation(() -> {
                    throw new AssertionError("defect");
                })
                .atMost(3)
                .build();

        assertThatThrownBy(() -> engine.execute(policy))
                .isInstanceOf(AssertionError.class)
                .hasMessage("defect");
    }

    @Test
    void execute_reportsEveryEvent() {
        AtomicInteger calls = new AtomicInteger();
        PolicyConfig<String> policy = PolicyBuilder.<String>create()
                .named("fetch")
                .withOperation(() -> {
                    if (calls.incrementAndGet() == 1) {
                        throw new IOException("down");
                    }
                    return "retry";
                })
                .withBackoff(BackoffStrategy.constant(Duration.ofMillis(5)))
                .atMost(3)
                .build();

        engine.execute(policy);

        assertThat(events).containsExactly(
                "failed:fetch:1:INVOCATION_FAILURE",
                "retry:fetch:1:5",
                "retry:fetch:2:5",
                "completed:fetch:EXHAUSTED:3");
    }

    @Test
    void execute_sameConfigTwice_givesIndependentResults() {
        AtomicInteger calls = new AtomicInteger();
        PolicyConfig<Integer> policy = PolicyBuilder.<Integer>create()
                .withOperation(calls::incrementAndGet)
                .withBailoutWhen(value -> value % 2 == 0)
                .atMost(5)
                .build();

        ExecutionResult<Integer> first = engine.execute(policy);
        ExecutionResult<Integer> second = engine.execute(policy);

        assertThat(first.attemptsMade()).isEqualTo(2);
        assertThat(first.finalValue()).isEqualTo(2);
        assertThat(second.attemptsMade()).isEqualTo(2);
        assertThat(second.finalValue()).isEqualTo(4);
    }

    static Sleeper recordingSleeper(List<Duration> sleeps) {
        return (duration, token) -> {
            sleeps.add(duration);
            return token.isCancelled();
        };
    }

    static final class CountingBackoff implements BackoffStrategy {
        final AtomicInteger calls = new AtomicInteger();
        final List<Integer> indices = new ArrayList<>();
        private final BackoffStrategy delegate;

        CountingBackoff(BackoffStrategy delegate) {
            this.delegate = delegate;
        }

        @Override
        public Duration delayFor(int attemptIndex) {
            calls.incrementAndGet();
            indices.add(attemptIndex);
            return delegate.delayFor(attemptIndex);
        }
    }
}
