package com.skybrief.service.runtime;

import com.skybrief.calculators.api.CalculationContext;
import com.skybrief.calculators.api.Calculator;
import com.skybrief.calculators.api.JsonFetcher;
import com.skybrief.calculators.api.SourceException;
import com.skybrief.calculators.api.SourceProtocol;
import com.skybrief.core.bus.EventBus;
import com.skybrief.core.events.AggregationCompleted;
import com.skybrief.core.events.AggregationStarted;
import com.skybrief.core.events.SourceResolved;
import com.skybrief.core.model.Domain;
import com.skybrief.core.model.FailureReason;
import com.skybrief.core.model.GeoLocation;
import com.skybrief.core.model.Provenance;
import com.skybrief.core.model.SourceResult;
import com.skybrief.service.config.EngineConfig;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs every calculator for one (location, instant) on a bounded pool. A domain's failure never
 * escapes: it becomes a fallback or an UNAVAILABLE entry.
 */
public class SourceOrchestrator implements AutoCloseable {
    private static final Logger LOGGER = Logger.getLogger(SourceOrchestrator.class.getName());

    private final Map<Domain, Calculator<?>> calculators;
    private final EngineConfig config;
    private final JsonFetcher fetcher;
    private final EventBus eventBus;
    private final Clock clock;
    private final ExecutorService executor;

    public SourceOrchestrator(
            List<Calculator<?>> calculators,
            EngineConfig config,
            JsonFetcher fetcher,
            EventBus eventBus,
            Clock clock
    ) {
        this.config = Objects.requireNonNull(config, "config is required");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher is required");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.calculators = new EnumMap<>(Domain.class);
        for (Calculator<?> calculator : calculators) {
            if (this.calculators.put(calculator.domain(), calculator) != null) {
                throw new IllegalArgumentException("Duplicate calculator for domain " + calculator.domain());
            }
        }
        this.executor = Executors.newFixedThreadPool(config.workerThreads(), new SourceThreadFactory());
    }

    public AggregationResult aggregate(GeoLocation location, ZonedDateTime at) {
        return aggregateAsync(location, at).join();
    }

    public CompletableFuture<AggregationResult> aggregateAsync(GeoLocation location, ZonedDateTime at) {
        Objects.requireNonNull(location, "location is required");
        Objects.requireNonNull(at, "at is required");
        Instant startedAt = clock.instant();
        eventBus.publish(new AggregationStarted(startedAt, location.latitude(), location.longitude(), at, Domain.values().length));

        Map<Domain, CompletableFuture<SourceResult<?>>> futures = new EnumMap<>(Domain.class);
        for (Domain domain : Domain.values()) {
            Calculator<?> calculator = calculators.get(domain);
            futures.put(domain, calculator == null ? missing(domain) : run(calculator, location, at));
        }

        return CompletableFuture.allOf(futures.values().toArray(CompletableFuture[]::new))
                .thenApply(ignored -> {
                    Map<Domain, SourceResult<?>> results = new EnumMap<>(Domain.class);
                    futures.forEach((domain, future) -> results.put(domain, future.join()));
                    Duration elapsed = Duration.between(startedAt, clock.instant());
                    AggregationResult result = new AggregationResult(location, at, results, elapsed);
                    eventBus.publish(new AggregationCompleted(
                            clock.instant(),
                            (int) result.count(Provenance.LIVE),
                            (int) result.count(Provenance.LOCAL_FALLBACK),
                            (int) result.count(Provenance.UNAVAILABLE),
                            elapsed.toMillis()
                    ));
                    LOGGER.fine(() -> "Aggregation finished in " + elapsed.toMillis() + " ms: " + result.provenanceSummary());
                    return result;
                });
    }

    private <T> CompletableFuture<SourceResult<?>> run(Calculator<T> calculator, GeoLocation location, ZonedDateTime at) {
        Domain domain = calculator.domain();
        Instant started = clock.instant();
        CalculationContext ctx = new CalculationContext(location, at, fetcher, config.requestTimeoutFor(domain));
        boolean liveEnabled = config.liveEnabled(domain);

        CompletableFuture<SourceResult<T>> future;
        if (!calculator.hasLiveSource() || !liveEnabled) {
            future = CompletableFuture.supplyAsync(() -> SourceProtocol.resolve(calculator, ctx, liveEnabled), executor);
        } else {
            Duration timeout = config.timeoutFor(domain);
            future = CompletableFuture.supplyAsync(() -> attemptLive(calculator, ctx), executor)
                    .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                    .<SourceResult<T>>handleAsync((value, error) -> error == null
                            ? SourceResult.live(value)
                            : SourceProtocol.fallback(calculator, ctx, reasonFor(error), detailFor(error, timeout)), executor);
        }

        return future
                .exceptionally(error -> {
                    LOGGER.log(Level.WARNING, "Resolving " + domain.key() + " failed unexpectedly", error);
                    return SourceResult.unavailable(FailureReason.COMPUTATION_FAILED, SourceProtocol.rootMessage(error));
                })
                .<SourceResult<?>>thenApply(result -> {
                    eventBus.publish(new SourceResolved(
                            clock.instant(),
                            domain,
                            result.provenance(),
                            result.reason(),
                            result.detail(),
                            Duration.between(started, clock.instant()).toMillis()
                    ));
                    return result;
                });
    }

    private CompletableFuture<SourceResult<?>> missing(Domain domain) {
        SourceResult<?> result = SourceResult.unavailable(FailureReason.NO_FALLBACK, "No calculator registered for " + domain.key());
        eventBus.publish(new SourceResolved(clock.instant(), domain, result.provenance(), result.reason(), result.detail(), 0));
        return CompletableFuture.<SourceResult<?>>completedFuture(result);
    }

    private static <T> T attemptLive(Calculator<T> calculator, CalculationContext ctx) {
        try {
            return SourceProtocol.attemptLive(calculator, ctx);
        } catch (SourceException e) {
            throw new CompletionException(e);
        }
    }

    static FailureReason reasonFor(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof TimeoutException) {
            return FailureReason.TIMEOUT;
        }
        if (cause instanceof SourceException sourceException) {
            return sourceException.reason();
        }
        return FailureReason.NETWORK_ERROR;
    }

    private static String detailFor(Throwable error, Duration timeout) {
        Throwable cause = unwrap(error);
        if (cause instanceof TimeoutException) {
            return "No answer within " + timeout.toMillis() + " ms";
        }
        return cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    @Override
    public void close() {
        executor.shutdownNow();
        try {
            executor.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static final class SourceThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "skybrief-source-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
