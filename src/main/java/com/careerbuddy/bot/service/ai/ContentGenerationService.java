package com.careerbuddy.bot.service.ai;

import com.careerbuddy.bot.service.flow.ContentPort;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs content generation on a bounded pool, one request per job and kind. A turn that starts a
 * generation waits briefly for it; a later turn (wake word) picks the result up. Failures and
 * timeouts complete the request with fallback content.
 */
@Slf4j
@Service
public class ContentGenerationService implements ContentPort {

    private static final Duration STALE_AFTER = Duration.ofMinutes(30);

    private final ContentGenerator generator;
    private final ExecutorService executor;
    private final Clock clock;
    private final Map<Key, Pending> inFlight = new ConcurrentHashMap<>();

    @Value("${ai.inline-wait-ms:8000}")
    private long inlineWaitMs;

    @Value("${ai.timeout-ms:45000}")
    private long timeoutMs;

    @Autowired
    public ContentGenerationService(ContentGenerator generator,
                                    @Qualifier("contentGenerationExecutor") ExecutorService executor,
                                    Clock clock) {
        this.generator = generator;
        this.executor = executor;
        this.clock = clock;
    }

    ContentGenerationService(ContentGenerator generator, ExecutorService executor, Clock clock,
                             long inlineWaitMs, long timeoutMs) {
        this(generator, executor, clock);
        this.inlineWaitMs = inlineWaitMs;
        this.timeoutMs = timeoutMs;
    }

    @Override
    public Optional<List<String>> skills(GenerationRequest request, boolean wait) {
        return obtain(request, ContentKind.SKILLS,
                () -> generator.suggestSkills(request),
                () -> FallbackContent.skills(request.getTargetRole()), wait);
    }

    @Override
    public Optional<String> summary(GenerationRequest request, boolean wait) {
        return obtain(request, ContentKind.SUMMARY,
                () -> generator.writeSummary(request),
                () -> FallbackContent.summary(request), wait);
    }

    @Override
    public Optional<String> revamp(GenerationRequest request, boolean wait) {
        return obtain(request, ContentKind.REVAMP,
                () -> generator.revampResume(request),
                () -> FallbackContent.revamp(request), wait);
    }

    /** Number of requests currently tracked. */
    public int inFlightCount() {
        return inFlight.size();
    }

    @Scheduled(fixedDelayString = "${ai.eviction-interval-ms:600000}")
    public void evictStale() {
        Instant cutoff = clock.instant().minus(STALE_AFTER);
        inFlight.entrySet().removeIf(entry -> {
            boolean stale = entry.getValue().startedAt.isBefore(cutoff);
            if (stale) {
                entry.getValue().future.cancel(true);
                log.info("Evicted stale {} generation for job {}", entry.getKey().kind, entry.getKey().jobId);
            }
            return stale;
        });
    }

    @SuppressWarnings("unchecked")
    private <T> Optional<T> obtain(GenerationRequest request, ContentKind kind,
                                   Supplier<T> call, Supplier<T> fallback, boolean wait) {
        Key key = new Key(request.getJobId(), kind);
        Pending pending = inFlight.computeIfAbsent(key, k -> start(k, call, fallback));
        CompletableFuture<T> future = (CompletableFuture<T>) pending.future;

        Optional<T> result = wait ? await(key, future, fallback) : peek(future);
        result.ifPresent(r -> inFlight.remove(key, pending));
        return result;
    }

    private <T> Pending start(Key key, Supplier<T> call, Supplier<T> fallback) {
        log.info("Starting {} generation for job {}", key.kind, key.jobId);
        CompletableFuture<T> submitted;
        try {
            submitted = CompletableFuture.supplyAsync(call, executor);
        } catch (RejectedExecutionException e) {
            log.warn("{} generation queue is full, using fallback for job {}", key.kind, key.jobId);
            return new Pending(CompletableFuture.completedFuture(fallback.get()), clock.instant());
        }
        CompletableFuture<T> future = submitted
                .exceptionally(ex -> {
                    log.warn("{} generation failed for job {}, using fallback: {}",
                            key.kind, key.jobId, ex.getMessage());
                    return fallback.get();
                })
                .completeOnTimeout(null, timeoutMs, TimeUnit.MILLISECONDS)
                .thenApply(result -> {
                    if (result == null) {
                        log.warn("{} generation for job {} timed out, using fallback", key.kind, key.jobId);
                        return fallback.get();
                    }
                    return result;
                });
        return new Pending(future, clock.instant());
    }

    private <T> Optional<T> await(Key key, CompletableFuture<T> future, Supplier<T> fallback) {
        try {
            return Optional.of(future.get(inlineWaitMs, TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            log.debug("{} generation for job {} still running after {} ms", key.kind, key.jobId, inlineWaitMs);
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        } catch (ExecutionException | CancellationException e) {
            log.warn("{} generation for job {} failed, using fallback: {}", key.kind, key.jobId, e.getMessage());
            return Optional.of(fallback.get());
        }
    }

    private static <T> Optional<T> peek(CompletableFuture<T> future) {
        if (!future.isDone() || future.isCompletedExceptionally()) {
            return Optional.empty();
        }
        return Optional.ofNullable(future.join());
    }

    @ToString
    @EqualsAndHashCode
    private static final class Key {

        private final Long jobId;
        private final ContentKind kind;

        Key(Long jobId, ContentKind kind) {
            this.jobId = jobId;
            this.kind = kind;
        }
    }

    private static final class Pending {

        private final CompletableFuture<?> future;
        private final Instant startedAt;

        Pending(CompletableFuture<?> future, Instant startedAt) {
            this.future = future;
            this.startedAt = startedAt;
        }
    }
}
