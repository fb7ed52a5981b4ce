package com.example.guardianservice.overhaul;

import com.example.guardianservice.client.DiscordPlatformClient;
import com.example.guardianservice.config.OverhaulSettings;
import com.example.guardianservice.entity.RemoteResource;
import com.example.guardianservice.exception.InvalidConfirmationException;
import com.example.guardianservice.exception.OverhaulInProgressException;
import com.example.guardianservice.metrics.GuardianMetrics;
import com.example.guardianservice.overhaul.execution.CancelToken;
import com.example.guardianservice.overhaul.execution.KnownState;
import com.example.guardianservice.overhaul.execution.KnownStateLoader;
import com.example.guardianservice.overhaul.execution.RunContext;
import com.example.guardianservice.overhaul.execution.RunResult;
import com.example.guardianservice.overhaul.execution.StepExecutor;
import com.example.guardianservice.overhaul.model.ConfigurationModel;
import com.example.guardianservice.overhaul.model.ConfigurationValidator;
import com.example.guardianservice.overhaul.model.ValidationResult;
import com.example.guardianservice.overhaul.plan.OverhaulPlanner;
import com.example.guardianservice.overhaul.plan.Step;
import com.example.guardianservice.overhaul.progress.DiscordMessageProgressSink;
import com.example.guardianservice.overhaul.progress.LoggingProgressSink;
import com.example.guardianservice.overhaul.progress.ProgressSink;
import com.example.guardianservice.store.RemoteStateStore;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.core.LockConfiguration;
import net.javacrumbs.shedlock.core.LockProvider;
import net.javacrumbs.shedlock.core.SimpleLock;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

/**
 * Entry point for overhaul and repair runs.
 * <p>
 * FLOW:
 * 1. Validate and plan (no remote call; invalid configurations stop here)
 * 2. Take the per-guild lock (a second run is rejected, never queued)
 * 3. Execute on the bounded overhaul executor with a correlation id in MDC
 * 4. Release the lock and record the outcome
 * <p>
 * A normal run needs a confirmation token issued for the same guild and configuration. When the
 * configuration requires a backup, the run records the guild's current structure first and stops
 * before any mutation if that fails.
 */
@Service
@Slf4j
public class OverhaulOrchestrator {

    private static final String LOCK_PREFIX = "overhaul-";

    private final ConfigurationValidator validator;
    private final OverhaulPlanner planner;
    private final StepExecutor stepExecutor;
    private final KnownStateLoader knownStateLoader;
    private final RemoteStateStore remoteStateStore;
    private final DiscordPlatformClient client;
    private final LockProvider lockProvider;
    private final Executor overhaulTaskExecutor;
    private final GuardianMetrics metrics;
    private final OverhaulSettings settings;
    private final Clock clock;

    private final Cache<String, PendingConfirmation> confirmations;
    private final Map<Long, CancelToken> activeRuns = new ConcurrentHashMap<>();

    public OverhaulOrchestrator(ConfigurationValidator validator,
                                OverhaulPlanner planner,
                                StepExecutor stepExecutor,
                                KnownStateLoader knownStateLoader,
                                RemoteStateStore remoteStateStore,
                                DiscordPlatformClient client,
                                LockProvider lockProvider,
                                @Qualifier("overhaulTaskExecutor") Executor overhaulTaskExecutor,
                                GuardianMetrics metrics,
                                OverhaulSettings settings,
                                Clock clock) {
        this.validator = validator;
        this.planner = planner;
        this.stepExecutor = stepExecutor;
        this.knownStateLoader = knownStateLoader;
        this.remoteStateStore = remoteStateStore;
        this.client = client;
        this.lockProvider = lockProvider;
        this.overhaulTaskExecutor = overhaulTaskExecutor;
        this.metrics = metrics;
        this.settings = settings;
        this.clock = clock;
        this.confirmations = Caffeine.newBuilder()
                .maximumSize(1_000)
                .expireAfterWrite(settings.confirmationTtl())
                .build();
    }

    public ValidationResult validateConfiguration(ConfigurationModel config) {
        return validator.validate(config);
    }

    public List<Step> plan(ConfigurationModel config) {
        return planner.plan(config);
    }

    /**
     * Issues a single-use token that authorizes one run of {@code config} on the guild.
     *
     * @throws com.example.guardianservice.exception.ConfigurationValidationException if the
     *         configuration is invalid
     */
    public String issueConfirmation(long guildId, ConfigurationModel config) {
        validator.validate(config).throwIfInvalid();
        String token = UUID.randomUUID().toString();
        confirmations.put(token, new PendingConfirmation(guildId, config.fingerprint()));
        log.info("Overhaul confirmation issued: guildId={} expiresIn={}", guildId, settings.confirmationTtl());
        return token;
    }

    /**
     * Starts a fresh overhaul.
     *
     * @throws InvalidConfirmationException if the token is unknown, expired, used, or issued for
     *         another guild or configuration
     * @throws OverhaulInProgressException if the guild already has a run in progress
     */
    public CompletableFuture<RunResult> start(long guildId, ConfigurationModel config, String confirmationToken,
                                              ProgressSink sink) {
        PendingConfirmation pending = confirmationToken == null
                ? null
                : confirmations.asMap().remove(confirmationToken);
        if (pending == null || pending.guildId() != guildId || !pending.fingerprint().equals(config.fingerprint())) {
            log.warn("Overhaul confirmation rejected: guildId={}", guildId);
            throw new InvalidConfirmationException(guildId);
        }
        return launch(guildId, config, false, config.safetyOptions().backupRequired(), KnownState::empty, sink);
    }

    /**
     * Re-applies {@code config} on top of whatever already exists. The starting state is read from
     * a fresh listing of the guild merged with identifiers recorded by earlier runs.
     */
    public CompletableFuture<RunResult> repair(long guildId, ConfigurationModel config, ProgressSink sink) {
        return launch(guildId, config, true, false, () -> knownStateLoader.load(guildId), sink);
    }

    /**
     * Repair starting from a caller-provided map of what already exists.
     */
    public CompletableFuture<RunResult> repair(long guildId, ConfigurationModel config, KnownState knownState,
                                               ProgressSink sink) {
        return launch(guildId, config, true, false, () -> knownState, sink);
    }

    /**
     * Records the identifiers of every role, category and categorized channel the guild has now,
     * keyed by name, so a later repair can match them.
     *
     * @return number of resources recorded
     */
    public int backup(long guildId) {
        KnownState current = knownStateLoader.load(guildId);
        current.roles().forEach((name, id) -> remoteStateStore.record(guildId, RemoteResource.Kind.ROLE, name, id));
        current.categories().forEach((name, id) ->
                remoteStateStore.record(guildId, RemoteResource.Kind.CATEGORY, name, id));
        current.channels().forEach((key, id) ->
                remoteStateStore.record(guildId, RemoteResource.Kind.CHANNEL, key, id));
        int recorded = current.roles().size() + current.categories().size() + current.channels().size();
        log.info("Structure backup recorded: guildId={} resources={}", guildId, recorded);
        return recorded;
    }

    /**
     * Asks the active run of the guild to stop after its current step.
     *
     * @return whether a run was active
     */
    public boolean cancel(long guildId) {
        CancelToken token = activeRuns.get(guildId);
        if (token == null) {
            return false;
        }
        token.cancel();
        log.info("Overhaul cancellation requested: guildId={}", guildId);
        return true;
    }

    public boolean isRunning(long guildId) {
        return activeRuns.containsKey(guildId);
    }

    /**
     * Status sink for a run: an evolving message in the given channel, or the log when none.
     */
    public ProgressSink statusSink(Long channelId) {
        return channelId == null ? new LoggingProgressSink() : new DiscordMessageProgressSink(client, channelId);
    }

    private CompletableFuture<RunResult> launch(long guildId, ConfigurationModel config, boolean repair,
                                                boolean backupFirst, Supplier<KnownState> initialState,
                                                ProgressSink sink) {
        List<Step> steps = planner.plan(config);

        Optional<SimpleLock> lock = lockProvider.lock(new LockConfiguration(
                clock.instant(), LOCK_PREFIX + guildId, settings.lockAtMostFor(), Duration.ZERO));
        if (lock.isEmpty()) {
            metrics.recordRun("rejected");
            log.warn("Overhaul rejected, another run holds the guild lock: guildId={}", guildId);
            throw new OverhaulInProgressException(guildId);
        }

        CancelToken cancelToken = new CancelToken();
        activeRuns.put(guildId, cancelToken);
        String correlationId = (repair ? "REPAIR-" : "OVERHAUL-") + UUID.randomUUID().toString().substring(0, 8);
        try {
            return CompletableFuture.supplyAsync(
                    () -> run(guildId, steps, repair, backupFirst, initialState, sink, cancelToken, lock.get(),
                            correlationId),
                    overhaulTaskExecutor);
        } catch (RejectedExecutionException e) {
            activeRuns.remove(guildId, cancelToken);
            lock.get().unlock();
            metrics.recordRun("rejected");
            log.error("Overhaul queue full, run rejected: guildId={}", guildId);
            throw e;
        }
    }

    private RunResult run(long guildId, List<Step> steps, boolean repair, boolean backupFirst,
                          Supplier<KnownState> initialState, ProgressSink sink, CancelToken cancelToken,
                          SimpleLock lock, String correlationId) {
        MDC.put("correlationId", correlationId);
        MDC.put("guildId", String.valueOf(guildId));
        try {
            log.info("Starting {}: guildId={} steps={}", repair ? "repair" : "overhaul", guildId, steps.size());
            if (backupFirst) {
                backup(guildId);
            }
            RunContext context = new RunContext(guildId, initialState.get(), repair, cancelToken, remoteStateStore);
            RunResult result = stepExecutor.execute(steps, context, sink);
            metrics.recordRun(result.outcome().metricTag());
            return result;
        } catch (RuntimeException e) {
            metrics.recordRun(RunResult.Outcome.FAILED.metricTag());
            log.error("Run aborted before execution: guildId={} error={}", guildId, e.getMessage(), e);
            throw e;
        } finally {
            activeRuns.remove(guildId, cancelToken);
            lock.unlock();
            MDC.remove("guildId");
            MDC.remove("correlationId");
        }
    }

    private record PendingConfirmation(long guildId, String fingerprint) {
    }
}
