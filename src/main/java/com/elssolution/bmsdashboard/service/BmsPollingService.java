package com.elssolution.bmsdashboard.service;

import com.elssolution.bmsdashboard.acquisition.AcquisitionOrchestrator;
import com.elssolution.bmsdashboard.acquisition.FetchRequest;
import com.elssolution.bmsdashboard.alerts.AlertService;
import com.elssolution.bmsdashboard.domain.CellVoltageReport;
import com.elssolution.bmsdashboard.domain.Snapshot;
import com.elssolution.bmsdashboard.error.AcquisitionException;
import com.elssolution.bmsdashboard.error.FetchFailedException;
import com.elssolution.bmsdashboard.error.UnexpectedFailureException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Drives poll cycles against the controller.
 *
 * Every tick: if a cycle is outstanding and finished, join it; if none is
 * outstanding and the poll period elapsed, start one. Never more than one
 * cycle in flight. An unresponsive controller simply keeps the cycle open.
 */
@Slf4j
@Service
@Getter @Setter
public class BmsPollingService {

    public static final String ALERT_FETCH = "BMS_FETCH";
    public static final String ALERT_INTERNAL = "BMS_INTERNAL";

    public enum ErrorKind { FETCH_FAILED, UNEXPECTED }

    // ==== Config (runtime-adjustable, not persisted) ====
    @Value("${bms.address:192.168.0.200}") private volatile String address;
    @Value("${bms.sanitize.enabled:true}")  private volatile boolean sanitize;
    @Value("${bms.poll.rateMs:2000}")       private volatile long pollRateMs;
    // startup-only
    @Setter(AccessLevel.NONE) @Value("${bms.poll.tickMs:100}")   private long tickMs;
    @Setter(AccessLevel.NONE) @Value("${bms.poll.enabled:true}") private boolean enabled;

    private static final long MIN_RATE_MS = 100;
    private static final long MAX_RATE_MS = 10_000;
    private static final int SUMMARY_EVERY_SEC = 30;

    // ==== Infra ====
    @Getter(AccessLevel.NONE) @Setter(AccessLevel.NONE)
    private final AcquisitionOrchestrator orchestrator;
    @Getter(AccessLevel.NONE) @Setter(AccessLevel.NONE)
    private final ScheduledExecutorService scheduler;
    @Getter(AccessLevel.NONE) @Setter(AccessLevel.NONE)
    private final AlertService alerts;
    @Getter(AccessLevel.NONE) @Setter(AccessLevel.NONE)
    private volatile ScheduledFuture<?> loopHandle;

    // ==== State exposed to others ====
    @Setter(AccessLevel.NONE) private volatile Snapshot latestSnapshot;
    @Setter(AccessLevel.NONE) private volatile PollError lastError;
    @Setter(AccessLevel.NONE) private volatile long lastPollStartMs = 0L;
    @Getter(AccessLevel.NONE) @Setter(AccessLevel.NONE)
    private volatile FetchRequest inFlight;

    public BmsPollingService(AcquisitionOrchestrator orchestrator,
                             ScheduledExecutorService scheduler,
                             AlertService alerts) {
        this.orchestrator = orchestrator;
        this.scheduler = scheduler;
        this.alerts = alerts;
    }

    @PostConstruct
    void startPolling() {
        setPollRateMs(pollRateMs);
        if (tickMs < 10) {
            log.warn("bms.poll.tickMs too small ({}). Bumping to 10 ms.", tickMs);
            tickMs = 10;
        }
        if (!enabled) {
            log.info("BMS polling disabled (bms.poll.enabled=false)");
            return;
        }
        loopHandle = scheduler.scheduleWithFixedDelay(this::tickSafe, 0, tickMs, TimeUnit.MILLISECONDS);
        scheduler.scheduleAtFixedRate(this::logSummarySafe, 10, SUMMARY_EVERY_SEC, TimeUnit.SECONDS);
        log.info("BMS polling: address={} every={}ms sanitize={} tick={}ms", address, pollRateMs, sanitize, tickMs);
    }

    @PreDestroy
    void stop() {
        ScheduledFuture<?> h = loopHandle;
        if (h != null) h.cancel(false);
    }

    /** Poll period, clamped to 100..10000 ms. */
    public void setPollRateMs(long pollRateMs) {
        long clamped = Math.max(MIN_RATE_MS, Math.min(MAX_RATE_MS, pollRateMs));
        if (clamped != pollRateMs) {
            log.warn("bms.poll.rateMs out of [{}..{}] ({}). Using {}.", MIN_RATE_MS, MAX_RATE_MS, pollRateMs, clamped);
        }
        this.pollRateMs = clamped;
    }

    public boolean isInFlight() {
        return inFlight != null;
    }

    // ---- Poll loop ----

    private void tickSafe() {
        try {
            tick(System.currentTimeMillis());
        } catch (Exception e) {
            // keep the schedule alive; a crashed tick must not stop polling
            log.warn("bms_tick_failed: {}", e.toString());
            alerts.raise(ALERT_INTERNAL, "Poll loop error: " + e, AlertService.Severity.ERROR);
            inFlight = null;
        }
    }

    /** One step of the loop; {@code now} is wall-clock ms. */
    synchronized void tick(long now) {
        FetchRequest req = inFlight;
        if (req != null) {
            if (req.isFinished()) {
                inFlight = null;
                complete(req);
            }
            return;
        }
        if (lastPollStartMs + pollRateMs < now) {
            inFlight = orchestrator.fetch(address, sanitize);
            lastPollStartMs = now;
        }
    }

    private void complete(FetchRequest req) {
        try {
            Snapshot s = req.join();
            latestSnapshot = s;
            lastError = null;
            alerts.resolve(ALERT_FETCH);
            alerts.resolve(ALERT_INTERNAL);
            if (log.isDebugEnabled()) {
                log.debug("bms_poll_ok tookMs={} cells={}", s.fetchedAtMs() - req.getStartedAtMs(),
                        s.cellVoltage().getCellCount());
            }
        } catch (FetchFailedException e) {
            lastError = PollError.of(ErrorKind.FETCH_FAILED, e);
            log.warn("bms_poll_failed leg={} cause={}", e.getLeg(), e.getCause().toString());
            alerts.raise(ALERT_FETCH, "Could not fetch data: " + e.getMessage(), AlertService.Severity.WARN);
        } catch (UnexpectedFailureException e) {
            lastError = PollError.of(ErrorKind.UNEXPECTED, e);
            log.error("bms_poll_crashed leg={}", e.getLeg(), e.getCause());
            alerts.raise(ALERT_INTERNAL, "Unexpected error: " + e.getMessage(), AlertService.Severity.ERROR);
        } catch (AcquisitionException e) {
            lastError = PollError.of(ErrorKind.UNEXPECTED, e);
            log.error("bms_poll_unknown_failure leg={}", e.getLeg(), e);
            alerts.raise(ALERT_INTERNAL, "Unexpected error: " + e.getMessage(), AlertService.Severity.ERROR);
        }
    }

    // ---- Views ----

    /** Used by the status endpoint and the health indicator. */
    public PollStatus buildStatus() {
        long now = System.currentTimeMillis();
        Snapshot s = latestSnapshot;
        PollError err = lastError;
        return PollStatus.builder()
                .address(address)
                .sanitize(sanitize)
                .pollRateMs(pollRateMs)
                .inFlight(isInFlight())
                .snapshot(s)
                .snapshotAgeMs(s == null ? -1 : Math.max(0, now - s.fetchedAtMs()))
                .error(err)
                .build();
    }

    private void logSummarySafe() {
        try {
            Snapshot s = latestSnapshot;
            PollError err = lastError;
            if (s == null) {
                log.info("BMS: no data yet{}", err == null ? "" : " (last error: " + err.getMessage() + ")");
                return;
            }
            CellVoltageReport cv = s.cellVoltage();
            log.info("BMS: U={}V I={} SoC={}% T={}..{}°C; cells={} avg={}mV min={}mV max={}mV Δ={}mV; tcell Δ={}°C{}",
                    s.main().voltage(), s.main().current(), s.main().stateOfCharge(),
                    s.main().tempMin(), s.main().tempMax(),
                    cv.getCellCount(), cv.getOverall().avg(), cv.getOverall().min(), cv.getOverall().max(),
                    cv.getOverall().delta(), String.format("%.1f", s.cellTemperature().getOverall().delta()),
                    err == null ? "" : " (last poll failed: " + err.getMessage() + ")");
        } catch (Exception e) {
            log.warn("bms_summary_failed: {}", e.getMessage());
        }
    }

    @lombok.Value
    public static class PollError {
        ErrorKind kind;
        String leg;
        String message;
        long atMs;

        static PollError of(ErrorKind kind, AcquisitionException e) {
            return new PollError(kind, e.getLeg() == null ? null : e.getLeg().name(), e.getMessage(),
                    System.currentTimeMillis());
        }
    }

    @Builder @Getter @ToString @EqualsAndHashCode @AllArgsConstructor
    public static class PollStatus {
        String address;
        boolean sanitize;
        long pollRateMs;
        boolean inFlight;
        Snapshot snapshot;     // null until the first successful cycle
        long snapshotAgeMs;    // -1 when no snapshot
        PollError error;       // null after a successful cycle
    }
}
