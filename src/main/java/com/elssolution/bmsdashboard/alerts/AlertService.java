package com.elssolution.bmsdashboard.alerts;

import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Keyed operational alerts. A key is active between raise() and resolve();
 * repeated raises refresh the same episode instead of piling up.
 */
@Slf4j
@Service
public class AlertService {

    public enum Severity { INFO, WARN, ERROR, CRITICAL }

    @Value @Builder
    public static class AlertView {
        String key;
        String message;
        Severity severity;
        long firstSeen;   // epoch ms, start of the current episode
        long lastSeen;
        int count;        // raises in this episode
        boolean active;
    }

    @Value @Builder
    public static class EventView {
        String key;
        String message;
        Severity severity;
        long ts;
        String type;      // "RAISE" or "RESOLVE"
    }

    @Value @Builder
    public static class AlertsSnapshot {
        List<AlertView> active;
        List<EventView> recent; // newest first
    }

    private final Map<String, MutableAlert> alerts = new ConcurrentHashMap<>();
    private final Deque<EventView> recent = new ArrayDeque<>();
    private final int recentCapacity = 50;

    /** Raise or refresh an alert. Logs only on the transition into active. */
    public void raise(String key, String message, Severity sev) {
        long now = System.currentTimeMillis();
        MutableAlert a = alerts.computeIfAbsent(key, k -> new MutableAlert(k, sev, message, now));

        boolean startingNewEpisode;
        synchronized (a) {
            startingNewEpisode = !a.active || a.count.get() == 0;
            if (!a.active) {
                a.firstSeen = now;
                a.count.set(0);
            }
            a.active = true;
            a.severity = sev;
            a.message = message;
            a.count.incrementAndGet();
            a.lastSeen = now;
        }

        if (startingNewEpisode) {
            log.warn("ALERT RAISE key={} sev={} msg={}", key, sev, message);
            emitEvent(key, message, sev, "RAISE");
        } else if (log.isDebugEnabled()) {
            log.debug("alert_refresh key={} msg={}", key, message);
        }
    }

    public void resolve(String key) {
        MutableAlert a = alerts.get(key);
        if (a == null) return;

        boolean wasActive;
        Severity sev;
        synchronized (a) {
            wasActive = a.active;
            sev = a.severity;
            a.active = false;
            a.lastSeen = System.currentTimeMillis();
        }
        if (wasActive) {
            log.info("ALERT RESOLVE key={}", key);
            emitEvent(key, "recovered", sev, "RESOLVE");
        }
    }

    public boolean isActive(String key) {
        MutableAlert a = alerts.get(key);
        return a != null && a.active;
    }

    public AlertsSnapshot snapshot() {
        List<AlertView> active = alerts.values().stream()
                .filter(ma -> ma.active)
                .sorted(Comparator.comparingLong(ma -> -ma.lastSeen))
                .map(MutableAlert::view)
                .toList();

        List<EventView> recentCopy;
        synchronized (recent) {
            recentCopy = new ArrayList<>(recent);
        }
        Collections.reverse(recentCopy);
        return AlertsSnapshot.builder().active(active).recent(recentCopy).build();
    }

    private void emitEvent(String key, String msg, Severity sev, String type) {
        EventView ev = EventView.builder()
                .key(key).message(msg).severity(sev).type(type)
                .ts(System.currentTimeMillis())
                .build();
        synchronized (recent) {
            recent.addLast(ev);
            while (recent.size() > recentCapacity) recent.removeFirst();
        }
    }

    private static class MutableAlert {
        final String key;
        volatile String message;
        volatile Severity severity;
        volatile boolean active;
        volatile long firstSeen;
        volatile long lastSeen;
        final AtomicInteger count = new AtomicInteger(0);

        MutableAlert(String key, Severity severity, String message, long now) {
            this.key = key;
            this.severity = severity;
            this.message = message;
            this.active = true;
            this.firstSeen = now;
            this.lastSeen = now;
        }

        AlertView view() {
            return AlertView.builder()
                    .key(key).message(message).severity(severity).active(active)
                    .firstSeen(firstSeen).lastSeen(lastSeen).count(count.get())
                    .build();
        }
    }
}
