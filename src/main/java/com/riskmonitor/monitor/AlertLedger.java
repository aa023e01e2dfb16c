package com.riskmonitor.monitor;

import com.riskmonitor.domain.model.Alert;
import com.riskmonitor.exception.AlertNotFoundException;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * In-memory, insertion-ordered collection of raised alerts.
 *
 * <p>Deduplication happens on insert: a candidate is rejected while an open alert with
 * the same (type, level) exists. Resolving an alert frees its key, so an identical
 * condition can be raised again afterwards.
 *
 * <p>Not thread-safe. {@link MonitorEngine} guards every access with its read/write lock.
 */
public class AlertLedger {

    private final List<Alert> entries = new ArrayList<>();

    /**
     * Appends the candidate unless an open alert with the same type and level exists.
     *
     * @return true if the candidate was appended
     */
    public boolean admit(Alert candidate) {
        for (Alert existing : entries) {
            if (existing.blocks(candidate)) {
                return false;
            }
        }
        entries.add(candidate);
        return true;
    }

    /**
     * Marks the alert with the given id as resolved. Resolving an already resolved
     * alert keeps its original {@code resolvedAt}.
     *
     * @return the alert in its resolved state
     * @throws AlertNotFoundException if no alert with that id was ever admitted
     */
    public Alert resolve(String alertId, LocalDateTime at) {
        int index = indexOf(alertId);
        if (index < 0) {
            throw new AlertNotFoundException(alertId);
        }

        Alert existing = entries.get(index);
        if (existing.isResolved()) {
            return existing;
        }
        Alert resolved = existing.resolve(at);
        entries.set(index, resolved);
        return resolved;
    }

    /**
     * Returns alerts newest first. Alerts raised at the same instant keep reverse insertion order.
     *
     * @param limit maximum number of alerts; zero or negative means all
     */
    public List<Alert> list(int limit) {
        List<Alert> sorted = new ArrayList<>(entries);
        Collections.reverse(sorted);
        sorted.sort(Comparator.comparing(Alert::getRaisedAt).reversed());

        if (limit > 0 && sorted.size() > limit) {
            return new ArrayList<>(sorted.subList(0, limit));
        }
        return sorted;
    }

    public int size() {
        return entries.size();
    }

    public long openCount() {
        return entries.stream().filter(alert -> !alert.isResolved()).count();
    }

    // Ids embed a one-second bucket, so a re-raised alert can share an id with a resolved one.
    // Prefer the open entry in that case.
    private int indexOf(String alertId) {
        int firstMatch = -1;
        for (int i = 0; i < entries.size(); i++) {
            Alert alert = entries.get(i);
            if (alert.getId().equals(alertId)) {
                if (!alert.isResolved()) {
                    return i;
                }
                if (firstMatch < 0) {
                    firstMatch = i;
                }
            }
        }
        return firstMatch;
    }
}
