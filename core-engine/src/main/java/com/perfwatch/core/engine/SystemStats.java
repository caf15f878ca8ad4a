package com.perfwatch.core.engine;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.perfwatch.core.model.EntityKind;
import com.perfwatch.core.model.Tier;

import java.io.Serializable;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Operational snapshot of the engine, served by the stats endpoint.
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({"running", "entitiesByKind", "alertsRetained", "activeAlerts", "baselines",
        "recordsPerTier", "droppedEvents"})
public final class SystemStats implements Serializable {

    private static final long serialVersionUID = 1L;

    private final boolean running;
    private final Map<EntityKind, Integer> entitiesByKind;
    private final int alertsRetained;
    private final int activeAlerts;
    private final int baselines;
    private final Map<Tier, Long> recordsPerTier;
    private final long droppedEvents;

    public SystemStats(boolean running, Map<EntityKind, Integer> entitiesByKind, int alertsRetained,
            int activeAlerts, int baselines, Map<Tier, Long> recordsPerTier, long droppedEvents) {
        this.running = running;
        this.entitiesByKind = Collections.unmodifiableMap(copy(EntityKind.class, entitiesByKind));
        this.alertsRetained = alertsRetained;
        this.activeAlerts = activeAlerts;
        this.baselines = baselines;
        this.recordsPerTier = Collections.unmodifiableMap(copy(Tier.class, recordsPerTier));
        this.droppedEvents = droppedEvents;
    }

    private static <K extends Enum<K>, V> Map<K, V> copy(Class<K> type, Map<K, V> source) {
        Map<K, V> result = new EnumMap<>(type);
        result.putAll(source);
        return result;
    }

    public boolean isRunning() {
        return running;
    }

    public Map<EntityKind, Integer> getEntitiesByKind() {
        return entitiesByKind;
    }

    public int getAlertsRetained() {
        return alertsRetained;
    }

    public int getActiveAlerts() {
        return activeAlerts;
    }

    public int getBaselines() {
        return baselines;
    }

    public Map<Tier, Long> getRecordsPerTier() {
        return recordsPerTier;
    }

    /**
     * @return events dropped because a subscriber queue was full
     */
    public long getDroppedEvents() {
        return droppedEvents;
    }

    @Override
    public String toString() {
        return "SystemStats{" +
                "running=" + running +
                ", entitiesByKind=" + entitiesByKind +
                ", alertsRetained=" + alertsRetained +
                ", activeAlerts=" + activeAlerts +
                ", recordsPerTier=" + recordsPerTier +
                ", droppedEvents=" + droppedEvents +
                '}';
    }
}
