package com.logsentinel.core.features;

import com.logsentinel.core.model.LogEntry;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Firewall connection features, selected by the {@code dstPort} field.
 *
 * @since 1.0.0
 */
public final class FirewallFeatureSet implements FeatureSet {

    public static final String SHAPE = "firewall";

    private static final Set<String> BLOCK_ACTIONS = Set.of(
            "block", "blocked", "deny", "denied", "drop", "dropped", "reject", "rejected");

    @Override
    public String getShape() {
        return SHAPE;
    }

    @Override
    public List<String> getMarkerFields() {
        return List.of("dstPort");
    }

    @Override
    public void contribute(List<LogEntry> entries, Map<String, Double> features) {
        int events = 0;
        int blocked = 0;
        Set<String> ports = new HashSet<>();
        Set<String> sources = new HashSet<>();

        for (LogEntry entry : entries) {
            if (!entry.hasField("dstPort")) {
                continue;
            }
            events++;
            entry.getNumericField("dstPort")
                    .map(p -> String.valueOf(p.longValue()))
                    .or(() -> entry.getStringField("dstPort"))
                    .ifPresent(ports::add);
            entry.getStringField("srcIp").ifPresent(sources::add);
            boolean isBlocked = entry.getStringField("action")
                    .map(a -> BLOCK_ACTIONS.contains(a.trim().toLowerCase(Locale.ROOT)))
                    .orElse(false);
            if (isBlocked) {
                blocked++;
            }
        }

        features.put("firewallEventCount", (double) events);
        features.put("blockedCount", (double) blocked);
        features.put("blockedRate", events == 0 ? 0.0 : (double) blocked / events);
        features.put("uniqueDstPortCount", (double) ports.size());
        features.put("uniqueSrcIpCount", (double) sources.size());
    }
}
