package com.logsentinel.core.features;

import com.logsentinel.core.model.LogEntry;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * WiFi authentication and management-frame features.
 *
 * <p>
 * Numeric counter fields are summed when present. An entry without the
 * counter still counts as one event when its message carries the matching
 * keyword, which covers hostapd-style text logs.
 * </p>
 *
 * @since 1.0.0
 */
public final class WifiFeatureSet implements FeatureSet {

    public static final String SHAPE = "wifi";

    static final Pattern MAC_PATTERN = Pattern.compile("\\b(?:[0-9A-Fa-f]{2}[:-]){5}[0-9A-Fa-f]{2}\\b");

    private static final Pattern AUTH_FAILED = Pattern.compile("authentication failed|auth(?:entication)? failure",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern DEAUTH = Pattern.compile("deauthentication|deauth", Pattern.CASE_INSENSITIVE);
    private static final Pattern BEACON = Pattern.compile("beacon", Pattern.CASE_INSENSITIVE);
    private static final Pattern DISASSOCIATION = Pattern.compile("disassociation|disassociated",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern ASSOCIATION = Pattern.compile("(?<!dis)association|(?<!dis)associated",
            Pattern.CASE_INSENSITIVE);

    @Override
    public String getShape() {
        return SHAPE;
    }

    @Override
    public List<String> getMarkerFields() {
        return List.of("authFailures", "deauthCount", "beaconCount", "macAddress");
    }

    @Override
    public void contribute(List<LogEntry> entries, Map<String, Double> features) {
        double authFailures = 0;
        double deauth = 0;
        double beacons = 0;
        double associations = 0;
        double disassociations = 0;
        Set<String> macs = new HashSet<>();
        Set<String> failedAuthMacs = new HashSet<>();

        for (LogEntry entry : entries) {
            String message = entry.getMessage();
            double entryAuthFailures = count(entry, "authFailures", AUTH_FAILED, message);
            authFailures += entryAuthFailures;
            deauth += count(entry, "deauthCount", DEAUTH, message);
            beacons += count(entry, "beaconCount", BEACON, message);
            associations += count(entry, "associationCount", ASSOCIATION, message);
            disassociations += count(entry, "disassociationCount", DISASSOCIATION, message);

            Set<String> entryMacs = macsOf(entry, message);
            macs.addAll(entryMacs);
            if (entryAuthFailures > 0) {
                failedAuthMacs.addAll(entryMacs);
            }
        }

        features.put("authFailures", authFailures);
        features.put("deauthCount", deauth);
        features.put("beaconCount", beacons);
        features.put("associationCount", associations);
        features.put("disassociationCount", disassociations);
        features.put("uniqueMacCount", (double) macs.size());
        features.put("failedAuthMacCount", (double) failedAuthMacs.size());
    }

    private static double count(LogEntry entry, String field, Pattern keyword, String message) {
        Optional<Double> value = entry.getNumericField(field);
        if (value.isPresent()) {
            return value.get();
        }
        return keyword.matcher(message).find() ? 1.0 : 0.0;
    }

    private static Set<String> macsOf(LogEntry entry, String message) {
        Set<String> macs = new HashSet<>();
        entry.getStringField("macAddress")
                .filter(mac -> !mac.isBlank())
                .ifPresent(mac -> macs.add(normalizeMac(mac)));
        Matcher m = MAC_PATTERN.matcher(message);
        while (m.find()) {
            macs.add(normalizeMac(m.group()));
        }
        return macs;
    }

    static String normalizeMac(String mac) {
        return mac.trim().toLowerCase(Locale.ROOT).replace('-', ':');
    }
}
