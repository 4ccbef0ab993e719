package com.logsentinel.core.features;

import com.logsentinel.core.model.LogEntry;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * DNS query features, selected by the {@code queryName} field.
 *
 * @since 1.0.0
 */
public final class DnsFeatureSet implements FeatureSet {

    public static final String SHAPE = "dns";

    private static final List<String> RESPONSE_CODE_FIELDS = List.of("responseCode", "rcode");

    @Override
    public String getShape() {
        return SHAPE;
    }

    @Override
    public List<String> getMarkerFields() {
        return List.of("queryName");
    }

    @Override
    public void contribute(List<LogEntry> entries, Map<String, Double> features) {
        int queries = 0;
        int nxdomain = 0;
        int maxLength = 0;
        Set<String> domains = new HashSet<>();

        for (LogEntry entry : entries) {
            Optional<String> query = entry.getStringField("queryName");
            if (query.isEmpty()) {
                continue;
            }
            queries++;
            String domain = normalizeDomain(query.get());
            domains.add(domain);
            maxLength = Math.max(maxLength, domain.length());
            if (isNxdomain(entry)) {
                nxdomain++;
            }
        }

        features.put("dnsQueryCount", (double) queries);
        features.put("uniqueDomainCount", (double) domains.size());
        features.put("nxdomainCount", (double) nxdomain);
        features.put("nxdomainRate", queries == 0 ? 0.0 : (double) nxdomain / queries);
        features.put("maxDomainLength", (double) maxLength);
    }

    private static boolean isNxdomain(LogEntry entry) {
        for (String field : RESPONSE_CODE_FIELDS) {
            Optional<String> code = entry.getStringField(field);
            if (code.isPresent()) {
                String c = code.get().trim();
                // rcode 3 is NXDOMAIN
                return c.equalsIgnoreCase("NXDOMAIN") || c.equals("3");
            }
        }
        return false;
    }

    private static String normalizeDomain(String name) {
        String d = name.trim().toLowerCase(Locale.ROOT);
        return d.endsWith(".") ? d.substring(0, d.length() - 1) : d;
    }
}
