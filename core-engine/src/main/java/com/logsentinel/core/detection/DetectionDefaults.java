package com.logsentinel.core.detection;

import com.logsentinel.core.config.RuleSpec;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Default rule table shared by every agent unless overridden per agent.
 *
 * <p>
 * Thresholds for the WiFi features are the values the field deployments ran
 * with; the DNS, firewall and generic rows follow the same
 * {@code divisor = threshold / 2} convention unless noted.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectionDefaults {

    public static final String AUTH_FAILURE = "auth_failure";
    public static final String DEAUTH_FLOOD = "deauth_flood";
    public static final String BEACON_FLOOD = "beacon_flood";
    public static final String MAC_SPOOFING = "mac_spoofing";
    public static final String DNS_NXDOMAIN_FLOOD = "dns_nxdomain_flood";
    public static final String DNS_DOMAIN_BURST = "dns_domain_burst";
    public static final String FIREWALL_BLOCK_FLOOD = "firewall_block_flood";
    public static final String PORT_SCAN = "port_scan";
    public static final String ERROR_BURST = "error_burst";

    /** Suffix of per-entry level alert types, as in {@code error_log_detected}. */
    public static final String LEVEL_ALERT_SUFFIX = "_log_detected";

    /** Level alert severity for levels missing from the agent's severity mapping. */
    public static final int DEFAULT_LEVEL_SEVERITY = 3;

    /** Built-in level alert severities. */
    public static final Map<String, Integer> LEVEL_SEVERITY = Map.of("error", 4, "critical", 5);

    /** Type assigned to a model hit no rule can describe. */
    public static final String MODEL_ANOMALY = "model_anomaly";

    /** Default rule table, in evaluation order. */
    public static final List<RuleSpec> RULES = List.of(
            new RuleSpec("authFailures", 5, 2, AUTH_FAILURE, 0.9,
                    "Authentication failures above threshold"),
            new RuleSpec("deauthCount", 10, 5, DEAUTH_FLOOD, 0.9,
                    "Deauthentication frame flood"),
            new RuleSpec("beaconCount", 100, 50, BEACON_FLOOD, 0.7,
                    "Beacon frame flood"),
            new RuleSpec("uniqueMacCount", 20, 10, MAC_SPOOFING, 0.6,
                    "Unusually many distinct MAC addresses"),
            new RuleSpec("nxdomainCount", 20, 10, DNS_NXDOMAIN_FLOOD, 0.7,
                    "Burst of NXDOMAIN responses"),
            new RuleSpec("uniqueDomainCount", 100, 50, DNS_DOMAIN_BURST, 0.6,
                    "Unusually many distinct queried domains"),
            new RuleSpec("blockedCount", 50, 25, FIREWALL_BLOCK_FLOOD, 0.8,
                    "Firewall blocked connections above threshold"),
            // port scans escalate faster than the threshold / 2 convention
            new RuleSpec("uniqueDstPortCount", 25, 10, PORT_SCAN, 0.7,
                    "Connections to many distinct destination ports"),
            new RuleSpec("errorCount", 10, 5, ERROR_BURST, 0.8,
                    "Error-level log entries above threshold"));

    private static final Map<String, RuleSpec> BY_FEATURE;

    static {
        Map<String, RuleSpec> byFeature = new LinkedHashMap<>();
        for (RuleSpec rule : RULES) {
            byFeature.put(rule.getFeatureName(), rule);
        }
        BY_FEATURE = Map.copyOf(byFeature);
    }

    private DetectionDefaults() {
        // constants holder
    }

    /**
     * @param featureName feature the rule watches
     * @return the default rule for the feature, if one exists
     */
    public static Optional<RuleSpec> rule(String featureName) {
        return Optional.ofNullable(BY_FEATURE.get(featureName));
    }
}
