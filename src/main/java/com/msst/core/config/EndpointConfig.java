package com.msst.core.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Connection parameters of the system under test plus per-group enable flags,
 * as read from an {@code s3_config.yaml} style file.
 * <p>
 * Every key of the file is kept in {@link #values()} so test units can read
 * settings the harness itself does not interpret.
 */
public record EndpointConfig(Map<String, Object> values) {

    public static final String ENDPOINT_URL = "s3_endpoint_url";
    public static final String ACCESS_KEY = "s3_access_key";
    public static final String SECRET_KEY = "s3_secret_key";
    public static final String REGION = "s3_region";
    public static final String USE_SSL = "s3_use_ssl";
    public static final String VERIFY_SSL = "s3_verify_ssl";
    public static final String BUCKET_PREFIX = "s3_bucket_prefix";
    public static final String PATH_STYLE = "s3_path_style";
    public static final String VENDOR_TYPE = "vendor_type";

    /** Groups that run by default when the file has no {@code test_<group>} flag. */
    private static final Set<String> DEFAULT_ENABLED_GROUPS = Set.of("basic", "multipart");

    public EndpointConfig {
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static EndpointConfig defaults() {
        return new EndpointConfig(Map.of());
    }

    public String endpointUrl() {
        return string(ENDPOINT_URL, "http://localhost:9000");
    }

    public String accessKey() {
        return string(ACCESS_KEY, "minioadmin");
    }

    public String secretKey() {
        return string(SECRET_KEY, "minioadmin");
    }

    public String region() {
        return string(REGION, "us-east-1");
    }

    public boolean useSsl() {
        return bool(USE_SSL, false);
    }

    public boolean verifySsl() {
        return bool(VERIFY_SSL, true);
    }

    public String bucketPrefix() {
        return string(BUCKET_PREFIX, "msst-test");
    }

    public boolean pathStyle() {
        return bool(PATH_STYLE, true);
    }

    public String vendorType() {
        return string(VENDOR_TYPE, "unknown");
    }

    public boolean isGroupEnabled(String group) {
        return bool("test_" + group, DEFAULT_ENABLED_GROUPS.contains(group));
    }

    public String string(String key, String defaultValue) {
        Object value = values.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    public boolean bool(String key, boolean defaultValue) {
        Object value = values.get(key);
        if (value instanceof Boolean b) {
            return b;
        }
        if (value == null) {
            return defaultValue;
        }
        String s = value.toString().trim().toLowerCase();
        return switch (s) {
            case "true", "yes", "y", "1", "on" -> true;
            case "false", "no", "n", "0", "off" -> false;
            default -> defaultValue;
        };
    }

    public int integer(String key, int defaultValue) {
        Object value = values.get(key);
        if (value instanceof Number n) {
            return n.intValue();
        }
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }
}
