package com.openclaw.scheduler.cron;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Named regex categories for transient errors. Hosts register extra
 * categories with {@link #withCategory}; {@code cron.retry.retryOn} selects
 * which categories count.
 */
public final class CronErrorClassifier {

    public static final String RATE_LIMIT = "rate_limit";
    public static final String NETWORK = "network";
    public static final String TIMEOUT = "timeout";
    public static final String SERVER_ERROR = "server_error";

    private static final CronErrorClassifier DEFAULTS;

    static {
        Map<String, Pattern> patterns = new LinkedHashMap<>();
        patterns.put(RATE_LIMIT, Pattern.compile(
                "(rate[_ ]limit|too many requests|429|resource has been exhausted|cloudflare)",
                Pattern.CASE_INSENSITIVE));
        patterns.put(NETWORK, Pattern.compile(
                "(network|econnreset|econnrefused|fetch failed|socket)", Pattern.CASE_INSENSITIVE));
        patterns.put(TIMEOUT, Pattern.compile("(timeout|timed out|etimedout)", Pattern.CASE_INSENSITIVE));
        patterns.put(SERVER_ERROR, Pattern.compile("\\b5\\d{2}\\b"));
        DEFAULTS = new CronErrorClassifier(patterns);
    }

    private final Map<String, Pattern> categories;

    private CronErrorClassifier(Map<String, Pattern> categories) {
        this.categories = Collections.unmodifiableMap(new LinkedHashMap<>(categories));
    }

    public static CronErrorClassifier defaults() {
        return DEFAULTS;
    }

    /**
     * Copy of this classifier with one category added or replaced.
     */
    public CronErrorClassifier withCategory(String name, Pattern pattern) {
        Map<String, Pattern> next = new LinkedHashMap<>(categories);
        next.put(name, pattern);
        return new CronErrorClassifier(next);
    }

    public Set<String> categories() {
        return categories.keySet();
    }

    /**
     * @param retryOn category names to consider; null or empty means all
     */
    public boolean isTransient(String error, Collection<String> retryOn) {
        if (error == null || error.isEmpty()) {
            return false;
        }
        Collection<String> keys = retryOn == null || retryOn.isEmpty() ? categories.keySet() : retryOn;
        for (String key : keys) {
            Pattern pattern = categories.get(key);
            if (pattern != null && pattern.matcher(error).find()) {
                return true;
            }
        }
        return false;
    }
}
