package eryxon.qrm.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * A collection fetch in which at least one sub-fetch failed.
 * The whole fetch fails; the exception names every failing key with its cause.
 */
public class PartialFanoutException extends QrmException {

    private final Map<String, Throwable> failures;
    private final int succeeded;

    public PartialFanoutException(Map<String, Throwable> failures, int succeeded) {
        super(describe(failures, succeeded));
        this.failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
        this.succeeded = succeeded;
        failures.values().forEach(this::addSuppressed);
    }

    /** Failing sub-keys mapped to their causes, in dispatch order. */
    public Map<String, Throwable> failures() {
        return failures;
    }

    public Set<String> failedKeys() {
        return failures.keySet();
    }

    /** Number of sub-fetches that completed normally. */
    public int succeeded() {
        return succeeded;
    }

    private static String describe(Map<String, Throwable> failures, int succeeded) {
        StringBuilder sb = new StringBuilder()
                .append(failures.size()).append(" of ").append(failures.size() + succeeded)
                .append(" sub-fetches failed:");
        failures.forEach((key, cause) -> sb.append(' ').append(key).append(" (").append(cause.getMessage()).append(')'));
        return sb.toString();
    }
}
