package com.govsandbox.export;

import java.util.List;

/**
 * Result of offline verification. {@code valid} only when {@code problems} is empty.
 * {@code firstBrokenIndex} is -1 when the chain itself verified.
 */
public record BundleVerificationReport(boolean valid, long eventsVerified, int evidenceRecordsVerified,
                                       long firstBrokenIndex, List<String> problems) {

    public BundleVerificationReport {
        problems = List.copyOf(problems);
    }
}
