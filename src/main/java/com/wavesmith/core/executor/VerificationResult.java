package com.wavesmith.core.executor;

import java.util.List;

public record VerificationResult(boolean verified, List<String> issues) {

    public VerificationResult {
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    public static VerificationResult passed() {
        return new VerificationResult(true, List.of());
    }

    public static VerificationResult failed(String... issues) {
        return new VerificationResult(false, List.of(issues));
    }
}
