package com.omrchecker.orchestrator.parsing.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Resolved result of one sheet. A sheet in {@link SheetStatus#PARSED} carries a {@link Success},
 * a sheet in {@link SheetStatus#FAILED} carries a {@link Failure}, a pending sheet carries nothing.
 */
public sealed interface SheetOutcome permits SheetOutcome.Success, SheetOutcome.Failure {

    SheetStatus status();

    record Success(Map<String, String> answers, int ambiguityCount) implements SheetOutcome {
        public Success {
            answers = answers == null ? Map.of() : new LinkedHashMap<>(answers);
            ambiguityCount = Math.max(0, ambiguityCount);
        }

        @Override
        public SheetStatus status() {
            return SheetStatus.PARSED;
        }
    }

    record Failure(String reason) implements SheetOutcome {
        public Failure {
            reason = reason == null || reason.isBlank() ? "unknown_error" : reason;
        }

        @Override
        public SheetStatus status() {
            return SheetStatus.FAILED;
        }
    }
}
