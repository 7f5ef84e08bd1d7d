package com.omrchecker.orchestrator.parsing.model;

import java.util.Map;

public record RecognitionResult(Map<String, String> answers, int ambiguityCount) {

    public SheetOutcome.Success toOutcome() {
        return new SheetOutcome.Success(answers, ambiguityCount);
    }
}
