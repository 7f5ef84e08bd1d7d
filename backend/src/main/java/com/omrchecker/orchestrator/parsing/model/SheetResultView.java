package com.omrchecker.orchestrator.parsing.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SheetResultView(
    String id,
    String itemId,
    String imageUrl,
    SheetStatus status,
    Map<String, String> answers,
    Integer ambiguityCount,
    String error
) {
    public static SheetResultView from(OmrSheet sheet) {
        SheetOutcome.Success success = sheet.success();
        return new SheetResultView(
            sheet.id(),
            sheet.itemId(),
            sheet.imageLocator(),
            sheet.status(),
            success == null ? null : success.answers(),
            success == null ? null : success.ambiguityCount(),
            sheet.status() == SheetStatus.FAILED ? sheet.errorMessage() : null
        );
    }
}
