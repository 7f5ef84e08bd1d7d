package com.omrchecker.orchestrator.parsing.model;

import com.fasterxml.jackson.annotation.JsonAlias;

public record SheetItem(
    String id,
    @JsonAlias({"image_url", "imageUrl"}) String locator
) {
    public String normalizedId() {
        return id == null ? null : id.trim();
    }

    public String normalizedLocator() {
        return locator == null ? null : locator.trim();
    }
}
