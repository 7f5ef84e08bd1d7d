package com.omrchecker.orchestrator.parsing.api;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.omrchecker.orchestrator.parsing.model.ScanConfig;
import com.omrchecker.orchestrator.parsing.model.SheetItem;

import java.util.List;

public record CreateJobRequest(
    List<SheetItem> items,
    @JsonAlias("template_json") String templateJson,
    @JsonAlias("config_json") String configJson
) {
    public ScanConfig scanConfig() {
        return new ScanConfig(templateJson, configJson);
    }
}
