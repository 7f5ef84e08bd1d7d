package com.omrchecker.orchestrator.parsing.api;

import java.util.Map;

public record SheetParseResponse(String id, Map<String, String> answers, int multiMarkedCount) {}
