package com.omrchecker.orchestrator.parsing.api;

import java.util.List;

public record JobListResponse(int total, List<JobSummaryView> jobs) {}
