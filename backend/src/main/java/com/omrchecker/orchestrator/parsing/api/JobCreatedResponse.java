package com.omrchecker.orchestrator.parsing.api;

import com.omrchecker.orchestrator.parsing.model.JobStatus;

public record JobCreatedResponse(String jobId, JobStatus status) {}
