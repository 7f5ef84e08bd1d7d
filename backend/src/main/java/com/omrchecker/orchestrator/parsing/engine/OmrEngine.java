package com.omrchecker.orchestrator.parsing.engine;

import com.omrchecker.orchestrator.parsing.model.RecognitionResult;
import com.omrchecker.orchestrator.parsing.model.ScanConfig;

import java.nio.file.Path;

/**
 * Reads the marked answers off one scanned sheet.
 */
public interface OmrEngine {

    RecognitionResult recognize(Path image, ScanConfig scanConfig) throws RecognitionException;
}
