package io.toolwatch;

import io.toolwatch.core.CurationResult;

/**
 * Analyzes one tool: fetches its sources, extracts structured data and diffs it against the last snapshot.
 */
@FunctionalInterface
public interface ToolAnalyzer {

    CurationResult analyze(String toolId) throws Exception;
}
