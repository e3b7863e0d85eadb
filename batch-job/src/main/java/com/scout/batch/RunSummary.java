package com.scout.batch;

import com.scout.core.pipeline.PipelineResult;
import com.scout.core.pipeline.PropertyOutcome;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Per-property success/failure lines printed at the end of a run.
 */
final class RunSummary {

    private RunSummary() {
        // utility class
    }

    static List<String> lines(Map<String, String> loadFailures, PipelineResult result) {
        List<String> lines = new ArrayList<>();
        loadFailures.forEach((file, error) -> lines.add(file + ": NOT LOADED (" + error + ")"));
        for (PropertyOutcome outcome : result.getOutcomes()) {
            lines.add(outcome.toString());
        }
        lines.add(String.format("%d loaded, %d not loaded, %d succeeded, %d failed, %d alerts, %d predictions",
                result.getOutcomes().size(), loadFailures.size(), result.getSucceededCount(),
                result.getFailedCount(), result.getRankedAlerts().size(), result.getPredictions().size()));
        return lines;
    }
}
