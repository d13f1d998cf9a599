package io.ezvis.proxylog.service.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Duration;
import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ImportSummary(
        String importId,
        String source,
        ImportOutcome outcome,
        long imported,
        long failed,
        long batches,
        Map<String, Long> failuresByReason,
        List<FailedLine> sampleFailures,
        Duration duration,
        String message
) {

    public boolean isComplete() {
        return outcome == ImportOutcome.COMPLETED;
    }
}
