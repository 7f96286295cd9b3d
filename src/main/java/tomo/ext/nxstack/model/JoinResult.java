package tomo.ext.nxstack.model;

import java.nio.file.Path;
import java.util.List;

/**
 * Result of a run: the output paths in role order and the run summary.
 *
 * @param outputs paths written, or that would be written in a dry run
 * @param summary counters and per-role outcomes
 */
public record JoinResult(List<Path> outputs, JoinSummary summary) {

    public JoinResult {
        outputs = List.copyOf(outputs);
    }

    /**
     * @return true when at least one output was expected and none was produced
     */
    public boolean isTotalFailure() {
        return outputs.isEmpty() && !summary.roles().isEmpty();
    }
}
