package work.agentflow.engine.flow;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import work.agentflow.engine.state.ErrorInfo;
import work.agentflow.engine.state.StepResult;
import work.agentflow.engine.state.StepStatus;

final class LoopSupport {
    private LoopSupport() {}

    static Map<String, Object> loopVars(int index, Integer total, Instant loopStarted, Instant now) {
        var vars = new LinkedHashMap<String, Object>();
        vars.put("index", index);
        vars.put("iteration", index + 1);
        if (total != null) {
            vars.put("total", total);
            vars.put("first", index == 0);
            vars.put("last", index == total - 1);
        }
        vars.put("elapsed", seconds(Duration.between(loopStarted, now)));
        return vars;
    }

    static double successRate(int completed, int total) {
        if (total == 0) {
            return 1.0;
        }
        return BigDecimal.valueOf(completed).divide(BigDecimal.valueOf(total), 3, RoundingMode.HALF_UP).doubleValue();
    }

    static double seconds(Duration duration) {
        return BigDecimal.valueOf(Math.max(0L, duration.toMillis())).divide(BigDecimal.valueOf(1000), 3, RoundingMode.HALF_UP).doubleValue();
    }

    /**
     * Result of a loop step: the summary doubles as its {@code json} value.
     */
    static StepResult loopResult(StepStatus status, Map<String, Object> summary, ErrorInfo error, Instant started, Instant finished) {
        var exitCode = status == StepStatus.COMPLETED ? 0 : 1;
        return new StepResult(status, exitCode, null, null, summary, false, false, null, null, 0L, 1, null, null, null, error)
            .finishedAt(started, finished);
    }
}
