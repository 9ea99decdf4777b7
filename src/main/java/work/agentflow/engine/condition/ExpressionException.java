package work.agentflow.engine.condition;

import java.util.LinkedHashMap;
import work.agentflow.engine.shared.WorkflowConfigException;

/**
 * Rejected or unevaluable {@code expr} condition.
 */
public final class ExpressionException extends WorkflowConfigException {
    public ExpressionException(String message, String source, int position) {
        super(message + (position >= 0 ? " at position " + position : "") + " in expression: " + source, details(source, position));
    }

    private static LinkedHashMap<String, Object> details(String source, int position) {
        var details = new LinkedHashMap<String, Object>();
        details.put("expression", source);
        if (position >= 0) {
            details.put("position", position);
        }
        return details;
    }
}
