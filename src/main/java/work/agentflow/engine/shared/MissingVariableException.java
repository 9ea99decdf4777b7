package work.agentflow.engine.shared;

import java.util.LinkedHashMap;

public final class MissingVariableException extends EngineException {
    private final String variable;

    public MissingVariableException(String variable, String field) {
        super(ErrorKind.MISSING_VARIABLE, "Undefined variable '${" + variable + "}'" + (field == null ? "" : " in field '" + field + "'"), details(variable, field));
        this.variable = variable;
    }

    public String variable() {
        return variable;
    }

    private static LinkedHashMap<String, Object> details(String variable, String field) {
        var details = new LinkedHashMap<String, Object>();
        details.put("variable", variable);
        if (field != null) {
            details.put("field", field);
        }
        return details;
    }
}
