package work.agentflow.engine.condition;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.agentflow.engine.shared.ErrorKind;
import work.agentflow.engine.state.StepResult;
import work.agentflow.engine.state.StepStatus;
import work.agentflow.engine.variables.VariableResolver;
import work.agentflow.engine.variables.VariableScope;

class ExpressionParserTest {
    private static Object eval(String source) {
        var scope = VariableScope.of(
            Map.of("id", "r1"),
            Map.of("count", 3, "name", "alpha"),
            Map.of("build", new StepResult(StepStatus.COMPLETED, 0, "ok", null, null, false, false, null, null, 10L, 1, null, null, null, null))
        );
        return new ExpressionInterpreter(source, new VariableResolver(scope), "when").evaluate(ExpressionParser.parse(source));
    }

    @Test
    void evaluatesArithmeticWithPrecedence() {
        assertEquals(0, new BigDecimal("7").compareTo((BigDecimal) eval("1 + 2 * 3")));
        assertEquals(0, new BigDecimal("9").compareTo((BigDecimal) eval("(1 + 2) * 3")));
        assertEquals(0, new BigDecimal("1").compareTo((BigDecimal) eval("7 % 3")));
    }

    @Test
    void evaluatesComparisonsAndBooleans() {
        assertEquals(true, eval("${context.count} > 2 and ${steps.build.exit_code} == 0"));
        assertEquals(false, eval("not (${context.count} >= 3)"));
        assertEquals(true, eval("${context.name} == 'alpha' || False"));
        assertEquals(true, eval("${context.name} in ['alpha', 'beta']"));
        assertEquals(true, eval("'gamma' not in ['alpha', 'beta']"));
    }

    @Test
    void rejectsCallsAttributesAndImports() {
        assertThrows(ExpressionException.class, () -> ExpressionParser.parse("open('x')"));
        assertThrows(ExpressionException.class, () -> ExpressionParser.parse("os.system"));
        var ex = assertThrows(ExpressionException.class, () -> ExpressionParser.parse("import os"));
        assertEquals(ErrorKind.CONFIGURATION, ex.kind());
        assertThrows(ExpressionException.class, () -> ExpressionParser.parse("unknown_name == 1"));
    }

    @Test
    void capsNestingDepth() {
        var deep = "(".repeat(60) + "1" + ")".repeat(60);
        assertThrows(ExpressionException.class, () -> ExpressionParser.parse(deep));
        var shallow = "(".repeat(10) + "1" + ")".repeat(10);
        assertInstanceOf(ExpressionNode.Literal.class, ExpressionParser.parse(shallow));
    }

    @Test
    void divisionByZeroIsAnError() {
        assertThrows(ExpressionException.class, () -> eval("1 / 0"));
    }

    @Test
    void truthinessFollowsValueKind() {
        assertFalse(ExpressionInterpreter.isTruthy(""));
        assertFalse(ExpressionInterpreter.isTruthy(BigDecimal.ZERO));
        assertTrue(ExpressionInterpreter.isTruthy("x"));
        assertFalse(ExpressionInterpreter.isTruthy(null));
    }
}
