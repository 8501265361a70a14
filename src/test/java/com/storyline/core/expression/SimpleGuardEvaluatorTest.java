package com.storyline.core.expression;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SimpleGuardEvaluatorTest {

    private final SimpleGuardEvaluator evaluator = new SimpleGuardEvaluator();

    private final VariableContext vars = VariableContext.of(Map.of(
            "x", 5,
            "gold", 12.5,
            "name", "Mara",
            "metGuard", true,
            "door.open", false
    ));

    private boolean eval(String guard) {
        return evaluator.evaluate(guard, vars);
    }

    @Nested
    @DisplayName("Comparisons")
    class Comparisons {

        @Test
        @DisplayName("numbers compare by value regardless of representation")
        void numbers() {
            assertTrue(eval("x > 0"));
            assertFalse(eval("x < 0"));
            assertTrue(eval("x >= 5"));
            assertTrue(eval("x <= 5.0"));
            assertTrue(eval("x == 5.00"));
            assertTrue(eval("x = 5"));
            assertTrue(eval("gold != 12"));
        }

        @Test
        @DisplayName("negative number literals compare against variables")
        void negativeNumbers() {
            assertTrue(eval("x > -1"));
            assertTrue(eval("-2.5 < gold"));
            assertFalse(eval("x <= -5"));
            assertTrue(evaluator.evaluate("debt == -3", VariableContext.of(Map.of("debt", -3))));
            assertThrows(EvaluationException.class, () -> eval("x > -"));
            assertThrows(EvaluationException.class, () -> eval("x > - name"));
        }

        @Test
        @DisplayName("strings compare with either quote style")
        void strings() {
            assertTrue(eval("name == 'Mara'"));
            assertTrue(eval("name != \"Bob\""));
            assertTrue(eval("name > 'Abe'"));
            assertTrue(eval("name <= 'Mara'"));
            assertFalse(eval("name < 'Abe'"));
        }

        @Test
        @DisplayName("booleans support equality only")
        void booleans() {
            assertTrue(eval("metGuard == true"));
            assertTrue(eval("door.open != true"));
            assertThrows(EvaluationException.class, () -> eval("metGuard > false"));
        }
    }

    @Nested
    @DisplayName("Logic")
    class Logic {

        @Test
        @DisplayName("bare boolean variables and literals are guards")
        void bareBooleans() {
            assertTrue(eval("metGuard"));
            assertFalse(eval("door.open"));
            assertTrue(eval("true"));
        }

        @Test
        @DisplayName("symbol and word operators are equivalent")
        void operators() {
            assertTrue(eval("x > 0 && metGuard"));
            assertTrue(eval("x > 0 and metGuard"));
            assertTrue(eval("door.open || metGuard"));
            assertTrue(eval("door.open or metGuard"));
            assertTrue(eval("!door.open"));
            assertTrue(eval("not door.open"));
        }

        @Test
        @DisplayName("and binds tighter than or; parentheses override")
        void precedence() {
            assertTrue(eval("metGuard || door.open && false"));
            assertFalse(eval("(metGuard || door.open) && false"));
            assertFalse(eval("!metGuard && x > 0"));
        }

        @Test
        @DisplayName("logic operators short-circuit, so unknown variables on the dead side are not looked up")
        void shortCircuit() {
            assertFalse(eval("door.open && missing > 1"));
            assertTrue(eval("metGuard || missing > 1"));
        }
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        @DisplayName("unknown variables fail")
        void unknownVariable() {
            var e = assertThrows(EvaluationException.class, () -> eval("missing > 1"));
            assertTrue(e.getMessage().contains("missing"));
            assertFalse(e.isLocated());
        }

        @Test
        @DisplayName("type mismatches fail")
        void typeMismatch() {
            assertThrows(EvaluationException.class, () -> eval("name > 3"));
            assertThrows(EvaluationException.class, () -> eval("x"));
            assertThrows(EvaluationException.class, () -> eval("x && metGuard"));
        }

        @Test
        @DisplayName("malformed expressions fail")
        void malformed() {
            assertThrows(EvaluationException.class, () -> eval("x >"));
            assertThrows(EvaluationException.class, () -> eval("(x > 1"));
            assertThrows(EvaluationException.class, () -> eval("x > 1 )"));
            assertThrows(EvaluationException.class, () -> eval("name == 'Mara"));
            assertThrows(EvaluationException.class, () -> eval("x # 1"));
            assertThrows(EvaluationException.class, () -> eval("   "));
        }
    }
}
