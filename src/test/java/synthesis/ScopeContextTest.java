package synthesis;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ScopeContextTest {

    private ScopeContext scope;

    @BeforeEach
    void setUp() {
        scope = new ScopeContext();
    }

    @Test
    void testEmptyContextRejectsBreakAndContinue() {
        assertThrows(StructuralException.class, () -> scope.resolveBreak(null));
        assertThrows(StructuralException.class, () -> scope.resolveContinue(null));
        assertEquals(0, scope.depth());
    }

    @Test
    void testLoopFrameResolvesBothTargets() throws StructuralException {
        scope.pushLoop(Continuation.node(7), Continuation.node(9), null);

        assertEquals(9, scope.resolveBreak(null).resolve());
        assertEquals(7, scope.resolveContinue(null).resolve());
    }

    @Test
    void testInnermostFrameWins() throws StructuralException {
        scope.pushLoop(Continuation.node(1), Continuation.node(2), null);
        scope.pushLoop(Continuation.node(3), Continuation.node(4), null);

        assertEquals(4, scope.resolveBreak(null).resolve());
        assertEquals(3, scope.resolveContinue(null).resolve());

        scope.pop();
        assertEquals(2, scope.resolveBreak(null).resolve());
        assertEquals(1, scope.resolveContinue(null).resolve());
    }

    @Test
    void testContinueSkipsSwitchFrames() throws StructuralException {
        scope.pushLoop(Continuation.node(5), Continuation.node(6), null);
        scope.pushSwitch(Continuation.node(8), null);

        // break leaves the switch, continue goes back to the loop condition
        assertEquals(8, scope.resolveBreak(null).resolve());
        assertEquals(5, scope.resolveContinue(null).resolve());
        assertEquals(2, scope.depth());
    }

    @Test
    void testContinueInsideSwitchWithoutLoopFails() {
        scope.pushSwitch(Continuation.node(8), null);

        assertThrows(StructuralException.class, () -> scope.resolveContinue(null));
    }

    @Test
    void testLabeledJumpsSkipInnerFrames() throws StructuralException {
        scope.pushLoop(Continuation.node(1), Continuation.node(2), "outer");
        scope.pushLoop(Continuation.node(3), Continuation.node(4), null);
        scope.pushSwitch(Continuation.node(5), "inner");

        assertEquals(2, scope.resolveBreak("outer").resolve());
        assertEquals(1, scope.resolveContinue("outer").resolve());
        assertEquals(5, scope.resolveBreak("inner").resolve());
        assertEquals(5, scope.resolveBreak(null).resolve());
        assertEquals(3, scope.resolveContinue(null).resolve());
    }

    @Test
    void testUnknownOrNonLoopLabelsFail() {
        scope.pushLoop(Continuation.node(1), Continuation.node(2), "outer");
        scope.pushSwitch(Continuation.node(5), "choice");

        assertThrows(StructuralException.class, () -> scope.resolveBreak("missing"));
        assertThrows(StructuralException.class, () -> scope.resolveContinue("missing"));
        assertThrows(StructuralException.class, () -> scope.resolveContinue("choice"));
    }

    @Test
    void testTargetsAreResolvedLazily() throws StructuralException {
        int[] created = {0};
        scope.pushLoop(() -> {
            created[0]++;
            return 42;
        }, Continuation.node(1), null);

        Continuation target = scope.resolveContinue(null);
        assertEquals(0, created[0]);
        assertEquals(42, target.resolve());
        assertEquals(1, created[0]);
    }

    @Test
    void testPopOnEmptyContextFails() {
        assertThrows(IllegalStateException.class, () -> scope.pop());
    }
}
