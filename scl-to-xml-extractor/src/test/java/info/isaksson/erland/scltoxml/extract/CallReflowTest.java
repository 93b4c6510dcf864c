package info.isaksson.erland.scltoxml.extract;

import info.isaksson.erland.scltoxml.ir.code.AccessScope;
import info.isaksson.erland.scltoxml.ir.code.CallParameter;
import info.isaksson.erland.scltoxml.ir.code.CodeToken;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CallReflowTest {

    private static final ExtractorOptions NARROW = new ExtractorOptions(true, 20);

    @Test
    void splitsLongCallOneParameterPerLine() {
        List<String> out = new CallReflow(NARROW).apply(timerLine(3));

        assertEquals(List.of(
                "    #timer(",
                "        IN := #start,",
                "        PT := T#2s,",
                "        Q => #done);"), out);
    }

    @Test
    void leavesCallsWithTwoParametersAlone() {
        assertEquals(List.of("    #timer(IN := #start, PT := T#2s);"), new CallReflow(NARROW).apply(timerLine(2)));
    }

    @Test
    void leavesShortLinesAlone() {
        CallReflow wide = new CallReflow(ExtractorOptions.defaults());
        assertEquals(List.of("    #timer(IN := #start, PT := T#2s, Q => #done);"), wide.apply(timerLine(3)));
    }

    @Test
    void disabledReflowKeepsTheRenderedLine() {
        CallReflow off = new CallReflow(NARROW.withReflow(false));
        assertEquals(1, off.apply(timerLine(3)).size());
    }

    @Test
    void instructionCallKeepsItsName() {
        List<CodeToken> line = List.of(
                CodeToken.instructionCall("MOVE_BLK", List.of(
                        named(List.of(), "IN", CodeToken.access(AccessScope.LOCAL_VARIABLE, "a")),
                        named(List.of(CodeToken.whitespace(1)), "COUNT", CodeToken.literal("10")),
                        named(List.of(CodeToken.whitespace(1)), "OUT", CodeToken.access(AccessScope.LOCAL_VARIABLE, "b")))),
                CodeToken.operator(";"));

        assertEquals(List.of("MOVE_BLK(", "    IN := #a,", "    COUNT := 10,", "    OUT := #b);"),
                new CallReflow(NARROW).apply(line));
    }

    private static List<CodeToken> timerLine(int parameterCount) {
        List<CallParameter> params = new ArrayList<>();
        params.add(named(List.of(), "IN", CodeToken.access(AccessScope.LOCAL_VARIABLE, "start")));
        params.add(named(List.of(CodeToken.whitespace(1)), "PT", CodeToken.typedLiteral("T#2s")));
        if (parameterCount > 2) {
            params.add(new CallParameter(List.of(CodeToken.whitespace(1)), "Q", List.of(
                    CodeToken.whitespace(1), CodeToken.operator("=>"), CodeToken.whitespace(1),
                    CodeToken.access(AccessScope.LOCAL_VARIABLE, "done"))));
        }
        return List.of(
                CodeToken.whitespace(4),
                CodeToken.call(CodeToken.access(AccessScope.LOCAL_VARIABLE, "timer"), params),
                CodeToken.operator(";"));
    }

    private static CallParameter named(List<CodeToken> leading, String name, CodeToken value) {
        return new CallParameter(leading, name, List.of(
                CodeToken.whitespace(1), CodeToken.operator(":="), CodeToken.whitespace(1), value));
    }
}
