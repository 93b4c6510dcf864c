package info.isaksson.erland.scltoxml.scl;

import info.isaksson.erland.scltoxml.ir.code.AccessScope;
import info.isaksson.erland.scltoxml.ir.code.CallKind;
import info.isaksson.erland.scltoxml.ir.code.CodeToken;
import info.isaksson.erland.scltoxml.ir.code.CodeTokenKind;
import info.isaksson.erland.scltoxml.ir.code.CodeTokenRenderer;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CodeLineParserTest {

    private final CodeLineParser parser = new CodeLineParser(ScopeRules.defaults().withLocalConstants(List.of("c_Max")));

    @Test
    void groupsDottedLocalPath() {
        List<CodeToken> line = parser.parseLine("#tag.field := 1;");
        CodeToken access = line.get(0);
        assertEquals(CodeTokenKind.ACCESS, access.kind);
        assertEquals(AccessScope.LOCAL_VARIABLE, access.scope);
        assertEquals(List.of("tag", "field"), access.path.stream().map(c -> c.name).toList());
        assertEquals(CodeTokenKind.LITERAL_CONSTANT, line.get(4).kind);
    }

    @Test
    void parsesNestedArrayIndex() {
        List<CodeToken> line = parser.parseLine("#tag[#index].field");
        assertEquals(1, line.size());
        CodeToken access = line.get(0);
        assertTrue(access.path.get(0).isIndexed());
        CodeToken index = access.path.get(0).index.get(0);
        assertEquals(AccessScope.LOCAL_VARIABLE, index.scope);
        assertEquals("index", index.path.get(0).name);
        assertEquals("#tag[#index].field", CodeTokenRenderer.render(line));
    }

    @Test
    void classifiesConstants() {
        List<CodeToken> line = parser.parseLine("#x := \"gc_Max\" + #c_Max + \"DB\".y;");
        assertEquals(AccessScope.GLOBAL_CONSTANT, line.get(4).scope);
        assertEquals(AccessScope.LOCAL_CONSTANT, line.get(8).scope);
        assertEquals(AccessScope.GLOBAL_VARIABLE, line.get(12).scope);
        assertEquals("#x := \"gc_Max\" + #c_Max + \"DB\".y;", CodeTokenRenderer.render(line));
    }

    @Test
    void parsesInstanceCallWithNamedParameters() {
        String text = "#timer(IN := #start, PT := T#2s);";
        List<CodeToken> line = parser.parseLine(text);
        CodeToken call = line.get(0);
        assertEquals(CodeTokenKind.CALL, call.kind);
        assertEquals(CallKind.INSTANCE, call.callKind);
        assertEquals("timer", call.calleeName());
        assertEquals(2, call.parameters.size());
        assertEquals("IN", call.parameters.get(0).name);
        assertEquals("PT", call.parameters.get(1).name);
        assertEquals(CodeTokenKind.TYPED_CONSTANT, call.parameters.get(1).value.get(3).kind);
        assertEquals(text, CodeTokenRenderer.render(line));
    }

    @Test
    void parsesNestedInstructionAndGlobalCalls() {
        String text = "#y := \"FC_Scale\"(in := ABS(#x), factor := 2) + MAX(IN1 := 1, IN2 := #z);";
        List<CodeToken> line = parser.parseLine(text);
        CodeToken fc = line.get(4);
        assertEquals(CallKind.GLOBAL, fc.callKind);
        CodeToken abs = fc.parameters.get(0).value.get(3);
        assertEquals(CallKind.INSTRUCTION, abs.callKind);
        assertNull(abs.parameters.get(0).name);
        assertEquals(text, CodeTokenRenderer.render(line));
    }

    @Test
    void leavesUnbalancedCallsFlat() {
        String text = "#inst(IN := #a,";
        List<CodeToken> line = parser.parseLine(text);
        assertEquals(CodeTokenKind.ACCESS, line.get(0).kind);
        assertEquals(CodeTokenKind.OPERATOR, line.get(1).kind);
        assertEquals(text, CodeTokenRenderer.render(line));
    }

    @Test
    void joinsCallWrittenOverSeveralLines() {
        List<String> lines = List.of(
                "  #t(",
                "      IN := #start,",
                "      PT := T#2s);",
                "  #x := 1;");
        List<List<CodeToken>> parsed = parser.parseLines(lines);

        assertEquals(2, parsed.size());
        CodeToken call = parsed.get(0).get(1);
        assertEquals(CodeTokenKind.CALL, call.kind);
        assertEquals(CallKind.INSTANCE, call.callKind);
        assertEquals(List.of("IN", "PT"), call.parameters.stream().map(p -> p.name).toList());
        assertTrue(call.parameters.get(0).leading.get(0).isLineBreak());
        assertEquals(String.join(CodeToken.LINE_BREAK, lines.subList(0, 3)), CodeTokenRenderer.render(parsed.get(0)));
        assertEquals("  #x := 1;", CodeTokenRenderer.render(parsed.get(1)));
    }

    @Test
    void unclosedCallAtTheEndKeepsItsText() {
        List<String> lines = List.of("#inst(IN := #a,", "  PT := #b;");
        List<List<CodeToken>> parsed = parser.parseLines(lines);

        assertEquals(1, parsed.size());
        assertEquals(String.join(CodeToken.LINE_BREAK, lines), CodeTokenRenderer.render(parsed.get(0)));
    }

    @Test
    void keepsCommentsAndIndentation() {
        String text = "        END_IF;  // done (* x *)";
        assertEquals(text, CodeTokenRenderer.render(parser.parseLine(text)));
        assertEquals(CodeTokenKind.LINE_COMMENT, parser.parseLine(text).get(4).kind);
    }
}
