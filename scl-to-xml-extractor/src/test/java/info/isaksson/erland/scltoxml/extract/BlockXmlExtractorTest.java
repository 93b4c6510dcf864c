package info.isaksson.erland.scltoxml.extract;

import info.isaksson.erland.scltoxml.ir.ArrayBound;
import info.isaksson.erland.scltoxml.ir.BlockKind;
import info.isaksson.erland.scltoxml.ir.CanonicalDocument;
import info.isaksson.erland.scltoxml.ir.ConversionException;
import info.isaksson.erland.scltoxml.ir.ConversionWarning;
import info.isaksson.erland.scltoxml.ir.FailureKind;
import info.isaksson.erland.scltoxml.ir.MemoryLayout;
import info.isaksson.erland.scltoxml.ir.Member;
import info.isaksson.erland.scltoxml.ir.SectionKind;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class BlockXmlExtractorTest {

    private static final String ST_NS = "http://www.siemens.com/automation/Openness/SW/NetworkSource/StructuredText/v3";

    @Test
    void extractsExportedFunctionBlock() throws Exception {
        BlockXmlExtractor.Result result = new BlockXmlExtractor().extract(fixture("/xml/FB_Conveyor.xml"));
        CanonicalDocument doc = result.document;

        assertTrue(result.warnings.isEmpty(), result.warnings.toString());
        assertEquals(BlockKind.FUNCTION_BLOCK, doc.metadata.blockType);
        assertEquals("FB_Conveyor", doc.metadata.blockName);
        assertEquals(12, doc.metadata.blockNumber);
        assertEquals("SCL", doc.metadata.programmingLanguage);
        assertEquals(MemoryLayout.OPTIMIZED, doc.metadata.memoryLayout);
        assertEquals(100, doc.metadata.memoryReserve);
        assertFalse(doc.metadata.enoSetting);
        assertEquals("V18", doc.metadata.engineeringVersion);
        assertEquals("Controls", doc.metadata.author);
        assertEquals("0.3", doc.metadata.version);
        assertNull(doc.metadata.family);
        assertEquals("Conveyor drive", doc.metadata.description);
    }

    @Test
    void readsInterfaceMembers() throws Exception {
        CanonicalDocument doc = new BlockXmlExtractor().extract(fixture("/xml/FB_Conveyor.xml")).document;

        List<Member> inputs = doc.section(SectionKind.INPUT);
        assertEquals(2, inputs.size());
        assertEquals("start request", inputs.get(0).comment);
        assertEquals("Real", inputs.get(1).datatype);
        assertEquals(List.of(new ArrayBound(0, 3)), inputs.get(1).arrayBounds);

        List<Member> statics = doc.section(SectionKind.STATIC);
        assertEquals(List.of("s_Delay", "s_Data", "s_Count"),
                statics.stream().map(m -> m.name).collect(Collectors.toList()));
        assertEquals(Map.of("ExternalAccessible", "false", "LibVersion", "1.0"), statics.get(0).attributes);

        Member data = statics.get(1);
        assertTrue(data.isStruct());
        assertEquals("1.5", data.members.get(0).defaultValue);
        Member limits = data.members.get(1);
        assertEquals(List.of(Member.of("low", "Int"), Member.of("high", "Int")), limits.members);

        assertTrue(statics.get(2).retain);
        assertEquals("3", doc.section(SectionKind.CONSTANT).get(0).defaultValue);
        assertTrue(doc.section(SectionKind.OUTPUT).isEmpty());
    }

    @Test
    void rebuildsCodeLinesFromStructuredText() throws Exception {
        CanonicalDocument doc = new BlockXmlExtractor().extract(fixture("/xml/FB_Conveyor.xml")).document;

        assertEquals(List.of(
                "REGION Start",
                "    #s_Delay(IN := #i_Start, PT := T#2s);",
                "    #s_Data.speed := #i_Speeds[#t_Index] * \"gc_Factor\";  // scale",
                "    IF #t_Index > #c_Max THEN",
                "        #t_Index := 0;",
                "    END_IF;",
                "END_REGION"), doc.code);
    }

    @Test
    void keepsBracketTokensOutOfIndexWhenPresent() throws Exception {
        String code = "<Access Scope=\"LocalVariable\" UId=\"21\"><Symbol UId=\"22\">"
                + "<Component Name=\"a\" AccessModifier=\"Array\" UId=\"23\">"
                + "<Token Text=\"[\" UId=\"24\"/>"
                + "<Access Scope=\"LiteralConstant\" UId=\"25\"><Constant UId=\"26\"><ConstantValue UId=\"27\">2</ConstantValue></Constant></Access>"
                + "<Token Text=\"]\" UId=\"28\"/>"
                + "</Component></Symbol></Access>"
                + "<Token Text=\";\" UId=\"29\"/>";
        CanonicalDocument doc = new BlockXmlExtractor().extract(block(code)).document;

        assertEquals(List.of("#a[2];"), doc.code);
    }

    @Test
    void readsGlobalAndInstructionCalls() throws Exception {
        String code = "<Access Scope=\"Call\" UId=\"21\">"
                + "<CallInfo Name=\"FC_Scale\" BlockType=\"FC\" UId=\"22\">"
                + "<Token Text=\"(\" UId=\"23\"/>"
                + "<Parameter Name=\"in\" UId=\"24\"><Blank UId=\"25\"/><Token Text=\":=\" UId=\"26\"/><Blank UId=\"27\"/>"
                + "<Access Scope=\"LiteralConstant\" UId=\"28\"><Constant UId=\"29\"><ConstantValue UId=\"30\">1</ConstantValue></Constant></Access>"
                + "</Parameter>"
                + "<Token Text=\")\" UId=\"31\"/>"
                + "</CallInfo></Access>"
                + "<Token Text=\";\" UId=\"32\"/>"
                + "<NewLine UId=\"33\"/>"
                + "<Access Scope=\"Call\" UId=\"34\">"
                + "<CallInfo Name=\"RESET_TIMER\" BlockType=\"Instruction\" UId=\"35\">"
                + "<Token Text=\"(\" UId=\"36\"/>"
                + "<Access Scope=\"LocalVariable\" UId=\"37\"><Symbol UId=\"38\"><Component Name=\"t\" UId=\"39\"/></Symbol></Access>"
                + "<Token Text=\")\" UId=\"40\"/>"
                + "</CallInfo></Access>"
                + "<Token Text=\";\" UId=\"41\"/>";
        CanonicalDocument doc = new BlockXmlExtractor().extract(block(code)).document;

        assertEquals(List.of("\"FC_Scale\"(in := 1);", "RESET_TIMER(#t);"), doc.code);
    }

    @Test
    void splitsNestedNewLineIntoSeparateLines() throws Exception {
        String code = "<Access Scope=\"Call\" UId=\"21\">"
                + "<CallInfo Name=\"FC_Scale\" BlockType=\"FC\" UId=\"22\">"
                + "<Token Text=\"(\" UId=\"23\"/>"
                + "<NewLine UId=\"24\"/><Blank Num=\"4\" UId=\"25\"/>"
                + "<Parameter Name=\"in\" UId=\"26\"><Blank UId=\"27\"/><Token Text=\":=\" UId=\"28\"/><Blank UId=\"29\"/>"
                + "<Access Scope=\"LiteralConstant\" UId=\"30\"><Constant UId=\"31\"><ConstantValue UId=\"32\">1</ConstantValue></Constant></Access>"
                + "</Parameter>"
                + "<Token Text=\")\" UId=\"33\"/>"
                + "</CallInfo></Access>"
                + "<Token Text=\";\" UId=\"34\"/>";
        CanonicalDocument doc = new BlockXmlExtractor().extract(block(code)).document;

        assertEquals(List.of("\"FC_Scale\"(", "    in := 1);"), doc.code);
    }

    @Test
    void degradedNodesProduceWarningsInsteadOfTokens() throws Exception {
        String code = "<Access UId=\"21\"><Symbol UId=\"22\"><Component Name=\"x\" UId=\"23\"/></Symbol></Access>"
                + "<Blank UId=\"24\"/>"
                + "<Token Text=\":=\" UId=\"25\"/>"
                + "<Blank UId=\"26\"/>"
                + "<Access Scope=\"LiteralConstant\" UId=\"27\"><Constant UId=\"28\"/></Access>"
                + "<Access Scope=\"Address\" UId=\"29\"/>"
                + "<Gadget UId=\"30\"/>"
                + "<Token Text=\";\" UId=\"31\"/>";
        BlockXmlExtractor.Result result = new BlockXmlExtractor().extract(block(code));

        assertEquals(List.of(" := ;"), result.document.code);
        assertEquals(List.of("ACCESS_WITHOUT_SCOPE", "CONSTANT_WITHOUT_VALUE", "UNKNOWN_ELEMENT", "UNKNOWN_SCOPE"),
                codes(result.warnings));
        assertEquals(FailureKind.INCOMPLETE_CONSTRUCT, result.warnings.get(0).kind);
        assertEquals(FailureKind.UNSUPPORTED_CONSTRUCT, result.warnings.get(3).kind);
    }

    @Test
    void unknownSectionAndIncompleteMemberAreSkipped() throws Exception {
        String xml = "<Document><SW.Blocks.FC ID=\"0\"><AttributeList>"
                + "<Interface><Sections xmlns=\"http://www.siemens.com/automation/Openness/SW/Interface/v5\">"
                + "<Section Name=\"Input\"><Member Name=\"a\" Datatype=\"Int\"/><Member Datatype=\"Int\"/></Section>"
                + "<Section Name=\"Mystery\"><Member Name=\"b\" Datatype=\"Int\"/></Section>"
                + "<Section Name=\"Return\"><Member Name=\"Ret_Val\" Datatype=\"Real\"/></Section>"
                + "</Sections></Interface>"
                + "<MemoryReserve>lots</MemoryReserve>"
                + "<Name>FC_Calc</Name>"
                + "</AttributeList></SW.Blocks.FC></Document>";
        BlockXmlExtractor.Result result = new BlockXmlExtractor().extract(xml);

        assertEquals(List.of(Member.of("a", "Int")), result.document.section(SectionKind.INPUT));
        assertEquals("Real", result.document.metadata.returnType);
        assertNull(result.document.metadata.memoryReserve);
        assertTrue(result.document.code.isEmpty());
        assertEquals(List.of("MEMBER_INCOMPLETE", "NOT_A_NUMBER", "UNKNOWN_SECTION"), codes(result.warnings));
    }

    @Test
    void compileUnitWithoutStructuredTextIsReported() throws Exception {
        String xml = "<Document><SW.Blocks.OB ID=\"0\"><AttributeList>"
                + "<Interface><Sections/></Interface><Name>Main</Name><Number>1</Number>"
                + "</AttributeList><ObjectList>"
                + "<SW.Blocks.CompileUnit ID=\"3\" CompositionName=\"CompileUnits\"><AttributeList>"
                + "<NetworkSource><FlgNet/></NetworkSource><ProgrammingLanguage>LAD</ProgrammingLanguage>"
                + "</AttributeList></SW.Blocks.CompileUnit>"
                + "</ObjectList></SW.Blocks.OB></Document>";
        BlockXmlExtractor.Result result = new BlockXmlExtractor().extract(xml);

        assertEquals(BlockKind.ORGANIZATION_BLOCK, result.document.metadata.blockType);
        assertTrue(result.document.code.isEmpty());
        assertEquals(List.of("UNSUPPORTED_NETWORK_SOURCE"), codes(result.warnings));
    }

    @Test
    void missingStructureIsMalformed() {
        assertMalformed("<Document><Engineering version=\"V17\"/></Document>");
        assertMalformed("<Document><SW.Blocks.FB ID=\"0\"/></Document>");
        assertMalformed("<Document><SW.Blocks.FB ID=\"0\"><AttributeList><Name>X</Name></AttributeList></SW.Blocks.FB></Document>");
        assertMalformed("<Document><SW.Blocks.FB ID=\"0\"><AttributeList><Interface><Sections/></Interface>"
                + "</AttributeList></SW.Blocks.FB></Document>");
        assertMalformed("<Document><SW.Blocks.FB");
    }

    @Test
    void doctypeIsRejected() {
        assertMalformed("<?xml version=\"1.0\"?><!DOCTYPE Document [<!ENTITY x SYSTEM \"file:///etc/passwd\">]>"
                + "<Document>&x;</Document>");
    }

    private static void assertMalformed(String xml) {
        ConversionException e = assertThrows(ConversionException.class, () -> new BlockXmlExtractor().extract(xml));
        assertEquals(FailureKind.MALFORMED_INPUT, e.getKind());
    }

    private static List<String> codes(List<ConversionWarning> warnings) {
        return warnings.stream().map(w -> w.code).collect(Collectors.toList());
    }

    /** Minimal FB whose single compile unit holds the given structured-text children. */
    static String block(String structuredText) {
        return "<Document><Engineering version=\"V17\"/><SW.Blocks.FB ID=\"0\"><AttributeList>"
                + "<Interface><Sections xmlns=\"http://www.siemens.com/automation/Openness/SW/Interface/v5\"/></Interface>"
                + "<Name>FB_Test</Name>"
                + "</AttributeList><ObjectList>"
                + "<SW.Blocks.CompileUnit ID=\"3\" CompositionName=\"CompileUnits\"><AttributeList>"
                + "<NetworkSource><StructuredText xmlns=\"" + ST_NS + "\">" + structuredText + "</StructuredText></NetworkSource>"
                + "</AttributeList></SW.Blocks.CompileUnit>"
                + "</ObjectList></SW.Blocks.FB></Document>";
    }

    static String fixture(String resource) throws IOException {
        try (InputStream in = BlockXmlExtractorTest.class.getResourceAsStream(resource)) {
            assertNotNull(in, "missing fixture " + resource);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
