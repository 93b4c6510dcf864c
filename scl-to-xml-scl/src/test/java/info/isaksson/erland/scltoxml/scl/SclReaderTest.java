package info.isaksson.erland.scltoxml.scl;

import info.isaksson.erland.scltoxml.ir.BlockKind;
import info.isaksson.erland.scltoxml.ir.CanonicalDocument;
import info.isaksson.erland.scltoxml.ir.ConversionException;
import info.isaksson.erland.scltoxml.ir.FailureKind;
import info.isaksson.erland.scltoxml.ir.MemoryLayout;
import info.isaksson.erland.scltoxml.ir.Member;
import info.isaksson.erland.scltoxml.ir.SectionKind;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SclReaderTest {

    @Test
    void readsMinimalFunctionBlock() throws Exception {
        String text = "FUNCTION_BLOCK \"M\"\nVAR_INPUT\n  x : Int;\nEND_VAR\nBEGIN\n  #x := 1;\nEND_FUNCTION_BLOCK";
        CanonicalDocument doc = new SclReader().read(text).document;

        assertEquals(BlockKind.FUNCTION_BLOCK, doc.metadata.blockType);
        assertEquals("M", doc.metadata.blockName);
        assertEquals(List.of(Member.of("x", "Int")), doc.section(SectionKind.INPUT));
        assertEquals(List.of("  #x := 1;"), doc.code);
        assertEquals(6, doc.sections.size());
        assertEquals("V17", doc.metadata.engineeringVersion);
    }

    @Test
    void readsFixtureWithStructsAttributesAndRetain() throws Exception {
        SclReader.Result result = new SclReader().read(fixture("/scl/FB_Conveyor.scl"));
        CanonicalDocument doc = result.document;

        assertTrue(result.warnings.isEmpty(), result.warnings.toString());
        assertEquals("FB_Conveyor", doc.metadata.blockName);
        assertEquals("0.3", doc.metadata.version);
        assertEquals("Controls", doc.metadata.author);
        assertEquals("Belt conveyor", doc.metadata.title);
        assertEquals("Conveyor drive with start delay", doc.metadata.description);
        assertEquals(MemoryLayout.OPTIMIZED, doc.metadata.memoryLayout);

        List<Member> inputs = doc.section(SectionKind.INPUT);
        assertEquals("start request", inputs.get(0).comment);
        assertEquals("Real", inputs.get(1).datatype);
        assertEquals(3, inputs.get(1).arrayBounds.get(0).upper);

        List<Member> statics = doc.section(SectionKind.STATIC);
        assertEquals(List.of("s_StartDelay", "s_Data", "s_Count"), statics.stream().map(m -> m.name).toList());
        assertEquals("TON_TIME", statics.get(0).attributes.get("InstructionName"));
        assertEquals("1.0", statics.get(0).attributes.get("LibVersion"));

        Member data = statics.get(1);
        assertTrue(data.isStruct());
        assertEquals("drive data", data.comment);
        assertEquals("1.5", data.members.get(0).defaultValue);
        Member limits = data.members.get(1);
        assertEquals(List.of("low", "high"), limits.members.stream().map(m -> m.name).toList());
        assertFalse(data.retain);
        assertTrue(statics.get(2).retain);

        assertEquals("3", doc.section(SectionKind.CONSTANT).get(0).defaultValue);
        assertEquals(8, doc.code.size());
        assertEquals("    REGION Start", doc.code.get(0));
        assertEquals("    END_FOR;", doc.code.get(7));
    }

    @Test
    void distinguishesFunctionFromFunctionBlock() throws Exception {
        CanonicalDocument fc = new SclReader().read(
                "FUNCTION \"FC_Add\" : Int\nVAR_INPUT\n a : Int;\n b : Int;\nEND_VAR\nBEGIN\n#FC_Add := #a + #b;\nEND_FUNCTION\n").document;
        assertEquals(BlockKind.FUNCTION, fc.metadata.blockType);
        assertEquals("Int", fc.metadata.returnType);
        assertEquals(List.of(Member.of("Ret_Val", "Int")), fc.section(SectionKind.RETURN));

        CanonicalDocument voidFc = new SclReader().read("FUNCTION \"FC_Log\"\nBEGIN\nEND_FUNCTION\n").document;
        assertEquals("Void", voidFc.metadata.returnType);
        assertTrue(voidFc.sections.containsKey(SectionKind.RETURN));
        assertTrue(voidFc.section(SectionKind.RETURN).isEmpty());
    }

    @Test
    void readsOrganizationBlockNumber() throws Exception {
        CanonicalDocument ob = new SclReader().read("ORGANIZATION_BLOCK \"Cyclic_OB30\"\nBEGIN\n;\nEND_ORGANIZATION_BLOCK").document;
        assertEquals(BlockKind.ORGANIZATION_BLOCK, ob.metadata.blockType);
        assertEquals(30, ob.metadata.blockNumber);
        assertEquals(3, ob.sections.size());
    }

    @Test
    void readsDataBlocksAndStartValues() throws Exception {
        String text = String.join("\n",
                "DATA_BLOCK \"DB_Line\"",
                "{ S7_Optimized_Access := 'FALSE' }",
                "VERSION : 0.1",
                "NON_RETAIN",
                "   STRUCT ",
                "      enabled : Bool;",
                "      cfg : Struct",
                "         speed : Real;",
                "      END_STRUCT;",
                "   END_STRUCT;",
                "BEGIN",
                "   enabled := TRUE;",
                "   cfg.speed := 2.5;",
                "END_DATA_BLOCK");
        CanonicalDocument db = new SclReader().read(text).document;

        assertEquals(BlockKind.GLOBAL_DB, db.metadata.blockType);
        assertEquals("DB", db.metadata.programmingLanguage);
        assertEquals(MemoryLayout.STANDARD, db.metadata.memoryLayout);
        assertTrue(db.code.isEmpty());
        List<Member> statics = db.section(SectionKind.STATIC);
        assertEquals("TRUE", statics.get(0).defaultValue);
        assertEquals("2.5", statics.get(1).members.get(0).defaultValue);
    }

    @Test
    void readsInstanceDataBlock() throws Exception {
        CanonicalDocument idb = new SclReader().read(
                "DATA_BLOCK \"iDB_Conveyor\"\n{ S7_Optimized_Access := 'TRUE' }\n\"FB_Conveyor\"\n\nBEGIN\n\nEND_DATA_BLOCK\n").document;
        assertEquals(BlockKind.INSTANCE_DB, idb.metadata.blockType);
        assertEquals("FB_Conveyor", idb.metadata.instanceOfName);
    }

    @Test
    void missingBlockKeywordIsMalformed() {
        ConversionException ex = assertThrows(ConversionException.class,
                () -> new SclReader().read("VAR_INPUT\n x : Int;\nEND_VAR\n"));
        assertEquals(FailureKind.MALFORMED_INPUT, ex.getKind());
    }

    @Test
    void recoversFromIncompleteConstructs() throws Exception {
        String text = "FUNCTION_BLOCK \"B\"\nVAR\n  broken line\n  ok : Int;\n  s : Struct\n    a : Bool;\nEND_VAR\nBEGIN\n#ok := 1;\n";
        SclReader.Result result = new SclReader().read(text);

        assertEquals(List.of("MISSING_END_KEYWORD", "UNPARSED_DECLARATION", "UNTERMINATED_STRUCT"),
                result.warnings.stream().map(w -> w.code).toList());
        assertEquals(FailureKind.INCOMPLETE_CONSTRUCT, result.warnings.get(0).kind);
        assertEquals(2, result.document.section(SectionKind.STATIC).size());
        assertEquals(List.of("#ok := 1;"), result.document.code);
    }

    static String fixture(String resource) throws IOException {
        try (InputStream in = SclReaderTest.class.getResourceAsStream(resource)) {
            assertNotNull(in, "fixture must exist in test resources: " + resource);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
