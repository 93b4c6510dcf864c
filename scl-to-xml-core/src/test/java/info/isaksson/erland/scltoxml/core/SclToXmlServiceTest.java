package info.isaksson.erland.scltoxml.core;

import info.isaksson.erland.scltoxml.ir.BlockMetadata;
import info.isaksson.erland.scltoxml.ir.CanonicalDocument;
import info.isaksson.erland.scltoxml.ir.ConversionException;
import info.isaksson.erland.scltoxml.ir.FailureKind;
import info.isaksson.erland.scltoxml.ir.Member;
import info.isaksson.erland.scltoxml.ir.SectionKind;
import info.isaksson.erland.scltoxml.ir.TypeDocument;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SclToXmlServiceTest {

    private static final String MINIMAL_FB = String.join("\n",
            "FUNCTION_BLOCK \"M\"",
            "VAR_INPUT",
            "  x : Int;",
            "END_VAR",
            "BEGIN",
            "  #x := 1;",
            "END_FUNCTION_BLOCK");

    private static final String UDT = String.join("\n",
            "TYPE \"UDT_Motor\"",
            "VERSION : 0.2",
            "   // Author: Controls",
            "   // Motor data",
            "   STRUCT",
            "      speed : Real := 0.0;   // rpm",
            "      faults : Array[1..8] of Bool;",
            "      cfg : Struct",
            "         ramp : Time := T#2s;",
            "      END_STRUCT;",
            "   END_STRUCT;",
            "",
            "END_TYPE",
            "");

    private final SclToXmlService service = new SclToXmlService();

    @Test
    void fixtureSurvivesXmlRoundTrip() throws Exception {
        CanonicalDocument original = service.textToCanonical(fixture("/scl/FB_Conveyor.scl")).document;
        String xml = service.canonicalToXml(original).content;
        CanonicalDocument back = service.xmlToCanonical(xml).document;

        // The generator writes the default memory reserve explicitly.
        BlockMetadata.Builder expected = original.metadata.toBuilder();
        expected.memoryReserve = 100;
        assertEquals(expected.build(), back.metadata);
        assertEquals(original.sections, back.sections);
        assertEquals(original.code, back.code);

        assertEquals(xml, service.canonicalToXml(back).content);
    }

    @Test
    void nestedStructsKeepTheirShape() throws Exception {
        CanonicalDocument doc = service.xmlToCanonical(service.textToXml(fixture("/scl/FB_Conveyor.scl")).content).document;

        Member data = doc.section(SectionKind.STATIC).get(1);
        assertEquals("s_Data", data.name);
        assertEquals(Member.STRUCT, data.datatype);
        Member limits = data.members.get(1);
        assertEquals("limits", limits.name);
        assertEquals(List.of("low", "high"), List.of(limits.members.get(0).name, limits.members.get(1).name));
        assertEquals("100", limits.members.get(1).defaultValue);
    }

    @Test
    void reflowedCallIsStillACallWhenGeneratedAgain() throws Exception {
        ConverterOptions narrow = new ConverterOptions();
        narrow.reflowWidth = 40;
        SclToXmlService reflowing = new SclToXmlService(narrow);
        String text = String.join("\n",
                "FUNCTION_BLOCK \"R\"",
                "VAR",
                "  t : TON_TIME;",
                "  done : Bool;",
                "END_VAR",
                "VAR_TEMP",
                "  el : Time;",
                "END_VAR",
                "BEGIN",
                "  #t(IN := TRUE, PT := T#2s, Q => #done, ET => #el);",
                "END_FUNCTION_BLOCK");

        CanonicalDocument read = reflowing.xmlToCanonical(reflowing.textToXml(text).content).document;
        assertEquals(List.of(
                "  #t(",
                "      IN := TRUE,",
                "      PT := T#2s,",
                "      Q => #done,",
                "      ET => #el);"), read.code);

        String regenerated = reflowing.canonicalToXml(read).content;
        assertEquals(1, occurrences(regenerated, "Scope=\"Call\""), regenerated);
        assertTrue(regenerated.contains("<Parameter Name=\"ET\""), regenerated);
        assertEquals(4, occurrences(regenerated, "<Parameter "), regenerated);

        assertEquals(read.code, reflowing.xmlToCanonical(regenerated).document.code);
    }

    @Test
    void minimalFunctionBlockRoundTripsThroughXml() throws Exception {
        ConversionResult<CanonicalDocument> generated = service.textToXml(MINIMAL_FB);

        assertTrue(generated.warnings.isEmpty(), generated.warnings.toString());
        assertTrue(generated.content.contains("<Section Name=\"Input\">"), generated.content);
        assertTrue(generated.content.contains("<Member Datatype=\"Int\" Name=\"x\"/>")
                || generated.content.contains("<Member Name=\"x\" Datatype=\"Int\"/>"), generated.content);
        assertTrue(generated.content.contains("Scope=\"LocalVariable\""), generated.content);

        ConversionResult<CanonicalDocument> text = service.xmlToText(generated.content);
        assertEquals(List.of("  #x := 1;"), text.document.code);
        assertTrue(text.content.contains("BEGIN\n  #x := 1;\nEND_FUNCTION_BLOCK\n"), text.content);
        assertEquals(List.of(Member.of("x", "Int")), text.document.section(SectionKind.INPUT));
    }

    @Test
    void globalConstantsFollowConfiguredRules() throws Exception {
        String text = String.join("\n",
                "FUNCTION \"F\" : Void",
                "VAR_TEMP",
                "  a : Int;",
                "END_VAR",
                "BEGIN",
                "  #a := \"gc_Max\" + \"MAX_AXES\";",
                "END_FUNCTION");

        String byPattern = service.textToXml(text).content;
        assertTrue(byPattern.contains("<Constant Name=\"gc_Max\""), byPattern);
        assertFalse(byPattern.contains("<Constant Name=\"MAX_AXES\""), byPattern);

        ConverterOptions options = new ConverterOptions();
        options.globalConstantPattern = "";
        options.globalConstants = List.of("max_axes");
        String byList = new SclToXmlService(options).textToXml(text).content;
        assertTrue(byList.contains("<Constant Name=\"MAX_AXES\""), byList);
        assertFalse(byList.contains("<Constant Name=\"gc_Max\""), byList);

        assertEquals(List.of("  #a := \"gc_Max\" + \"MAX_AXES\";"), service.xmlToText(byList).document.code);
    }

    @Test
    void uidStartIsConfigurable() throws Exception {
        ConverterOptions options = new ConverterOptions();
        options.uidStart = 500;
        String xml = new SclToXmlService(options).textToXml(MINIMAL_FB).content;

        assertTrue(xml.contains("UId=\"500\""), xml);
        assertFalse(xml.contains("UId=\"21\""), xml);
    }

    @Test
    void typeRoundTripsThroughXmlAndText() throws Exception {
        TypeDocument doc = service.udtTextToType(UDT).document;
        String xml = service.typeToXml(doc).content;
        TypeDocument back = service.xmlToType(xml).document;

        assertEquals(doc, back);
        assertEquals(doc, service.udtTextToType(service.typeToUdtText(back).content).document);
    }

    @Test
    void canonicalJsonIsTheStringContent() throws Exception {
        ConversionResult<CanonicalDocument> result = service.textToCanonical(MINIMAL_FB);

        assertTrue(result.content.startsWith("{"), result.content);
        assertTrue(result.content.endsWith("\n"));
        assertNull(result.outputPath);
        assertFalse(result.hasWarnings());
    }

    @Test
    void pathFormsWriteTheirOutput(@TempDir Path dir) throws Exception {
        Path scl = dir.resolve("M.scl");
        Files.writeString(scl, "\uFEFF" + MINIMAL_FB, StandardCharsets.UTF_8);

        Path json = dir.resolve("out/json/M.json");
        ConversionResult<CanonicalDocument> canonical = service.textToCanonical(scl, json);
        assertEquals(json, canonical.outputPath);
        assertEquals(canonical.content, Files.readString(json, StandardCharsets.UTF_8));

        Path xml = dir.resolve("out/M.xml");
        service.canonicalToXml(json, xml);
        assertTrue(Files.readString(xml, StandardCharsets.UTF_8).contains("<Name>M</Name>"));

        Path back = dir.resolve("out/M.scl");
        service.xmlToText(xml, back);
        assertEquals(canonical.document.code, service.textToCanonical(back, null).document.code);

        ConversionResult<CanonicalDocument> noOutput = service.xmlToCanonical(xml, null);
        assertNull(noOutput.outputPath);
    }

    @Test
    void typePathFormsChainThroughJson(@TempDir Path dir) throws Exception {
        Path udt = dir.resolve("UDT_Motor.udt");
        Files.writeString(udt, UDT, StandardCharsets.UTF_8);
        Path json = dir.resolve("UDT_Motor.json");
        Path xml = dir.resolve("UDT_Motor.xml");
        Path text = dir.resolve("UDT_Motor.back.udt");

        service.udtTextToType(udt, json);
        service.typeToXml(json, xml);
        service.xmlToType(xml, json);
        service.typeToUdtText(json, text);

        assertEquals(service.udtTextToType(UDT).document, service.udtTextToType(text, null).document);
    }

    @Test
    void failuresCarryTheirKind(@TempDir Path dir) throws Exception {
        assertKind(FailureKind.MALFORMED_INPUT, () -> service.textToCanonical("no block here"));
        assertKind(FailureKind.MALFORMED_INPUT, () -> service.xmlToCanonical("<Document"));
        assertKind(FailureKind.MALFORMED_INPUT, () -> service.xmlToType("<Document/>"));
        assertKind(FailureKind.IO_FAILURE, () -> service.textToXml(dir.resolve("missing.scl"), null));

        Path broken = dir.resolve("broken.json");
        Files.writeString(broken, "{ \"metadata\": ", StandardCharsets.UTF_8);
        assertKind(FailureKind.MALFORMED_INPUT, () -> service.canonicalToXml(broken, null));
        assertKind(FailureKind.MALFORMED_INPUT, () -> service.typeToXml(broken, null));

        assertThrows(IllegalArgumentException.class, () -> service.canonicalToXml((CanonicalDocument) null));
    }

    private static void assertKind(FailureKind kind, ThrowingCall call) {
        ConversionException e = assertThrows(ConversionException.class, call::run);
        assertEquals(kind, e.getKind(), e.getMessage());
    }

    @FunctionalInterface
    private interface ThrowingCall {
        void run() throws Exception;
    }

    private static int occurrences(String haystack, String needle) {
        int n = 0;
        for (int at = haystack.indexOf(needle); at >= 0; at = haystack.indexOf(needle, at + needle.length())) n++;
        return n;
    }

    static String fixture(String resource) throws IOException {
        try (InputStream in = SclToXmlServiceTest.class.getResourceAsStream(resource)) {
            assertNotNull(in, "missing fixture " + resource);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
