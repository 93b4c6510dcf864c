package info.isaksson.erland.scltoxml.core;

import info.isaksson.erland.scltoxml.scl.ScopeRules;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ConverterConfigTest {

    @Test
    void missingFileGivesDefaults(@TempDir Path dir) {
        ConverterOptions options = ConverterConfig.load(dir.resolve("scl-to-xml.yml"));

        assertEquals(21, options.uidStart);
        assertEquals("V17", options.engineeringVersion);
        assertTrue(options.reflowLongCalls);
        assertEquals(120, options.reflowWidth);
        assertTrue(options.globalConstants.isEmpty());
    }

    @Test
    void readsAllKeys(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("scl-to-xml.yml");
        Files.writeString(file, String.join("\n",
                "uidStart: 40",
                "engineeringVersion: V18",
                "reflowLongCalls: false",
                "reflowWidth: 80",
                "globalConstantPattern: \"K_\\\\w+\"",
                "globalConstants:",
                "  - MAX_AXES",
                "unknownKey: ignored",
                ""), StandardCharsets.UTF_8);

        ConverterOptions options = ConverterConfig.load(file);

        assertEquals(40, options.uidStart);
        assertEquals("V18", options.engineeringVersion);
        assertFalse(options.reflowLongCalls);
        assertEquals(80, options.reflowWidth);
        assertEquals("K_\\w+", options.globalConstantPattern);
        assertEquals(List.of("MAX_AXES"), options.globalConstants);
    }

    @Test
    void partialFileKeepsOtherDefaults(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("partial.yml");
        Files.writeString(file, "uidStart: 1000\nreflowWidth: -5\n", StandardCharsets.UTF_8);

        ConverterOptions options = ConverterConfig.load(file);

        assertEquals(1000, options.uidStart);
        assertEquals(120, options.reflowWidth);
        assertEquals("V17", options.engineeringVersion);
    }

    @Test
    void unreadableFileFallsBackToDefaults(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("broken.yml");
        Files.writeString(file, "uidStart: [not, a, number\n", StandardCharsets.UTF_8);

        assertEquals(21, ConverterConfig.load(file).uidStart);
    }

    @Test
    void invalidConstantPatternKeepsTheDefault(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("scl-to-xml.yml");
        Files.writeString(file, "uidStart: 30\nglobalConstantPattern: \"gc_(\"\n", StandardCharsets.UTF_8);

        ConverterOptions options = ConverterConfig.load(file);

        assertEquals(30, options.uidStart);
        assertEquals(ScopeRules.DEFAULT_GLOBAL_CONSTANT_PATTERN, options.globalConstantPattern);
        String xml = new SclToXmlService(options).textToXml(String.join("\n",
                "FUNCTION_BLOCK \"M\"",
                "VAR_TEMP",
                "  x : Int;",
                "END_VAR",
                "BEGIN",
                "  #x := \"gc_Max\";",
                "END_FUNCTION_BLOCK")).content;
        assertTrue(xml.contains("Scope=\"GlobalConstant\""), xml);
    }
}
