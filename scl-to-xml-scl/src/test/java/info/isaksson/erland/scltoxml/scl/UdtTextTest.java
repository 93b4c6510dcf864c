package info.isaksson.erland.scltoxml.scl;

import info.isaksson.erland.scltoxml.ir.ConversionException;
import info.isaksson.erland.scltoxml.ir.FailureKind;
import info.isaksson.erland.scltoxml.ir.Member;
import info.isaksson.erland.scltoxml.ir.TypeDocument;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class UdtTextTest {

    private static final String UDT = String.join("\n",
            "TYPE \"UDT_Motor\"",
            "VERSION : 0.2",
            "   // Author: Controls",
            "   // Family: Drives",
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

    @Test
    void readsCommentStyleHeader() throws Exception {
        UdtTextReader.Result result = new UdtTextReader().read(UDT);
        TypeDocument doc = result.document;

        assertTrue(result.warnings.isEmpty());
        assertEquals("UDT_Motor", doc.metadata.name);
        assertEquals("0.2", doc.metadata.version);
        assertEquals("Controls", doc.metadata.author);
        assertEquals("Drives", doc.metadata.family);
        assertEquals("Motor data", doc.metadata.description);

        assertEquals(3, doc.members.size());
        assertEquals("rpm", doc.members.get(0).comment);
        assertEquals(8, doc.members.get(1).arrayBounds.get(0).upper);
        Member cfg = doc.members.get(2);
        assertTrue(cfg.isStruct());
        assertEquals("T#2s", cfg.members.get(0).defaultValue);
    }

    @Test
    void writerOutputReadsBackToTheSameDocument() throws Exception {
        TypeDocument doc = new UdtTextReader().read(UDT).document;
        String text = new UdtTextWriter().write(doc);

        assertTrue(text.startsWith("TYPE \"UDT_Motor\"\nVERSION : 0.2\nAUTHOR : Controls\n"), text);
        assertTrue(text.contains("      faults : Array[1..8] of Bool;\n"), text);
        assertTrue(text.endsWith("   END_STRUCT;\n\nEND_TYPE\n"), text);
        assertEquals(doc, new UdtTextReader().read(text).document);
    }

    @Test
    void missingTypeHeaderIsMalformed() {
        ConversionException ex = assertThrows(ConversionException.class,
                () -> new UdtTextReader().read("STRUCT\n a : Int;\nEND_STRUCT;\n"));
        assertEquals(FailureKind.MALFORMED_INPUT, ex.getKind());
    }
}
