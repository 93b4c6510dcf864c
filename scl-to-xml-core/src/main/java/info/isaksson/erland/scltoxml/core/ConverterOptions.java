package info.isaksson.erland.scltoxml.core;

import info.isaksson.erland.scltoxml.emitter.GeneratorOptions;
import info.isaksson.erland.scltoxml.extract.ExtractorOptions;
import info.isaksson.erland.scltoxml.scl.ScopeRules;

import java.util.ArrayList;
import java.util.List;

/**
 * Core options for all conversions.
 *
 * <p>Mirrors the CLI flags and the keys of {@code scl-to-xml.yml} in a structured form.</p>
 */
public final class ConverterOptions {
    /** First {@code UId} assigned to structured-code nodes. */
    public int uidStart = GeneratorOptions.DEFAULT_UID_START;

    /** Engineering version written when a document does not carry one. */
    public String engineeringVersion = GeneratorOptions.DEFAULT_ENGINEERING_VERSION;

    /** Split long call lines one parameter per line when reading XML. */
    public boolean reflowLongCalls = true;
    public int reflowWidth = ExtractorOptions.DEFAULT_REFLOW_WIDTH;

    /**
     * Quoted names matching this pattern are global constants. {@code null} or blank disables
     * pattern matching.
     */
    public String globalConstantPattern = ScopeRules.DEFAULT_GLOBAL_CONSTANT_PATTERN;

    /** Additional global constant names, matched case-insensitively. */
    public List<String> globalConstants = new ArrayList<>();

    GeneratorOptions generatorOptions() {
        return new GeneratorOptions(uidStart, engineeringVersion,
                new ScopeRules(null, globalConstants, globalConstantPattern));
    }

    ExtractorOptions extractorOptions() {
        return new ExtractorOptions(reflowLongCalls, reflowWidth);
    }

    @Override
    public String toString() {
        return "ConverterOptions{" +
                "uidStart=" + uidStart +
                ", engineeringVersion='" + engineeringVersion + '\'' +
                ", reflowLongCalls=" + reflowLongCalls +
                ", reflowWidth=" + reflowWidth +
                ", globalConstantPattern='" + globalConstantPattern + '\'' +
                ", globalConstants=" + globalConstants +
                '}';
    }
}
