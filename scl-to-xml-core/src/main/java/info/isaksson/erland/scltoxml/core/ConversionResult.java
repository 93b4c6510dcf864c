package info.isaksson.erland.scltoxml.core;

import info.isaksson.erland.scltoxml.ir.ConversionWarning;

import java.nio.file.Path;
import java.util.List;

/**
 * Conversion result container for programmatic usage.
 *
 * @param <D> the document on the canonical side of the conversion
 */
public final class ConversionResult<D> {
    /** Produced text: canonical JSON, interchange XML or source text. */
    public final String content;

    /** The canonical document that was read or written. */
    public final D document;

    /** Where {@link #content} was written; {@code null} for string conversions. */
    public final Path outputPath;

    /** Recovered problems in deterministic order. */
    public final List<ConversionWarning> warnings;

    ConversionResult(String content, D document, Path outputPath, List<ConversionWarning> warnings) {
        this.content = content;
        this.document = document;
        this.outputPath = outputPath;
        this.warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    ConversionResult<D> writtenTo(Path path) {
        return new ConversionResult<>(content, document, path, warnings);
    }
}
