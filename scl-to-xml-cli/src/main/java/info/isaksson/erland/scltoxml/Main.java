package info.isaksson.erland.scltoxml;

import info.isaksson.erland.scltoxml.core.ConversionResult;
import info.isaksson.erland.scltoxml.core.ConverterConfig;
import info.isaksson.erland.scltoxml.core.ConverterOptions;
import info.isaksson.erland.scltoxml.core.SclToXmlService;
import info.isaksson.erland.scltoxml.ir.ConversionException;
import info.isaksson.erland.scltoxml.ir.ConversionWarning;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;

/**
 * CLI entrypoint: converts one file between source text, canonical JSON and interchange XML.
 *
 * <p>Exit codes: 0 success, 1 usage error, 2 conversion failure.</p>
 */
public final class Main {

    static final List<String> FORMATS = List.of("scl", "json", "xml", "udt", "udt-json", "udt-xml");

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Testable entrypoint that returns an exit code instead of calling System.exit.
     */
    public static int run(String[] args) {
        CliArgs parsed;
        try {
            parsed = CliArgs.parse(args);
        } catch (IllegalArgumentException ex) {
            System.err.println("Error: " + ex.getMessage());
            System.err.println();
            CliArgs.printHelp();
            return 1;
        }

        if (parsed.help) {
            CliArgs.printHelp();
            return 0;
        }

        if (parsed.from == null || parsed.to == null || parsed.input == null) {
            System.err.println("Error: --from, --to and --input are required.");
            System.err.println();
            CliArgs.printHelp();
            return 1;
        }

        final Path input = Paths.get(parsed.input).toAbsolutePath().normalize();
        if (!Files.isRegularFile(input)) {
            System.err.println("Error: --input must point to an existing file: " + input);
            return 1;
        }
        final Path output = parsed.output == null ? null : Paths.get(parsed.output).toAbsolutePath().normalize();

        ConverterOptions options = parsed.config != null
                ? ConverterConfig.load(Paths.get(parsed.config))
                : ConverterConfig.load();
        if (parsed.uidStart != null) options.uidStart = parsed.uidStart;
        if (parsed.noReflow) options.reflowLongCalls = false;

        SclToXmlService service = new SclToXmlService(options);
        final ConversionResult<?> res;
        try {
            res = convert(service, parsed.from, parsed.to, input, output);
        } catch (UnsupportedOperationException ex) {
            System.err.println("Error: " + ex.getMessage());
            return 1;
        } catch (ConversionException ex) {
            System.err.println("Error: conversion failed (" + ex.getKind() + ").");
            System.err.println(ex.getMessage());
            return 2;
        }

        for (ConversionWarning w : res.warnings) {
            System.err.println("Warning: " + w);
        }
        if (output == null) {
            System.out.print(res.content);
        } else {
            System.out.println(
                    "scl-to-xml\n" +
                    "- Input: " + input + " (" + parsed.from + ")\n" +
                    "- Output: " + output + " (" + parsed.to + ")\n" +
                    "- Warnings: " + res.warnings.size()
            );
        }
        return 0;
    }

    static ConversionResult<?> convert(SclToXmlService service, String from, String to, Path input, Path output)
            throws ConversionException {
        return switch (from + "->" + to) {
            case "scl->json" -> service.textToCanonical(input, output);
            case "scl->xml" -> service.textToXml(input, output);
            case "json->xml" -> service.canonicalToXml(input, output);
            case "json->scl" -> service.canonicalToText(input, output);
            case "xml->json" -> service.xmlToCanonical(input, output);
            case "xml->scl" -> service.xmlToText(input, output);
            case "udt->udt-json" -> service.udtTextToType(input, output);
            case "udt->udt-xml" -> service.udtTextToXml(input, output);
            case "udt-json->udt-xml" -> service.typeToXml(input, output);
            case "udt-json->udt" -> service.typeToUdtText(input, output);
            case "udt-xml->udt-json" -> service.xmlToType(input, output);
            case "udt-xml->udt" -> service.xmlToUdtText(input, output);
            default -> throw new UnsupportedOperationException("No conversion from " + from + " to " + to);
        };
    }

    /** Minimal CLI argument parsing without external dependencies. */
    static final class CliArgs {
        boolean help = false;
        String from;
        String to;
        String input;
        String output;
        String config;
        Integer uidStart;
        boolean noReflow = false;

        static CliArgs parse(String[] args) {
            CliArgs out = new CliArgs();

            for (int i = 0; i < args.length; i++) {
                String a = args[i];
                if (a == null) continue;

                switch (a) {
                    case "--help":
                    case "-h":
                        out.help = true;
                        break;
                    case "--from":
                        out.from = parseFormat(requireValue(args, ++i, "--from"), "--from");
                        break;
                    case "--to":
                        out.to = parseFormat(requireValue(args, ++i, "--to"), "--to");
                        break;
                    case "--input":
                        out.input = requireValue(args, ++i, "--input");
                        break;
                    case "--output":
                        out.output = requireValue(args, ++i, "--output");
                        break;
                    case "--config":
                        out.config = requireValue(args, ++i, "--config");
                        break;
                    case "--uid-start":
                        out.uidStart = parseNonNegative(requireValue(args, ++i, "--uid-start"), "--uid-start");
                        break;
                    case "--no-reflow":
                        out.noReflow = true;
                        break;
                    default:
                        if (a.startsWith("--")) {
                            throw new IllegalArgumentException("Unknown argument: " + a);
                        }
                        // allow a bare path as shorthand for --input
                        if (out.input == null) {
                            out.input = a;
                        } else {
                            throw new IllegalArgumentException("Unexpected extra argument: " + a);
                        }
                }
            }

            return out;
        }

        static String requireValue(String[] args, int index, String flag) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Missing value for " + flag);
            }
            String v = args[index];
            if (v == null || v.isBlank() || v.startsWith("--")) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + v);
            }
            return v;
        }

        static String parseFormat(String v, String flag) {
            String s = v.trim().toLowerCase(Locale.ROOT);
            if (!FORMATS.contains(s)) {
                throw new IllegalArgumentException("Invalid format for " + flag + ": " + v + " (expected one of " + FORMATS + ")");
            }
            return s;
        }

        static int parseNonNegative(String v, String flag) {
            try {
                int n = Integer.parseInt(v.trim());
                if (n < 0) throw new IllegalArgumentException("Negative value for " + flag + ": " + v);
                return n;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid integer for " + flag + ": " + v);
            }
        }

        static void printHelp() {
            System.out.println(
                    "scl-to-xml\n" +
                    "\n" +
                    "Usage:\n" +
                    "  java -jar scl-to-xml.jar --from <format> --to <format> --input <file> [--output <file>] [options]\n" +
                    "\n" +
                    "Formats:\n" +
                    "  scl | json | xml            program blocks (source text, canonical JSON, interchange XML)\n" +
                    "  udt | udt-json | udt-xml    user-defined struct types\n" +
                    "\n" +
                    "Options:\n" +
                    "  --input <file>         File to convert (required; a bare path also works)\n" +
                    "  --output <file>        Destination file (default: print to stdout)\n" +
                    "  --config <yml>         Configuration file (default: ./scl-to-xml.yml when present)\n" +
                    "  --uid-start <n>        First UId of structured-code nodes (default: 21)\n" +
                    "  --no-reflow            Keep long call lines on one line when reading XML\n" +
                    "  -h, --help             Show help\n" +
                    "\n" +
                    "Examples:\n" +
                    "  java -jar scl-to-xml.jar --from scl --to xml --input FB_Conveyor.scl --output FB_Conveyor.xml\n" +
                    "  java -jar scl-to-xml.jar --from xml --to json --input FB_Conveyor.xml\n"
            );
        }
    }
}
