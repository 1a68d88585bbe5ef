package info.isaksson.erland.modelimport;

import info.isaksson.erland.modelimport.apply.UnknownTypePolicy;
import info.isaksson.erland.modelimport.core.ModelImportOptions;
import info.isaksson.erland.modelimport.core.ModelImportResult;
import info.isaksson.erland.modelimport.core.ModelImportService;
import info.isaksson.erland.modelimport.domain.ModelMetadata;
import info.isaksson.erland.modelimport.framework.StructuralParseException;
import info.isaksson.erland.modelimport.framework.UnsupportedImportFormatException;
import info.isaksson.erland.modelimport.ir.IrJson;
import info.isaksson.erland.modelimport.sink.ModelAllocationException;
import info.isaksson.erland.modelimport.store.InMemoryModelStore;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Command line entrypoint: imports one BPMN / ArchiMate exchange / EA XMI file into an in-memory model
 * and writes the import report, and optionally the normalized IR and the resulting model, as JSON.
 *
 * <p>Exit codes: 0 success, 1 usage error, 2 import or I/O failure, 3 warnings present with
 * {@code --fail-on-warnings}.</p>
 */
public final class Main {

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

        if (parsed.input == null) {
            System.err.println("Error: --input is required.");
            System.err.println();
            CliArgs.printHelp();
            return 1;
        }

        final Path inputPath = Paths.get(parsed.input).toAbsolutePath().normalize();
        if (!Files.isRegularFile(inputPath)) {
            System.err.println("Error: --input must point to an existing file: " + inputPath);
            return 1;
        }

        final Path reportOut = resolveReportOutput(parsed.report, inputPath);

        final ModelImportResult res;
        try {
            ModelImportService service = new ModelImportService(new InMemoryModelStore(1));
            res = service.importFile(inputPath, toCoreOptions(parsed));
        } catch (UnsupportedImportFormatException | StructuralParseException | ModelAllocationException e) {
            System.err.println("Error: import failed.");
            System.err.println(e.getMessage());
            return 2;
        } catch (IOException e) {
            System.err.println("Error: could not read input: " + inputPath);
            System.err.println(e.getMessage());
            return 2;
        }

        try {
            writeJson(res.report, reportOut);
            if (parsed.writeIr != null) writeJson(res.ir, absolute(parsed.writeIr));
            if (parsed.output != null) writeJson(res.model, absolute(parsed.output));
        } catch (IOException e) {
            System.err.println("Error: could not write output.");
            System.err.println(e.getMessage());
            return 2;
        }

        int warnings = res.report.getWarnings().size();
        System.out.println(
                "model-import\n" +
                "- Input: " + inputPath + "\n" +
                "- Format: " + res.format + " (importer " + res.importerId + ")\n" +
                "- Model: " + res.model.kind.id() + " \"" + res.model.metadata.name + "\"\n" +
                "- Report: " + reportOut + "\n" +
                (parsed.writeIr != null ? "- IR: " + absolute(parsed.writeIr) + "\n" : "") +
                (parsed.output != null ? "- Output: " + absolute(parsed.output) + "\n" : "") +
                "- Folders: " + res.model.folders.size() + "\n" +
                "- Elements: " + res.model.elements.size() + "\n" +
                "- Relationships: " + res.model.relationships.size() + "\n" +
                "- Views: " + res.model.views.size() + "\n" +
                "- Warnings: " + warnings
        );

        if (parsed.failOnWarnings && warnings > 0) {
            System.err.println("Import produced " + warnings + " warning(s) and --fail-on-warnings is set.");
            System.err.println("See report: " + reportOut);
            return 3;
        }
        return 0;
    }

    private static ModelImportOptions toCoreOptions(CliArgs parsed) {
        ModelImportOptions o = new ModelImportOptions();
        o.sourceSystem = parsed.sourceSystem;
        o.unknownTypePolicy = parsed.unknownTypePolicy;
        o.dropDanglingRelationships = !parsed.keepDangling;
        o.deterministicIdSeed = parsed.seed;
        if (parsed.name != null) o.metadata = ModelMetadata.named(parsed.name);
        return o;
    }

    private static void writeJson(Object value, Path out) throws IOException {
        Path parent = out.getParent();
        if (parent != null) Files.createDirectories(parent);
        IrJson.writeObject(value, out);
    }

    private static Path absolute(String path) {
        return Paths.get(path).toAbsolutePath().normalize();
    }

    private static Path resolveReportOutput(String reportArg, Path inputPath) {
        if (reportArg != null) return absolute(reportArg);
        return inputPath.resolveSibling(stripExtension(inputPath.getFileName().toString()) + ".import-report.json");
    }

    private static String stripExtension(String fileName) {
        int idx = fileName.lastIndexOf('.');
        if (idx <= 0) return fileName;
        return fileName.substring(0, idx);
    }

    /** Minimal CLI argument parsing without external dependencies. */
    static final class CliArgs {
        boolean help = false;
        String input;
        String report;
        String writeIr;
        String output;
        String name;
        String sourceSystem;
        String seed;
        UnknownTypePolicy unknownTypePolicy = UnknownTypePolicy.IMPORT_AS_UNKNOWN;
        boolean keepDangling = false;
        boolean failOnWarnings = false;

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
                    case "--input":
                        out.input = requireValue(args, ++i, "--input");
                        break;
                    case "--report":
                        out.report = requireValue(args, ++i, "--report");
                        break;
                    case "--write-ir":
                        out.writeIr = requireValue(args, ++i, "--write-ir");
                        break;
                    case "--output":
                        out.output = requireValue(args, ++i, "--output");
                        break;
                    case "--name":
                        out.name = requireValue(args, ++i, "--name");
                        break;
                    case "--source-system":
                        out.sourceSystem = requireValue(args, ++i, "--source-system");
                        break;
                    case "--seed":
                        out.seed = requireValue(args, ++i, "--seed");
                        break;
                    case "--unknown-types":
                        out.unknownTypePolicy = UnknownTypePolicy.parse(requireValue(args, ++i, "--unknown-types"));
                        break;
                    case "--keep-dangling":
                        out.keepDangling = true;
                        break;
                    case "--fail-on-warnings":
                        out.failOnWarnings = true;
                        break;
                    default:
                        if (a.startsWith("--")) {
                            throw new IllegalArgumentException("Unknown argument: " + a);
                        }
                        // a bare path is shorthand for --input
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

        static void printHelp() {
            System.out.println(
                    "model-import\n" +
                    "\n" +
                    "Usage:\n" +
                    "  java -jar model-import-cli.jar --input <file> [options]\n" +
                    "\n" +
                    "Supported inputs: BPMN 2.0 XML, ArchiMate Model Exchange (MEFF), Sparx EA XMI (UML 2.x).\n" +
                    "\n" +
                    "Options:\n" +
                    "  --input <file>           Model file to import (required; a bare path works too)\n" +
                    "  --report <file.json>     Import report (default: <input>.import-report.json next to the input)\n" +
                    "  --write-ir <file.json>   Also write the normalized intermediate representation\n" +
                    "  --output <file.json>     Also write the imported model\n" +
                    "  --name <name>            Model name (default: name found in the file, else the file name)\n" +
                    "  --source-system <id>     System recorded in external ids (default: derived from the format)\n" +
                    "  --unknown-types <mode>   import | skip (default: import, as type Unknown)\n" +
                    "  --keep-dangling          Keep relationships whose endpoints are missing during normalization\n" +
                    "                           (Apply still skips them)\n" +
                    "  --seed <text>            Derive internal ids from this seed so repeated runs match\n" +
                    "  --fail-on-warnings       Exit with code 3 when the report contains warnings\n" +
                    "  -h, --help               Show help\n" +
                    "\n" +
                    "Examples:\n" +
                    "  java -jar target/model-import-cli.jar --input process.bpmn --output out/model.json\n" +
                    "  java -jar target/model-import-cli.jar export.xml --unknown-types skip --seed demo\n"
            );
        }
    }
}
