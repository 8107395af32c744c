package info.isaksson.erland.paramdup;

import com.github.javaparser.ParseProblemException;
import info.isaksson.erland.paramdup.bridge.ResultToReportAdapter;
import info.isaksson.erland.paramdup.core.FileOutcome;
import info.isaksson.erland.paramdup.core.ParamDuplicatorOptions;
import info.isaksson.erland.paramdup.core.ParamDuplicatorResult;
import info.isaksson.erland.paramdup.core.ParamDuplicatorService;
import info.isaksson.erland.paramdup.report.ReportJson;
import info.isaksson.erland.paramdup.rewrite.ParameterDuplication;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * CLI entrypoint: duplicate the sole parameter of methods in a Java file or source tree.
 */
public final class Main {

    private static final ParamDuplicatorService SERVICE = new ParamDuplicatorService();

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

        if (parsed.input == null || parsed.output == null) {
            System.err.println("Error: both --input and --output are required.");
            System.err.println();
            CliArgs.printHelp();
            return 1;
        }

        final Path inputPath = Paths.get(parsed.input).toAbsolutePath().normalize();
        if (!Files.exists(inputPath)) {
            System.err.println("Error: input '" + inputPath + "' not found.");
            return 1;
        }
        final boolean treeMode = Files.isDirectory(inputPath);
        final Path outputPath = resolveOutput(parsed.output, inputPath, treeMode);
        if (treeMode && Files.isRegularFile(outputPath)) {
            System.err.println("Error: --output must be a directory when --input is a directory: " + outputPath);
            return 1;
        }

        final ParamDuplicatorOptions opts = toCoreOptions(parsed);
        final ParamDuplicatorResult res;
        try {
            res = treeMode
                    ? SERVICE.rewriteTree(inputPath, outputPath, parsed.excludes, opts)
                    : SERVICE.rewriteFile(inputPath, outputPath, opts);
        } catch (ParseProblemException e) {
            System.err.println("Error processing file: " + inputPath + " is not valid Java.");
            System.err.println(firstLine(e.getMessage()));
            return 2;
        } catch (RuntimeException | IOException e) {
            System.err.println("Error processing " + (treeMode ? "directory" : "file") + ": " + e.getMessage());
            return 2;
        }

        if (parsed.verbose) {
            for (FileOutcome f : res.files) {
                for (ParameterDuplication d : f.duplications) {
                    System.out.println((treeMode ? f.relativePath + ": " : "") + d.describe());
                }
            }
        }
        for (FileOutcome f : res.parseFailures()) {
            System.err.println("Warning: " + f.relativePath + ": " + f.parseError + " (copied unchanged)");
        }

        if (parsed.writeReport != null) {
            final Path reportOut = Paths.get(parsed.writeReport).toAbsolutePath().normalize();
            try {
                ReportJson.write(new ResultToReportAdapter().toReport(res), reportOut);
            } catch (IOException e) {
                System.err.println("Error: could not write report to: " + reportOut);
                System.err.println(e.getMessage());
                return 2;
            }
        }

        System.out.println(
                "param-duplicator\n" +
                "- Input: " + inputPath + "\n" +
                "- Output: " + outputPath + "\n" +
                (parsed.writeReport != null ? "- Report: " + Paths.get(parsed.writeReport).toAbsolutePath().normalize() + "\n" : "") +
                "- Java files: " + res.files.size() + "\n" +
                "- Parse errors: " + res.parseFailures().size() + "\n" +
                "Found and processed " + res.totalModified() + " method(s) with single parameters."
        );

        return res.parseFailures().isEmpty() ? 0 : 3;
    }

    private static ParamDuplicatorOptions toCoreOptions(CliArgs parsed) {
        ParamDuplicatorOptions o = new ParamDuplicatorOptions();
        o.includeConstructors = parsed.includeConstructors;
        o.includeTests = parsed.includeTests;
        if (parsed.threads > 0) o.threads = parsed.threads;
        return o;
    }

    private static Path resolveOutput(String outputArg, Path inputPath, boolean treeMode) {
        Path out = Paths.get(outputArg).toAbsolutePath().normalize();
        // A file written into an existing directory keeps its own name.
        if (!treeMode && Files.isDirectory(out)) {
            return out.resolve(inputPath.getFileName().toString());
        }
        return out;
    }

    private static String firstLine(String s) {
        if (s == null) return "";
        int nl = s.indexOf('\n');
        return nl < 0 ? s : s.substring(0, nl);
    }

    /** Minimal CLI argument parsing without external dependencies. */
    static final class CliArgs {
        boolean help = false;
        String input;
        String output;

        String writeReport;
        boolean verbose = false;

        boolean includeConstructors = false;
        // 0 = service default (available processors)
        int threads = 0;

        // Directory mode
        boolean includeTests = false;
        final List<String> excludes = new ArrayList<>();

        static CliArgs parse(String[] args) {
            CliArgs out = new CliArgs();

            for (int i = 0; i < args.length; i++) {
                String a = args[i];
                if (a == null) continue;

                if (a.startsWith("--exclude=")) {
                    out.excludes.add(a.substring("--exclude=".length()));
                    continue;
                }

                switch (a) {
                    case "--help":
                    case "-h":
                        out.help = true;
                        break;
                    case "--input":
                    case "-i":
                        out.input = requireValue(args, ++i, a);
                        break;
                    case "--output":
                    case "-o":
                        out.output = requireValue(args, ++i, a);
                        break;
                    case "--write-report":
                        out.writeReport = requireValue(args, ++i, "--write-report");
                        break;
                    case "--exclude":
                        out.excludes.add(requireValue(args, ++i, "--exclude"));
                        break;
                    case "--include-tests":
                        out.includeTests = true;
                        break;
                    case "--include-constructors":
                        out.includeConstructors = parseBoolean(requireValue(args, ++i, "--include-constructors"), "--include-constructors");
                        break;
                    case "--threads":
                        out.threads = parsePositiveInt(requireValue(args, ++i, "--threads"), "--threads");
                        break;
                    case "--verbose":
                    case "-v":
                        out.verbose = true;
                        break;
                    default:
                        if (a.startsWith("-")) {
                            throw new IllegalArgumentException("Unknown argument: " + a);
                        }
                        // positional form: <input> <output>
                        if (out.input == null) {
                            out.input = a;
                        } else if (out.output == null) {
                            out.output = a;
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

        static boolean parseBoolean(String v, String flag) {
            if (v == null) throw new IllegalArgumentException("Missing value for " + flag);
            String s = v.trim().toLowerCase();
            if (s.equals("true") || s.equals("1") || s.equals("yes")) return true;
            if (s.equals("false") || s.equals("0") || s.equals("no")) return false;
            throw new IllegalArgumentException("Invalid boolean for " + flag + ": " + v);
        }

        static int parsePositiveInt(String v, String flag) {
            int n;
            try {
                n = Integer.parseInt(v.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid number for " + flag + ": " + v, e);
            }
            if (n < 1) throw new IllegalArgumentException(flag + " must be at least 1: " + v);
            return n;
        }

        static void printHelp() {
            System.out.println(
                    "param-duplicator\n" +
                    "\n" +
                    "Usage:\n" +
                    "  java -jar param-duplicator.jar <input> <output>\n" +
                    "  java -jar param-duplicator.jar --input <file|dir> --output <file|dir> [options]\n" +
                    "\n" +
                    "Every method with exactly one parameter gets a second parameter of the same type\n" +
                    "with a suggested name. Everything else is written back unchanged.\n" +
                    "\n" +
                    "Options:\n" +
                    "  -i, --input <path>     Java file, or directory to scan for .java files (required)\n" +
                    "  -o, --output <path>    Output file, or output directory in directory mode (required)\n" +
                    "  --exclude <glob>       Directory mode: exclude paths matching glob (repeatable), relative\n" +
                    "                         to --input with '/' separators. Also supports --exclude=<glob>.\n" +
                    "  --include-tests        Directory mode: include common test folders (default: excluded)\n" +
                    "  --include-constructors <bool>  Also rewrite single-parameter constructors. Default: false.\n" +
                    "  --threads <n>          Directory mode: files rewritten in parallel (default: CPU count)\n" +
                    "  --write-report <file>  Write a JSON report of every duplicated parameter\n" +
                    "  -v, --verbose          Print one line per duplicated parameter\n" +
                    "  -h, --help             Show help\n" +
                    "\n" +
                    "Exit codes: 0 ok, 1 usage error or missing input, 2 processing failure,\n" +
                    "            3 directory mode finished but some files could not be parsed\n" +
                    "\n" +
                    "Examples:\n" +
                    "  java -jar param-duplicator.jar Input.java Output.java\n" +
                    "  java -jar param-duplicator.jar --input src/main/java --output out --exclude \"**/generated/**\"\n"
            );
        }
    }
}
