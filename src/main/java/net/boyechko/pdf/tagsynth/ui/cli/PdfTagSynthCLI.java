/*
 * PDF-TagSynth - Accessibility Structure-Tree Synthesis
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.pdf.tagsynth.ui.cli;

import ch.qos.logback.classic.Level;
import com.itextpdf.kernel.pdf.PdfDocument;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import net.boyechko.pdf.tagsynth.core.EngineConfig;
import net.boyechko.pdf.tagsynth.core.ProcessingResult;
import net.boyechko.pdf.tagsynth.core.ProcessingService;
import net.boyechko.pdf.tagsynth.core.VerbosityLevel;
import net.boyechko.pdf.tagsynth.document.PdfCustodian;
import net.boyechko.pdf.tagsynth.sidecar.Sidecar;
import net.boyechko.pdf.tagsynth.sidecar.SidecarStore;
import net.boyechko.pdf.tagsynth.structure.TreeDump;
import net.boyechko.pdf.tagsynth.ui.ProcessingReporter;
import net.boyechko.pdf.tagsynth.ui.RemediationReport;
import net.boyechko.pdf.tagsynth.ui.StatusReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class PdfTagSynthCLI {
    private static final String DEFAULT_OUTPUT_SUFFIX = "_tagged";

    private static Logger logger;

    // Configuration record to hold parsed CLI arguments
    public record CLIConfig(
            Path inputPath,
            Path outputPath,
            Path sidecarPath,
            Path configPath,
            String password,
            Path reportPath,
            boolean writeSidecar,
            boolean dumpTree,
            VerbosityLevel verbosity) {
        public CLIConfig {
            if (inputPath == null) {
                throw new IllegalArgumentException("Input path is required");
            }
            if (outputPath == null) {
                throw new IllegalArgumentException("Output path is required");
            }
            if (verbosity == null) {
                throw new IllegalArgumentException("Verbosity level is required");
            }
        }
    }

    // Custom exception for CLI errors
    public static class CLIException extends Exception {
        public CLIException(String message) {
            super(message);
        }
    }

    /** Mutable builder that accumulates parsed CLI arguments and resolves derived paths. */
    static class CLIConfigBuilder {
        Path inputPath;
        Path outputPath;
        Path sidecarPath;
        Path configPath;
        String password;
        Path reportPath;
        boolean writeSidecar;
        boolean dumpTree;
        VerbosityLevel verbosity = VerbosityLevel.NORMAL;

        CLIConfig build() throws CLIException {
            if (inputPath == null) {
                throw new CLIException("No input file specified");
            }
            if (!Files.exists(inputPath)) {
                throw new CLIException("File not found: " + inputPath);
            }
            if (configPath != null && !Files.exists(configPath)) {
                throw new CLIException("Config file not found: " + configPath);
            }

            String baseName = inputPath.getFileName().toString().replaceFirst("[.][^.]+$", "");
            resolveOutputPath(baseName);
            if (sidecarPath == null) {
                sidecarPath = SidecarStore.sidecarPathFor(inputPath);
            }
            if (reportPath != null && Files.isDirectory(reportPath)) {
                reportPath = reportPath.resolve(baseName + DEFAULT_OUTPUT_SUFFIX + "_report.json");
            }

            return new CLIConfig(
                    inputPath,
                    outputPath,
                    sidecarPath,
                    configPath,
                    password,
                    reportPath,
                    writeSidecar,
                    dumpTree,
                    verbosity);
        }

        private void resolveOutputPath(String baseName) {
            if (outputPath == null) {
                String outputFilename = baseName + DEFAULT_OUTPUT_SUFFIX + ".pdf";
                Path parent = inputPath.getParent();
                outputPath =
                        parent != null ? parent.resolve(outputFilename) : Paths.get(outputFilename);
            } else if (Files.isDirectory(outputPath)) {
                outputPath = outputPath.resolve(baseName + DEFAULT_OUTPUT_SUFFIX + ".pdf");
            }
        }
    }

    public static void main(String[] args) {
        int exitCode = run(args, System.out, System.err);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    /** Runs the CLI and returns the process exit code. */
    static int run(String[] args, PrintStream out, PrintStream err) {
        try {
            if (isHelpRequested(args)) {
                out.println(usageMessage());
                return 0;
            }
            CLIConfig config = parseArguments(args);
            configureLogging(config.verbosity());
            logger().info(
                            "Starting processing of {} with verbosity level {}",
                            config.inputPath(),
                            config.verbosity());
            return processFile(config, out, err);
        } catch (CLIException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    static CLIConfig parseArguments(String[] args) throws CLIException {
        if (args.length == 0) {
            throw new CLIException("No input file specified\n" + usageMessage());
        }

        CLIConfigBuilder b = new CLIConfigBuilder();

        for (int i = 0; i < args.length; i++) {
            if (args[i].startsWith("--report=")) {
                b.reportPath = Paths.get(args[i].substring("--report=".length()));
            } else if (args[i].startsWith("--sidecar=")) {
                b.sidecarPath = Paths.get(args[i].substring("--sidecar=".length()));
            } else if (args[i].startsWith("--config=")) {
                b.configPath = Paths.get(args[i].substring("--config=".length()));
            } else {
                switch (args[i]) {
                    case "-p", "--password" -> b.password = requireValue(args, ++i, "-p");
                    case "-s", "--sidecar" ->
                            b.sidecarPath = Paths.get(requireValue(args, ++i, "-s"));
                    case "-c", "--config" ->
                            b.configPath = Paths.get(requireValue(args, ++i, "-c"));
                    case "-q", "--quiet" -> b.verbosity = VerbosityLevel.QUIET;
                    case "-v", "--verbose" -> b.verbosity = VerbosityLevel.VERBOSE;
                    case "-vv", "--debug" -> b.verbosity = VerbosityLevel.DEBUG;
                    case "--write-sidecar" -> b.writeSidecar = true;
                    case "--dump-tree" -> b.dumpTree = true;
                    default -> {
                        if (args[i].startsWith("-")) {
                            throw new CLIException("Unknown option: " + args[i]);
                        } else if (b.inputPath == null) {
                            b.inputPath = Paths.get(args[i]);
                        } else if (b.outputPath == null) {
                            b.outputPath = Paths.get(args[i]);
                        } else {
                            throw new CLIException("Multiple input files specified");
                        }
                    }
                }
            }
        }

        return b.build();
    }

    private static String requireValue(String[] args, int i, String option)
            throws CLIException {
        if (i < args.length) {
            return args[i];
        }
        throw new CLIException("Value not specified after " + option);
    }

    private static void configureLogging(VerbosityLevel verbosity) {
        Level level =
                switch (verbosity) {
                    case QUIET -> Level.ERROR;
                    case NORMAL -> Level.WARN;
                    case VERBOSE -> Level.INFO;
                    case DEBUG -> Level.DEBUG;
                };
        ch.qos.logback.classic.Logger appLogger =
                (ch.qos.logback.classic.Logger)
                        LoggerFactory.getLogger("net.boyechko.pdf.tagsynth");
        appLogger.setLevel(level);
    }

    private static Logger logger() {
        if (logger == null) {
            logger = LoggerFactory.getLogger(PdfTagSynthCLI.class);
        }
        return logger;
    }

    private static int processFile(CLIConfig config, PrintStream out, PrintStream err) {
        ProcessingReporter reporter = new ProcessingReporter(out, config.verbosity());
        try {
            EngineConfig engineConfig =
                    config.configPath() != null
                            ? EngineConfig.fromFile(config.configPath())
                            : EngineConfig.loadDefault();
            PdfCustodian custodian = new PdfCustodian(config.inputPath(), config.password());

            if (config.writeSidecar()) {
                writeInitialSidecar(config, custodian, reporter);
            }

            ProcessingService service =
                    new ProcessingService.ProcessingServiceBuilder()
                            .withPdfCustodian(custodian)
                            .withListener(reporter)
                            .withConfig(engineConfig)
                            .withSidecarPath(config.sidecarPath())
                            .build();

            logger().info("Synthesizing structure tree");
            ProcessingResult result = service.synthesize();
            if (result.isAborted()) {
                err.println("✗ Structure synthesis failed; no output written");
                return 1;
            }

            saveResult(result, config, reporter);
            reportStatus(result, config, reporter);

            if (config.dumpTree()) {
                out.print(TreeDump.toDetailedTreeString(result.synthesis().root()));
            }
            if (config.reportPath() != null) {
                Sidecar applied = service.sidecar() != null ? service.sidecar() : new Sidecar();
                RemediationReport.write(
                        result,
                        applied,
                        config.inputPath(),
                        config.outputPath(),
                        config.reportPath());
                reporter.onSuccess("Report saved to " + config.reportPath());
            }
            return 0;
        } catch (Exception e) {
            err.println("✗ Processing failed due to an exception:");
            err.println();
            e.printStackTrace(err);
            return 1;
        } finally {
            reporter.detach();
        }
    }

    private static void writeInitialSidecar(
            CLIConfig config, PdfCustodian custodian, ProcessingReporter reporter)
            throws IOException {
        if (Files.exists(config.sidecarPath())) {
            reporter.onInfo("Sidecar " + config.sidecarPath() + " already exists; left as is");
            return;
        }
        int pageCount;
        try (PdfDocument doc = custodian.openForReading()) {
            pageCount = doc.getNumberOfPages();
        }
        new SidecarStore().write(Sidecar.initial(pageCount), config.sidecarPath());
        reporter.onSuccess("Wrote initial sidecar to " + config.sidecarPath());
    }

    private static void saveResult(
            ProcessingResult result, CLIConfig config, ProcessingReporter reporter)
            throws IOException {
        Path outputParent = config.outputPath().toAbsolutePath().getParent();
        if (outputParent != null) {
            Files.createDirectories(outputParent);
        }

        logger().info(
                        "Moving temporary output file {} to {}",
                        result.tempOutputFile(),
                        config.outputPath());
        Files.move(
                result.tempOutputFile(), config.outputPath(), StandardCopyOption.REPLACE_EXISTING);

        reporter.onSuccess("Output saved to " + config.outputPath());
    }

    private static void reportStatus(
            ProcessingResult result, CLIConfig config, ProcessingReporter reporter)
            throws IOException {
        if (!reporter.shouldShow(VerbosityLevel.VERBOSE)) {
            return;
        }
        reporter.onPhaseStart("Status");
        try (PdfDocument doc =
                new PdfCustodian(config.outputPath(), config.password()).openForReading()) {
            reporter.onVerboseOutput(StatusReport.of(doc).format());
        }
        reporter.onSubsection("Created elements");
        for (String line : StatusReport.elementSummary(result.synthesis())) {
            reporter.onInfo(line);
        }
    }

    private static boolean isHelpRequested(String[] args) {
        for (String arg : args) {
            if ("-h".equals(arg) || "--help".equals(arg)) {
                return true;
            }
        }
        return false;
    }

    static String usageMessage() {
        return "Usage: pdf-tagsynth [-q|-v|-vv] [-s sidecar.json] [-c config.yaml] [-p password]"
                + " [--report=file] [--write-sidecar] [--dump-tree] <input.pdf> [<output.pdf>]\n"
                + "  -h, --help        Show this help message\n"
                + "  -q, --quiet       Only show errors and final status\n"
                + "  -v, --verbose     Show per-page progress and a status report\n"
                + "  -vv, --debug      Show all debug information\n"
                + "  -s, --sidecar     Sidecar JSON to apply (default: <input>_sidecar.json)\n"
                + "  -c, --config      Engine configuration YAML\n"
                + "  -p, --password    Password for encrypted PDFs\n"
                + "  --report=<file>   Save a JSON remediation report\n"
                + "  --write-sidecar   Write an initial sidecar if none exists yet\n"
                + "  --dump-tree       Print the synthesized structure tree\n"
                + "Examples:\n"
                + "  pdf-tagsynth document.pdf\n"
                + "  pdf-tagsynth -v -s edits.json document.pdf tagged.pdf\n"
                + "  pdf-tagsynth --write-sidecar --dump-tree document.pdf\n"
                + "  pdf-tagsynth --report=report.json -c strict.yaml document.pdf";
    }
}
