package com.ciro.jsxt.standalone;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.ciro.jsxt.TransformOptions;
import com.ciro.jsxt.scanner.LocatorKind;
import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

@Command(name = "jsxt", version = "jsxt 0.1.0", mixinStandardHelpOptions = true,
        description = "Compiles the JSX in JS/TS sources into template literals.")
public class Main implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final String DEFAULT_CONFIG = "jsxt.properties";

    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", paramLabel = "<input>", description = "Source file or directory")
    private Path input;

    @Parameters(index = "1", arity = "0..1", paramLabel = "<output>",
            description = "Output file (default: stdout) or output directory")
    private Path output;

    @Option(names = "--config", paramLabel = "<file>",
            description = "Properties file (default: ./" + DEFAULT_CONFIG + " if present)")
    private Path config;

    @Option(names = "--locator", paramLabel = "SCANNER|FIRST_ANGLE", converter = LocatorConverter.class,
            description = "How JSX start positions are found")
    private LocatorKind locator;

    @Option(names = "--helpers-import", paramLabel = "<module>",
            description = "Module imported at the top of every output")
    private String helpersImport;

    @Option(names = "--report", paramLabel = "<file>", description = "Write a JSON build report")
    private Path report;

    @Option(names = "--list-tags", description = "Print the tags of each JSX fragment instead of compiling")
    private boolean listTags;

    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }

    static CommandLine commandLine() {
        return new CommandLine(new Main());
    }

    @Override
    public Integer call() {
        CommandLine cmd = spec.commandLine();
        TransformOptions options;
        try {
            options = loadOptions();
        } catch (IOException | IllegalArgumentException e) {
            log.error("invalid configuration: {}", e.getMessage());
            cmd.getErr().println("Error: invalid configuration: " + e.getMessage());
            return EXIT_USAGE;
        }

        JsxBuild build = new JsxBuild(options, helpersImport, cmd.getOut(), cmd.getErr());
        try {
            BuildReport result;
            if (Files.isDirectory(input)) {
                if (listTags) {
                    result = build.listTree(input);
                } else if (output == null) {
                    throw new ParameterException(cmd, "<output> is required when <input> is a directory");
                } else {
                    result = build.buildTree(input, output);
                }
            } else if (Files.isRegularFile(input)) {
                result = listTags ? build.listFile(input) : build.buildFile(input, output);
            } else {
                cmd.getErr().println("Error: input not found: " + input);
                return EXIT_USAGE;
            }

            if (report != null) {
                ObjectMapperFactory.create().writeValue(report.toFile(), result);
                log.info("report written to {}", report);
            }
            return result.hasFailures() ? EXIT_FAILED : CommandLine.ExitCode.OK;
        } catch (IOException e) {
            log.error("I/O error", e);
            cmd.getErr().println("Error: " + e.getMessage());
            return EXIT_USAGE;
        }
    }

    private TransformOptions loadOptions() throws IOException {
        TransformOptions.Builder builder = TransformOptions.builder();
        Path file = config != null ? config : Path.of(DEFAULT_CONFIG);
        if (config != null || Files.isRegularFile(file)) {
            Properties props = new Properties();
            try (Reader reader = Files.newBufferedReader(file, UTF_8)) {
                props.load(reader);
            }
            builder.apply(props);
            log.info("configuration loaded from {}", file);
        }
        if (locator != null) builder.locator(locator);
        return builder.build();
    }

    public static final class LocatorConverter implements CommandLine.ITypeConverter<LocatorKind> {
        @Override
        public LocatorKind convert(String value) {
            return LocatorKind.parse(value);
        }
    }
}
