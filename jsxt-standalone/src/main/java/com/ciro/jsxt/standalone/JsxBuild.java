package com.ciro.jsxt.standalone;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.ciro.jsxt.JsxException;
import com.ciro.jsxt.JsxTransformer;
import com.ciro.jsxt.TransformOptions;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Aplica el transformer a un archivo o a un árbol de directorios.
 *
 * Un error de JSX marca el archivo como FAILED y se sigue con el resto; un
 * error de I/O corta el build.
 */
public class JsxBuild {

    private static final Logger log = LoggerFactory.getLogger(JsxBuild.class);

    static final String OUTPUT_EXTENSION = ".js";

    private final TransformOptions options;
    private final String helpersImport;
    private final PrintWriter out;
    private final PrintWriter err;

    /**
     * @param helpersImport módulo a importar al principio de cada salida, o null
     */
    public JsxBuild(TransformOptions options, String helpersImport, PrintWriter out, PrintWriter err) {
        this.options = options;
        this.helpersImport = helpersImport;
        this.out = out;
        this.err = err;
    }

    /** Un archivo suelto. Sin {@code output} el resultado va a stdout. */
    public BuildReport buildFile(Path input, Path output) throws IOException {
        String name = input.getFileName().toString();
        String source = Files.readString(input, UTF_8);
        try {
            String compiled = compile(source, name);
            if (output == null) {
                out.print(compiled);
                out.flush();
            } else {
                write(output, compiled);
            }
            log.info("{} -> {}", name, output == null ? "stdout" : output);
            return BuildReport.of(List.of(FileResult.ok(name)));
        } catch (JsxException e) {
            return BuildReport.of(List.of(failed(name, e)));
        }
    }

    /** Cada {@code .jsx}/{@code .tsx} bajo {@code root} va a {@code outRoot} con extensión {@code .js}. */
    public BuildReport buildTree(Path root, Path outRoot) throws IOException {
        List<FileResult> results = new ArrayList<>();
        for (Path file : sources(root)) {
            Path relative = root.relativize(file);
            String name = displayName(relative);
            String source = Files.readString(file, UTF_8);
            try {
                Path target = outputPath(outRoot, relative);
                write(target, compile(source, name));
                log.info("{} -> {}", name, target);
                results.add(FileResult.ok(name));
            } catch (JsxException e) {
                results.add(failed(name, e));
            }
        }
        BuildReport report = BuildReport.of(results);
        log.info("built {} file(s), {} failed", report.total(), report.failed());
        return report;
    }

    public BuildReport listFile(Path input) throws IOException {
        return BuildReport.of(List.of(list(input, input.getFileName().toString())));
    }

    public BuildReport listTree(Path root) throws IOException {
        List<FileResult> results = new ArrayList<>();
        for (Path file : sources(root)) {
            results.add(list(file, displayName(root.relativize(file))));
        }
        return BuildReport.of(results);
    }

    String compile(String source, String sourceName) throws JsxException {
        JsxTransformer transformer = new JsxTransformer(options.toBuilder().sourceName(sourceName).build());
        String compiled = transformer.transform(source);
        if (helpersImport == null) return compiled;
        return "import \"" + helpersImport + "\";\n\n" + compiled;
    }

    private FileResult list(Path file, String name) throws IOException {
        String source = Files.readString(file, UTF_8);
        TagLister lister = new TagLister(options.toBuilder().sourceName(name).build());
        try {
            String rendered = TagLister.render(lister.collect(source));
            out.print(name + "\n" + rendered);
            out.flush();
            return FileResult.ok(name);
        } catch (JsxException e) {
            return failed(name, e);
        }
    }

    private FileResult failed(String name, JsxException e) {
        log.warn("{} failed: {}", name, e.kind());
        err.println(e.getMessage());
        err.flush();
        return FileResult.failed(name, e.getMessage());
    }

    static List<Path> sources(Path root) throws IOException {
        try (Stream<Path> files = Files.walk(root)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(JsxBuild::isJsxSource)
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    static boolean isJsxSource(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".jsx") || name.endsWith(".tsx");
    }

    static Path outputPath(Path outRoot, Path relative) {
        String name = relative.getFileName().toString();
        String renamed = name.substring(0, name.lastIndexOf('.')) + OUTPUT_EXTENSION;
        return outRoot.resolve(relative.resolveSibling(renamed).toString());
    }

    private static String displayName(Path relative) {
        return relative.toString().replace(relative.getFileSystem().getSeparator(), "/");
    }

    private static void write(Path target, String content) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        Files.writeString(target, content, UTF_8);
    }
}
