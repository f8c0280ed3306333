package com.micaixbrl.cli;

import com.micaixbrl.core.config.ConfigLoader;
import com.micaixbrl.core.config.ProjectConfig;
import com.micaixbrl.core.generator.DocumentGenerator;
import com.micaixbrl.core.generator.DocumentGenerators;
import com.micaixbrl.core.generator.GeneratedDocument;
import com.micaixbrl.core.generator.GeneratorConfig;
import com.micaixbrl.core.generator.MissingEntityIdentifierException;
import com.micaixbrl.core.io.WhitepaperReader;
import com.micaixbrl.core.model.WhitepaperData;
import com.micaixbrl.core.renderer.OutputRenderer;
import com.micaixbrl.core.renderer.RenderContext;
import com.micaixbrl.core.renderer.impl.ConsoleRenderer;
import com.micaixbrl.core.renderer.impl.FileSystemRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command to generate documents from a white paper record.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Inline XBRL document into ./output
 * mica-ixbrl generate whitepaper.json
 *
 * # Document and fact list into out/
 * mica-ixbrl generate whitepaper.yaml -g xhtml -g facts-json -o out
 *
 * # Print to standard output
 * mica-ixbrl generate whitepaper.json --stdout > whitepaper.xhtml
 *
 * # Keep documents already in out/
 * mica-ixbrl generate whitepaper.json -o out --no-overwrite
 * }</pre>
 */
@Command(
    name = "generate",
    description = "Generate the inline XBRL document of a white paper record",
    mixinStandardHelpOptions = true
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "White paper record (JSON or YAML)")
    private Path input;

    @Option(names = {"-o", "--output"}, description = "Output directory (default: from configuration)")
    private Path outputDir;

    @Option(names = {"-g", "--generator"}, description = "Generator id, repeatable (default: from configuration)")
    private List<String> generatorIds = new ArrayList<>();

    @Option(names = {"-c", "--config"}, description = "Configuration file", defaultValue = ConfigLoader.DEFAULT_FILE_NAME)
    private Path configFile;

    @Option(names = "--stdout", description = "Print documents instead of writing files")
    private boolean stdout;

    @Option(names = "--no-overwrite", description = "Fail instead of replacing existing output files")
    private boolean noOverwrite;

    @Option(names = "--headers", description = "With --stdout, print a header line before each document")
    private boolean headers;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        // Status lines must not mix with a document printed to stdout
        PrintWriter status = stdout ? err : out;

        try {
            ProjectConfig config = ConfigLoader.load(configFile);
            List<DocumentGenerator> generators = resolveGenerators(config);
            if (generators.isEmpty()) {
                return 1;
            }

            WhitepaperData data = WhitepaperReader.read(input);
            GeneratorConfig generatorConfig = config.toGeneratorConfig();

            List<GeneratedDocument> documents = new ArrayList<>();
            for (DocumentGenerator generator : generators) {
                GeneratedDocument document = generator.generate(data, generatorConfig);
                documents.add(document);
                status.println("✓ Generated " + document.fileName() + " (" + document.factCount() + " facts)");
            }

            if (stdout) {
                new ConsoleRenderer(out).render(documents,
                    new RenderContext(".", Map.of(ConsoleRenderer.HEADERS, String.valueOf(headers))));
                return 0;
            }

            Path directory = outputDir != null ? outputDir : Paths.get(config.output().directory());
            OutputRenderer renderer = new FileSystemRenderer();
            List<Path> written = renderer.render(documents, new RenderContext(directory.toString(),
                Map.of(FileSystemRenderer.OVERWRITE, String.valueOf(!noOverwrite))));
            written.forEach(path -> status.println("✓ Wrote " + path));
            return 0;

        } catch (MissingEntityIdentifierException e) {
            log.debug("Generation aborted", e);
            err.println("✗ Generation failed: " + e.getMessage());
            return 1;
        } catch (UncheckedIOException | IllegalStateException e) {
            log.error("Generation failed", e);
            err.println("✗ Generation failed: " + e.getMessage());
            return 1;
        }
    }

    private List<DocumentGenerator> resolveGenerators(ProjectConfig config) {
        List<String> ids = generatorIds.isEmpty() ? List.of(config.generator().defaultGenerator()) : generatorIds;
        List<DocumentGenerator> generators = new ArrayList<>();
        for (String id : ids) {
            DocumentGenerators.byId(id).ifPresentOrElse(generators::add, () -> {
                PrintWriter err = spec.commandLine().getErr();
                err.println("✗ Unknown generator: " + id);
                DocumentGenerators.all().forEach(generator -> err.println("    - " + generator.getId()));
            });
        }
        return generators.size() == ids.size() ? generators : List.of();
    }
}
