package com.micaixbrl.core.renderer.impl;

import com.micaixbrl.core.generator.GeneratedDocument;
import com.micaixbrl.core.renderer.OutputRenderer;
import com.micaixbrl.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes generated documents into the output directory as UTF-8 files named
 * {@link GeneratedDocument#fileName()}.
 *
 * <p><b>Settings:</b>
 * <ul>
 *   <li>{@code filesystem.overwrite} - replace existing files ("true"/"false", default: "true")</li>
 * </ul>
 */
public class FileSystemRenderer implements OutputRenderer {

    private static final Logger log = LoggerFactory.getLogger(FileSystemRenderer.class);

    public static final String OVERWRITE = "filesystem.overwrite";

    @Override
    public String getId() {
        return "filesystem";
    }

    @Override
    public List<Path> render(List<GeneratedDocument> documents, RenderContext context) {
        Path outputDir = Paths.get(context.outputDirectory());
        boolean overwrite = Boolean.parseBoolean(context.getSettingOrDefault(OVERWRITE, "true"));

        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create output directory: " + outputDir, e);
        }

        List<Path> written = new ArrayList<>();
        for (GeneratedDocument document : documents) {
            written.add(write(outputDir, document, overwrite));
        }
        log.info("Rendered {} document(s) to {}", written.size(), outputDir);
        return written;
    }

    private Path write(Path outputDir, GeneratedDocument document, boolean overwrite) {
        Path target = outputDir.resolve(document.fileName());
        if (!overwrite && Files.exists(target)) {
            throw new IllegalStateException("Refusing to overwrite existing file: " + target);
        }
        try {
            Files.writeString(target, document.content(), StandardCharsets.UTF_8);
            log.debug("Wrote {} ({} facts, {} chars)", target, document.factCount(), document.content().length());
            return target;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write file: " + target, e);
        }
    }
}
