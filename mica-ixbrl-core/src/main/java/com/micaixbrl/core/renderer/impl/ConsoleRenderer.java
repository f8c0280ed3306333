package com.micaixbrl.core.renderer.impl;

import com.micaixbrl.core.generator.GeneratedDocument;
import com.micaixbrl.core.renderer.OutputRenderer;
import com.micaixbrl.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Prints generated documents to a writer, UTF-8 standard output by default.
 *
 * <p>A single document is printed as-is so the output can be piped into a file. With
 * several documents, or with {@code console.headers} set to "true", each document is
 * preceded by a header line naming its file.</p>
 */
public class ConsoleRenderer implements OutputRenderer {

    private static final Logger log = LoggerFactory.getLogger(ConsoleRenderer.class);

    public static final String HEADERS = "console.headers";

    private static final String SEPARATOR = "-".repeat(80);

    private final PrintWriter out;

    public ConsoleRenderer() {
        this(new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8), true));
    }

    public ConsoleRenderer(PrintWriter out) {
        this.out = Objects.requireNonNull(out, "out must not be null");
    }

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public List<Path> render(List<GeneratedDocument> documents, RenderContext context) {
        boolean headers = documents.size() > 1
            || Boolean.parseBoolean(context.getSettingOrDefault(HEADERS, "false"));

        for (int i = 0; i < documents.size(); i++) {
            GeneratedDocument document = documents.get(i);
            if (headers) {
                out.println(SEPARATOR);
                out.println("File " + (i + 1) + "/" + documents.size() + ": " + document.fileName()
                    + " (" + document.factCount() + " facts)");
                out.println(SEPARATOR);
            }
            out.println(document.content());
        }
        out.flush();
        log.debug("Printed {} document(s) to console", documents.size());
        return List.of();
    }
}
