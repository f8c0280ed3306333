package com.micaixbrl.core.renderer.impl;

import com.micaixbrl.core.generator.GeneratedDocument;
import com.micaixbrl.core.renderer.RenderContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ConsoleRenderer}.
 */
class ConsoleRendererTest {

    private StringWriter output;
    private ConsoleRenderer renderer;

    @BeforeEach
    void setUp() {
        output = new StringWriter();
        renderer = new ConsoleRenderer(new PrintWriter(output));
    }

    @Test
    void getId_returnsConsole() {
        assertThat(renderer.getId()).isEqualTo("console");
    }

    @Test
    void render_withSingleDocument_printsContentOnly() {
        // Given
        GeneratedDocument document = new GeneratedDocument("whitepaper", "<html/>", "xhtml", 3);

        // When
        List<?> written = renderer.render(List.of(document), new RenderContext("./output", Map.of()));

        // Then
        assertThat(written).isEmpty();
        assertThat(output.toString()).isEqualToIgnoringNewLines("<html/>");
    }

    @Test
    void render_withMultipleDocuments_printsHeaders() {
        // Given
        GeneratedDocument xhtml = new GeneratedDocument("whitepaper", "<html/>", "xhtml", 3);
        GeneratedDocument facts = new GeneratedDocument("whitepaper-facts", "{}", "json", 3);

        // When
        renderer.render(List.of(xhtml, facts), new RenderContext("./output", Map.of()));

        // Then
        assertThat(output.toString())
            .contains("File 1/2: whitepaper.xhtml (3 facts)")
            .contains("File 2/2: whitepaper-facts.json (3 facts)")
            .contains("-".repeat(80));
    }

    @Test
    void render_withHeadersSetting_printsHeaderForSingleDocument() {
        // Given
        GeneratedDocument document = new GeneratedDocument("whitepaper", "<html/>", "xhtml", 0);
        RenderContext context = new RenderContext("./output", Map.of(ConsoleRenderer.HEADERS, "true"));

        // When
        renderer.render(List.of(document), context);

        // Then
        assertThat(output.toString()).contains("File 1/1: whitepaper.xhtml (0 facts)");
    }
}
