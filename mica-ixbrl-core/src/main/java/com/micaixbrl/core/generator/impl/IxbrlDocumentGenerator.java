package com.micaixbrl.core.generator.impl;

import com.micaixbrl.core.generator.DocumentGenerator;
import com.micaixbrl.core.generator.FactModel;
import com.micaixbrl.core.generator.FactModelBuilder;
import com.micaixbrl.core.generator.GeneratedDocument;
import com.micaixbrl.core.generator.GenerationContext;
import com.micaixbrl.core.generator.GeneratorConfig;
import com.micaixbrl.core.generator.template.DocumentStyles;
import com.micaixbrl.core.generator.template.HiddenFactBlock;
import com.micaixbrl.core.generator.template.Markup;
import com.micaixbrl.core.generator.template.PageLayout;
import com.micaixbrl.core.generator.template.ResourceRenderer;
import com.micaixbrl.core.generator.template.SectionRenderer;
import com.micaixbrl.core.model.EntityInfo;
import com.micaixbrl.core.model.ProjectInfo;
import com.micaixbrl.core.model.WhitepaperData;
import com.micaixbrl.core.taxonomy.MicaTaxonomy;
import com.micaixbrl.core.taxonomy.Section;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Generates the Inline XBRL (XHTML) white paper.
 *
 * <h2>Document Layout</h2>
 * <ul>
 *   <li>XML declaration and {@code html} root with the fixed namespace prefixes and {@code xml:lang}</li>
 *   <li>Head with the embedded stylesheet</li>
 *   <li>Cover page and table of contents</li>
 *   <li>One page per section, summary first, then parts A to J and the sustainability annex</li>
 *   <li>{@code ix:header} in a hidden div at the end of the body: hidden enumeration facts,
 *       the schema reference to the MiCA entry point, and the contexts and units that at
 *       least one fact references</li>
 * </ul>
 *
 * <p>Fact ids come from a {@link GenerationContext} created per call, so repeated runs on
 * the same record produce identical documents.</p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * DocumentGenerator generator = new IxbrlDocumentGenerator();
 * GeneratedDocument document = generator.generate(data, GeneratorConfig.defaults());
 * Files.writeString(Path.of(document.fileName()), document.content());
 * }</pre>
 */
public class IxbrlDocumentGenerator implements DocumentGenerator {

    private static final Logger log = LoggerFactory.getLogger(IxbrlDocumentGenerator.class);

    private static final String XML_DECLARATION = "<?xml version=\"1.0\" encoding=\"utf-8\"?>";
    private static final String TITLE_PREFIX = "MiCA Crypto-Asset White Paper - ";

    private final Clock clock;

    public IxbrlDocumentGenerator() {
        this(Clock.systemDefaultZone());
    }

    public IxbrlDocumentGenerator(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public String getId() {
        return "xhtml";
    }

    @Override
    public String getDisplayName() {
        return "Inline XBRL Document Generator";
    }

    @Override
    public String getFileExtension() {
        return "xhtml";
    }

    @Override
    public GeneratedDocument generate(WhitepaperData data, GeneratorConfig config) {
        Objects.requireNonNull(data, "data must not be null");
        GeneratorConfig effective = config != null ? config : GeneratorConfig.defaults();
        FactModel model = new FactModelBuilder(clock, effective).build(data);
        GenerationContext context = new GenerationContext(effective);

        String content = render(data, model, context);
        int factCount = model.allFacts().size();
        log.info("Generated iXBRL document with {} facts, {} hidden, {} contexts",
            factCount, context.hiddenFacts().size(), model.referencedContexts().size());
        return new GeneratedDocument(baseName(data), content, getFileExtension(), factCount);
    }

    private String render(WhitepaperData data, FactModel model, GenerationContext context) {
        List<Section> sections = Arrays.asList(Section.values());
        List<String> pages = new ArrayList<>();
        for (Section section : sections) {
            pages.add(PageLayout.wrapInPage(SectionRenderer.render(section, model, context), "section-" + section.key()));
        }

        ProjectInfo project = data.partD();
        EntityInfo offeror = data.partA();
        String assetName = project != null && project.cryptoAssetName() != null ? project.cryptoAssetName() : null;
        String cover = PageLayout.renderCoverPage(new PageLayout.CoverPage(
            assetName != null ? assetName : "Unknown Token",
            project != null && project.cryptoAssetSymbol() != null ? project.cryptoAssetSymbol() : "???",
            offeror != null && offeror.legalName() != null ? offeror.legalName() : "Unknown Offeror",
            model.documentDate().toString(),
            model.language()));

        String namespaces = MicaTaxonomy.NAMESPACES.entrySet().stream()
            .map(entry -> "xmlns:" + entry.getKey() + "=\"" + entry.getValue() + "\"")
            .collect(Collectors.joining("\n    "));

        String hiddenBlock = HiddenFactBlock.render(context.hiddenFacts());

        return XML_DECLARATION + "\n"
            + "<html xmlns=\"" + MicaTaxonomy.XHTML_NAMESPACE + "\"\n"
            + "    " + namespaces + "\n"
            + "    xml:lang=\"" + Markup.escape(model.language()) + "\">\n"
            + "<head>\n"
            + "  <meta charset=\"utf-8\" />\n"
            + "  <title>" + TITLE_PREFIX + Markup.escape(assetName != null ? assetName : "Unknown") + "</title>\n"
            + "  <style type=\"text/css\">\n" + DocumentStyles.CSS + "  </style>\n"
            + "</head>\n"
            + "<body>\n\n"
            + cover + "\n\n"
            + PageLayout.renderTableOfContents(sections) + "\n\n"
            + String.join("\n", pages) + "\n\n"
            + "  <div style=\"display:none\">\n"
            + "    <ix:header>\n"
            + (hiddenBlock.isEmpty() ? "" : hiddenBlock + "\n")
            + "      <ix:references>\n"
            + "        <link:schemaRef xlink:href=\"" + MicaTaxonomy.ENTRY_POINT + "\" xlink:type=\"simple\" />\n"
            + "      </ix:references>\n"
            + "      <ix:resources>\n"
            + ResourceRenderer.renderContexts(model.referencedContexts()) + "\n"
            + ResourceRenderer.renderUnits(model.units()) + "\n"
            + "      </ix:resources>\n"
            + "    </ix:header>\n"
            + "  </div>\n\n"
            + "</body>\n"
            + "</html>\n";
    }

    /**
     * Base file name: the token symbol in lower case, or {@code whitepaper}.
     */
    static String baseName(WhitepaperData data) {
        String symbol = data.partD() != null ? data.partD().cryptoAssetSymbol() : null;
        if (symbol == null || symbol.isBlank()) {
            return "whitepaper";
        }
        String cleaned = symbol.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_-]", "");
        return cleaned.isEmpty() ? "whitepaper" : cleaned + "-whitepaper";
    }
}
