package com.micaixbrl.core.generator.template;

import com.micaixbrl.core.taxonomy.Languages;
import com.micaixbrl.core.taxonomy.Section;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Page-level markup: cover page, table of contents and page wrappers.
 */
public final class PageLayout {

    private PageLayout() {
        // Utility class
    }

    /**
     * Cover page content.
     *
     * @param cryptoAssetName name of the crypto-asset
     * @param symbol ticker symbol
     * @param offerorName offeror legal name
     * @param documentDate document date
     * @param language document language code
     */
    public record CoverPage(
        String cryptoAssetName,
        String symbol,
        String offerorName,
        String documentDate,
        String language
    ) {}

    public static String renderCoverPage(CoverPage cover) {
        String content = "\n    <div class=\"title\">Crypto-Asset White Paper</div>"
            + "\n    <div class=\"subtitle\">" + Markup.escape(cover.cryptoAssetName())
            + " (" + Markup.escape(cover.symbol()) + ")</div>"
            + "\n    <div class=\"meta\">"
            + "\n      <p>Prepared in accordance with Regulation (EU) 2023/1114 (MiCA)</p>"
            + "\n      <p>Offeror: " + Markup.escape(cover.offerorName()) + "</p>"
            + "\n      <p>Date: " + Markup.escape(cover.documentDate()) + "</p>"
            + "\n      <p>Language: " + Markup.escape(Languages.nameOf(cover.language())) + "</p>"
            + "\n    </div>";
        return wrapInPage(content, "cover-page");
    }

    /**
     * Table of contents linking to the section pages.
     *
     * @param sections sections in rendering order
     * @return table of contents page
     */
    public static String renderTableOfContents(List<Section> sections) {
        String entries = sections.stream()
            .map(section -> "        <li><a href=\"#section-" + section.key() + "\">"
                + Markup.escape(section.title()) + "</a></li>")
            .collect(Collectors.joining("\n"));
        String content = "\n    <h2 class=\"section-heading\">Table of Contents</h2>"
            + "\n    <ol class=\"toc\">\n" + entries + "\n    </ol>";
        return wrapInPage(content, "toc");
    }

    /**
     * Wraps content in an A4 page container.
     *
     * @param content page content
     * @param id element id of the page, also used as an extra class for the cover page
     * @return page markup
     */
    public static String wrapInPage(String content, String id) {
        String classes = "cover-page".equals(id) ? "page cover-page" : "page";
        return "  <div class=\"" + classes + "\" id=\"" + id + "\">" + content + "\n  </div>";
    }
}
