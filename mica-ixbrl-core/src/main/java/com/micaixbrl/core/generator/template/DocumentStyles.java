package com.micaixbrl.core.generator.template;

/**
 * Embedded stylesheet of generated documents: A4 pages and numbered field tables.
 */
public final class DocumentStyles {

    private DocumentStyles() {
        // Utility class
    }

    public static final String CSS = """
        * { margin: 0; padding: 0; box-sizing: border-box; }
        html { font-size: 10pt; }
        body {
          font-family: 'Segoe UI', Tahoma, Geneva, Verdana, sans-serif;
          line-height: 1.5;
          color: #1a1a1a;
          background: #f0f0f0;
        }
        .page {
          width: 210mm;
          min-height: 297mm;
          margin: 10mm auto;
          padding: 20mm 25mm;
          background: #ffffff;
          box-shadow: 0 1px 4px rgba(0, 0, 0, 0.15);
          page-break-after: always;
          overflow: hidden;
        }
        @media print {
          body { background: #ffffff; }
          .page { margin: 0; padding: 15mm 20mm; box-shadow: none; }
        }
        .cover-page {
          display: flex;
          flex-direction: column;
          justify-content: center;
          align-items: center;
          text-align: center;
        }
        .cover-page .title { font-size: 22pt; font-weight: 700; margin-bottom: 8mm; }
        .cover-page .subtitle { font-size: 16pt; color: #003399; margin-bottom: 20mm; }
        .cover-page .meta p { margin: 2mm 0; }
        .toc { margin-left: 8mm; }
        .toc li { margin: 2mm 0; }
        .section-heading {
          font-size: 14pt;
          color: #003399;
          border-bottom: 2px solid #003399;
          padding-bottom: 2mm;
          margin-bottom: 5mm;
        }
        .section-subheading { font-size: 11pt; color: #003399; margin: 6mm 0 3mm; }
        table { width: 100%; border-collapse: collapse; margin-bottom: 5mm; }
        th, td { border: 1px solid #c0c0c0; padding: 2mm 3mm; vertical-align: top; text-align: left; }
        th { background: #e8edf7; font-weight: 600; }
        table.accounts td:first-child, table.sustainability td:first-child { width: 12mm; white-space: nowrap; }
        table.accounts td:nth-child(2), table.sustainability td:nth-child(2) { width: 55mm; }
        table.sustainability th { background: #e6f4ea; }
        table.dimensional td:first-child { width: 8mm; }
        .text-block { white-space: pre-wrap; }
        .empty-field { background: #fafafa; }
        """;
}
