package eu.virtualparadox.docsearch.ingest.extractor;

import eu.virtualparadox.docsearch.exception.ExtractionException;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.UnsupportedFileFormatException;
import org.apache.poi.ooxml.POIXMLException;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;
import org.apache.poi.xwpf.usermodel.XWPFTableRow;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Word (OOXML) extractor backed by Apache POI.
 * <p>Non-empty paragraphs become paragraphs of the text. Tables follow the body, one row per
 * line with the non-empty cells joined by {@code " | "}.</p>
 */
@Slf4j
@Service
public final class DocxTextExtractor implements TextExtractor {

    @Override
    public boolean supports(final String fileType) {
        return "docx".equals(fileType);
    }

    @Override
    public String extract(final Path path) {
        try (InputStream in = Files.newInputStream(path);
             XWPFDocument docx = new XWPFDocument(in)) {
            final List<String> paragraphs = new ArrayList<>();
            for (final XWPFParagraph paragraph : docx.getParagraphs()) {
                final String text = paragraph.getText().strip();
                if (!text.isEmpty()) {
                    paragraphs.add(text);
                }
            }

            final List<String> rows = new ArrayList<>();
            for (final XWPFTable table : docx.getTables()) {
                for (final XWPFTableRow row : table.getRows()) {
                    final List<String> cells = new ArrayList<>();
                    for (final XWPFTableCell cell : row.getTableCells()) {
                        final String text = cell.getText().strip();
                        if (!text.isEmpty()) {
                            cells.add(text);
                        }
                    }
                    if (!cells.isEmpty()) {
                        rows.add(String.join(" | ", cells));
                    }
                }
            }

            final StringBuilder text = new StringBuilder(String.join("\n\n", paragraphs));
            if (!rows.isEmpty()) {
                text.append("\n\n").append(String.join("\n", rows));
            }
            log.debug("Extracted {} paragraphs and {} table rows from {}", paragraphs.size(), rows.size(), path);
            return text.toString();
        }
        catch (IOException | POIXMLException | UnsupportedFileFormatException e) {
            throw new ExtractionException(path, "Failed to extract text from DOCX", e);
        }
    }
}
