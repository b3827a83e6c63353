package eu.virtualparadox.docsearch.ingest.extractor;

import eu.virtualparadox.docsearch.exception.ExtractionException;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;

/**
 * PDF extractor backed by Apache PDFBox.
 * <p>Pages are extracted one by one and separated by a blank line, so page breaks become
 * paragraph boundaries for the chunker.</p>
 */
@Slf4j
@Service
public final class PdfTextExtractor implements TextExtractor {

    @Override
    public boolean supports(final String fileType) {
        return "pdf".equals(fileType);
    }

    @Override
    public String extract(final Path path) {
        try (PDDocument pdf = PDDocument.load(path.toFile())) {
            final int pageCount = pdf.getNumberOfPages();
            final PDFTextStripper stripper = new PDFTextStripper();

            final StringBuilder text = new StringBuilder(pageCount * 2_000);
            for (int page = 1; page <= pageCount; page++) {
                stripper.setStartPage(page);
                stripper.setEndPage(page);

                final String pageText = stripper.getText(pdf);
                if (!pageText.isBlank()) {
                    text.append(pageText).append("\n\n");
                }
            }

            log.debug("Extracted {} chars from {} pages of {}", text.length(), pageCount, path);
            return text.toString();
        }
        catch (IOException e) {
            throw new ExtractionException(path, "Failed to extract text from PDF", e);
        }
    }
}
