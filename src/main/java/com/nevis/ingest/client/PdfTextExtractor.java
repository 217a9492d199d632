package com.nevis.ingest.client;

import com.nevis.ingest.exception.TextExtractionException;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;

@Slf4j
@Component
public class PdfTextExtractor implements DocumentTextExtractor {

    @Override
    public String extract(Path file) {
        try (PDDocument document = PDDocument.load(file.toFile())) {
            String text = new PDFTextStripper().getText(document);
            log.debug("Extracted {} characters from {} ({} pages)", text.length(), file.getFileName(),
                document.getNumberOfPages());
            return text;
        } catch (IOException e) {
            throw new TextExtractionException("Failed to extract text from " + file.getFileName(), e);
        }
    }

    @Override
    public boolean supports(String fileName) {
        return fileName != null && fileName.toLowerCase().endsWith(".pdf");
    }
}
