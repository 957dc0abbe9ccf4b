package com.datasheetrag.ingest;

import java.io.IOException;
import java.nio.file.Path;
import java.text.Normalizer;
import java.util.Locale;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class PdfTextExtractor implements TextExtractor {
    private static final Logger log = LoggerFactory.getLogger(PdfTextExtractor.class);

    @Override
    public boolean supports(Path path) {
        Path fileName = path.getFileName();
        return fileName != null && fileName.toString().toLowerCase(Locale.ROOT).endsWith(".pdf");
    }

    @Override
    public String extract(Path path) throws IOException {
        log.info("Extracting text from PDF: {}", path);
        try (PDDocument pdf = PDDocument.load(path.toFile())) {
            PDFTextStripper stripper = new PDFTextStripper();
            String text = Normalizer.normalize(stripper.getText(pdf), Normalizer.Form.NFC);
            if (text.isBlank()) {
                log.warn("No text extracted from PDF: {}", path);
                return "";
            }
            log.info("Extracted {} characters from {} pages", text.length(), pdf.getNumberOfPages());
            return text;
        }
    }
}
