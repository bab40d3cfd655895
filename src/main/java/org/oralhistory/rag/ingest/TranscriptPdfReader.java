package org.oralhistory.rag.ingest;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Extracts the page texts of all transcript PDFs in a folder. Files are read in
 * numeric order of the first number in their name ({@code document2.pdf} before
 * {@code document10.pdf}). Unreadable files are logged and skipped.
 */
public class TranscriptPdfReader {

    private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptPdfReader.class);

    private static final Pattern NUMBER = Pattern.compile("\\d+");

    static final Comparator<Path> NUMERIC_ORDER = Comparator
            .comparingLong((Path path) -> numberIn(path.getFileName().toString()))
            .thenComparing(path -> path.getFileName().toString());

    public List<TranscriptDocument> readFolder(Path folder) throws IOException {
        List<Path> pdfs;
        try (Stream<Path> files = Files.list(folder)) {
            pdfs = files.filter(Files::isRegularFile)
                    .filter(file -> file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".pdf"))
                    .sorted(NUMERIC_ORDER)
                    .toList();
        }
        List<TranscriptDocument> documents = new ArrayList<>();
        for (Path pdf : pdfs) {
            try {
                TranscriptDocument document = read(pdf);
                documents.add(document);
                LOGGER.info("Processed {} ({} pages)", pdf.getFileName(), document.pageCount());
            } catch (IOException ex) {
                LOGGER.error("Skipping {}: {}", pdf.getFileName(), ex.getMessage(), ex);
            }
        }
        return documents;
    }

    public TranscriptDocument read(Path pdf) throws IOException {
        try (PDDocument document = Loader.loadPDF(pdf.toFile())) {
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(true);
            List<String> pages = new ArrayList<>(document.getNumberOfPages());
            for (int page = 1; page <= document.getNumberOfPages(); page++) {
                stripper.setStartPage(page);
                stripper.setEndPage(page);
                pages.add(stripper.getText(document));
            }
            return new TranscriptDocument(pdf.getFileName().toString(), pages);
        }
    }

    private static long numberIn(String fileName) {
        Matcher matcher = NUMBER.matcher(fileName);
        return matcher.find() ? Long.parseLong(matcher.group()) : Long.MAX_VALUE;
    }
}
