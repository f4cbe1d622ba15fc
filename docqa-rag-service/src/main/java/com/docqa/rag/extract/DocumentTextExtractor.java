package com.docqa.rag.extract;

import com.docqa.rag.error.EmptyDocumentException;
import com.docqa.rag.error.ExtractionFailedException;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.poi.xwpf.usermodel.BodyElementType;
import org.apache.poi.xwpf.usermodel.IBodyElement;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;
import org.apache.poi.xwpf.usermodel.XWPFTableRow;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts uploaded PDF, DOCX and plain-text bytes to plain text.
 * Images and other non-text content are skipped; a PDF page that cannot be
 * read is logged and skipped rather than failing the whole document.
 */
@Slf4j
public class DocumentTextExtractor {

    public String extract(byte[] content, String declaredType) {
        return extract(content, DocumentType.fromDeclared(declaredType), null);
    }

    public String extract(byte[] content, DocumentType type, String filename) {
        String name = filename == null ? type.name() + " document" : filename;
        if (content == null || content.length == 0) {
            throw new EmptyDocumentException(name);
        }

        String text = switch (type) {
            case PDF -> extractPdf(content, name);
            case DOCX -> extractDocx(content, name);
            case TXT -> extractTxt(content, name);
        };

        if (text.isBlank()) {
            throw new EmptyDocumentException(name);
        }
        log.debug("Extracted {} chars from {} ({})", text.length(), name, type);
        return text;
    }

    private String extractPdf(byte[] content, String name) {
        try (PDDocument doc = PDDocument.load(content)) {
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(true);
            int pages = doc.getNumberOfPages();
            StringBuilder sb = new StringBuilder();
            for (int page = 1; page <= pages; page++) {
                stripper.setStartPage(page);
                stripper.setEndPage(page);
                try {
                    sb.append(stripper.getText(doc));
                } catch (IOException | RuntimeException e) {
                    log.warn("Skipping unreadable page {} of {}: {}", page, name, e.getMessage());
                }
            }
            return sb.toString();
        } catch (IOException e) {
            throw new ExtractionFailedException("Failed to read PDF: " + name, e);
        }
    }

    private String extractDocx(byte[] content, String name) {
        try (XWPFDocument doc = new XWPFDocument(new ByteArrayInputStream(content))) {
            StringBuilder sb = new StringBuilder();
            for (IBodyElement element : doc.getBodyElements()) {
                if (element.getElementType() == BodyElementType.PARAGRAPH) {
                    sb.append(((XWPFParagraph) element).getText()).append("\n");
                } else if (element.getElementType() == BodyElementType.TABLE) {
                    appendTable(sb, (XWPFTable) element);
                }
            }
            return sb.toString();
        } catch (IOException | RuntimeException e) {
            throw new ExtractionFailedException("Failed to read DOCX: " + name, e);
        }
    }

    private void appendTable(StringBuilder sb, XWPFTable table) {
        for (XWPFTableRow row : table.getRows()) {
            List<String> cells = new ArrayList<>();
            for (XWPFTableCell cell : row.getTableCells()) {
                String cellText = cell.getText();
                if (cellText != null && !cellText.isBlank()) {
                    cells.add(cellText.trim());
                }
            }
            if (!cells.isEmpty()) {
                sb.append(String.join(" | ", cells)).append("\n");
            }
        }
    }

    /**
     * Plain text must be valid UTF-8; malformed bytes fail the document instead
     * of being replaced.
     */
    private String extractTxt(byte[] content, String name) {
        String text;
        try {
            text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(content))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new ExtractionFailedException("Text is not valid UTF-8: " + name, e);
        }
        // UTF-8 byte order mark
        if (!text.isEmpty() && text.charAt(0) == '\uFEFF') {
            text = text.substring(1);
        }
        return text.replace("\u0000", " ");
    }
}
