package com.docqa.rag.extract;

import com.docqa.rag.error.UnsupportedFormatException;

import java.util.Locale;

/**
 * The document formats the extractor understands. A declared type may be a
 * MIME type ("application/pdf") or a short name ("pdf", ".pdf").
 */
public enum DocumentType {
    PDF("application/pdf", "pdf"),
    DOCX("application/vnd.openxmlformats-officedocument.wordprocessingml.document", "docx"),
    TXT("text/plain", "txt");

    private final String mimeType;
    private final String extension;

    DocumentType(String mimeType, String extension) {
        this.mimeType = mimeType;
        this.extension = extension;
    }

    public String getMimeType() {
        return mimeType;
    }

    public String getExtension() {
        return extension;
    }

    public static DocumentType fromDeclared(String declaredType) {
        if (declaredType == null || declaredType.isBlank()) {
            throw new UnsupportedFormatException("No document type declared");
        }
        // "text/plain; charset=utf-8" -> "text/plain"
        String normalized = declaredType.split(";")[0].trim().toLowerCase(Locale.ROOT);
        if (normalized.startsWith(".")) {
            normalized = normalized.substring(1);
        }
        for (DocumentType type : values()) {
            if (type.mimeType.equals(normalized) || type.extension.equals(normalized)) {
                return type;
            }
        }
        throw new UnsupportedFormatException("Unsupported document type: " + declaredType);
    }

    /**
     * Resolves the type from the declared MIME type, falling back to the file
     * extension when the client sent a generic type such as application/octet-stream.
     */
    public static DocumentType resolve(String declaredType, String filename) {
        if (declaredType != null && !declaredType.isBlank()
                && !declaredType.startsWith("application/octet-stream")) {
            return fromDeclared(declaredType);
        }
        String f = filename == null ? "" : filename;
        int dot = f.lastIndexOf('.');
        if (dot < 0 || dot == f.length() - 1) {
            throw new UnsupportedFormatException("Cannot determine document type of " + filename);
        }
        return fromDeclared(f.substring(dot + 1));
    }
}
