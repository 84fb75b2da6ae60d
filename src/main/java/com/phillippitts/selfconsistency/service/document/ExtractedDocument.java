package com.phillippitts.selfconsistency.service.document;

import java.util.List;
import java.util.Objects;

/**
 * Text pulled from an uploaded document.
 *
 * @param text      extracted text with {@code --- Page n ---} markers
 * @param pageCount number of pages in the document
 * @param warnings  non-fatal extraction problems (e.g. pages without a text layer)
 */
public record ExtractedDocument(String text, int pageCount, List<String> warnings) {

    public ExtractedDocument {
        Objects.requireNonNull(text, "text");
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
