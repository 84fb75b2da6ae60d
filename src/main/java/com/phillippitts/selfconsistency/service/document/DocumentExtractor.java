package com.phillippitts.selfconsistency.service.document;

import com.phillippitts.selfconsistency.exception.DocumentExtractionException;

/**
 * Converts an uploaded document into plain text for the prompt.
 */
public interface DocumentExtractor {

    /**
     * @param content raw document bytes
     * @throws DocumentExtractionException if the document cannot be read or contains no text
     */
    ExtractedDocument extract(byte[] content);
}
