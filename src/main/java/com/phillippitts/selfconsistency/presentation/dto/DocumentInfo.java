package com.phillippitts.selfconsistency.presentation.dto;

import java.util.List;

/**
 * Facts about an uploaded document, returned beside the result.
 */
public record DocumentInfo(String filename, int pageCount, int extractedCharacters, List<String> warnings) {
}
