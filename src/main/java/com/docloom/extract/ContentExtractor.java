package com.docloom.extract;

/**
 * Reduces mechanically stripped page text to its main content.
 */
@FunctionalInterface
public interface ContentExtractor {
    ExtractedContent extract(String text) throws ExtractionException;
}
