package com.docloom.source;

import org.junit.jupiter.api.Test;

import com.docloom.model.SourceType;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SourceDescriptorTest {

    @Test
    void shouldSplitOnFirstColonOnly() throws Exception {
        SourceDescriptor descriptor = SourceDescriptor.parse("site:https://example.com:8443/docs");

        assertEquals(SourceType.SITE, descriptor.type());
        assertEquals("https://example.com:8443/docs", descriptor.locator());
        assertEquals("site:https://example.com:8443/docs", descriptor.canonical());
    }

    @Test
    void shouldRecognizeEveryKnownType() throws Exception {
        assertEquals(SourceType.GITHUB, SourceDescriptor.parse("github:acme").type());
        assertEquals(SourceType.FILE, SourceDescriptor.parse("file:docs/*.md").type());
        assertEquals(SourceType.PDF, SourceDescriptor.parse("pdf:papers/*.pdf").type());
    }

    @Test
    void shouldTrimAroundTypeAndLocator() throws Exception {
        assertEquals("github:acme", SourceDescriptor.parse(" github : acme ").canonical());
    }

    @Test
    void shouldRejectMalformedDescriptors() {
        assertTrue(assertThrows(InvalidSourceException.class, () -> SourceDescriptor.parse("bogus"))
                .getMessage().contains("missing"));
        assertTrue(assertThrows(InvalidSourceException.class, () -> SourceDescriptor.parse("nope:1"))
                .getMessage().contains("unrecognized source type 'nope'"));
        assertTrue(assertThrows(InvalidSourceException.class, () -> SourceDescriptor.parse("github:  "))
                .getMessage().contains("empty locator"));
        assertThrows(InvalidSourceException.class, () -> SourceDescriptor.parse(""));
        assertThrows(InvalidSourceException.class, () -> SourceDescriptor.parse(null));
    }
}
