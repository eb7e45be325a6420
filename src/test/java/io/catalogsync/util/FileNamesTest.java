package io.catalogsync.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileNamesTest {

    @Test
    void shouldAcceptSinglePathElements() {
        assertTrue(FileNames.isPlainName("lecture 1.pdf"));
        assertTrue(FileNames.isPlainName("..notes"));
        assertTrue(FileNames.isPlainName(".hidden"));
    }

    @Test
    void shouldRejectNamesThatLeaveTheFolder() {
        assertFalse(FileNames.isPlainName(null));
        assertFalse(FileNames.isPlainName(" "));
        assertFalse(FileNames.isPlainName("."));
        assertFalse(FileNames.isPlainName(".."));
        assertFalse(FileNames.isPlainName("../x"));
        assertFalse(FileNames.isPlainName("Slides/x.pdf"));
        assertFalse(FileNames.isPlainName("..\\x"));
    }

    @Test
    void shouldTreatDotPrefixAsHidden() {
        assertTrue(FileNames.isHidden(".catalog-cache.json"));
        assertTrue(FileNames.isHidden(".lecture.pdf.part"));
        assertFalse(FileNames.isHidden("lecture.pdf"));
    }
}
