package com.datasheetrag.ingest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ContentHasherTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldHashFileContentStably() throws Exception {
        Path file = tempDir.resolve("test.txt");
        Files.writeString(file, "test content");

        String first = ContentHasher.hashFile(file);
        String second = ContentHasher.hashFile(file);

        assertEquals(first, second);
        assertEquals(64, first.length());
        assertNotEquals(ContentHasher.UNKNOWN, first);
        assertEquals("6ae8a75555209fd6c44157c0aed8016e763ff435a19cf186f76863140143ff72", first);
        assertEquals(first, ContentHasher.hashText("test content"));
    }

    @Test
    void shouldFallBackToUnknownForMissingFile() {
        assertEquals(ContentHasher.UNKNOWN, ContentHasher.hashFile(tempDir.resolve("nonexistent.pdf")));
    }

    @Test
    void shouldDistinguishDifferentContent() {
        assertNotEquals(ContentHasher.hashText("rev A"), ContentHasher.hashText("rev B"));
    }
}
