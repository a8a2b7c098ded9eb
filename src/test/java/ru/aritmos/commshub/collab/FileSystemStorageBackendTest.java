package ru.aritmos.commshub.collab;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import ru.aritmos.commshub.core.NotFoundException;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class FileSystemStorageBackendTest {

    @TempDir
    Path baseDir;

    @Test
    void readBytes_shouldReadNestedKey() throws Exception {
        Files.createDirectories(baseDir.resolve("org-1"));
        Files.write(baseDir.resolve("org-1/rec.mp3"), "audio".getBytes(StandardCharsets.UTF_8));

        byte[] out = new FileSystemStorageBackend(baseDir).readBytes("org-1/rec.mp3");

        assertArrayEquals("audio".getBytes(StandardCharsets.UTF_8), out);
    }

    @Test
    void readBytes_missingOrBlankKeyShouldBeNotFound() {
        FileSystemStorageBackend storage = new FileSystemStorageBackend(baseDir);
        assertThrows(NotFoundException.class, () -> storage.readBytes("org-1/none.mp3"));
        assertThrows(NotFoundException.class, () -> storage.readBytes(" "));
    }

    @Test
    void readBytes_shouldRejectPathTraversal() throws Exception {
        Path inner = Files.createDirectories(baseDir.resolve("store"));
        Files.write(baseDir.resolve("secret.txt"), new byte[]{1});

        FileSystemStorageBackend storage = new FileSystemStorageBackend(inner);

        assertThrows(IllegalArgumentException.class, () -> storage.readBytes("../secret.txt"));
    }
}
