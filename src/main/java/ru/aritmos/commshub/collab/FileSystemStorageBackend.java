package ru.aritmos.commshub.collab;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import ru.aritmos.commshub.config.CommsHubProperties;
import ru.aritmos.commshub.core.NotFoundException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Хранилище записей на локальном диске. Ключ задаёт относительный путь внутри базового каталога.
 */
@Singleton
public class FileSystemStorageBackend implements StorageBackend {

    private final Path baseDir;

    @Inject
    public FileSystemStorageBackend(CommsHubProperties properties) {
        this(Path.of(properties.getStorage().getBaseDir()));
    }

    public FileSystemStorageBackend(Path baseDir) {
        this.baseDir = baseDir.toAbsolutePath().normalize();
    }

    @Override
    public byte[] readBytes(String key) {
        if (key == null || key.isBlank()) {
            throw new NotFoundException("storage", "Ключ хранилища не задан");
        }
        Path target = baseDir.resolve(key).normalize();
        if (!target.startsWith(baseDir)) {
            throw new IllegalArgumentException("Ключ хранилища выходит за пределы базового каталога");
        }
        try {
            return Files.readAllBytes(target);
        } catch (NoSuchFileException e) {
            throw new NotFoundException("storage", "Объект хранилища не найден");
        } catch (IOException e) {
            throw new UncheckedIOException("Не удалось прочитать объект хранилища", e);
        }
    }
}
