package io.triage.sdk.session;

import io.triage.sdk.internal.Json;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.Optional;

/**
 * Mirrors the session into a JSON file. Writes go through a sibling temp file and an atomic move so a crash never
 * leaves a half-written document behind.
 */
public final class FileSessionMirror implements SessionMirror {

    private final Path file;

    public FileSessionMirror(Path file) {
        this.file = Objects.requireNonNull(file, "file");
    }

    @Override
    public void save(MirroredSession session) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        Files.write(tmp, Json.bytes(session));
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    @Override
    public Optional<MirroredSession> load() throws IOException {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        return Optional.of(Json.mapper().readValue(file.toFile(), MirroredSession.class));
    }

    @Override
    public void clear() throws IOException {
        Files.deleteIfExists(file);
    }

    public Path getFile() {
        return file;
    }
}
