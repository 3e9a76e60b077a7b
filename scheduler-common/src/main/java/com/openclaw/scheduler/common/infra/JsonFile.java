package com.openclaw.scheduler.common.infra;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Set;
import java.util.UUID;

/**
 * JSON file load/save with atomic replacement and owner-only permissions.
 */
public final class JsonFile {

    private JsonFile() {
    }

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * Load and parse a JSON file. Returns null if the file does not exist or is
     * invalid.
     */
    public static <T> T load(Path path, Class<T> type) {
        try {
            if (!Files.exists(path))
                return null;
            String raw = Files.readString(path);
            return MAPPER.readValue(raw, type);
        } catch (Exception e) {
            return null;
        }
    }

    /**
     * Read a file as UTF-8, or null when it does not exist.
     */
    public static String readString(Path path) throws IOException {
        if (!Files.exists(path)) {
            return null;
        }
        return Files.readString(path, StandardCharsets.UTF_8);
    }

    /**
     * Serialize data and write it atomically.
     */
    public static void save(Path path, Object data) throws IOException {
        writeAtomic(path, MAPPER.writeValueAsString(data) + "\n", false);
    }

    /**
     * Write content through a temp file and an atomic move. Identical content
     * is left untouched. With {@code backup}, differing previous content is
     * copied to {@code <path>.bak} first.
     *
     * @return true if the file was written
     */
    public static boolean writeAtomic(Path path, String content, boolean backup) throws IOException {
        Path dir = path.toAbsolutePath().getParent();
        if (dir != null && !Files.exists(dir)) {
            Files.createDirectories(dir);
        }
        String previous = readString(path);
        if (content.equals(previous)) {
            return false;
        }
        if (backup && previous != null) {
            Path bak = path.resolveSibling(path.getFileName() + ".bak");
            Files.writeString(bak, previous, StandardCharsets.UTF_8);
            restrictPermissions(bak);
        }

        Path tmp = path.resolveSibling(path.getFileName() + "." + UUID.randomUUID() + ".tmp");
        try {
            Files.writeString(tmp, content, StandardCharsets.UTF_8);
            restrictPermissions(tmp);
            try {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
        return true;
    }

    private static void restrictPermissions(Path path) throws IOException {
        try {
            Set<PosixFilePermission> perms = PosixFilePermissions.fromString("rw-------");
            Files.setPosixFilePermissions(path, perms);
        } catch (UnsupportedOperationException ignored) {
            // Non-POSIX (e.g. Windows), skip
        }
    }
}
