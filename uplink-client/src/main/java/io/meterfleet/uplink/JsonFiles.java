package io.meterfleet.uplink;

import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Whole-file JSON reads and writes. A write goes to a sibling temp file and is moved over the
 * target, so readers never observe a half-written document. There is no locking across
 * processes: concurrent writers are last-writer-wins.
 */
public final class JsonFiles {

    private JsonFiles() {
    }

    public static Optional<JSONObject> read(Path file) throws IOException {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        String content = Files.readString(file, StandardCharsets.UTF_8);
        if (content.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new JSONObject(content));
        } catch (JSONException e) {
            throw new IOException("Malformed JSON in " + file + ": " + e.getMessage(), e);
        }
    }

    public static void write(Path file, JSONObject document) throws IOException {
        Path absolute = file.toAbsolutePath();
        Path parent = absolute.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = Files.createTempFile(parent, absolute.getFileName().toString(), ".tmp");
        try {
            Files.writeString(temp, document.toString(2), StandardCharsets.UTF_8);
            try {
                Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }
}
