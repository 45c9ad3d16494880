package app.lexis.core.sync.domain;

import java.util.regex.Pattern;

/**
 * Key of a learner's remote partition. Becomes a path segment on the remote
 * store, so characters the store reserves are rejected.
 */
public record SyncIdentity(String key) {

    private static final Pattern RESERVED = Pattern.compile("[./#$\\[\\]\\s]");

    public SyncIdentity {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Sync key is required");
        }
        key = key.trim();
        if (RESERVED.matcher(key).find()) {
            throw new IllegalArgumentException("Sync key contains reserved characters: " + key);
        }
    }

    /**
     * @return identity for {@code raw}, or {@code null} when it is blank (local-only mode)
     */
    public static SyncIdentity parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return new SyncIdentity(raw);
    }

    @Override
    public String toString() {
        return key;
    }
}
