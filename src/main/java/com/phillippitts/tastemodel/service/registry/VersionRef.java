package com.phillippitts.tastemodel.service.registry;

/**
 * Either an explicit version number or the {@code latest} pointer.
 */
public record VersionRef(Integer version) {

    private static final VersionRef LATEST = new VersionRef(null);

    public VersionRef {
        if (version != null && version < 1) {
            throw new IllegalArgumentException("Version must be positive, got: " + version);
        }
    }

    public static VersionRef latest() {
        return LATEST;
    }

    public static VersionRef of(int version) {
        return new VersionRef(version);
    }

    /**
     * Parses {@code "latest"}, {@code "v3"} or {@code "3"}.
     */
    public static VersionRef parse(String text) {
        if (text == null || text.isBlank() || "latest".equalsIgnoreCase(text.trim())) {
            return LATEST;
        }
        String t = text.trim();
        if (t.startsWith("v") || t.startsWith("V")) {
            t = t.substring(1);
        }
        return of(Integer.parseInt(t));
    }

    public boolean isLatest() {
        return version == null;
    }

    @Override
    public String toString() {
        return isLatest() ? "latest" : "v" + version;
    }
}
