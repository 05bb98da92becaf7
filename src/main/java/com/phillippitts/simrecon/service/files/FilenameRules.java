package com.phillippitts.simrecon.service.files;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Per-platform filename sanitization: invalid characters become {@code _} and designated
 * trailing characters are stripped.
 *
 * <p>Trailing characters are stripped before substitution, so a trailing invalid
 * character is replaced rather than removed.
 *
 * @param platform platform the rules apply to
 * @param invalidCharacters characters replaced with {@code _}
 * @param trailingStrip characters removed from the end of the name
 */
public record FilenameRules(Platform platform, String invalidCharacters, String trailingStrip) {

    private static final Logger LOG = LogManager.getLogger(FilenameRules.class);

    private static final Map<Platform, FilenameRules> TABLE = new EnumMap<>(Platform.class);

    static {
        TABLE.put(Platform.WINDOWS, new FilenameRules(Platform.WINDOWS, "<>:\"/\\|?*", " ."));
        TABLE.put(Platform.LINUX, new FilenameRules(Platform.LINUX, "/", " "));
        TABLE.put(Platform.MACOS, new FilenameRules(Platform.MACOS, "/:", " "));
    }

    public FilenameRules {
        Objects.requireNonNull(platform, "platform");
        Objects.requireNonNull(invalidCharacters, "invalidCharacters");
        Objects.requireNonNull(trailingStrip, "trailingStrip");
    }

    public static FilenameRules forPlatform(Platform platform) {
        return TABLE.get(Objects.requireNonNull(platform, "platform"));
    }

    /**
     * Rules for the running OS.
     *
     * @throws com.phillippitts.simrecon.exception.UnsupportedPlatformException for unknown systems
     */
    public static FilenameRules forCurrentPlatform() {
        return forPlatform(Platform.current());
    }

    /**
     * Returns a filename that is valid on this platform.
     *
     * @param filename bare filename (no directory)
     * @return sanitized filename
     */
    public String sanitize(String filename) {
        Objects.requireNonNull(filename, "filename");
        int end = filename.length();
        while (end > 0 && trailingStrip.indexOf(filename.charAt(end - 1)) >= 0) {
            end--;
        }
        String stripped = filename.substring(0, end);
        StringBuilder sb = new StringBuilder(stripped.length());
        for (int i = 0; i < stripped.length(); i++) {
            char c = stripped.charAt(i);
            sb.append(invalidCharacters.indexOf(c) >= 0 ? '_' : c);
        }
        String sanitized = sb.toString();
        if (!sanitized.equals(filename)) {
            LOG.debug("Removed invalid filename characters: '{}' is now '{}'", filename, sanitized);
        }
        return sanitized;
    }
}
