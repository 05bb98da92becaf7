package com.phillippitts.simrecon.service.files;

import com.phillippitts.simrecon.exception.UnsupportedPlatformException;

import java.util.Locale;

/**
 * Operating systems with known filename rules.
 */
public enum Platform {
    WINDOWS,
    LINUX,
    MACOS;

    /**
     * Maps a {@code os.name} value to a platform.
     *
     * @param osName value of the {@code os.name} system property
     * @return matching platform
     * @throws UnsupportedPlatformException when the name is not recognised
     */
    public static Platform fromOsName(String osName) {
        if (osName == null || osName.isBlank()) {
            throw new UnsupportedPlatformException(String.valueOf(osName));
        }
        String normalized = osName.toLowerCase(Locale.ROOT);
        if (normalized.startsWith("windows")) {
            return WINDOWS;
        }
        if (normalized.equals("linux")) {
            return LINUX;
        }
        if (normalized.startsWith("mac os") || normalized.equals("darwin")) {
            return MACOS;
        }
        throw new UnsupportedPlatformException(osName);
    }

    public static Platform current() {
        return fromOsName(System.getProperty("os.name"));
    }
}
