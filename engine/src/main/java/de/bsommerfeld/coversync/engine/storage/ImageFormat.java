package de.bsommerfeld.coversync.engine.storage;

import java.util.Locale;
import java.util.Set;

/**
 * Image formats a cover file may have, with the extension used when writing
 * one. The format is sniffed from the leading bytes; anything unrecognized
 * is written as JPEG, which is what tag extractors hand out most of the time.
 */
public enum ImageFormat {

    JPEG("jpg"),
    PNG("png"),
    WEBP("webp");

    /**
     * Extensions accepted when scanning cover directories.
     */
    public static final Set<String> COVER_EXTENSIONS = Set.of("jpg", "jpeg", "png", "webp");

    private static final byte[] PNG_SIGNATURE = {(byte) 0x89, 'P', 'N', 'G', '\r', '\n', 0x1A, '\n'};

    private final String extension;

    ImageFormat(String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }

    public static ImageFormat sniff(byte[] bytes) {
        if (startsWith(bytes, PNG_SIGNATURE, 0)) {
            return PNG;
        }
        if (bytes.length >= 12
                && startsWith(bytes, new byte[]{'R', 'I', 'F', 'F'}, 0)
                && startsWith(bytes, new byte[]{'W', 'E', 'B', 'P'}, 8)) {
            return WEBP;
        }
        return JPEG;
    }

    /**
     * Whether the file name ends in one of {@link #COVER_EXTENSIONS},
     * ignoring case.
     */
    public static boolean hasCoverExtension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        if (dot <= 0 || dot == fileName.length() - 1) {
            return false;
        }
        return COVER_EXTENSIONS.contains(fileName.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    private static boolean startsWith(byte[] bytes, byte[] prefix, int offset) {
        if (bytes.length < offset + prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (bytes[offset + i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }
}
