package alpha.tinyhttp.util;

import java.nio.file.Path;
import java.util.Map;

import static java.util.Locale.ROOT;

/**
 * Utils for media types.
 */
public final class MediaTypes
{
    private static final Map<String, String> BY_EXTENSION = Map.of(
            "html", "text/html",
            "htm",  "text/html",
            "css",  "text/css",
            "js",   "application/javascript",
            "json", "application/json",
            "png",  "image/png",
            "jpg",  "image/jpeg",
            "jpeg", "image/jpeg",
            "gif",  "image/gif");

    /** Media type used when no other is known. */
    public static final String FALLBACK = "text/plain";

    private MediaTypes() {
        // Empty
    }

    /**
     * Guesses the media type of a file based on its extension.<p>
     *
     * The extension is matched case-insensitively. A file without an
     * extension, or with an extension not known, gets {@value #FALLBACK}.
     *
     * @param file to guess type of
     * @return a media type (never {@code null})
     * @throws NullPointerException if {@code file} is {@code null}
     */
    public static String guess(Path file) {
        var name = file.getFileName();
        return name == null ? FALLBACK : guess(name.toString());
    }

    /**
     * Guesses the media type of a file name based on its extension.
     *
     * @param fileName to guess type of
     * @return a media type (never {@code null})
     * @throws NullPointerException if {@code fileName} is {@code null}
     * @see #guess(Path)
     */
    public static String guess(String fileName) {
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            return FALLBACK;
        }
        String ext = fileName.substring(dot + 1).toLowerCase(ROOT);
        return BY_EXTENSION.getOrDefault(ext, FALLBACK);
    }
}
