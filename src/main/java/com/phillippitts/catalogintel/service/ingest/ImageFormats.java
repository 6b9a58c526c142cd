package com.phillippitts.catalogintel.service.ingest;

import com.phillippitts.catalogintel.exception.IngestException;
import com.phillippitts.catalogintel.exception.StageErrorType;
import com.phillippitts.catalogintel.util.Digests;

import java.util.Locale;
import java.util.Set;

/**
 * Image extension rules and cache file naming.
 */
public final class ImageFormats {

    public static final Set<String> SUPPORTED_EXTENSIONS = Set.of(".jpg", ".jpeg", ".png", ".webp", ".bmp");
    public static final String DEFAULT_EXTENSION = ".jpg";

    private static final int DIGEST_CHARS = 10;

    private ImageFormats() {
    }

    /**
     * Extension of the reference's last path segment, ignoring any query string.
     * A reference without an extension is assumed to be a JPEG.
     *
     * @throws IngestException unsupported_format for any other extension
     */
    public static String extensionOf(String reference) {
        String path = reference;
        int query = path.indexOf('?');
        if (query >= 0) {
            path = path.substring(0, query);
        }
        int fragment = path.indexOf('#');
        if (fragment >= 0) {
            path = path.substring(0, fragment);
        }
        String name = path.substring(path.lastIndexOf('/') + 1);
        int dot = name.lastIndexOf('.');
        if (dot <= 0 || dot == name.length() - 1) {
            return DEFAULT_EXTENSION;
        }
        String ext = name.substring(dot).toLowerCase(Locale.ROOT);
        if (!SUPPORTED_EXTENSIONS.contains(ext)) {
            throw new IngestException(StageErrorType.UNSUPPORTED_FORMAT, "Unsupported image type '" + ext + "'");
        }
        return ext;
    }

    /**
     * {@code <slug>_<first 10 hex chars of sha1(url)><ext>}.
     */
    public static String cachedFileName(String productId, String imageUrl, String extension) {
        return slug(productId) + "_" + Digests.sha1Hex(imageUrl).substring(0, DIGEST_CHARS) + extension;
    }

    static String slug(String productId) {
        String slug = productId.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-");
        slug = slug.replaceAll("^-+", "").replaceAll("-+$", "");
        return slug.isEmpty() ? "product" : slug;
    }
}
