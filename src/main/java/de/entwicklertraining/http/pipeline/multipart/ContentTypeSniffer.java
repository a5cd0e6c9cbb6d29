package de.entwicklertraining.http.pipeline.multipart;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Guesses a media type from the first bytes of a stream, following the subset of the
 * WHATWG MIME sniffing algorithm that browsers apply to uploads.
 * <p>
 * At most {@link #SNIFF_LENGTH} bytes are considered. Data that matches no signature is
 * reported as {@code text/plain; charset=utf-8} if it contains no binary control bytes,
 * otherwise as {@code application/octet-stream}.
 */
public final class ContentTypeSniffer {

    /** Number of leading bytes inspected */
    public static final int SNIFF_LENGTH = 512;

    static final String TEXT_PLAIN = "text/plain; charset=utf-8";
    static final String OCTET_STREAM = "application/octet-stream";

    private static final List<String> HTML_TAGS = List.of(
            "<!DOCTYPE HTML", "<HTML", "<HEAD", "<SCRIPT", "<IFRAME", "<H1", "<DIV", "<FONT",
            "<TABLE", "<A", "<STYLE", "<TITLE", "<B", "<BODY", "<BR", "<P", "<!--");

    private record Signature(byte[] mask, byte[] pattern, String mime) {
        boolean matches(byte[] data, int length) {
            if (length < pattern.length) {
                return false;
            }
            for (int i = 0; i < pattern.length; i++) {
                int b = mask == null ? data[i] : data[i] & mask[i];
                if ((byte) b != pattern[i]) {
                    return false;
                }
            }
            return true;
        }
    }

    private static final List<Signature> SIGNATURES = List.of(
            exact("%PDF-", "application/pdf"),
            exact("%!PS-Adobe-", "application/postscript"),
            exact(new byte[]{(byte) 0xFE, (byte) 0xFF}, "text/plain; charset=utf-16be"),
            exact(new byte[]{(byte) 0xFF, (byte) 0xFE}, "text/plain; charset=utf-16le"),
            exact(new byte[]{(byte) 0xEF, (byte) 0xBB, (byte) 0xBF}, TEXT_PLAIN),
            exact(new byte[]{0, 0, 1, 0}, "image/x-icon"),
            exact(new byte[]{0, 0, 2, 0}, "image/x-icon"),
            exact("BM", "image/bmp"),
            exact("GIF87a", "image/gif"),
            exact("GIF89a", "image/gif"),
            masked(new byte[]{(byte) 0xFF, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF, 0, 0, 0, 0,
                            (byte) 0xFF, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF},
                    "RIFF\0\0\0\0WEBPVP".getBytes(StandardCharsets.ISO_8859_1), "image/webp"),
            exact(new byte[]{(byte) 0x89, 'P', 'N', 'G', 0x0D, 0x0A, 0x1A, 0x0A}, "image/png"),
            exact(new byte[]{(byte) 0xFF, (byte) 0xD8, (byte) 0xFF}, "image/jpeg"),
            masked(new byte[]{(byte) 0xFF, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF, 0, 0, 0, 0,
                            (byte) 0xFF, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF},
                    "RIFF\0\0\0\0WAVE".getBytes(StandardCharsets.ISO_8859_1), "audio/wave"),
            masked(new byte[]{(byte) 0xFF, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF, 0, 0, 0, 0,
                            (byte) 0xFF, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF},
                    "RIFF\0\0\0\0AVI ".getBytes(StandardCharsets.ISO_8859_1), "video/avi"),
            exact("ID3", "audio/mpeg"),
            exact(new byte[]{'O', 'g', 'g', 'S', 0}, "application/ogg"),
            exact(new byte[]{'M', 'T', 'h', 'd', 0, 0, 0, 6}, "audio/midi"),
            exact(new byte[]{0x1A, 0x45, (byte) 0xDF, (byte) 0xA3}, "video/webm"),
            exact(new byte[]{0x1F, (byte) 0x8B, 0x08}, "application/x-gzip"),
            exact(new byte[]{'P', 'K', 0x03, 0x04}, "application/zip"),
            exact(new byte[]{'R', 'a', 'r', '!', 0x1A, 0x07, 0x00}, "application/x-rar-compressed"),
            exact(new byte[]{'R', 'a', 'r', '!', 0x1A, 0x07, 0x01, 0x00}, "application/x-rar-compressed"),
            exact(new byte[]{0x00, 0x61, 0x73, 0x6D}, "application/wasm"),
            exact("wOFF", "font/woff"),
            exact("wOF2", "font/woff2"));

    private ContentTypeSniffer() {
    }

    /**
     * Detects the media type of the given data.
     *
     * @param data the leading bytes of the content
     * @param length number of valid bytes in data
     * @return the detected media type, never null
     */
    public static String detect(byte[] data, int length) {
        int n = Math.min(length, SNIFF_LENGTH);

        int firstNonWs = 0;
        while (firstNonWs < n && isWhitespace(data[firstNonWs])) {
            firstNonWs++;
        }
        for (String tag : HTML_TAGS) {
            if (matchesHtmlTag(data, firstNonWs, n, tag)) {
                return "text/html; charset=utf-8";
            }
        }
        if (startsWith(data, firstNonWs, n, "<?xml")) {
            return "text/xml; charset=utf-8";
        }
        for (Signature signature : SIGNATURES) {
            if (signature.matches(data, n)) {
                return signature.mime();
            }
        }
        for (int i = 0; i < n; i++) {
            if (isBinary(data[i])) {
                return OCTET_STREAM;
            }
        }
        return TEXT_PLAIN;
    }

    private static boolean matchesHtmlTag(byte[] data, int offset, int length, String tag) {
        if (length - offset < tag.length() + 1) {
            return false;
        }
        for (int i = 0; i < tag.length(); i++) {
            byte b = data[offset + i];
            if (b >= 'a' && b <= 'z') {
                b -= 0x20;
            }
            if (b != tag.charAt(i)) {
                return false;
            }
        }
        // tag must be terminated by a space or '>'
        byte terminator = data[offset + tag.length()];
        return terminator == ' ' || terminator == '>';
    }

    private static boolean startsWith(byte[] data, int offset, int length, String prefix) {
        if (length - offset < prefix.length()) {
            return false;
        }
        for (int i = 0; i < prefix.length(); i++) {
            if (data[offset + i] != prefix.charAt(i)) {
                return false;
            }
        }
        return true;
    }

    private static boolean isWhitespace(byte b) {
        return b == '\t' || b == '\n' || b == 0x0C || b == '\r' || b == ' ';
    }

    private static boolean isBinary(byte b) {
        return (b >= 0x00 && b <= 0x08) || b == 0x0B || (b >= 0x0E && b <= 0x1A) || (b >= 0x1C && b <= 0x1F);
    }

    private static Signature exact(String pattern, String mime) {
        return new Signature(null, pattern.getBytes(StandardCharsets.ISO_8859_1), mime);
    }

    private static Signature exact(byte[] pattern, String mime) {
        return new Signature(null, pattern, mime);
    }

    private static Signature masked(byte[] mask, byte[] pattern, String mime) {
        return new Signature(mask, pattern, mime);
    }
}
