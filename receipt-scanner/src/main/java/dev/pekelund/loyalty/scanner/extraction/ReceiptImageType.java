package dev.pekelund.loyalty.scanner.extraction;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import org.springframework.util.MimeType;
import org.springframework.util.MimeTypeUtils;

/**
 * Image formats a phone camera produces, recognised by their leading bytes.
 */
enum ReceiptImageType {

    JPEG(MimeTypeUtils.IMAGE_JPEG),
    PNG(MimeTypeUtils.IMAGE_PNG),
    WEBP(new MimeType("image", "webp")),
    HEIC(new MimeType("image", "heic"));

    private static final byte[] PNG_SIGNATURE = {(byte) 0x89, 'P', 'N', 'G', '\r', '\n', 0x1A, '\n'};

    private final MimeType mimeType;

    ReceiptImageType(MimeType mimeType) {
        this.mimeType = mimeType;
    }

    MimeType mimeType() {
        return mimeType;
    }

    /**
     * Unrecognised signatures are treated as JPEG.
     */
    static ReceiptImageType detect(byte[] bytes) {
        if (startsWith(bytes, new byte[] {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF})) {
            return JPEG;
        }
        if (startsWith(bytes, PNG_SIGNATURE)) {
            return PNG;
        }
        if (bytes.length >= 12 && ascii(bytes, 0, 4).equals("RIFF") && ascii(bytes, 8, 12).equals("WEBP")) {
            return WEBP;
        }
        if (bytes.length >= 12 && ascii(bytes, 4, 8).equals("ftyp")) {
            String brand = ascii(bytes, 8, 12);
            if (brand.startsWith("hei") || brand.startsWith("hev") || brand.equals("mif1") || brand.equals("msf1")) {
                return HEIC;
            }
        }
        return JPEG;
    }

    private static boolean startsWith(byte[] bytes, byte[] prefix) {
        return bytes.length >= prefix.length && Arrays.equals(bytes, 0, prefix.length, prefix, 0, prefix.length);
    }

    private static String ascii(byte[] bytes, int from, int to) {
        return new String(bytes, from, to - from, StandardCharsets.US_ASCII);
    }
}
