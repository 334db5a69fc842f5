package work.lcod.docpath.hash;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import work.lcod.docpath.error.UnsupportedHashTypeException;
import work.lcod.docpath.shared.DocumentValues;

/**
 * Deterministic 64-bit fingerprint of a document.
 *
 * <p>Object keys are fed in sorted order so key iteration order never changes the result; array
 * elements are fed in their original order.
 */
public final class DocumentHasher {
    private static final int HASH_BYTES = Long.BYTES;

    private DocumentHasher() {}

    public static long hash(Map<String, ?> document) {
        return ByteBuffer.wrap(digest(document)).getLong();
    }

    public static String hashString(Map<String, ?> document) {
        return Base64.getEncoder().encodeToString(digest(document));
    }

    private static byte[] digest(Map<String, ?> document) {
        MessageDigest digest = newDigest();
        feedObject(digest, document);
        return Arrays.copyOf(digest.digest(), HASH_BYTES);
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 algorithm unavailable", ex);
        }
    }

    private static void feedObject(MessageDigest digest, Map<?, ?> object) {
        List<String> keys = new ArrayList<>(object.size());
        for (Object key : object.keySet()) {
            keys.add(String.valueOf(key));
        }
        Collections.sort(keys);
        for (String key : keys) {
            feedText(digest, key);
            feedValue(digest, key, object.get(key));
        }
    }

    private static void feedValue(MessageDigest digest, String key, Object value) {
        if (value == null) {
            feedText(digest, "null");
        } else if (value instanceof String text) {
            feedText(digest, text);
        } else if (value instanceof byte[] bytes) {
            digest.update(bytes);
        } else if (value instanceof Boolean flag) {
            feedText(digest, flag ? "true" : "false");
        } else if (value instanceof Map<?, ?> object) {
            feedObject(digest, object);
        } else if (value instanceof List<?> array) {
            for (Object item : array) {
                feedValue(digest, key, item);
            }
        } else if (value instanceof Number number) {
            feedText(digest, formatNumber(key, number));
        } else {
            throw new UnsupportedHashTypeException(key, DocumentValues.typeName(value));
        }
    }

    private static String formatNumber(String key, Number number) {
        if (number instanceof Integer || number instanceof Long || number instanceof Short
            || number instanceof Byte || number instanceof BigInteger) {
            return number.toString();
        }
        if (number instanceof Double || number instanceof Float || number instanceof BigDecimal) {
            return String.format(Locale.ROOT, "%f", number);
        }
        throw new UnsupportedHashTypeException(key, DocumentValues.typeName(number));
    }

    private static void feedText(MessageDigest digest, String text) {
        digest.update(text.getBytes(StandardCharsets.UTF_8));
    }
}
