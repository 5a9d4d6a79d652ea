package configstore.domain.store;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Escapes "/", "%" and NUL as %XX with uppercase hex digits. Everything else, including non ASCII text, passes
 * through unchanged.
 * <p>
 * Decoding is total: it never fails, and a "%" that is not followed by two hex digits is copied as is. Escaped
 * bytes are collected and decoded as UTF-8, so "%C3%A9" decodes to "é".
 */
public final class PercentKeyCodec implements KeyCodec {
    static final PercentKeyCodec INSTANCE = new PercentKeyCodec();

    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    private PercentKeyCodec() {
    }

    @Override
    public String encode(final String key) {
        if (key.isEmpty()) {
            return key;
        }

        final StringBuilder builder = new StringBuilder(key.length());
        for (int i = 0; i < key.length(); i++) {
            final char c = key.charAt(i);
            if (c == '/' || c == '%' || c == '\0') {
                builder.append('%').append(HEX[c >> 4]).append(HEX[c & 0x0f]);
            } else {
                builder.append(c);
            }
        }
        return builder.toString();
    }

    @Override
    public String decode(final String encoded) {
        if (encoded.isEmpty()) {
            return encoded;
        }

        final StringBuilder builder = new StringBuilder(encoded.length());
        final ByteArrayOutputStream escaped = new ByteArrayOutputStream();
        int i = 0;
        while (i < encoded.length()) {
            final char c = encoded.charAt(i);
            if (c == '%' && i + 2 < encoded.length()) {
                final int hi = fromHex(encoded.charAt(i + 1));
                final int lo = fromHex(encoded.charAt(i + 2));
                if (hi >= 0 && lo >= 0) {
                    escaped.write((hi << 4) | lo);
                    i += 3;
                    continue;
                }
            }

            flush(escaped, builder);
            builder.append(c);
            i++;
        }
        flush(escaped, builder);
        return builder.toString();
    }

    private static void flush(final ByteArrayOutputStream escaped, final StringBuilder builder) {
        if (escaped.size() > 0) {
            builder.append(new String(escaped.toByteArray(), StandardCharsets.UTF_8));
            escaped.reset();
        }
    }

    /**
     * ASCII hex digits only. Character.digit would also accept non ASCII digits.
     */
    private static int fromHex(final char c) {
        if (c >= '0' && c <= '9') {
            return c - '0';
        }
        if (c >= 'a' && c <= 'f') {
            return c - 'a' + 10;
        }
        if (c >= 'A' && c <= 'F') {
            return c - 'A' + 10;
        }
        return -1;
    }
}
