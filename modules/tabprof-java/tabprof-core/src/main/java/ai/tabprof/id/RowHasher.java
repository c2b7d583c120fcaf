package ai.tabprof.id;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.UUID;

/**
 * Content hash of a row: MD5 over the canonical row string, packed into 128 bits.
 * <p>
 * Canonical form joins every value in column order with {@link #DELIMITER}, null values written as empty strings.
 * Values containing the delimiter (U+001F, unit separator) may produce colliding canonical strings: a row
 * {@code [x<US>y, ""]} hashes the same as {@code [x, y<US>]}. The unit separator is not expected in text data.
 * <p>
 * Not thread-safe: keeps a single digest instance.
 */
public class RowHasher {

    public static final char DELIMITER = '\u001F';

    private final MessageDigest md;
    private final StringBuilder buffer = new StringBuilder(256);

    public RowHasher() {
        try {
            md = MessageDigest.getInstance("MD5");
        } catch (NoSuchAlgorithmException e) {
            throw new InternalError("MD5 not supported");
        }
    }

    public String canonical(String[] row) {
        buffer.setLength(0);
        for (int i = 0; i < row.length; i++) {
            if (i > 0) {
                buffer.append(DELIMITER);
            }
            if (row[i] != null) {
                buffer.append(row[i]);
            }
        }
        return buffer.toString();
    }

    public UUID hash(String[] row) {
        byte[] digest = md.digest(canonical(row).getBytes(StandardCharsets.UTF_8));
        return bytesToUuid(digest);
    }

    /**
     * Convert first 16 bytes of the digest to UUID using unrolled loop.
     *
     * @param bytes digest bytes, at least 16
     * @return 128-bit value
     */
    protected static UUID bytesToUuid(byte[] bytes) {
        long msb = ((long) bytes[0] << 56)
            | ((long) bytes[1] & 0xff) << 48
            | ((long) bytes[2] & 0xff) << 40
            | ((long) bytes[3] & 0xff) << 32
            | ((long) bytes[4] & 0xff) << 24
            | ((long) bytes[5] & 0xff) << 16
            | ((long) bytes[6] & 0xff) << 8
            | ((long) bytes[7] & 0xff);

        long lsb = ((long) bytes[8] << 56)
            | ((long) bytes[9] & 0xff) << 48
            | ((long) bytes[10] & 0xff) << 40
            | ((long) bytes[11] & 0xff) << 32
            | ((long) bytes[12] & 0xff) << 24
            | ((long) bytes[13] & 0xff) << 16
            | ((long) bytes[14] & 0xff) << 8
            | ((long) bytes[15] & 0xff);

        return new UUID(msb, lsb);
    }

}
