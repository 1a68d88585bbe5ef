package info.isaksson.erland.modelimport.apply;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HashSet;
import java.util.Set;

/**
 * SHA-256 of {@code seed|prefix|sourceKey}, truncated to 16 bytes. A repeated key gets a
 * {@code #n} suffix mixed in, so ids stay unique and still depend only on the input order.
 */
final class HashedIdAllocator implements IdAllocator {

    private final String seed;
    private final Set<String> issued = new HashSet<>();

    HashedIdAllocator(String seed) {
        if (seed == null) throw new IllegalArgumentException("seed must not be null");
        this.seed = seed;
    }

    @Override
    public String next(String prefix, String sourceKey) {
        String base = seed + "|" + prefix + "|" + (sourceKey == null ? "" : sourceKey);
        String id = prefix + "_" + hash(base);
        for (int n = 2; !issued.add(id); n++) {
            id = prefix + "_" + hash(base + "#" + n);
        }
        return id;
    }

    static String hash(String key) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] digest = md.digest(key.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < 16; i++) {
                sb.append(String.format("%02x", digest[i]));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            // SHA-256 is guaranteed in the JRE.
            throw new IllegalStateException(e);
        }
    }
}
