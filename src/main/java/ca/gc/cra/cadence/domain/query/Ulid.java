package ca.gc.cra.cadence.domain.query;

import java.time.Instant;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Generates ULID-style opaque identifiers for queries and results.
 * <p>Stateless and thread-safe; uses {@link ThreadLocalRandom}, so identifiers are unique in practice but not
 * suitable for cryptographic purposes.</p>
 *
 * @since 0.1.0
 */
final class Ulid {
  private static final char[] ENC = "0123456789ABCDEFGHJKMNPQRSTVWXYZ".toCharArray();

  private Ulid() {}

  /**
   * Generates a lexicographically sortable identifier composed of the current time and random bits.
   *
   * @return 26-character identifier
   */
  static String next() {
    ThreadLocalRandom random = ThreadLocalRandom.current();
    return encode(Instant.now().toEpochMilli(), random.nextLong(), random.nextLong());
  }

  private static String encode(long epochMillis, long r1, long r2) {
    char[] out = new char[26];
    long time = epochMillis;
    for (int i = 9; i >= 0; i--) {
      out[i] = ENC[(int) (time & 31)];
      time >>>= 5;
    }
    long high = (r1 << 16) | ((r2 >>> 48) & 0xFFFFL);
    long low = r2 & 0x0000FFFFFFFFFFFFL;
    for (int i = 25; i >= 18; i--) {
      out[i] = ENC[(int) (low & 31)];
      low >>>= 5;
    }
    for (int i = 17; i >= 10; i--) {
      out[i] = ENC[(int) (high & 31)];
      high >>>= 5;
    }
    return new String(out);
  }
}
