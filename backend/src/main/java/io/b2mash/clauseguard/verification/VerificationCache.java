package io.b2mash.clauseguard.verification;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.b2mash.clauseguard.clause.ClauseInput;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Caches verification reports keyed on a SHA-256 of the normalized request. Verification itself is
 * stateless; this cache only lives at the API layer. Concurrent requests for the same key share
 * one verification, and failed verifications are not cached.
 */
@Component
public class VerificationCache {

  private static final Logger log = LoggerFactory.getLogger(VerificationCache.class);

  private final boolean enabled;
  private final Cache<String, ConsistencyReport> reports;

  public VerificationCache(VerificationCacheProperties properties) {
    this.enabled = properties.enabled();
    this.reports =
        Caffeine.newBuilder()
            .maximumSize(properties.maximumSize())
            .expireAfterWrite(properties.expireAfter())
            .build();
  }

  public ConsistencyReport get(
      VerificationMode mode, List<ClauseInput> clauses, Supplier<ConsistencyReport> loader) {
    if (!enabled) {
      return loader.get();
    }
    String key = cacheKey(mode, clauses);
    return reports.get(
        key,
        k -> {
          log.debug("Verification cache miss: key={}", k);
          return loader.get();
        });
  }

  public long size() {
    reports.cleanUp();
    return reports.estimatedSize();
  }

  /**
   * Clause text is lower-cased because every extraction and qualifier match is case-insensitive;
   * ids are kept verbatim since reports echo them.
   */
  static String cacheKey(VerificationMode mode, List<ClauseInput> clauses) {
    var canonical = new StringBuilder(String.valueOf(mode));
    for (ClauseInput clause : clauses) {
      canonical
          .append('\u001e')
          .append(clause.id())
          .append('\u001f')
          .append(clause.text() == null ? null : clause.text().toLowerCase(Locale.ROOT))
          .append('\u001f')
          .append(clause.category())
          .append('\u001f')
          .append(clause.value());
    }
    try {
      var digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of()
          .formatHex(digest.digest(canonical.toString().getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
