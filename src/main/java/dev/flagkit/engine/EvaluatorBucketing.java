package dev.flagkit.engine;

import org.apache.commons.codec.digest.DigestUtils;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;

/**
 * Encapsulates the logic for percentage rollouts.
 * <p>
 * The bucket of a context is computed from SHA-256 of {@code salt + ":" + featureKey + ":" + stableIdHex}
 * in UTF-8: the first four digest bytes are read as a big-endian unsigned 32-bit integer and reduced
 * modulo {@link #RESOLUTION}. This reduction must never change, since changing it would move every
 * user to a different bucket.
 */
abstract class EvaluatorBucketing {
  private EvaluatorBucketing() {}

  /**
   * Size of the bucket space; one bucket is one basis point of a percentage.
   */
  static final int RESOLUTION = 10_000;

  /**
   * Bucket used for contexts that have no stable id. Being the last bucket, it is only inside a
   * rollout at 100%.
   */
  static final int MISSING_STABLE_ID_BUCKET = RESOLUTION - 1;

  static int bucket(String salt, String featureKey, StableId stableId) {
    if (stableId == null) {
      return MISSING_STABLE_ID_BUCKET;
    }
    return bucket(salt, featureKey, stableId.getHexId());
  }

  // DigestUtils.sha256 obtains a new MessageDigest for every call, so no digest state is shared
  // between threads.
  static int bucket(String salt, String featureKey, String stableIdHex) {
    byte[] hash = DigestUtils.sha256((salt + ":" + featureKey + ":" + stableIdHex).getBytes(StandardCharsets.UTF_8));
    long value = ((hash[0] & 0xFFL) << 24) |
        ((hash[1] & 0xFFL) << 16) |
        ((hash[2] & 0xFFL) << 8) |
        (hash[3] & 0xFFL);
    return (int)(value % RESOLUTION);
  }

  // Floors the percentage's decimal value in basis points, so 33.33 is 3333 and 12.345 is 1234.
  static int thresholdBasisPoints(double rollout) {
    return BigDecimal.valueOf(rollout).movePointRight(2).setScale(0, RoundingMode.FLOOR).intValue();
  }

  static boolean isInRampUp(double rollout, int bucket) {
    if (rollout <= 0.0) {
      return false;
    }
    if (rollout >= 100.0) {
      return true;
    }
    return bucket < thresholdBasisPoints(rollout);
  }
}
