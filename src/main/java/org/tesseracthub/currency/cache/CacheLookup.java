package org.tesseracthub.currency.cache;

/**
 * Result of a cache read that keeps ignored tier 2 failures visible to the caller.
 *
 * <p>An {@link Outcome#ERROR} lookup carries no value and must be treated like a miss: the caller
 * falls through to the store rather than failing the request.
 */
public record CacheLookup<T>(Outcome outcome, T value) {

  public enum Outcome {
    LOCAL_HIT,
    SHARED_HIT,
    MISS,
    ERROR
  }

  public static <T> CacheLookup<T> localHit(T value) {
    return new CacheLookup<>(Outcome.LOCAL_HIT, value);
  }

  public static <T> CacheLookup<T> sharedHit(T value) {
    return new CacheLookup<>(Outcome.SHARED_HIT, value);
  }

  public static <T> CacheLookup<T> miss() {
    return new CacheLookup<>(Outcome.MISS, null);
  }

  public static <T> CacheLookup<T> error() {
    return new CacheLookup<>(Outcome.ERROR, null);
  }

  public boolean found() {
    return value != null;
  }

  public boolean errorIgnored() {
    return outcome == Outcome.ERROR;
  }
}
