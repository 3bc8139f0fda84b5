package org.tesseracthub.currency.service;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Collapses concurrent calls for the same key into one execution.
 *
 * <p>The first caller for a key runs the work on its own thread; callers arriving while it is in
 * flight block and receive the same result or the same exception. Once the work completes the key
 * is released, so later calls run the work again. Nothing is memoized.
 *
 * @param <K> key type
 * @param <V> result type
 */
public class SingleFlight<K, V> {

  private final ConcurrentHashMap<K, CompletableFuture<V>> inFlight = new ConcurrentHashMap<>();

  public V execute(K key, Supplier<V> work) {
    var future = new CompletableFuture<V>();
    var existing = inFlight.putIfAbsent(key, future);
    if (existing != null) {
      return await(existing);
    }

    try {
      var value = work.get();
      future.complete(value);
      return value;
    } catch (RuntimeException | Error e) {
      future.completeExceptionally(e);
      throw e;
    } finally {
      inFlight.remove(key, future);
    }
  }

  int inFlightCount() {
    return inFlight.size();
  }

  private V await(CompletableFuture<V> future) {
    try {
      return future.join();
    } catch (CompletionException e) {
      if (e.getCause() instanceof RuntimeException runtimeException) {
        throw runtimeException;
      }
      if (e.getCause() instanceof Error error) {
        throw error;
      }
      throw e;
    }
  }
}
