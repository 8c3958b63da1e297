package dev.hitrank.hits;

/**
 * Thrown when a {@link TopHits} list cannot allocate room for more hits: the requested capacity
 * exceeds the list's maximum capacity, overflows {@code int}, or the JVM runs out of memory while
 * allocating the grown arrays.
 *
 * <p>The list that threw is left exactly as it was before the call.
 */
public class TopHitsCapacityException extends RuntimeException {

  private final long requestedCapacity;

  public TopHitsCapacityException(String message, long requestedCapacity) {
    super(message);
    this.requestedCapacity = requestedCapacity;
  }

  public TopHitsCapacityException(String message, long requestedCapacity, Throwable cause) {
    super(message, cause);
    this.requestedCapacity = requestedCapacity;
  }

  /** Capacity, in hits, that could not be allocated. */
  public long getRequestedCapacity() {
    return requestedCapacity;
  }
}
