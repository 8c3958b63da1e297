package dev.hitrank.hits;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.IntStream;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ranked list of scored hits.
 *
 * <p>Hits live in an append-only record array; a second array of record indices gives rank order
 * (descending {@link Hit#getSortKey()}). The two are kept consistent through a small state machine:
 *
 * <ul>
 *   <li>{@link State#SORTED} - the index array is a valid ranking of all hits
 *   <li>{@link State#UNSORTED} - hits were appended since the last {@link #sort()}; rank-order
 *       reads are rejected
 *   <li>{@link State#DRAINED} - the hits were moved into another list by {@link #merge(TopHits)};
 *       only {@link #close()} is allowed
 *   <li>{@link State#CLOSED} - released; every call except {@link #close()} is rejected
 * </ul>
 *
 * <p>Capacity doubles on demand. Because the ranking holds indices rather than references into
 * the record array, growth never invalidates it; {@link #merge(TopHits)} only has to rebase the
 * moved indices by the destination's previous size.
 *
 * <p>Not thread-safe. Parallel producers each fill their own list and a single coordinator merges
 * them afterwards.
 */
public class TopHits implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(TopHits.class);

  /** Initial capacity of a list created with the no-arg constructor. */
  public static final int DEFAULT_CAPACITY = 256;

  /** Largest array the JVM reliably allocates. */
  public static final int MAX_ARRAY_CAPACITY = Integer.MAX_VALUE - 8;

  private static final Hit[] NO_RECORDS = new Hit[0];
  private static final int[] NO_ORDER = new int[0];

  /** Lifecycle state of a list. */
  public enum State {
    SORTED,
    UNSORTED,
    DRAINED,
    CLOSED
  }

  private final int maxCapacity;

  private Hit[] records;
  private int[] order;
  private int size;
  private int reportedCount;
  private State state;

  /** Creates an empty list with {@link #DEFAULT_CAPACITY}. */
  public TopHits() {
    this(DEFAULT_CAPACITY, MAX_ARRAY_CAPACITY);
  }

  /**
   * Creates an empty list.
   *
   * @param initialCapacity number of hits allocated up front (at least 1)
   * @param maxCapacity upper bound on growth and merges; exceeding it throws {@link
   *     TopHitsCapacityException}
   */
  public TopHits(int initialCapacity, int maxCapacity) {
    if (initialCapacity < 1) {
      throw new IllegalArgumentException(
          "initialCapacity must be at least 1, got: " + initialCapacity);
    }
    if (maxCapacity < initialCapacity || maxCapacity > MAX_ARRAY_CAPACITY) {
      throw new IllegalArgumentException(
          "maxCapacity must be in [%d, %d], got: %d"
              .formatted(initialCapacity, MAX_ARRAY_CAPACITY, maxCapacity));
    }
    this.maxCapacity = maxCapacity;
    this.records = new Hit[initialCapacity];
    this.order = new int[initialCapacity];
    this.size = 0;
    this.state = State.SORTED;
    // zero or one hit is trivially ranked
    this.order[0] = 0;
  }

  /**
   * Makes room for one more hit, doubling the capacity if the list is full.
   *
   * <p>Both arrays are allocated before any field changes, so a failure leaves the list intact.
   * Record indices and the current ranking survive unchanged.
   *
   * @throws TopHitsCapacityException if the grown capacity cannot be allocated
   */
  public void grow() {
    checkOpen();
    if (size < records.length) {
      return;
    }
    long doubled = 2L * records.length;
    int newCapacity = (int) Math.min(doubled, maxCapacity);
    if (newCapacity <= records.length) {
      throw new TopHitsCapacityException(
          "Hit list is full at its maximum capacity of %d hits".formatted(maxCapacity), doubled);
    }

    Hit[] grownRecords;
    int[] grownOrder;
    try {
      grownRecords = Arrays.copyOf(records, newCapacity);
      grownOrder = Arrays.copyOf(order, newCapacity);
    } catch (OutOfMemoryError e) {
      throw new TopHitsCapacityException(
          "Out of memory growing hit list to %d hits".formatted(newCapacity), newCapacity, e);
    }

    log.debug("Grew hit list from {} to {} hits", records.length, newCapacity);
    records = grownRecords;
    order = grownOrder;
  }

  /**
   * Appends an empty hit and returns it for the caller to fill in place.
   *
   * <p>Every field of the returned hit is at its default: numbers zero, flags false, text null, no
   * domains, best domain {@code -1}. The list leaves the {@code SORTED} state once it holds two or
   * more hits.
   *
   * @return the new hit, owned by this list
   * @throws TopHitsCapacityException if the list is full and cannot grow
   */
  public Hit createNextHit() {
    grow();
    Hit hit = records[size];
    if (hit == null) {
      hit = new Hit();
      records[size] = hit;
    } else {
      hit.reset();
    }
    size++;
    if (size >= 2) {
      state = State.UNSORTED;
    }
    return hit;
  }

  /**
   * Appends a hit with the given identity and scores. Text fields are immutable and shared with
   * the caller; every other field takes its default.
   *
   * @param name target name
   * @param accession target accession, may be null
   * @param description target description, may be null
   * @param sortKey ranking value, bigger is better
   * @param score bit score of the hit
   * @param pvalue P-value of the hit
   * @return the stored hit
   * @throws TopHitsCapacityException if the list is full and cannot grow
   */
  public Hit add(
      String name,
      @Nullable String accession,
      @Nullable String description,
      double sortKey,
      float score,
      double pvalue) {
    Hit hit = createNextHit();
    hit.setName(name);
    hit.setAccession(accession);
    hit.setDescription(description);
    hit.setSortKey(sortKey);
    hit.setScore(score);
    hit.setPvalue(pvalue);
    return hit;
  }

  /**
   * Ranks the hits by descending sort key. Returns immediately when the list is already sorted.
   *
   * <p>The sort is stable: hits with equal keys keep their append order.
   */
  public void sort() {
    checkOpen();
    if (state == State.SORTED) {
      return;
    }
    Hit[] hits = records;
    int[] ranked =
        IntStream.range(0, size)
            .boxed()
            .sorted(Comparator.comparingDouble((Integer i) -> hits[i].getSortKey()).reversed())
            .mapToInt(Integer::intValue)
            .toArray();
    System.arraycopy(ranked, 0, order, 0, size);
    state = State.SORTED;
  }

  /**
   * Moves every hit of {@code source} into this list and leaves this list sorted.
   *
   * <p>Both lists are sorted first, then the grown arrays are allocated before either list is
   * touched; on {@link TopHitsCapacityException} both lists are unchanged and still usable. The
   * source records are appended after this list's records and the two rankings are merged in one
   * linear pass. On equal sort keys this list's hit ranks first.
   *
   * <p>Afterwards {@code source} is {@link State#DRAINED}: it owns nothing, and any call other
   * than {@link #close()} throws {@link IllegalStateException}.
   *
   * @param source the list to drain
   * @throws IllegalArgumentException if {@code source} is this list
   * @throws TopHitsCapacityException if the combined capacity cannot be allocated
   */
  public void merge(TopHits source) {
    Objects.requireNonNull(source, "source");
    if (source == this) {
      throw new IllegalArgumentException("Cannot merge a hit list into itself");
    }
    checkOpen();
    source.checkOpen();

    sort();
    source.sort();

    long combined = (long) records.length + source.records.length;
    if (combined > maxCapacity) {
      throw new TopHitsCapacityException(
          "Merged hit list would need %d hits, maximum is %d".formatted(combined, maxCapacity),
          combined);
    }
    Hit[] mergedRecords;
    int[] mergedOrder;
    try {
      mergedRecords = Arrays.copyOf(records, (int) combined);
      mergedOrder = new int[(int) combined];
    } catch (OutOfMemoryError e) {
      throw new TopHitsCapacityException(
          "Out of memory merging hit lists into %d hits".formatted(combined), combined, e);
    }

    int base = size;
    int moved = source.size;
    System.arraycopy(source.records, 0, mergedRecords, base, moved);

    int i = 0;
    int j = 0;
    int k = 0;
    while (i < size && j < moved) {
      double ours = records[order[i]].getSortKey();
      double theirs = source.records[source.order[j]].getSortKey();
      // ties go to this list
      boolean sourceFirst = Double.compare(theirs, ours) > 0;
      mergedOrder[k++] = sourceFirst ? base + source.order[j++] : order[i++];
    }
    while (i < size) {
      mergedOrder[k++] = order[i++];
    }
    while (j < moved) {
      mergedOrder[k++] = base + source.order[j++];
    }

    source.drain();

    records = mergedRecords;
    order = mergedOrder;
    size = base + moved;
    log.debug("Merged {} hits into a list of {}; capacity now {}", moved, base, combined);
  }

  /**
   * Folds every list after the first into the first one and closes the drained lists.
   *
   * @param lists per-worker lists, at least one
   * @return the first list, now holding every hit in rank order
   */
  public static TopHits mergeAll(List<TopHits> lists) {
    if (lists.isEmpty()) {
      throw new IllegalArgumentException("At least one hit list is required");
    }
    TopHits merged = lists.get(0);
    for (TopHits other : lists.subList(1, lists.size())) {
      merged.merge(other);
      other.close();
    }
    merged.sort();
    return merged;
  }

  /**
   * Empties the list but keeps its arrays and hit objects for the next run. Per-hit text and
   * domains are released now; the hit objects are reset and handed out again by {@link
   * #createNextHit()}.
   */
  public void reuse() {
    checkOpen();
    for (int i = 0; i < size; i++) {
      records[i].reset();
    }
    size = 0;
    reportedCount = 0;
    state = State.SORTED;
    order[0] = 0;
  }

  /** Releases every hit and both arrays. Safe to call in any state, more than once. */
  @Override
  public void close() {
    if (state == State.CLOSED) {
      return;
    }
    for (int i = 0; i < size; i++) {
      records[i].reset();
    }
    releaseArrays();
    state = State.CLOSED;
  }

  /** Longest hit name in characters, over all hits; 0 if there are none or none has a name. */
  public int maxNameLength() {
    checkOpen();
    int max = 0;
    for (int i = 0; i < size; i++) {
      String name = records[i].getName();
      if (name != null) {
        max = Math.max(max, name.length());
      }
    }
    return max;
  }

  /**
   * Hit at the given rank.
   *
   * @throws IllegalStateException if the list is not sorted
   */
  public Hit get(int rank) {
    checkSorted();
    Objects.checkIndex(rank, size);
    return records[order[rank]];
  }

  /** Hit at the given position in append order. */
  public Hit getUnsorted(int index) {
    checkOpen();
    Objects.checkIndex(index, size);
    return records[index];
  }

  /**
   * Snapshot of all hits in rank order.
   *
   * @throws IllegalStateException if the list is not sorted
   */
  public List<Hit> ranked() {
    checkSorted();
    Hit[] hits = records;
    return Arrays.stream(order, 0, size).mapToObj(i -> hits[i]).toList();
  }

  /**
   * Snapshot of the reportable hits in rank order.
   *
   * @throws IllegalStateException if the list is not sorted
   */
  public List<Hit> reported() {
    return ranked().stream().filter(Hit::isReported).toList();
  }

  public int size() {
    checkOpen();
    return size;
  }

  public boolean isEmpty() {
    return size() == 0;
  }

  public int capacity() {
    checkOpen();
    return records.length;
  }

  public int maxCapacity() {
    return maxCapacity;
  }

  /** Number of hits flagged reportable by the last threshold pass. */
  public int reportedCount() {
    checkOpen();
    return reportedCount;
  }

  /**
   * Recounts the hits whose reported flag is set and stores the result as {@link
   * #reportedCount()}. Called by the threshold pass once targets are flagged.
   *
   * @return the number of reportable hits
   */
  public int recountReported() {
    checkOpen();
    int count = 0;
    for (int i = 0; i < size; i++) {
      if (records[i].isReported()) {
        count++;
      }
    }
    reportedCount = count;
    return count;
  }

  public boolean isSorted() {
    return state == State.SORTED;
  }

  public State state() {
    return state;
  }

  private void drain() {
    releaseArrays();
    state = State.DRAINED;
  }

  private void releaseArrays() {
    Arrays.fill(records, null);
    records = NO_RECORDS;
    order = NO_ORDER;
    size = 0;
    reportedCount = 0;
  }

  private void checkOpen() {
    if (state == State.DRAINED) {
      throw new IllegalStateException("Hit list was merged into another list and is drained");
    }
    if (state == State.CLOSED) {
      throw new IllegalStateException("Hit list is closed");
    }
  }

  private void checkSorted() {
    checkOpen();
    if (state != State.SORTED) {
      throw new IllegalStateException("Hit list has unsorted hits; call sort() first");
    }
  }
}
