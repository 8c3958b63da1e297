package dev.hitrank.hits;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;

/**
 * Property-based tests for {@link TopHits} ordering invariants using jqwik.
 *
 * <p>Lists start with a small capacity so that generated inputs cross several growth steps.
 */
class TopHitsPropertyTest {

  private static final int SMALL_CAPACITY = 4;

  // =========================================================================
  // Generators
  // =========================================================================

  @Provide
  Arbitrary<List<Double>> sortKeys() {
    return Arbitraries.oneOf(
            Arbitraries.doubles().between(-1000.0, 1000.0),
            Arbitraries.integers().between(-3, 3).map(Integer::doubleValue))
        .list()
        .ofMaxSize(300);
  }

  private static TopHits fill(String prefix, List<Double> keys) {
    TopHits hits = new TopHits(SMALL_CAPACITY, TopHits.MAX_ARRAY_CAPACITY);
    for (int i = 0; i < keys.size(); i++) {
      double key = keys.get(i);
      hits.add(prefix + i, prefix + "-acc", null, key, (float) key, Math.abs(key));
    }
    return hits;
  }

  private static List<Double> rankedKeys(TopHits hits) {
    return hits.ranked().stream().map(Hit::getSortKey).toList();
  }

  private static List<Double> descending(List<Double> keys) {
    List<Double> sorted = new ArrayList<>(keys);
    sorted.sort(Comparator.reverseOrder());
    return sorted;
  }

  // =========================================================================
  // Sort
  // =========================================================================

  @Property
  void sorted_view_has_non_increasing_keys(@ForAll("sortKeys") List<Double> keys) {
    TopHits hits = fill("h", keys);

    hits.sort();

    List<Double> ranked = rankedKeys(hits);
    assertThat(ranked).hasSize(keys.size());
    for (int i = 1; i < ranked.size(); i++) {
      assertThat(ranked.get(i)).isLessThanOrEqualTo(ranked.get(i - 1));
    }
  }

  @Property
  void sorted_view_is_a_permutation_of_the_records(@ForAll("sortKeys") List<Double> keys) {
    TopHits hits = fill("h", keys);

    hits.sort();

    List<Hit> appended = new ArrayList<>();
    for (int i = 0; i < hits.size(); i++) {
      appended.add(hits.getUnsorted(i));
    }
    assertThat(hits.ranked()).containsExactlyInAnyOrderElementsOf(appended);
  }

  @Property
  void sort_is_idempotent(@ForAll("sortKeys") List<Double> keys) {
    TopHits hits = fill("h", keys);

    hits.sort();
    List<Hit> first = hits.ranked();
    hits.sort();

    assertThat(hits.ranked()).containsExactlyElementsOf(first);
  }

  // =========================================================================
  // Growth
  // =========================================================================

  @Property
  void growth_keeps_every_record_at_its_index(@ForAll("sortKeys") List<Double> keys) {
    TopHits hits = fill("h", keys);

    assertThat(hits.size()).isEqualTo(keys.size());
    assertThat(hits.capacity()).isGreaterThanOrEqualTo(keys.size());
    for (int i = 0; i < keys.size(); i++) {
      assertThat(hits.getUnsorted(i).getName()).isEqualTo("h" + i);
      assertThat(hits.getUnsorted(i).getSortKey()).isEqualTo(keys.get(i));
    }
  }

  // =========================================================================
  // Merge
  // =========================================================================

  @Property
  void merge_keeps_every_record_in_global_order(
      @ForAll("sortKeys") List<Double> left, @ForAll("sortKeys") List<Double> right) {
    TopHits destination = fill("a", left);
    TopHits source = fill("b", right);

    destination.merge(source);

    assertThat(destination.size()).isEqualTo(left.size() + right.size());
    List<Double> all = new ArrayList<>(left);
    all.addAll(right);
    assertThat(rankedKeys(destination)).isEqualTo(descending(all));

    List<String> names = destination.ranked().stream().map(Hit::getName).toList();
    for (int i = 0; i < right.size(); i++) {
      assertThat(names).contains("b" + i);
    }
    for (Hit hit : destination.ranked()) {
      String name = hit.getName();
      List<Double> origin = name.startsWith("a") ? left : right;
      assertThat(hit.getSortKey()).isEqualTo(origin.get(Integer.parseInt(name.substring(1))));
      assertThat(hit.getAccession()).isEqualTo(name.charAt(0) + "-acc");
    }
  }

  @Property
  void merge_is_associative_in_content_and_order(
      @ForAll("sortKeys") List<Double> a,
      @ForAll("sortKeys") List<Double> b,
      @ForAll("sortKeys") List<Double> c) {
    TopHits leftFold = fill("a", a);
    leftFold.merge(fill("b", b));
    leftFold.merge(fill("c", c));

    TopHits rightFold = fill("b", b);
    rightFold.merge(fill("c", c));
    TopHits outer = fill("a", a);
    outer.merge(rightFold);

    assertThat(rankedKeys(leftFold)).isEqualTo(rankedKeys(outer));
    assertThat(leftFold.ranked())
        .extracting(Hit::getName)
        .containsExactlyInAnyOrderElementsOf(
            outer.ranked().stream().map(Hit::getName).toList());
  }

  // =========================================================================
  // Reuse
  // =========================================================================

  @Property
  void reuse_then_append_matches_fresh_list(
      @ForAll("sortKeys") List<Double> before, @ForAll("sortKeys") List<Double> after) {
    TopHits reused = fill("old", before);
    reused.sort();
    reused.reuse();
    for (int i = 0; i < after.size(); i++) {
      double key = after.get(i);
      reused.add("h" + i, "h-acc", null, key, (float) key, Math.abs(key));
    }
    TopHits fresh = fill("h", after);

    reused.sort();
    fresh.sort();

    assertThat(reused.size()).isEqualTo(fresh.size());
    assertThat(reused.maxNameLength()).isEqualTo(fresh.maxNameLength());
    for (int i = 0; i < fresh.size(); i++) {
      assertThat(reused.get(i)).usingRecursiveComparison().isEqualTo(fresh.get(i));
    }
  }
}
