package org.fpbase.client.application.resolve;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Ratcliff/Obershelp string similarity used for "did you mean" suggestions.
 *
 * <p>{@link #ratio(String, String)} is {@code 2 * M / T}, where {@code M} counts characters in the recursively found
 * longest common blocks and {@code T} is the combined length. No junk heuristics are applied; lookup keys are short.</p>
 *
 * <p><strong>Thread-safety:</strong> Stateless utility.</p>
 *
 * @since 0.1.0
 */
public final class SequenceSimilarity {
  /** Minimum ratio a candidate needs to be suggested. */
  public static final double DEFAULT_CUTOFF = 0.5;

  private SequenceSimilarity() {
    // Utility
  }

  /**
   * Computes the similarity ratio of two strings.
   *
   * @param a first string; never {@code null}
   * @param b second string; never {@code null}
   * @return value in {@code [0, 1]}; {@code 1.0} for two empty strings
   */
  public static double ratio(String a, String b) {
    Objects.requireNonNull(a, "a");
    Objects.requireNonNull(b, "b");
    int total = a.length() + b.length();
    if (total == 0) {
      return 1.0;
    }
    return 2.0 * matchingCharacters(a, b) / total;
  }

  /**
   * Picks the single candidate most similar to {@code query}.
   *
   * <p>Ties on ratio go to the lexicographically greater candidate so the result does not depend on iteration
   * order.</p>
   *
   * @param query normalized query; never {@code null}
   * @param candidates candidate keys; never {@code null}
   * @param cutoff minimum ratio, inclusive
   * @return best candidate scoring at least {@code cutoff}, or empty
   */
  public static Optional<String> closest(String query, Collection<String> candidates, double cutoff) {
    Objects.requireNonNull(query, "query");
    Objects.requireNonNull(candidates, "candidates");
    String best = null;
    double bestScore = -1;
    for (String candidate : candidates) {
      double score = ratio(candidate, query);
      if (score < cutoff) {
        continue;
      }
      if (score > bestScore || (score == bestScore && candidate.compareTo(best) > 0)) {
        best = candidate;
        bestScore = score;
      }
    }
    return Optional.ofNullable(best);
  }

  private static int matchingCharacters(String a, String b) {
    Map<Character, List<Integer>> positions = new HashMap<>();
    for (int j = 0; j < b.length(); j++) {
      positions.computeIfAbsent(b.charAt(j), c -> new ArrayList<>()).add(j);
    }
    int matched = 0;
    Deque<int[]> pending = new ArrayDeque<>();
    pending.push(new int[] {0, a.length(), 0, b.length()});
    while (!pending.isEmpty()) {
      int[] range = pending.pop();
      int alo = range[0];
      int ahi = range[1];
      int blo = range[2];
      int bhi = range[3];
      int[] block = longestMatch(a, positions, alo, ahi, blo, bhi);
      int i = block[0];
      int j = block[1];
      int size = block[2];
      if (size == 0) {
        continue;
      }
      matched += size;
      if (alo < i && blo < j) {
        pending.push(new int[] {alo, i, blo, j});
      }
      if (i + size < ahi && j + size < bhi) {
        pending.push(new int[] {i + size, ahi, j + size, bhi});
      }
    }
    return matched;
  }

  /**
   * Finds the longest block {@code a[i, i+k) == b[j, j+k)} inside the given ranges, earliest in {@code a} first.
   */
  private static int[] longestMatch(
      String a, Map<Character, List<Integer>> positions, int alo, int ahi, int blo, int bhi) {
    int bestI = alo;
    int bestJ = blo;
    int bestSize = 0;
    Map<Integer, Integer> lengths = new HashMap<>();
    for (int i = alo; i < ahi; i++) {
      Map<Integer, Integer> next = new HashMap<>();
      for (int j : positions.getOrDefault(a.charAt(i), List.of())) {
        if (j < blo) {
          continue;
        }
        if (j >= bhi) {
          break;
        }
        int k = lengths.getOrDefault(j - 1, 0) + 1;
        next.put(j, k);
        if (k > bestSize) {
          bestI = i - k + 1;
          bestJ = j - k + 1;
          bestSize = k;
        }
      }
      lengths = next;
    }
    return new int[] {bestI, bestJ, bestSize};
  }
}
