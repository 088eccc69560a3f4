/*
 * Copyright 2013 Matt T. Proud (matt.proud@gmail.com) Copyright 2012 Andrew
 * Wang (andrew@umbrant.com)
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not
 * use this file except in compliance with the License. You may obtain a copy of
 * the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations under
 * the License.
 */

package com.matttproud.gkarray;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;
import org.apache.log4j.Logger;

/**
 * <p>
 * Mergeable implementation of the Greenwald and Khanna algorithm for streaming
 * calculation of epsilon-approximate quantiles.
 * </p>
 *
 * <p>
 * Observations are buffered and periodically sorted and folded into a
 * compressed list of entries. The value returned for quantile <em>q</em> has a
 * true rank within <code>epsilon * n</code> of <code>q * (n - 1)</code>.
 * Summaries built with the same epsilon can be merged. A merged summary may
 * carry up to twice the rank error of a single one, because the partner's rank
 * uncertainty is folded in as exact rank mass.
 * </p>
 *
 * <p>
 * Greenwald and Khanna,
 * "Space-efficient online computation of quantile summaries" in SIGMOD 2001
 * </p>
 *
 * <p>
 * This type is <em>not</em> concurrency safe.
 * </p>
 */
public class GKArray {
  private static final Logger LOG = Logger.getLogger(GKArray.class);

  static final double DEFAULT_EPSILON = 0.01;
  /**
   * Keeps the compaction period and the small-sample buffer within int range.
   */
  static final double MIN_EPSILON = 1.0 / Integer.MAX_VALUE;

  private static final Comparator<Entry> BY_VALUE = new Comparator<Entry>() {
    @Override
    public int compare(final Entry left, final Entry right) {
      return Double.compare(left.value, right.value);
    }
  };

  private double epsilon;

  /**
   * Compressed entries, sorted ascending by value.
   */
  List<Entry> entries = new ArrayList<Entry>();
  /**
   * Raw observations not yet folded into {@link #entries}.
   */
  final ArrayList<Double> incoming = new ArrayList<Double>();

  private long count = 0;
  private double sum = 0;
  private double mean = 0;
  private double min = Double.POSITIVE_INFINITY;
  private double max = Double.NEGATIVE_INFINITY;

  /**
   * Create a summary whose quantile answers are within
   * <code>epsilon * n</code> ranks of the exact answer.
   *
   * @param epsilon relative rank error; at least {@link #MIN_EPSILON}.
   */
  public GKArray(final double epsilon) {
    checkArgument(epsilon >= MIN_EPSILON, "epsilon must be at least %s: %s", MIN_EPSILON,
        epsilon);
    this.epsilon = epsilon;
  }

  /**
   * Create a summary with one percent rank error.
   */
  public GKArray() {
    this(DEFAULT_EPSILON);
  }

  /**
   * <p>
   * Add a new value from the stream.
   * </p>
   *
   * @param value finite observation to be added.
   */
  public void ingest(final double value) {
    checkArgument(!Double.isNaN(value) && !Double.isInfinite(value),
        "Cannot add non-finite value: %s", value);

    count++;
    sum += value;
    mean += (value - mean) / count;
    if (value < min) {
      min = value;
    }
    if (value > max) {
      max = value;
    }
    incoming.add(value);

    if (count % compactionPeriod() == 0) {
      compact(Collections.<Entry>emptyList());
    }
  }

  /**
   * <p>
   * Add new values from the stream.
   * </p>
   *
   * @param values observations to be added.
   */
  public void ingestAll(final Collection<? extends Number> values) {
    for (final Number value : values) {
      ingest(value.doubleValue());
    }
  }

  private long compactionPeriod() {
    return (long) (1.0 / epsilon) + 1;
  }

  /**
   * @return number of compressed entries, after folding in pending values.
   */
  public int size() {
    flush();
    return entries.size();
  }

  public long count() {
    return count;
  }

  public double sum() {
    return sum;
  }

  public double mean() {
    return mean;
  }

  /**
   * @return smallest value seen, or NaN if the summary is empty.
   */
  public double min() {
    return count == 0 ? Double.NaN : min;
  }

  /**
   * @return largest value seen, or NaN if the summary is empty.
   */
  public double max() {
    return count == 0 ? Double.NaN : max;
  }

  public double epsilon() {
    return epsilon;
  }

  void flush() {
    if (!incoming.isEmpty()) {
      compact(Collections.<Entry>emptyList());
    }
  }

  /**
   * Fold the pending values and the given entries into {@link #entries},
   * merging each entry into its right-hand neighbour when the pair fits within
   * the current error budget.
   */
  private void compact(final List<Entry> extra) {
    final long removalThreshold = (long) Math.floor(2.0 * epsilon * (count - 1));

    final List<Entry> candidates = new ArrayList<Entry>(incoming.size() + extra.size());
    for (final double value : incoming) {
      candidates.add(new Entry(value, 1, 0));
    }
    for (final Entry entry : extra) {
      candidates.add(new Entry(entry.value, entry.g, entry.delta));
    }
    Collections.sort(candidates, BY_VALUE);

    final List<Entry> merged = new ArrayList<Entry>(entries.size() + candidates.size());
    int i = 0;
    int j = 0;
    while (i < candidates.size() || j < entries.size()) {
      // Ties go to the existing entry.
      if (i < candidates.size()
          && (j == entries.size() || candidates.get(i).value < entries.get(j).value)) {
        if (j == entries.size()) {
          coalesceOrKeep(candidates, i, removalThreshold, merged);
        } else {
          final Entry candidate = candidates.get(i);
          final Entry next = entries.get(j);
          if (candidate.g + next.g + next.delta <= removalThreshold) {
            next.g += candidate.g;
          } else {
            candidate.delta = next.g + next.delta - candidate.g;
            merged.add(candidate);
          }
        }
        i++;
      } else {
        coalesceOrKeep(entries, j, removalThreshold, merged);
        j++;
      }
    }

    if (LOG.isDebugEnabled()) {
      LOG.debug(String.format("Compacted %d pending values and %d extra entries into %d entries"
          + " (threshold %d, count %d)", incoming.size(), extra.size(), merged.size(),
          removalThreshold, count));
    }

    entries = merged;
    incoming.clear();
  }

  private static void coalesceOrKeep(final List<Entry> run, final int index,
      final long removalThreshold, final List<Entry> merged) {
    final Entry entry = run.get(index);
    if (index + 1 < run.size()) {
      final Entry next = run.get(index + 1);
      if (entry.g + next.g + next.delta <= removalThreshold) {
        next.g += entry.g;
        return;
      }
    }
    merged.add(entry);
  }

  /**
   * <p>
   * Merge another summary into this one. The other summary has its pending
   * values compacted but is otherwise left as it was; nothing of it is retained.
   * </p>
   *
   * @param other summary built with the same epsilon.
   * @throws IncompatiblePrecisionException if the epsilons differ.
   */
  public void merge(final GKArray other) throws IncompatiblePrecisionException {
    checkNotNull(other, "other is null");
    if (epsilon != other.epsilon) {
      throw new IncompatiblePrecisionException(epsilon, other.epsilon);
    }

    if (other.count == 0) {
      flush();
      return;
    }

    other.flush();

    if (count == 0) {
      entries = new ArrayList<Entry>(other.entries.size());
      for (final Entry entry : other.entries) {
        entries.add(new Entry(entry.value, entry.g, entry.delta));
      }
      count = other.count;
      sum = other.sum;
      mean = other.mean;
      min = other.min;
      max = other.max;
      return;
    }

    final List<Entry> synthetic = reconstruct(other);

    mean += (other.mean - mean) * other.count / (count + other.count);
    sum += other.sum;
    count += other.count;
    epsilon = Math.max(epsilon, other.epsilon);
    min = Math.min(min, other.min);
    max = Math.max(max, other.max);

    if (LOG.isDebugEnabled()) {
      LOG.debug(String.format("Merging %d observations as %d synthetic entries",
          other.count, synthetic.size()));
    }

    compact(synthetic);
  }

  /**
   * Turn the compacted entries of another summary into rank mass that can be
   * fed through {@link #compact(List)}. The rank uncertainty of each entry is
   * centred by shifting it by <code>epsilon * (n - 1)</code>.
   */
  private static List<Entry> reconstruct(final GKArray other) {
    final List<Entry> source = other.entries;
    final int last = source.size() - 1;
    final long spread = (long) (other.epsilon * (other.count - 1));
    final List<Entry> synthetic = new ArrayList<Entry>(source.size() + 1);

    long g = source.get(0).g + source.get(0).delta - spread - 1;
    if (g > 0) {
      synthetic.add(new Entry(other.min, g, 0));
    }
    for (int i = 0; i < last; i++) {
      g = source.get(i + 1).g + source.get(i + 1).delta - source.get(i).delta;
      if (g > 0) {
        synthetic.add(new Entry(source.get(i).value, g, 0));
      }
    }
    g = spread + 1 - source.get(last).delta;
    if (g > 0) {
      synthetic.add(new Entry(source.get(last).value, g, 0));
    }
    return synthetic;
  }

  /**
   * Get the estimated value at the specified quantile.
   *
   * @param q Queried quantile, e.g. 0.50 or 0.99.
   * @return Estimated value at that quantile, or NaN if <code>q</code> lies
   *         outside <code>[0, 1]</code> or the summary is empty.
   */
  public double quantile(final double q) {
    if (!inRange(q) || count == 0) {
      return Double.NaN;
    }

    flush();

    if (count < 1.0 / epsilon) {
      return exactQuantile(q);
    }

    final long rank = (long) (q * (count - 1) + 1);
    final long spread = (long) (epsilon * (count - 1));
    long gSum = 0;
    int i = 0;
    for (; i < entries.size(); i++) {
      final Entry entry = entries.get(i);
      gSum += entry.g;
      if (gSum + entry.delta - 1 > rank + spread) {
        break;
      }
    }
    return i == 0 ? min : entries.get(i - 1).value;
  }

  /**
   * <p>
   * Get the estimated values at several quantiles. Quantiles given in
   * ascending order are answered in a single pass over the entries; otherwise
   * each is answered as by {@link #quantile(double)}.
   * </p>
   *
   * @param qs Queried quantiles.
   * @return Estimated values, position by position; NaN for quantiles outside
   *         <code>[0, 1]</code>.
   */
  public double[] quantiles(final double... qs) {
    final double[] result = new double[qs.length];
    if (count == 0) {
      Arrays.fill(result, Double.NaN);
      return result;
    }

    flush();

    if (count < 1.0 / epsilon) {
      for (int k = 0; k < qs.length; k++) {
        result[k] = inRange(qs[k]) ? exactQuantile(qs[k]) : Double.NaN;
      }
      return result;
    }

    if (!isSorted(qs)) {
      for (int k = 0; k < qs.length; k++) {
        result[k] = quantile(qs[k]);
      }
      return result;
    }

    final long spread = (long) (epsilon * (count - 1));
    long gSum = 0;
    int i = 0;
    int k = 0;
    while (i < entries.size() && k < qs.length) {
      final Entry entry = entries.get(i);
      gSum += entry.g;
      while (k < qs.length) {
        if (!inRange(qs[k])) {
          result[k++] = Double.NaN;
        } else if (gSum + entry.delta - 1 > (long) (qs[k] * (count - 1) + 1) + spread) {
          result[k++] = i == 0 ? min : entries.get(i - 1).value;
        } else {
          break;
        }
      }
      i++;
    }
    for (; k < qs.length; k++) {
      result[k] = inRange(qs[k]) ? max : Double.NaN;
    }
    return result;
  }

  private static boolean inRange(final double q) {
    return q >= 0 && q <= 1;
  }

  private static boolean isSorted(final double[] qs) {
    for (int k = 1; k < qs.length; k++) {
      if (qs[k] < qs[k - 1]) {
        return false;
      }
    }
    return true;
  }

  /**
   * Linearly interpolated percentile over every value the entries stand for.
   * Only used while the summary is small enough to hold them all.
   */
  private double exactQuantile(final double q) {
    long total = 0;
    for (final Entry entry : entries) {
      total += entry.g;
    }
    final double[] values = new double[(int) total];
    int k = 0;
    for (final Entry entry : entries) {
      for (long n = 0; n < entry.g; n++) {
        values[k++] = entry.value;
      }
    }

    // Percentile rejects p == 0.
    if (q == 0) {
      return values[0];
    }
    return new Percentile().withEstimationType(EstimationType.R_7).evaluate(values, q * 100);
  }

  @Override
  public String toString() {
    return String.format("GKArray{epsilon=%s, count=%d, entries=%d, pending=%d}", epsilon, count,
        entries.size(), incoming.size());
  }

  static final class Entry {
    final double value;
    long g;
    long delta;

    Entry(final double value, final long g, final long delta) {
      this.value = value;
      this.g = g;
      this.delta = delta;
    }

    @Override
    public String toString() {
      return String.format("%s, %d, %d", value, g, delta);
    }
  }
}
