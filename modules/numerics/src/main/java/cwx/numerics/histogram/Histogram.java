// ******************************************************************************
//
// Title:       CWX.
// Description: CWX - Continuous-Wave Search Sensitivity Toolkit.
// Copyright:   Copyright (c) CWX Developers 2012-2026.
//
// This file is part of CWX.
//
// CWX is free software; you can redistribute it and/or modify it
// under the terms of the GNU General Public License version 3 as published by
// the Free Software Foundation.
//
// CWX is distributed in the hope that it will be useful, but WITHOUT
// ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or FITNESS
// FOR A PARTICULAR PURPOSE. See the GNU General Public License for more
// details.
//
// You should have received a copy of the GNU General Public License along with
// CWX; if not, write to the Free Software Foundation, Inc., 59 Temple
// Place, Suite 330, Boston, MA 02111-1307 USA
//
// Linking this library statically or dynamically with other modules is making a
// combined work based on this library. Thus, the terms and conditions of the
// GNU General Public License cover the whole combination.
//
// As a special exception, the copyright holders of this library give you
// permission to link this library with independent modules to produce an
// executable, regardless of the license terms of these independent modules, and
// to copy and distribute the resulting executable under terms of your choice,
// provided that you also meet, for each linked independent module, the terms
// and conditions of the license of that module. An independent module is a
// module which is not derived from or based on this library. If you modify this
// library, you may extend this exception to your version of the library, but
// you are not obligated to do so. If you do not wish to do so, delete this
// exception statement from your version.
//
package cwx.numerics.histogram;

import static java.lang.Double.NEGATIVE_INFINITY;
import static java.lang.Double.POSITIVE_INFINITY;
import static java.lang.Double.isFinite;
import static java.lang.Double.isNaN;
import static java.lang.String.format;
import static java.lang.System.arraycopy;
import static java.util.Arrays.binarySearch;
import static java.util.Arrays.copyOf;
import static java.util.Arrays.fill;
import static org.apache.commons.math3.util.FastMath.abs;
import static org.apache.commons.math3.util.FastMath.ceil;
import static org.apache.commons.math3.util.FastMath.floor;
import static org.apache.commons.math3.util.FastMath.max;
import static org.apache.commons.math3.util.FastMath.min;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The Histogram class accumulates weighted samples over an arbitrary number of dimensions.
 *
 * <p>Each dimension has a strictly increasing sequence of bin edges that always begins with
 * negative infinity and ends with positive infinity, so the first and last bins of every dimension
 * collect the mass lying outside the finite range. Counts are stored in a flattened array with the
 * first dimension varying slowest.
 *
 * <p>The number of dimensions is fixed at construction. Adding data may extend the finite range of a
 * dimension; resampling (see {@link HistogramResampler}) always produces a new Histogram.
 *
 * @author CWX Developers
 * @since 1.0
 */
public class Histogram {

  private static final Logger logger = Logger.getLogger(Histogram.class.getName());

  /** Quantities that can be requested for the bins of one dimension. */
  public enum BinQuantity {
    /** Bin centre; infinite for the two sentinel bins. */
    CENTRE,
    /** Bin width; infinite for the two sentinel bins. */
    WIDTH,
    /** Lower bin edge. */
    LOWER,
    /** Upper bin edge. */
    UPPER
  }

  /** Relative width of the single bin used by {@link #delta(double)}. */
  private static final double DELTA_WIDTH = 1.0e-10;

  private final int dimensions;
  /** Bin edges of each dimension, including the infinite sentinels. */
  private final double[][] edges;
  /** Flattened counts, first dimension slowest. */
  private double[] counts;

  /**
   * Constructs an empty Histogram; every dimension has the single bin (-inf, +inf).
   *
   * @param dimensions Number of dimensions.
   */
  public Histogram(int dimensions) {
    if (dimensions < 1) {
      throw new IllegalArgumentException(
          format(" A histogram requires at least one dimension (%d requested).", dimensions));
    }
    this.dimensions = dimensions;
    edges = new double[dimensions][];
    for (int d = 0; d < dimensions; d++) {
      edges[d] = new double[] {NEGATIVE_INFINITY, POSITIVE_INFINITY};
    }
    counts = new double[1];
  }

  /**
   * Constructs a Histogram from complete bin edges and counts; both are copied.
   *
   * @param edges Bin edges of each dimension, including the infinite sentinels.
   * @param counts Flattened counts matching the shape implied by the edges.
   */
  Histogram(double[][] edges, double[] counts) {
    dimensions = edges.length;
    this.edges = new double[dimensions][];
    int size = 1;
    for (int d = 0; d < dimensions; d++) {
      double[] e = edges[d];
      assert e.length >= 2 && e[0] == NEGATIVE_INFINITY && e[e.length - 1] == POSITIVE_INFINITY;
      this.edges[d] = copyOf(e, e.length);
      size *= e.length - 1;
    }
    assert size == counts.length : " Counts do not match the shape of the bin edges.";
    this.counts = copyOf(counts, counts.length);
  }

  /**
   * Creates a Histogram containing the supplied samples.
   *
   * @param samples Samples, one row per sample and one column per dimension.
   * @param binWidth Width of any new bins, either one value or one per dimension.
   * @return A new Histogram.
   */
  public static Histogram create(double[][] samples, double... binWidth) {
    if (samples.length == 0) {
      throw new IllegalArgumentException(" Cannot infer the dimension of a histogram without samples.");
    }
    Histogram histogram = new Histogram(samples[0].length);
    return histogram.addData(samples, binWidth);
  }

  /**
   * Creates a one-dimensional Histogram with all of its mass in a single, very narrow bin whose
   * lower edge is the given value.
   *
   * @param value Location of the delta function.
   * @return A new Histogram.
   */
  public static Histogram delta(double value) {
    if (!isFinite(value)) {
      throw new IllegalArgumentException(format(" Delta histogram location %f is not finite.", value));
    }
    double width = DELTA_WIDTH * max(1.0, abs(value));
    double[][] e = {{NEGATIVE_INFINITY, value, value + width, POSITIVE_INFINITY}};
    return new Histogram(e, new double[] {0.0, 1.0, 0.0});
  }

  /**
   * Add unit-weight samples to the histogram.
   *
   * @param samples Samples, one row per sample and one column per dimension.
   * @param binWidth Width of any new bins, either one value or one per dimension.
   * @return This Histogram.
   */
  public Histogram addData(double[][] samples, double... binWidth) {
    return addData(samples, null, binWidth);
  }

  /**
   * Add weighted samples to the histogram. The finite range of each dimension is extended, in steps
   * of the bin width, until it contains every finite sample; infinite samples are accumulated into the
   * corresponding sentinel bin.
   *
   * @param samples Samples, one row per sample and one column per dimension.
   * @param weights Weight of each sample (null for unit weights).
   * @param binWidth Width of any new bins, either one value or one per dimension.
   * @return This Histogram.
   */
  public Histogram addData(double[][] samples, double[] weights, double... binWidth) {
    double[] dx = binWidths(binWidth);
    if (weights != null && weights.length != samples.length) {
      throw new DimensionMismatchException(samples.length, weights.length,
          "number of sample weights");
    }

    // Validate every sample before anything is modified.
    double[] lo = new double[dimensions];
    double[] hi = new double[dimensions];
    fill(lo, POSITIVE_INFINITY);
    fill(hi, NEGATIVE_INFINITY);
    for (int n = 0; n < samples.length; n++) {
      double[] sample = samples[n];
      if (sample.length != dimensions) {
        throw new DimensionMismatchException(dimensions, sample.length,
            format("width of sample %d", n));
      }
      if (weights != null && (!isFinite(weights[n]) || weights[n] < 0.0)) {
        throw new IllegalArgumentException(
            format(" Weight %f of sample %d must be finite and non-negative.", weights[n], n));
      }
      for (int d = 0; d < dimensions; d++) {
        double x = sample[d];
        if (isNaN(x)) {
          throw new IllegalArgumentException(format(" Sample %d is NaN in dimension %d.", n, d));
        }
        if (isFinite(x)) {
          lo[d] = min(lo[d], x);
          hi[d] = max(hi[d], x);
        }
      }
    }

    // Extend the finite range of each dimension as required.
    for (int d = 0; d < dimensions; d++) {
      double[] newEdges = extendedEdges(d, lo[d], hi[d], dx[d]);
      if (newEdges != null) {
        Histogram extended = HistogramResampler.resample(this, d, newEdges);
        edges[d] = extended.edges[d];
        counts = extended.counts;
      }
    }

    // Accumulate.
    int[] strides = strides();
    for (int n = 0; n < samples.length; n++) {
      int index = 0;
      for (int d = 0; d < dimensions; d++) {
        index += binIndex(d, samples[n][d]) * strides[d];
      }
      counts[index] += (weights == null) ? 1.0 : weights[n];
    }

    if (logger.isLoggable(Level.FINEST)) {
      logger.finest(format(" Added %d samples; total count is now %g.", samples.length, totalCount()));
    }
    return this;
  }

  /**
   * The finite bin edges needed along one dimension to contain [lo, hi], or null if the current edges
   * already suffice.
   */
  private double[] extendedEdges(int dim, double lo, double hi, double dx) {
    double[] e = edges[dim];
    int nFinite = e.length - 2;
    if (nFinite == 0) {
      // A dimension without finite bins always gains at least one, so infinite samples
      // land in the sentinel bins rather than in the single unbounded bin.
      long kLo = (lo > hi) ? 0 : (long) floor(lo / dx);
      long kHi = (lo > hi) ? 1 : (long) floor(hi / dx) + 1;
      double[] newEdges = new double[(int) (kHi - kLo) + 1];
      for (int i = 0; i < newEdges.length; i++) {
        newEdges[i] = (kLo + i) * dx;
      }
      // Guard against rounding at the ends of the range.
      while (newEdges[0] > lo) {
        newEdges = prepend(newEdges, newEdges[0] - dx);
      }
      while (newEdges[newEdges.length - 1] <= hi) {
        newEdges = copyOf(newEdges, newEdges.length + 1);
        newEdges[newEdges.length - 1] = newEdges[newEdges.length - 2] + dx;
      }
      return newEdges;
    }
    if (lo > hi) {
      return null;
    }
    double first = e[1];
    double last = e[nFinite];
    int nLow = (lo < first) ? (int) ceil((first - lo) / dx) : 0;
    while (first - nLow * dx > lo) {
      nLow++;
    }
    int nHigh = (hi >= last) ? (int) floor((hi - last) / dx) + 1 : 0;
    while (last + nHigh * dx <= hi) {
      nHigh++;
    }
    if (nLow == 0 && nHigh == 0) {
      return null;
    }
    double[] newEdges = new double[nLow + nFinite + nHigh];
    for (int i = 0; i < nLow; i++) {
      newEdges[i] = first - (nLow - i) * dx;
    }
    arraycopy(e, 1, newEdges, nLow, nFinite);
    for (int i = 1; i <= nHigh; i++) {
      newEdges[nLow + nFinite + i - 1] = last + i * dx;
    }
    return newEdges;
  }

  private static double[] prepend(double[] a, double value) {
    double[] b = new double[a.length + 1];
    b[0] = value;
    arraycopy(a, 0, b, 1, a.length);
    return b;
  }

  private double[] binWidths(double[] binWidth) {
    if (binWidth == null || (binWidth.length != 1 && binWidth.length != dimensions)) {
      throw new DimensionMismatchException(dimensions, binWidth == null ? 0 : binWidth.length,
          "number of bin widths");
    }
    double[] dx = new double[dimensions];
    for (int d = 0; d < dimensions; d++) {
      dx[d] = (binWidth.length == 1) ? binWidth[0] : binWidth[d];
      if (!isFinite(dx[d]) || dx[d] <= 0.0) {
        throw new IllegalArgumentException(
            format(" Bin width %f for dimension %d must be finite and positive.", dx[d], d));
      }
    }
    return dx;
  }

  /**
   * Index of the bin along a dimension that contains a value; bins include their lower edge.
   *
   * @param dim Dimension.
   * @param x Value.
   * @return Bin index, counting the negative infinity bin as 0.
   */
  int binIndex(int dim, double x) {
    double[] e = edges[dim];
    int i = binarySearch(e, x);
    if (i < 0) {
      i = -i - 2;
    }
    return max(0, min(i, e.length - 2));
  }

  /**
   * Strides of the flattened count array.
   *
   * @return Stride of each dimension.
   */
  int[] strides() {
    int[] strides = new int[dimensions];
    int stride = 1;
    for (int d = dimensions - 1; d >= 0; d--) {
      strides[d] = stride;
      stride *= edges[d].length - 1;
    }
    return strides;
  }

  /**
   * Number of dimensions.
   *
   * @return The number of dimensions.
   */
  public int getDimensions() {
    return dimensions;
  }

  /**
   * Bin edges of one dimension, including the infinite sentinels.
   *
   * @param dim Dimension.
   * @return A copy of the bin edges.
   */
  public double[] getEdges(int dim) {
    checkDimension(dim);
    return copyOf(edges[dim], edges[dim].length);
  }

  /**
   * Number of bins along a dimension, including the two infinite bins.
   *
   * @param dim Dimension.
   * @return Number of bins.
   */
  public int binCount(int dim) {
    checkDimension(dim);
    return edges[dim].length - 1;
  }

  /**
   * Number of finite bins along a dimension.
   *
   * @param dim Dimension.
   * @return Number of finite bins.
   */
  public int finiteBinCount(int dim) {
    checkDimension(dim);
    return max(0, edges[dim].length - 3);
  }

  /**
   * Shape of the count array.
   *
   * @return Number of bins in each dimension.
   */
  public int[] shape() {
    int[] shape = new int[dimensions];
    for (int d = 0; d < dimensions; d++) {
      shape[d] = edges[d].length - 1;
    }
    return shape;
  }

  /**
   * Count in one hyper-bin.
   *
   * @param index Bin index in each dimension.
   * @return The accumulated weight.
   */
  public double getCount(int... index) {
    if (index.length != dimensions) {
      throw new DimensionMismatchException(dimensions, index.length, "number of bin indices");
    }
    int[] strides = strides();
    int flat = 0;
    for (int d = 0; d < dimensions; d++) {
      if (index[d] < 0 || index[d] >= edges[d].length - 1) {
        throw new IndexOutOfBoundsException(
            format(" Bin index %d is out of range for dimension %d.", index[d], d));
      }
      flat += index[d] * strides[d];
    }
    return counts[flat];
  }

  /**
   * Flattened counts, first dimension slowest.
   *
   * @return A copy of the counts.
   */
  public double[] getCounts() {
    return copyOf(counts, counts.length);
  }

  /**
   * Total accumulated weight, including the infinite bins.
   *
   * @return The total count.
   */
  public double totalCount() {
    double sum = 0.0;
    for (double c : counts) {
      sum += c;
    }
    return sum;
  }

  /**
   * Derived quantities of every bin along a dimension.
   *
   * @param dim Dimension.
   * @param what Quantity to compute.
   * @return One value per bin, including the infinite bins.
   */
  public double[] bins(int dim, BinQuantity what) {
    checkDimension(dim);
    double[] e = edges[dim];
    int n = e.length - 1;
    double[] values = new double[n];
    for (int i = 0; i < n; i++) {
      double lower = e[i];
      double upper = e[i + 1];
      switch (what) {
        case LOWER:
          values[i] = lower;
          break;
        case UPPER:
          values[i] = upper;
          break;
        case WIDTH:
          values[i] = upper - lower;
          break;
        case CENTRE:
        default:
          if (isFinite(lower) && isFinite(upper)) {
            values[i] = 0.5 * (lower + upper);
          } else if (isFinite(lower)) {
            values[i] = POSITIVE_INFINITY;
          } else if (isFinite(upper)) {
            values[i] = NEGATIVE_INFINITY;
          } else {
            // The single bin of a dimension without finite bins has no centre.
            values[i] = Double.NaN;
          }
          break;
      }
    }
    return values;
  }

  /**
   * Normalized probability of every hyper-bin, including the infinite bins.
   *
   * @return Flattened probabilities (all zero for an empty histogram).
   */
  public double[] probabilities() {
    double total = totalCount();
    double[] p = new double[counts.length];
    if (total > 0.0) {
      for (int i = 0; i < counts.length; i++) {
        p[i] = counts[i] / total;
      }
    }
    return p;
  }

  /**
   * Probability density of every hyper-bin: probability divided by the hyper-bin volume. Bins with
   * an infinite width have zero density.
   *
   * @return Flattened probability densities.
   */
  public double[] densities() {
    double[] p = probabilities();
    double[][] widths = new double[dimensions][];
    for (int d = 0; d < dimensions; d++) {
      widths[d] = bins(d, BinQuantity.WIDTH);
    }
    int[] shape = shape();
    int[] index = new int[dimensions];
    for (int i = 0; i < p.length; i++) {
      double volume = 1.0;
      for (int d = 0; d < dimensions; d++) {
        volume *= widths[d][index[d]];
      }
      p[i] = isFinite(volume) ? p[i] / volume : 0.0;
      // Advance the multi-index, last dimension fastest.
      for (int d = dimensions - 1; d >= 0; d--) {
        if (++index[d] < shape[d]) {
          break;
        }
        index[d] = 0;
      }
    }
    return p;
  }

  /**
   * Finite range of a dimension.
   *
   * @param dim Dimension.
   * @return The smallest and largest finite bin edges, or NaN if there are no finite bins.
   */
  public double[] range(int dim) {
    checkDimension(dim);
    double[] e = edges[dim];
    if (e.length < 4) {
      return new double[] {Double.NaN, Double.NaN};
    }
    return new double[] {e[1], e[e.length - 2]};
  }

  /**
   * Counts along one dimension, summed over every other dimension.
   *
   * @param dim Dimension.
   * @return Marginal counts, one per bin including the infinite bins.
   */
  public double[] marginal(int dim) {
    checkDimension(dim);
    int n = edges[dim].length - 1;
    int stride = strides()[dim];
    double[] m = new double[n];
    for (int i = 0; i < counts.length; i++) {
      m[(i / stride) % n] += counts[i];
    }
    return m;
  }

  /**
   * A deep copy of this histogram.
   *
   * @return A new Histogram.
   */
  public Histogram copy() {
    return new Histogram(edges, counts);
  }

  /**
   * Throws an IllegalArgumentException if the dimension is out of range.
   *
   * @param dim Dimension to check.
   */
  void checkDimension(int dim) {
    if (dim < 0 || dim >= dimensions) {
      throw new IllegalArgumentException(
          format(" Dimension %d is not in the range 0-%d.", dim, dimensions - 1));
    }
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(
        format(" Histogram of %d dimension(s) with total count %g", dimensions, totalCount()));
    for (int d = 0; d < dimensions; d++) {
      double[] r = range(d);
      sb.append(format("\n  Dimension %d: %d finite bins over [%g, %g]", d, finiteBinCount(d),
          r[0], r[1]));
    }
    return sb.toString();
  }
}
