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
import static java.lang.String.format;
import static java.lang.System.arraycopy;
import static java.util.Arrays.binarySearch;
import static java.util.Arrays.copyOf;
import static java.util.Arrays.copyOfRange;
import static java.util.Arrays.fill;
import static java.util.Arrays.sort;
import static org.apache.commons.math3.util.FastMath.abs;
import static org.apache.commons.math3.util.FastMath.max;
import static org.apache.commons.math3.util.FastMath.min;

import java.util.logging.Logger;

/**
 * The HistogramResampler class rebins a {@link Histogram} onto new bin edges.
 *
 * <p>Probability is redistributed by linear interpolation of the cumulative distribution along the
 * resampled dimension, which assumes a uniform density within each old bin. Total mass is conserved,
 * and the counts of the two infinite bins are carried over unchanged. When the new edges are an exact
 * superset of the old ones no interpolation is needed and the old counts are kept.
 *
 * @author CWX Developers
 * @since 1.0
 */
public final class HistogramResampler {

  private static final Logger logger = Logger.getLogger(HistogramResampler.class.getName());

  /** Edges closer than this (relative to their magnitude) are the same edge. */
  private static final double EDGE_TOLERANCE = 1.0e-12;

  private HistogramResampler() {
    // Prevent instantiation.
  }

  /**
   * Resample every dimension of a histogram; equivalent to resampling each dimension in turn.
   *
   * @param histogram Histogram to resample.
   * @param newEdges New bin edges, one array per dimension.
   * @return A new Histogram.
   */
  public static Histogram resample(Histogram histogram, double[]... newEdges) {
    int dimensions = histogram.getDimensions();
    if (newEdges.length != dimensions) {
      throw new DimensionMismatchException(dimensions, newEdges.length,
          "number of new bin edge vectors");
    }
    Histogram resampled = histogram;
    for (int d = 0; d < dimensions; d++) {
      resampled = resample(resampled, d, newEdges[d]);
    }
    return resampled;
  }

  /**
   * Resample one dimension of a histogram onto new bin edges. Non-finite new edges are ignored, and
   * the remainder are sorted and de-duplicated.
   *
   * @param histogram Histogram to resample.
   * @param dim Dimension to resample.
   * @param newEdges New finite bin edges.
   * @return A new Histogram.
   */
  public static Histogram resample(Histogram histogram, int dim, double[] newEdges) {
    histogram.checkDimension(dim);
    double[][] edges = new double[histogram.getDimensions()][];
    for (int d = 0; d < edges.length; d++) {
      edges[d] = histogram.getEdges(d);
    }
    double[] oldEdges = finiteEdges(edges[dim]);
    double[] counts = histogram.getCounts();

    if (oldEdges.length == 0) {
      // Only the single unbounded bin exists along this dimension, so there is nothing to interpolate.
      for (double c : counts) {
        if (c != 0.0) {
          throw new IllegalStateException(format(
              " Dimension %d holds mass but has no finite bins to resample from.", dim));
        }
      }
      double[] fin = cleanEdges(newEdges, oldEdges);
      edges[dim] = withSentinels(fin);
      int size = 1;
      for (double[] e : edges) {
        size *= e.length - 1;
      }
      return new Histogram(edges, new double[size]);
    }

    double[] fin = cleanEdges(newEdges, oldEdges);
    double oldMin = oldEdges[0];
    double oldMax = oldEdges[oldEdges.length - 1];
    if (fin.length == 0 || !(fin[0] <= oldMin) || !(fin[fin.length - 1] >= oldMax)) {
      double[] newRange = (fin.length == 0) ? new double[] {Double.NaN, Double.NaN}
          : new double[] {fin[0], fin[fin.length - 1]};
      throw new RangeCoverageException(dim, new double[] {oldMin, oldMax}, newRange);
    }

    // Counts are viewed as [outer][bin along dim][inner].
    int nOld = oldEdges.length + 1;
    int nNew = fin.length + 1;
    int[] shape = histogram.shape();
    int outer = 1;
    for (int d = 0; d < dim; d++) {
      outer *= shape[d];
    }
    int inner = 1;
    for (int d = dim + 1; d < shape.length; d++) {
      inner *= shape[d];
    }

    int nLow = isSuperset(fin, oldEdges);
    double[] newCounts = new double[outer * nNew * inner];
    double[] line = new double[nOld];
    double[] newLine = new double[nNew];
    for (int o = 0; o < outer; o++) {
      for (int i = 0; i < inner; i++) {
        for (int k = 0; k < nOld; k++) {
          line[k] = counts[(o * nOld + k) * inner + i];
        }
        if (nLow >= 0) {
          extend(line, newLine, nLow);
        } else {
          interpolate(oldEdges, line, fin, newLine);
        }
        for (int k = 0; k < nNew; k++) {
          newCounts[(o * nNew + k) * inner + i] = newLine[k];
        }
      }
    }

    if (nLow < 0) {
      logger.fine(format(" Interpolated dimension %d from %d to %d finite bins.", dim,
          oldEdges.length - 1, fin.length - 1));
    }
    edges[dim] = withSentinels(fin);
    return new Histogram(edges, newCounts);
  }

  /**
   * Copy counts into a longer line, padding with zero bins below and above the old range.
   */
  private static void extend(double[] line, double[] newLine, int nLow) {
    int nOld = line.length;
    fill(newLine, 0.0);
    newLine[0] = line[0];
    newLine[newLine.length - 1] = line[nOld - 1];
    arraycopy(line, 1, newLine, 1 + nLow, nOld - 2);
  }

  /**
   * Redistribute the finite counts of one line by interpolating the cumulative mass at each new
   * edge.
   */
  private static void interpolate(double[] oldEdges, double[] line, double[] newEdges,
      double[] newLine) {
    int nFinite = oldEdges.length - 1;
    double[] cumulative = new double[newEdges.length];
    for (int j = 0; j < newEdges.length; j++) {
      double x = newEdges[j];
      double sum = 0.0;
      for (int k = 0; k < nFinite; k++) {
        double lower = oldEdges[k];
        double width = oldEdges[k + 1] - lower;
        double fraction = min(1.0, max(0.0, (x - lower) / width));
        sum += line[k + 1] * fraction;
      }
      cumulative[j] = sum;
    }
    newLine[0] = line[0];
    newLine[newLine.length - 1] = line[line.length - 1];
    for (int j = 0; j < newEdges.length - 1; j++) {
      newLine[j + 1] = max(0.0, cumulative[j + 1] - cumulative[j]);
    }
  }

  /**
   * If the new edges contain exactly the old edges within the old range, return the number of new
   * edges below the old range; otherwise return -1.
   */
  private static int isSuperset(double[] newEdges, double[] oldEdges) {
    int first = binarySearch(newEdges, oldEdges[0]);
    if (first < 0 || first + oldEdges.length > newEdges.length) {
      return -1;
    }
    for (int k = 0; k < oldEdges.length; k++) {
      if (newEdges[first + k] != oldEdges[k]) {
        return -1;
      }
    }
    return first;
  }

  /**
   * Drop non-finite values, snap values within rounding error of an old edge onto that edge, then
   * sort and de-duplicate.
   */
  static double[] cleanEdges(double[] newEdges, double[] oldEdges) {
    double[] fin = new double[newEdges.length];
    int n = 0;
    for (double x : newEdges) {
      if (isFinite(x)) {
        fin[n++] = snap(x, oldEdges);
      }
    }
    fin = copyOf(fin, n);
    sort(fin);
    int m = 0;
    for (int i = 0; i < n; i++) {
      if (m == 0 || fin[i] != fin[m - 1]) {
        fin[m++] = fin[i];
      }
    }
    return copyOf(fin, m);
  }

  private static double snap(double x, double[] oldEdges) {
    if (oldEdges.length == 0) {
      return x;
    }
    int i = binarySearch(oldEdges, x);
    if (i >= 0) {
      return x;
    }
    int ip = -i - 1;
    for (int k = max(0, ip - 1); k <= min(oldEdges.length - 1, ip); k++) {
      double e = oldEdges[k];
      if (abs(x - e) <= EDGE_TOLERANCE * max(abs(x), abs(e))) {
        return e;
      }
    }
    return x;
  }

  private static double[] finiteEdges(double[] edges) {
    return copyOfRange(edges, 1, edges.length - 1);
  }

  private static double[] withSentinels(double[] finite) {
    double[] e = new double[finite.length + 2];
    e[0] = NEGATIVE_INFINITY;
    arraycopy(finite, 0, e, 1, finite.length);
    e[e.length - 1] = POSITIVE_INFINITY;
    return e;
  }
}
