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

import static java.lang.String.format;
import static java.util.Arrays.copyOfRange;
import static org.apache.commons.math3.util.FastMath.max;
import static org.apache.commons.math3.util.FastMath.sqrt;

import cwx.numerics.histogram.Histogram.BinQuantity;

/**
 * The HistogramStatistics class computes marginal moments of a {@link Histogram}, and the
 * probability view (bin centres, widths, probabilities and densities) along one dimension.
 *
 * <p>Moments are only defined when no probability lies in the infinite bins of the dimension
 * concerned; otherwise an {@link InfiniteMassException} is thrown.
 *
 * @author CWX Developers
 * @since 1.0
 */
public final class HistogramStatistics {

  private HistogramStatistics() {
    // Prevent instantiation.
  }

  /**
   * Marginal probabilities, centres and widths of the bins along one dimension.
   */
  public static class ProbabilityView {

    /** Bin centres, including the infinite bins. */
    public final double[] centres;
    /** Bin widths, including the infinite bins. */
    public final double[] widths;
    /** Marginal probability of each bin, including the infinite bins. */
    public final double[] probabilities;
    /** Marginal probability density of each bin (zero in the infinite bins). */
    public final double[] densities;

    ProbabilityView(double[] centres, double[] widths, double[] probabilities) {
      this.centres = centres;
      this.widths = widths;
      this.probabilities = probabilities;
      densities = new double[probabilities.length];
      for (int i = 1; i < densities.length - 1; i++) {
        densities[i] = probabilities[i] / widths[i];
      }
    }

    /**
     * Number of bins, including the infinite bins.
     *
     * @return The number of bins.
     */
    public int size() {
      return probabilities.length;
    }

    /**
     * Probability in the negative infinity bin.
     *
     * @return The probability.
     */
    public double lowerInfiniteMass() {
      return probabilities[0];
    }

    /**
     * Probability in the positive infinity bin.
     *
     * @return The probability.
     */
    public double upperInfiniteMass() {
      return probabilities[probabilities.length - 1];
    }

    /**
     * Centres of the finite bins.
     *
     * @return Centres with the infinite bins removed.
     */
    public double[] finiteCentres() {
      if (centres.length < 3) {
        return new double[0];
      }
      return copyOfRange(centres, 1, centres.length - 1);
    }

    /**
     * Probabilities of the finite bins, i.e. density times width.
     *
     * @return Probabilities with the infinite bins removed.
     */
    public double[] finiteProbabilities() {
      double[] p = new double[max(0, probabilities.length - 2)];
      for (int i = 0; i < p.length; i++) {
        p[i] = densities[i + 1] * widths[i + 1];
      }
      return p;
    }
  }

  /**
   * The probability view of a histogram along one dimension.
   *
   * @param histogram Histogram.
   * @param dim Dimension.
   * @return The marginal probability view.
   */
  public static ProbabilityView probabilityView(Histogram histogram, int dim) {
    double[] marginal = histogram.marginal(dim);
    double total = 0.0;
    for (double m : marginal) {
      total += m;
    }
    if (total > 0.0) {
      for (int i = 0; i < marginal.length; i++) {
        marginal[i] /= total;
      }
    }
    return new ProbabilityView(histogram.bins(dim, BinQuantity.CENTRE),
        histogram.bins(dim, BinQuantity.WIDTH), marginal);
  }

  /**
   * Mean of a histogram along one dimension.
   *
   * @param histogram Histogram.
   * @param dim Dimension.
   * @return The mean (NaN for an empty histogram).
   */
  public static double meanOf(Histogram histogram, int dim) {
    ProbabilityView view = finiteView(histogram, dim);
    if (view == null) {
      return Double.NaN;
    }
    double mean = 0.0;
    for (int i = 1; i < view.size() - 1; i++) {
      mean += view.centres[i] * view.probabilities[i];
    }
    return mean;
  }

  /**
   * Variance of a histogram along one dimension.
   *
   * @param histogram Histogram.
   * @param dim Dimension.
   * @return The variance (NaN for an empty histogram).
   */
  public static double varianceOf(Histogram histogram, int dim) {
    ProbabilityView view = finiteView(histogram, dim);
    if (view == null) {
      return Double.NaN;
    }
    double mean = meanOf(histogram, dim);
    double var = 0.0;
    for (int i = 1; i < view.size() - 1; i++) {
      double dx = view.centres[i] - mean;
      var += dx * dx * view.probabilities[i];
    }
    return var;
  }

  /**
   * Standard deviation of a histogram along one dimension.
   *
   * @param histogram Histogram.
   * @param dim Dimension.
   * @return The standard deviation (NaN for an empty histogram).
   */
  public static double stdDevOf(Histogram histogram, int dim) {
    return sqrt(varianceOf(histogram, dim));
  }

  /**
   * Describe the moments of every dimension.
   *
   * @param histogram Histogram.
   * @return The description.
   */
  public static String describe(Histogram histogram) {
    StringBuilder sb = new StringBuilder();
    for (int d = 0; d < histogram.getDimensions(); d++) {
      sb.append(format(" Dimension %d: mean %12.6f +/-%12.6f\n", d, meanOf(histogram, d),
          stdDevOf(histogram, d)));
    }
    return sb.toString();
  }

  /**
   * The probability view along a dimension, checked for mass in the infinite bins; null if the
   * histogram is empty.
   */
  private static ProbabilityView finiteView(Histogram histogram, int dim) {
    ProbabilityView view = probabilityView(histogram, dim);
    if (histogram.totalCount() <= 0.0) {
      return null;
    }
    if (view.lowerInfiniteMass() != 0.0 || view.upperInfiniteMass() != 0.0) {
      throw new InfiniteMassException(dim, view.lowerInfiniteMass(), view.upperInfiniteMass());
    }
    return view;
  }
}
