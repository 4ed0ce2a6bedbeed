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
package cwx.sensitivity;

import static java.lang.Double.isFinite;
import static java.lang.String.format;
import static java.util.Arrays.copyOf;
import static org.apache.commons.math3.util.FastMath.max;

import cwx.numerics.histogram.Histogram;
import cwx.numerics.histogram.HistogramStatistics;
import cwx.numerics.histogram.HistogramStatistics.ProbabilityView;
import cwx.numerics.histogram.InvalidHistogramShapeException;

/**
 * The distribution of the squared-SNR geometric factor R^2, reduced to quadrature nodes and weights.
 *
 * <p>The expectation of any function of R^2 is approximated by the weighted sum of the function at
 * the nodes. Nodes are the finite bin centres of a one-dimensional histogram and weights are their
 * probabilities; bins without probability are dropped.
 *
 * @author CWX Developers
 * @since 1.0
 */
public final class GeometricFactor {

  private final double[] nodes;
  private final double[] weights;

  private GeometricFactor(double[] nodes, double[] weights) {
    this.nodes = nodes;
    this.weights = weights;
  }

  /**
   * A geometric factor with a single value.
   *
   * @param rSqr The value of R^2.
   * @return A new GeometricFactor with one node of weight 1.
   */
  public static GeometricFactor of(double rSqr) {
    if (!isFinite(rSqr) || rSqr < 0.0) {
      throw new IllegalArgumentException(
          format(" The geometric factor %g must be finite and non-negative.", rSqr));
    }
    return new GeometricFactor(new double[] {rSqr}, new double[] {1.0});
  }

  /**
   * A geometric factor distributed as a histogram.
   *
   * @param histogram A one-dimensional histogram of R^2.
   * @return A new GeometricFactor.
   * @throws InvalidHistogramShapeException If the histogram is not one-dimensional.
   * @throws NegativeDomainException If a finite bin edge is negative.
   * @throws UnboundedMassException If either infinite bin holds probability.
   */
  public static GeometricFactor of(Histogram histogram) {
    ProbabilityView view = validate(histogram, "geometric factor");
    return fromView(view);
  }

  /**
   * The distribution of R^2 (1 - m), where the mismatch m is independent of R^2. Mismatches above
   * one give a non-centrality of zero.
   *
   * @param mismatch A one-dimensional histogram of the mismatch.
   * @return A new GeometricFactor.
   */
  public GeometricFactor withMismatch(Histogram mismatch) {
    GeometricFactor m = fromView(validate(mismatch, "mismatch"));
    int n = nodes.length * m.nodes.length;
    double[] productNodes = new double[n];
    double[] productWeights = new double[n];
    int k = 0;
    for (int i = 0; i < nodes.length; i++) {
      for (int j = 0; j < m.nodes.length; j++) {
        productNodes[k] = nodes[i] * max(0.0, 1.0 - m.nodes[j]);
        productWeights[k] = weights[i] * m.weights[j];
        k++;
      }
    }
    return new GeometricFactor(productNodes, productWeights);
  }

  /**
   * Quadrature nodes.
   *
   * @return A copy of the values of R^2.
   */
  public double[] getNodes() {
    return copyOf(nodes, nodes.length);
  }

  /**
   * Quadrature weights; they sum to one.
   *
   * @return A copy of the weights.
   */
  public double[] getWeights() {
    return copyOf(weights, weights.length);
  }

  /**
   * Number of quadrature nodes.
   *
   * @return The number of nodes.
   */
  public int size() {
    return nodes.length;
  }

  /**
   * Mean of R^2.
   *
   * @return The weighted mean of the nodes.
   */
  public double mean() {
    double mean = 0.0;
    for (int i = 0; i < nodes.length; i++) {
      mean += weights[i] * nodes[i];
    }
    return mean;
  }

  @Override
  public String toString() {
    return format(" Geometric factor with %d node(s), mean %.6f", nodes.length, mean());
  }

  /**
   * Checks the shape, domain and infinite mass of a histogram, in that order.
   */
  private static ProbabilityView validate(Histogram histogram, String what) {
    if (histogram.getDimensions() != 1) {
      throw new InvalidHistogramShapeException(1, histogram.getDimensions(), what);
    }
    double[] range = histogram.range(0);
    if (range[0] < 0.0) {
      throw new NegativeDomainException(range[0], what);
    }
    if (histogram.totalCount() <= 0.0) {
      throw new IllegalArgumentException(format(" The %s histogram is empty.", what));
    }
    ProbabilityView view = HistogramStatistics.probabilityView(histogram, 0);
    if (view.lowerInfiniteMass() != 0.0 || view.upperInfiniteMass() != 0.0) {
      throw new UnboundedMassException(view.lowerInfiniteMass(), view.upperInfiniteMass(), what);
    }
    return view;
  }

  private static GeometricFactor fromView(ProbabilityView view) {
    double[] centres = view.finiteCentres();
    double[] probabilities = view.finiteProbabilities();
    int n = 0;
    for (double p : probabilities) {
      if (p > 0.0) {
        n++;
      }
    }
    double[] nodes = new double[n];
    double[] weights = new double[n];
    int k = 0;
    for (int i = 0; i < centres.length; i++) {
      if (probabilities[i] > 0.0) {
        nodes[k] = centres[i];
        weights[k] = probabilities[i];
        k++;
      }
    }
    return new GeometricFactor(nodes, weights);
  }
}
