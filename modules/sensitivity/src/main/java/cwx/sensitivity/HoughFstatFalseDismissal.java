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

import static java.lang.String.format;
import static java.util.Arrays.copyOf;
import static org.apache.commons.math3.util.FastMath.exp;
import static org.apache.commons.math3.util.FastMath.max;
import static org.apache.commons.math3.util.FastMath.min;
import static org.apache.commons.math3.util.FastMath.rint;

import cwx.numerics.special.ChiSquare;
import org.apache.commons.math3.distribution.BinomialDistribution;

/**
 * False dismissal probability of a Hough transform on the F-statistic.
 *
 * <p>Each of Ns segments contributes a count of one when its 2F value crosses the threshold Fth; a
 * signal is dismissed when the number count stays below the threshold nth. With a per-segment
 * crossing probability eta, the number count is binomially distributed.
 *
 * @author CWX Developers
 * @since 1.0
 */
public class HoughFstatFalseDismissal implements FalseDismissalProbability {

  /** Default threshold on 2F in each segment. */
  public static final double DEFAULT_FTH = 5.2;

  /** Degrees of freedom of 2F. */
  private static final double DOF = 4.0;

  private final double fth;
  private final int[] nth;

  private HoughFstatFalseDismissal(double fth, int[] nth) {
    this.fth = fth;
    this.nth = nth;
  }

  /**
   * A Hough statistic with a given number count threshold per row.
   *
   * @param fth Threshold on 2F in each segment.
   * @param nth Number count threshold of each row.
   * @return A new HoughFstatFalseDismissal.
   */
  public static HoughFstatFalseDismissal withThreshold(double fth, double[] nth) {
    checkFth(fth);
    int[] n = new int[nth.length];
    for (int i = 0; i < nth.length; i++) {
      if (!(nth[i] >= 0.0) || nth[i] != rint(nth[i]) || nth[i] > Integer.MAX_VALUE) {
        throw new IllegalArgumentException(
            format(" Row %d: number count threshold %g must be a non-negative integer.", i, nth[i]));
      }
      n[i] = (int) nth[i];
    }
    return new HoughFstatFalseDismissal(fth, n);
  }

  /**
   * A Hough statistic whose number count threshold gives at most the requested false alarm
   * probability per template.
   *
   * @param fth Threshold on 2F in each segment.
   * @param ns Number of segments of each row.
   * @param paNt False alarm probability of each row.
   * @return A new HoughFstatFalseDismissal.
   */
  public static HoughFstatFalseDismissal withFalseAlarm(double fth, double[] ns, double[] paNt) {
    checkFth(fth);
    if (ns.length != paNt.length) {
      throw new IllegalArgumentException(format(
          " %d segment counts do not match %d false alarm probabilities.", ns.length, paNt.length));
    }
    double eta0 = ChiSquare.survival(fth, DOF);
    int[] n = new int[ns.length];
    for (int i = 0; i < ns.length; i++) {
      if (!(paNt[i] > 0.0 && paNt[i] < 1.0)) {
        throw new IllegalArgumentException(
            format(" Row %d: false alarm probability %g must be in (0, 1).", i, paNt[i]));
      }
      n[i] = numberCountThreshold(segments(ns[i], i), eta0, paNt[i]);
    }
    return new HoughFstatFalseDismissal(fth, n);
  }

  /**
   * The smallest number count whose probability of being reached in noise is at most the false
   * alarm probability.
   *
   * @param segments Number of segments.
   * @param eta0 Per-segment crossing probability in noise.
   * @param paNt False alarm probability.
   * @return The number count threshold, between 0 and segments + 1.
   */
  static int numberCountThreshold(int segments, double eta0, double paNt) {
    BinomialDistribution noise = new BinomialDistribution(null, segments, eta0);
    // Upper tail sums from the largest count down keep small probabilities accurate.
    double tail = 0.0;
    int threshold = segments + 1;
    for (int n = segments; n >= 0; n--) {
      tail += exp(noise.logProbability(n));
      if (tail > paNt) {
        break;
      }
      threshold = n;
    }
    return threshold;
  }

  /**
   * Threshold on 2F in each segment.
   *
   * @return The threshold.
   */
  public double getFth() {
    return fth;
  }

  /**
   * Number count threshold of each row.
   *
   * @return A copy of the thresholds.
   */
  public int[] getNumberCountThresholds() {
    return copyOf(nth, nth.length);
  }

  /** {@inheritDoc} */
  @Override
  public double[] falseDismissal(int[] rows, double[] pd, double[] ns, double[] nonCentrality) {
    double[] pdRho = new double[rows.length];
    for (int k = 0; k < rows.length; k++) {
      int row = rows[k];
      int threshold = nth[nth.length == 1 ? 0 : row];
      if (threshold <= 0) {
        pdRho[k] = 0.0;
        continue;
      }
      double eta = 1.0 - ChiSquare.noncentralCdf(fth, DOF, nonCentrality[k]);
      eta = min(1.0, max(0.0, eta));
      BinomialDistribution signal = new BinomialDistribution(null, segments(ns[k], row), eta);
      pdRho[k] = signal.cumulativeProbability(threshold - 1);
    }
    return pdRho;
  }

  private static int segments(double ns, int row) {
    if (!(ns >= 1.0) || ns != rint(ns) || ns > Integer.MAX_VALUE) {
      throw new IllegalArgumentException(
          format(" Row %d: the Hough statistic needs a positive integer number of segments (%g).",
              row, ns));
    }
    return (int) ns;
  }

  private static void checkFth(double fth) {
    if (!(fth > 0.0) || Double.isInfinite(fth)) {
      throw new IllegalArgumentException(
          format(" The 2F threshold %g must be finite and positive.", fth));
    }
  }
}
