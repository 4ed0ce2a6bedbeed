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
package cwx.numerics.special;

import static java.lang.Double.isInfinite;
import static java.lang.String.format;
import static org.apache.commons.math3.special.Gamma.logGamma;
import static org.apache.commons.math3.special.Gamma.regularizedGammaP;
import static org.apache.commons.math3.special.Gamma.regularizedGammaQ;
import static org.apache.commons.math3.util.FastMath.exp;
import static org.apache.commons.math3.util.FastMath.floor;
import static org.apache.commons.math3.util.FastMath.log;
import static org.apache.commons.math3.util.FastMath.max;
import static org.apache.commons.math3.util.FastMath.min;
import static org.apache.commons.math3.util.FastMath.sqrt;

import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.analysis.solvers.BrentSolver;

/**
 * Central and non-central chi-square distribution functions, and the inverse false alarm
 * relation used to turn a false alarm probability into a detection threshold.
 *
 * <p>The non-central cumulative distribution is evaluated as a Poisson mixture of central
 * chi-square distributions, summed outwards from the Poisson mode. Successive central terms are
 * generated by the recurrence P(a + 1, y) = P(a, y) - y^a exp(-y) / Gamma(a + 1), so that only one
 * incomplete gamma function is evaluated per call.
 *
 * @author CWX Developers
 */
public class ChiSquare {

  /** Relative size below which further Poisson terms are dropped. */
  private static final double EPS = 1.0e-16;
  /** Safety bound on the number of Poisson terms summed in each direction. */
  private static final int MAX_TERMS = 10000000;
  /** Standard deviations below the mean beyond which the cumulative distribution is zero. */
  private static final double TAIL_SIGMAS = 40.0;
  /** Maximum evaluations used when inverting the false alarm probability. */
  private static final int MAX_EVALUATIONS = 1000;

  private ChiSquare() {
    // Prevent instantiation.
  }

  /**
   * Cumulative distribution function of the central chi-square distribution.
   *
   * @param x Value of the statistic.
   * @param k Degrees of freedom.
   * @return P(X &lt;= x).
   */
  public static double cdf(double x, double k) {
    checkDegreesOfFreedom(k);
    if (x <= 0.0) {
      return 0.0;
    }
    return regularizedGammaP(0.5 * k, 0.5 * x);
  }

  /**
   * Survival function of the central chi-square distribution.
   *
   * @param x Value of the statistic.
   * @param k Degrees of freedom.
   * @return P(X &gt; x).
   */
  public static double survival(double x, double k) {
    checkDegreesOfFreedom(k);
    if (x <= 0.0) {
      return 1.0;
    }
    return regularizedGammaQ(0.5 * k, 0.5 * x);
  }

  /**
   * False alarm probability of a threshold on a chi-square statistic in pure noise.
   *
   * @param threshold Threshold on the statistic.
   * @param k Degrees of freedom.
   * @return The false alarm probability.
   */
  public static double falseAlarm(double threshold, double k) {
    return survival(threshold, k);
  }

  /**
   * Cumulative distribution function of the non-central chi-square distribution.
   *
   * @param x Value of the statistic.
   * @param k Degrees of freedom.
   * @param lambda Non-centrality parameter.
   * @return P(X &lt;= x).
   */
  public static double noncentralCdf(double x, double k, double lambda) {
    checkDegreesOfFreedom(k);
    if (lambda < 0.0) {
      throw new IllegalArgumentException(format(" Non-centrality %g must be non-negative.", lambda));
    }
    if (x <= 0.0) {
      return 0.0;
    }
    if (lambda == 0.0) {
      return cdf(x, k);
    }
    if (isInfinite(lambda)) {
      return 0.0;
    }
    // Far below the mean the lower tail is negligible.
    double sigma = sqrt(2.0 * (k + 2.0 * lambda));
    if (x < k + lambda - TAIL_SIGMAS * sigma) {
      return 0.0;
    }

    double h = 0.5 * lambda;
    double y = 0.5 * x;
    double a0 = 0.5 * k;
    double logY = log(y);
    long j0 = (long) floor(h);

    double w0 = exp(-h + j0 * log(h) - logGamma(j0 + 1.0));
    double p0 = regularizedGammaP(a0 + j0, y);
    double sum = w0 * p0;

    // Upwards from the mode; both the weights and the central terms decrease.
    double w = w0;
    double p = p0;
    for (long j = j0 + 1; j - j0 < MAX_TERMS; j++) {
      double a = a0 + j - 1;
      p = max(0.0, p - exp(a * logY - y - logGamma(a + 1.0)));
      w *= h / j;
      double term = w * p;
      sum += term;
      if (term <= EPS * sum) {
        break;
      }
    }

    // Downwards from the mode; the central terms increase but are bounded by one.
    w = w0;
    p = p0;
    for (long j = j0 - 1; j >= 0 && j0 - j < MAX_TERMS; j--) {
      double a = a0 + j;
      p = min(1.0, p + exp(a * logY - y - logGamma(a + 1.0)));
      w *= (j + 1) / h;
      sum += w * p;
      if (w <= EPS * sum) {
        break;
      }
    }

    return min(1.0, sum);
  }

  /**
   * Threshold on a central chi-square statistic that gives the requested false alarm probability.
   * The equation is solved in logarithmic form so that very small probabilities keep full relative
   * accuracy.
   *
   * @param pFA False alarm probability, in (0, 1).
   * @param k Degrees of freedom.
   * @return The threshold.
   */
  public static double invFalseAlarm(double pFA, double k) {
    checkDegreesOfFreedom(k);
    if (!(pFA > 0.0 && pFA < 1.0)) {
      throw new IllegalArgumentException(format(" False alarm probability %g must be in (0, 1).", pFA));
    }
    final double logPFA = log(pFA);
    UnivariateFunction f = (double x) -> log(survival(x, k)) - logPFA;

    // Bracket the root; the survival function decreases from 1 at x = 0.
    double lo = 0.0;
    double hi = max(k, 1.0);
    double fHi = f.value(hi);
    while (fHi > 0.0) {
      lo = hi;
      hi *= 1.5;
      fHi = f.value(hi);
    }
    while (isInfinite(fHi)) {
      // The survival function underflowed; pull the upper bracket back.
      double mid = 0.5 * (lo + hi);
      double fMid = f.value(mid);
      if (fMid > 0.0) {
        lo = mid;
      } else {
        hi = mid;
        fHi = fMid;
      }
    }

    BrentSolver solver = new BrentSolver(1.0e-15, 1.0e-12);
    return solver.solve(MAX_EVALUATIONS, f, lo, hi);
  }

  private static void checkDegreesOfFreedom(double k) {
    if (!(k > 0.0)) {
      throw new IllegalArgumentException(format(" Degrees of freedom %g must be positive.", k));
    }
  }
}
