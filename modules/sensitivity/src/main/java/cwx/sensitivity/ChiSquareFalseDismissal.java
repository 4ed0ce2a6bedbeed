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

import cwx.numerics.special.ChiSquare;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * False dismissal probability of a chi-square detection statistic, such as the F-statistic summed
 * over segments.
 *
 * <p>With dof degrees of freedom per segment, the statistic summed over Ns segments is non-central
 * chi-square distributed with dof Ns degrees of freedom and non-centrality Ns rho^2 R^2. A signal is
 * dismissed when the statistic lies below the threshold sa of its row.
 *
 * @author CWX Developers
 * @since 1.0
 */
public class ChiSquareFalseDismissal implements FalseDismissalProbability {

  private static final Logger logger = Logger.getLogger(ChiSquareFalseDismissal.class.getName());

  /** Degrees of freedom per segment of the F-statistic. */
  public static final double DEFAULT_DOF = 4.0;

  private final double dof;
  private final double[] sa;

  private ChiSquareFalseDismissal(double dof, double[] sa) {
    if (!(dof > 0.0)) {
      throw new IllegalArgumentException(format(" Degrees of freedom %g must be positive.", dof));
    }
    this.dof = dof;
    this.sa = sa;
  }

  /**
   * A chi-square statistic with a threshold on the summed statistic of each row.
   *
   * @param dof Degrees of freedom per segment.
   * @param sa Threshold of each row.
   * @return A new ChiSquareFalseDismissal.
   */
  public static ChiSquareFalseDismissal withThreshold(double dof, double[] sa) {
    for (int i = 0; i < sa.length; i++) {
      if (!(sa[i] >= 0.0) || Double.isInfinite(sa[i])) {
        throw new IllegalArgumentException(
            format(" Row %d: threshold %g must be finite and non-negative.", i, sa[i]));
      }
    }
    return new ChiSquareFalseDismissal(dof, copyOf(sa, sa.length));
  }

  /**
   * A chi-square statistic whose threshold gives the requested false alarm probability per
   * template.
   *
   * @param dof Degrees of freedom per segment.
   * @param ns Number of segments of each row.
   * @param paNt False alarm probability of each row.
   * @return A new ChiSquareFalseDismissal.
   */
  public static ChiSquareFalseDismissal withFalseAlarm(double dof, double[] ns, double[] paNt) {
    if (ns.length != paNt.length) {
      throw new IllegalArgumentException(format(
          " %d segment counts do not match %d false alarm probabilities.", ns.length, paNt.length));
    }
    double[] sa = new double[ns.length];
    for (int i = 0; i < ns.length; i++) {
      sa[i] = ChiSquare.invFalseAlarm(paNt[i], dof * ns[i]);
      if (logger.isLoggable(Level.FINE)) {
        logger.fine(format(" Row %d: false alarm %g with %g degrees of freedom gives threshold %.6f.",
            i, paNt[i], dof * ns[i], sa[i]));
      }
    }
    return new ChiSquareFalseDismissal(dof, sa);
  }

  /**
   * Degrees of freedom per segment.
   *
   * @return The degrees of freedom.
   */
  public double getDof() {
    return dof;
  }

  /**
   * Threshold of each row.
   *
   * @return A copy of the thresholds.
   */
  public double[] getThresholds() {
    return copyOf(sa, sa.length);
  }

  /** {@inheritDoc} */
  @Override
  public double[] falseDismissal(int[] rows, double[] pd, double[] ns, double[] nonCentrality) {
    double[] pdRho = new double[rows.length];
    for (int k = 0; k < rows.length; k++) {
      double threshold = sa[sa.length == 1 ? 0 : rows[k]];
      pdRho[k] = ChiSquare.noncentralCdf(threshold, dof * ns[k], ns[k] * nonCentrality[k]);
    }
    return pdRho;
  }
}
