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
import static java.util.Arrays.fill;
import static org.apache.commons.math3.util.FastMath.abs;
import static org.apache.commons.math3.util.FastMath.max;
import static org.apache.commons.math3.util.FastMath.sqrt;

import cwx.utilities.CWXProperties;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

/**
 * The SensitivitySolver finds the squared SNR at which a detection statistic achieves a target false
 * dismissal probability.
 *
 * <p>The false dismissal probability at squared SNR rho^2 is the expectation, over the geometric
 * factor R^2, of the statistic's false dismissal probability at non-centrality rho^2 R^2. Rows of the
 * problem are independent but are advanced together: each round evaluates every active row in one
 * call of the {@link FalseDismissalProbability}.
 *
 * <p>The solve has three phases:
 * <br>
 * 1) The false dismissal probability at zero SNR is evaluated; rows where it already lies below the
 * target are not searched and report NaN.
 * <br>
 * 2) The upper end of the bracket starts at rho^2 = 1 and is doubled until the false dismissal
 * probability falls below the target.
 * <br>
 * 3) A point drawn uniformly within the bracket replaces the end on the same side of the target,
 * until both the relative error in the false dismissal probability and the relative width of the
 * bracket are within tolerance.
 *
 * <p>Properties read by this class:
 * <br>
 * sensitivity-max-bracket (default 1000): maximum number of bracket doublings.
 * <br>
 * sensitivity-max-bisection (default 100000): maximum number of bisection rounds.
 * <br>
 * sensitivity-pd-tolerance (default 1e-3): relative tolerance on the false dismissal probability.
 * <br>
 * sensitivity-width-tolerance (default 1e-8): relative tolerance on the bracket width.
 * <br>
 * sensitivity-seed: seed of the random bisection points (default: a random seed per solve).
 *
 * @author CWX Developers
 * @since 1.0
 */
public class SensitivitySolver {

  private static final Logger logger = Logger.getLogger(SensitivitySolver.class.getName());

  private final int maxBracket;
  private final int maxBisection;
  private final double pdTolerance;
  private final double widthTolerance;
  private final Long seed;
  private SensitivityListener listener = null;

  /** Constructs a SensitivitySolver configured from the CWX property files. */
  public SensitivitySolver() {
    this(CWXProperties.loadProperties());
  }

  /**
   * Constructs a SensitivitySolver.
   *
   * @param properties Solver properties.
   */
  public SensitivitySolver(Configuration properties) {
    maxBracket = properties.getInt("sensitivity-max-bracket", 1000);
    maxBisection = properties.getInt("sensitivity-max-bisection", 100000);
    pdTolerance = properties.getDouble("sensitivity-pd-tolerance", 1.0e-3);
    widthTolerance = properties.getDouble("sensitivity-width-tolerance", 1.0e-8);
    seed = properties.getLong("sensitivity-seed", null);
    if (maxBracket < 1 || maxBracket > 1000) {
      throw new IllegalArgumentException(
          format(" The maximum number of bracket doublings (%d) must be in 1-1000.", maxBracket));
    }
    if (maxBisection < 1) {
      throw new IllegalArgumentException(
          format(" The maximum number of bisection rounds (%d) must be positive.", maxBisection));
    }
    if (!(pdTolerance > 0.0) || !(widthTolerance > 0.0)) {
      throw new IllegalArgumentException(format(
          " Tolerances must be positive (pd %g, width %g).", pdTolerance, widthTolerance));
    }
  }

  /**
   * Set the listener informed of progress after each round.
   *
   * @param listener The listener (null to log progress instead).
   */
  public void setListener(SensitivityListener listener) {
    this.listener = listener;
  }

  /**
   * Find the detectable SNR of each row for a named detection statistic family.
   *
   * @param pd Target false dismissal probability of each row, in (0, 1).
   * @param ns Number of segments of each row.
   * @param geometricFactor Distribution of the geometric factor R^2.
   * @param family Selector of the detection statistic family, e.g. "ChiSqr".
   * @param options Options of the family.
   * @return The detectable SNR and achieved false dismissal probability of each row.
   * @throws UnknownStatisticFamilyException If the family is not known.
   */
  public SensitivityResult solve(double[] pd, double[] ns, GeometricFactor geometricFactor,
      String family, Configuration options) {
    int n = max(pd.length, ns.length);
    FalseDismissalProbability fdp = StatisticFamily.parse(family)
        .create(broadcast(ns, n, "segment counts"), options);
    return solve(pd, ns, geometricFactor, fdp);
  }

  /**
   * Find the detectable SNR of each row.
   *
   * @param pd Target false dismissal probability of each row, in (0, 1).
   * @param ns Number of segments of each row.
   * @param geometricFactor Distribution of the geometric factor R^2.
   * @param fdp False dismissal probability of the detection statistic.
   * @return The detectable SNR and achieved false dismissal probability of each row.
   * @throws ConvergenceFailureException If a row cannot be bracketed or isolated within the round
   *     limits.
   */
  public SensitivityResult solve(double[] pd, double[] ns, GeometricFactor geometricFactor,
      FalseDismissalProbability fdp) {
    int n = max(pd.length, ns.length);
    pd = broadcast(pd, n, "false dismissal probabilities");
    ns = broadcast(ns, n, "segment counts");
    for (int i = 0; i < n; i++) {
      if (!(pd[i] > 0.0 && pd[i] < 1.0)) {
        throw new IllegalArgumentException(
            format(" Row %d: false dismissal probability %g must be in (0, 1).", i, pd[i]));
      }
      if (!(ns[i] > 0.0) || !isFinite(ns[i])) {
        throw new IllegalArgumentException(
            format(" Row %d: number of segments %g must be finite and positive.", i, ns[i]));
      }
    }

    Evaluator evaluator = new Evaluator(pd, ns, geometricFactor, fdp);
    RandomGenerator random = (seed != null) ? new Well19937c(seed) : new Well19937c();

    double[] rhoSqr = new double[n];
    double[] pdRho = new double[n];
    double[] rhoSqrMin = new double[n];
    double[] rhoSqrMax = new double[n];
    double[] pdMin = new double[n];
    double[] pdMax = new double[n];
    boolean[] active = new boolean[n];
    fill(rhoSqr, Double.NaN);
    fill(pdRho, Double.NaN);
    fill(active, true);

    // Zero check.
    double[] pd0 = evaluator.evaluate(SolverPhase.ZERO_CHECK, 1, active, rhoSqrMin);
    boolean[] search = new boolean[n];
    for (int i = 0; i < n; i++) {
      pdMin[i] = pd0[i];
      search[i] = pd0[i] >= pd[i];
      if (!search[i]) {
        logger.info(format(" Row %d: the false dismissal probability at zero SNR (%g) is already"
            + " below the target %g.", i, pd0[i], pd[i]));
      }
    }
    update(SolverPhase.ZERO_CHECK, 1, count(search));

    // Bracket.
    fill(rhoSqrMax, 1.0);
    System.arraycopy(search, 0, active, 0, n);
    int round = 0;
    while (count(active) > 0) {
      if (round == maxBracket) {
        throw new ConvergenceFailureException(SolverPhase.BRACKETING, round, rows(active),
            "the false dismissal probability did not fall below the target");
      }
      round++;
      for (int i = 0; i < n; i++) {
        if (active[i]) {
          rhoSqrMax[i] *= 2.0;
        }
      }
      double[] p = evaluator.evaluate(SolverPhase.BRACKETING, round, active, rhoSqrMax);
      for (int i = 0; i < n; i++) {
        if (active[i]) {
          pdMax[i] = p[i];
          active[i] = pdMax[i] >= pd[i];
        }
      }
      update(SolverPhase.BRACKETING, round, count(active));
    }

    // Randomized bisection; one draw per row per round, shared by all active rows.
    System.arraycopy(search, 0, active, 0, n);
    double[] u = new double[n];
    round = 0;
    while (count(active) > 0) {
      if (round == maxBisection) {
        throw new ConvergenceFailureException(SolverPhase.BISECTION, round, rows(active),
            "the bracket did not converge");
      }
      round++;
      for (int i = 0; i < n; i++) {
        u[i] = random.nextDouble();
        if (active[i]) {
          rhoSqr[i] = rhoSqrMin[i] * u[i] + rhoSqrMax[i] * (1.0 - u[i]);
        }
      }
      double[] p = evaluator.evaluate(SolverPhase.BISECTION, round, active, rhoSqr);
      for (int i = 0; i < n; i++) {
        if (!active[i]) {
          continue;
        }
        pdRho[i] = p[i];
        if (pdMin[i] > pd[i] && pdRho[i] > pd[i]) {
          rhoSqrMin[i] = rhoSqr[i];
          pdMin[i] = pdRho[i];
        } else if (pdMax[i] < pd[i] && pdRho[i] < pd[i]) {
          rhoSqrMax[i] = rhoSqr[i];
          pdMax[i] = pdRho[i];
        }
        double pdError = abs(pdRho[i] - pd[i]) / pd[i];
        double widthError = (rhoSqrMax[i] - rhoSqrMin[i]) / rhoSqr[i];
        boolean converged = pdError < pdTolerance && widthError < widthTolerance;
        active[i] = !converged && pdRho[i] != pd[i];
      }
      update(SolverPhase.BISECTION, round, count(active));
    }

    double[] rho = new double[n];
    for (int i = 0; i < n; i++) {
      rho[i] = sqrt(rhoSqr[i]);
    }
    SensitivityResult result = new SensitivityResult(rho, pdRho);
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(format(" Sensitivity solve finished after %d bisection round(s).%s", round,
          result));
    }
    return result;
  }

  /** Inform the listener of progress, or log it. */
  private void update(SolverPhase phase, int round, int activeRows) {
    if (listener == null) {
      if (logger.isLoggable(Level.FINE)) {
        logger.fine(format(" %-12s round %6d: %d row(s) active.", phase, round, activeRows));
      }
      return;
    }
    try {
      listener.sensitivityUpdate(phase, round, activeRows);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, format(" Sensitivity listener failed in %s round %d.", phase,
          round), e);
    }
  }

  private static double[] broadcast(double[] values, int n, String what) {
    if (values.length == n) {
      return values.clone();
    }
    if (values.length != 1) {
      throw new IllegalArgumentException(
          format(" The %s have length %d; expected 1 or %d.", what, values.length, n));
    }
    double[] b = new double[n];
    fill(b, values[0]);
    return b;
  }

  private static int count(boolean[] flags) {
    int c = 0;
    for (boolean f : flags) {
      if (f) {
        c++;
      }
    }
    return c;
  }

  private static int[] rows(boolean[] flags) {
    int[] r = new int[count(flags)];
    int k = 0;
    for (int i = 0; i < flags.length; i++) {
      if (flags[i]) {
        r[k++] = i;
      }
    }
    return r;
  }

  /**
   * Evaluates the false dismissal probability of the active rows, averaged over the geometric
   * factor, in a single call of the detection statistic.
   */
  private static class Evaluator {

    private final double[] pd;
    private final double[] ns;
    private final double[] nodes;
    private final double[] weights;
    private final FalseDismissalProbability fdp;

    Evaluator(double[] pd, double[] ns, GeometricFactor geometricFactor,
        FalseDismissalProbability fdp) {
      this.pd = pd;
      this.ns = ns;
      this.nodes = geometricFactor.getNodes();
      this.weights = geometricFactor.getWeights();
      this.fdp = fdp;
    }

    /**
     * False dismissal probability at the given squared SNR for every active row; NaN elsewhere.
     */
    double[] evaluate(SolverPhase phase, int round, boolean[] active, double[] rhoSqr) {
      int[] activeRows = rows(active);
      int m = nodes.length;
      int size = activeRows.length * m;
      int[] r = new int[size];
      double[] p = new double[size];
      double[] s = new double[size];
      double[] nonCentrality = new double[size];
      for (int a = 0; a < activeRows.length; a++) {
        int i = activeRows[a];
        for (int j = 0; j < m; j++) {
          int k = a * m + j;
          r[k] = i;
          p[k] = pd[i];
          s[k] = ns[i];
          nonCentrality[k] = rhoSqr[i] * nodes[j];
        }
      }

      double[] values = (size > 0) ? fdp.falseDismissal(r, p, s, nonCentrality) : new double[0];
      if (values.length != size) {
        throw new IllegalStateException(format(
            " The false dismissal probability returned %d values for %d arguments.",
            values.length, size));
      }

      double[] result = new double[pd.length];
      fill(result, Double.NaN);
      for (int a = 0; a < activeRows.length; a++) {
        int i = activeRows[a];
        double sum = 0.0;
        for (int j = 0; j < m; j++) {
          sum += weights[j] * values[a * m + j];
        }
        if (!isFinite(sum)) {
          throw new ConvergenceFailureException(phase, round, new int[] {i},
              format("the false dismissal probability at rho^2 = %g is not finite", rhoSqr[i]));
        }
        result[i] = sum;
      }
      return result;
    }
  }
}
