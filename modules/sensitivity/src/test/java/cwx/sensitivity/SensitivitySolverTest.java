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

import static java.util.Arrays.fill;
import static org.apache.commons.math3.util.FastMath.abs;
import static org.apache.commons.math3.util.FastMath.exp;
import static org.apache.commons.math3.util.FastMath.log;
import static org.apache.commons.math3.util.FastMath.sqrt;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import cwx.numerics.histogram.Histogram;
import cwx.numerics.histogram.InvalidHistogramShapeException;
import cwx.numerics.special.ChiSquare;
import cwx.utilities.CWXTest;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.Before;
import org.junit.Test;

/**
 * Tests the sensitivity solver with false dismissal probabilities whose roots are known.
 *
 * @author CWX Developers
 */
public class SensitivitySolverTest extends CWXTest {

  /** pd(x) = exp(-x), so that rho^2 = -log(pd) for a unit geometric factor. */
  private static final FalseDismissalProbability EXPONENTIAL = (rows, pd, ns, nonCentrality) -> {
    double[] p = new double[rows.length];
    for (int k = 0; k < rows.length; k++) {
      p[k] = exp(-nonCentrality[k]);
    }
    return p;
  };

  private BaseConfiguration properties;

  @Before
  public void setUp() {
    properties = new BaseConfiguration();
    properties.addProperty("sensitivity-seed", 8675309L);
  }

  @Test
  public void testExponentialRoots() {
    double[] pd = {0.5, 0.2, 0.1, 0.05, 0.01};
    SensitivitySolver solver = new SensitivitySolver(properties);
    SensitivityResult result = solver.solve(pd, new double[] {1.0}, GeometricFactor.of(1.0),
        EXPONENTIAL);
    assertEquals(pd.length, result.size());
    for (int i = 0; i < pd.length; i++) {
      assertEquals(" Row " + i, sqrt(-log(pd[i])), result.getRho(i), 1.0e-6);
      assertTrue(abs(result.getPdRho(i) - pd[i]) / pd[i] < 1.0e-3);
    }
  }

  @Test
  public void testRhoIncreasesAsPdDecreases() {
    double[] pd = {0.5, 0.3, 0.1, 0.05, 0.01, 0.001};
    SensitivitySolver solver = new SensitivitySolver(properties);
    FalseDismissalProbability fdp = ChiSquareFalseDismissal.withFalseAlarm(4.0,
        new double[] {10.0}, new double[] {1.0e-10});
    SensitivityResult result = solver.solve(pd, new double[] {10.0}, GeometricFactor.of(1.0), fdp);
    for (int i = 1; i < pd.length; i++) {
      assertTrue(" Row " + i, result.getRho(i) >= result.getRho(i - 1));
    }
    for (int i = 0; i < pd.length; i++) {
      assertTrue(abs(result.getPdRho(i) - pd[i]) / pd[i] < 1.0e-3);
    }
  }

  @Test
  public void testHistogramQuadrature() {
    // Half of the probability at R^2 = 0.5 and half at R^2 = 1.5.
    Histogram rSqr = Histogram.create(new double[][] {{0.5}, {1.5}}, 1.0);
    SensitivitySolver solver = new SensitivitySolver(properties);
    SensitivityResult result = solver.solve(new double[] {0.1}, new double[] {1.0},
        GeometricFactor.of(rSqr), EXPONENTIAL);
    double rhoSqr = result.getRho(0) * result.getRho(0);
    double expected = 0.5 * (exp(-0.5 * rhoSqr) + exp(-1.5 * rhoSqr));
    assertEquals(0.1, expected, 1.0e-7);
    assertEquals(expected, result.getPdRho(0), 1.0e-7);
  }

  @Test
  public void testChiSquareAtSolution() {
    double ns = 5.0;
    double sa = ChiSquare.invFalseAlarm(1.0e-6, 4.0 * ns);
    FalseDismissalProbability fdp = ChiSquareFalseDismissal.withThreshold(4.0, new double[] {sa});
    SensitivityResult result = new SensitivitySolver(properties).solve(new double[] {0.1},
        new double[] {ns}, GeometricFactor.of(1.0), fdp);
    double rhoSqr = result.getRho(0) * result.getRho(0);
    assertEquals(0.1, ChiSquare.noncentralCdf(sa, 4.0 * ns, ns * rhoSqr), 1.0e-4);
  }

  @Test
  public void testRowsMetAtZeroSnrAreNaN() {
    FalseDismissalProbability fdp = (rows, pd, ns, nonCentrality) -> {
      double[] p = new double[rows.length];
      for (int k = 0; k < rows.length; k++) {
        p[k] = 0.5 * exp(-nonCentrality[k]);
      }
      return p;
    };
    SensitivityResult result = new SensitivitySolver(properties).solve(new double[] {0.8, 0.1},
        new double[] {1.0}, GeometricFactor.of(1.0), fdp);
    assertTrue(Double.isNaN(result.getRho(0)));
    assertTrue(Double.isNaN(result.getPdRho(0)));
    assertEquals(sqrt(log(5.0)), result.getRho(1), 1.0e-6);
  }

  @Test
  public void testExactHitConverges() {
    FalseDismissalProbability step = (rows, pd, ns, nonCentrality) -> {
      double[] p = new double[rows.length];
      for (int k = 0; k < rows.length; k++) {
        double x = nonCentrality[k];
        p[k] = (x < 1.0) ? 0.9 : (x < 3.0) ? 0.5 : 0.1;
      }
      return p;
    };
    SensitivityResult result = new SensitivitySolver(properties).solve(new double[] {0.5},
        new double[] {1.0}, GeometricFactor.of(1.0), step);
    double rhoSqr = result.getRho(0) * result.getRho(0);
    assertEquals(0.5, result.getPdRho(0), 0.0);
    assertTrue(rhoSqr >= 1.0 && rhoSqr < 3.0);
  }

  @Test
  public void testSeedReproducesResult() {
    double[] pd = {0.3, 0.05};
    SensitivityResult first = new SensitivitySolver(properties).solve(pd, new double[] {1.0},
        GeometricFactor.of(2.0), EXPONENTIAL);
    SensitivityResult second = new SensitivitySolver(properties).solve(pd, new double[] {1.0},
        GeometricFactor.of(2.0), EXPONENTIAL);
    assertArrayEquals(first.getRho(), second.getRho(), 0.0);
    assertArrayEquals(first.getPdRho(), second.getPdRho(), 0.0);
  }

  @Test
  public void testListener() {
    List<SolverPhase> phases = new ArrayList<>();
    SensitivitySolver solver = new SensitivitySolver(properties);
    solver.setListener((phase, round, activeRows) -> {
      phases.add(phase);
      throw new IllegalStateException(" Listener failures must not abort a solve.");
    });
    SensitivityResult result = solver.solve(new double[] {0.1}, new double[] {1.0},
        GeometricFactor.of(1.0), EXPONENTIAL);
    assertEquals(sqrt(-log(0.1)), result.getRho(0), 1.0e-6);
    assertEquals(SolverPhase.ZERO_CHECK, phases.get(0));
    assertEquals(SolverPhase.BRACKETING, phases.get(1));
    assertEquals(SolverPhase.BISECTION, phases.get(phases.size() - 1));
  }

  @Test
  public void testBracketingFailure() {
    properties.addProperty("sensitivity-max-bracket", 20);
    FalseDismissalProbability constant = (rows, pd, ns, nonCentrality) -> {
      double[] p = new double[rows.length];
      fill(p, 0.9);
      return p;
    };
    try {
      new SensitivitySolver(properties).solve(new double[] {0.1, 0.95}, new double[] {1.0},
          GeometricFactor.of(1.0), constant);
      fail(" A false dismissal probability that never falls below the target cannot converge.");
    } catch (ConvergenceFailureException e) {
      assertEquals(SolverPhase.BRACKETING, e.phase);
      assertEquals(20, e.rounds);
      assertArrayEquals(new int[] {0}, e.getRows());
    }
  }

  @Test
  public void testBisectionFailure() {
    properties.addProperty("sensitivity-max-bisection", 200);
    FalseDismissalProbability step = (rows, pd, ns, nonCentrality) -> {
      double[] p = new double[rows.length];
      for (int k = 0; k < rows.length; k++) {
        p[k] = (nonCentrality[k] < 2.0) ? 0.9 : 0.1;
      }
      return p;
    };
    try {
      new SensitivitySolver(properties).solve(new double[] {0.5}, new double[] {1.0},
          GeometricFactor.of(1.0), step);
      fail(" A discontinuous false dismissal probability cannot meet the pd tolerance.");
    } catch (ConvergenceFailureException e) {
      assertEquals(SolverPhase.BISECTION, e.phase);
      assertArrayEquals(new int[] {0}, e.getRows());
    }
  }

  @Test
  public void testNonFiniteFalseDismissal() {
    FalseDismissalProbability broken = (rows, pd, ns, nonCentrality) -> {
      double[] p = new double[rows.length];
      fill(p, Double.NaN);
      return p;
    };
    try {
      new SensitivitySolver(properties).solve(new double[] {0.1}, new double[] {1.0},
          GeometricFactor.of(1.0), broken);
      fail(" A NaN false dismissal probability should be reported.");
    } catch (ConvergenceFailureException e) {
      assertEquals(SolverPhase.ZERO_CHECK, e.phase);
    }
  }

  @Test(expected = UnboundedMassException.class)
  public void testUnboundedGeometricFactor() {
    Histogram rSqr = Histogram.create(new double[][] {{0.5}, {Double.POSITIVE_INFINITY}}, 0.1);
    new SensitivitySolver(properties).solve(new double[] {0.1}, new double[] {1.0},
        GeometricFactor.of(rSqr), EXPONENTIAL);
  }

  @Test(expected = NegativeDomainException.class)
  public void testNegativeGeometricFactor() {
    Histogram rSqr = Histogram.create(new double[][] {{-0.5}, {0.5}}, 0.1);
    GeometricFactor.of(rSqr);
  }

  @Test(expected = InvalidHistogramShapeException.class)
  public void testTwoDimensionalGeometricFactor() {
    Histogram rSqr = Histogram.create(new double[][] {{0.5, 0.5}}, 0.1);
    GeometricFactor.of(rSqr);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testRejectsProbabilityOne() {
    new SensitivitySolver(properties).solve(new double[] {0.1, 1.0}, new double[] {1.0},
        GeometricFactor.of(1.0), EXPONENTIAL);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testRejectsMismatchedRows() {
    new SensitivitySolver(properties).solve(new double[] {0.1, 0.2}, new double[] {1.0, 2.0, 3.0},
        GeometricFactor.of(1.0), EXPONENTIAL);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testRejectsNonPositiveSegments() {
    new SensitivitySolver(properties).solve(new double[] {0.1}, new double[] {0.0},
        GeometricFactor.of(1.0), EXPONENTIAL);
  }
}
