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

import static org.apache.commons.math3.util.FastMath.exp;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import cwx.utilities.CWXTest;
import org.junit.Test;

/**
 * Tests of the central chi-square functions and the inverse false alarm relation.
 *
 * @author CWX Developers
 */
public class ChiSquareTest extends CWXTest {

  @Test
  public void testCentralClosedForms() {
    // With two degrees of freedom the cdf is 1 - exp(-x/2).
    assertEquals(1.0 - exp(-1.5), ChiSquare.cdf(3.0, 2.0), 1.0e-14);
    // With four, the survival function is (1 + x/2) exp(-x/2).
    assertEquals(6.0 * exp(-5.0), ChiSquare.survival(10.0, 4.0), 1.0e-14);
    assertEquals(0.0645703689211329758, ChiSquare.falseAlarm(100.0, 80.0), 1.0e-12);
    assertEquals(1.0, ChiSquare.cdf(100.0, 80.0) + ChiSquare.survival(100.0, 80.0), 1.0e-14);
  }

  @Test
  public void testBoundaries() {
    assertEquals(0.0, ChiSquare.cdf(0.0, 4.0), 0.0);
    assertEquals(1.0, ChiSquare.survival(-1.0, 4.0), 0.0);
    assertEquals(0.0, ChiSquare.noncentralCdf(0.0, 4.0, 3.0), 0.0);
    assertEquals(0.0, ChiSquare.noncentralCdf(10.0, 4.0, 1.0e8), 0.0);
    assertEquals(ChiSquare.cdf(7.5, 6.0), ChiSquare.noncentralCdf(7.5, 6.0, 0.0), 0.0);
  }

  @Test
  public void testNoncentralDecreasesWithNonCentrality() {
    double previous = 1.0;
    for (double lambda = 0.0; lambda <= 200.0; lambda += 5.0) {
      double p = ChiSquare.noncentralCdf(120.0, 80.0, lambda);
      assertTrue(" Non-centrality " + lambda, p <= previous);
      previous = p;
    }
  }

  @Test
  public void testNoncentralLargeNonCentrality() {
    // The mean of the distribution is k + lambda; with lambda large it is close to the median.
    double p = ChiSquare.noncentralCdf(1.0e5 + 80.0, 80.0, 1.0e5);
    assertEquals(0.5, p, 0.01);
  }

  @Test
  public void testInvFalseAlarm() {
    assertEquals(218.006950182504805, ChiSquare.invFalseAlarm(1.0e-14, 80.0), 1.0e-8);
    assertEquals(188.359257211524504, ChiSquare.invFalseAlarm(1.0e-10, 80.0), 1.0e-8);
    assertEquals(13.2767041359876245, ChiSquare.invFalseAlarm(0.01, 4.0), 1.0e-9);

    // Extremely small probabilities keep their relative accuracy.
    double x = ChiSquare.invFalseAlarm(1.0e-200, 4.0);
    assertEquals(1.0e-200, ChiSquare.falseAlarm(x, 4.0), 1.0e-206);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testInvFalseAlarmRejectsProbabilityOne() {
    ChiSquare.invFalseAlarm(1.0, 4.0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testRejectsNonPositiveDegreesOfFreedom() {
    ChiSquare.cdf(1.0, 0.0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testRejectsNegativeNonCentrality() {
    ChiSquare.noncentralCdf(1.0, 4.0, -1.0);
  }
}
