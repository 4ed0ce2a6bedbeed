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

import static org.apache.commons.math3.util.FastMath.sqrt;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import cwx.numerics.histogram.Histogram;
import cwx.numerics.special.ChiSquare;
import cwx.utilities.CWXTest;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.Test;

/**
 * Tests the StackSlide sensitivity depth of a 20 segment search.
 *
 * @author CWX Developers
 */
public class SensitivityDepthTest extends CWXTest {

  private static final int NSEG = 20;
  private static final double TDATA = 60.0 * 3600.0 * NSEG;
  private static final double[] PFA = {1.0e-14, 1.0e-12, 1.0e-10};

  /**
   * Depths for a mismatch of 0.1 and a false dismissal of 0.1, from the sidereal-day averaged
   * geometric factor sampled with the seed below. Other seeds move them by about 0.03.
   */
  private static final double[] EXPECTED = {38.362, 40.453, 43.044};

  private static final double TOLERANCE = 0.05;

  private static SensitivityDepth search() {
    return new SensitivityDepth()
        .setNSeg(NSEG)
        .setTData(TDATA)
        .setPFD(0.1)
        .setDetectors(new Detector[] {Detector.H1, Detector.L1}, null)
        .setSampling(SqrSNRGeometricFactor.DEFAULT_SAMPLES, 20160401L);
  }

  @Test
  public void testDepthFromAverageThreshold() {
    double[] avg2Fth = new double[PFA.length];
    for (int i = 0; i < PFA.length; i++) {
      avg2Fth[i] = ChiSquare.invFalseAlarm(PFA[i], 4.0 * NSEG) / NSEG;
    }
    double[] depth = search()
        .setMismatchHistogram(Histogram.delta(0.1))
        .setAvg2Fth(avg2Fth)
        .compute();
    for (int i = 0; i < EXPECTED.length; i++) {
      assertEquals(" pFA " + PFA[i], EXPECTED[i], depth[i], TOLERANCE);
    }
    // Depth decreases as the false alarm probability decreases.
    assertTrue(depth[0] < depth[1] && depth[1] < depth[2]);
  }

  @Test
  public void testDepthFromFalseAlarm() {
    double[] depth = search()
        .setMismatchHistogram(Histogram.delta(0.1))
        .setPFA(PFA)
        .compute();
    for (int i = 0; i < EXPECTED.length; i++) {
      assertEquals(" pFA " + PFA[i], EXPECTED[i], depth[i], TOLERANCE);
    }
  }

  @Test
  public void testDepthOfFixedGeometricFactor() {
    double[] pd = {0.1, 0.1, 0.1};
    double[] ns = {NSEG, NSEG, NSEG};
    BaseConfiguration properties = new BaseConfiguration();
    properties.addProperty("sensitivity-seed", 7L);
    SensitivitySolver solver = new SensitivitySolver(properties);
    FalseDismissalProbability fdp = ChiSquareFalseDismissal.withFalseAlarm(4.0, ns, PFA);

    // A single node at R^2 = 1 reduced by a mismatch of 0.1.
    GeometricFactor single = GeometricFactor.of(1.0).withMismatch(Histogram.delta(0.1));
    assertArrayEquals(new double[] {59.632, 62.546, 66.112},
        depths(solver.solve(pd, ns, single, fdp)), TOLERANCE);

    // Two equally weighted nodes at R^2 = 0.5 and 1.5.
    GeometricFactor pair = GeometricFactor.of(Histogram.create(new double[][] {{0.5}, {1.5}}, 1.0));
    assertArrayEquals(new double[] {46.162, 48.529, 51.446},
        depths(solver.solve(pd, ns, pair, fdp)), TOLERANCE);
  }

  private static double[] depths(SensitivityResult result) {
    double[] depth = new double[result.size()];
    for (int i = 0; i < depth.length; i++) {
      depth[i] = 0.4 * sqrt(TDATA) / (sqrt(NSEG) * result.getRho(i));
    }
    return depth;
  }

  @Test
  public void testMismatchScalesDepth() {
    double[] perfect = search().setPFA(1.0e-10).compute();
    double[] mismatched = search().setMismatchHistogram(Histogram.delta(0.1)).setPFA(1.0e-10)
        .compute();
    // A mismatch of 0.1 reduces the non-centrality by 10%, so the depth shrinks by sqrt(0.9).
    assertEquals(perfect[0] * sqrt(0.9), mismatched[0], 1.0e-6 * perfect[0]);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testFalseAlarmOptionsAreExclusive() {
    search().setPFA(1.0e-10).setAvg2Fth(5.0).compute();
  }

  @Test(expected = IllegalArgumentException.class)
  public void testDataDurationIsRequired() {
    new SensitivityDepth().setPFA(1.0e-10).compute();
  }
}
