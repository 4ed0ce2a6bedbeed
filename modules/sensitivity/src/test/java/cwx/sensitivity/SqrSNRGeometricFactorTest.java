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
import static org.apache.commons.math3.util.FastMath.PI;
import static org.apache.commons.math3.util.FastMath.cos;
import static org.apache.commons.math3.util.FastMath.max;
import static org.apache.commons.math3.util.FastMath.min;
import static org.apache.commons.math3.util.FastMath.sin;
import static org.apache.commons.math3.util.FastMath.sqrt;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import cwx.numerics.histogram.Histogram;
import cwx.numerics.histogram.HistogramStatistics;
import cwx.utilities.CWXTest;
import org.junit.Test;

/**
 * Tests the Monte Carlo geometric factor of detector networks.
 *
 * @author CWX Developers
 */
public class SqrSNRGeometricFactorTest extends CWXTest {

  @Test
  public void testDetectorGeometry() {
    for (Detector detector : Detector.values()) {
      assertEquals(detector.name(), 0.5 * PI, detector.armAngle(), 1.0e-5);
    }
    assertArrayEquals(new Detector[] {Detector.H1, Detector.L1, Detector.V1},
        Detector.parse("H1, l1,V1"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnknownDetector() {
    Detector.parse("H1,X9");
  }

  @Test
  public void testIsotropicMeanIsOne() {
    int samples = cwxCI ? 1000000 : 200000;
    Detector[][] networks = {{Detector.H1}, {Detector.H1, Detector.L1},
        {Detector.H1, Detector.L1, Detector.V1}};
    for (Detector[] network : networks) {
      Histogram histogram = new SqrSNRGeometricFactor(network)
          .setSamples(samples)
          .setSeed(2718L)
          .createHistogram();
      assertEquals(samples, histogram.totalCount(), 0.0);
      assertTrue(histogram.range(0)[0] >= 0.0);
      assertEquals(1.0, HistogramStatistics.meanOf(histogram, 0), 1.5e-2);
      // The same histogram serves as a quadrature distribution.
      assertEquals(HistogramStatistics.meanOf(histogram, 0), GeometricFactor.of(histogram).mean(),
          1.0e-9);
    }
  }

  /**
   * Averages of the squared responses of the detector tensor over one sidereal day, for every
   * polarisation basis angle, are the quadratic form of a^2 and b^2; they must not depend on the
   * right ascension at which the day starts.
   */
  @Test
  public void testDailyAveragesMatchDetectorTensor() {
    double[] declinations = {-1.2, -0.4, 0.0, 0.7, 1.3};
    double[] rightAscensions = {0.0, 1.9};
    for (Detector detector : Detector.values()) {
      double[][] d = detectorTensor(detector);
      double sinZeta = sin(detector.armAngle());
      for (double delta : declinations) {
        double[] ab = SqrSNRGeometricFactor.dailyAverages(detector, delta);
        double a2 = sinZeta * sinZeta * ab[0];
        double b2 = sinZeta * sinZeta * ab[1];
        for (double alpha : rightAscensions) {
          double[] pxq = dailyResponses(d, alpha, delta);
          double m = 0.5 * (pxq[0] + pxq[1]);
          double r = sqrt(0.25 * (pxq[0] - pxq[1]) * (pxq[0] - pxq[1]) + pxq[2] * pxq[2]);
          String message = format(" %s at declination %4.1f", detector, delta);
          assertEquals(message, max(a2, b2), m + r, 1.0e-9);
          assertEquals(message, min(a2, b2), m - r, 1.0e-9);
        }
      }
    }
  }

  /** D = (u u - v v) / 2 in Earth fixed coordinates, for a vertex on the zero meridian. */
  private static double[][] detectorTensor(Detector detector) {
    double lat = detector.latitude;
    double[] north = {-sin(lat), 0.0, cos(lat)};
    double[] east = {0.0, 1.0, 0.0};
    double[] u = new double[3];
    double[] v = new double[3];
    for (int i = 0; i < 3; i++) {
      u[i] = cos(detector.xArmAzimuth) * north[i] + sin(detector.xArmAzimuth) * east[i];
      v[i] = cos(detector.yArmAzimuth) * north[i] + sin(detector.yArmAzimuth) * east[i];
    }
    double[][] d = new double[3][3];
    for (int i = 0; i < 3; i++) {
      for (int j = 0; j < 3; j++) {
        d[i][j] = 0.5 * (u[i] * u[j] - v[i] * v[j]);
      }
    }
    return d;
  }

  /**
   * Day averages of F+^2, Fx^2 and F+ Fx in a fixed polarisation basis. The responses are
   * trigonometric polynomials of degree four in the hour angle, so a uniform grid of 360 points
   * averages them exactly.
   */
  private static double[] dailyResponses(double[][] d, double alpha, double delta) {
    int n = 360;
    double pp = 0.0;
    double xx = 0.0;
    double px = 0.0;
    for (int k = 0; k < n; k++) {
      double phi = alpha + 2.0 * PI * k / n;
      double[] p = {-sin(delta) * cos(phi), -sin(delta) * sin(phi), cos(delta)};
      double[] q = {-sin(phi), cos(phi), 0.0};
      double fPlus = 0.0;
      double fCross = 0.0;
      for (int i = 0; i < 3; i++) {
        for (int j = 0; j < 3; j++) {
          fPlus += d[i][j] * (p[i] * p[j] - q[i] * q[j]);
          fCross += d[i][j] * (p[i] * q[j] + q[i] * p[j]);
        }
      }
      pp += fPlus * fPlus;
      xx += fCross * fCross;
      px += fPlus * fCross;
    }
    return new double[] {pp / n, xx / n, px / n};
  }

  @Test
  public void testFaceOnSourceIgnoresPolarisation() {
    SqrSNRGeometricFactor sqrSNR = new SqrSNRGeometricFactor(Detector.H1, Detector.L1);
    for (double delta = -1.5; delta <= 1.5; delta += 0.5) {
      double r0 = sqrSNR.rSqr(delta, 0.0, 1.0);
      assertEquals(r0, sqrSNR.rSqr(delta, 0.3, 1.0), 1.0e-12);
      assertEquals(r0, sqrSNR.rSqr(delta, 1.1, -1.0), 1.0e-12);
    }
  }

  @Test
  public void testWeightsAreNormalised() {
    SqrSNRGeometricFactor weighted = new SqrSNRGeometricFactor(
        new Detector[] {Detector.H1, Detector.L1}, new double[] {3.0, 1.0});
    SqrSNRGeometricFactor h1 = new SqrSNRGeometricFactor(Detector.H1);
    SqrSNRGeometricFactor l1 = new SqrSNRGeometricFactor(Detector.L1);
    double expected = 0.75 * h1.rSqr(0.4, 0.2, 0.3) + 0.25 * l1.rSqr(0.4, 0.2, 0.3);
    assertEquals(expected, weighted.rSqr(0.4, 0.2, 0.3), 1.0e-12);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testWeightLengthMismatch() {
    new SqrSNRGeometricFactor(new Detector[] {Detector.H1, Detector.L1}, new double[] {1.0});
  }

  @Test
  public void testDeclinationBand() {
    Histogram histogram = new SqrSNRGeometricFactor(Detector.H1)
        .setDeclinationRange(0.3, 0.3)
        .setSamples(1000)
        .setBinWidth(0.05)
        .setSeed(1L)
        .createHistogram();
    assertEquals(1000.0, histogram.totalCount(), 0.0);
  }
}
