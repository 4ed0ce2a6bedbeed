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
import static java.util.Arrays.fill;
import static org.apache.commons.math3.util.FastMath.PI;
import static org.apache.commons.math3.util.FastMath.asin;
import static org.apache.commons.math3.util.FastMath.cos;
import static org.apache.commons.math3.util.FastMath.min;
import static org.apache.commons.math3.util.FastMath.sin;

import cwx.numerics.histogram.Histogram;
import java.util.Arrays;
import java.util.logging.Logger;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

/**
 * Monte Carlo histogram of the squared-SNR geometric factor R^2 of a detector network.
 *
 * <p>For a signal from declination delta with polarisation angle psi and inclination iota,
 * <br>
 * R^2 = (25/4) sum_k w_k &lt;F+_k^2&gt; A+^2 + &lt;Fx_k^2&gt; Ax^2,
 * <br>
 * where the detector weights w_k sum to one, A+ = (1 + cos^2 iota) / 2, Ax = cos iota, and the
 * antenna patterns of each detector are averaged over a sidereal day. The normalisation makes the
 * mean of R^2 over isotropic, randomly oriented sources equal to one. The sidereal average removes
 * any dependence on right ascension.
 *
 * @author CWX Developers
 * @since 1.0
 */
public class SqrSNRGeometricFactor {

  private static final Logger logger = Logger.getLogger(SqrSNRGeometricFactor.class.getName());

  /** Default number of Monte Carlo samples. */
  public static final int DEFAULT_SAMPLES = 1000000;
  /** Default histogram bin width. */
  public static final double DEFAULT_BIN_WIDTH = 0.01;

  /** Samples added to the histogram at a time. */
  private static final int CHUNK = 100000;

  private final Detector[] detectors;
  private final double[] weights;
  private int samples = DEFAULT_SAMPLES;
  private double binWidth = DEFAULT_BIN_WIDTH;
  private double sinDeltaMin = -1.0;
  private double sinDeltaMax = 1.0;
  private Long seed = null;

  /**
   * A network of equally weighted detectors.
   *
   * @param detectors The detectors.
   */
  public SqrSNRGeometricFactor(Detector... detectors) {
    this(detectors, null);
  }

  /**
   * A network of weighted detectors.
   *
   * @param detectors The detectors.
   * @param weights Detector weights (null for equal weights); normalised to sum to one.
   */
  public SqrSNRGeometricFactor(Detector[] detectors, double[] weights) {
    if (detectors.length == 0) {
      throw new IllegalArgumentException(" At least one detector is required.");
    }
    this.detectors = detectors.clone();
    this.weights = new double[detectors.length];
    if (weights == null) {
      fill(this.weights, 1.0 / detectors.length);
    } else {
      if (weights.length != detectors.length) {
        throw new IllegalArgumentException(format(
            " %d detector weights do not match %d detectors.", weights.length, detectors.length));
      }
      double sum = 0.0;
      for (int i = 0; i < weights.length; i++) {
        if (!(weights[i] > 0.0) || Double.isInfinite(weights[i])) {
          throw new IllegalArgumentException(
              format(" Weight %g of detector %s must be finite and positive.", weights[i],
                  detectors[i]));
        }
        sum += weights[i];
      }
      for (int i = 0; i < weights.length; i++) {
        this.weights[i] = weights[i] / sum;
      }
    }
  }

  /**
   * Set the number of Monte Carlo samples.
   *
   * @param samples Number of samples.
   * @return This SqrSNRGeometricFactor.
   */
  public SqrSNRGeometricFactor setSamples(int samples) {
    if (samples < 1) {
      throw new IllegalArgumentException(format(" The number of samples %d must be positive.", samples));
    }
    this.samples = samples;
    return this;
  }

  /**
   * Set the histogram bin width.
   *
   * @param binWidth Bin width.
   * @return This SqrSNRGeometricFactor.
   */
  public SqrSNRGeometricFactor setBinWidth(double binWidth) {
    if (!(binWidth > 0.0) || Double.isInfinite(binWidth)) {
      throw new IllegalArgumentException(
          format(" The bin width %g must be finite and positive.", binWidth));
    }
    this.binWidth = binWidth;
    return this;
  }

  /**
   * Restrict the sky to a band of declination.
   *
   * @param deltaMin Smallest declination, radians.
   * @param deltaMax Largest declination, radians.
   * @return This SqrSNRGeometricFactor.
   */
  public SqrSNRGeometricFactor setDeclinationRange(double deltaMin, double deltaMax) {
    if (!(deltaMin >= -0.5 * PI && deltaMin <= deltaMax && deltaMax <= 0.5 * PI)) {
      throw new IllegalArgumentException(
          format(" Declination range [%g, %g] is not within [-pi/2, pi/2].", deltaMin, deltaMax));
    }
    sinDeltaMin = sin(deltaMin);
    sinDeltaMax = sin(deltaMax);
    return this;
  }

  /**
   * Seed the random number generator.
   *
   * @param seed The seed.
   * @return This SqrSNRGeometricFactor.
   */
  public SqrSNRGeometricFactor setSeed(long seed) {
    this.seed = seed;
    return this;
  }

  /**
   * The geometric factor of a single source, averaged over a sidereal day.
   *
   * @param delta Declination.
   * @param psi Polarisation angle.
   * @param cosIota Cosine of the inclination.
   * @return R^2.
   */
  public double rSqr(double delta, double psi, double cosIota) {
    double aPlus = 0.5 * (1.0 + cosIota * cosIota);
    double aCross = cosIota;
    double aPlus2 = aPlus * aPlus;
    double aCross2 = aCross * aCross;
    double cos2Psi = cos(2.0 * psi);
    double sin2Psi = sin(2.0 * psi);
    double c = cos2Psi * cos2Psi;
    double s = sin2Psi * sin2Psi;

    double sum = 0.0;
    for (int k = 0; k < detectors.length; k++) {
      double[] ab = dailyAverages(detectors[k], delta);
      double sinZeta = sin(detectors[k].armAngle());
      double fPlus2 = ab[0] * c + ab[1] * s;
      double fCross2 = ab[1] * c + ab[0] * s;
      sum += weights[k] * sinZeta * sinZeta * (fPlus2 * aPlus2 + fCross2 * aCross2);
    }
    return 6.25 * sum;
  }

  /**
   * Sidereal-day averages of a^2 and b^2, the squared amplitude modulation coefficients of a
   * 90-degree interferometer; the average of ab vanishes.
   */
  static double[] dailyAverages(Detector detector, double delta) {
    double lambda = detector.latitude;
    double gamma = detector.bisectorAngle();
    double sin2g = sin(2.0 * gamma);
    double cos2g = cos(2.0 * gamma);
    double sinL = sin(lambda);
    double cosL = cos(lambda);
    double sin2L = sin(2.0 * lambda);
    double cos2L = cos(2.0 * lambda);
    double sinD = sin(delta);
    double cosD = cos(delta);
    double sin2D = sin(2.0 * delta);
    double cos2D = cos(2.0 * delta);

    double a0 = 0.75 * sin2g * cosL * cosL * cosD * cosD;
    double a1c = 0.25 * sin2g * sin2L * sin2D;
    double a1s = -0.5 * cos2g * cosL * sin2D;
    double a2c = sin2g * (3.0 - cos2L) * (3.0 - cos2D) / 16.0;
    double a2s = -0.25 * cos2g * sinL * (3.0 - cos2D);

    double b1c = cos2g * cosL * cosD;
    double b1s = 0.5 * sin2g * sin2L * cosD;
    double b2c = cos2g * sinL * sinD;
    double b2s = 0.25 * sin2g * (3.0 - cos2L) * sinD;

    double a2 = a0 * a0 + 0.5 * (a1c * a1c + a1s * a1s + a2c * a2c + a2s * a2s);
    double b2 = 0.5 * (b1c * b1c + b1s * b1s + b2c * b2c + b2s * b2s);
    return new double[] {a2, b2};
  }

  /**
   * Sample the geometric factor into a histogram.
   *
   * @return A one-dimensional Histogram of R^2.
   */
  public Histogram createHistogram() {
    RandomGenerator random = (seed != null) ? new Well19937c(seed) : new Well19937c();
    Histogram histogram = new Histogram(1);
    double[][] chunk = new double[min(CHUNK, samples)][1];
    int remaining = samples;
    while (remaining > 0) {
      int n = min(chunk.length, remaining);
      if (n < chunk.length) {
        chunk = new double[n][1];
      }
      for (int i = 0; i < n; i++) {
        double sinDelta = sinDeltaMin + (sinDeltaMax - sinDeltaMin) * random.nextDouble();
        double psi = 2.0 * PI * random.nextDouble();
        double cosIota = 2.0 * random.nextDouble() - 1.0;
        chunk[i][0] = rSqr(asin(sinDelta), psi, cosIota);
      }
      histogram.addData(chunk, binWidth);
      remaining -= n;
    }
    logger.fine(format(" Sampled %d values of the geometric factor of %s.", samples,
        Arrays.toString(detectors)));
    return histogram;
  }
}
