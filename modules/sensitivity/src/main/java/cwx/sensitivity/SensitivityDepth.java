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
import static java.util.Arrays.fill;
import static org.apache.commons.math3.util.FastMath.PI;
import static org.apache.commons.math3.util.FastMath.sqrt;

import cwx.numerics.histogram.Histogram;
import java.util.logging.Logger;
import org.apache.commons.configuration2.BaseConfiguration;
import org.apache.commons.configuration2.Configuration;

/**
 * Sensitivity depth of a semi-coherent StackSlide search on the F-statistic.
 *
 * <p>The sensitivity depth is sqrt(Sh) / h0, the ratio of the noise amplitude spectral density to the
 * smallest gravitational wave amplitude detected with the given false alarm and false dismissal
 * probabilities. With Nseg segments, Tdata seconds of data, and a detectable SNR rho per segment,
 * <br>
 * depth = (2/5) sqrt(Tdata) / (sqrt(Nseg) rho).
 *
 * <p>The false alarm level is given either as a false alarm probability per template (pFA) or as a
 * threshold on the F-statistic averaged over segments (avg2Fth); each value is one row.
 *
 * @author CWX Developers
 * @since 1.0
 */
public class SensitivityDepth {

  private static final Logger logger = Logger.getLogger(SensitivityDepth.class.getName());

  private int nSeg = 1;
  private double tData = Double.NaN;
  private Histogram mismatchHistogram = null;
  private double pFD = 0.1;
  private double[] pFA = null;
  private double[] avg2Fth = null;
  private Detector[] detectors = {Detector.H1, Detector.L1};
  private double[] detectorWeights = null;
  private double deltaMin = -0.5 * PI;
  private double deltaMax = 0.5 * PI;
  private int samples = SqrSNRGeometricFactor.DEFAULT_SAMPLES;
  private Long seed = null;
  private Configuration solverProperties = null;

  /**
   * Number of StackSlide segments (default 1).
   *
   * @param nSeg Number of segments.
   * @return This SensitivityDepth.
   */
  public SensitivityDepth setNSeg(int nSeg) {
    if (nSeg < 1) {
      throw new IllegalArgumentException(format(" The number of segments %d must be positive.", nSeg));
    }
    this.nSeg = nSeg;
    return this;
  }

  /**
   * Total amount of data from all detectors, in seconds.
   *
   * @param tData Amount of data.
   * @return This SensitivityDepth.
   */
  public SensitivityDepth setTData(double tData) {
    if (!(tData > 0.0) || Double.isInfinite(tData)) {
      throw new IllegalArgumentException(format(" Tdata %g must be finite and positive.", tData));
    }
    this.tData = tData;
    return this;
  }

  /**
   * Distribution of the template bank mismatch (default: no mismatch).
   *
   * @param mismatchHistogram A one-dimensional mismatch histogram.
   * @return This SensitivityDepth.
   */
  public SensitivityDepth setMismatchHistogram(Histogram mismatchHistogram) {
    this.mismatchHistogram = mismatchHistogram;
    return this;
  }

  /**
   * False dismissal probability (default 0.1).
   *
   * @param pFD False dismissal probability.
   * @return This SensitivityDepth.
   */
  public SensitivityDepth setPFD(double pFD) {
    this.pFD = pFD;
    return this;
  }

  /**
   * False alarm probabilities per template; excludes {@link #setAvg2Fth(double...)}.
   *
   * @param pFA False alarm probabilities.
   * @return This SensitivityDepth.
   */
  public SensitivityDepth setPFA(double... pFA) {
    this.pFA = copyOf(pFA, pFA.length);
    return this;
  }

  /**
   * Thresholds on the segment-averaged 2F; excludes {@link #setPFA(double...)}.
   *
   * @param avg2Fth Thresholds.
   * @return This SensitivityDepth.
   */
  public SensitivityDepth setAvg2Fth(double... avg2Fth) {
    this.avg2Fth = copyOf(avg2Fth, avg2Fth.length);
    return this;
  }

  /**
   * Detectors of the network (default H1 and L1) and their weights (null for equal weights).
   *
   * @param detectors Detectors.
   * @param weights Detector weights.
   * @return This SensitivityDepth.
   */
  public SensitivityDepth setDetectors(Detector[] detectors, double[] weights) {
    this.detectors = detectors.clone();
    this.detectorWeights = (weights == null) ? null : weights.clone();
    return this;
  }

  /**
   * Declination band of the sources (default: all sky).
   *
   * @param deltaMin Smallest declination, radians.
   * @param deltaMax Largest declination, radians.
   * @return This SensitivityDepth.
   */
  public SensitivityDepth setDeclinationRange(double deltaMin, double deltaMax) {
    this.deltaMin = deltaMin;
    this.deltaMax = deltaMax;
    return this;
  }

  /**
   * Number of samples of the geometric factor and the seed used to draw them and the bisection
   * points.
   *
   * @param samples Number of samples.
   * @param seed Random seed.
   * @return This SensitivityDepth.
   */
  public SensitivityDepth setSampling(int samples, long seed) {
    this.samples = samples;
    this.seed = seed;
    return this;
  }

  /**
   * Properties of the sensitivity solver (default: the CWX property files).
   *
   * @param solverProperties Solver properties.
   * @return This SensitivityDepth.
   */
  public SensitivityDepth setSolverProperties(Configuration solverProperties) {
    this.solverProperties = solverProperties;
    return this;
  }

  /**
   * Compute the sensitivity depth of each row.
   *
   * @return Sensitivity depth per row, in 1/sqrt(Hz).
   */
  public double[] compute() {
    if (Double.isNaN(tData)) {
      throw new IllegalArgumentException(" Tdata must be set.");
    }
    if ((pFA == null) == (avg2Fth == null)) {
      throw new IllegalArgumentException(" Exactly one of pFA or avg2Fth must be given.");
    }

    SqrSNRGeometricFactor sqrSNR = new SqrSNRGeometricFactor(detectors, detectorWeights)
        .setDeclinationRange(deltaMin, deltaMax)
        .setSamples(samples);
    if (seed != null) {
      sqrSNR.setSeed(seed);
    }
    GeometricFactor geometricFactor = GeometricFactor.of(sqrSNR.createHistogram());
    if (mismatchHistogram != null) {
      geometricFactor = geometricFactor.withMismatch(mismatchHistogram);
    }

    int rows = (pFA != null) ? pFA.length : avg2Fth.length;
    double[] ns = new double[rows];
    fill(ns, nSeg);
    Configuration options = new BaseConfiguration();
    for (int i = 0; i < rows; i++) {
      if (pFA != null) {
        options.addProperty("paNt", pFA[i]);
      } else {
        options.addProperty("sa", nSeg * avg2Fth[i]);
      }
    }

    SensitivitySolver solver;
    if (solverProperties != null) {
      solver = new SensitivitySolver(solverProperties);
    } else if (seed != null) {
      BaseConfiguration properties = new BaseConfiguration();
      properties.addProperty("sensitivity-seed", seed);
      solver = new SensitivitySolver(properties);
    } else {
      solver = new SensitivitySolver();
    }
    SensitivityResult result = solver.solve(new double[] {pFD}, ns, geometricFactor,
        StatisticFamily.CHI_SQR.getSelector(), options);

    double[] depth = new double[rows];
    for (int i = 0; i < rows; i++) {
      depth[i] = 0.4 * sqrt(tData) / (sqrt(nSeg) * result.getRho(i));
      logger.info(format(" Row %d: rho %10.6f, sensitivity depth %10.4f /sqrt(Hz).", i,
          result.getRho(i), depth[i]));
    }
    return depth;
  }
}
