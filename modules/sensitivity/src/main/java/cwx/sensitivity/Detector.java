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

import static org.apache.commons.math3.util.FastMath.PI;
import static org.apache.commons.math3.util.FastMath.abs;
import static org.apache.commons.math3.util.FastMath.atan2;
import static org.apache.commons.math3.util.FastMath.cos;
import static org.apache.commons.math3.util.FastMath.sin;

/**
 * Ground based interferometric gravitational wave detectors.
 *
 * <p>Locations and arm azimuths are in radians; azimuths are measured clockwise from North.
 *
 * @author CWX Developers
 * @since 1.0
 */
public enum Detector {

  /** LIGO Hanford. */
  H1(0.81079526383, -2.08405676917, 5.65487724844, 4.08408092164),
  /** LIGO Livingston. */
  L1(0.53342313506, -1.58430937078, 4.40317772346, 2.83238139666),
  /** Virgo. */
  V1(0.76151183984, 0.18333805213, 0.33916285222, 5.05155183261),
  /** GEO600. */
  G1(0.91184982752, 0.17116780435, 1.19360100484, 5.83039279401),
  /** KAGRA. */
  K1(0.63550684972, 2.39654111310, 1.05411330000, -0.51667983000);

  /** Geodetic latitude. */
  public final double latitude;
  /** Longitude, positive East. */
  public final double longitude;
  /** Azimuth of the x arm. */
  public final double xArmAzimuth;
  /** Azimuth of the y arm. */
  public final double yArmAzimuth;

  Detector(double latitude, double longitude, double xArmAzimuth, double yArmAzimuth) {
    this.latitude = latitude;
    this.longitude = longitude;
    this.xArmAzimuth = xArmAzimuth;
    this.yArmAzimuth = yArmAzimuth;
  }

  /**
   * Angle between the arms.
   *
   * @return The opening angle, in [0, pi].
   */
  public double armAngle() {
    double zeta = abs(xArmAzimuth - yArmAzimuth) % (2.0 * PI);
    return (zeta > PI) ? 2.0 * PI - zeta : zeta;
  }

  /**
   * Orientation of the arm bisector, measured counter-clockwise from East.
   *
   * @return The bisector angle.
   */
  public double bisectorAngle() {
    double thetaX = 0.5 * PI - xArmAzimuth;
    double thetaY = 0.5 * PI - yArmAzimuth;
    return atan2(sin(thetaX) + sin(thetaY), cos(thetaX) + cos(thetaY));
  }

  /**
   * Resolve a comma separated list of detector names, e.g. "H1,L1".
   *
   * @param names Detector names.
   * @return The detectors.
   * @throws IllegalArgumentException If a name is not a known detector.
   */
  public static Detector[] parse(String names) {
    String[] tokens = names.split(",");
    Detector[] detectors = new Detector[tokens.length];
    for (int i = 0; i < tokens.length; i++) {
      String token = tokens[i].trim().toUpperCase();
      try {
        detectors[i] = valueOf(token);
      } catch (IllegalArgumentException e) {
        throw new IllegalArgumentException(String.format(" Unknown detector '%s'.", tokens[i]), e);
      }
    }
    return detectors;
  }
}
