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

/**
 * Detectable root-mean-square SNR and the false dismissal probability achieved there, one value per
 * row of a sensitivity solve. Rows whose target is already met at zero SNR hold NaN.
 *
 * @author CWX Developers
 */
public class SensitivityResult {

  private final double[] rho;
  private final double[] pdRho;

  SensitivityResult(double[] rho, double[] pdRho) {
    assert rho.length == pdRho.length;
    this.rho = rho;
    this.pdRho = pdRho;
  }

  /**
   * Detectable SNR per row.
   *
   * @return A copy of the SNR values.
   */
  public double[] getRho() {
    return copyOf(rho, rho.length);
  }

  /**
   * Detectable SNR of one row.
   *
   * @param row Row index.
   * @return The SNR.
   */
  public double getRho(int row) {
    return rho[row];
  }

  /**
   * Achieved false dismissal probability per row.
   *
   * @return A copy of the probabilities.
   */
  public double[] getPdRho() {
    return copyOf(pdRho, pdRho.length);
  }

  /**
   * Achieved false dismissal probability of one row.
   *
   * @param row Row index.
   * @return The probability.
   */
  public double getPdRho(int row) {
    return pdRho[row];
  }

  /**
   * Number of rows.
   *
   * @return The number of rows.
   */
  public int size() {
    return rho.length;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(format("\n %5s %14s %14s\n", "Row", "rho", "pd(rho)"));
    for (int i = 0; i < rho.length; i++) {
      sb.append(format(" %5d %14.6f %14.6e\n", i, rho[i], pdRho[i]));
    }
    return sb.toString();
  }
}
