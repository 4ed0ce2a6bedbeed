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

import java.util.Arrays;

/**
 * This exception is thrown when the sensitivity solver cannot bracket or isolate the squared SNR of
 * one or more rows within its round limits, or when the false dismissal probability becomes
 * non-finite.
 *
 * @author CWX Developers
 */
public class ConvergenceFailureException extends RuntimeException {

  /** Phase of the solve that failed. */
  public final SolverPhase phase;
  /** Number of rounds completed in that phase. */
  public final int rounds;
  private final int[] rows;

  public ConvergenceFailureException(SolverPhase phase, int rounds, int[] rows, String reason) {
    super(format(" %s failed after %d round(s) for row(s) %s: %s", phase, rounds,
        Arrays.toString(rows), reason));
    this.phase = phase;
    this.rounds = rounds;
    this.rows = Arrays.copyOf(rows, rows.length);
  }

  /**
   * The rows that did not converge.
   *
   * @return A copy of the row indices.
   */
  public int[] getRows() {
    return Arrays.copyOf(rows, rows.length);
  }
}
