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
package cwx.numerics.histogram;

import static java.lang.String.format;

/**
 * Thrown when the new bin edges of a resampling do not cover the finite range of the existing
 * bins.
 *
 * @author CWX Developers
 */
public class RangeCoverageException extends RuntimeException {

  public final int dimension;
  public final double[] oldRange;
  public final double[] newRange;

  /**
   * Constructor for RangeCoverageException.
   *
   * @param dimension Dimension being resampled.
   * @param oldRange Finite range of the existing bins.
   * @param newRange Range of the new bin edges.
   */
  public RangeCoverageException(int dimension, double[] oldRange, double[] newRange) {
    super(format(" Range of new bins (%g to %g) does not include old bins (%g to %g) in dimension %d.",
        newRange[0], newRange[1], oldRange[0], oldRange[1], dimension));
    this.dimension = dimension;
    this.oldRange = oldRange;
    this.newRange = newRange;
  }
}
