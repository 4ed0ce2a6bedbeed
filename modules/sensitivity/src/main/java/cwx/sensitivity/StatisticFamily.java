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

import java.util.List;
import org.apache.commons.configuration2.Configuration;

/**
 * Detection statistic families known to the {@link SensitivitySolver}.
 *
 * <p>Each family reads its options from a {@link Configuration}. Options that vary per row may be
 * given as a single value, which applies to every row, or as a list with one value per row.
 *
 * @author CWX Developers
 * @since 1.0
 */
public enum StatisticFamily {

  /**
   * A chi-square statistic such as the F-statistic. Options: "dof" (degrees of freedom per segment,
   * default 4) and exactly one of "paNt" (false alarm probability) or "sa" (threshold).
   */
  CHI_SQR("ChiSqr") {
    @Override
    public FalseDismissalProbability create(double[] ns, Configuration options) {
      double dof = options.getDouble("dof", ChiSquareFalseDismissal.DEFAULT_DOF);
      String key = exactlyOne(options, "paNt", "sa");
      double[] values = perRow(options, key, ns.length);
      if (key.equals("sa")) {
        return ChiSquareFalseDismissal.withThreshold(dof, values);
      }
      return ChiSquareFalseDismissal.withFalseAlarm(dof, ns, values);
    }
  },

  /**
   * A Hough transform on the F-statistic. Options: "Fth" (2F threshold per segment, default 5.2) and
   * exactly one of "paNt" (false alarm probability) or "nth" (number count threshold).
   */
  HOUGH_FSTAT("HoughFstat") {
    @Override
    public FalseDismissalProbability create(double[] ns, Configuration options) {
      double fth = options.getDouble("Fth", HoughFstatFalseDismissal.DEFAULT_FTH);
      String key = exactlyOne(options, "paNt", "nth");
      double[] values = perRow(options, key, ns.length);
      if (key.equals("nth")) {
        return HoughFstatFalseDismissal.withThreshold(fth, values);
      }
      return HoughFstatFalseDismissal.withFalseAlarm(fth, ns, values);
    }
  };

  private final String selector;

  StatisticFamily(String selector) {
    this.selector = selector;
  }

  /**
   * Create the false dismissal probability of this family.
   *
   * @param ns Number of segments of each row.
   * @param options Family options.
   * @return A new FalseDismissalProbability.
   */
  public abstract FalseDismissalProbability create(double[] ns, Configuration options);

  /**
   * Selector of this family, e.g. "ChiSqr".
   *
   * @return The selector.
   */
  public String getSelector() {
    return selector;
  }

  /**
   * Resolve a family from its selector or enum name, ignoring case.
   *
   * @param name Selector.
   * @return The family.
   * @throws UnknownStatisticFamilyException If no family matches.
   */
  public static StatisticFamily parse(String name) {
    if (name != null) {
      for (StatisticFamily family : values()) {
        if (family.selector.equalsIgnoreCase(name) || family.name().equalsIgnoreCase(name)) {
          return family;
        }
      }
    }
    throw new UnknownStatisticFamilyException(name);
  }

  /**
   * Selectors of every family.
   *
   * @return The selectors.
   */
  public static String[] selectors() {
    StatisticFamily[] families = values();
    String[] selectors = new String[families.length];
    for (int i = 0; i < families.length; i++) {
      selectors[i] = families[i].selector;
    }
    return selectors;
  }

  private static String exactlyOne(Configuration options, String first, String second) {
    boolean hasFirst = options.containsKey(first);
    boolean hasSecond = options.containsKey(second);
    if (hasFirst == hasSecond) {
      throw new IllegalArgumentException(
          format(" Exactly one of the options '%s' and '%s' must be given.", first, second));
    }
    return hasFirst ? first : second;
  }

  /**
   * Values of a per-row option, broadcast from a single value if necessary.
   */
  private static double[] perRow(Configuration options, String key, int rows) {
    List<Double> list = options.getList(Double.class, key);
    if (list.size() != 1 && list.size() != rows) {
      throw new IllegalArgumentException(format(
          " Option '%s' has %d values; expected 1 or %d.", key, list.size(), rows));
    }
    double[] values = new double[rows];
    for (int i = 0; i < rows; i++) {
      values[i] = list.get(list.size() == 1 ? 0 : i);
    }
    return values;
  }
}
