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
package cwx.utilities;

import static java.lang.String.format;

import java.io.File;
import java.io.IOException;
import java.util.Arrays;
import java.util.Iterator;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.configuration2.PropertiesConfiguration;
import org.apache.commons.configuration2.SystemConfiguration;
import org.apache.commons.configuration2.builder.FileBasedConfigurationBuilder;
import org.apache.commons.configuration2.builder.fluent.Parameters;
import org.apache.commons.configuration2.convert.DefaultListDelimiterHandler;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.io.FilenameUtils;

/**
 * The CWXProperties class assembles the configuration used by CWX calculations.
 *
 * <p>Sources are consulted in order of precedence:
 * <br>
 * 1) JVM system properties (i.e. -Dkey=value on the command line).
 * <br>
 * 2) A property file beside an input file, with the same base name and the extension
 * ".properties" or ".prop".
 * <br>
 * 3) The user property file ~/.cwx/cwx.properties.
 * <br>
 * 4) The property file named by the CWX_PROPERTIES environment variable.
 *
 * <p>Values in property files may be comma separated lists.
 *
 * @author CWX Developers
 * @since 1.0
 */
public class CWXProperties {

  private static final Logger logger = Logger.getLogger(CWXProperties.class.getName());

  /** Environment variable naming a site wide property file. */
  public static final String ENVIRONMENT_VARIABLE = "CWX_PROPERTIES";

  /** User property file, relative to the home directory. */
  public static final String USER_PROPERTIES = ".cwx" + File.separator + "cwx.properties";

  private CWXProperties() {
    // Prevent instantiation.
  }

  /**
   * Load properties without an input file.
   *
   * @return a {@link org.apache.commons.configuration2.CompositeConfiguration} object.
   */
  public static CompositeConfiguration loadProperties() {
    return loadProperties(null);
  }

  /**
   * Load properties for an input file.
   *
   * @param file The input file (may be null).
   * @return a {@link org.apache.commons.configuration2.CompositeConfiguration} object.
   */
  public static CompositeConfiguration loadProperties(File file) {

    CompositeConfiguration properties = new CompositeConfiguration();

    // JVM system properties take precedence.
    PropertiesConfiguration systemConfiguration = new PropertiesConfiguration();
    systemConfiguration.append(new SystemConfiguration());
    systemConfiguration.setHeader("JVM system properties (i.e. command line -Dkey=value pairs).");
    properties.addConfiguration(systemConfiguration);

    // Input specific options are 2nd.
    if (file != null) {
      String basename = FilenameUtils.removeExtension(file.getAbsolutePath());
      String propertyFilename =
          (new File(basename + ".properties").exists()) ? basename + ".properties"
              : (new File(basename + ".prop").exists()) ? basename + ".prop"
              : null;
      if (propertyFilename != null) {
        PropertiesConfiguration inputConfiguration = readPropertyFile(new File(propertyFilename),
            "Input properties from (" + propertyFilename + ").");
        if (inputConfiguration != null) {
          properties.addConfiguration(inputConfiguration);
          try {
            properties.addProperty("propertyFile", new File(propertyFilename).getCanonicalPath());
          } catch (IOException e) {
            logger.log(Level.INFO, " Could not resolve the path of {0}.", propertyFilename);
          }
        }
      }
    }

    // User specific options are 3rd.
    String filename = System.getProperty("user.home") + File.separator + USER_PROPERTIES;
    PropertiesConfiguration userConfiguration = readPropertyFile(new File(filename),
        "CWX user property file (" + filename + ").");
    if (userConfiguration != null) {
      properties.addConfiguration(userConfiguration);
    }

    // Site wide options are last.
    filename = System.getenv(ENVIRONMENT_VARIABLE);
    if (filename != null) {
      PropertiesConfiguration envConfiguration = readPropertyFile(new File(filename),
          "Environment variable " + ENVIRONMENT_VARIABLE + " (" + filename + ").");
      if (envConfiguration != null) {
        properties.addConfiguration(envConfiguration);
      }
    }

    // Echo the interpolated configuration.
    if (logger.isLoggable(Level.FINE)) {
      Iterator<String> i = properties.getKeys();
      StringBuilder sb = new StringBuilder();
      sb.append(format("\n %-30s %s\n", "Property", "Value"));
      while (i.hasNext()) {
        String s = i.next();
        sb.append(format(" %-30s %s\n", s, Arrays.toString(properties.getList(s).toArray())));
      }
      logger.fine(sb.toString());
    }

    return properties;
  }

  /**
   * Read one property file; null if it does not exist, cannot be read or cannot be parsed.
   */
  private static PropertiesConfiguration readPropertyFile(File propertyFile, String header) {
    if (!propertyFile.exists() || !propertyFile.canRead()) {
      return null;
    }
    try {
      FileBasedConfigurationBuilder<PropertiesConfiguration> builder =
          new FileBasedConfigurationBuilder<>(PropertiesConfiguration.class)
              .configure(new Parameters().properties()
                  .setFile(propertyFile)
                  .setListDelimiterHandler(new DefaultListDelimiterHandler(','))
                  .setIncludesAllowed(false));
      PropertiesConfiguration configuration = builder.getConfiguration();
      configuration.setHeader(header);
      return configuration;
    } catch (ConfigurationException e) {
      logger.log(Level.INFO, " Error loading {0}.", propertyFile.getPath());
      return null;
    }
  }
}
