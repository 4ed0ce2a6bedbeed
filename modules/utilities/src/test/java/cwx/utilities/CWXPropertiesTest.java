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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.io.FileUtils;
import org.junit.Test;

/**
 * Tests the precedence of the CWX property sources.
 *
 * @author CWX Developers
 */
public class CWXPropertiesTest extends CWXTest {

  @Test
  public void testInputPropertyFile() throws IOException {
    Path directory = registerTemporaryDirectory();
    File input = directory.resolve("search.dat").toFile();
    FileUtils.writeStringToFile(input, "data", StandardCharsets.UTF_8);
    File propertyFile = directory.resolve("search.properties").toFile();
    FileUtils.writeStringToFile(propertyFile,
        "sensitivity-max-bisection = 5000\npaNt = 1e-14, 1e-12, 1e-10\ncwx-test-key = file\n",
        StandardCharsets.UTF_8);

    System.setProperty("cwx-test-key", "system");
    CompositeConfiguration properties = CWXProperties.loadProperties(input);

    assertEquals(5000, properties.getInt("sensitivity-max-bisection"));
    // System properties take precedence over the input property file.
    assertEquals("system", properties.getString("cwx-test-key"));
    List<Double> paNt = properties.getList(Double.class, "paNt");
    assertEquals(3, paNt.size());
    assertEquals(1.0e-12, paNt.get(1), 0.0);
    assertEquals(propertyFile.getCanonicalPath(), properties.getString("propertyFile"));
  }

  @Test
  public void testWithoutInputFile() {
    System.setProperty("sensitivity-seed", "1234");
    CompositeConfiguration properties = CWXProperties.loadProperties();
    assertEquals(1234L, properties.getLong("sensitivity-seed"));
    assertFalse(properties.containsKey("propertyFile"));
  }

  @Test
  public void testMissingPropertyFileIsIgnored() {
    Path directory = registerTemporaryDirectory();
    CompositeConfiguration properties =
        CWXProperties.loadProperties(directory.resolve("missing.dat").toFile());
    assertFalse(properties.containsKey("propertyFile"));
    assertTrue(properties.getDouble("sensitivity-pd-tolerance", 1.0e-3) > 0.0);
  }
}
