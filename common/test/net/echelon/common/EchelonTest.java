/*
 * Copyright Myrrix Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package net.echelon.common;

import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;
import org.junit.Assert;
import org.junit.Before;
import org.junit.BeforeClass;

public abstract class EchelonTest extends Assert {

  private static final long TEST_SEED = 1234567890L;
  private static final String JAVA_LOG_FORMAT_PROP = "java.util.logging.SimpleFormatter.format";

  protected static final double DOUBLE_EPSILON = 1.0e-9;

  private RandomGenerator random;

  @SuppressWarnings("deprecation")
  public static void assertEquals(double expected, double actual) {
    Assert.assertEquals(expected, actual, DOUBLE_EPSILON);
  }

  @SuppressWarnings("deprecation")
  public static void assertEquals(String message, double expected, double actual) {
    Assert.assertEquals(message, expected, actual, DOUBLE_EPSILON);
  }

  public static void assertArrayEquals(double[] expecteds, double[] actuals) {
    Assert.assertArrayEquals(expecteds, actuals, DOUBLE_EPSILON);
  }

  @BeforeClass
  public static void setUpClass() {
    // One line per log record, like: Mon Nov 26 23:16:09 GMT 2012 INFO Reduced 3 x 3 matrix
    if (System.getProperty(JAVA_LOG_FORMAT_PROP) == null) {
      System.setProperty(JAVA_LOG_FORMAT_PROP, "%1$tc %4$s %5$s%6$s%n");
    }
  }

  @Before
  public void setUp() throws Exception {
    random = new MersenneTwister(TEST_SEED);
  }

  /**
   * @return generator seeded identically for every test
   */
  protected final RandomGenerator getRandom() {
    return random;
  }

}
