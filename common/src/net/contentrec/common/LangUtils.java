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

package net.contentrec.common;

import com.google.common.base.Preconditions;

/**
 * General utility methods related to the language, or primitives.
 *
 * @author Sean Owen
 */
public final class LangUtils {

  private LangUtils() {
  }

  /**
   * Parses a {@code float} from a {@link String} as if by {@link Float#valueOf(String)}, but disallows special
   * values like {@link Float#NaN}, {@link Float#POSITIVE_INFINITY} and {@link Float#NEGATIVE_INFINITY}.
   *
   * @param s {@link String} to parse
   * @return floating-point value in the {@link String}
   * @throws NumberFormatException if input does not parse as a floating-point value
   * @throws IllegalArgumentException if input is infinite or {@link Float#NaN}
   */
  public static float parseFloat(String s) {
    float value = Float.parseFloat(s);
    Preconditions.checkArgument(isFinite(value), "Bad value: %s", value);
    return value;
  }

  /**
   * @see #parseFloat(String)
   */
  public static double parseDouble(String s) {
    double value = Double.parseDouble(s);
    Preconditions.checkArgument(isFinite(value), "Bad value: %s", value);
    return value;
  }

  public static boolean isFinite(float f) {
    return !(Float.isNaN(f) || Float.isInfinite(f));
  }

  public static boolean isFinite(double d) {
    return !(Double.isNaN(d) || Double.isInfinite(d));
  }

  /**
   * @return {@code value} if it lies in [min,max], else the nearer of the two bounds
   */
  public static double clamp(double value, double min, double max) {
    Preconditions.checkArgument(min <= max, "min > max: %s > %s", min, max);
    if (value < min) {
      return min;
    }
    return value > max ? max : value;
  }

  /**
   * Reads an {@code int} system property.
   *
   * @param key property name
   * @param defaultValue value to use when the property is not set
   * @throws IllegalArgumentException if the property is set but is not an integer
   */
  public static int getIntProperty(String key, int defaultValue) {
    String value = System.getProperty(key);
    if (value == null) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException nfe) {
      throw new IllegalArgumentException("Bad " + key + ": " + value, nfe);
    }
  }

  /**
   * Like {@link #getIntProperty(String, int)}, but for finite {@code double} values.
   */
  public static double getDoubleProperty(String key, double defaultValue) {
    String value = System.getProperty(key);
    if (value == null) {
      return defaultValue;
    }
    try {
      return parseDouble(value.trim());
    } catch (NumberFormatException nfe) {
      throw new IllegalArgumentException("Bad " + key + ": " + value, nfe);
    }
  }

  public static boolean getBooleanProperty(String key, boolean defaultValue) {
    String value = System.getProperty(key);
    return value == null ? defaultValue : Boolean.parseBoolean(value.trim());
  }

}
