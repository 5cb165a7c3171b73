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

package net.contentrec.common.log;

/**
 * Utilities for the {@code java.util.logging} backend that SLF4J logs to.
 *
 * @author Sean Owen
 * @since 1.0
 */
public final class LoggingUtils {

  private static final String JUL_LOG_FORMAT_PROP = "java.util.logging.SimpleFormatter.format";

  private LoggingUtils() {
  }

  /**
   * <p>Sets the {@code java.util.logging} default output format to something more sensible than the 2-line default.
   * This can be overridden further on the command line. The format is like:</p>
   *
   * <p><pre>
   * Mon Nov 26 23:16:09 GMT 2012 INFO Promoted model version 1b4e28ba-2fa1-11d2-883f-0016d3cca427
   * </pre></p>
   */
  public static void setSensibleLogFormat() {
    if (System.getProperty(JUL_LOG_FORMAT_PROP) == null) {
      System.setProperty(JUL_LOG_FORMAT_PROP, "%1$tc %4$s %5$s%6$s%n");
    }
  }

}
