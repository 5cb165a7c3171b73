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

package net.contentrec.online.scheduler;

import java.util.concurrent.TimeUnit;

import com.google.common.base.Preconditions;

import net.contentrec.common.LangUtils;

/**
 * Configuration of the {@link RetrainingScheduler}. Defaults are read from system properties:
 *
 * <ul>
 *   <li>{@code retrain.intervalHours}: minimum hours between automatic runs (default 12)</li>
 *   <li>{@code retrain.interactionThreshold}: new interactions needed for an automatic run (default 50)</li>
 *   <li>{@code retrain.window.startHour}, {@code retrain.window.endHour}: daily hours in which automatic runs
 *    may start; both unset means any time</li>
 *   <li>{@code retrain.autoEnabled}: whether automatic runs happen at all (default true)</li>
 *   <li>{@code retrain.dataset}: named dataset for automatic runs (default: the main interaction source)</li>
 *   <li>{@code retrain.checkIntervalSec}: seconds between checks (default 3600)</li>
 *   <li>{@code retrain.errorBackoffSec}: seconds to wait after a failed check (default 300)</li>
 *   <li>{@code retrain.timeoutMin}: minutes after which a run is interrupted; 0 means never (default 120)</li>
 *   <li>{@code retrain.shutdownGraceSec}: seconds to wait for a run to finish on close (default 5)</li>
 * </ul>
 *
 * @author Sean Owen
 */
public final class RetrainingConfiguration {

  private int intervalHours;
  private int interactionThreshold;
  private TimeWindow window;
  private boolean autoRetrainingEnabled;
  private String dataset;
  private int checkIntervalSec;
  private int errorBackoffSec;
  private long timeoutMS;
  private int shutdownGraceSec;

  public RetrainingConfiguration() {
    setIntervalHours(LangUtils.getIntProperty("retrain.intervalHours", 12));
    setInteractionThreshold(LangUtils.getIntProperty("retrain.interactionThreshold", 50));
    int startHour = LangUtils.getIntProperty("retrain.window.startHour", -1);
    int endHour = LangUtils.getIntProperty("retrain.window.endHour", -1);
    Preconditions.checkArgument((startHour < 0) == (endHour < 0),
                                "Set both or neither of retrain.window.startHour and retrain.window.endHour");
    setWindow(startHour < 0 ? null : new TimeWindow(startHour, endHour));
    setAutoRetrainingEnabled(LangUtils.getBooleanProperty("retrain.autoEnabled", true));
    setDataset(System.getProperty("retrain.dataset"));
    setCheckIntervalSec(LangUtils.getIntProperty("retrain.checkIntervalSec", 3600));
    setErrorBackoffSec(LangUtils.getIntProperty("retrain.errorBackoffSec", 300));
    setTimeout(LangUtils.getIntProperty("retrain.timeoutMin", 120), TimeUnit.MINUTES);
    setShutdownGraceSec(LangUtils.getIntProperty("retrain.shutdownGraceSec", 5));
  }

  public int getIntervalHours() {
    return intervalHours;
  }

  public void setIntervalHours(int intervalHours) {
    Preconditions.checkArgument(intervalHours >= 0, "Bad retrain.intervalHours: %s", intervalHours);
    this.intervalHours = intervalHours;
  }

  public int getInteractionThreshold() {
    return interactionThreshold;
  }

  public void setInteractionThreshold(int interactionThreshold) {
    Preconditions.checkArgument(interactionThreshold >= 0,
                                "Bad retrain.interactionThreshold: %s", interactionThreshold);
    this.interactionThreshold = interactionThreshold;
  }

  /**
   * @return hours in which automatic runs may start, or {@code null} for any time
   */
  public TimeWindow getWindow() {
    return window;
  }

  public void setWindow(TimeWindow window) {
    this.window = window;
  }

  public boolean isAutoRetrainingEnabled() {
    return autoRetrainingEnabled;
  }

  public void setAutoRetrainingEnabled(boolean autoRetrainingEnabled) {
    this.autoRetrainingEnabled = autoRetrainingEnabled;
  }

  public String getDataset() {
    return dataset;
  }

  public void setDataset(String dataset) {
    this.dataset = dataset;
  }

  public int getCheckIntervalSec() {
    return checkIntervalSec;
  }

  public void setCheckIntervalSec(int checkIntervalSec) {
    Preconditions.checkArgument(checkIntervalSec > 0, "Bad retrain.checkIntervalSec: %s", checkIntervalSec);
    this.checkIntervalSec = checkIntervalSec;
  }

  public int getErrorBackoffSec() {
    return errorBackoffSec;
  }

  public void setErrorBackoffSec(int errorBackoffSec) {
    Preconditions.checkArgument(errorBackoffSec > 0, "Bad retrain.errorBackoffSec: %s", errorBackoffSec);
    this.errorBackoffSec = errorBackoffSec;
  }

  /**
   * @return milliseconds after which a run is interrupted, or 0 if runs are never interrupted
   */
  public long getTimeoutMS() {
    return timeoutMS;
  }

  /**
   * @param timeout time after which a run is interrupted; 0 means never
   * @param unit unit of {@code timeout}
   */
  public void setTimeout(long timeout, TimeUnit unit) {
    Preconditions.checkArgument(timeout >= 0, "Bad timeout: %s", timeout);
    this.timeoutMS = TimeUnit.MILLISECONDS.convert(timeout, unit);
  }

  public int getShutdownGraceSec() {
    return shutdownGraceSec;
  }

  public void setShutdownGraceSec(int shutdownGraceSec) {
    Preconditions.checkArgument(shutdownGraceSec >= 0, "Bad retrain.shutdownGraceSec: %s", shutdownGraceSec);
    this.shutdownGraceSec = shutdownGraceSec;
  }

  @Override
  public String toString() {
    return "RetrainingConfiguration[intervalHours:" + intervalHours +
        ", interactionThreshold:" + interactionThreshold + ", window:" + window +
        ", autoRetrainingEnabled:" + autoRetrainingEnabled + ", dataset:" + dataset +
        ", checkIntervalSec:" + checkIntervalSec + ", timeoutMS:" + timeoutMS + ']';
  }

}
