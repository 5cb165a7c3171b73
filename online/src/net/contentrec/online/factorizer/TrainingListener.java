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

package net.contentrec.online.factorizer;

/**
 * Receives progress from {@link FactorizationModel#train(java.util.List, TrainingParameters, TrainingListener)}.
 * It is called on the training thread, between epochs.
 *
 * @author Sean Owen
 */
public interface TrainingListener {

  /**
   * @param epoch index of the epoch just finished, from 0
   * @param epochs total number of epochs in the run
   * @param loss mean squared error over the epoch
   */
  void epochFinished(int epoch, int epochs, double loss);

}
