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

package net.contentrec.online.generation;

import java.io.Serializable;
import java.util.Comparator;

/**
 * Orders {@link ModelVersion}s by training time ascending, then by version ID.
 *
 * @author Sean Owen
 */
final class ByTrainedAtComparator implements Comparator<ModelVersion>, Serializable {

  @Override
  public int compare(ModelVersion a, ModelVersion b) {
    long aTrained = a.getTrainedAt();
    long bTrained = b.getTrainedAt();
    if (aTrained < bTrained) {
      return -1;
    }
    if (aTrained > bTrained) {
      return 1;
    }
    return a.getVersionID().compareTo(b.getVersionID());
  }

}
