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

package net.contentrec.online;

import java.util.Arrays;
import java.util.List;

import com.google.common.collect.Lists;

import net.contentrec.online.interaction.Interaction;
import net.contentrec.online.interaction.InteractionSource;

/**
 * An {@link InteractionSource} over a fixed list, taken to be most recent first.
 */
public final class ListInteractionSource implements InteractionSource {

  private final List<Interaction> interactions;

  public ListInteractionSource(Interaction... interactions) {
    this(Arrays.asList(interactions));
  }

  public ListInteractionSource(List<Interaction> interactions) {
    this.interactions = Lists.newArrayList(interactions);
  }

  public static Interaction interaction(String userID, String contentID, float value) {
    return new Interaction(userID, contentID, value, 0L);
  }

  @Override
  public List<Interaction> queryRecent(int limit) {
    return Lists.newArrayList(interactions.subList(0, Math.min(limit, interactions.size())));
  }

  @Override
  public List<Interaction> queryByUser(String userID) {
    List<Interaction> result = Lists.newArrayList();
    for (Interaction interaction : interactions) {
      if (interaction.getUserID().equals(userID)) {
        result.add(interaction);
      }
    }
    return result;
  }

}
