/*-
 * -\-\-
 * ECS Run Task Common
 * --
 * Copyright (C) 2026 Spotify AB
 * --
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
 * -/-/-
 */

package com.spotify.ecsrun.model;

import com.google.common.collect.ImmutableList;
import java.util.List;

final class Lists {

  private Lists() {
    throw new UnsupportedOperationException();
  }

  // Absent lists in a definition file arrive as null
  static <T> List<T> orEmpty(List<T> list) {
    return list == null ? ImmutableList.of() : ImmutableList.copyOf(list);
  }
}
