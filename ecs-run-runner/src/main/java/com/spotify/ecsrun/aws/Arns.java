/*-
 * -\-\-
 * ECS Run Task Runner
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

package com.spotify.ecsrun.aws;

public final class Arns {

  private Arns() {
    throw new UnsupportedOperationException();
  }

  /**
   * The last path segment of an ARN, e.g. the task id of
   * {@code arn:aws:ecs:eu-west-1:123456789012:task/default/5e2c...}.
   */
  public static String resourceId(String arn) {
    final int slash = arn.lastIndexOf('/');
    return slash < 0 ? arn : arn.substring(slash + 1);
  }
}
