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

package com.spotify.ecsrun.logs;

import com.spotify.ecsrun.aws.Arns;

/**
 * The sentinel log message appended to a container's log stream once the container has stopped.
 * Both the writer and the tailer use this format so that the tailer recognizes the end of a
 * stream.
 */
public final class FinishMarker {

  private FinishMarker() {
    throw new UnsupportedOperationException();
  }

  public static String message(String containerArn, int exitCode) {
    return prefix(containerArn) + " " + exitCode;
  }

  public static String prefix(String containerArn) {
    return "Container " + Arns.resourceId(containerArn) + " exited with";
  }

  public static boolean matches(String containerArn, String message) {
    return message != null && message.startsWith(prefix(containerArn));
  }
}
