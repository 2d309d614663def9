/*-
 * -\-\-
 * ECS Run Task CLI
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

package com.spotify.ecsrun.cli;

class CliExitException extends RuntimeException {

  enum ExitStatus {
    Success(0),
    UnknownError(1),
    ArgumentError(2),
    ConfigurationError(3),
    SubmissionError(4),
    TaskError(5),
    Cancelled(130);

    final int code;

    ExitStatus(final int code) {
      this.code = code;
    }
  }

  private final int code;

  private CliExitException(int code) {
    this.code = code;
  }

  int code() {
    return code;
  }

  static CliExitException of(ExitStatus status) {
    return new CliExitException(status.code);
  }

  /**
   * Exit with the exit code of a container.
   */
  static CliExitException container(int exitCode) {
    return new CliExitException(exitCode);
  }
}
