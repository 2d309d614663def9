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

/**
 * Prints container output to stdout and everything else to stderr, so that the output of a run
 * can be piped like the output of a local process.
 */
class PlainCliOutput implements CliOutput {

  @Override
  public void printLine(String line) {
    System.out.println(line);
  }

  @Override
  public void printMessage(String message) {
    System.err.println(message);
  }

  @Override
  public void printError(String message) {
    System.err.println(message);
  }
}
