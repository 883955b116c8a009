/*
 * Copyright 2025 The Rangeopt Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.rangeopt.ir;

/** A position in the source that a Region or Operation was built from; used in diagnostics. */
public record Location(String source, int line) {

  /** The location of IR that was not built from any source. */
  public static final Location UNKNOWN = new Location("<unknown>", 0);

  @Override
  public String toString() {
    return (line > 0) ? (source + ":" + line) : source;
  }
}
