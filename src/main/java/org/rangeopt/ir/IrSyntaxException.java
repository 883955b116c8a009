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

/** Thrown by {@link IrParser} when given text that does not describe a well-formed Region. */
public class IrSyntaxException extends RuntimeException {

  public IrSyntaxException(Location location, String message) {
    super(location + ": " + message);
  }

  public IrSyntaxException(Location location, String message, Throwable cause) {
    super(location + ": " + message, cause);
  }
}
