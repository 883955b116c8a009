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

package org.rangeopt.arith;

import org.jspecify.annotations.Nullable;
import org.rangeopt.ir.Location;

/** Thrown by {@link OptimizeIntArithmetic#run} when the pass cannot complete. */
public class PassFailureException extends Exception {

  /** Why the pass failed. */
  public enum Kind {
    /** The range analysis could not be completed, e.g. because the region is malformed. */
    ANALYSIS_FAILED,
    /** A round of rewriting did not reach a fixpoint. */
    REWRITE_DID_NOT_CONVERGE,
    /** Analysis and rewriting still changed the region after the maximum number of iterations. */
    ITERATION_LIMIT_EXCEEDED
  }

  private final Kind kind;
  private final Location location;

  public PassFailureException(
      Kind kind, Location location, String message, @Nullable Throwable cause) {
    super(location + ": " + message, cause);
    this.kind = kind;
    this.location = location;
  }

  public Kind kind() {
    return kind;
  }

  /** The location of the region being optimized. */
  public Location location() {
    return location;
  }
}
