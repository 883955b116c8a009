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

import java.util.ArrayList;
import java.util.List;

/**
 * A DebugInfo aggregates information from a single {@link OptimizeIntArithmetic} run that may be
 * useful for understanding its results. The region listings are only captured if {@link
 * OptimizeIntArithmetic#verbose} is set.
 */
public class DebugInfo {
  /** The region as it was before the pass started. */
  public String initial;

  /** The region after each iteration's rewrites, in order. */
  public final List<String> afterIteration = new ArrayList<>();

  /** The number of analyze/rewrite iterations run. */
  public int iterations;

  /** The total number of successful pattern applications, folds and dead operation removals. */
  public int rewrites;

  /** The total number of range states evicted because the IR was changed. */
  public int evictions;

  /** The phase the pass ended in. */
  public OptimizeIntArithmetic.Phase finalPhase;

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(
        String.format(
            "%s after %s iterations (%s rewrites, %s evictions)\n",
            finalPhase, iterations, rewrites, evictions));
    if (initial != null) {
      sb.append("Initial:\n").append(initial);
    }
    for (int i = 0; i < afterIteration.size(); i++) {
      sb.append("After iteration ").append(i).append(":\n").append(afterIteration.get(i));
    }
    return sb.toString();
  }
}
