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

package org.rangeopt.rewrite;

import org.jspecify.annotations.Nullable;

/** Options controlling a {@link GreedyPatternRewriter}. */
public class GreedyRewriteConfig {

  /**
   * If false (the default), operations are visited starting from the end of the region, so that
   * an operation's users are usually rewritten before it is.
   */
  public boolean useTopDownTraversal;

  /**
   * The maximum number of times the rewriter will scan the whole region; if the last allowed scan
   * still changes the IR, the rewrite is reported as not converged.
   */
  public int maxIterations = 10;

  /** If true (the default), operations are folded before patterns are tried. */
  public boolean fold = true;

  /** If non-null, notified of every change made to the IR. */
  public @Nullable RewriteListener listener;

  public GreedyRewriteConfig() {}

  /** Returns a config with the same settings as {@code other}. */
  public GreedyRewriteConfig(GreedyRewriteConfig other) {
    this.useTopDownTraversal = other.useTopDownTraversal;
    this.maxIterations = other.maxIterations;
    this.fold = other.fold;
    this.listener = other.listener;
  }
}
