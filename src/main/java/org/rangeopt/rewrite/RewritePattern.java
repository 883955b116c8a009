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
import org.rangeopt.ir.OpKind;
import org.rangeopt.ir.Operation;

/**
 * A local transformation that a {@link GreedyPatternRewriter} may apply to an operation.
 *
 * <p>A pattern that fails to match must leave the IR unchanged. Patterns with a higher {@link
 * #benefit} are tried first.
 */
public abstract class RewritePattern {

  private final @Nullable OpKind rootKind;
  private final int benefit;

  /**
   * @param rootKind if non-null, the pattern will only be tried on operations of this kind
   */
  protected RewritePattern(@Nullable OpKind rootKind, int benefit) {
    this.rootKind = rootKind;
    this.benefit = benefit;
  }

  protected RewritePattern(@Nullable OpKind rootKind) {
    this(rootKind, 1);
  }

  public final @Nullable OpKind rootKind() {
    return rootKind;
  }

  public final int benefit() {
    return benefit;
  }

  /**
   * If this pattern applies to {@code op}, rewrites it (using only {@code rewriter} to change the
   * IR) and returns true; otherwise returns false without changing anything.
   */
  public abstract boolean matchAndRewrite(Operation op, PatternRewriter rewriter);

  @Override
  public String toString() {
    return getClass().getSimpleName() + ((rootKind == null) ? "" : ("(" + rootKind + ")"));
  }
}
