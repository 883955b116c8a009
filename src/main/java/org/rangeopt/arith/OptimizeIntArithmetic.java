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

import static com.google.common.flogger.LazyArgs.lazy;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import org.jspecify.annotations.Nullable;
import org.rangeopt.ir.IrPrinter;
import org.rangeopt.ir.Region;
import org.rangeopt.range.AnalysisException;
import org.rangeopt.range.IntRangeAnalysis;
import org.rangeopt.range.RangeQuery;
import org.rangeopt.rewrite.GreedyPatternRewriter;
import org.rangeopt.rewrite.GreedyRewriteConfig;
import org.rangeopt.rewrite.GreedyRewriteResult;
import org.rangeopt.rewrite.RewriteListener;
import org.rangeopt.rewrite.RewritePattern;

/**
 * Uses integer range analysis to replace signed arithmetic with unsigned arithmetic, and to move
 * casts to {@code index} up through 64-bit arithmetic, wherever the proven ranges show that doing
 * so does not change the results.
 *
 * <p>The pass alternates between two phases until the region stops changing:
 *
 * <ul>
 *   <li>ANALYZE computes a range for each value that doesn't already have one.
 *   <li>REWRITE greedily applies the patterns from {@link ArithPatterns} (bottom-up), with a {@link
 *       RangeInvalidator} evicting the ranges of every value affected by a change.
 * </ul>
 *
 * <p>Each OptimizeIntArithmetic instance may only be {@link #run} once.
 */
public class OptimizeIntArithmetic {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  public final DebugInfo debugInfo = new DebugInfo();

  /**
   * If true, the region's text is saved in {@link #debugInfo} before the pass and after each
   * iteration.
   */
  public boolean verbose;

  /** The maximum number of analyze/rewrite iterations before the pass gives up. */
  public int maxIterations = 16;

  /**
   * Options for each round of rewriting. Its {@link GreedyRewriteConfig#listener}, if set, will be
   * notified of each change in addition to the pass's own listener.
   */
  public final GreedyRewriteConfig rewriteConfig = new GreedyRewriteConfig();

  /** The states of a run. */
  public enum Phase {
    ANALYZE,
    REWRITE,
    CONVERGED,
    FAILED
  }

  /** The current phase; null until {@link #run} is called. */
  private @Nullable Phase phase;

  public @Nullable Phase phase() {
    return phase;
  }

  /**
   * Optimizes {@code region} in place. Returns true if it was changed.
   *
   * @throws PassFailureException if range analysis fails, a round of rewriting does not converge,
   *     or the region is still changing after {@link #maxIterations}; the region may have been
   *     partially rewritten
   */
  public boolean run(Region region) throws PassFailureException {
    Preconditions.checkState(phase == null, "Already run");
    IntRangeAnalysis analysis = new IntRangeAnalysis();
    RangeInvalidator invalidator = new RangeInvalidator(analysis);
    ImmutableList<RewritePattern> patterns =
        ArithPatterns.all(new UnsignedLegality(new RangeQuery(analysis)));
    GreedyRewriteConfig config = new GreedyRewriteConfig(rewriteConfig);
    config.listener =
        (rewriteConfig.listener == null)
            ? invalidator
            : RewriteListener.chain(invalidator, rewriteConfig.listener);
    GreedyPatternRewriter rewriter = new GreedyPatternRewriter(patterns, config);
    if (verbose) {
      debugInfo.initial = IrPrinter.print(region);
    }
    logger.atFine().log(
        "Optimizing %s:\n%s", region.location(), lazy(() -> IrPrinter.print(region)));
    boolean changed = false;
    try {
      for (int iteration = 0; ; iteration++) {
        if (iteration == maxIterations) {
          throw failure(
              PassFailureException.Kind.ITERATION_LIMIT_EXCEEDED,
              region,
              "int arithmetic optimization did not converge after " + iteration + " iterations",
              null);
        }
        debugInfo.iterations = iteration + 1;
        phase = Phase.ANALYZE;
        try {
          analysis.solve(region);
        } catch (AnalysisException e) {
          throw failure(
              PassFailureException.Kind.ANALYSIS_FAILED,
              region,
              "failed to perform int range analysis",
              e);
        }
        phase = Phase.REWRITE;
        GreedyRewriteResult result = rewriter.apply(region);
        debugInfo.rewrites += result.numRewrites();
        debugInfo.evictions = invalidator.numEvicted();
        if (verbose) {
          debugInfo.afterIteration.add(IrPrinter.print(region));
        }
        logger.atFine().log(
            "Iteration %s: %s rewrites, %s evictions, %s range states",
            iteration,
            result.numRewrites(),
            invalidator.numEvicted(),
            analysis.numStates());
        if (!result.converged()) {
          throw failure(
              PassFailureException.Kind.REWRITE_DID_NOT_CONVERGE,
              region,
              "int arithmetic optimization failed to converge on iteration " + iteration,
              null);
        }
        if (!result.changed()) {
          phase = Phase.CONVERGED;
          return changed;
        }
        changed = true;
      }
    } finally {
      debugInfo.finalPhase = phase;
      logger.atFine().log("%s", lazy(() -> debugInfo));
    }
  }

  private PassFailureException failure(
      PassFailureException.Kind kind, Region region, String message, @Nullable Throwable cause) {
    phase = Phase.FAILED;
    logger.atFine().withCause(cause).log("%s: %s", region.location(), message);
    return new PassFailureException(kind, region.location(), message, cause);
  }
}
