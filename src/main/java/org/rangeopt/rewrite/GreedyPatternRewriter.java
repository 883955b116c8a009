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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.flogger.FluentLogger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import org.rangeopt.ir.OpKind;
import org.rangeopt.ir.Operation;
import org.rangeopt.ir.Region;
import org.rangeopt.ir.Value;

/**
 * Applies a set of {@link RewritePattern}s to a {@link Region} until none of them applies (or an
 * iteration limit is reached).
 *
 * <p>Each iteration puts every operation on a worklist and then processes the worklist until it is
 * empty. Processing an operation first removes it if it is trivially dead, then tries to {@link
 * Folder fold} it, and then tries each pattern rooted at its kind in order of decreasing benefit
 * until one succeeds. Operations created or modified by a rewrite, and the users and producers of
 * affected values, are added back to the worklist.
 *
 * <p>The worklist is processed last-in first-out. With the default (bottom-up) traversal the
 * initial worklist is in region order, so the last operation is visited first.
 */
public class GreedyPatternRewriter {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final ImmutableListMultimap<OpKind, RewritePattern> patternsByKind;
  private final GreedyRewriteConfig config;

  private final List<Operation> worklist = new ArrayList<>();
  private final Set<Operation> onWorklist = Collections.newSetFromMap(new IdentityHashMap<>());

  private int numRewrites;
  private int numFolded;
  private int numErased;

  public GreedyPatternRewriter(List<RewritePattern> patterns, GreedyRewriteConfig config) {
    List<RewritePattern> sorted = new ArrayList<>(patterns);
    // List.sort is stable, so patterns with equal benefit keep their original order.
    sorted.sort(Comparator.comparingInt(RewritePattern::benefit).reversed());
    ImmutableListMultimap.Builder<OpKind, RewritePattern> byKind = ImmutableListMultimap.builder();
    for (OpKind kind : OpKind.values()) {
      for (RewritePattern pattern : sorted) {
        if (pattern.rootKind() == null || pattern.rootKind() == kind) {
          byKind.put(kind, pattern);
        }
      }
    }
    this.patternsByKind = byKind.build();
    this.config = config;
  }

  /** Rewrites {@code region} in place. May be called more than once. */
  public GreedyRewriteResult apply(Region region) {
    RewriteListener listener = new WorklistListener();
    if (config.listener != null) {
      listener = RewriteListener.chain(config.listener, listener);
    }
    PatternRewriter rewriter = new PatternRewriter(region, listener);
    numRewrites = 0;
    numFolded = 0;
    numErased = 0;
    boolean changed = false;
    for (int iteration = 0; iteration < config.maxIterations; iteration++) {
      int prevNumChanges = numChanges();
      fillWorklist(region);
      processWorklist(rewriter);
      logChanges(iteration);
      if (numChanges() == prevNumChanges) {
        return new GreedyRewriteResult(changed, true, numChanges());
      }
      changed = true;
    }
    logger.atFine().log(
        "Rewrite of %s did not converge in %s iterations", region.location(), config.maxIterations);
    return new GreedyRewriteResult(changed, false, numChanges());
  }

  private int numChanges() {
    return numRewrites + numFolded + numErased;
  }

  private void logChanges(int iteration) {
    logger.atFine().log(
        "Iteration %s: %s rewritten, %s folded, %s erased",
        iteration, numRewrites, numFolded, numErased);
  }

  private void fillWorklist(Region region) {
    ImmutableList<Operation> ops = region.operations();
    if (config.useTopDownTraversal) {
      ops = ops.reverse();
    }
    ops.forEach(this::addToWorklist);
  }

  private void addToWorklist(Operation op) {
    if (op.region() != null && onWorklist.add(op)) {
      worklist.add(op);
    }
  }

  private void addDefiningOps(Operation op) {
    for (Value operand : op.operands()) {
      Operation def = operand.definingOp();
      if (def != null) {
        addToWorklist(def);
      }
    }
  }

  private void addUsers(Operation op) {
    for (Value result : op.results()) {
      result.users().forEach(this::addToWorklist);
    }
  }

  private void processWorklist(PatternRewriter rewriter) {
    while (!worklist.isEmpty()) {
      Operation op = worklist.remove(worklist.size() - 1);
      onWorklist.remove(op);
      if (op.region() == null) {
        // Erased since it was queued.
        continue;
      }
      if (op.isTriviallyDead()) {
        rewriter.eraseOp(op);
        ++numErased;
      } else if (config.fold && Folder.tryFold(op, rewriter)) {
        ++numFolded;
      } else {
        tryPatterns(op, rewriter);
      }
    }
  }

  private void tryPatterns(Operation op, PatternRewriter rewriter) {
    for (RewritePattern pattern : patternsByKind.get(op.kind())) {
      if (pattern.matchAndRewrite(op, rewriter)) {
        ++numRewrites;
        logger.atFinest().log("%s applied to %s", pattern, op.id());
        return;
      }
    }
  }

  /** Keeps the worklist up to date as the IR changes. */
  private class WorklistListener implements RewriteListener {
    @Override
    public void notifyOperationInserted(Operation op) {
      addToWorklist(op);
    }

    @Override
    public void notifyOperationErased(Operation op) {
      // Producers of the erased operation's operands may now be dead.
      addDefiningOps(op);
    }

    @Override
    public void notifyOperationModified(Operation op) {
      addToWorklist(op);
      addUsers(op);
      addDefiningOps(op);
    }

    @Override
    public void notifyOperationReplaced(Operation op, Operation replacement) {
      addUsers(op);
    }

    @Override
    public void notifyOperationReplaced(Operation op, List<Value> replacement) {
      addUsers(op);
    }
  }
}
