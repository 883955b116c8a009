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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.rangeopt.ir.IntType;
import org.rangeopt.ir.IrParser;
import org.rangeopt.ir.IrPrinter;
import org.rangeopt.ir.OpKind;
import org.rangeopt.ir.Operation;
import org.rangeopt.ir.Region;
import org.rangeopt.ir.Value;

@RunWith(JUnit4.class)
public class GreedyPatternRewriterTest {

  private static final String CHAIN =
      """
      region(%a: i32) {
        %0 = subi %a, %a : i32
        %1 = subi %0, %a : i32
        %2 = subi %1, %a : i32
        return %2
      }
      """;

  /** Records the operations it is offered, and never matches. */
  private static class Recorder extends RewritePattern {
    final List<String> visited = new ArrayList<>();

    Recorder() {
      super(null);
    }

    @Override
    public boolean matchAndRewrite(Operation op, PatternRewriter rewriter) {
      visited.add(op.kind() + "@" + rewriter.region().indexOf(op));
      return false;
    }
  }

  /**
   * Reports a change to each return operation on every other visit, so that every scan of the
   * region makes exactly one change.
   */
  private static class Toggle extends RewritePattern {
    boolean fire;

    Toggle() {
      super(OpKind.RETURN);
    }

    @Override
    public boolean matchAndRewrite(Operation op, PatternRewriter rewriter) {
      fire = !fire;
      if (!fire) {
        return false;
      }
      rewriter.modifyOpInPlace(op, () -> {});
      return true;
    }
  }

  /** Replaces each operation of one kind with the same operation of another kind. */
  private static class ChangeKind extends RewritePattern {
    final OpKind to;
    int applied;

    ChangeKind(OpKind from, OpKind to, int benefit) {
      super(from, benefit);
      this.to = to;
    }

    @Override
    public boolean matchAndRewrite(Operation op, PatternRewriter rewriter) {
      ++applied;
      rewriter.replaceOpWithNewOp(op, to, op.result().type(), op.operands(), ImmutableMap.of());
      return true;
    }
  }

  private static GreedyRewriteResult apply(
      Region region, GreedyRewriteConfig config, RewritePattern... patterns) {
    return new GreedyPatternRewriter(List.of(patterns), config).apply(region);
  }

  @Test
  public void bottomUpVisitsLastOperationFirst() {
    Region region = IrParser.parse(CHAIN, "chain");
    Recorder recorder = new Recorder();
    GreedyRewriteResult result = apply(region, new GreedyRewriteConfig(), recorder);
    assertThat(result).isEqualTo(new GreedyRewriteResult(false, true, 0));
    assertThat(recorder.visited)
        .containsExactly("return@3", "subi@2", "subi@1", "subi@0")
        .inOrder();
  }

  @Test
  public void topDownVisitsFirstOperationFirst() {
    Region region = IrParser.parse(CHAIN, "chain");
    Recorder recorder = new Recorder();
    GreedyRewriteConfig config = new GreedyRewriteConfig();
    config.useTopDownTraversal = true;
    apply(region, config, recorder);
    assertThat(recorder.visited)
        .containsExactly("subi@0", "subi@1", "subi@2", "return@3")
        .inOrder();
  }

  @Test
  public void higherBenefitIsTriedFirst() {
    Region region = IrParser.parse(CHAIN, "chain");
    ChangeKind toAdd = new ChangeKind(OpKind.SUB, OpKind.ADD, 1);
    ChangeKind toMul = new ChangeKind(OpKind.SUB, OpKind.MUL, 2);
    GreedyRewriteResult result = apply(region, new GreedyRewriteConfig(), toAdd, toMul);

    assertThat(result.changed()).isTrue();
    assertThat(result.converged()).isTrue();
    assertThat(result.numRewrites()).isEqualTo(3);
    assertThat(toMul.applied).isEqualTo(3);
    assertThat(toAdd.applied).isEqualTo(0);
    String expected = IrPrinter.print(IrParser.parse(CHAIN, "chain")).replace("subi", "muli");
    assertThat(IrPrinter.print(region)).isEqualTo(expected);
  }

  @Test
  public void reportsNonConvergence() {
    Region region = IrParser.parse(CHAIN, "chain");
    GreedyRewriteConfig config = new GreedyRewriteConfig();
    config.maxIterations = 3;
    GreedyRewriteResult result = apply(region, config, new Toggle());
    assertThat(result).isEqualTo(new GreedyRewriteResult(true, false, 3));
  }

  @Test
  public void erasesDeadOperations() {
    Region region =
        IrParser.parse(
            """
            region(%a: i32) {
              %0 = subi %a, %a : i32
              %1 = subi %0, %a : i32
              %2 = muli %a, %a : i32
              return %2
            }
            """,
            "dead");
    GreedyRewriteResult result = apply(region, new GreedyRewriteConfig());
    assertThat(result).isEqualTo(new GreedyRewriteResult(true, true, 2));
    assertThat(region.numOperations()).isEqualTo(2);
  }

  @Test
  public void foldsBeforeTryingPatterns() {
    Region region = new Region();
    Value ten = region.constant(IntType.I8, 10);
    Value three = region.constant(IntType.I8, 3);
    region.ret(region.add(OpKind.SUB, IntType.I8, ten, three));
    ChangeKind toAdd = new ChangeKind(OpKind.SUB, OpKind.ADD, 1);
    apply(region, new GreedyRewriteConfig(), toAdd);
    assertThat(toAdd.applied).isEqualTo(0);
    assertThat(IrPrinter.print(region))
        .isEqualTo(
            """
            region() {
              %0 = constant 7 : i8
              return %0
            }
            """);
  }

  @Test
  public void foldingCanBeDisabled() {
    Region region = new Region();
    Value ten = region.constant(IntType.I8, 10);
    Value three = region.constant(IntType.I8, 3);
    region.ret(region.add(OpKind.SUB, IntType.I8, ten, three));
    GreedyRewriteConfig config = new GreedyRewriteConfig();
    config.fold = false;
    GreedyRewriteResult result = apply(region, config);
    assertThat(result.changed()).isFalse();
    assertThat(region.numOperations()).isEqualTo(4);
  }

  @Test
  public void notifiesConfiguredListener() {
    Region region = IrParser.parse(CHAIN, "chain");
    List<String> erased = new ArrayList<>();
    GreedyRewriteConfig config = new GreedyRewriteConfig();
    config.listener =
        new RewriteListener() {
          @Override
          public void notifyOperationErased(Operation op) {
            erased.add(op.kind().toString());
          }
        };
    apply(region, config, new ChangeKind(OpKind.SUB, OpKind.ADD, 1));
    assertThat(erased).containsExactly("subi", "subi", "subi");
  }

  @Test
  public void copiesEverySetting() {
    GreedyRewriteConfig config = new GreedyRewriteConfig();
    config.useTopDownTraversal = true;
    config.maxIterations = 3;
    config.fold = false;
    config.listener = new RewriteListener() {};
    GreedyRewriteConfig copy = new GreedyRewriteConfig(config);
    assertThat(copy).isNotSameInstanceAs(config);
    assertThat(copy.useTopDownTraversal).isTrue();
    assertThat(copy.maxIterations).isEqualTo(3);
    assertThat(copy.fold).isFalse();
    assertThat(copy.listener).isSameInstanceAs(config.listener);
  }
}
