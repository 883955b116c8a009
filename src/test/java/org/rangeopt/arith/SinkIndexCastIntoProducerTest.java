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

import static com.google.common.truth.Truth.assertThat;

import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.rangeopt.ir.IntType;
import org.rangeopt.ir.IrPrinter;
import org.rangeopt.ir.OpKind;
import org.rangeopt.ir.Operation;
import org.rangeopt.ir.Region;
import org.rangeopt.ir.Value;
import org.rangeopt.range.IntRangeAnalysis;
import org.rangeopt.range.RangeQuery;
import org.rangeopt.rewrite.PatternRewriter;
import org.rangeopt.rewrite.RewriteListener;

@RunWith(JUnit4.class)
public class SinkIndexCastIntoProducerTest {

  private final IntRangeAnalysis analysis = new IntRangeAnalysis();
  private final SinkIndexCastIntoProducer pattern =
      new SinkIndexCastIntoProducer(new UnsignedLegality(new RangeQuery(analysis)));
  private final List<String> events = new ArrayList<>();

  private final RewriteListener recorder =
      new RewriteListener() {
        @Override
        public void notifyOperationInserted(Operation op) {
          events.add("inserted " + op.kind());
        }

        @Override
        public void notifyOperationModified(Operation op) {
          events.add("modified " + op.kind());
        }

        @Override
        public void notifyOperationErased(Operation op) {
          events.add("erased " + op.kind());
        }
      };

  @Test
  public void sinksCastIntoAdd() throws Exception {
    Region region = new Region();
    Value a = region.addArgument(IntType.I64, 0, 1000);
    Value b = region.addArgument(IntType.I64, 0, 1000);
    Value sum = region.add(OpKind.ADD, IntType.I64, a, b);
    Value cast = region.add(OpKind.INDEX_CAST_UI, IntType.INDEX, sum);
    region.ret(cast);
    analysis.solve(region);

    PatternRewriter rewriter = new PatternRewriter(region, recorder);
    assertThat(pattern.matchAndRewrite(cast.definingOp(), rewriter)).isTrue();

    Operation producer = sum.definingOp();
    assertThat(sum.type()).isEqualTo(IntType.INDEX);
    assertThat(producer.operand(0).definingOp().kind()).isEqualTo(OpKind.INDEX_CAST_UI);
    assertThat(producer.operand(0).definingOp().operand(0)).isSameInstanceAs(a);
    assertThat(producer.operand(1).definingOp().operand(0)).isSameInstanceAs(b);
    // The original cast is now an identity, left for folding.
    assertThat(cast.definingOp().operand(0).type()).isEqualTo(IntType.INDEX);
    assertThat(events)
        .containsExactly("inserted index_castui", "inserted index_castui", "modified addi")
        .inOrder();
    assertThat(region.indexOf(producer)).isEqualTo(2);
  }

  @Test
  public void noMatchIfProducerHasOtherUsers() throws Exception {
    Region region = new Region();
    Value a = region.addArgument(IntType.I64, 0, 1000);
    Value sum = region.add(OpKind.ADD, IntType.I64, a, a);
    Value cast = region.add(OpKind.INDEX_CAST_UI, IntType.INDEX, sum);
    region.ret(cast, sum);
    assertNoMatch(region, cast);
  }

  @Test
  public void noMatchForNarrowProducer() throws Exception {
    Region region = new Region();
    Value a = region.addArgument(IntType.I32, 0, 1000);
    Value sum = region.add(OpKind.ADD, IntType.I32, a, a);
    Value cast = region.add(OpKind.INDEX_CAST_UI, IntType.INDEX, sum);
    region.ret(cast);
    assertNoMatch(region, cast);
  }

  @Test
  public void noMatchForSignedProducer() throws Exception {
    Region region = new Region();
    Value a = region.addArgument(IntType.I64, 0, 1000);
    Value b = region.addArgument(IntType.I64, 1, 10);
    Value quotient = region.add(OpKind.DIV_SI, IntType.I64, a, b);
    Value cast = region.add(OpKind.INDEX_CAST_UI, IntType.INDEX, quotient);
    region.ret(cast);
    assertNoMatch(region, cast);
  }

  @Test
  public void noMatchBeyondSafeBound() throws Exception {
    Region region = new Region();
    Value a = region.addArgument(IntType.I64, 0, 3_000_000_000L);
    Value b = region.addArgument(IntType.I64, 0, 3_000_000_000L);
    Value sum = region.add(OpKind.ADD, IntType.I64, a, b);
    Value cast = region.add(OpKind.INDEX_CAST_UI, IntType.INDEX, sum);
    region.ret(cast);
    assertNoMatch(region, cast);
  }

  @Test
  public void noMatchForCastFromIndex() throws Exception {
    Region region = new Region();
    Value a = region.addArgument(IntType.INDEX, 0, 1000);
    Value sum = region.add(OpKind.ADD, IntType.INDEX, a, a);
    Value cast = region.add(OpKind.INDEX_CAST_UI, IntType.I64, sum);
    region.ret(cast);
    assertNoMatch(region, cast);
  }

  @Test
  public void noMatchWithoutAnalysis() {
    Region region = new Region();
    Value a = region.addArgument(IntType.I64, 0, 1000);
    Value sum = region.add(OpKind.ADD, IntType.I64, a, a);
    Value cast = region.add(OpKind.INDEX_CAST_UI, IntType.INDEX, sum);
    region.ret(cast);
    PatternRewriter rewriter = new PatternRewriter(region, recorder);
    assertThat(pattern.matchAndRewrite(cast.definingOp(), rewriter)).isFalse();
  }

  private void assertNoMatch(Region region, Value cast) throws Exception {
    analysis.solve(region);
    String before = IrPrinter.print(region);
    PatternRewriter rewriter = new PatternRewriter(region, recorder);
    assertThat(pattern.matchAndRewrite(cast.definingOp(), rewriter)).isFalse();
    assertThat(IrPrinter.print(region)).isEqualTo(before);
    assertThat(events).isEmpty();
  }
}
