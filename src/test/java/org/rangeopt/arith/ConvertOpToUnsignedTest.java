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
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import com.google.testing.junit.testparameterinjector.TestParameterValuesProvider;
import org.junit.Test;
import org.junit.runner.RunWith;
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

@RunWith(TestParameterInjector.class)
public class ConvertOpToUnsignedTest {

  /** Provides each kind that has an unsigned counterpart. */
  public static final class SignedKinds extends TestParameterValuesProvider {
    @Override
    public ImmutableList<OpKind> provideValues(Context context) {
      return ConvertOpToUnsigned.SIGNED_TO_UNSIGNED.keySet().asList();
    }
  }

  private final IntRangeAnalysis analysis = new IntRangeAnalysis();
  private final UnsignedLegality legality = new UnsignedLegality(new RangeQuery(analysis));

  /**
   * Returns the result of a new operation of the given kind, added to {@code region}, whose first
   * operand has the given lower bound.
   */
  private static Value addOperation(Region region, OpKind kind, long lo) {
    return switch (kind) {
      case EXT_SI -> region.add(kind, IntType.I32, region.addArgument(IntType.I8, lo, 100));
      case INDEX_CAST -> region.add(kind, IntType.INDEX, region.addArgument(IntType.I32, lo, 100));
      default ->
          region.add(
              kind,
              IntType.I32,
              region.addArgument(IntType.I32, lo, 100),
              region.addArgument(IntType.I32, 1, 10));
    };
  }

  @Test
  public void convertsWhenNonNegative(
      @TestParameter(valuesProvider = SignedKinds.class) OpKind kind) throws Exception {
    Region region = new Region();
    Value result = addOperation(region, kind, 0);
    Operation op = result.definingOp();
    Operation ret = region.ret(result);
    analysis.solve(region);

    ConvertOpToUnsigned pattern = new ConvertOpToUnsigned(kind, legality);
    assertThat(pattern.rootKind()).isEqualTo(kind);
    PatternRewriter rewriter = new PatternRewriter(region, new RewriteListener() {});
    assertThat(pattern.matchAndRewrite(op, rewriter)).isTrue();

    assertThat(op.isErased()).isTrue();
    Operation replacement = ret.operand(0).definingOp();
    assertThat(replacement.kind()).isEqualTo(ConvertOpToUnsigned.SIGNED_TO_UNSIGNED.get(kind));
    assertThat(replacement.result().type()).isEqualTo(result.type());
    assertThat(replacement.operands()).containsExactlyElementsIn(region.arguments()).inOrder();
    assertThat(region.numOperations()).isEqualTo(2);
  }

  @Test
  public void noMatchWhenOperandMayBeNegative(
      @TestParameter(valuesProvider = SignedKinds.class) OpKind kind) throws Exception {
    Region region = new Region();
    Value result = addOperation(region, kind, -1);
    region.ret(result);
    analysis.solve(region);
    String before = IrPrinter.print(region);

    ConvertOpToUnsigned pattern = new ConvertOpToUnsigned(kind, legality);
    PatternRewriter rewriter = new PatternRewriter(region, new RewriteListener() {});
    assertThat(pattern.matchAndRewrite(result.definingOp(), rewriter)).isFalse();
    assertThat(IrPrinter.print(region)).isEqualTo(before);
  }

  @Test
  public void noMatchWithoutAnalysis(
      @TestParameter(valuesProvider = SignedKinds.class) OpKind kind) {
    Region region = new Region();
    Value result = addOperation(region, kind, 0);
    region.ret(result);

    ConvertOpToUnsigned pattern = new ConvertOpToUnsigned(kind, legality);
    PatternRewriter rewriter = new PatternRewriter(region, new RewriteListener() {});
    assertThat(pattern.matchAndRewrite(result.definingOp(), rewriter)).isFalse();
  }

  @Test
  public void floorDivisionBecomesPlainDivision() {
    assertThat(ConvertOpToUnsigned.SIGNED_TO_UNSIGNED.get(OpKind.FLOOR_DIV_SI))
        .isEqualTo(OpKind.DIV_UI);
    assertThat(ConvertOpToUnsigned.SIGNED_TO_UNSIGNED).hasSize(8);
  }

  @Test
  public void onlySignedKinds() {
    assertThrows(
        IllegalArgumentException.class, () -> new ConvertOpToUnsigned(OpKind.ADD, legality));
    assertThrows(
        IllegalArgumentException.class, () -> new ConvertOpToUnsigned(OpKind.DIV_UI, legality));
  }
}
