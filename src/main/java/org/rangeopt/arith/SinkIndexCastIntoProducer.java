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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Sets;
import java.util.List;
import java.util.Set;
import org.rangeopt.ir.IntType;
import org.rangeopt.ir.OpKind;
import org.rangeopt.ir.Operation;
import org.rangeopt.ir.Value;
import org.rangeopt.rewrite.PatternRewriter;
import org.rangeopt.rewrite.RewritePattern;

/**
 * Given {@code %c = index_castui %p : index} where {@code %p} is an {@code i64} computed by an
 * arithmetic operation whose operands and result all fit in 32 unsigned bits, moves the cast onto
 * the producer's operands and retypes the producer to {@code index}. For example
 *
 * <pre>
 *   %p = addi %a, %b : i64
 *   %c = index_castui %p : index
 * </pre>
 *
 * becomes
 *
 * <pre>
 *   %a' = index_castui %a : index
 *   %b' = index_castui %b : index
 *   %p = addi %a', %b' : index
 *   %c = index_castui %p : index
 * </pre>
 *
 * after which {@code %c} is an identity cast that will be folded away.
 *
 * <p>Only {@code i64} producers are rewritten: the bound checks are made on the producer's own
 * width, and a narrower producer's wraparound would not be preserved once it runs at index width.
 * Every user of the producer's result must be an equivalent cast, since retyping the result changes
 * what all of them see.
 */
public class SinkIndexCastIntoProducer extends RewritePattern {

  /** The producer kinds whose unsigned behavior is unchanged by computing them in a wider type. */
  static final Set<OpKind> SINKABLE_PRODUCERS =
      Sets.immutableEnumSet(
          OpKind.ADD,
          OpKind.CEIL_DIV_UI,
          OpKind.DIV_UI,
          OpKind.MAX_UI,
          OpKind.MIN_UI,
          OpKind.MUL,
          OpKind.REM_UI,
          OpKind.SUB);

  private final UnsignedLegality legality;

  public SinkIndexCastIntoProducer(UnsignedLegality legality) {
    super(OpKind.INDEX_CAST_UI);
    this.legality = legality;
  }

  @Override
  public boolean matchAndRewrite(Operation op, PatternRewriter rewriter) {
    Value input = op.operand(0);
    IntType inType = input.type();
    if (inType != IntType.I64 || !op.result().type().isIndex()) {
      return false;
    }
    Operation producer = input.definingOp();
    if (producer == null || !SINKABLE_PRODUCERS.contains(producer.kind())) {
      return false;
    }
    if (!input.users().stream().allMatch(SinkIndexCastIntoProducer::isCastToIndex)) {
      return false;
    }
    if (!producer.operands().stream().allMatch(legality::valueWithinSafeIndexBound)
        || !producer.results().stream().allMatch(legality::valueWithinSafeIndexBound)) {
      return false;
    }
    rewriter.modifyOpInPlace(
        producer,
        () -> {
          rewriter.setInsertionPoint(producer);
          for (int i = 0; i < producer.numOperands(); i++) {
            Value operand = producer.operand(i);
            if (operand.type() == inType) {
              Value cast =
                  rewriter
                      .create(
                          OpKind.INDEX_CAST_UI,
                          IntType.INDEX,
                          List.of(operand),
                          ImmutableMap.of(),
                          producer.location())
                      .result();
              producer.setOperand(i, cast);
            }
          }
          producer.result().setType(IntType.INDEX);
        });
    return true;
  }

  private static boolean isCastToIndex(Operation user) {
    return user.kind() == OpKind.INDEX_CAST_UI && user.result().type().isIndex();
  }
}
