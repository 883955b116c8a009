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

import java.util.List;
import org.rangeopt.ir.OpKind;
import org.rangeopt.ir.Operation;
import org.rangeopt.ir.Value;
import org.rangeopt.range.ConstantRange;
import org.rangeopt.range.RangeQuery;
import org.rangeopt.rewrite.PatternRewriter;
import org.rangeopt.rewrite.RewritePattern;

/**
 * Replaces an operation whose result is proven to have a single value with a constant. This
 * includes comparisons decided by their operands' ranges.
 *
 * <p>Results of type {@code index} are left alone, since there are no {@code index} constants. A
 * fixed-width result computed from {@code index} values is only single-valued if it is the same
 * for every index width.
 */
public class MaterializeKnownConstant extends RewritePattern {

  private final RangeQuery query;

  public MaterializeKnownConstant(RangeQuery query) {
    // Preferred over the other patterns, since it makes the operation dead.
    super(null, 2);
    this.query = query;
  }

  @Override
  public boolean matchAndRewrite(Operation op, PatternRewriter rewriter) {
    if (op.kind() == OpKind.CONSTANT || !op.kind().hasResult()) {
      return false;
    }
    Value result = op.result();
    if (result.type().isIndex()) {
      return false;
    }
    ConstantRange range = query.query(result);
    if (range == null || !range.isSingleValue()) {
      return false;
    }
    rewriter.setInsertionPoint(op);
    Value constant = rewriter.createConstant(result.type(), range.singleValue(), op.location());
    rewriter.replaceOp(op, List.of(constant));
    return true;
  }
}
