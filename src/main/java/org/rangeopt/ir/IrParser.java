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

package org.rangeopt.ir;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.jspecify.annotations.Nullable;

/**
 * Builds a {@link Region} from its textual form (see {@link IrPrinter}). Value names are local to
 * the text; each must be defined (as an argument or result) before it is used.
 */
public class IrParser {

  private final String sourceName;
  private final Map<String, Value> values = new HashMap<>();

  private IrParser(String sourceName) {
    this.sourceName = sourceName;
  }

  /**
   * Parses {@code text}, which must contain a single region. Throws an {@link IrSyntaxException} if
   * the text is malformed.
   */
  public static Region parse(String text, String sourceName) {
    ThrowingErrorListener errors = new ThrowingErrorListener(sourceName);
    IrTextLexer lexer = new IrTextLexer(CharStreams.fromString(text, sourceName));
    lexer.removeErrorListeners();
    lexer.addErrorListener(errors);
    IrTextParser parser = new IrTextParser(new CommonTokenStream(lexer));
    parser.removeErrorListeners();
    parser.addErrorListener(errors);
    return new IrParser(sourceName).buildRegion(parser.region());
  }

  private Location location(Token token) {
    return new Location(sourceName, token.getLine());
  }

  private Region buildRegion(IrTextParser.RegionContext ctx) {
    Region region = new Region(location(ctx.getStart()));
    for (IrTextParser.ArgumentContext arg : ctx.argument()) {
      IntType type = parseType(arg.type());
      Value value =
          (arg.lo == null)
              ? region.addArgument(type)
              : addBoundedArgument(region, type, arg.lo, arg.hi, location(arg.name));
      define(arg.name, value);
    }
    for (IrTextParser.OperationContext op : ctx.operation()) {
      addOperation(region, op);
    }
    return region;
  }

  private static Value addBoundedArgument(
      Region region,
      IntType type,
      IrTextParser.IntegerContext lo,
      IrTextParser.IntegerContext hi,
      Location location) {
    try {
      return region.addArgument(type, new BigInteger(lo.getText()), new BigInteger(hi.getText()));
    } catch (IllegalArgumentException e) {
      throw new IrSyntaxException(location, e.getMessage(), e);
    }
  }

  private void addOperation(Region region, IrTextParser.OperationContext ctx) {
    Location location = location(ctx.getStart());
    String mnemonic = ctx.opName.getText();
    OpKind kind = OpKind.forMnemonic(mnemonic);
    if (kind == null) {
      throw new IrSyntaxException(location, "Unknown operation '" + mnemonic + "'");
    }
    if (kind.hasResult() != (ctx.res != null)) {
      throw new IrSyntaxException(
          location, kind + (kind.hasResult() ? " must" : " must not") + " have a result");
    }
    if (kind.hasResult() != (ctx.type() != null)) {
      throw new IrSyntaxException(
          location, kind + (kind.hasResult() ? " must" : " must not") + " have a type");
    }
    IntType resultType = kind.hasResult() ? parseType(ctx.type()) : null;
    ImmutableList.Builder<Value> operands = ImmutableList.builder();
    for (Token operand : ctx.operands) {
      Value value = values.get(operand.getText());
      if (value == null) {
        throw new IrSyntaxException(location, "Undefined value " + operand.getText());
      }
      operands.add(value);
    }
    ImmutableMap<String, Object> attributes =
        attributes(kind, resultType, ctx.predicate, ctx.constant, location);
    Operation op;
    try {
      op = Operation.create(kind, resultType, operands.build(), attributes, location);
    } catch (IllegalArgumentException e) {
      throw new IrSyntaxException(location, e.getMessage(), e);
    }
    region.append(op);
    if (ctx.res != null) {
      define(ctx.res, op.result());
    }
  }

  private static ImmutableMap<String, Object> attributes(
      OpKind kind,
      @Nullable IntType resultType,
      @Nullable Token predicate,
      IrTextParser.@Nullable IntegerContext constant,
      Location location) {
    if ((kind == OpKind.CMP) != (predicate != null)) {
      throw new IrSyntaxException(location, "Only cmpi takes a predicate");
    }
    if ((kind == OpKind.CONSTANT) != (constant != null)) {
      throw new IrSyntaxException(location, "Only constant takes an integer");
    }
    if (predicate != null) {
      CmpPredicate p = CmpPredicate.forMnemonic(predicate.getText());
      if (p == null) {
        throw new IrSyntaxException(location, "Unknown predicate '" + predicate.getText() + "'");
      }
      return ImmutableMap.of(OpKind.PREDICATE_ATTR, p);
    } else if (constant != null) {
      int width = resultType.width();
      BigInteger v = new BigInteger(constant.getText());
      if (v.compareTo(ArithSemantics.signedMin(width)) < 0
          || v.compareTo(ArithSemantics.unsignedMax(width)) > 0) {
        throw new IrSyntaxException(location, v + " does not fit in " + resultType);
      }
      return ImmutableMap.of(OpKind.VALUE_ATTR, ArithSemantics.toSigned(v, width));
    }
    return ImmutableMap.of();
  }

  private IntType parseType(IrTextParser.TypeContext ctx) {
    IntType type = IntType.parse(ctx.getText());
    if (type == null) {
      throw new IrSyntaxException(location(ctx.getStart()), "Unknown type '" + ctx.getText() + "'");
    }
    return type;
  }

  private void define(Token name, Value value) {
    if (values.putIfAbsent(name.getText(), value) != null) {
      throw new IrSyntaxException(location(name), "Duplicate definition of " + name.getText());
    }
  }

  /** Converts ANTLR's syntax error reports into IrSyntaxExceptions. */
  private static class ThrowingErrorListener extends BaseErrorListener {
    private final String sourceName;

    ThrowingErrorListener(String sourceName) {
      this.sourceName = sourceName;
    }

    @Override
    public void syntaxError(
        Recognizer<?, ?> recognizer,
        Object offendingSymbol,
        int line,
        int charPositionInLine,
        String msg,
        RecognitionException e) {
      throw new IrSyntaxException(new Location(sourceName, line), msg, e);
    }
  }
}
