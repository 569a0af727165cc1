/*
 * Copyright 2025 The Komrad Authors
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

package org.komrad.impl;

import org.jspecify.annotations.Nullable;
import org.komrad.ast.Expr.BinaryOp;
import org.komrad.ast.Expr.UnaryOp;

/**
 * Implementations of the binary and unary operators (other than the short-circuiting {@code &&} and
 * {@code ||}, which the Evaluator handles itself).
 *
 * <p>Arithmetic on two ints produces an int and fails on overflow; if either operand is a float
 * both are converted to floats. Division or modulo by zero fails for both ints and floats.
 */
final class Operators {

  private Operators() {}

  static Value binary(BinaryOp op, Value left, Value right) throws EvalError {
    switch (op) {
      case EQ:
        return BoolValue.of(Value.equal(left, right));
      case NE:
        return BoolValue.of(!Value.equal(left, right));
      case LT:
        return BoolValue.of(compare(op, left, right) < 0);
      case LE:
        return BoolValue.of(compare(op, left, right) <= 0);
      case GT:
        return BoolValue.of(compare(op, left, right) > 0);
      case GE:
        return BoolValue.of(compare(op, left, right) >= 0);
      case DIVISIBLE:
        return BoolValue.of(divisible(left, right));
      case ADD:
        if (left instanceof StringValue || right instanceof StringValue) {
          return new StringValue(left.display() + right.display());
        } else if (left instanceof ListValue l && right instanceof ListValue r) {
          return l.concat(r);
        }
        return arithmetic(op, left, right);
      case AND:
        {
          boolean x = asBoolean(op.symbol, left);
          boolean y = asBoolean(op.symbol, right);
          return BoolValue.of(x && y);
        }
      case OR:
        {
          boolean x = asBoolean(op.symbol, left);
          boolean y = asBoolean(op.symbol, right);
          return BoolValue.of(x || y);
        }
      default:
        return arithmetic(op, left, right);
    }
  }

  static Value unary(UnaryOp op, Value operand) throws EvalError {
    if (op == UnaryOp.NOT) {
      return BoolValue.of(!asBoolean(op.symbol, operand));
    } else if (operand instanceof IntValue i) {
      if (i.value() == Long.MIN_VALUE) {
        throw overflow(op.symbol, operand, null);
      }
      return IntValue.of(-i.value());
    } else if (operand instanceof FloatValue f) {
      return new FloatValue(-f.value());
    }
    throw new EvalError(EvalError.Kind.TYPE_MISMATCH, "Can't apply %s to %s", op.symbol, operand);
  }

  static boolean asBoolean(String operator, Value v) throws EvalError {
    if (v instanceof BoolValue b) {
      return b.asBoolean();
    }
    throw new EvalError(
        EvalError.Kind.TYPE_MISMATCH, "%s requires a boolean, got %s", operator, v);
  }

  /** Returns the value of an int or float as a Double, or null if {@code v} is not a number. */
  static @Nullable Double toDouble(Value v) {
    if (v instanceof IntValue i) {
      return (double) i.value();
    } else if (v instanceof FloatValue f) {
      return f.value();
    }
    return null;
  }

  private static Value arithmetic(BinaryOp op, Value left, Value right) throws EvalError {
    if (left instanceof IntValue l && right instanceof IntValue r) {
      long x = l.value();
      long y = r.value();
      if (y == 0 && (op == BinaryOp.DIVIDE || op == BinaryOp.MODULO)) {
        throw divisionByZero(op, left, right);
      }
      try {
        long result =
            switch (op) {
              case ADD -> Math.addExact(x, y);
              case SUBTRACT -> Math.subtractExact(x, y);
              case MULTIPLY -> Math.multiplyExact(x, y);
              case DIVIDE -> {
                if (x == Long.MIN_VALUE && y == -1) {
                  throw new ArithmeticException("long overflow");
                }
                yield x / y;
              }
              case MODULO -> x % y;
              default -> throw new AssertionError(op);
            };
        return IntValue.of(result);
      } catch (ArithmeticException e) {
        throw overflow(op.symbol, left, right);
      }
    }
    Double x = toDouble(left);
    Double y = toDouble(right);
    if (x == null || y == null) {
      throw new EvalError(
          EvalError.Kind.TYPE_MISMATCH, "Can't apply %s to %s and %s", op.symbol, left, right);
    }
    if (y == 0 && (op == BinaryOp.DIVIDE || op == BinaryOp.MODULO)) {
      throw divisionByZero(op, left, right);
    }
    double result =
        switch (op) {
          case ADD -> x + y;
          case SUBTRACT -> x - y;
          case MULTIPLY -> x * y;
          case DIVIDE -> x / y;
          case MODULO -> x % y;
          default -> throw new AssertionError(op);
        };
    return new FloatValue(result);
  }

  /** {@code a %% b} is true if the int {@code a} is a multiple of the int {@code b}. */
  private static boolean divisible(Value left, Value right) throws EvalError {
    if (left instanceof IntValue l && right instanceof IntValue r) {
      if (r.value() == 0) {
        throw divisionByZero(BinaryOp.DIVISIBLE, left, right);
      }
      return l.value() % r.value() == 0;
    }
    throw new EvalError(
        EvalError.Kind.TYPE_MISMATCH, "%% requires integers, got %s and %s", left, right);
  }

  /** Compares two numbers or two strings. */
  private static int compare(BinaryOp op, Value left, Value right) throws EvalError {
    if (left instanceof IntValue l && right instanceof IntValue r) {
      return Long.compare(l.value(), r.value());
    } else if (left instanceof StringValue l && right instanceof StringValue r) {
      return l.value.compareTo(r.value);
    }
    Double x = toDouble(left);
    Double y = toDouble(right);
    if (x == null || y == null) {
      throw new EvalError(
          EvalError.Kind.TYPE_MISMATCH, "Can't compare %s and %s with %s", left, right, op.symbol);
    }
    return Double.compare(x, y);
  }

  private static EvalError divisionByZero(BinaryOp op, Value left, Value right) {
    return new EvalError(EvalError.Kind.DIVISION_BY_ZERO, "%s %s %s", left, op.symbol, right);
  }

  private static EvalError overflow(String operator, Value left, @Nullable Value right) {
    if (right == null) {
      return new EvalError(
          EvalError.Kind.INTRINSIC_FAILURE, "Integer overflow in %s%s", operator, left);
    }
    return new EvalError(
        EvalError.Kind.INTRINSIC_FAILURE, "Integer overflow in %s %s %s", left, operator, right);
  }
}
