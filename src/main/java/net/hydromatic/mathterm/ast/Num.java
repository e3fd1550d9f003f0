/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.mathterm.ast;

import com.google.common.collect.ImmutableList;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;

import static java.util.Objects.requireNonNull;

/** Value of a numeric or boolean constant.
 *
 * <p>The sub-classes are a closed set: {@link IntegerNum},
 * {@link DecimalNum}, {@link PairNum} (rational, complex and e-notation
 * values, which have exactly two parts) and {@link BoolNum}.
 *
 * <p>Values are exact. A decimal keeps its scale, so "1.50" and "1.5" are
 * different values; this is what allows a value to survive conversion to
 * text and back. */
public abstract class Num {
  private Num() {}

  /** Creates an integer value. */
  public static IntegerNum integer(BigInteger value) {
    return new IntegerNum(value);
  }

  /** Creates an integer value. */
  public static IntegerNum integer(long value) {
    return new IntegerNum(BigInteger.valueOf(value));
  }

  /** Creates a decimal value. */
  public static DecimalNum decimal(BigDecimal value) {
    return new DecimalNum(value);
  }

  /** Creates a decimal value from its text, for example ".1". */
  public static DecimalNum decimal(String text) {
    return new DecimalNum(new BigDecimal(text));
  }

  /** Creates a rational value "numerator / denominator". */
  public static PairNum rational(BigDecimal numerator,
      BigDecimal denominator) {
    return new PairNum(Op.RATIONAL_LITERAL, numerator, denominator);
  }

  /** Creates a complex value in cartesian form. */
  public static PairNum complex(BigDecimal real, BigDecimal imaginary) {
    return new PairNum(Op.COMPLEX_LITERAL, real, imaginary);
  }

  /** Creates a value in scientific notation, "mantissa * 10 ^ exponent". */
  public static PairNum eNotation(BigDecimal mantissa, BigDecimal exponent) {
    return new PairNum(Op.E_NOTATION_LITERAL, mantissa, exponent);
  }

  /** Returns the boolean value. */
  public static BoolNum bool(boolean value) {
    return value ? BoolNum.TRUE : BoolNum.FALSE;
  }

  /** Returns the kind of literal that holds this value, for example
   * {@link Op#COMPLEX_LITERAL}. */
  public abstract Op op();

  /** Returns the parts of this value, each of which is the text of a
   * decimal number. Integers and decimals have one part, pairs have two,
   * booleans have none. */
  public abstract List<String> parts();

  /** Returns whether the value is negative, and therefore whether its text
   * starts with a minus sign. */
  public abstract boolean isNegative();

  /** Returns the text of this value in term syntax; for example "3i"
   * for a complex with zero real part, "1.2e10" for e-notation. */
  @Override public abstract String toString();

  /** Integer value. */
  public static final class IntegerNum extends Num {
    public final BigInteger value;

    IntegerNum(BigInteger value) {
      this.value = requireNonNull(value);
    }

    @Override public Op op() {
      return Op.INTEGER_LITERAL;
    }

    @Override public List<String> parts() {
      return ImmutableList.of(value.toString());
    }

    @Override public boolean isNegative() {
      return value.signum() < 0;
    }

    @Override public int hashCode() {
      return value.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof IntegerNum
          && value.equals(((IntegerNum) o).value);
    }

    @Override public String toString() {
      return value.toString();
    }
  }

  /** Decimal value. */
  public static final class DecimalNum extends Num {
    public final BigDecimal value;

    DecimalNum(BigDecimal value) {
      this.value = requireNonNull(value);
    }

    @Override public Op op() {
      return Op.DECIMAL_LITERAL;
    }

    @Override public List<String> parts() {
      return ImmutableList.of(value.toPlainString());
    }

    @Override public boolean isNegative() {
      return value.signum() < 0;
    }

    @Override public int hashCode() {
      return value.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof DecimalNum
          && value.equals(((DecimalNum) o).value);
    }

    @Override public String toString() {
      return value.toPlainString();
    }
  }

  /** Value that consists of two decimal parts: a rational, complex or
   * e-notation value. */
  public static final class PairNum extends Num {
    private final Op op;
    public final BigDecimal first;
    public final BigDecimal second;

    PairNum(Op op, BigDecimal first, BigDecimal second) {
      checkArgument(op == Op.RATIONAL_LITERAL
          || op == Op.COMPLEX_LITERAL
          || op == Op.E_NOTATION_LITERAL, "not a pair: %s", op);
      this.op = op;
      this.first = requireNonNull(first);
      this.second = requireNonNull(second);
    }

    @Override public Op op() {
      return op;
    }

    @Override public List<String> parts() {
      return ImmutableList.of(first.toPlainString(), second.toPlainString());
    }

    @Override public boolean isNegative() {
      return first.signum() < 0
          || op == Op.COMPLEX_LITERAL
          && isPureImaginary()
          && second.signum() < 0;
    }

    /** Returns whether this is a complex value whose real part is exactly
     * zero, which is written "3i" rather than "(0+3i)". */
    public boolean isPureImaginary() {
      return op == Op.COMPLEX_LITERAL && first.equals(BigDecimal.ZERO);
    }

    @Override public int hashCode() {
      return Objects.hash(op, first, second);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof PairNum
          && op == ((PairNum) o).op
          && first.equals(((PairNum) o).first)
          && second.equals(((PairNum) o).second);
    }

    @Override public String toString() {
      final String a = first.toPlainString();
      final String b = second.toPlainString();
      switch (op) {
      case RATIONAL_LITERAL:
        return a + "//" + b;
      case E_NOTATION_LITERAL:
        return a + "e" + b;
      case COMPLEX_LITERAL:
        if (isPureImaginary()) {
          return b + "i";
        }
        return a + (second.signum() < 0 ? "" : "+") + b + "i";
      default:
        throw new AssertionError(op);
      }
    }
  }

  /** Boolean value. */
  public static final class BoolNum extends Num {
    static final BoolNum TRUE = new BoolNum(true);
    static final BoolNum FALSE = new BoolNum(false);

    public final boolean value;

    private BoolNum(boolean value) {
      this.value = value;
    }

    @Override public Op op() {
      return Op.BOOL_LITERAL;
    }

    @Override public List<String> parts() {
      return ImmutableList.of();
    }

    @Override public boolean isNegative() {
      return false;
    }

    @Override public int hashCode() {
      return Boolean.hashCode(value);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof BoolNum
          && value == ((BoolNum) o).value;
    }

    @Override public String toString() {
      return value ? "true" : "false";
    }
  }
}

// End Num.java
