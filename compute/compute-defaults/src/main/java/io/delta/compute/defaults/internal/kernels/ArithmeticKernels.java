/*
 * Copyright (2026) The Delta Lake Project Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.delta.compute.defaults.internal.kernels;

import io.delta.compute.defaults.engine.DefaultFunctionRegistry;
import io.delta.compute.defaults.internal.DefaultComputeErrors;
import io.delta.compute.engine.Kernel;
import io.delta.compute.functions.FunctionId;
import io.delta.compute.types.*;

/**
 * Kernels of the arithmetic functions. Both operands must have the same numeric type, which is
 * also the result type. Integer results of the unchecked variants wrap around on overflow, the
 * checked variants fail instead. Integer division by zero fails in both variants.
 */
final class ArithmeticKernels {
  private ArithmeticKernels() {}

  static void registerAll(DefaultFunctionRegistry registry) {
    registerUnary(registry, FunctionId.ABS, FunctionId.ABS_CHECKED, ABS);
    registerUnary(registry, FunctionId.NEGATE, FunctionId.NEGATE_CHECKED, NEGATE);
    registerBinary(registry, FunctionId.ADD, FunctionId.ADD_CHECKED, ADD);
    registerBinary(registry, FunctionId.SUBTRACT, FunctionId.SUBTRACT_CHECKED, SUBTRACT);
    registerBinary(registry, FunctionId.MULTIPLY, FunctionId.MULTIPLY_CHECKED, MULTIPLY);
    registerBinary(registry, FunctionId.DIVIDE, FunctionId.DIVIDE_CHECKED, DIVIDE);
    registerBinary(registry, FunctionId.POWER, FunctionId.POWER_CHECKED, POWER);
  }

  interface UnaryOperation {
    /** Exact result, throws {@link ArithmeticException} if it does not fit in a long. */
    long exact(long value);

    long wrapping(long value);

    double floating(double value);
  }

  interface BinaryOperation {
    /** Exact result, throws {@link ArithmeticException} if it does not fit in a long. */
    long exact(long left, long right);

    long wrapping(long left, long right);

    double floating(double left, double right);

    /** Rejects operands for which the integer operation is undefined. */
    default void checkIntegerOperands(String functionName, long left, long right) {}

    /** Rejects operands for which the checked floating point operation fails. */
    default void checkFloatingOperands(String functionName, double left, double right) {}
  }

  static final UnaryOperation ABS =
      new UnaryOperation() {
        @Override
        public long exact(long value) {
          return value < 0 ? Math.negateExact(value) : value;
        }

        @Override
        public long wrapping(long value) {
          return Math.abs(value);
        }

        @Override
        public double floating(double value) {
          return Math.abs(value);
        }
      };

  static final UnaryOperation NEGATE =
      new UnaryOperation() {
        @Override
        public long exact(long value) {
          return Math.negateExact(value);
        }

        @Override
        public long wrapping(long value) {
          return -value;
        }

        @Override
        public double floating(double value) {
          return -value;
        }
      };

  static final BinaryOperation ADD =
      new BinaryOperation() {
        @Override
        public long exact(long left, long right) {
          return Math.addExact(left, right);
        }

        @Override
        public long wrapping(long left, long right) {
          return left + right;
        }

        @Override
        public double floating(double left, double right) {
          return left + right;
        }
      };

  static final BinaryOperation SUBTRACT =
      new BinaryOperation() {
        @Override
        public long exact(long left, long right) {
          return Math.subtractExact(left, right);
        }

        @Override
        public long wrapping(long left, long right) {
          return left - right;
        }

        @Override
        public double floating(double left, double right) {
          return left - right;
        }
      };

  static final BinaryOperation MULTIPLY =
      new BinaryOperation() {
        @Override
        public long exact(long left, long right) {
          return Math.multiplyExact(left, right);
        }

        @Override
        public long wrapping(long left, long right) {
          return left * right;
        }

        @Override
        public double floating(double left, double right) {
          return left * right;
        }
      };

  static final BinaryOperation DIVIDE =
      new BinaryOperation() {
        @Override
        public long exact(long left, long right) {
          if (left == Long.MIN_VALUE && right == -1) {
            throw new ArithmeticException("long overflow");
          }
          return left / right;
        }

        @Override
        public long wrapping(long left, long right) {
          return left / right;
        }

        @Override
        public double floating(double left, double right) {
          return left / right;
        }

        @Override
        public void checkIntegerOperands(String functionName, long left, long right) {
          if (right == 0) {
            throw DefaultComputeErrors.divideByZero(functionName);
          }
        }

        @Override
        public void checkFloatingOperands(String functionName, double left, double right) {
          if (right == 0) {
            throw DefaultComputeErrors.divideByZero(functionName);
          }
        }
      };

  static final BinaryOperation POWER =
      new BinaryOperation() {
        @Override
        public long exact(long base, long exponent) {
          if (base == 0 || base == 1) {
            return exponent == 0 ? 1 : base;
          }
          if (base == -1) {
            return (exponent & 1) == 0 ? 1 : -1;
          }
          long result = 1;
          for (long i = 0; i < exponent; i++) {
            result = Math.multiplyExact(result, base);
          }
          return result;
        }

        @Override
        public long wrapping(long base, long exponent) {
          // square and multiply, every step wraps
          long result = 1;
          long factor = base;
          long remaining = exponent;
          while (remaining > 0) {
            if ((remaining & 1) == 1) {
              result *= factor;
            }
            factor *= factor;
            remaining >>= 1;
          }
          return result;
        }

        @Override
        public double floating(double base, double exponent) {
          return Math.pow(base, exponent);
        }

        @Override
        public void checkIntegerOperands(String functionName, long base, long exponent) {
          if (exponent < 0) {
            throw DefaultComputeErrors.negativePower(functionName);
          }
        }
      };

  private static void registerUnary(
      DefaultFunctionRegistry registry,
      FunctionId unchecked,
      FunctionId checked,
      UnaryOperation operation) {
    registry.register(unchecked, unaryKernel(unchecked.getRegistryName(), operation, false));
    registry.register(checked, unaryKernel(checked.getRegistryName(), operation, true));
  }

  private static void registerBinary(
      DefaultFunctionRegistry registry,
      FunctionId unchecked,
      FunctionId checked,
      BinaryOperation operation) {
    registry.register(unchecked, binaryKernel(unchecked.getRegistryName(), operation, false));
    registry.register(checked, binaryKernel(checked.getRegistryName(), operation, true));
  }

  static Kernel unaryKernel(String name, UnaryOperation operation, boolean checked) {
    return (arguments, options, context) -> {
      DataType type = KernelUtils.checkSameType(name, arguments, ArithmeticKernels::isNumeric);
      return KernelUtils.mapRowsNullPropagating(
          name,
          arguments,
          type,
          values -> {
            Number value = (Number) values[0];
            if (isFloating(type)) {
              return toFloating(type, operation.floating(value.doubleValue()));
            }
            long result;
            if (checked) {
              try {
                result = operation.exact(value.longValue());
              } catch (ArithmeticException e) {
                throw DefaultComputeErrors.overflow(name);
              }
              checkFits(name, type, result);
            } else {
              result = operation.wrapping(value.longValue());
            }
            return toIntegral(type, result);
          });
    };
  }

  static Kernel binaryKernel(String name, BinaryOperation operation, boolean checked) {
    return (arguments, options, context) -> {
      DataType type = KernelUtils.checkSameType(name, arguments, ArithmeticKernels::isNumeric);
      return KernelUtils.mapRowsNullPropagating(
          name,
          arguments,
          type,
          values -> {
            Number left = (Number) values[0];
            Number right = (Number) values[1];
            if (isFloating(type)) {
              if (checked) {
                operation.checkFloatingOperands(name, left.doubleValue(), right.doubleValue());
              }
              return toFloating(
                  type, operation.floating(left.doubleValue(), right.doubleValue()));
            }
            operation.checkIntegerOperands(name, left.longValue(), right.longValue());
            long result;
            if (checked) {
              try {
                result = operation.exact(left.longValue(), right.longValue());
              } catch (ArithmeticException e) {
                throw DefaultComputeErrors.overflow(name);
              }
              checkFits(name, type, result);
            } else {
              result = operation.wrapping(left.longValue(), right.longValue());
            }
            return toIntegral(type, result);
          });
    };
  }

  static boolean isNumeric(DataType type) {
    return isIntegral(type) || isFloating(type);
  }

  static boolean isIntegral(DataType type) {
    return type instanceof ByteType
        || type instanceof ShortType
        || type instanceof IntegerType
        || type instanceof LongType;
  }

  static boolean isFloating(DataType type) {
    return type instanceof FloatType || type instanceof DoubleType;
  }

  private static void checkFits(String name, DataType type, long value) {
    long min;
    long max;
    if (type instanceof ByteType) {
      min = Byte.MIN_VALUE;
      max = Byte.MAX_VALUE;
    } else if (type instanceof ShortType) {
      min = Short.MIN_VALUE;
      max = Short.MAX_VALUE;
    } else if (type instanceof IntegerType) {
      min = Integer.MIN_VALUE;
      max = Integer.MAX_VALUE;
    } else {
      return;
    }
    if (value < min || value > max) {
      throw DefaultComputeErrors.overflow(name);
    }
  }

  /** Narrows to the Java representation of {@code type}, wrapping out-of-range values. */
  private static Object toIntegral(DataType type, long value) {
    if (type instanceof ByteType) {
      return (byte) value;
    } else if (type instanceof ShortType) {
      return (short) value;
    } else if (type instanceof IntegerType) {
      return (int) value;
    }
    return value;
  }

  private static Object toFloating(DataType type, double value) {
    if (type instanceof FloatType) {
      return (float) value;
    }
    return value;
  }
}
