package vypr.runtime;

import vypr.ast.BinaryOperator;
import vypr.ast.UnaryOperator;
import vypr.exception.VyprRuntimeException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Operations on runtime values, following what the generated Python does.
 * Values are Long, BigInteger, Double, String, Boolean, List or null. Integers are
 * unbounded: a result that leaves the long range becomes a BigInteger, and one that
 * fits again goes back to Long.
 */
public final class Values {
    private Values() {
    }

    public static boolean truthy(Object o) {
        if (o == null) return false;
        if (o instanceof Boolean) return (Boolean) o;
        if (o instanceof Long) return (Long) o != 0L;
        if (o instanceof BigInteger) return ((BigInteger) o).signum() != 0;
        if (o instanceof Double) return (Double) o != 0.0;
        if (o instanceof String) return !((String) o).isEmpty();
        if (o instanceof List) return !((List<?>) o).isEmpty();
        return true;
    }

    /** Text form used by print, string addition and concatenation. */
    public static String format(Object o) {
        if (o == null) return "None";
        if (o instanceof Boolean) return (Boolean) o ? "true" : "false";
        if (o instanceof Double) return formatFloat((Double) o);
        if (o instanceof List) {
            StringBuilder sb = new StringBuilder("[");
            List<?> items = (List<?>) o;
            for (int i = 0; i < items.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(format(items.get(i)));
            }
            return sb.append(']').toString();
        }
        return o.toString();
    }

    // Python's repr for floats: shortest round-tripping digits, exponent form below 1e-4 and from 1e16.
    static String formatFloat(double d) {
        if (Double.isNaN(d)) return "nan";
        if (Double.isInfinite(d)) return d > 0 ? "inf" : "-inf";
        if (d == 0.0) return (1.0 / d) < 0 ? "-0.0" : "0.0";
        BigDecimal shortest = shortestDigits(d);
        String digits = shortest.unscaledValue().abs().toString();
        int exponent = digits.length() - 1 - shortest.scale();
        String sign = d < 0 ? "-" : "";
        if (exponent >= -4 && exponent < 16) {
            String plain = shortest.toPlainString();
            return plain.contains(".") ? plain : plain + ".0";
        }
        String mantissa = digits.length() == 1 ? digits : digits.charAt(0) + "." + digits.substring(1);
        int abs = Math.abs(exponent);
        return sign + mantissa + "e" + (exponent < 0 ? "-" : "+") + (abs < 10 ? "0" : "") + abs;
    }

    private static BigDecimal shortestDigits(double d) {
        BigDecimal exact = new BigDecimal(d);
        for (int precision = 1; precision < 17; precision++) {
            BigDecimal rounded = exact.round(new MathContext(precision, RoundingMode.HALF_EVEN));
            if (rounded.doubleValue() == d) {
                return rounded.stripTrailingZeros();
            }
        }
        return exact.round(new MathContext(17, RoundingMode.HALF_EVEN)).stripTrailingZeros();
    }

    public static Object binary(BinaryOperator op, Object left, Object right) {
        switch (op) {
            case ADD:
                if (left instanceof String || right instanceof String) {
                    return format(left) + format(right);
                }
                if (left instanceof List && right instanceof List) {
                    List<Object> joined = new ArrayList<>((List<?>) left);
                    joined.addAll((List<?>) right);
                    return joined;
                }
                return arithmetic(op, left, right);
            case CONCAT:
                return format(left) + format(right);
            case SUBTRACT:
            case DIVIDE:
                return arithmetic(op, left, right);
            case MULTIPLY:
                if (left instanceof String && isInteger(right)) {
                    return repeat((String) left, right);
                }
                if (isInteger(left) && right instanceof String) {
                    return repeat((String) right, left);
                }
                return arithmetic(op, left, right);
            case EQUAL:
                return equal(left, right);
            case NOT_EQUAL:
                return !equal(left, right);
            default:
                return compare(op, left, right);
        }
    }

    public static Object unary(UnaryOperator op, Object operand) {
        if (!isNumber(operand)) {
            throw new VyprRuntimeException("bad operand type for unary " + op.symbol() + ": '" + typeName(operand) + "'");
        }
        if (op == UnaryOperator.PLUS) {
            return operand instanceof Boolean ? toLong(operand) : operand;
        }
        if (operand instanceof Double) {
            return -(Double) operand;
        }
        return narrow(toBig(operand).negate());
    }

    private static String repeat(String text, Object times) {
        BigInteger count = toBig(times);
        if (count.signum() <= 0) {
            return "";
        }
        if (count.compareTo(BigInteger.valueOf(Integer.MAX_VALUE / Math.max(1, text.length()))) > 0) {
            throw new VyprRuntimeException("repeated string is too long");
        }
        return text.repeat(count.intValue());
    }

    private static Object arithmetic(BinaryOperator op, Object left, Object right) {
        if (!isNumber(left) || !isNumber(right)) {
            throw new VyprRuntimeException("unsupported operand type(s) for " + op.symbol() + ": '"
                    + typeName(left) + "' and '" + typeName(right) + "'");
        }
        if (op == BinaryOperator.DIVIDE) {
            double divisor = toDouble(right);
            if (divisor == 0.0) {
                throw new VyprRuntimeException("division by zero");
            }
            return toDouble(left) / divisor;
        }
        if (left instanceof Double || right instanceof Double) {
            double l = toDouble(left);
            double r = toDouble(right);
            switch (op) {
                case ADD: return l + r;
                case SUBTRACT: return l - r;
                default: return l * r;
            }
        }
        BigInteger l = toBig(left);
        BigInteger r = toBig(right);
        switch (op) {
            case ADD: return narrow(l.add(r));
            case SUBTRACT: return narrow(l.subtract(r));
            default: return narrow(l.multiply(r));
        }
    }

    private static boolean equal(Object left, Object right) {
        if (isInteger(left) && isInteger(right)) {
            return toBig(left).equals(toBig(right));
        }
        if (isNumber(left) && isNumber(right)) {
            return toDouble(left) == toDouble(right);
        }
        if (left instanceof List && right instanceof List) {
            List<?> l = (List<?>) left;
            List<?> r = (List<?>) right;
            if (l.size() != r.size()) return false;
            for (int i = 0; i < l.size(); i++) {
                if (!equal(l.get(i), r.get(i))) return false;
            }
            return true;
        }
        return left == null ? right == null : left.equals(right);
    }

    private static boolean compare(BinaryOperator op, Object left, Object right) {
        int c;
        if (isInteger(left) && isInteger(right)) {
            c = toBig(left).compareTo(toBig(right));
        } else if (isNumber(left) && isNumber(right)) {
            c = Double.compare(toDouble(left), toDouble(right));
        } else if (left instanceof String && right instanceof String) {
            c = ((String) left).compareTo((String) right);
        } else {
            throw new VyprRuntimeException("'" + op.symbol() + "' not supported between instances of '"
                    + typeName(left) + "' and '" + typeName(right) + "'");
        }
        switch (op) {
            case LESS_THAN: return c < 0;
            case GREATER_THAN: return c > 0;
            case LESS_EQUAL: return c <= 0;
            case GREATER_EQUAL: return c >= 0;
            default: throw new IllegalArgumentException("Not a comparison: " + op);
        }
    }

    /** Python's int() as applied to a loop count. */
    public static long toCount(Object o) {
        if (o instanceof String) {
            try {
                return Long.parseLong(((String) o).trim());
            } catch (NumberFormatException e) {
                throw new VyprRuntimeException("invalid literal for int() with base 10: '" + o + "'", e);
            }
        }
        if (o instanceof Double) {
            return (long) (double) (Double) o;
        }
        if (o instanceof BigInteger) {
            return ((BigInteger) o).signum() < 0 ? 0L : Long.MAX_VALUE;
        }
        if (isNumber(o)) {
            return toLong(o);
        }
        throw new VyprRuntimeException("int() argument must be a string or a number, not '" + typeName(o) + "'");
    }

    public static Iterable<?> toIterable(Object o) {
        if (o instanceof List) {
            return new ArrayList<>((List<?>) o);
        }
        if (o instanceof String) {
            List<String> chars = new ArrayList<>();
            ((String) o).codePoints().forEach(cp -> chars.add(new String(Character.toChars(cp))));
            return chars;
        }
        throw new VyprRuntimeException("'" + typeName(o) + "' object is not iterable");
    }

    public static String typeName(Object o) {
        if (o == null) return "NoneType";
        if (o instanceof Boolean) return "bool";
        if (o instanceof Long || o instanceof BigInteger) return "int";
        if (o instanceof Double) return "float";
        if (o instanceof String) return "str";
        if (o instanceof List) return "list";
        return o.getClass().getSimpleName();
    }

    private static boolean isNumber(Object o) {
        return isInteger(o) || o instanceof Double;
    }

    private static boolean isInteger(Object o) {
        return o instanceof Long || o instanceof BigInteger || o instanceof Boolean;
    }

    private static long toLong(Object o) {
        if (o instanceof Boolean) return (Boolean) o ? 1L : 0L;
        return (Long) o;
    }

    private static BigInteger toBig(Object o) {
        if (o instanceof BigInteger) return (BigInteger) o;
        return BigInteger.valueOf(toLong(o));
    }

    private static Object narrow(BigInteger value) {
        return value.bitLength() < Long.SIZE ? (Object) value.longValue() : value;
    }

    private static double toDouble(Object o) {
        if (o instanceof Double) return (Double) o;
        if (o instanceof BigInteger) {
            double d = ((BigInteger) o).doubleValue();
            if (Double.isInfinite(d)) {
                throw new VyprRuntimeException("int too large to convert to float");
            }
            return d;
        }
        return (double) toLong(o);
    }
}
