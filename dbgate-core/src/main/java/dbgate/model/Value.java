package dbgate.model;

import dbgate.error.DatabaseException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.Arrays;
import java.util.Base64;
import java.util.Objects;

/**
 * Backend-neutral cell and parameter value.
 *
 * <p>Adapters translate native wire types to and from this closed set. Conversions are either
 * lossless or fail with {@link dbgate.error.ErrorKind#CONVERSION_ERROR}; nothing is silently
 * truncated or rounded.
 */
public sealed interface Value {

  Value NULL = new Null();

  static Value of(boolean value) {
    return new Bool(value);
  }

  static Value of(long value) {
    return new Int64(value);
  }

  static Value of(double value) {
    return new Float64(value);
  }

  static Value of(String value) {
    return value == null ? NULL : new Text(value);
  }

  static Value of(byte[] value) {
    return value == null ? NULL : new Binary(value);
  }

  static Value of(Instant value) {
    return value == null ? NULL : new DateTime(value);
  }

  static Value json(String text) {
    return text == null ? NULL : new Json(text);
  }

  /**
   * Converts a plain Java object into a value.
   *
   * @throws DatabaseException with {@code CONVERSION_ERROR} if the object has no lossless mapping
   */
  static Value from(Object object) {
    if (object == null) {
      return NULL;
    }
    if (object instanceof Value v) {
      return v;
    }
    if (object instanceof Boolean b) {
      return new Bool(b);
    }
    if (object instanceof Long || object instanceof Integer
        || object instanceof Short || object instanceof Byte) {
      return new Int64(((Number) object).longValue());
    }
    if (object instanceof Double || object instanceof Float) {
      return new Float64(((Number) object).doubleValue());
    }
    if (object instanceof BigInteger bi) {
      if (bi.bitLength() > 63) {
        throw DatabaseException.conversion("integer out of 64-bit range: " + bi);
      }
      return new Int64(bi.longValue());
    }
    if (object instanceof BigDecimal bd) {
      return fromDecimal(bd);
    }
    if (object instanceof CharSequence s) {
      return new Text(s.toString());
    }
    if (object instanceof byte[] bytes) {
      return new Binary(bytes);
    }
    if (object instanceof Instant instant) {
      return new DateTime(instant);
    }
    if (object instanceof java.util.Date date) {
      return new DateTime(date.toInstant());
    }
    throw DatabaseException.conversion("no value mapping for " + object.getClass().getName());
  }

  /**
   * Maps a decimal to {@link Int64} when it is integral and in range, otherwise to
   * {@link Float64} when the double represents it exactly.
   */
  static Value fromDecimal(BigDecimal decimal) {
    if (decimal == null) {
      return NULL;
    }
    BigDecimal stripped = decimal.stripTrailingZeros();
    if (stripped.scale() <= 0) {
      try {
        return new Int64(stripped.longValueExact());
      } catch (ArithmeticException e) {
        throw DatabaseException.conversion("decimal out of 64-bit range: " + decimal);
      }
    }
    double d = decimal.doubleValue();
    if (Double.isFinite(d) && new BigDecimal(Double.toString(d)).compareTo(decimal) == 0) {
      return new Float64(d);
    }
    throw DatabaseException.conversion("decimal cannot be represented exactly: " + decimal);
  }

  default boolean isNull() {
    return this instanceof Null;
  }

  /** The value as a plain Java object, {@code null} for {@link Null}. */
  Object toJava();

  record Null() implements Value {
    @Override
    public Object toJava() {
      return null;
    }

    @Override
    public String toString() {
      return "NULL";
    }
  }

  record Bool(boolean value) implements Value {
    @Override
    public Object toJava() {
      return value;
    }
  }

  record Int64(long value) implements Value {
    @Override
    public Object toJava() {
      return value;
    }
  }

  record Float64(double value) implements Value {
    @Override
    public Object toJava() {
      return value;
    }
  }

  record Text(String value) implements Value {
    public Text {
      Objects.requireNonNull(value, "value");
    }

    @Override
    public Object toJava() {
      return value;
    }
  }

  record Binary(byte[] value) implements Value {
    public Binary {
      Objects.requireNonNull(value, "value");
      value = value.clone();
    }

    @Override
    public byte[] value() {
      return value.clone();
    }

    @Override
    public Object toJava() {
      return value.clone();
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof Binary other && Arrays.equals(value, other.value);
    }

    @Override
    public int hashCode() {
      return Arrays.hashCode(value);
    }

    @Override
    public String toString() {
      return "Binary[" + Base64.getEncoder().encodeToString(value) + "]";
    }
  }

  /** JSON document kept in its textual form; adapters decide how to bind it. */
  record Json(String text) implements Value {
    public Json {
      Objects.requireNonNull(text, "text");
    }

    @Override
    public Object toJava() {
      return text;
    }
  }

  record DateTime(Instant value) implements Value {
    public DateTime {
      Objects.requireNonNull(value, "value");
    }

    @Override
    public Object toJava() {
      return value;
    }
  }
}
