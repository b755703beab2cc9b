package com.datalens.analytics.model;

import java.math.BigDecimal;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * A single cell of a {@link Dataset}. Exactly one of three variants: a number, a piece of text, or
 * a missing value. Raw inputs (JSON nulls, absent keys, empty strings, CSV cells) are converted
 * into this type once at ingestion so that no downstream stage has to guess what a raw object
 * means.
 *
 * <p>Numbers compare by numeric value, so {@code 1} and {@code 1.0} are equal.
 */
public final class FieldValue {

  private static final FieldValue MISSING_VALUE = new FieldValue(ValueType.MISSING, null, null);

  private final ValueType type;
  private final BigDecimal number;
  private final String text;

  private FieldValue(ValueType type, BigDecimal number, String text) {
    this.type = type;
    this.number = number;
    this.text = text;
  }

  public static FieldValue missing() {
    return MISSING_VALUE;
  }

  public static FieldValue number(BigDecimal number) {
    Objects.requireNonNull(number, "number");
    return new FieldValue(ValueType.NUMBER, number, null);
  }

  public static FieldValue number(long number) {
    return number(BigDecimal.valueOf(number));
  }

  /** Wraps a text value. An empty string is the missing value, never empty text. */
  public static FieldValue text(String text) {
    if (text == null || text.isEmpty()) {
      return MISSING_VALUE;
    }
    return new FieldValue(ValueType.TEXT, null, text);
  }

  public ValueType getType() {
    return type;
  }

  public boolean isMissing() {
    return type == ValueType.MISSING;
  }

  public boolean isNumber() {
    return type == ValueType.NUMBER;
  }

  public boolean isText() {
    return type == ValueType.TEXT;
  }

  public BigDecimal asNumber() {
    if (!isNumber()) {
      throw new IllegalStateException("Not a number value: " + type);
    }
    return number;
  }

  public String asText() {
    if (!isText()) {
      throw new IllegalStateException("Not a text value: " + type);
    }
    return text;
  }

  /**
   * Raw JSON form: {@link BigDecimal} for numbers, {@link String} for text, {@code null} for
   * missing.
   */
  @JsonValue
  public Object toRaw() {
    switch (type) {
      case NUMBER:
        return number;
      case TEXT:
        return text;
      default:
        return null;
    }
  }

  /** Plain-text rendering used for delimited export. Missing renders as the empty string. */
  public String render() {
    switch (type) {
      case NUMBER:
        return number.stripTrailingZeros().toPlainString();
      case TEXT:
        return text;
      default:
        return "";
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof FieldValue)) {
      return false;
    }
    FieldValue other = (FieldValue) o;
    if (type != other.type) {
      return false;
    }
    switch (type) {
      case NUMBER:
        return number.compareTo(other.number) == 0;
      case TEXT:
        return text.equals(other.text);
      default:
        return true;
    }
  }

  @Override
  public int hashCode() {
    switch (type) {
      case NUMBER:
        return Objects.hash(type, number.stripTrailingZeros());
      case TEXT:
        return Objects.hash(type, text);
      default:
        return type.hashCode();
    }
  }

  @Override
  public String toString() {
    switch (type) {
      case NUMBER:
        return render();
      case TEXT:
        return '"' + text + '"';
      default:
        return "<missing>";
    }
  }
}
