/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.tessera.common.types;

import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * A column type: the {@link MinorType} plus the parameters some types carry. Instances are immutable values.
 */
@JsonInclude(Include.NON_NULL)
@JsonPropertyOrder({"minorType", "precision", "scale", "timeUnit", "timezone", "elementType", "children"})
public final class DataType {

  public enum TimeUnit {
    SECONDS, MILLISECONDS, MICROSECONDS, NANOSECONDS
  }

  private final MinorType minorType;
  private final Integer precision;
  private final Integer scale;
  private final TimeUnit timeUnit;
  private final String timezone;
  private final DataType elementType;
  private final List<Field> children;

  @JsonCreator
  public DataType(@JsonProperty("minorType") MinorType minorType,
                  @JsonProperty("precision") Integer precision,
                  @JsonProperty("scale") Integer scale,
                  @JsonProperty("timeUnit") TimeUnit timeUnit,
                  @JsonProperty("timezone") String timezone,
                  @JsonProperty("elementType") DataType elementType,
                  @JsonProperty("children") List<Field> children) {
    this.minorType = Preconditions.checkNotNull(minorType, "minorType");
    this.precision = precision;
    this.scale = scale;
    this.timeUnit = timeUnit;
    this.timezone = timezone;
    this.elementType = elementType;
    this.children = children == null ? null : ImmutableList.copyOf(children);
  }

  public static DataType of(MinorType minorType) {
    Preconditions.checkArgument(minorType != MinorType.DECIMAL128 && !minorType.isNested()
        && minorType != MinorType.TIMESTAMP && minorType != MinorType.DURATION,
        "Type %s needs parameters, use its dedicated factory method", minorType);
    return new DataType(minorType, null, null, null, null, null, null);
  }

  public static DataType decimal(int precision, int scale) {
    Preconditions.checkArgument(precision > 0 && precision <= 38, "Decimal precision out of range: %s", precision);
    Preconditions.checkArgument(scale >= 0 && scale <= precision, "Decimal scale out of range: %s", scale);
    return new DataType(MinorType.DECIMAL128, precision, scale, null, null, null, null);
  }

  public static DataType timestamp(TimeUnit timeUnit, String timezone) {
    return new DataType(MinorType.TIMESTAMP, null, null, Preconditions.checkNotNull(timeUnit), timezone, null, null);
  }

  public static DataType duration(TimeUnit timeUnit) {
    return new DataType(MinorType.DURATION, null, null, Preconditions.checkNotNull(timeUnit), null, null, null);
  }

  public static DataType list(DataType elementType) {
    return new DataType(MinorType.LIST, null, null, null, null, Preconditions.checkNotNull(elementType), null);
  }

  public static DataType struct(List<Field> children) {
    return new DataType(MinorType.STRUCT, null, null, null, null, null, Preconditions.checkNotNull(children));
  }

  @JsonProperty
  public MinorType getMinorType() {
    return minorType;
  }

  @JsonProperty
  public Integer getPrecision() {
    return precision;
  }

  @JsonProperty
  public Integer getScale() {
    return scale;
  }

  @JsonProperty
  public TimeUnit getTimeUnit() {
    return timeUnit;
  }

  @JsonProperty
  public String getTimezone() {
    return timezone;
  }

  @JsonProperty
  public DataType getElementType() {
    return elementType;
  }

  @JsonProperty
  public List<Field> getChildren() {
    return children;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    DataType that = (DataType) o;
    return minorType == that.minorType
        && Objects.equals(precision, that.precision)
        && Objects.equals(scale, that.scale)
        && timeUnit == that.timeUnit
        && Objects.equals(timezone, that.timezone)
        && Objects.equals(elementType, that.elementType)
        && Objects.equals(children, that.children);
  }

  @Override
  public int hashCode() {
    return Objects.hash(minorType, precision, scale, timeUnit, timezone, elementType, children);
  }

  @Override
  public String toString() {
    switch (minorType) {
      case DECIMAL128:
        return "Decimal128(" + precision + ", " + scale + ")";
      case TIMESTAMP:
        return "Timestamp(" + timeUnit + (timezone == null ? "" : ", " + timezone) + ")";
      case DURATION:
        return "Duration(" + timeUnit + ")";
      case LIST:
        return "List[" + elementType + "]";
      case STRUCT:
        return "Struct" + children;
      default:
        return minorType.name();
    }
  }
}
