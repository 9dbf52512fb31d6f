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
package org.apache.tessera.common.logical;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Plan meta properties.
 */
public class PlanProperties {
  public enum PlanType {TESSERA_PHYSICAL}

  public final PlanType type;
  public final int version;
  public final Generator generator;

  @JsonInclude(Include.NON_NULL)
  public static class Generator {
    public final String type;
    public final String info;

    @JsonCreator
    private Generator(@JsonProperty("type") String type, @JsonProperty("info") String info) {
      this.type = type;
      this.info = info;
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (!(o instanceof Generator)) {
        return false;
      }
      Generator that = (Generator) o;
      return Objects.equals(type, that.type) && Objects.equals(info, that.info);
    }

    @Override
    public int hashCode() {
      return Objects.hash(type, info);
    }
  }

  @JsonCreator
  private PlanProperties(@JsonProperty("version") int version,
                         @JsonProperty("generator") Generator generator,
                         @JsonProperty("type") PlanType type) {
    this.version = version;
    this.generator = generator;
    this.type = type;
  }

  public static PlanPropertiesBuilder builder() {
    return new PlanPropertiesBuilder();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof PlanProperties)) {
      return false;
    }
    PlanProperties that = (PlanProperties) o;
    return version == that.version && type == that.type && Objects.equals(generator, that.generator);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, version, generator);
  }

  public static class PlanPropertiesBuilder {
    private int version;
    private Generator generator;
    private PlanType type = PlanType.TESSERA_PHYSICAL;

    public PlanPropertiesBuilder type(PlanType type) {
      this.type = type;
      return this;
    }

    public PlanPropertiesBuilder version(int version) {
      this.version = version;
      return this;
    }

    public PlanPropertiesBuilder generator(String type, String info) {
      this.generator = new Generator(type, info);
      return this;
    }

    public PlanPropertiesBuilder generator(Generator generator) {
      this.generator = generator;
      return this;
    }

    public PlanProperties build() {
      return new PlanProperties(version, generator, type);
    }
  }
}
