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
package org.apache.tessera.exec.store;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Files making up a dataset. Sizes and row counts are parallel to the paths; either list may be absent and any
 * entry may be {@code null} when unknown.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class InputFileInfos {

  private final List<String> filePaths;
  private final List<Long> fileSizes;
  private final List<Long> numRows;

  @JsonCreator
  public InputFileInfos(@JsonProperty("filePaths") List<String> filePaths,
                        @JsonProperty("fileSizes") List<Long> fileSizes,
                        @JsonProperty("numRows") List<Long> numRows) {
    this.filePaths = ImmutableList.copyOf(Preconditions.checkNotNull(filePaths, "filePaths"));
    checkParallel("fileSizes", fileSizes);
    checkParallel("numRows", numRows);
    this.fileSizes = fileSizes == null ? null : unmodifiableWithNulls(fileSizes);
    this.numRows = numRows == null ? null : unmodifiableWithNulls(numRows);
  }

  public static InputFileInfos ofPaths(List<String> filePaths) {
    return new InputFileInfos(filePaths, null, null);
  }

  private void checkParallel(String name, List<Long> values) {
    Preconditions.checkArgument(values == null || values.size() == filePaths.size(),
        "%s has %s entries for %s files", name, values == null ? 0 : values.size(), filePaths.size());
  }

  private static List<Long> unmodifiableWithNulls(List<Long> values) {
    // ImmutableList rejects null entries, unknown values are kept as nulls
    return Collections.unmodifiableList(new ArrayList<>(values));
  }

  @JsonProperty
  public List<String> getFilePaths() {
    return filePaths;
  }

  @JsonProperty
  public List<Long> getFileSizes() {
    return fileSizes;
  }

  @JsonProperty
  public List<Long> getNumRows() {
    return numRows;
  }

  @JsonIgnore
  public int size() {
    return filePaths.size();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    InputFileInfos that = (InputFileInfos) o;
    return filePaths.equals(that.filePaths)
        && Objects.equals(fileSizes, that.fileSizes)
        && Objects.equals(numRows, that.numRows);
  }

  @Override
  public int hashCode() {
    return Objects.hash(filePaths, fileSizes, numRows);
  }

  @Override
  public String toString() {
    return "InputFileInfos [files=" + filePaths.size() + "]";
  }
}
