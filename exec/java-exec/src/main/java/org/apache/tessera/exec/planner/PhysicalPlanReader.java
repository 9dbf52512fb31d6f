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
package org.apache.tessera.exec.planner;

import java.io.IOException;
import java.util.List;

import org.apache.tessera.common.config.CommonConstants;
import org.apache.tessera.common.config.TesseraConfig;
import org.apache.tessera.common.exceptions.TesseraConfigurationException;
import org.apache.tessera.common.exceptions.TesseraRuntimeException;
import org.apache.tessera.common.exceptions.UserException;
import org.apache.tessera.common.logical.FormatPluginConfig;
import org.apache.tessera.common.logical.PlanProperties;
import org.apache.tessera.common.logical.StoragePluginConfig;
import org.apache.tessera.common.util.JacksonUtils;
import org.apache.tessera.exec.ExecConstants;
import org.apache.tessera.exec.physical.PhysicalPlan;
import org.apache.tessera.exec.physical.base.PhysicalOperator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Reads and writes physical plans as JSON. Operator, storage and format classes are registered with the mapper
 * from the lists under {@value CommonConstants#PHYSICAL_OPERATORS}, {@value CommonConstants#STORAGE_PLUGINS}
 * and {@value CommonConstants#STORAGE_FORMATS}; a type name that is not registered cannot be read.
 */
public class PhysicalPlanReader {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(PhysicalPlanReader.class);

  private final ObjectMapper mapper;
  private final ObjectReader physicalPlanReader;
  private final ObjectReader operatorReader;
  private final ObjectWriter writer;
  private final ObjectWriter operatorWriter;
  private final int planVersion;

  public PhysicalPlanReader(TesseraConfig config) {
    JsonMapper.Builder builder = JacksonUtils.createJsonMapperBuilder();
    if (config.getBoolean(ExecConstants.PLAN_PRETTY_PRINT)) {
      builder.enable(SerializationFeature.INDENT_OUTPUT);
    }
    this.mapper = builder.build();
    try {
      registerSubtypes(config.getClassesAt(CommonConstants.PHYSICAL_OPERATORS, PhysicalOperator.class));
      registerSubtypes(config.getClassesAt(CommonConstants.STORAGE_PLUGINS, StoragePluginConfig.class));
      registerSubtypes(config.getClassesAt(CommonConstants.STORAGE_FORMATS, FormatPluginConfig.class));
    } catch (TesseraConfigurationException e) {
      throw TesseraRuntimeException.create(e, "Unable to register plan types: %s", e.getMessage());
    }
    this.planVersion = config.getInt(ExecConstants.PLAN_VERSION);
    this.physicalPlanReader = mapper.readerFor(PhysicalPlan.class);
    this.operatorReader = mapper.readerFor(PhysicalOperator.class);
    this.writer = mapper.writer();
    this.operatorWriter = mapper.writerFor(PhysicalOperator.class);
  }

  private <T> void registerSubtypes(List<Class<? extends T>> types) {
    for (Class<? extends T> type : types) {
      mapper.registerSubtypes(type);
    }
    logger.debug("Registered {} plan types: {}", types.size(), types);
  }

  /**
   * Wraps the given root operators into a plan whose head carries the configured plan version.
   */
  public PhysicalPlan createPlan(List<PhysicalOperator> roots) {
    PlanProperties head = PlanProperties.builder()
        .version(planVersion)
        .generator(ExecConstants.PLAN_GENERATOR_TYPE, PhysicalPlanReader.class.getSimpleName())
        .build();
    return new PhysicalPlan(head, roots);
  }

  public PhysicalPlan readPhysicalPlan(String json) {
    try {
      PhysicalPlan plan = PhysicalPlan.parse(physicalPlanReader, json);
      logger.debug("Read plan with {} root operators", plan.getGraph().size());
      return plan;
    } catch (IOException e) {
      throw UserException.planError(e)
          .message("Failure while reading physical plan: %s", e.getMessage())
          .build(logger);
    }
  }

  public PhysicalOperator readOperator(String json) {
    try {
      return operatorReader.readValue(json);
    } catch (IOException e) {
      throw UserException.planError(e)
          .message("Failure while reading physical operator: %s", e.getMessage())
          .build(logger);
    }
  }

  public String writeJson(PhysicalPlan plan) {
    try {
      return plan.unparse(writer);
    } catch (JsonProcessingException e) {
      throw UserException.systemError(e)
          .addContext("Failure while writing physical plan")
          .build(logger);
    }
  }

  public String writeOperator(PhysicalOperator op) {
    try {
      return operatorWriter.writeValueAsString(op);
    } catch (JsonProcessingException e) {
      throw UserException.systemError(e)
          .addContext("Failure while writing physical operator", op.getOperatorType().name())
          .build(logger);
    }
  }
}
