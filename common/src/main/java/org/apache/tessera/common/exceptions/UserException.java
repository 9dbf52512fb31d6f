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
package org.apache.tessera.common.exceptions;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import org.slf4j.Logger;

import com.google.common.base.Throwables;

/**
 * Base class for errors reported back to whoever submitted or shipped a plan. The goal is to separate out
 * common error conditions where we can give useful feedback.
 * <p>Instances are created through a {@link Builder} obtained from one of the static factory methods
 * ({@link #planError(Throwable)}, {@link #systemError(Throwable)}, ...). If the wrapped cause already is, or
 * wraps, a user exception the builder returns that one instead of creating a new exception, so context added
 * at several levels ends up on the same object.
 */
public class UserException extends TesseraRuntimeException {
  private static final long serialVersionUID = -6720929331624621840L;

  public enum ErrorType {
    /** Malformed or unreadable plan. */
    PLAN,
    /** A plan that parsed but breaks an invariant the planner must uphold. */
    VALIDATION,
    /** Internal failure; the message of the root cause is reported. */
    SYSTEM
  }

  public static Builder planError() {
    return planError(null);
  }

  public static Builder planError(final Throwable cause) {
    return new Builder(ErrorType.PLAN, cause);
  }

  public static Builder validationError() {
    return validationError(null);
  }

  public static Builder validationError(final Throwable cause) {
    return new Builder(ErrorType.VALIDATION, cause);
  }

  public static Builder systemError(final Throwable cause) {
    return new Builder(ErrorType.SYSTEM, cause);
  }

  public static class Builder {

    private final Throwable cause;
    private final ErrorType errorType;
    private final UserException uex;
    private final List<String> context;

    private String message;

    private Builder(final ErrorType errorType, final Throwable cause) {
      this.cause = cause;
      this.uex = findWrappedUserException(cause);
      if (uex != null) {
        this.errorType = uex.errorType;
        this.context = uex.context;
      } else {
        this.errorType = errorType;
        this.context = new ArrayList<>();
        this.message = cause != null ? cause.getMessage() : null;
      }
    }

    /**
     * Sets or replaces the error message. Ignored when this builder wraps an existing user exception.
     */
    public Builder message(final String format, final Object... args) {
      if (uex == null && format != null) {
        this.message = String.format(format, args);
      }
      return this;
    }

    public Builder addContext(final String value) {
      context.add(value);
      return this;
    }

    public Builder addContext(final String name, final String value) {
      return addContext(name + " " + value);
    }

    public Builder addContext(final String name, final long value) {
      return addContext(name + " " + value);
    }

    public UserException build() {
      if (uex != null) {
        return uex;
      }
      if (errorType == ErrorType.SYSTEM && cause != null) {
        message = Throwables.getRootCause(cause).getMessage();
      }
      return new UserException(this);
    }

    /**
     * Builds the exception and logs it. System errors are logged as errors, everything else is a caller mistake
     * and logged at info level.
     */
    public UserException build(final Logger logger) {
      final UserException newException = build();
      if (newException == uex) {
        return newException;
      }
      if (errorType == ErrorType.SYSTEM) {
        logger.error(newException.getMessage(), newException);
      } else {
        logger.info("User Error Occurred: {}", newException.getMessage(), newException);
      }
      return newException;
    }
  }

  private final ErrorType errorType;
  private final String errorId;
  private final List<String> context;

  private UserException(final Builder builder) {
    super(builder.message, builder.cause);
    this.errorType = builder.errorType;
    this.errorId = UUID.randomUUID().toString();
    this.context = builder.context;
  }

  private static UserException findWrappedUserException(Throwable ex) {
    Throwable cause = ex;
    while (cause != null) {
      if (cause instanceof UserException) {
        return (UserException) cause;
      }
      if (cause.getCause() == cause) {
        break;
      }
      cause = cause.getCause();
    }
    return null;
  }

  public ErrorType getErrorType() {
    return errorType;
  }

  public String getErrorId() {
    return errorId;
  }

  /**
   * @return the error message that was passed to the builder
   */
  public String getOriginalMessage() {
    return super.getMessage();
  }

  public List<String> getContext() {
    return context;
  }

  @Override
  public String getMessage() {
    StringBuilder sb = new StringBuilder();
    sb.append(errorType).append(" ERROR: ").append(getOriginalMessage()).append("\n");
    for (String line : context) {
      sb.append("\n").append(line);
    }
    sb.append("\n\n[Error Id: ").append(errorId).append("]");
    return sb.toString();
  }
}
