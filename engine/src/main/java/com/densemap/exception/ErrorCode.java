/*
 * Copyright © 2021-present Arcade Data Ltd (info@arcadedata.com)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * SPDX-FileCopyrightText: 2021-present Arcade Data Ltd (info@arcadedata.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.densemap.exception;

import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Standardized error codes for DenseMap exceptions.
 * Error codes are organized in categories based on the first digit(s):
 * <ul>
 *   <li>1xxx - Configuration errors</li>
 *   <li>5xxx - Storage errors (I/O, index file format and consistency)</li>
 *   <li>8xxx - Index errors (state machine preconditions, key range)</li>
 *   <li>99xxx - Internal errors</li>
 * </ul>
 *
 * @see DenseMapException
 */
public enum ErrorCode {

  // ========== Configuration Errors (1xxx) ==========
  /** Invalid configuration value or unsupported collaborator */
  CONFIGURATION_ERROR(1001, "Configuration error"),

  // ========== Storage Errors (5xxx) ==========
  /** File system I/O operation failed */
  IO_ERROR(5001, "I/O error"),

  /** Index file magic marker or format version is not the expected one */
  FORMAT_MISMATCH(5101, "Index file format mismatch"),

  /** Index file was written for a different record layout */
  SCHEMA_MISMATCH(5102, "Record schema mismatch"),

  /** Backing store was modified after the index file was written */
  STALE_INDEX(5103, "Stale index"),

  // ========== Index Errors (8xxx) ==========
  /** Operation called in a state that does not satisfy its preconditions */
  INVARIANT_VIOLATION(8001, "Invariant violation"),

  /** Key or record position outside the indexed domain */
  KEY_OUT_OF_RANGE(8002, "Key out of range"),

  // ========== General Errors (99xxx) ==========
  /** Unexpected internal error (should not normally occur) */
  INTERNAL_ERROR(99999, "Internal error");

  private static final Map<Integer, ErrorCode> CODE_MAP = Stream.of(values())
      .collect(Collectors.toUnmodifiableMap(ErrorCode::getCode, e -> e));

  private final int    code;
  private final String defaultMessage;

  ErrorCode(final int code, final String defaultMessage) {
    this.code = code;
    this.defaultMessage = defaultMessage;
  }

  public int getCode() {
    return code;
  }

  public String getDefaultMessage() {
    return defaultMessage;
  }

  /**
   * Returns the error category based on the error code range.
   */
  public ErrorCategory getCategory() {
    final int category = code / 1000;
    return switch (category) {
      case 1 -> ErrorCategory.CONFIGURATION;
      case 5 -> ErrorCategory.STORAGE;
      case 8 -> ErrorCategory.INDEX;
      default -> ErrorCategory.INTERNAL;
    };
  }

  /**
   * Finds an ErrorCode by its numeric code.
   *
   * @return the matching ErrorCode, or INTERNAL_ERROR if not found
   */
  public static ErrorCode fromCode(final int code) {
    return CODE_MAP.getOrDefault(code, INTERNAL_ERROR);
  }

  @Override
  public String toString() {
    return String.format("%s(%d): %s", name(), code, defaultMessage);
  }
}
