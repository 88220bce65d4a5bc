package com.example.bookkeeping.service;

import com.example.bookkeeping.exception.ErrorCode;

/**
 * Uniform result returned to callers: either data, or an error message with its category.
 *
 * @param <T> the type of the data on success
 */
public record OperationResult<T>(boolean success, T data, String error, ErrorCode errorCode) {

  public static <T> OperationResult<T> success(T data) {
    return new OperationResult<>(true, data, null, null);
  }

  public static <T> OperationResult<T> failure(ErrorCode errorCode, String error) {
    return new OperationResult<>(false, null, error, errorCode);
  }
}
