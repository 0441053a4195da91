package com.acme.shove.core;

/** The broker refused or failed a result queue declaration or publish. */
public class ResultPublishException extends RuntimeException {
  public ResultPublishException(String message) {
    super(message);
  }

  public ResultPublishException(String message, Throwable e) {
    super(message, e);
  }
}
