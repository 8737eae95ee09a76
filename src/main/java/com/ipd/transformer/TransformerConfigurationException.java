package com.ipd.transformer;

public class TransformerConfigurationException extends RuntimeException {
  public TransformerConfigurationException(String message) {
    super(message);
  }

  public TransformerConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
