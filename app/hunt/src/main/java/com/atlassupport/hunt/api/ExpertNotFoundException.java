package com.atlassupport.hunt.api;

public class ExpertNotFoundException extends RuntimeException {
  public ExpertNotFoundException(String expertId) {
    super("expert not found: " + expertId);
  }
}
