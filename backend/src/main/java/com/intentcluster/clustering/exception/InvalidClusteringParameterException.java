package com.intentcluster.clustering.exception;

/** Rejected {@code eps} or {@code minPts}. Raised before any clustering work starts. */
public class InvalidClusteringParameterException extends IllegalArgumentException {

  private final String parameter;

  public InvalidClusteringParameterException(String parameter, String message) {
    super(message);
    this.parameter = parameter;
  }

  public String getParameter() {
    return parameter;
  }
}
