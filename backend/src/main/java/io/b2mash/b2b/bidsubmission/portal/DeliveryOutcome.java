package io.b2mash.b2b.bidsubmission.portal;

public record DeliveryOutcome(
    boolean success,
    String confirmationNumber,
    DeliveryErrorClass errorClass,
    String errorMessage) {

  public DeliveryOutcome {
    if (errorClass == null) {
      throw new IllegalArgumentException("errorClass must not be null");
    }
    if (success != (errorClass == DeliveryErrorClass.NONE)) {
      throw new IllegalArgumentException(
          "errorClass must be NONE exactly when the delivery succeeded, got " + errorClass);
    }
  }

  public static DeliveryOutcome confirmed(String confirmationNumber) {
    return new DeliveryOutcome(true, confirmationNumber, DeliveryErrorClass.NONE, null);
  }

  public static DeliveryOutcome retryable(String errorMessage) {
    return new DeliveryOutcome(false, null, DeliveryErrorClass.RETRYABLE, errorMessage);
  }

  public static DeliveryOutcome nonRetryable(String errorMessage) {
    return new DeliveryOutcome(false, null, DeliveryErrorClass.NON_RETRYABLE, errorMessage);
  }

  public boolean isRetryable() {
    return errorClass == DeliveryErrorClass.RETRYABLE;
  }
}
