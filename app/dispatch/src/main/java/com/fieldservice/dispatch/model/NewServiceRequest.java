package com.fieldservice.dispatch.model;

/** 顧客が作成する依頼の入力。customerId は操作者から決まるため含めない。 */
public record NewServiceRequest(
    String title,
    String description,
    String category,
    RequestPriority priority,
    Coordinate location,
    String address,
    int estimatedDurationMinutes) {

  public static final int DEFAULT_ESTIMATED_DURATION_MINUTES = 60;

  public static NewServiceRequest of(
      String title, RequestPriority priority, Coordinate location, String address) {
    return new NewServiceRequest(
        title, "", null, priority, location, address, DEFAULT_ESTIMATED_DURATION_MINUTES);
  }
}
