package com.fieldservice.dispatch.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fieldservice.dispatch.exception.DispatchErrorCode;
import com.fieldservice.dispatch.exception.InvalidDispatchRequestException;
import org.junit.jupiter.api.Test;

class CoordinateTest {

  @Test
  void acceptsBoundaryValues() {
    assertThat(new Coordinate(-90.0, -180.0).latitude()).isEqualTo(-90.0);
    assertThat(new Coordinate(90.0, 180.0).longitude()).isEqualTo(180.0);
  }

  @Test
  void rejectsLatitudeOutOfRange() {
    assertThatThrownBy(() -> new Coordinate(90.5, 0.0))
        .isInstanceOf(InvalidDispatchRequestException.class)
        .hasMessageContaining("latitude");
  }

  @Test
  void rejectsLongitudeOutOfRange() {
    assertThatThrownBy(() -> new Coordinate(0.0, -180.1))
        .isInstanceOfSatisfying(
            InvalidDispatchRequestException.class,
            ex -> assertThat(ex.errorCode()).isEqualTo(DispatchErrorCode.BAD_REQUEST));
  }

  @Test
  void rejectsNaN() {
    assertThatThrownBy(() -> new Coordinate(Double.NaN, 0.0))
        .isInstanceOf(InvalidDispatchRequestException.class);
  }
}
