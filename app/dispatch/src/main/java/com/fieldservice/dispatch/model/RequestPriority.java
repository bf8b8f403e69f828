package com.fieldservice.dispatch.model;

/** 宣言順が低い方から高い方。マッチングでは rank の降順で並べる。 */
public enum RequestPriority {
  STANDARD(0),
  EMERGENCY(1);

  private final int rank;

  RequestPriority(int rank) {
    this.rank = rank;
  }

  public int rank() {
    return rank;
  }
}
