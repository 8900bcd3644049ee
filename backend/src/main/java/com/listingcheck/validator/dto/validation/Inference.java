package com.listingcheck.validator.dto.validation;

import lombok.Value;

/** A value predicted from the neighbour set with its strength in [0, 1]. */
@Value
public class Inference {

  private static final Inference NONE = new Inference(null, 0.0);

  String predicted;
  double strength;

  public static Inference none() {
    return NONE;
  }

  public static Inference of(String predicted, double strength) {
    return new Inference(predicted, Math.max(0.0, Math.min(1.0, strength)));
  }

  public boolean hasPrediction() {
    return predicted != null;
  }
}
