package com.listingcheck.validator.service.rules;

import java.math.BigDecimal;
import java.math.RoundingMode;

final class Percentages {

  private Percentages() {}

  /** Whole-number percentage, e.g. 0.734 becomes "73%" and -0.3 becomes "-30%". */
  static String format(double fraction) {
    return format(BigDecimal.valueOf(fraction));
  }

  static String format(BigDecimal fraction) {
    return fraction.movePointRight(2).setScale(0, RoundingMode.HALF_EVEN).toPlainString() + "%";
  }

  static String pounds(BigDecimal amount) {
    return "£" + amount.setScale(2, RoundingMode.HALF_UP).toPlainString();
  }
}
