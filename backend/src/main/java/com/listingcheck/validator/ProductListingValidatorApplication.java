package com.listingcheck.validator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ProductListingValidatorApplication {

  public static void main(String[] args) {
    SpringApplication.run(ProductListingValidatorApplication.class, args);
  }
}
