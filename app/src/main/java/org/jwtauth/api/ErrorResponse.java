package org.jwtauth.api;

import lombok.Value;

@Value
public class ErrorResponse {
  String errorCode;
  String message;
}
