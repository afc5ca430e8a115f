package com.mk.fx.qa.perf.rest;

import java.time.Duration;
import java.util.Map;
import lombok.Data;

@Data
public class Request {
  private HttpMethod method;
  private String url;
  private Map<String, String> headers;
  private Map<String, String> query;
  private Object body;
  private BodyEncoding encoding = BodyEncoding.JSON;
  private Duration timeout;
}
