package com.datalens.analytics.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.ViewControllerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

  @Value("${cors.allowed-origins:}")
  private String[] allowedOrigins;

  private static final String[] DEFAULT_METHODS = new String[] {"GET", "POST", "DELETE", "OPTIONS"};
  private static final String[] DEFAULT_HEADERS = new String[] {"*"};
  private static final String[] EXPOSED_HEADERS =
      new String[] {"Content-Disposition", RequestMdcFilter.CORRELATION_ID_HEADER};

  @Override
  public void addViewControllers(ViewControllerRegistry registry) {
    registry.addRedirectViewController("/", "/swagger-ui/index.html");
    registry.setOrder(1);
  }

  @Override
  public void addCorsMappings(CorsRegistry registry) {
    var mapping = registry.addMapping("/**");

    // No configured origins means any origin, matched by pattern so credentials still work
    if (allowedOrigins == null || allowedOrigins.length == 0) {
      mapping.allowedOriginPatterns("*");
    } else {
      mapping.allowedOriginPatterns(allowedOrigins);
    }

    mapping
        .allowedMethods(DEFAULT_METHODS)
        .allowedHeaders(DEFAULT_HEADERS)
        .exposedHeaders(EXPOSED_HEADERS)
        .allowCredentials(true);
  }
}
