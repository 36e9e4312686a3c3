/*
 * どこで: Hunt Web 設定
 * 何を: RequestMdcInterceptor を API リクエストへ適用する
 * なぜ: claim などの外部コマンドのログへ要求元を安定して埋め込むため
 */
package com.atlassupport.hunt.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@RequiredArgsConstructor
public class WebMvcConfig implements WebMvcConfigurer {

  private static final String API_PATTERN = "/v1/**";

  private final RequestMdcInterceptor requestMdcInterceptor;

  @Override
  public void addInterceptors(InterceptorRegistry registry) {
    // actuator はログ量が多いため対象外
    registry.addInterceptor(requestMdcInterceptor).addPathPatterns(API_PATTERN);
  }
}
