/*
 * どこで: Common 共通設定
 * 何を: Clock と RequestMdcInterceptor を各関数アプリへ提供する
 * なぜ: 単独デプロイでもモノリスでも同一の時刻注入とログキーを使うため
 */
package com.ontologymarket.common.config;

import com.ontologymarket.common.web.RequestMdcInterceptor;
import java.time.Clock;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class MarketplaceCommonConfig implements WebMvcConfigurer {

  private final String functionName;

  public MarketplaceCommonConfig(
      @Value("${spring.application.name:marketplace}") String functionName) {
    this.functionName = functionName;
  }

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public RequestMdcInterceptor requestMdcInterceptor() {
    return new RequestMdcInterceptor(functionName);
  }

  @Override
  public void addInterceptors(InterceptorRegistry registry) {
    registry.addInterceptor(requestMdcInterceptor());
  }
}
