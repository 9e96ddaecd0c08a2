package io.b2mash.shopdesk.config;

import io.b2mash.shopdesk.session.CurrentSessionArgumentResolver;
import java.util.List;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

  private final CurrentSessionArgumentResolver currentSessionArgumentResolver;

  public WebConfig(CurrentSessionArgumentResolver currentSessionArgumentResolver) {
    this.currentSessionArgumentResolver = currentSessionArgumentResolver;
  }

  @Override
  public void addArgumentResolvers(List<HandlerMethodArgumentResolver> resolvers) {
    resolvers.add(currentSessionArgumentResolver);
  }
}
