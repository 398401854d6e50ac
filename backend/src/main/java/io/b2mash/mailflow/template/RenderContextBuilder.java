package io.b2mash.mailflow.template;

import io.b2mash.mailflow.config.EmailDispatchProperties;
import java.util.HashMap;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Builds the render context shared by dispatch and preview: site branding from configuration,
 * overlaid with the caller's variables (caller keys win).
 */
@Component
public class RenderContextBuilder {

  private final EmailDispatchProperties properties;

  public RenderContextBuilder(EmailDispatchProperties properties) {
    this.properties = properties;
  }

  public Map<String, Object> build(Map<String, Object> callerContext) {
    var context = new HashMap<String, Object>();
    context.put("site_name", properties.siteName());
    context.put("site_url", properties.siteUrl());
    if (callerContext != null) {
      context.putAll(callerContext);
    }
    return context;
  }
}
