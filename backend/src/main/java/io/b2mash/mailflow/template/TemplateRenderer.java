package io.b2mash.mailflow.template;

import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.thymeleaf.TemplateEngine;
import org.thymeleaf.TemplateSpec;
import org.thymeleaf.context.Context;
import org.thymeleaf.exceptions.TemplateEngineException;
import org.thymeleaf.templatemode.TemplateMode;
import org.thymeleaf.templateresolver.StringTemplateResolver;

/**
 * Renders the subject, HTML and plain-text sources of an {@link EmailTemplate} with Thymeleaf. The
 * template sources are stored in the database, so a {@link StringTemplateResolver} treats each
 * source string as the template itself.
 *
 * <p>Subject and text are processed in TEXT mode ({@code Hi [(${name})]}); the HTML body in HTML
 * mode, where {@code [[${name}]]} and {@code th:text} escape the value. Missing context values
 * render as empty via {@link LenientStandardDialect}. Malformed syntax fails with {@link
 * TemplateRenderException}. Rendering performs no I/O.
 */
@Component
public class TemplateRenderer {

  private static final Logger log = LoggerFactory.getLogger(TemplateRenderer.class);

  private final TemplateEngine templateEngine;

  public TemplateRenderer() {
    this.templateEngine = createTemplateEngine();
  }

  public RenderedEmail render(EmailTemplate template, Map<String, Object> context) {
    String key = template.getTemplateKey();
    var rendered =
        new RenderedEmail(
            renderSource(key, template.getSubjectTemplate(), context, TemplateMode.TEXT).strip(),
            renderSource(key, template.getHtmlTemplate(), context, TemplateMode.HTML),
            renderSource(key, template.getTextTemplate(), context, TemplateMode.TEXT));
    log.debug("Rendered email template '{}', HTML size={}", key, rendered.htmlBody().length());
    return rendered;
  }

  /**
   * Renders a single template source.
   *
   * @param templateKey key reported in errors
   * @param source raw template text; null renders as empty
   * @param context variable context; null is treated as empty
   * @param mode {@link TemplateMode#HTML} for the HTML body, {@link TemplateMode#TEXT} otherwise
   */
  public String renderSource(
      String templateKey, String source, Map<String, Object> context, TemplateMode mode) {
    if (source == null || source.isEmpty()) {
      return "";
    }
    var ctx = new Context(Locale.ROOT);
    if (context != null) {
      ctx.setVariables(context);
    }
    try {
      return templateEngine.process(new TemplateSpec(source, mode), ctx);
    } catch (TemplateEngineException e) {
      throw new TemplateRenderException(templateKey, rootMessage(e), e);
    }
  }

  private static String rootMessage(Throwable error) {
    Throwable root = error;
    while (root.getCause() != null && root.getCause() != root) {
      root = root.getCause();
    }
    return root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
  }

  private static TemplateEngine createTemplateEngine() {
    var engine = new TemplateEngine();
    engine.setDialect(new LenientStandardDialect());

    var resolver = new StringTemplateResolver();
    resolver.setTemplateMode(TemplateMode.TEXT);
    // The source text is the cache key, so an edited template never hits a stale entry
    resolver.setCacheable(true);

    engine.setTemplateResolver(resolver);
    return engine;
  }
}
