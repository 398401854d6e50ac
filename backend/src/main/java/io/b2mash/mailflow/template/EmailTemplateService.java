package io.b2mash.mailflow.template;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.b2mash.mailflow.config.EmailDispatchProperties;
import io.b2mash.mailflow.exception.InvalidStateException;
import io.b2mash.mailflow.exception.ResourceConflictException;
import io.b2mash.mailflow.exception.ResourceNotFoundException;
import io.b2mash.mailflow.template.EmailTemplateDtos.CreateTemplateRequest;
import io.b2mash.mailflow.template.EmailTemplateDtos.TemplateResponse;
import io.b2mash.mailflow.template.EmailTemplateDtos.UpdateTemplateRequest;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * Template store: resolves keys to active templates and manages the template lifecycle (create,
 * edit, deactivate, reactivate). Resolved templates are cached per node and evicted locally
 * whenever a template changes.
 */
@Service
public class EmailTemplateService {

  private static final Logger log = LoggerFactory.getLogger(EmailTemplateService.class);

  static final String DEFAULT_CATEGORY = "general";
  static final String DEFAULT_LANGUAGE = "en";

  private final EmailTemplateRepository repository;
  private final TemplateRenderer renderer;
  private final RenderContextBuilder contextBuilder;
  private final Cache<String, EmailTemplate> activeTemplates;

  public EmailTemplateService(
      EmailTemplateRepository repository,
      TemplateRenderer renderer,
      RenderContextBuilder contextBuilder,
      EmailDispatchProperties properties) {
    this.repository = repository;
    this.renderer = renderer;
    this.contextBuilder = contextBuilder;
    this.activeTemplates =
        Caffeine.newBuilder()
            .expireAfterWrite(properties.templateCacheTtl())
            .maximumSize(1000)
            .build();
  }

  /**
   * Resolves a key to its active template. Lookup is exact and case-sensitive.
   *
   * @throws TemplateNotFoundException if no active template has this key
   */
  @Transactional(readOnly = true)
  public EmailTemplate resolve(String key) {
    if (key == null || key.isBlank()) {
      throw new TemplateNotFoundException(String.valueOf(key));
    }
    var cached = activeTemplates.getIfPresent(key);
    if (cached != null) {
      return cached;
    }
    var template =
        repository
            .findByTemplateKeyAndActiveTrue(key)
            .orElseThrow(() -> new TemplateNotFoundException(key));
    activeTemplates.put(key, template);
    return template;
  }

  /** Renders an active template against a sample context without dispatching anything. */
  @Transactional(readOnly = true)
  public RenderedEmail preview(String key, Map<String, Object> sampleContext) {
    var template = resolve(key);
    return renderer.render(template, contextBuilder.build(sampleContext));
  }

  @Transactional(readOnly = true)
  public TemplateResponse get(String key) {
    return TemplateResponse.from(findByKey(key));
  }

  @Transactional(readOnly = true)
  public List<TemplateResponse> list(String category, boolean activeOnly) {
    List<EmailTemplate> templates;
    if (category != null && !category.isBlank()) {
      templates =
          activeOnly
              ? repository.findByCategoryAndActiveTrueOrderByNameAsc(category)
              : repository.findByCategoryOrderByNameAsc(category);
    } else {
      templates =
          activeOnly
              ? repository.findByActiveTrueOrderByCategoryAscNameAsc()
              : repository.findAllByOrderByCategoryAscNameAsc();
    }
    return templates.stream().map(TemplateResponse::from).toList();
  }

  @Transactional
  public TemplateResponse create(CreateTemplateRequest request) {
    if (!EmailTemplate.isValidKey(request.key())) {
      throw new InvalidStateException(
          "Invalid template key",
          "Template key must be lowercase letters, digits, '-' or '_': " + request.key());
    }
    if (repository.existsByTemplateKey(request.key())) {
      throw new ResourceConflictException(
          "Template key already exists",
          "An email template with key '" + request.key() + "' already exists");
    }

    var template =
        new EmailTemplate(
            request.key(),
            request.name(),
            request.description(),
            request.subjectTemplate(),
            request.htmlTemplate(),
            request.textTemplate(),
            orDefault(request.category(), DEFAULT_CATEGORY),
            orDefault(request.language(), DEFAULT_LANGUAGE),
            request.declaredVariables());
    checkSyntax(template);

    var saved = repository.save(template);
    evict(saved.getTemplateKey());
    log.info(
        "Created email template key={} category={}", saved.getTemplateKey(), saved.getCategory());
    return TemplateResponse.from(saved);
  }

  @Transactional
  public TemplateResponse update(String key, UpdateTemplateRequest request) {
    var template = findByKey(key);
    template.update(
        request.name(),
        request.description(),
        request.subjectTemplate(),
        request.htmlTemplate(),
        request.textTemplate(),
        orDefault(request.category(), template.getCategory()),
        orDefault(request.language(), template.getLanguage()),
        request.declaredVariables());
    checkSyntax(template);

    var saved = repository.save(template);
    evict(key);
    log.info("Updated email template key={}", key);
    return TemplateResponse.from(saved);
  }

  @Transactional
  public TemplateResponse deactivate(String key) {
    var template = findByKey(key);
    template.deactivate();
    var saved = repository.save(template);
    evict(key);
    log.info("Deactivated email template key={}", key);
    return TemplateResponse.from(saved);
  }

  @Transactional
  public TemplateResponse reactivate(String key) {
    var template = findByKey(key);
    template.reactivate();
    var saved = repository.save(template);
    evict(key);
    log.info("Reactivated email template key={}", key);
    return TemplateResponse.from(saved);
  }

  private EmailTemplate findByKey(String key) {
    return repository
        .findByTemplateKey(key)
        .orElseThrow(() -> new ResourceNotFoundException("EmailTemplate", key));
  }

  /** Rejects templates whose placeholder syntax cannot be parsed, before they are stored. */
  private void checkSyntax(EmailTemplate template) {
    renderer.render(template, Map.of());
  }

  /**
   * Evicts now and again once the surrounding transaction commits, so a concurrent resolve cannot
   * re-cache the pre-change row.
   */
  private void evict(String key) {
    activeTemplates.invalidate(key);
    if (TransactionSynchronizationManager.isSynchronizationActive()) {
      TransactionSynchronizationManager.registerSynchronization(
          new TransactionSynchronization() {
            @Override
            public void afterCommit() {
              activeTemplates.invalidate(key);
            }
          });
    }
  }

  private static String orDefault(String value, String fallback) {
    return value != null && !value.isBlank() ? value : fallback;
  }
}
