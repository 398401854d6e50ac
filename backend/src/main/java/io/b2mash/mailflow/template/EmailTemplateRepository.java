package io.b2mash.mailflow.template;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface EmailTemplateRepository extends JpaRepository<EmailTemplate, UUID> {

  Optional<EmailTemplate> findByTemplateKey(String templateKey);

  Optional<EmailTemplate> findByTemplateKeyAndActiveTrue(String templateKey);

  boolean existsByTemplateKey(String templateKey);

  List<EmailTemplate> findAllByOrderByCategoryAscNameAsc();

  List<EmailTemplate> findByActiveTrueOrderByCategoryAscNameAsc();

  List<EmailTemplate> findByCategoryOrderByNameAsc(String category);

  List<EmailTemplate> findByCategoryAndActiveTrueOrderByNameAsc(String category);
}
