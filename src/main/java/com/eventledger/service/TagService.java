package com.eventledger.service;

import com.eventledger.exception.ValidationException;
import com.eventledger.model.Tag;
import com.eventledger.repository.TagRepository;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class TagService {
  private static final Logger log = LoggerFactory.getLogger(TagService.class);
  static final int MAX_NAME_LENGTH = 100;

  private final TagRepository repository;

  public TagService(TagRepository repository) {
    this.repository = repository;
  }

  public List<Tag> list() {
    return repository.findAllByOrderByNameAsc();
  }

  /** Trimmed, de-duplicated tag names in first-seen order; blanks are dropped. */
  public static Set<String> normalize(Collection<String> names) {
    Set<String> normalized = new LinkedHashSet<>();
    if (names == null) {
      return normalized;
    }
    for (String name : names) {
      if (name != null && !name.isBlank()) {
        normalized.add(name.trim());
      }
    }
    return normalized;
  }

  /**
   * Loads the named tags, creating the ones that do not exist yet. Runs inside the caller's
   * transaction, so a failed event creation leaves no new tags behind.
   */
  public Set<Tag> resolve(Collection<String> names) {
    Set<Tag> tags = new LinkedHashSet<>();
    for (String name : normalize(names)) {
      if (name.length() > MAX_NAME_LENGTH) {
        throw new ValidationException("Tag too long (max " + MAX_NAME_LENGTH + " characters): " + name);
      }
      tags.add(repository.findByName(name).orElseGet(() -> create(name)));
    }
    return tags;
  }

  private Tag create(String name) {
    Tag tag = new Tag();
    tag.setName(name);
    Tag saved = repository.save(tag);
    log.info("Created tag '{}'", name);
    return saved;
  }
}
