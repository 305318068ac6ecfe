package com.eventledger.service;

import com.eventledger.exception.CategoryInUseException;
import com.eventledger.exception.NotFoundException;
import com.eventledger.exception.ValidationException;
import com.eventledger.model.Category;
import com.eventledger.repository.CategoryRepository;
import com.eventledger.repository.EventRepository;
import com.eventledger.repository.HintRepository;
import java.text.Normalizer;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

@Service
public class CategoryService {
  private static final Logger log = LoggerFactory.getLogger(CategoryService.class);

  private final CategoryRepository repository;
  private final EventRepository eventRepository;
  private final HintRepository hintRepository;

  public CategoryService(CategoryRepository repository,
                         EventRepository eventRepository,
                         HintRepository hintRepository) {
    this.repository = repository;
    this.eventRepository = eventRepository;
    this.hintRepository = hintRepository;
  }

  public List<Category> list() {
    return repository.findAllByOrderByNameAsc();
  }

  public boolean exists(String id) {
    return id != null && repository.existsById(id);
  }

  public Category create(String id, String name) {
    if (name == null || name.isBlank()) {
      throw new ValidationException("name is required");
    }
    String trimmed = name.trim();
    String categoryId = id == null || id.isBlank() ? slug(trimmed) : id.trim();
    if (categoryId.isEmpty()) {
      throw new ValidationException("Category name must contain letters or digits");
    }
    if (repository.existsById(categoryId) || repository.existsByNameIgnoreCase(trimmed)) {
      throw new ResponseStatusException(HttpStatus.CONFLICT, "Category already exists: " + trimmed);
    }
    Category category = new Category();
    category.setId(categoryId);
    category.setName(trimmed);
    Category saved = repository.save(category);
    log.info("Created category {}", categoryId);
    return saved;
  }

  public Category get(String id) {
    return repository.findById(id)
        .orElseThrow(() -> new NotFoundException("Category not found: " + id));
  }

  /** Renames the category; its id, and so every reference to it, stays the same. */
  public Category update(String id, String name) {
    Category category = get(id);
    if (name == null || name.isBlank()) {
      throw new ValidationException("Category name cannot be empty");
    }
    String trimmed = name.trim();
    if (repository.existsByNameIgnoreCaseAndIdNot(trimmed, id)) {
      throw new ResponseStatusException(HttpStatus.CONFLICT, "Category already exists: " + trimmed);
    }
    category.setName(trimmed);
    Category saved = repository.save(category);
    log.info("Renamed category {} to '{}'", id, trimmed);
    return saved;
  }

  /** Deletes an unused category. Events and hint prefills that name it block the delete. */
  public void delete(String id) {
    Category category = get(id);
    if (eventRepository.existsByCategoryId(id) || hintRepository.existsByPrefillCategoryId(id)) {
      log.warn("Refusing to delete category {}: in use", id);
      throw new CategoryInUseException(id);
    }
    repository.delete(category);
    log.info("Deleted category {}", id);
  }

  static String slug(String name) {
    String ascii = Normalizer.normalize(name, Normalizer.Form.NFD).replaceAll("\\p{M}", "");
    return ascii.toLowerCase(Locale.ROOT)
        .replaceAll("[^a-z0-9]+", "-")
        .replaceAll("(^-+)|(-+$)", "");
  }
}
