package com.eventledger.controller;

import com.eventledger.dto.CategoryRequest;
import com.eventledger.dto.CategoryResponse;
import com.eventledger.model.Category;
import com.eventledger.service.CategoryService;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/categories")
public class CategoryController {
  private final CategoryService categoryService;

  public CategoryController(CategoryService categoryService) {
    this.categoryService = categoryService;
  }

  @GetMapping
  public List<CategoryResponse> list() {
    return categoryService.list().stream().map(CategoryController::toResponse).toList();
  }

  @PostMapping
  @ResponseStatus(HttpStatus.CREATED)
  public CategoryResponse create(@Valid @RequestBody CategoryRequest request) {
    return toResponse(categoryService.create(request.getId(), request.getName()));
  }

  @GetMapping("/{categoryId}")
  public CategoryResponse get(@PathVariable String categoryId) {
    return toResponse(categoryService.get(categoryId));
  }

  @PutMapping("/{categoryId}")
  public CategoryResponse update(@PathVariable String categoryId, @Valid @RequestBody CategoryRequest request) {
    return toResponse(categoryService.update(categoryId, request.getName()));
  }

  @DeleteMapping("/{categoryId}")
  @ResponseStatus(HttpStatus.NO_CONTENT)
  public void delete(@PathVariable String categoryId) {
    categoryService.delete(categoryId);
  }

  private static CategoryResponse toResponse(Category category) {
    return new CategoryResponse(category.getId(), category.getName());
  }
}
