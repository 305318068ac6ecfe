package com.eventledger.controller;

import com.eventledger.dto.TagListResponse;
import com.eventledger.dto.TagResponse;
import com.eventledger.service.TagService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/tags")
public class TagController {
  private final TagService tagService;

  public TagController(TagService tagService) {
    this.tagService = tagService;
  }

  /** Every tag ever attached to an event, ordered by name. */
  @GetMapping
  public TagListResponse list() {
    return new TagListResponse(tagService.list().stream()
        .map(tag -> new TagResponse(tag.getId(), tag.getName()))
        .toList());
  }
}
