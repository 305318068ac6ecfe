package com.eventledger.service;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class CategoryServiceTest {

  @Test
  void slugFoldsAccentsAndPunctuation() {
    assertThat(CategoryService.slug("Dining")).isEqualTo("dining");
    assertThat(CategoryService.slug("  Café & Bars! ")).isEqualTo("cafe-bars");
    assertThat(CategoryService.slug("Rent / Utilities 2024")).isEqualTo("rent-utilities-2024");
    assertThat(CategoryService.slug("!!!")).isEmpty();
  }
}
