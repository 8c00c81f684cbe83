package com.linelist.cleaner.config;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import io.swagger.v3.oas.models.OpenAPI;

class OpenApiConfigTest {

  @Test
  void shouldDescribeApiFromProperties() {
    OpenApiConfig config = new OpenApiConfig();
    ReflectionTestUtils.setField(config, "title", "Linelist Spelling Cleaner API");
    ReflectionTestUtils.setField(config, "version", "1.0.0");
    ReflectionTestUtils.setField(config, "description", "Wordlist recoding");
    ReflectionTestUtils.setField(config, "licenseName", "Apache 2.0");
    ReflectionTestUtils.setField(
        config, "licenseUrl", "https://www.apache.org/licenses/LICENSE-2.0");
    ReflectionTestUtils.setField(config, "serverPort", "8081");

    OpenAPI openApi = config.customOpenAPI();

    assertThat(openApi.getInfo().getTitle()).isEqualTo("Linelist Spelling Cleaner API");
    assertThat(openApi.getInfo().getLicense().getName()).isEqualTo("Apache 2.0");
    assertThat(openApi.getServers()).hasSize(1);
    assertThat(openApi.getServers().get(0).getUrl()).isEqualTo("http://localhost:8081");
  }
}
