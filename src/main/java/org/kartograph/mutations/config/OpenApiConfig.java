package org.kartograph.mutations.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * OpenAPI/Swagger configuration for the graph mutation API.
 */
@Configuration
public class OpenApiConfig {

  /**
   * Configures the OpenAPI specification.
   *
   * @return the configured OpenAPI instance
   */
  @Bean
  public OpenAPI customOpenApi() {
    return new OpenAPI()
        .info(new Info()
            .title("Kartograph Graph Mutation API")
            .description("""
                **Line-oriented mutations for a labeled property graph**

                A mutation batch is a JSONL document: one operation per line \
                (DEFINE, CREATE, UPDATE or DELETE). Blank lines and lines starting \
                with `//` or `#` are ignored.

                ## Key Features

                - **Atomic batches**: a batch commits in full or not at all
                - **Idempotent CREATE**: re-applying a batch merges properties into \
                existing entities
                - **Live feedback**: parse sessions return errors, warnings and an \
                operation breakdown while a batch is being edited
                - **Schema registry**: DEFINE operations publish type definitions

                ## Error Handling

                Request errors follow RFC 7807 Problem Details format \
                (`application/problem+json`). Batch outcomes are always returned as a \
                mutation result with `success`, `operations_applied` and `errors`.
                """)
            .version("0.1.0")
            .license(new License()
                .name("Apache 2.0")
                .url("https://www.apache.org/licenses/LICENSE-2.0.html")))
        .addServersItem(new Server()
            .url("http://localhost:8080")
            .description("Development server"));
  }
}
