package teranet.mapdev.forge.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI document for the source and transform endpoints.
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI transformForgeOpenAPI(@Value("${server.port:8081}") int port) {
        Server localServer = new Server()
                .url("http://localhost:" + port)
                .description("Local Development Server");

        Info info = new Info()
                .title("Transform Forge API")
                .version("1.0.0")
                .description("Previews sampled CSV sources through joins, filters, computed columns and "
                        + "projection, and validates transform configurations before they are run")
                .license(new License()
                        .name("MIT License")
                        .url("https://opensource.org/licenses/MIT"));

        return new OpenAPI()
                .info(info)
                .servers(List.of(localServer))
                .tags(List.of(
                        new Tag().name("Sources").description("Dataset upload and schema inspection"),
                        new Tag().name("Transform").description("Transform validation, join health and preview")));
    }
}
