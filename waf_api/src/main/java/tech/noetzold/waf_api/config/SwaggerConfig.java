package tech.noetzold.waf_api.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class SwaggerConfig {

    @Bean
    public OpenAPI customOpenAPI(@Value("${server.port:8080}") int port) {
        return new OpenAPI()
                .info(new Info()
                        .title("Adaptive WAF API")
                        .version("1.0.0")
                        .description("Request classification and the Scout, Red-Team and Adapt defense cycle")
                        .contact(new Contact()
                                .name("Noetzold Tech")
                                .email("contato@noetzold.tech")
                                .url("https://noetzold.tech"))
                        .license(new License()
                                .name("Apache 2.0")
                                .url("https://www.apache.org/licenses/LICENSE-2.0.html")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + port)
                                .description("Local")))
                .tags(List.of(
                        new Tag().name("Classification").description("Verdicts for raw HTTP requests"),
                        new Tag().name("Agents").description("Manual Scout, Red-Team and cycle triggers"),
                        new Tag().name("Dashboard").description("Stats, threats, rules and activity")));
    }
}
