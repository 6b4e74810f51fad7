package com.techStack.courseHub.config;

import com.techStack.courseHub.config.security.AccessControlProperties;
import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenAPIConfiguration {

    private static final String TOKEN_COOKIE_SCHEME = "tokenCookie";

    /**
     * Documents the session cookie under the name the login endpoint actually sets
     */
    @Bean
    public OpenAPI defineOpenApi(AccessControlProperties accessControlProperties) {
        Server server = new Server();
        server.setUrl("http://localhost:8080");
        server.setDescription("Development");

        Info info = new Info()
                .title("Course Hub API")
                .version("1.0")
                .description("Faculties, programs, courses, branches, user profiles and timetable events");

        SecurityScheme cookieScheme = new SecurityScheme()
                .type(SecurityScheme.Type.APIKEY)
                .in(SecurityScheme.In.COOKIE)
                .name(accessControlProperties.getCookieName());

        return new OpenAPI()
                .info(info)
                .servers(List.of(server))
                .components(new Components().addSecuritySchemes(TOKEN_COOKIE_SCHEME, cookieScheme))
                .addSecurityItem(new SecurityRequirement().addList(TOKEN_COOKIE_SCHEME));
    }
}
