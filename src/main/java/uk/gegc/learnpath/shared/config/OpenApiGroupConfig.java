package uk.gegc.learnpath.shared.config;

import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiGroupConfig {

    @Bean
    public GroupedOpenApi contentGroup() {
        return GroupedOpenApi.builder()
                .group("content")
                .displayName("Learning Content")
                .pathsToMatch("/api/v1/content/**")
                .build();
    }

    @Bean
    public GroupedOpenApi learningGroup() {
        return GroupedOpenApi.builder()
                .group("learning")
                .displayName("Challenges, Progress & XP")
                .pathsToMatch("/api/v1/challenges/**", "/api/v1/progress/**")
                .build();
    }

    @Bean
    public GroupedOpenApi certificatesGroup() {
        return GroupedOpenApi.builder()
                .group("certificates")
                .displayName("Certificates")
                .pathsToMatch("/api/v1/certificates/**")
                .build();
    }

    @Bean
    public GroupedOpenApi authoringGroup() {
        return GroupedOpenApi.builder()
                .group("authoring")
                .displayName("AI Authoring Assistant")
                .pathsToMatch("/api/v1/ai/**")
                .build();
    }

    @Bean
    public GroupedOpenApi adminGroup() {
        return GroupedOpenApi.builder()
                .group("admin")
                .displayName("Analytics & Administration")
                .pathsToMatch("/api/v1/analytics/**", "/api/v1/admin/**")
                .build();
    }
}
