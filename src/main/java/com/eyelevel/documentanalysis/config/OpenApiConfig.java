package com.eyelevel.documentanalysis.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

import java.util.Optional;

@Configuration
@Profile("!prod")
@RequiredArgsConstructor
public class OpenApiConfig {

    private final Optional<BuildProperties> buildProperties;

    @Bean
    public OpenAPI customOpenAPI() {
        String version = buildProperties.map(BuildProperties::getVersion).orElse("<NOT_FOUND>");
        String appName = buildProperties.map(BuildProperties::getName).orElse("Document Analysis API");

        return new OpenAPI()
                .info(new Info().title(appName)
                        .version(version)
                        .description("""
                                Runs uploaded documents through text extraction and model-based analysis.
                                
                                * **Extraction:** a fast OCR attempt, with an asynchronous vision-model fallback \
                                for scanned or unsupported documents.
                                * **Analysis:** the extracted text is analyzed with the prompt of the chosen model \
                                variant (A: counter-guarantees, B: social reports).
                                * **Status and history:** each run can be polled until it settles, and a user's \
                                recent runs can be listed newest first.
                                
                                Endpoints answer 202 while work continues in the background; poll the status \
                                endpoint until the run is COMPLETED or FAILED.
                                """)
                        .contact(new Contact()
                                .name("EyeLevel.ai Support")
                                .url("https://www.eyelevel.ai")));
    }
}
