package com.federation.infrastructure.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.media.StringSchema;
import io.swagger.v3.oas.models.parameters.HeaderParameter;
import org.springdoc.core.customizers.OperationCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI customOpenAPI(AppProperties appProperties) {
        return new OpenAPI()
                .info(new Info()
                        .title("Federation API")
                        .version("1.0")
                        .description("Follow graph, local content and federation index of site "
                                + appProperties.getNode().getAddress()));
    }

    /**
     * Documents the acting-identity header on every operation, prefilled with this node's own key.
     */
    @Bean
    public OperationCustomizer addSiteKeyHeader(AppProperties appProperties) {
        return (operation, handlerMethod) -> {
            String ownKey = appProperties.getNode().getPublicKey();
            StringSchema schema = new StringSchema();
            schema.setDefault(ownKey);
            schema.setExample(ownKey);
            operation.addParametersItem(new HeaderParameter()
                    .name("X-Site-Key")
                    .description("Acting identity; required on mutating calls")
                    .required(false)
                    .schema(schema));
            return operation;
        };
    }
}
