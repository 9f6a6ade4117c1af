package tech.yump.boundary.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tech.yump.boundary.tenant.TenantContextExtractor;

@Configuration
public class OpenApiConfig {

    private static final String BEARER_SCHEME_NAME = "BearerJwt";
    private static final String GATEWAY_SCHEME_NAME = "GatewayTenant";

    @Bean
    public OpenAPI customOpenAPI() {
        SecurityScheme bearerScheme = new SecurityScheme()
                .type(SecurityScheme.Type.HTTP)
                .scheme("bearer")
                .bearerFormat("JWT")
                .description("HS256 token; its 'tenant_id' claim is one of the tenant sources.");

        SecurityScheme gatewayScheme = new SecurityScheme()
                .name(TenantContextExtractor.DEFAULT_GATEWAY_HEADER)
                .type(SecurityScheme.Type.APIKEY)
                .in(SecurityScheme.In.HEADER)
                .description("Tenant id asserted by the API gateway. Takes priority over every other tenant source.");

        return new OpenAPI()
                .info(new Info().title("Trust Boundary").version("v1"))
                .components(new Components()
                        .addSecuritySchemes(BEARER_SCHEME_NAME, bearerScheme)
                        .addSecuritySchemes(GATEWAY_SCHEME_NAME, gatewayScheme))
                .addSecurityItem(new SecurityRequirement().addList(BEARER_SCHEME_NAME))
                .addSecurityItem(new SecurityRequirement().addList(GATEWAY_SCHEME_NAME));
    }
}
