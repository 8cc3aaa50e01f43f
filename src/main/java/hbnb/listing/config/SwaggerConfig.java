package hbnb.listing.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.Components;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Swagger/OpenAPI Configuration
 * Documents the caller identity header as an API key scheme
 */
@Configuration
public class SwaggerConfig {

    private static final String IDENTITY_SCHEME = "callerIdentity";

    @Value("${server.port:8080}")
    private String serverPort;

    @Bean
    public OpenAPI openAPI(ListingProperties properties) {
        return new OpenAPI()
                .info(apiInfo())
                .servers(apiServers())
                .components(new Components().addSecuritySchemes(IDENTITY_SCHEME, new SecurityScheme()
                        .type(SecurityScheme.Type.APIKEY)
                        .in(SecurityScheme.In.HEADER)
                        .name(properties.getIdentityHeader())
                        .description("Verified user id forwarded by the gateway")))
                .addSecurityItem(new SecurityRequirement().addList(IDENTITY_SCHEME));
    }

    private Info apiInfo() {
        return new Info()
                .title("Rental Listing API")
                .description("Users, places, amenities and reviews of a short-term rental listing service. " +
                             "All data lives in process memory and is cleared on restart.")
                .version("1.0.0");
    }

    private List<Server> apiServers() {
        Server localServer = new Server()
                .url("http://localhost:" + serverPort)
                .description("Local Development Server");

        return List.of(localServer);
    }
}
