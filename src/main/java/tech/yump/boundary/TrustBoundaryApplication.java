package tech.yump.boundary;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import tech.yump.boundary.config.BoundaryProperties;

@SpringBootApplication
@EnableConfigurationProperties(BoundaryProperties.class)
public class TrustBoundaryApplication {

    public static void main(String[] args) {
        SpringApplication.run(TrustBoundaryApplication.class, args);
    }
}
