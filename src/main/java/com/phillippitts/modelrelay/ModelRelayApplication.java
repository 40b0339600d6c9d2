package com.phillippitts.modelrelay;

import com.phillippitts.modelrelay.config.properties.OrchestratorProperties;
import com.phillippitts.modelrelay.config.properties.ProviderProperties;
import com.phillippitts.modelrelay.config.properties.ResponseCacheProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

// The cache opens its own SQLite data source; no application-wide DataSource is configured.
@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
@EnableConfigurationProperties({
        OrchestratorProperties.class,
        ResponseCacheProperties.class,
        ProviderProperties.class
})
@EnableScheduling
public class ModelRelayApplication {

    public static void main(String[] args) {
        SpringApplication.run(ModelRelayApplication.class, args);
    }

}
