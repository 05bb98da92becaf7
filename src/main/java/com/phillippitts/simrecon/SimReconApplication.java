package com.phillippitts.simrecon;

import com.phillippitts.simrecon.config.dataset.DatasetProperties;
import com.phillippitts.simrecon.config.engine.EngineProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        EngineProperties.class,
        DatasetProperties.class
})
public class SimReconApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(SimReconApplication.class, args)));
    }

}
