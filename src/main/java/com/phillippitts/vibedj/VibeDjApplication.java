package com.phillippitts.vibedj;

import com.phillippitts.vibedj.config.properties.CatalogProperties;
import com.phillippitts.vibedj.config.properties.CooldownProperties;
import com.phillippitts.vibedj.config.properties.CoordinatorProperties;
import com.phillippitts.vibedj.config.properties.OracleProperties;
import com.phillippitts.vibedj.config.properties.VibeProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        CoordinatorProperties.class,
        VibeProperties.class,
        CatalogProperties.class,
        CooldownProperties.class,
        OracleProperties.class
})
public class VibeDjApplication {

    public static void main(String[] args) {
        SpringApplication.run(VibeDjApplication.class, args);
    }

}
