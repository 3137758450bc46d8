package com.openforge.kairn;

import com.openforge.kairn.experience.ExperienceProperties;
import com.openforge.kairn.graph.GraphProperties;
import com.openforge.kairn.intelligence.WorkspaceProperties;
import com.openforge.kairn.router.RouterProperties;
import com.openforge.kairn.store.StoreProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        StoreProperties.class,
        GraphProperties.class,
        ExperienceProperties.class,
        RouterProperties.class,
        WorkspaceProperties.class
})
public class KairnApplication {

    public static void main(String[] args) {
        SpringApplication.run(KairnApplication.class, args);
    }
}
