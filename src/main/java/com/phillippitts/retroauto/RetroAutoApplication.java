package com.phillippitts.retroauto;

import com.phillippitts.retroauto.config.properties.EngineProperties;
import com.phillippitts.retroauto.config.properties.HotkeyProperties;
import com.phillippitts.retroauto.config.properties.InputProperties;
import com.phillippitts.retroauto.config.properties.SupervisorProperties;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        EngineProperties.class,
        SupervisorProperties.class,
        HotkeyProperties.class,
        InputProperties.class
})
@EnableScheduling
public class RetroAutoApplication {

    public static void main(String[] args) {
        // java.awt.Robot needs a non-headless AWT toolkit
        new SpringApplicationBuilder(RetroAutoApplication.class)
                .headless(false)
                .run(args);
    }

}
