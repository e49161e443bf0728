package de.htwsaar.miniota.server;

import de.htwsaar.miniota.common.logging.LoggingConfig;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.annotation.Import;

@SpringBootApplication
@Import(LoggingConfig.class)
public class OtaServerApp {
    public static void main(String[] args) {
        new SpringApplicationBuilder(OtaServerApp.class)
                .web(WebApplicationType.NONE)
                .run(args);
    }
}
