package com.registration;

import com.registration.cli.RegistrationCommand;
import org.springframework.boot.Banner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

@SpringBootApplication
public class RegistrationApplication {

    public static void main(String[] args) {
        if (!RegistrationCommand.isCommand(args)) {
            SpringApplication.run(RegistrationApplication.class, args);
            return;
        }

        // Chế độ dòng lệnh: không bật web server
        SpringApplication app = new SpringApplication(RegistrationApplication.class);
        app.setWebApplicationType(WebApplicationType.NONE);
        app.setBannerMode(Banner.Mode.OFF);
        ConfigurableApplicationContext context = app.run(args);
        int exitCode = context.getBean(RegistrationCommand.class).execute(args);
        System.exit(SpringApplication.exit(context, () -> exitCode));
    }
}
