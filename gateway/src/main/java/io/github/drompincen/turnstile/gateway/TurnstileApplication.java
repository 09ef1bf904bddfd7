package io.github.drompincen.turnstile.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.data.mongo.MongoDataAutoConfiguration;
import org.springframework.boot.autoconfigure.mongo.MongoAutoConfiguration;

/** The persistence context opens its own Mongo connection from the configured locator. */
@SpringBootApplication(
        scanBasePackages = "io.github.drompincen.turnstile",
        exclude = {
                MongoAutoConfiguration.class,
                MongoDataAutoConfiguration.class
        }
)
public class TurnstileApplication {

    public static void main(String[] args) {
        SpringApplication.run(TurnstileApplication.class, args);
    }
}
