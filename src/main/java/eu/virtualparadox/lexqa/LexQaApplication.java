package eu.virtualparadox.lexqa;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LexQaApplication {

    public static void main(final String[] args) {
        SpringApplication.run(LexQaApplication.class, args);
    }
}
