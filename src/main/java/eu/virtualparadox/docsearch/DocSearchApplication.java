package eu.virtualparadox.docsearch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DocSearchApplication {

    public static void main(final String[] args) {
        SpringApplication.run(DocSearchApplication.class, args);
    }
}
