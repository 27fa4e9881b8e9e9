package uk.gegc.qaloader;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class QaLoaderApplication {

    public static void main(String[] args) {
        SpringApplication.run(QaLoaderApplication.class, args);
    }
}
