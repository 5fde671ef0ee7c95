package org.docstore;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class DocStoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(DocStoreApplication.class, args);
    }
}
