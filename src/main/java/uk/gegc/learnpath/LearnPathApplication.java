package uk.gegc.learnpath;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LearnPathApplication {

    public static void main(String[] args) {
        SpringApplication.run(LearnPathApplication.class, args);
    }
}
