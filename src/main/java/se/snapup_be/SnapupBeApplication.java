package se.snapup_be;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class SnapupBeApplication {

    public static void main(String[] args) {
        SpringApplication.run(SnapupBeApplication.class, args);
    }

}
