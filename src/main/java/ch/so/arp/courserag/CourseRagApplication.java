package ch.so.arp.courserag;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CourseRagApplication {

    public static void main(String[] args) {
        SpringApplication.run(CourseRagApplication.class, args);
    }
}
