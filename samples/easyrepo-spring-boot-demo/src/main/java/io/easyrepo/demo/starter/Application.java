package io.easyrepo.demo.starter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Spring Boot demo for the easyrepo starter.
 * <p>
 * Run with: mvn install -DskipTests && mvn -f samples/easyrepo-spring-boot-demo/pom.xml spring-boot:run
 */
@SpringBootApplication
public class Application {

    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }
}
