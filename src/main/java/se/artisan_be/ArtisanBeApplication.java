package se.artisan_be;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ArtisanBeApplication {

    public static void main(String[] args) {
        SpringApplication.run(ArtisanBeApplication.class, args);
    }

}
