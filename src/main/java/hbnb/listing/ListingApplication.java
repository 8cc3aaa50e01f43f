package hbnb.listing;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ListingApplication {

    public static void main(String[] args) {
        SpringApplication.run(ListingApplication.class, args);
    }
}
