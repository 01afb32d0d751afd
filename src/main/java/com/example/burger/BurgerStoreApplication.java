package com.example.burger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Burger Store demo.
 */
@SpringBootApplication
public class BurgerStoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(BurgerStoreApplication.class, args);
    }
}
