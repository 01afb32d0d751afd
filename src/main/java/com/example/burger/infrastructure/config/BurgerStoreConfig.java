package com.example.burger.infrastructure.config;

import com.example.burger.domain.store.BurgerStore;
import com.example.burger.domain.store.CheeseBurgerStore;
import com.example.burger.domain.store.VeganBurgerStore;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the burger stores.
 * Adding a store means adding a bean here; ordering code stays untouched.
 */
@Configuration
@EnableConfigurationProperties(BurgerDemoProperties.class)
public class BurgerStoreConfig {

    @Bean
    public BurgerStore cheeseBurgerStore() {
        return new CheeseBurgerStore();
    }

    @Bean
    public BurgerStore veganBurgerStore() {
        return new VeganBurgerStore();
    }
}
