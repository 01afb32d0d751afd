package com.example.burger.infrastructure.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Orders placed by the demo runner at startup.
 *
 * <pre>
 * burger:
 *   demo:
 *     enabled: true
 *     orders:
 *       - customer: Ethan
 *         store: cheese
 *         type: CHEESE
 * </pre>
 *
 * {@code enabled} is the bound form of the flag that {@code BurgerDemoRunner} is
 * conditional on; when it is {@code false} the runner bean is not registered at all.
 */
@Validated
@ConfigurationProperties(prefix = "burger.demo")
public record BurgerDemoProperties(
        @DefaultValue("true")
        boolean enabled,

        @NotNull
        @Valid
        @DefaultValue
        List<DemoOrder> orders
) {
    public record DemoOrder(
            @NotBlank(message = "Customer is required")
            String customer,

            @NotBlank(message = "Store is required")
            String store,

            @NotBlank(message = "Burger type is required")
            String type
    ) {}
}
